package com.pgbranch.capture.replay;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/** A DML statement with text parameters, each bound to a {@code CAST(? AS type)} placeholder. */
@Getter
@ToString
@AllArgsConstructor
public class ReplayStatement {

    private final String sql;
    private final List<String> parameters;
}
