package com.pgbranch.capture.replay;

import com.pgbranch.capture.capture.ChangeOperation;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class ReplayResult {

    private final long recordId;
    private final String relation;
    private final ChangeOperation operation;

    /** False when the record needed no statement (an update with nothing left to set). */
    private final boolean applied;

    private final int rowsAffected;
    private final String sql;
}
