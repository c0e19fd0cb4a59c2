package com.pgbranch.branch.storage;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/** A database as the engine lists it in {@code pg_database}. */
@Getter
@AllArgsConstructor
@ToString
public class ServerDatabase {

    private final long oid;
    private final String name;
}
