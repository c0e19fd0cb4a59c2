package com.pgbranch.branch.service;

import com.pgbranch.branch.domain.TrackedDatabase;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * One tracked database and everything cloned from it.
 * {@code currentName} follows renames done on the server; {@code null} once the database is gone.
 */
@Getter
@Builder
@ToString
public class LineageNode {

    private final TrackedDatabase database;
    private final String currentName;
    private final List<LineageNode> children;

    public String displayName() {
        return currentName != null ? currentName : database.getDatname();
    }
}
