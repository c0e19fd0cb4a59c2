package com.pgbranch.branch.service;

import com.pgbranch.branch.domain.TrackedDatabase;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/** A database on the server, with its tracking row when the service knows it. */
@Getter
@Builder
@ToString
public class DatabaseListing {

    private final long oid;
    private final String name;
    private final TrackedDatabase tracking;

    public Optional<TrackedDatabase> tracked() {
        return Optional.ofNullable(tracking);
    }
}
