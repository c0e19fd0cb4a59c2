package com.pgbranch.capture.audit;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Optional;

/**
 * One audited schema change, as read back from {@code pgbranch.ddl_log}.
 * Start and end records are independent rows; nothing links them except transaction id and order.
 */
@Getter
@Builder
@ToString
public class DdlRecord {

    private final long id;
    private final Instant timestamp;
    private final String username;
    private final String database;
    private final String transactionId;
    private final String commandTag;
    private final String objectType;
    private final String schemaName;
    private final String objectIdentity;
    private final DdlPhase phase;
    private final String sqlText;
    private final String preDefinition;
    private final String postDefinition;

    public AuditCoverage coverage() {
        return AuditCoverage.classify(commandTag, objectType);
    }

    public Optional<AuditGap> gap() {
        return AuditGap.detect(this);
    }
}
