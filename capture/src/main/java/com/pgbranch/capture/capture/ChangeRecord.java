package com.pgbranch.capture.capture;

import com.pgbranch.capture.catalog.RelationId;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * One captured row mutation, as read back from {@code pgbranch.change_log}.
 *
 * {@code key} holds the primary key of the new row (old row for deletes). For updates {@code columns}
 * holds only the columns whose value changed, primary key columns included; for deletes it is empty.
 */
@Getter
@Builder
@ToString
public class ChangeRecord {

    private final long id;

    /** Relation as resolved on the source database; null once the relation has been dropped there. */
    private final RelationId relation;

    /** Schema and table name as the capture trigger saw them; null for records logged without them. */
    private final RelationId loggedRelation;

    private final long relationOid;

    /** Engine's text form of the relation, kept for messages when {@link #relation} is null. */
    private final String relationText;

    private final ChangeOperation operation;
    private final Map<String, String> key;
    private final Map<String, ColumnValue> columns;
    private final String transactionId;
    private final Instant timestamp;

    public String relationName() {
        return target().map(RelationId::toString).orElse(relationText);
    }

    /** The relation to apply this record to: the current source name, else the name logged at capture. */
    public Optional<RelationId> target() {
        return Optional.ofNullable(relation != null ? relation : loggedRelation);
    }
}
