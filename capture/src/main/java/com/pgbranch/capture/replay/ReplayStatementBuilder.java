package com.pgbranch.capture.replay;

import com.pgbranch.capture.capture.ChangeRecord;
import com.pgbranch.capture.capture.ColumnValue;
import com.pgbranch.capture.catalog.ColumnDescriptor;
import com.pgbranch.capture.catalog.RelationDescriptor;
import com.pgbranch.capture.catalog.RelationId;
import com.pgbranch.capture.exception.ReplayMismatchException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the DML equivalent of a change record against a target relation's current shape.
 *
 * Pure: the output depends only on the record and the descriptor. Column values are cast to the type
 * recorded on the source; key values are cast to the target column's type, since the key is matched
 * against what the target holds now.
 */
@Component
public class ReplayStatementBuilder {

    public Optional<ReplayStatement> build(ChangeRecord record, RelationDescriptor target) {
        return switch (record.getOperation()) {
            case INSERT -> Optional.of(insert(record, target));
            case UPDATE -> update(record, target);
            case DELETE -> Optional.of(delete(record, target));
        };
    }

    // ─── Statements ───────────────────────────────────────────────────────────

    private ReplayStatement insert(ChangeRecord record, RelationDescriptor target) {
        List<String> names = new ArrayList<>();
        List<String> values = new ArrayList<>();
        List<String> params = new ArrayList<>();
        boolean overriding = false;

        for (Map.Entry<ColumnDescriptor, ColumnValue> e : targetColumns(record, target)) {
            ColumnDescriptor column = e.getKey();
            if (column.isGenerated()) continue;
            overriding |= column.isIdentityAlways();
            names.add(RelationId.quote(column.getName()));
            values.add(e.getValue().getType().castSql("?"));
            params.add(e.getValue().getValue());
        }

        String relation = target.getId().qualified();
        if (names.isEmpty()) {
            return new ReplayStatement("INSERT INTO " + relation + " DEFAULT VALUES", List.of());
        }
        String sql = "INSERT INTO " + relation + " (" + String.join(", ", names) + ")"
                + (overriding ? " OVERRIDING SYSTEM VALUE" : "")
                + " VALUES (" + String.join(", ", values) + ")";
        return new ReplayStatement(sql, params);
    }

    private Optional<ReplayStatement> update(ChangeRecord record, RelationDescriptor target) {
        List<String> assignments = new ArrayList<>();
        List<String> params = new ArrayList<>();

        for (Map.Entry<ColumnDescriptor, ColumnValue> e : targetColumns(record, target)) {
            ColumnDescriptor column = e.getKey();
            if (column.isGenerated()) continue;
            assignments.add(RelationId.quote(column.getName()) + " = " + e.getValue().getType().castSql("?"));
            params.add(e.getValue().getValue());
        }
        if (assignments.isEmpty()) {
            return Optional.empty();
        }

        String where = whereClause(record, target, params);
        String sql = "UPDATE " + target.getId().qualified() + " SET " + String.join(", ", assignments)
                + " WHERE " + where;
        return Optional.of(new ReplayStatement(sql, params));
    }

    private ReplayStatement delete(ChangeRecord record, RelationDescriptor target) {
        List<String> params = new ArrayList<>();
        String where = whereClause(record, target, params);
        return new ReplayStatement("DELETE FROM " + target.getId().qualified() + " WHERE " + where, params);
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private List<Map.Entry<ColumnDescriptor, ColumnValue>> targetColumns(ChangeRecord record, RelationDescriptor target) {
        List<Map.Entry<ColumnDescriptor, ColumnValue>> resolved = new ArrayList<>();
        for (Map.Entry<String, ColumnValue> e : record.getColumns().entrySet()) {
            ColumnDescriptor column = target.column(e.getKey())
                    .orElseThrow(() -> new ReplayMismatchException(record.getId(), target.getId().toString(),
                            "Column " + e.getKey() + " not present on target"));
            resolved.add(Map.entry(column, e.getValue()));
        }
        resolved.sort(Comparator.comparingInt(e -> e.getKey().getAttnum()));
        return resolved;
    }

    private String whereClause(ChangeRecord record, RelationDescriptor target, List<String> params) {
        List<ColumnDescriptor> keyColumns = new ArrayList<>();
        for (String name : record.getKey().keySet()) {
            keyColumns.add(target.column(name)
                    .orElseThrow(() -> new ReplayMismatchException(record.getId(), target.getId().toString(),
                            "Key column " + name + " not present on target")));
        }
        keyColumns.sort(Comparator.comparingInt(ColumnDescriptor::getAttnum));

        List<String> predicates = new ArrayList<>();
        for (ColumnDescriptor column : keyColumns) {
            String value = record.getKey().get(column.getName());
            if (value == null) {
                predicates.add(RelationId.quote(column.getName()) + " IS NULL");
            } else {
                predicates.add(RelationId.quote(column.getName()) + " = " + column.getType().castSql("?"));
                params.add(value);
            }
        }
        return String.join(" AND ", predicates);
    }
}
