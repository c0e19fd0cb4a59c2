package com.pgbranch.capture.diff;

import com.pgbranch.capture.catalog.CatalogInspector;
import com.pgbranch.capture.catalog.ColumnDescriptor;
import com.pgbranch.capture.catalog.IdentityMode;
import com.pgbranch.capture.catalog.Persistence;
import com.pgbranch.capture.catalog.RelationDescriptor;
import com.pgbranch.capture.catalog.RelationId;
import com.pgbranch.capture.catalog.RelationKind;
import com.pgbranch.capture.catalog.TypeDescriptor;
import com.pgbranch.capture.jdbc.DatabaseConnections;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Logical Diff
 *
 * Compares two databases of the managed server table by table and writes the statements that turn
 * the left one into the right one. Only ordinary tables are compared, and of their shape only columns
 * (type, default, nullability) and the primary key; other constraints, indexes, identity and generation
 * changes are left out. Rows are matched by primary key and compared as text, so tables whose key differs
 * between the sides get DDL only.
 *
 * Rows are held in memory while a table is compared.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LogicalDiff {

    private final DatabaseConnections connections;
    private final CatalogInspector inspector;

    public DatabaseDiff diff(String left, String right) {
        Map<RelationId, RelationDescriptor> leftTables = tables(left);
        Map<RelationId, RelationDescriptor> rightTables = tables(right);
        List<String> leftSchemas = new ArrayList<>(connections.jdbc(left).queryForList(
                "SELECT nspname FROM pg_namespace", String.class));

        List<String> ddl = new ArrayList<>();
        List<String> dml = new ArrayList<>();

        for (RelationDescriptor added : rightTables.values()) {
            if (leftTables.containsKey(added.getId())) {
                continue;
            }
            String schema = added.getId().getSchema();
            if (!leftSchemas.contains(schema)) {
                ddl.add("CREATE SCHEMA IF NOT EXISTS " + RelationId.quote(schema) + ";");
                leftSchemas.add(schema);
            }
            ddl.add(createTable(added));
            dml.addAll(insertAll(right, added));
        }

        for (RelationDescriptor current : leftTables.values()) {
            RelationDescriptor target = rightTables.get(current.getId());
            if (target != null) {
                ddl.addAll(alterTable(current, target));
                dml.addAll(rowChanges(left, right, current, target));
            }
        }

        for (RelationDescriptor removed : leftTables.values()) {
            if (!rightTables.containsKey(removed.getId())) {
                ddl.add("DROP TABLE " + removed.getId().qualified() + ";");
            }
        }

        log.info("Databases diffed: left={}, right={}, ddlStatements={}, dmlStatements={}",
                left, right, ddl.size(), dml.size());
        return new DatabaseDiff(left, right, ddl, dml);
    }

    private Map<RelationId, RelationDescriptor> tables(String database) {
        Map<RelationId, RelationDescriptor> tables = new LinkedHashMap<>();
        for (RelationId id : inspector.listCaptureCandidates(database)) {
            RelationDescriptor descriptor = inspector.describe(database, id.qualified());
            if (descriptor.getKind() == RelationKind.TABLE) {
                tables.put(id, descriptor);
            } else {
                log.warn("Partitioned table left out of diff: database={}, relation={}", database, id);
            }
        }
        return tables;
    }

    // ─── DDL ──────────────────────────────────────────────────────────────────

    static String createTable(RelationDescriptor table) {
        List<String> parts = table.getColumns().stream()
                .map(LogicalDiff::columnDefinition)
                .collect(Collectors.toCollection(ArrayList::new));
        if (table.hasPrimaryKey()) {
            parts.add("PRIMARY KEY (" + columnList(table.getPrimaryKey()) + ")");
        }
        String unlogged = table.getPersistence() == Persistence.UNLOGGED ? "UNLOGGED " : "";
        return "CREATE " + unlogged + "TABLE " + table.getId().qualified() + " (" + String.join(", ", parts) + ");";
    }

    static List<String> alterTable(RelationDescriptor current, RelationDescriptor target) {
        List<String> out = new ArrayList<>();
        String table = "ALTER TABLE " + target.getId().qualified();
        boolean keyChanged = !current.getPrimaryKey().equals(target.getPrimaryKey());

        // dropping a key column would take the constraint with it
        if (keyChanged && current.hasPrimaryKey()) {
            out.add(table + " DROP CONSTRAINT " + RelationId.quote(primaryKeyName(current)) + ";");
        }
        for (ColumnDescriptor column : target.getColumns()) {
            current.column(column.getName()).ifPresentOrElse(
                    existing -> out.addAll(alterColumn(table, existing, column)),
                    () -> out.add(table + " ADD COLUMN " + columnDefinition(column) + ";"));
        }
        for (ColumnDescriptor column : current.getColumns()) {
            if (target.column(column.getName()).isEmpty()) {
                out.add(table + " DROP COLUMN " + RelationId.quote(column.getName()) + ";");
            }
        }
        if (keyChanged && target.hasPrimaryKey()) {
            out.add(table + " ADD PRIMARY KEY (" + columnList(target.getPrimaryKey()) + ");");
        }
        return out;
    }

    private static List<String> alterColumn(String table, ColumnDescriptor current, ColumnDescriptor target) {
        List<String> out = new ArrayList<>();
        String name = RelationId.quote(target.getName());
        String column = table + " ALTER COLUMN " + name;

        if (!current.getType().equals(target.getType())) {
            out.add(column + " TYPE " + target.getType().getFormatted()
                    + " USING " + target.getType().castSql(name) + ";");
        }
        if (!current.isGenerated() && !target.isGenerated()
                && !Objects.equals(current.getDefaultExpression(), target.getDefaultExpression())) {
            out.add(target.getDefaultExpression() == null
                    ? column + " DROP DEFAULT;"
                    : column + " SET DEFAULT " + target.getDefaultExpression() + ";");
        }
        if (current.isNotNull() != target.isNotNull()) {
            out.add(column + (target.isNotNull() ? " SET NOT NULL;" : " DROP NOT NULL;"));
        }
        return out;
    }

    static String columnDefinition(ColumnDescriptor column) {
        StringBuilder sb = new StringBuilder(RelationId.quote(column.getName()))
                .append(' ').append(column.getType().getFormatted());
        if (column.getCollation() != null) {
            sb.append(" COLLATE ").append(RelationId.quote(column.getCollation()));
        }
        if (column.isGenerated()) {
            sb.append(" GENERATED ALWAYS AS (").append(column.getDefaultExpression()).append(") STORED");
        } else if (column.getIdentity() == IdentityMode.ALWAYS) {
            sb.append(" GENERATED ALWAYS AS IDENTITY");
        } else if (column.getIdentity() == IdentityMode.BY_DEFAULT) {
            sb.append(" GENERATED BY DEFAULT AS IDENTITY");
        } else if (column.getDefaultExpression() != null) {
            sb.append(" DEFAULT ").append(column.getDefaultExpression());
        }
        if (column.isNotNull()) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }

    private static String primaryKeyName(RelationDescriptor table) {
        return table.getConstraints().stream()
                .filter(c -> "p".equals(c.getType()))
                .map(c -> c.getName())
                .findFirst()
                .orElse(table.getId().getName() + "_pkey");
    }

    // ─── DML ──────────────────────────────────────────────────────────────────

    private List<String> insertAll(String database, RelationDescriptor table) {
        List<ColumnDescriptor> columns = table.getColumns().stream()
                .filter(c -> !c.isGenerated())
                .collect(Collectors.toList());
        if (columns.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (List<String> row : readRows(database, table.getId(), columns, table.getPrimaryKey())) {
            out.add(insert(table.getId(), columns, row));
        }
        return out;
    }

    private List<String> rowChanges(String left, String right, RelationDescriptor current, RelationDescriptor target) {
        if (!current.hasPrimaryKey() || !current.getPrimaryKey().equals(target.getPrimaryKey())) {
            log.debug("Rows not compared, primary keys differ: relation={}, left={}, right={}",
                    target.getId(), current.getPrimaryKey(), target.getPrimaryKey());
            return List.of();
        }
        List<ColumnDescriptor> common = target.getColumns().stream()
                .filter(c -> !c.isGenerated())
                .filter(c -> current.column(c.getName()).filter(existing -> !existing.isGenerated()).isPresent())
                .collect(Collectors.toList());
        List<String> commonNames = common.stream().map(ColumnDescriptor::getName).collect(Collectors.toList());
        if (!commonNames.containsAll(target.getPrimaryKey())) {
            return List.of();
        }
        int[] keyIndexes = target.getPrimaryKey().stream().mapToInt(commonNames::indexOf).toArray();

        Map<List<String>, List<String>> leftRows =
                keyed(readRows(left, current.getId(), common, current.getPrimaryKey()), keyIndexes);
        Map<List<String>, List<String>> rightRows =
                keyed(readRows(right, target.getId(), common, target.getPrimaryKey()), keyIndexes);

        List<String> out = new ArrayList<>();
        for (Map.Entry<List<String>, List<String>> row : leftRows.entrySet()) {
            if (!rightRows.containsKey(row.getKey())) {
                out.add("DELETE FROM " + target.getId().qualified()
                        + " WHERE " + keyCondition(common, keyIndexes, row.getValue()) + ";");
            }
        }
        for (Map.Entry<List<String>, List<String>> row : rightRows.entrySet()) {
            if (!leftRows.containsKey(row.getKey())) {
                out.add(insert(target.getId(), common, row.getValue()));
            }
        }
        for (Map.Entry<List<String>, List<String>> row : leftRows.entrySet()) {
            List<String> changed = rightRows.get(row.getKey());
            if (changed != null) {
                String update = update(target.getId(), common, keyIndexes, row.getValue(), changed);
                if (update != null) {
                    out.add(update);
                }
            }
        }
        return out;
    }

    private List<List<String>> readRows(String database, RelationId relation,
                                        List<ColumnDescriptor> columns, List<String> orderBy) {
        String sql = "SELECT " + columns.stream()
                .map(c -> RelationId.quote(c.getName()) + "::text")
                .collect(Collectors.joining(", "))
                + " FROM ONLY " + relation.qualified()
                + (orderBy.isEmpty() ? "" : " ORDER BY " + columnList(orderBy));
        return connections.jdbc(database).query(sql, (rs, i) -> {
            List<String> row = new ArrayList<>(columns.size());
            for (int c = 1; c <= columns.size(); c++) {
                row.add(rs.getString(c));
            }
            return row;
        });
    }

    private static Map<List<String>, List<String>> keyed(List<List<String>> rows, int[] keyIndexes) {
        Map<List<String>, List<String>> keyed = new LinkedHashMap<>();
        for (List<String> row : rows) {
            List<String> key = new ArrayList<>(keyIndexes.length);
            for (int index : keyIndexes) {
                key.add(row.get(index));
            }
            keyed.put(key, row);
        }
        return keyed;
    }

    static String insert(RelationId relation, List<ColumnDescriptor> columns, List<String> row) {
        List<String> values = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            values.add(literal(row.get(i), columns.get(i).getType()));
        }
        boolean overriding = columns.stream().anyMatch(ColumnDescriptor::isIdentityAlways);
        return "INSERT INTO " + relation.qualified()
                + " (" + columnList(columns.stream().map(ColumnDescriptor::getName).collect(Collectors.toList())) + ")"
                + (overriding ? " OVERRIDING SYSTEM VALUE" : "")
                + " VALUES (" + String.join(", ", values) + ");";
    }

    /** Null when no column outside the key changed; identity ALWAYS columns cannot be set. */
    static String update(RelationId relation, List<ColumnDescriptor> columns, int[] keyIndexes,
                         List<String> before, List<String> after) {
        List<Integer> keys = new ArrayList<>();
        for (int index : keyIndexes) {
            keys.add(index);
        }
        List<String> sets = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            ColumnDescriptor column = columns.get(i);
            if (keys.contains(i) || column.isIdentityAlways() || Objects.equals(before.get(i), after.get(i))) {
                continue;
            }
            sets.add(RelationId.quote(column.getName()) + " = " + literal(after.get(i), column.getType()));
        }
        if (sets.isEmpty()) {
            return null;
        }
        return "UPDATE " + relation.qualified() + " SET " + String.join(", ", sets)
                + " WHERE " + keyCondition(columns, keyIndexes, after) + ";";
    }

    private static String keyCondition(List<ColumnDescriptor> columns, int[] keyIndexes, List<String> row) {
        List<String> terms = new ArrayList<>(keyIndexes.length);
        for (int index : keyIndexes) {
            ColumnDescriptor column = columns.get(index);
            terms.add(RelationId.quote(column.getName()) + " = " + literal(row.get(index), column.getType()));
        }
        return String.join(" AND ", terms);
    }

    /** Text value as a typed literal, e.g. {@code CAST('12.50' AS numeric(10,2))}. */
    static String literal(String value, TypeDescriptor type) {
        if (value == null) {
            return "NULL";
        }
        return type.castSql("'" + value.replace("'", "''") + "'");
    }

    private static String columnList(List<String> names) {
        return names.stream().map(RelationId::quote).collect(Collectors.joining(", "));
    }
}
