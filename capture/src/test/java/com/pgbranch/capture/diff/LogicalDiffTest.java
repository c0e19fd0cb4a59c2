package com.pgbranch.capture.diff;

import com.pgbranch.capture.catalog.ColumnDescriptor;
import com.pgbranch.capture.catalog.ConstraintDescriptor;
import com.pgbranch.capture.catalog.IdentityMode;
import com.pgbranch.capture.catalog.Persistence;
import com.pgbranch.capture.catalog.RelationDescriptor;
import com.pgbranch.capture.catalog.RelationId;
import com.pgbranch.capture.catalog.RelationKind;
import com.pgbranch.capture.catalog.TypeDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit Tests: LogicalDiff statement building
 *
 * Descriptors are built by hand; no database involved.
 */
class LogicalDiffTest {

    private static final RelationId LEDGER = new RelationId("public", "ledger");

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private static ColumnDescriptor.ColumnDescriptorBuilder column(String name, String type) {
        return ColumnDescriptor.builder().name(name).type(TypeDescriptor.of(type)).identity(IdentityMode.NONE);
    }

    private static RelationDescriptor ledger(List<String> primaryKey, ColumnDescriptor... columns) {
        return RelationDescriptor.builder()
                .oid(16384L)
                .id(LEDGER)
                .kind(RelationKind.TABLE)
                .persistence(Persistence.PERMANENT)
                .columns(List.of(columns))
                .primaryKey(primaryKey)
                .constraints(primaryKey.isEmpty() ? List.of() : List.of(ConstraintDescriptor.builder()
                        .name("ledger_pk").type("p").definition("PRIMARY KEY (id)").build()))
                .parents(List.of())
                .reloptions(List.of())
                .build();
    }

    // ─── DDL ──────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("createTable — identity, default, collation and key on one line")
    void createTable() {
        RelationDescriptor table = ledger(List.of("id"),
                column("id", "bigint").identity(IdentityMode.ALWAYS).notNull(true).build(),
                column("name", "text").collation("C").build(),
                column("balance", "numeric(10,2)").defaultExpression("0").notNull(true).build(),
                column("doubled", "numeric").generated(true).defaultExpression("(balance * (2)::numeric)").build());

        assertThat(LogicalDiff.createTable(table)).isEqualTo("CREATE TABLE \"public\".\"ledger\" ("
                + "\"id\" bigint GENERATED ALWAYS AS IDENTITY NOT NULL, "
                + "\"name\" text COLLATE \"C\", "
                + "\"balance\" numeric(10,2) DEFAULT 0 NOT NULL, "
                + "\"doubled\" numeric GENERATED ALWAYS AS ((balance * (2)::numeric)) STORED, "
                + "PRIMARY KEY (\"id\"));");
    }

    @Test
    @DisplayName("alterTable — added, dropped and changed columns")
    void alterColumns() {
        RelationDescriptor before = ledger(List.of("id"),
                column("id", "integer").notNull(true).build(),
                column("name", "text").build(),
                column("balance", "numeric(10,2)").defaultExpression("0").build(),
                column("legacy", "text").build());
        RelationDescriptor after = ledger(List.of("id"),
                column("id", "integer").notNull(true).build(),
                column("name", "text").notNull(true).build(),
                column("balance", "numeric(12,2)").build(),
                column("note", "text").build());

        assertThat(LogicalDiff.alterTable(before, after)).containsExactly(
                "ALTER TABLE \"public\".\"ledger\" ALTER COLUMN \"name\" SET NOT NULL;",
                "ALTER TABLE \"public\".\"ledger\" ALTER COLUMN \"balance\" TYPE numeric(12,2)"
                        + " USING CAST(\"balance\" AS numeric(12,2));",
                "ALTER TABLE \"public\".\"ledger\" ALTER COLUMN \"balance\" DROP DEFAULT;",
                "ALTER TABLE \"public\".\"ledger\" ADD COLUMN \"note\" text;",
                "ALTER TABLE \"public\".\"ledger\" DROP COLUMN \"legacy\";");
    }

    @Test
    @DisplayName("alterTable — key change drops the left constraint by its name before anything else")
    void primaryKeyChange() {
        RelationDescriptor before = ledger(List.of("id"),
                column("id", "integer").notNull(true).build(),
                column("code", "text").notNull(true).build());
        RelationDescriptor after = ledger(List.of("code"),
                column("code", "text").notNull(true).build());

        assertThat(LogicalDiff.alterTable(before, after)).containsExactly(
                "ALTER TABLE \"public\".\"ledger\" DROP CONSTRAINT \"ledger_pk\";",
                "ALTER TABLE \"public\".\"ledger\" DROP COLUMN \"id\";",
                "ALTER TABLE \"public\".\"ledger\" ADD PRIMARY KEY (\"code\");");
    }

    @Test
    @DisplayName("alterTable — identical tables give no statements")
    void unchanged() {
        RelationDescriptor table = ledger(List.of("id"), column("id", "integer").notNull(true).build());

        assertThat(LogicalDiff.alterTable(table, table)).isEmpty();
    }

    // ─── DML ──────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("literal — quotes doubled, typed with the right-side type, NULL bare")
    void literals() {
        assertThat(LogicalDiff.literal("it's", TypeDescriptor.of("text"))).isEqualTo("CAST('it''s' AS text)");
        assertThat(LogicalDiff.literal("12.50", TypeDescriptor.of("numeric(10,2)")))
                .isEqualTo("CAST('12.50' AS numeric(10,2))");
        assertThat(LogicalDiff.literal(null, TypeDescriptor.of("integer"))).isEqualTo("NULL");
    }

    @Test
    @DisplayName("insert — identity ALWAYS column needs OVERRIDING SYSTEM VALUE")
    void insertOverridingIdentity() {
        List<ColumnDescriptor> columns = List.of(
                column("id", "bigint").identity(IdentityMode.ALWAYS).build(),
                column("name", "text").build());

        assertThat(LogicalDiff.insert(LEDGER, columns, Arrays.asList("7", null))).isEqualTo(
                "INSERT INTO \"public\".\"ledger\" (\"id\", \"name\") OVERRIDING SYSTEM VALUE"
                        + " VALUES (CAST('7' AS bigint), NULL);");
    }

    @Test
    @DisplayName("update — only changed non-key columns are set")
    void updateChangedColumns() {
        List<ColumnDescriptor> columns = List.of(
                column("id", "integer").build(),
                column("name", "text").build(),
                column("balance", "numeric(10,2)").build());

        assertThat(LogicalDiff.update(LEDGER, columns, new int[]{0},
                List.of("1", "a", "10.00"), List.of("1", "a", "12.50")))
                .isEqualTo("UPDATE \"public\".\"ledger\" SET \"balance\" = CAST('12.50' AS numeric(10,2))"
                        + " WHERE \"id\" = CAST('1' AS integer);");
        assertThat(LogicalDiff.update(LEDGER, columns, new int[]{0},
                List.of("1", "a", "10.00"), List.of("1", "a", "10.00"))).isNull();
    }

    @Test
    @DisplayName("toSql — DDL section first, then DML, both headers always present")
    void rendering() {
        DatabaseDiff diff = new DatabaseDiff("app", "app_dev",
                List.of("DROP TABLE \"public\".\"t\";"), List.of());

        assertThat(diff.toSql()).isEqualTo("-- DDL\nDROP TABLE \"public\".\"t\";\n-- DML\n");
        assertThat(diff.isEmpty()).isFalse();
        assertThat(new DatabaseDiff("a", "b", List.of(), List.of()).toSql()).isEqualTo("-- DDL\n-- DML\n");
    }
}
