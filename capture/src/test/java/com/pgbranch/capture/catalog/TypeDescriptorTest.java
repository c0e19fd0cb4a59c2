package com.pgbranch.capture.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TypeDescriptorTest {

    @Test
    @DisplayName("numeric(10,2) splits into base type and modifier")
    void numericWithModifier() {
        TypeDescriptor type = TypeDescriptor.of("numeric(10,2)", 1700L, 655366);

        assertThat(type.baseType()).isEqualTo("numeric");
        assertThat(type.modifier()).contains("10,2");
        assertThat(type.castSql("?")).isEqualTo("CAST(? AS numeric(10,2))");
        assertThat(type.getOid()).isEqualTo(1700L);
    }

    @Test
    @DisplayName("Modifier in the middle of a multi-word type is removed from the base type")
    void timestampWithPrecision() {
        TypeDescriptor type = TypeDescriptor.of("timestamp(3) with time zone");

        assertThat(type.baseType()).isEqualTo("timestamp with time zone");
        assertThat(type.modifier()).contains("3");
    }

    @Test
    @DisplayName("Array of a modified type keeps its brackets")
    void arrayOfVarchar() {
        TypeDescriptor type = TypeDescriptor.of("character varying(20)[]");

        assertThat(type.baseType()).isEqualTo("character varying[]");
        assertThat(type.modifier()).contains("20");
    }

    @Test
    @DisplayName("Type without modifier has no modifier")
    void plainType() {
        TypeDescriptor type = TypeDescriptor.of("double precision");

        assertThat(type.baseType()).isEqualTo("double precision");
        assertThat(type.modifier()).isEmpty();
    }

    @Test
    @DisplayName("Descriptors compare by formatted text only")
    void equalityIgnoresOid() {
        assertThat(TypeDescriptor.of("integer", 23L, -1)).isEqualTo(TypeDescriptor.of("integer"));
    }

    @Test
    @DisplayName("Text that is not a formatted type name is rejected")
    void rejectsInjectedText() {
        assertThatThrownBy(() -> TypeDescriptor.of("integer); DROP TABLE accounts; --"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeDescriptor.of("text -- comment"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeDescriptor.of("'x'"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeDescriptor.of(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Quoted and schema-qualified user types are accepted")
    void userTypes() {
        assertThat(TypeDescriptor.of("public.mood").getFormatted()).isEqualTo("public.mood");
        assertThat(TypeDescriptor.of("\"Weird Type\"").castSql("?")).isEqualTo("CAST(? AS \"Weird Type\")");
    }

    @Test
    @DisplayName("Quoted names holding dashes, escaped quotes or non-ASCII letters are accepted")
    void quotedNamesWithAnyCharacter() {
        assertThat(TypeDescriptor.of("public.\"order-status\"").getFormatted()).isEqualTo("public.\"order-status\"");
        assertThat(TypeDescriptor.of("\"größe\"[]").baseType()).isEqualTo("\"größe\"[]");
        assertThat(TypeDescriptor.of("\"say \"\"hi\"\"; --\"").getFormatted()).isEqualTo("\"say \"\"hi\"\"; --\"");
    }

    @Test
    @DisplayName("Unterminated quote or unbalanced parenthesis is rejected")
    void rejectsUnbalancedText() {
        assertThatThrownBy(() -> TypeDescriptor.of("\"open"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeDescriptor.of("\"a\"\"\" x\""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TypeDescriptor.of("numeric(10,2"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Relation ids always quote both parts")
    void relationIdQuoting() {
        assertThat(new RelationId("public", "accounts").qualified()).isEqualTo("\"public\".\"accounts\"");
        assertThat(new RelationId("s", "we\"ird").qualified()).isEqualTo("\"s\".\"we\"\"ird\"");
        assertThat(new RelationId("public", "accounts")).hasToString("public.accounts");
    }

    @Test
    @DisplayName("Catalog codes map onto identity, kind and persistence")
    void catalogCodes() {
        assertThat(IdentityMode.fromCode("a")).isEqualTo(IdentityMode.ALWAYS);
        assertThat(IdentityMode.fromCode("d")).isEqualTo(IdentityMode.BY_DEFAULT);
        assertThat(IdentityMode.fromCode("")).isEqualTo(IdentityMode.NONE);
        assertThat(RelationKind.fromCode("p")).isEqualTo(RelationKind.PARTITIONED_TABLE);
        assertThat(RelationKind.fromCode("v")).isNull();
        assertThat(Persistence.fromCode("u")).isEqualTo(Persistence.UNLOGGED);
        assertThat(Persistence.fromCode("p")).isEqualTo(Persistence.PERMANENT);
    }
}
