package com.pgbranch.capture.capture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgbranch.capture.catalog.RelationId;
import com.pgbranch.capture.catalog.TypeDescriptor;
import com.pgbranch.capture.exception.CaptureException;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a {@code change_log} row (joined with the catalog for the relation name) to a {@link ChangeRecord}.
 */
@Component
@RequiredArgsConstructor
public class ChangeRecordMapper implements RowMapper<ChangeRecord> {

    private final ObjectMapper objectMapper;

    @Override
    public ChangeRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        long id = rs.getLong("id");
        String schema = rs.getString("nspname");
        String name = rs.getString("relname");
        String loggedSchema = rs.getString("logged_schema");
        String loggedName = rs.getString("logged_table");
        OffsetDateTime ts = rs.getObject("ts", OffsetDateTime.class);

        return ChangeRecord.builder()
                .id(id)
                .relation(schema != null && name != null ? new RelationId(schema, name) : null)
                .loggedRelation(loggedSchema != null && loggedName != null
                        ? new RelationId(loggedSchema, loggedName) : null)
                .relationOid(rs.getLong("rel_oid"))
                .relationText(rs.getString("rel_text"))
                .operation(ChangeOperation.fromCode(rs.getString("op")))
                .key(parseKey(id, rs.getString("key")))
                .columns(parseColumns(id, rs.getString("cols")))
                .transactionId(rs.getString("tx"))
                .timestamp(ts != null ? ts.toInstant() : null)
                .build();
    }

    Map<String, String> parseKey(long id, String json) {
        JsonNode node = read(id, json);
        if (node == null || !node.isObject() || node.isEmpty()) {
            throw new CaptureException("Change record has no key: recordId=" + id);
        }
        Map<String, String> key = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            key.put(field.getKey(), field.getValue().isNull() ? null : field.getValue().asText());
        }
        return Collections.unmodifiableMap(key);
    }

    Map<String, ColumnValue> parseColumns(long id, String json) {
        JsonNode node = read(id, json);
        if (node == null || node.isNull()) {
            return Map.of();
        }
        Map<String, ColumnValue> columns = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode col = field.getValue();
            JsonNode v = col.get("v");
            TypeDescriptor type;
            try {
                type = TypeDescriptor.of(
                        col.path("type").asText(null),
                        col.hasNonNull("toid") ? col.get("toid").asLong() : null,
                        col.hasNonNull("m") ? col.get("m").asInt() : null);
            } catch (IllegalArgumentException e) {
                throw new CaptureException("Change record column has an invalid type descriptor: recordId="
                        + id + ", column=" + field.getKey(), e);
            }
            columns.put(field.getKey(), new ColumnValue(type, v == null || v.isNull() ? null : v.asText()));
        }
        return Collections.unmodifiableMap(columns);
    }

    private JsonNode read(long id, String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CaptureException("Change record payload is not valid JSON: recordId=" + id, e);
        }
    }
}
