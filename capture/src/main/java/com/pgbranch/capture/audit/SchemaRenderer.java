package com.pgbranch.capture.audit;

import com.pgbranch.capture.CaptureNames;
import com.pgbranch.capture.catalog.CatalogInspector;
import com.pgbranch.capture.catalog.RelationDescriptor;
import com.pgbranch.capture.exception.CaptureException;
import com.pgbranch.capture.jdbc.DatabaseConnections;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Schema Renderer
 *
 * Rebuilds a table's CREATE statement from catalog state through {@code pgbranch.render_create_table},
 * the same function the end-of-command audit hook calls, so on-demand output and audited
 * post-definitions never disagree. Reflects CREATE-time shape only; ALTERs are audited as text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaRenderer {

    private final DatabaseConnections connections;
    private final CatalogInspector inspector;

    /**
     * @throws com.pgbranch.capture.exception.PreconditionException when the relation does not resolve to a table
     */
    public String render(String database, String relation) {
        RelationDescriptor descriptor = inspector.describe(database, relation);
        try {
            return connections.jdbc(database).queryForObject(
                    "SELECT " + CaptureNames.RENDER_FUNCTION + "(CAST(? AS oid)::regclass)",
                    String.class, descriptor.getOid());
        } catch (DataAccessException e) {
            log.error("Render failed: database={}, relation={}", database, descriptor.getId(), e);
            throw new CaptureException("Cannot render relation " + descriptor.getId()
                    + " in database " + database + " (is capture installed?)", e);
        }
    }
}
