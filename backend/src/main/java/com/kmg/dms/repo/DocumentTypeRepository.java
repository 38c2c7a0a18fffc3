package com.kmg.dms.repo;

import com.kmg.dms.model.Classification;
import com.kmg.dms.model.DocumentType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;

@Repository
public class DocumentTypeRepository {
    private final JdbcTemplate jdbcTemplate;

    public DocumentTypeRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<DocumentType> TYPE_MAPPER = new RowMapper<>() {
        @Override
        public DocumentType mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new DocumentType(
                    rs.getString("id"),
                    rs.getString("tenant_id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    rs.getString("category_code"),
                    rs.getInt("is_subject_specific") == 1
            );
        }
    };

    public Optional<DocumentType> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM document_types WHERE id = ?", TYPE_MAPPER, id)
                .stream()
                .findFirst();
    }

    public Optional<DocumentType> findByTenantAndName(String tenantId, String name) {
        return jdbcTemplate.query(
                "SELECT * FROM document_types WHERE tenant_id = ? AND name = ?",
                TYPE_MAPPER,
                tenantId,
                name
        ).stream().findFirst();
    }

    /**
     * Materialises a known classification as a tenant-scoped document type row.
     */
    public DocumentType getOrCreate(String tenantId, Classification classification) {
        if (!classification.isKnown()) {
            throw new IllegalArgumentException("Unknown classification has no document type");
        }
        jdbcTemplate.update(
                """
                INSERT OR IGNORE INTO document_types(id, tenant_id, name, description, category_code,
                                                     is_subject_specific, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """,
                UUID.randomUUID().toString(),
                tenantId,
                classification.type(),
                classification.description(),
                classification.categoryCode(),
                classification.subjectSpecific() ? 1 : 0,
                SqlTime.nowText()
        );
        return findByTenantAndName(tenantId, classification.type())
                .orElseThrow(() -> new IllegalStateException("Document type vanished: " + classification.type()));
    }
}
