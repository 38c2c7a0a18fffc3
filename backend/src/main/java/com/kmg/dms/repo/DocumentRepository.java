package com.kmg.dms.repo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.dms.model.DocumentMetadata;
import com.kmg.dms.model.DocumentRecord;
import com.kmg.dms.model.DocumentSource;
import com.kmg.dms.model.DocumentStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

@Repository
public class DocumentRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<DocumentRecord> documentMapper;

    public DocumentRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.documentMapper = this::mapDocument;
    }

    public void insert(DocumentRecord document) {
        jdbcTemplate.update(
                """
                INSERT INTO documents(id, tenant_id, title, original_filename, file_extension, mime_type, content_ref,
                                      file_size, content_hash, status, source, metadata_json, tags_json, employee_id,
                                      document_type_id, period_year, period_month, notes, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                document.id(),
                document.tenantId(),
                document.title(),
                document.originalFilename(),
                document.fileExtension(),
                document.mimeType(),
                document.contentRef(),
                document.fileSize(),
                document.contentHash(),
                document.status().name(),
                document.source().name(),
                writeJson(document.metadata()),
                writeJson(document.tags()),
                document.employeeId(),
                document.documentTypeId(),
                document.periodYear(),
                document.periodMonth(),
                document.notes(),
                SqlTime.text(document.createdAt()),
                SqlTime.text(document.updatedAt())
        );
    }

    /**
     * Persists the mutable classification fields of a document.
     */
    public void updateClassification(DocumentRecord document) {
        jdbcTemplate.update(
                """
                UPDATE documents
                   SET status = ?,
                       employee_id = ?,
                       document_type_id = ?,
                       metadata_json = ?,
                       tags_json = ?,
                       notes = ?,
                       updated_at = ?
                 WHERE id = ?
                """,
                document.status().name(),
                document.employeeId(),
                document.documentTypeId(),
                writeJson(document.metadata()),
                writeJson(document.tags()),
                document.notes(),
                SqlTime.nowText(),
                document.id()
        );
    }

    public Optional<DocumentRecord> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM documents WHERE id = ?", documentMapper, id)
                .stream()
                .findFirst();
    }

    public List<DocumentRecord> findByTenant(String tenantId) {
        return jdbcTemplate.query(
                "SELECT * FROM documents WHERE tenant_id = ? ORDER BY created_at ASC, title ASC",
                documentMapper,
                tenantId
        );
    }

    public int countByTenant(String tenantId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM documents WHERE tenant_id = ?",
                Integer.class,
                tenantId
        );
        return count == null ? 0 : count;
    }

    private DocumentRecord mapDocument(ResultSet rs, int rowNum) throws SQLException {
        return new DocumentRecord(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("title"),
                rs.getString("original_filename"),
                rs.getString("file_extension"),
                rs.getString("mime_type"),
                rs.getString("content_ref"),
                rs.getLong("file_size"),
                rs.getString("content_hash"),
                DocumentStatus.valueOf(rs.getString("status")),
                DocumentSource.valueOf(rs.getString("source")),
                readMetadata(rs.getString("metadata_json")),
                readTags(rs.getString("tags_json")),
                rs.getString("employee_id"),
                rs.getString("document_type_id"),
                nullableInt(rs, "period_year"),
                nullableInt(rs, "period_month"),
                rs.getString("notes"),
                SqlTime.parse(rs.getString("created_at")),
                SqlTime.parse(rs.getString("updated_at"))
        );
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private DocumentMetadata readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return new DocumentMetadata();
        }
        try {
            return objectMapper.readValue(json, DocumentMetadata.class);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse document metadata", e);
        }
    }

    private List<String> readTags(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {
            });
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse document tags", e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize document column", e);
        }
    }
}
