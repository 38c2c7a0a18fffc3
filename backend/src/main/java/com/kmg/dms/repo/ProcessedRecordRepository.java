package com.kmg.dms.repo;

import com.kmg.dms.model.ProcessedRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
public class ProcessedRecordRepository {
    private final JdbcTemplate jdbcTemplate;

    public ProcessedRecordRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<ProcessedRecord> RECORD_MAPPER = new RowMapper<>() {
        @Override
        public ProcessedRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ProcessedRecord(
                    rs.getString("tenant_id"),
                    rs.getString("content_hash"),
                    rs.getString("source_identifier"),
                    rs.getString("document_id"),
                    SqlTime.parse(rs.getString("processed_at"))
            );
        }
    };

    /**
     * Inserts the record unless (tenant, hash) is already present. Returns false for a duplicate.
     */
    public boolean insertIfAbsent(ProcessedRecord record) {
        int inserted = jdbcTemplate.update(
                """
                INSERT INTO processed_records(tenant_id, content_hash, source_identifier, document_id, processed_at)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT(tenant_id, content_hash) DO NOTHING
                """,
                record.tenantId(),
                record.contentHash(),
                record.sourceIdentifier(),
                record.documentId(),
                record.processedAt() == null ? SqlTime.nowText() : SqlTime.text(record.processedAt())
        );
        return inserted > 0;
    }

    public boolean exists(String tenantId, String contentHash) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM processed_records WHERE tenant_id = ? AND content_hash = ?",
                Integer.class,
                tenantId,
                contentHash
        );
        return count != null && count > 0;
    }

    public List<ProcessedRecord> findAll() {
        return jdbcTemplate.query("SELECT * FROM processed_records ORDER BY id ASC", RECORD_MAPPER);
    }

    public List<ProcessedRecord> findByTenant(String tenantId) {
        return jdbcTemplate.query(
                "SELECT * FROM processed_records WHERE tenant_id = ? ORDER BY id ASC",
                RECORD_MAPPER,
                tenantId
        );
    }
}
