package com.kmg.dms.repo;

import com.kmg.dms.model.ScanJobRecord;
import com.kmg.dms.model.ScanJobStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

@Repository
public class ScanJobRepository {
    private final JdbcTemplate jdbcTemplate;

    public ScanJobRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<ScanJobRecord> JOB_MAPPER = new RowMapper<>() {
        @Override
        public ScanJobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ScanJobRecord(
                    rs.getString("id"),
                    rs.getString("source"),
                    ScanJobStatus.valueOf(rs.getString("status")),
                    rs.getInt("total_files"),
                    rs.getInt("processed_files"),
                    rs.getInt("skipped_files"),
                    rs.getInt("error_files"),
                    rs.getInt("documents_created"),
                    rs.getString("current_item"),
                    rs.getString("error_message"),
                    SqlTime.parse(rs.getString("created_at")),
                    SqlTime.parse(rs.getString("started_at")),
                    SqlTime.parse(rs.getString("completed_at"))
            );
        }
    };

    public void insert(ScanJobRecord record) {
        jdbcTemplate.update(
                """
                INSERT INTO scan_jobs(id, source, status, total_files, processed_files, skipped_files, error_files,
                                      documents_created, current_item, error_message, created_at, started_at,
                                      completed_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                record.id(),
                record.source(),
                record.status().name(),
                record.totalFiles(),
                record.processedFiles(),
                record.skippedFiles(),
                record.errorFiles(),
                record.documentsCreated(),
                record.currentItem(),
                record.errorMessage(),
                SqlTime.text(record.createdAt()),
                SqlTime.text(record.startedAt()),
                SqlTime.text(record.completedAt())
        );
    }

    public void markRunning(String jobId) {
        jdbcTemplate.update(
                """
                UPDATE scan_jobs
                   SET status = 'RUNNING',
                       started_at = ?
                 WHERE id = ? AND status = 'PENDING'
                """,
                SqlTime.nowText(),
                jobId
        );
    }

    public void updateTotals(String jobId, int totalFiles, int skippedFiles) {
        jdbcTemplate.update(
                "UPDATE scan_jobs SET total_files = ?, skipped_files = ? WHERE id = ? AND status = 'RUNNING'",
                totalFiles,
                skippedFiles,
                jobId
        );
    }

    public void updateProgress(String jobId, ProgressSnapshot progress) {
        jdbcTemplate.update(
                """
                UPDATE scan_jobs
                   SET processed_files = ?,
                       skipped_files = ?,
                       error_files = ?,
                       documents_created = ?,
                       current_item = ?
                 WHERE id = ? AND status = 'RUNNING'
                """,
                progress.processed(),
                progress.skipped(),
                progress.errors(),
                progress.documentsCreated(),
                progress.currentItem(),
                jobId
        );
    }

    public void complete(String jobId, ProgressSnapshot progress) {
        jdbcTemplate.update(
                """
                UPDATE scan_jobs
                   SET status = 'COMPLETED',
                       processed_files = ?,
                       skipped_files = ?,
                       error_files = ?,
                       documents_created = ?,
                       current_item = NULL,
                       completed_at = ?
                 WHERE id = ? AND status = 'RUNNING'
                """,
                progress.processed(),
                progress.skipped(),
                progress.errors(),
                progress.documentsCreated(),
                SqlTime.nowText(),
                jobId
        );
    }

    public void fail(String jobId, String errorMessage) {
        jdbcTemplate.update(
                """
                UPDATE scan_jobs
                   SET status = 'FAILED',
                       error_message = ?,
                       completed_at = ?
                 WHERE id = ? AND status IN ('PENDING', 'RUNNING')
                """,
                errorMessage,
                SqlTime.nowText(),
                jobId
        );
    }

    public Optional<ScanJobRecord> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM scan_jobs WHERE id = ?", JOB_MAPPER, id)
                .stream()
                .findFirst();
    }

    public List<ScanJobRecord> findRecent(int limit) {
        return jdbcTemplate.query(
                "SELECT * FROM scan_jobs ORDER BY created_at DESC LIMIT ?",
                JOB_MAPPER,
                limit
        );
    }

    public int recoverRunningJobsAfterRestart() {
        return jdbcTemplate.update(
                """
                UPDATE scan_jobs
                   SET status = 'FAILED',
                       completed_at = COALESCE(completed_at, ?),
                       error_message = COALESCE(error_message, 'Application restarted while scan was running')
                 WHERE status = 'RUNNING'
                """,
                SqlTime.nowText()
        );
    }

    public record ProgressSnapshot(
            int processed,
            int skipped,
            int errors,
            int documentsCreated,
            String currentItem
    ) {
    }
}
