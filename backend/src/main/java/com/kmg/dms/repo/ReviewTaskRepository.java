package com.kmg.dms.repo;

import com.kmg.dms.model.ReviewSource;
import com.kmg.dms.model.ReviewTask;
import com.kmg.dms.model.ReviewTaskStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

@Repository
public class ReviewTaskRepository {
    private final JdbcTemplate jdbcTemplate;

    public ReviewTaskRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<ReviewTask> TASK_MAPPER = new RowMapper<>() {
        @Override
        public ReviewTask mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ReviewTask(
                    rs.getString("id"),
                    rs.getString("document_id"),
                    rs.getString("title"),
                    rs.getString("description"),
                    rs.getInt("priority"),
                    ReviewTaskStatus.valueOf(rs.getString("status")),
                    ReviewSource.valueOf(rs.getString("source")),
                    SqlTime.parse(rs.getString("created_at")),
                    SqlTime.parse(rs.getString("updated_at")),
                    SqlTime.parse(rs.getString("completed_at"))
            );
        }
    };

    /**
     * Inserts the task unless the document already has an open one. Returns false when skipped.
     */
    public boolean insertIfNoOpenTask(ReviewTask task) {
        int inserted = jdbcTemplate.update(
                """
                INSERT OR IGNORE INTO review_tasks(id, document_id, title, description, priority, status, source,
                                                   created_at, updated_at, completed_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                task.id(),
                task.documentId(),
                task.title(),
                task.description(),
                task.priority(),
                task.status().name(),
                task.source().name(),
                SqlTime.text(task.createdAt()),
                SqlTime.text(task.updatedAt()),
                SqlTime.text(task.completedAt())
        );
        return inserted > 0;
    }

    public Optional<ReviewTask> findOpenByDocumentId(String documentId) {
        return jdbcTemplate.query(
                """
                SELECT * FROM review_tasks
                 WHERE document_id = ? AND status IN ('OPEN', 'IN_PROGRESS')
                 ORDER BY created_at ASC
                """,
                TASK_MAPPER,
                documentId
        ).stream().findFirst();
    }

    public List<ReviewTask> findByDocumentId(String documentId) {
        return jdbcTemplate.query(
                "SELECT * FROM review_tasks WHERE document_id = ? ORDER BY created_at ASC",
                TASK_MAPPER,
                documentId
        );
    }
}
