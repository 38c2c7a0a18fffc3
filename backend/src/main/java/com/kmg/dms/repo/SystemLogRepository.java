package com.kmg.dms.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
public class SystemLogRepository {
    private final JdbcTemplate jdbcTemplate;

    public SystemLogRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<SystemLogRow> ROW_MAPPER = new RowMapper<>() {
        @Override
        public SystemLogRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new SystemLogRow(
                    rs.getLong("id"),
                    rs.getString("created_at"),
                    rs.getString("level"),
                    rs.getString("source"),
                    rs.getString("message"),
                    rs.getString("details_json")
            );
        }
    };

    public void insert(String level, String source, String message, String detailsJson) {
        jdbcTemplate.update(
                "INSERT INTO system_logs(created_at, level, source, message, details_json) VALUES (?, ?, ?, ?, ?)",
                SqlTime.nowText(),
                level,
                source,
                message,
                detailsJson
        );
    }

    public List<SystemLogRow> findRecent(int limit) {
        return jdbcTemplate.query("SELECT * FROM system_logs ORDER BY id DESC LIMIT ?", ROW_MAPPER, limit);
    }

    public record SystemLogRow(
            long id,
            String createdAt,
            String level,
            String source,
            String message,
            String detailsJson
    ) {
    }
}
