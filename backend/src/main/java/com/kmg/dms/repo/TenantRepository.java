package com.kmg.dms.repo;

import com.kmg.dms.model.Tenant;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class TenantRepository {
    private final JdbcTemplate jdbcTemplate;

    public TenantRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<Tenant> TENANT_MAPPER = new RowMapper<>() {
        @Override
        public Tenant mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Tenant(
                    rs.getString("id"),
                    rs.getString("code"),
                    rs.getString("name"),
                    rs.getInt("is_active") == 1,
                    SqlTime.parse(rs.getString("created_at"))
            );
        }
    };

    public Optional<Tenant> findByCode(String code) {
        return jdbcTemplate.query("SELECT * FROM tenants WHERE code = ?", TENANT_MAPPER, code)
                .stream()
                .findFirst();
    }

    public Optional<Tenant> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM tenants WHERE id = ?", TENANT_MAPPER, id)
                .stream()
                .findFirst();
    }

    public List<Tenant> findActive() {
        return jdbcTemplate.query("SELECT * FROM tenants WHERE is_active = 1 ORDER BY code ASC", TENANT_MAPPER);
    }

    /**
     * Inserts an active tenant for {@code code} unless one exists. Returns true when a row was created.
     */
    public boolean createIfMissing(String code, String name) {
        int inserted = jdbcTemplate.update(
                """
                INSERT OR IGNORE INTO tenants(id, code, name, is_active, created_at)
                VALUES (?, ?, ?, 1, ?)
                """,
                UUID.randomUUID().toString(),
                code,
                name,
                SqlTime.nowText()
        );
        return inserted > 0;
    }
}
