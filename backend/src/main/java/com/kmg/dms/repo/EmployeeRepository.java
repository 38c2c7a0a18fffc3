package com.kmg.dms.repo;

import com.kmg.dms.model.Employee;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Employee lookups are always scoped explicitly: a tenant id, or {@code null} for the tenant-less legacy records.
 */
@Repository
public class EmployeeRepository {
    private final JdbcTemplate jdbcTemplate;

    public EmployeeRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<Employee> EMPLOYEE_MAPPER = new RowMapper<>() {
        @Override
        public Employee mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new Employee(
                    rs.getString("id"),
                    rs.getString("tenant_id"),
                    rs.getString("employee_id"),
                    rs.getString("first_name"),
                    rs.getString("last_name"),
                    rs.getInt("is_active") == 1,
                    List.of(),
                    SqlTime.parse(rs.getString("created_at"))
            );
        }
    };

    public Optional<Employee> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM employees WHERE id = ?", EMPLOYEE_MAPPER, id)
                .stream()
                .findFirst()
                .map(this::withAliases);
    }

    /**
     * Matches the primary employee id first, then any alias, inside one scope.
     */
    public Optional<Employee> findByIdentifier(String tenantId, String identifier) {
        Optional<Employee> primary = tenantId == null
                ? first(jdbcTemplate.query(
                        """
                        SELECT * FROM employees
                         WHERE tenant_id IS NULL AND employee_id = ?
                         ORDER BY is_active DESC, created_at ASC
                        """,
                        EMPLOYEE_MAPPER, identifier))
                : first(jdbcTemplate.query(
                        """
                        SELECT * FROM employees
                         WHERE tenant_id = ? AND employee_id = ?
                         ORDER BY is_active DESC, created_at ASC
                        """,
                        EMPLOYEE_MAPPER, tenantId, identifier));
        if (primary.isPresent()) {
            return primary.map(this::withAliases);
        }

        Optional<Employee> alias = tenantId == null
                ? first(jdbcTemplate.query(
                        """
                        SELECT e.* FROM employees e
                          JOIN employee_aliases a ON a.employee_ref = e.id
                         WHERE e.tenant_id IS NULL AND a.alias = ?
                         ORDER BY e.is_active DESC, e.created_at ASC
                        """,
                        EMPLOYEE_MAPPER, identifier))
                : first(jdbcTemplate.query(
                        """
                        SELECT e.* FROM employees e
                          JOIN employee_aliases a ON a.employee_ref = e.id
                         WHERE e.tenant_id = ? AND a.alias = ?
                         ORDER BY e.is_active DESC, e.created_at ASC
                        """,
                        EMPLOYEE_MAPPER, tenantId, identifier));
        return alias.map(this::withAliases);
    }

    public void insert(Employee employee) {
        jdbcTemplate.update(
                """
                INSERT INTO employees(id, tenant_id, employee_id, first_name, last_name, is_active, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """,
                employee.id(),
                employee.tenantId(),
                employee.employeeId(),
                employee.firstName(),
                employee.lastName(),
                employee.active() ? 1 : 0,
                employee.createdAt() == null ? SqlTime.nowText() : SqlTime.text(employee.createdAt())
        );
        for (String alias : employee.aliases()) {
            jdbcTemplate.update(
                    "INSERT OR IGNORE INTO employee_aliases(employee_ref, alias) VALUES (?, ?)",
                    employee.id(),
                    alias
            );
        }
    }

    private Employee withAliases(Employee employee) {
        List<String> aliases = jdbcTemplate.queryForList(
                "SELECT alias FROM employee_aliases WHERE employee_ref = ? ORDER BY alias ASC",
                String.class,
                employee.id()
        );
        return new Employee(
                employee.id(),
                employee.tenantId(),
                employee.employeeId(),
                employee.firstName(),
                employee.lastName(),
                employee.active(),
                aliases,
                employee.createdAt()
        );
    }

    private static Optional<Employee> first(List<Employee> rows) {
        return rows.stream().findFirst();
    }
}
