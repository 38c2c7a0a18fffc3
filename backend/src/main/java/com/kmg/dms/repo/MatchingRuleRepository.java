package com.kmg.dms.repo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.dms.model.DocumentStatus;
import com.kmg.dms.model.MatchAlgorithm;
import com.kmg.dms.model.MatchingRule;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.util.List;

@Repository
public class MatchingRuleRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<MatchingRule> ruleMapper;

    public MatchingRuleRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.ruleMapper = this::mapRule;
    }

    /**
     * Active rules of the tenant plus the global ones, highest priority first, then declaration order.
     */
    public List<MatchingRule> findActiveGlobalOrTenant(String tenantId) {
        return jdbcTemplate.query(
                """
                SELECT * FROM matching_rules
                 WHERE is_active = 1 AND (tenant_id IS NULL OR tenant_id = ?)
                 ORDER BY priority DESC, id ASC
                """,
                ruleMapper,
                tenantId
        );
    }

    public List<MatchingRule> findByTenant(String tenantId) {
        return jdbcTemplate.query(
                "SELECT * FROM matching_rules WHERE tenant_id = ? ORDER BY priority DESC, id ASC",
                ruleMapper,
                tenantId
        );
    }

    public List<MatchingRule> findGlobal() {
        return jdbcTemplate.query(
                "SELECT * FROM matching_rules WHERE tenant_id IS NULL ORDER BY priority DESC, id ASC",
                ruleMapper
        );
    }

    public long insert(MatchingRule rule) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        String tagsJson = writeTags(rule.assignTags());
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(
                    """
                    INSERT INTO matching_rules(tenant_id, name, is_active, priority, algorithm, match_pattern,
                                               is_case_sensitive, assign_document_type_id, assign_employee_id,
                                               assign_tags_json, assign_status, match_count, last_matched_at,
                                               created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0, NULL, ?)
                    """,
                    Statement.RETURN_GENERATED_KEYS
            );
            ps.setString(1, rule.tenantId());
            ps.setString(2, rule.name());
            ps.setInt(3, rule.active() ? 1 : 0);
            ps.setInt(4, rule.priority());
            ps.setString(5, rule.algorithm().name());
            ps.setString(6, rule.pattern() == null ? "" : rule.pattern());
            ps.setInt(7, rule.caseSensitive() ? 1 : 0);
            ps.setString(8, rule.assignDocumentTypeId());
            ps.setString(9, rule.assignEmployeeId());
            ps.setString(10, tagsJson);
            ps.setString(11, rule.assignStatus() == null ? null : rule.assignStatus().name());
            ps.setString(12, SqlTime.nowText());
            return ps;
        }, keyHolder);
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id generated for rule " + rule.name());
        }
        return key.longValue();
    }

    public void recordMatch(long ruleId, OffsetDateTime matchedAt) {
        jdbcTemplate.update(
                "UPDATE matching_rules SET match_count = match_count + 1, last_matched_at = ? WHERE id = ?",
                SqlTime.text(matchedAt),
                ruleId
        );
    }

    private MatchingRule mapRule(ResultSet rs, int rowNum) throws SQLException {
        String status = rs.getString("assign_status");
        return new MatchingRule(
                rs.getLong("id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                rs.getInt("is_active") == 1,
                rs.getInt("priority"),
                MatchAlgorithm.valueOf(rs.getString("algorithm")),
                rs.getString("match_pattern"),
                rs.getInt("is_case_sensitive") == 1,
                rs.getString("assign_document_type_id"),
                rs.getString("assign_employee_id"),
                readTags(rs.getString("assign_tags_json")),
                status == null || status.isBlank() ? null : DocumentStatus.valueOf(status),
                rs.getLong("match_count"),
                SqlTime.parse(rs.getString("last_matched_at"))
        );
    }

    private List<String> readTags(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {
            });
        } catch (Exception e) {
            throw new IllegalStateException("Failed to parse rule tags", e);
        }
    }

    private String writeTags(List<String> tags) {
        try {
            return objectMapper.writeValueAsString(tags);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize rule tags", e);
        }
    }
}
