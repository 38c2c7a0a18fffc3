package com.kmg.dms.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.dms.TestDatabase;
import com.kmg.dms.model.DocumentMetadata;
import com.kmg.dms.model.DocumentRecord;
import com.kmg.dms.model.DocumentSource;
import com.kmg.dms.model.DocumentStatus;
import com.kmg.dms.model.MatchAlgorithm;
import com.kmg.dms.model.MatchingRule;
import com.kmg.dms.model.Tenant;
import com.kmg.dms.repo.MatchingRuleRepository;
import com.kmg.dms.repo.TenantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleEngineTest {

    @TempDir
    Path tempDir;

    private MatchingRuleRepository rules;
    private RuleEngine engine;
    private Tenant tenant;
    private Tenant otherTenant;

    @BeforeEach
    void setUp() {
        TestDatabase database = TestDatabase.create(tempDir);
        TenantRepository tenants = new TenantRepository(database.jdbcTemplate());
        tenants.createIfMissing("00000001", "Mandant 00000001");
        tenants.createIfMissing("00000002", "Mandant 00000002");
        tenant = tenants.findByCode("00000001").orElseThrow();
        otherTenant = tenants.findByCode("00000002").orElseThrow();

        rules = new MatchingRuleRepository(database.jdbcTemplate(), new ObjectMapper());
        engine = new RuleEngine(rules, Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void allWordsMatchAnywhereInText() {
        rules.insert(rule(null, "vacation", 0, MatchAlgorithm.ALL, "urlaub antrag", List.of("hr")));

        RuleEngine.RuleApplication application = engine.apply(document("Urlaubsantrag_2025.pdf"));

        assertThat(application.matched()).isTrue();
        assertThat(application.document().tags()).containsExactly("hr");
        assertThat(application.document().metadata().get(DocumentMetadata.Key.MATCHED_RULE)).contains("vacation");
    }

    @Test
    void highestPriorityWinsAndTiesFollowDeclarationOrder() {
        rules.insert(rule(null, "low", 1, MatchAlgorithm.EXACT, "lohn", List.of("low")));
        rules.insert(rule(tenant.id(), "first-high", 5, MatchAlgorithm.EXACT, "lohn", List.of("first")));
        rules.insert(rule(null, "second-high", 5, MatchAlgorithm.EXACT, "lohn", List.of("second")));

        RuleEngine.RuleApplication application = engine.apply(document("Lohnscheine.pdf"));

        assertThat(application.rule().name()).isEqualTo("first-high");
    }

    @Test
    void matchIsCountedOnTheWinningRuleOnly() {
        long winner = rules.insert(rule(null, "winner", 9, MatchAlgorithm.ANY, "foo lohn", List.of()));
        long loser = rules.insert(rule(null, "loser", 1, MatchAlgorithm.EXACT, "lohn", List.of()));

        engine.apply(document("Lohnscheine.pdf"));
        engine.classifyFilename(tenant.id(), "Lohnkonto.pdf");

        MatchingRule winning = rules.findGlobal().stream().filter(r -> r.id() == winner).findFirst().orElseThrow();
        MatchingRule losing = rules.findGlobal().stream().filter(r -> r.id() == loser).findFirst().orElseThrow();
        assertThat(winning.matchCount()).isEqualTo(2);
        assertThat(winning.lastMatchedAt()).isEqualTo(OffsetDateTime.parse("2025-03-01T10:00:00Z"));
        assertThat(losing.matchCount()).isZero();
    }

    @Test
    void otherTenantsRulesAreIgnored() {
        rules.insert(rule(otherTenant.id(), "foreign", 10, MatchAlgorithm.EXACT, "lohn", List.of()));

        assertThat(engine.apply(document("Lohnscheine.pdf")).matched()).isFalse();
        assertThat(engine.classifyFilename(otherTenant.id(), "Lohnscheine.pdf")).isPresent();
    }

    @Test
    void assignmentsOnlyFillOpenFields() {
        MatchingRule rule = new MatchingRule(1, null, "assign", true, 0, MatchAlgorithm.EXACT, "x", false,
                "type-from-rule", "employee-from-rule", List.of("b", "c"), DocumentStatus.COMPANY, 0, null);
        DocumentRecord assigned = document("x.pdf")
                .withEmployeeId("existing")
                .withStatus(DocumentStatus.ASSIGNED)
                .withTags(List.of("a", "b"));

        DocumentRecord result = RuleEngine.assign(assigned, rule);

        assertThat(result.employeeId()).isEqualTo("existing");
        assertThat(result.documentTypeId()).isEqualTo("type-from-rule");
        assertThat(result.status()).isEqualTo(DocumentStatus.ASSIGNED);
        assertThat(result.tags()).containsExactly("a", "b", "c");
        assertThat(RuleEngine.assign(document("x.pdf"), rule).status()).isEqualTo(DocumentStatus.COMPANY);
    }

    @Test
    void algorithmSemantics() {
        assertThat(RuleEngine.matches(rule(null, "r", 0, MatchAlgorithm.EXACT, "lohn konto", List.of()),
                "Jahres Lohn Konto.pdf")).isTrue();
        assertThat(RuleEngine.matches(rule(null, "r", 0, MatchAlgorithm.ANY, "foo bar", List.of()),
                "no match here")).isFalse();
        assertThat(RuleEngine.matches(rule(null, "r", 0, MatchAlgorithm.REGEX, "^lohn\\w+_\\d{4}", List.of()),
                "LOHNKONTO_2024.pdf")).isTrue();
        assertThat(RuleEngine.matches(rule(null, "r", 0, MatchAlgorithm.REGEX, "([unclosed", List.of()),
                "([unclosed")).isFalse();
        assertThat(RuleEngine.matches(rule(null, "r", 0, MatchAlgorithm.FUZZY, "rechnung", List.of()),
                "Rechnunk_01.pdf")).isTrue();
        assertThat(RuleEngine.matches(rule(null, "r", 0, MatchAlgorithm.FUZZY, "abc", List.of()),
                "abc.pdf")).isFalse();
        assertThat(RuleEngine.matches(rule(null, "r", 0, MatchAlgorithm.NONE, "lohn", List.of()),
                "lohn.pdf")).isFalse();
        assertThat(RuleEngine.matches(rule(null, "r", 0, MatchAlgorithm.EXACT, "  ", List.of()),
                "anything")).isFalse();
    }

    private static MatchingRule rule(String tenantId, String name, int priority, MatchAlgorithm algorithm,
                                     String pattern, List<String> tags) {
        return new MatchingRule(0, tenantId, name, true, priority, algorithm, pattern, false, null, null, tags,
                null, 0, null);
    }

    private DocumentRecord document(String filename) {
        OffsetDateTime now = OffsetDateTime.parse("2025-03-01T09:00:00Z");
        return new DocumentRecord("doc-1", tenant.id(), filename, filename, ".pdf", "application/pdf", "ab/doc-1.enc",
                10L, "hash", DocumentStatus.UNASSIGNED, DocumentSource.BATCH_ARCHIVE, new DocumentMetadata(),
                List.of(), null, null, null, null, "", now, now);
    }
}
