package com.kmg.dms.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.dms.TestDatabase;
import com.kmg.dms.model.DocumentMetadata;
import com.kmg.dms.model.DocumentRecord;
import com.kmg.dms.model.DocumentSource;
import com.kmg.dms.model.DocumentStatus;
import com.kmg.dms.model.ReviewSource;
import com.kmg.dms.model.Tenant;
import com.kmg.dms.repo.DocumentRepository;
import com.kmg.dms.repo.MatchingRuleRepository;
import com.kmg.dms.repo.ProcessedRecordRepository;
import com.kmg.dms.repo.ReviewTaskRepository;
import com.kmg.dms.repo.SystemLogRepository;
import com.kmg.dms.repo.TenantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DocumentPersistenceServiceTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-02-01T09:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private TestDatabase database;
    private DocumentRepository documents;
    private ProcessedRecordRepository processedRecords;
    private ReviewTaskRepository reviewTasks;
    private ContentStore contentStore;
    private ReviewTaskService reviewTaskService;
    private Tenant tenant;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create(tempDir);
        ObjectMapper objectMapper = new ObjectMapper();
        TenantRepository tenants = new TenantRepository(database.jdbcTemplate());
        tenants.createIfMissing("00000001", "Mandant 00000001");
        tenant = tenants.findByCode("00000001").orElseThrow();

        documents = new DocumentRepository(database.jdbcTemplate(), objectMapper);
        processedRecords = new ProcessedRecordRepository(database.jdbcTemplate());
        reviewTasks = new ReviewTaskRepository(database.jdbcTemplate());
        contentStore = new ContentStore(tempDir.resolve("content"),
                new StreamingCipher(new SecretKeySpec(new byte[32], "AES")));
        EventService events = new EventService(new SystemLogRepository(database.jdbcTemplate()), objectMapper);
        reviewTaskService = new ReviewTaskService(reviewTasks, events, CLOCK);
    }

    @Test
    void ruleFailureStillRaisesReviewTask() throws IOException {
        RuleEngine failingRules = mock(RuleEngine.class);
        when(failingRules.apply(any(DocumentRecord.class))).thenThrow(new IllegalStateException("rules table locked"));
        DocumentPersistenceService service = service(failingRules, reviewTaskService);
        DocumentRecord draft = draft("scan_0007.txt");

        Optional<List<DocumentRecord>> created = service.persist(tenant.id(), "00000001/202502/scan_0007.txt", "hash-7",
                List.of(pending(draft, "unreadable")), ReviewSource.BATCH_ARCHIVE);

        assertThat(created).isPresent();
        assertThat(created.get()).singleElement()
                .satisfies(document -> assertThat(document.status()).isEqualTo(DocumentStatus.REVIEW_NEEDED));
        assertThat(reviewTasks.findOpenByDocumentId(draft.id())).isPresent();
        assertThat(processedRecords.exists(tenant.id(), "hash-7")).isTrue();
    }

    @Test
    void reviewTaskFailureKeepsCommittedDocument() throws IOException {
        ReviewTaskService failingReviews = mock(ReviewTaskService.class);
        when(failingReviews.createReviewTask(any(DocumentRecord.class), any(ReviewSource.class)))
                .thenThrow(new IllegalStateException("review table locked"));
        RuleEngine rules = new RuleEngine(
                new MatchingRuleRepository(database.jdbcTemplate(), new ObjectMapper()), CLOCK);
        DocumentPersistenceService service = service(rules, failingReviews);
        DocumentRecord draft = draft("scan_0008.txt");

        Optional<List<DocumentRecord>> created = service.persist(tenant.id(), "00000001/202502/scan_0008.txt", "hash-8",
                List.of(pending(draft, "unreadable")), ReviewSource.BATCH_ARCHIVE);

        assertThat(created).isPresent();
        assertThat(documents.findById(draft.id())).isPresent();
        assertThat(processedRecords.findByTenant(tenant.id())).singleElement()
                .satisfies(record -> assertThat(record.documentId()).isEqualTo(draft.id()));
    }

    private DocumentPersistenceService service(RuleEngine ruleEngine, ReviewTaskService reviews) {
        return new DocumentPersistenceService(documents, processedRecords, contentStore, ruleEngine, reviews,
                database.transactionTemplate(), CLOCK);
    }

    private DocumentPersistenceService.PendingDocument pending(DocumentRecord draft, String text) throws IOException {
        Path content = Files.writeString(tempDir.resolve(draft.id() + ".txt"), text);
        return new DocumentPersistenceService.PendingDocument(draft, content);
    }

    private DocumentRecord draft(String filename) {
        OffsetDateTime now = OffsetDateTime.now(CLOCK);
        return new DocumentRecord(
                UUID.randomUUID().toString(),
                tenant.id(),
                filename.substring(0, filename.lastIndexOf('.')),
                filename,
                ".txt",
                "text/plain",
                null,
                0L,
                null,
                DocumentStatus.REVIEW_NEEDED,
                DocumentSource.BATCH_ARCHIVE,
                new DocumentMetadata().put(DocumentMetadata.Key.NEEDS_REVIEW, true),
                List.of(),
                null,
                null,
                2025,
                2,
                "",
                now,
                now
        );
    }
}
