package com.kmg.dms.service;

import com.kmg.dms.model.DocumentMetadata;
import com.kmg.dms.model.DocumentRecord;
import com.kmg.dms.model.DocumentSource;
import com.kmg.dms.model.DocumentStatus;
import com.kmg.dms.model.Employee;
import com.kmg.dms.model.MatchAlgorithm;
import com.kmg.dms.model.MatchingRule;
import com.kmg.dms.model.ReviewSource;
import com.kmg.dms.model.ReviewTask;
import com.kmg.dms.model.Tenant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentProcessingServiceTest {

    @TempDir
    Path tempDir;

    private PipelineFixture fixture;
    private Tenant tenant;
    private Employee employee;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture(tempDir);
        fixture.tenants.createIfMissing("00000001", "Mandant 00000001");
        tenant = fixture.tenants.findByCode("00000001").orElseThrow();
        employee = new Employee(UUID.randomUUID().toString(), tenant.id(), "10", "Max", "Muster", true,
                List.of(), null);
        fixture.employees.insert(employee);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void multiSubjectDocumentIsSplitAndArchived() throws IOException {
        byte[] pdf = TestPdfs.bytes(Arrays.asList("PN10", "PN20", null));
        DocumentRecord parent = storedDocument("Lohnscheine_Feb.pdf", ".pdf", "application/pdf", pdf);

        List<DocumentRecord> result = fixture.processingService.reprocess(parent.id());

        assertThat(result).extracting(DocumentRecord::originalFilename)
                .containsExactly("Lohnscheine_Feb_MA10.pdf", "Lohnscheine_Feb_MA20.pdf");
        assertThat(result.get(0).employeeId()).isEqualTo(employee.id());
        assertThat(result.get(0).metadata().get(DocumentMetadata.Key.SPLIT_FROM_DOCUMENT)).contains(parent.id());
        assertThat(result.get(1).status()).isEqualTo(DocumentStatus.REVIEW_NEEDED);
        assertThat(result.get(1).metadata().get(DocumentMetadata.Key.PAGES_IN_SPLIT)).contains("2");

        DocumentRecord archived = fixture.documents.findById(parent.id()).orElseThrow();
        assertThat(archived.status()).isEqualTo(DocumentStatus.ARCHIVED);
        assertThat(archived.notes()).isEqualTo(DocumentProcessingService.SPLIT_ARCHIVED_NOTE);

        ReviewTask task = fixture.reviewTasks.findOpenByDocumentId(result.get(1).id()).orElseThrow();
        assertThat(task.source()).isEqualTo(ReviewSource.SPLIT);
    }

    @Test
    void inlineRuleClassifiesDocument() {
        fixture.rules.insert(new MatchingRule(0, tenant.id(), "memo", true, 1, MatchAlgorithm.EXACT, "memo",
                false, null, employee.id(), List.of("memo"), null, 0, null));
        DocumentRecord document = storedDocument("memo_2025.txt", ".txt", "text/plain",
                "internal memo".getBytes(StandardCharsets.UTF_8));

        List<DocumentRecord> result = fixture.processingService.reprocess(document.id());

        assertThat(result).singleElement().satisfies(updated -> {
            assertThat(updated.employeeId()).isEqualTo(employee.id());
            assertThat(updated.status()).isEqualTo(DocumentStatus.ASSIGNED);
            assertThat(updated.tags()).containsExactly("memo");
            assertThat(updated.metadata().get(DocumentMetadata.Key.MATCHED_RULE)).contains("memo");
        });
        assertThat(fixture.rules.findByTenant(tenant.id())).singleElement()
                .satisfies(rule -> assertThat(rule.matchCount()).isEqualTo(1));
    }

    @Test
    void unresolvedDocumentNeedsReview() {
        DocumentRecord document = storedDocument("scan_0001.txt", ".txt", "text/plain",
                "nothing to see".getBytes(StandardCharsets.UTF_8));

        DocumentRecord updated = fixture.processingService.reprocess(document.id()).get(0);

        assertThat(updated.status()).isEqualTo(DocumentStatus.REVIEW_NEEDED);
        ReviewTask task = fixture.reviewTasks.findOpenByDocumentId(document.id()).orElseThrow();
        assertThat(task.source()).isEqualTo(ReviewSource.API);
        assertThat(task.priority()).isEqualTo(2);
        assertThat(task.title()).isEqualTo("Review document: scan_0001.txt");

        fixture.processingService.reprocess(document.id());
        assertThat(fixture.reviewTasks.findByDocumentId(document.id())).hasSize(1);
    }

    @Test
    void unknownDocumentIsRejected() {
        assertThatThrownBy(() -> fixture.processingService.reprocess("missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    private DocumentRecord storedDocument(String filename, String extension, String mimeType, byte[] content) {
        String id = UUID.randomUUID().toString();
        ContentStore.StoredContent stored = fixture.contentStore.store(id, new ByteArrayInputStream(content));
        OffsetDateTime now = OffsetDateTime.now();
        DocumentRecord document = new DocumentRecord(id, tenant.id(), filename, filename, extension, mimeType,
                stored.ref(), stored.encryption().bytesRead(), stored.encryption().contentHash(),
                DocumentStatus.UNASSIGNED, DocumentSource.API, new DocumentMetadata(), List.of(), null, null,
                null, null, "", now, now);
        fixture.documents.insert(document);
        return document;
    }
}
