package com.kmg.dms.service;

import com.kmg.dms.config.DmsProperties;
import com.kmg.dms.model.Classification;
import com.kmg.dms.model.DocumentMetadata;
import com.kmg.dms.model.DocumentRecord;
import com.kmg.dms.model.DocumentSource;
import com.kmg.dms.model.DocumentStatus;
import com.kmg.dms.model.Employee;
import com.kmg.dms.model.MatchingRule;
import com.kmg.dms.model.PdfSegment;
import com.kmg.dms.model.ReviewSource;
import com.kmg.dms.model.Tenant;
import com.kmg.dms.repo.DocumentRepository;
import com.kmg.dms.repo.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Re-runs extraction, segmentation and classification on a document that is already stored.
 */
@Service
public class DocumentProcessingService {
    private static final Logger log = LoggerFactory.getLogger(DocumentProcessingService.class);

    private static final String SOURCE = "DocumentProcessor";
    static final String SPLIT_ARCHIVED_NOTE = "Automatically split and archived.";

    private final DocumentRepository documentRepository;
    private final TenantRepository tenantRepository;
    private final ContentStore contentStore;
    private final DocumentAnalyzer documentAnalyzer;
    private final PdfSegmenter pdfSegmenter;
    private final IdentityResolver identityResolver;
    private final RuleEngine ruleEngine;
    private final DocumentPersistenceService persistenceService;
    private final ReviewTaskService reviewTaskService;
    private final EventService eventService;
    private final Clock clock;
    private final Path workDir;

    public DocumentProcessingService(
            DocumentRepository documentRepository,
            TenantRepository tenantRepository,
            ContentStore contentStore,
            DocumentAnalyzer documentAnalyzer,
            PdfSegmenter pdfSegmenter,
            IdentityResolver identityResolver,
            RuleEngine ruleEngine,
            DocumentPersistenceService persistenceService,
            ReviewTaskService reviewTaskService,
            EventService eventService,
            Clock clock,
            DmsProperties properties
    ) {
        this.documentRepository = documentRepository;
        this.tenantRepository = tenantRepository;
        this.contentStore = contentStore;
        this.documentAnalyzer = documentAnalyzer;
        this.pdfSegmenter = pdfSegmenter;
        this.identityResolver = identityResolver;
        this.ruleEngine = ruleEngine;
        this.persistenceService = persistenceService;
        this.reviewTaskService = reviewTaskService;
        this.eventService = eventService;
        this.clock = clock;
        this.workDir = Path.of(properties.getStorage().getSplitDir());
    }

    /**
     * Processes the stored document again. A subject-specific PDF that splits into at least two segments is
     * replaced by the segments and archived; otherwise the document itself is reclassified.
     *
     * @return the resulting documents: the split documents, or the reclassified document alone
     */
    public List<DocumentRecord> reprocess(String documentId) {
        DocumentRecord document = documentRepository.findById(documentId)
                .orElseThrow(() -> new IllegalArgumentException("Document not found: " + documentId));
        Tenant tenant = tenantRepository.findById(document.tenantId())
                .orElseThrow(() -> new IllegalStateException("Tenant missing for document " + documentId));
        if (document.contentRef() == null) {
            throw new IllegalStateException("Document has no stored content: " + documentId);
        }

        Path dir = null;
        try {
            dir = Files.createTempDirectory(Files.createDirectories(workDir), "reprocess-");
            Path plain = dir.resolve("content" + (document.fileExtension() == null ? "" : document.fileExtension()));
            try (OutputStream output = Files.newOutputStream(plain)) {
                contentStore.open(document, output);
            }

            if (document.isPdf()) {
                Optional<List<DocumentRecord>> split = trySplit(tenant, document, plain, dir.resolve("segments"));
                if (split.isPresent()) {
                    return split.get();
                }
            }
            return List.of(reclassify(tenant, document, plain));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to reprocess document " + documentId, e);
        } finally {
            deleteTree(dir);
        }
    }

    private Optional<List<DocumentRecord>> trySplit(Tenant tenant, DocumentRecord parent, Path plain, Path segmentDir)
            throws IOException {
        Classification classification = documentAnalyzer.classify(parent.originalFilename());
        if (!classification.subjectSpecific() || pdfSegmenter.countPages(plain) <= 1) {
            return Optional.empty();
        }

        Files.createDirectories(segmentDir);
        List<PdfSegment> segments = pdfSegmenter.segment(plain, parent.originalFilename(), segmentDir);
        if (segments.size() < 2) {
            return Optional.empty();
        }

        String documentTypeId = documentAnalyzer.documentTypeId(tenant, classification);
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<DocumentPersistenceService.PendingDocument> pending = new ArrayList<>(segments.size());
        for (PdfSegment segment : segments) {
            Optional<Employee> employee = identityResolver.resolve(segment.subjectId(), tenant, segment.tenantHint());
            DocumentStatus status = employee.isPresent() ? DocumentStatus.ASSIGNED : DocumentStatus.REVIEW_NEEDED;
            String filename = segment.file().getFileName().toString();

            DocumentMetadata metadata = parent.metadata().copy()
                    .put(DocumentMetadata.Key.SPLIT_FROM, parent.originalFilename())
                    .put(DocumentMetadata.Key.SPLIT_FROM_DOCUMENT, parent.id())
                    .put(DocumentMetadata.Key.SUBJECT_ID_FROM_CODE, segment.subjectId())
                    .put(DocumentMetadata.Key.PAGES_IN_SPLIT, segment.pageCount())
                    .put(DocumentMetadata.Key.CODE_TENANT_HINT, segment.tenantHint())
                    .put(DocumentMetadata.Key.SUBJECT_SPECIFIC, true)
                    .put(DocumentMetadata.Key.NEEDS_REVIEW, status == DocumentStatus.REVIEW_NEEDED)
                    .put(DocumentMetadata.Key.MATCHED_RULE, null)
                    .put(DocumentMetadata.Key.PROCESSED_AT, now);

            DocumentRecord draft = new DocumentRecord(
                    UUID.randomUUID().toString(),
                    parent.tenantId(),
                    filename.substring(0, filename.length() - ".pdf".length()),
                    filename,
                    ".pdf",
                    "application/pdf",
                    null,
                    0L,
                    null,
                    status,
                    parent.source(),
                    metadata,
                    parent.tags(),
                    employee.map(Employee::id).orElse(null),
                    documentTypeId,
                    parent.periodYear(),
                    parent.periodMonth(),
                    "",
                    now,
                    now
            );
            pending.add(new DocumentPersistenceService.PendingDocument(draft, segment.file()));
        }

        List<DocumentRecord> created = persistenceService.persistDerived(pending, ReviewSource.SPLIT);
        DocumentRecord archived = parent.withStatus(DocumentStatus.ARCHIVED).withNotes(SPLIT_ARCHIVED_NOTE);
        documentRepository.updateClassification(archived);

        log.info("Split document {} into {} documents", parent.id(), created.size());
        eventService.record(EventService.Level.INFO, SOURCE,
                "PDF split: " + parent.originalFilename() + " -> " + created.size() + " documents",
                Map.of("document_id", parent.id()));
        return Optional.of(created);
    }

    private DocumentRecord reclassify(Tenant tenant, DocumentRecord document, Path plain) {
        DocumentAnalyzer.Analysis analysis =
                documentAnalyzer.analyze(tenant, plain, document.originalFilename(), document.isPdf());

        String employeeId = document.employeeId() != null ? document.employeeId() : analysis.employeeId();
        DocumentStatus status = employeeId != null ? DocumentStatus.ASSIGNED : analysis.status();
        DocumentRecord updated = document
                .withEmployeeId(employeeId)
                .withDocumentTypeId(analysis.documentTypeId())
                .withStatus(status)
                .withMetadata(document.metadata().copy().merge(analysis.metadata()));

        Optional<MatchingRule> rule = ruleEngine.classifyFilename(document.tenantId(), document.originalFilename());
        if (rule.isPresent()) {
            updated = RuleEngine.assign(updated, rule.get());
            if (updated.employeeId() != null && (updated.status() == DocumentStatus.UNASSIGNED
                    || updated.status() == DocumentStatus.REVIEW_NEEDED)) {
                updated = updated.withStatus(DocumentStatus.ASSIGNED);
            }
        }

        if (updated.status() == DocumentStatus.UNASSIGNED
                && updated.documentTypeId() == null
                && updated.employeeId() == null) {
            updated = updated.withStatus(DocumentStatus.REVIEW_NEEDED);
        }
        updated = updated.withMetadata(updated.metadata().copy()
                .put(DocumentMetadata.Key.NEEDS_REVIEW, updated.status() == DocumentStatus.REVIEW_NEEDED)
                .put(DocumentMetadata.Key.PROCESSED_AT, OffsetDateTime.now(clock)));

        documentRepository.updateClassification(updated);
        if (updated.status() == DocumentStatus.REVIEW_NEEDED) {
            reviewTaskService.createReviewTask(updated, reviewSource(document.source()));
        }
        log.info("Reprocessed document {}: status {}", document.id(), updated.status());
        return updated;
    }

    static ReviewSource reviewSource(DocumentSource source) {
        if (source == null) {
            return ReviewSource.MANUAL;
        }
        return switch (source) {
            case BATCH_ARCHIVE -> ReviewSource.BATCH_ARCHIVE;
            case EMAIL -> ReviewSource.EMAIL;
            case API -> ReviewSource.API;
            case MANUAL -> ReviewSource.MANUAL;
        };
    }

    private static void deleteTree(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Failed to delete {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to clean up {}: {}", dir, e.getMessage());
        }
    }
}
