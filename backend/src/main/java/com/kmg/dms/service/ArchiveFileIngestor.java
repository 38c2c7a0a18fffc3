package com.kmg.dms.service;

import com.kmg.dms.config.DmsProperties;
import com.kmg.dms.model.ArchivePath;
import com.kmg.dms.model.Classification;
import com.kmg.dms.model.DocumentMetadata;
import com.kmg.dms.model.DocumentRecord;
import com.kmg.dms.model.DocumentSource;
import com.kmg.dms.model.DocumentStatus;
import com.kmg.dms.model.Employee;
import com.kmg.dms.model.PdfSegment;
import com.kmg.dms.model.Period;
import com.kmg.dms.model.RawArtifact;
import com.kmg.dms.model.ReviewSource;
import com.kmg.dms.model.Tenant;
import com.kmg.dms.repo.ProcessedRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
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
 * Ingests one archive file. Runs on a pool worker; every failure is turned into an {@link FileOutcome} and never
 * escapes.
 */
@Service
public class ArchiveFileIngestor {
    private static final Logger log = LoggerFactory.getLogger(ArchiveFileIngestor.class);

    private static final String SOURCE = "ArchiveScanner";

    private final ProcessedRecordRepository processedRecordRepository;
    private final MediaTypeDetector mediaTypeDetector;
    private final DocumentAnalyzer documentAnalyzer;
    private final PdfSegmenter pdfSegmenter;
    private final IdentityResolver identityResolver;
    private final DocumentPersistenceService persistenceService;
    private final EventService eventService;
    private final Clock clock;
    private final Path spoolDir;
    private final Path splitDir;

    public ArchiveFileIngestor(
            ProcessedRecordRepository processedRecordRepository,
            MediaTypeDetector mediaTypeDetector,
            DocumentAnalyzer documentAnalyzer,
            PdfSegmenter pdfSegmenter,
            IdentityResolver identityResolver,
            DocumentPersistenceService persistenceService,
            EventService eventService,
            Clock clock,
            DmsProperties properties
    ) {
        this.processedRecordRepository = processedRecordRepository;
        this.mediaTypeDetector = mediaTypeDetector;
        this.documentAnalyzer = documentAnalyzer;
        this.pdfSegmenter = pdfSegmenter;
        this.identityResolver = identityResolver;
        this.persistenceService = persistenceService;
        this.eventService = eventService;
        this.clock = clock;
        this.spoolDir = Path.of(properties.getStorage().getSpoolDir());
        this.splitDir = Path.of(properties.getStorage().getSplitDir());
    }

    FileOutcome ingest(Tenant tenant, RawArtifact artifact, DedupIndex index) {
        String identifier = artifact.identifier();
        Path spool = null;
        Path segmentDir = null;
        String hash = null;
        boolean claimed = false;

        try {
            ArchivePath path = ArchivePath.parse(identifier)
                    .orElseThrow(() -> new IllegalArgumentException("Unrecognised archive path: " + identifier));

            Files.createDirectories(spoolDir);
            spool = Files.createTempFile(spoolDir, "ingest-", ".tmp");
            hash = spool(artifact, spool);

            if (!index.claimHash(tenant.id(), hash)) {
                index.addPath(identifier);
                return FileOutcome.skipped(identifier);
            }
            claimed = true;
            if (processedRecordRepository.exists(tenant.id(), hash)) {
                index.addPath(identifier);
                return FileOutcome.skipped(identifier);
            }

            String mimeType = mediaTypeDetector.detect(spool, path.filename());
            Optional<Period> period = path.period();

            List<DocumentRecord> created;
            if (path.isPdf() && isSplitCandidate(spool, path)) {
                segmentDir = Files.createTempDirectory(createdDir(splitDir), "split-");
                List<PdfSegment> segments = pdfSegmenter.segment(spool, path.filename(), segmentDir);
                if (segments.size() >= 2) {
                    created = persistSegments(tenant, path, hash, period, segments);
                } else {
                    created = persistSingle(tenant, path, hash, mimeType, period, spool);
                }
            } else {
                created = persistSingle(tenant, path, hash, mimeType, period, spool);
            }

            if (created == null) {
                index.addPath(identifier);
                return FileOutcome.skipped(identifier);
            }
            index.addPath(identifier);
            reportReview(tenant, identifier, created);
            return FileOutcome.processed(identifier, created.size());
        } catch (Exception e) {
            if (claimed) {
                index.releaseHash(tenant.id(), hash);
            }
            log.error("Failed to ingest {}: {}", identifier, e.getMessage(), e);
            return FileOutcome.error(identifier, e.getMessage());
        } finally {
            deleteQuietly(spool);
            deleteTree(segmentDir);
        }
    }

    private boolean isSplitCandidate(Path spool, ArchivePath path) {
        Classification classification = documentAnalyzer.classify(path.filename());
        if (!classification.subjectSpecific()) {
            return false;
        }
        int pages;
        try {
            pages = pdfSegmenter.countPages(spool);
        } catch (RuntimeException e) {
            log.warn("Could not count pages of {}: {}", path.identifier(), e.getMessage());
            pages = 1;
        }
        return pages > 1;
    }

    private List<DocumentRecord> persistSingle(Tenant tenant, ArchivePath path, String hash, String mimeType,
                                               Optional<Period> period, Path content) {
        DocumentAnalyzer.Analysis analysis = documentAnalyzer.analyze(tenant, content, path.filename(), path.isPdf());
        DocumentMetadata metadata = baseMetadata(tenant, path).merge(analysis.metadata());

        DocumentRecord draft = draft(tenant, path.stem(), path.filename(), "." + path.extension(), mimeType,
                hash, analysis.status(), metadata, analysis.employeeId(), analysis.documentTypeId(), period);

        return persistenceService.persist(
                tenant.id(),
                path.identifier(),
                hash,
                List.of(new DocumentPersistenceService.PendingDocument(draft, content)),
                ReviewSource.BATCH_ARCHIVE
        ).orElse(null);
    }

    private List<DocumentRecord> persistSegments(Tenant tenant, ArchivePath path, String hash,
                                                 Optional<Period> period, List<PdfSegment> segments) {
        Classification classification = documentAnalyzer.classify(path.filename());
        String documentTypeId = documentAnalyzer.documentTypeId(tenant, classification);

        List<DocumentPersistenceService.PendingDocument> pending = new ArrayList<>(segments.size());
        for (PdfSegment segment : segments) {
            Optional<Employee> employee = identityResolver.resolve(segment.subjectId(), tenant, segment.tenantHint());
            DocumentStatus status = employee.isPresent() ? DocumentStatus.ASSIGNED : DocumentStatus.REVIEW_NEEDED;

            String filename = segment.file().getFileName().toString();
            DocumentMetadata metadata = baseMetadata(tenant, path)
                    .put(DocumentMetadata.Key.SPLIT_FROM, path.filename())
                    .put(DocumentMetadata.Key.SUBJECT_ID_FROM_CODE, segment.subjectId())
                    .put(DocumentMetadata.Key.PAGES_IN_SPLIT, segment.pageCount())
                    .put(DocumentMetadata.Key.CODE_TENANT_HINT, segment.tenantHint())
                    .put(DocumentMetadata.Key.DOC_TYPE, classification.type())
                    .put(DocumentMetadata.Key.DOC_TYPE_DESCRIPTION, classification.description())
                    .put(DocumentMetadata.Key.CATEGORY_CODE, classification.categoryCode())
                    .put(DocumentMetadata.Key.SUBJECT_SPECIFIC, true)
                    .put(DocumentMetadata.Key.NEEDS_REVIEW, status == DocumentStatus.REVIEW_NEEDED);

            DocumentRecord draft = draft(tenant, stem(filename), filename, ".pdf", "application/pdf", null,
                    status, metadata, employee.map(Employee::id).orElse(null), documentTypeId, period);
            pending.add(new DocumentPersistenceService.PendingDocument(draft, segment.file()));
        }

        Optional<List<DocumentRecord>> created = persistenceService.persist(
                tenant.id(), path.identifier(), hash, pending, ReviewSource.BATCH_ARCHIVE);
        created.ifPresent(documents -> eventService.record(EventService.Level.INFO, SOURCE,
                "PDF split: " + path.filename() + " -> " + documents.size() + " documents",
                Map.of("tenant", tenant.code(), "source", path.identifier())));
        return created.orElse(null);
    }

    private DocumentRecord draft(Tenant tenant, String title, String filename, String extension, String mimeType,
                                 String hash, DocumentStatus status, DocumentMetadata metadata, String employeeId,
                                 String documentTypeId, Optional<Period> period) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        metadata.put(DocumentMetadata.Key.PROCESSED_AT, now);
        return new DocumentRecord(
                UUID.randomUUID().toString(),
                tenant.id(),
                title,
                filename,
                extension,
                mimeType,
                null,
                0L,
                hash,
                status,
                DocumentSource.BATCH_ARCHIVE,
                metadata,
                List.of(),
                employeeId,
                documentTypeId,
                period.map(Period::year).orElse(null),
                period.map(Period::month).orElse(null),
                "",
                now,
                now
        );
    }

    private static DocumentMetadata baseMetadata(Tenant tenant, ArchivePath path) {
        return new DocumentMetadata()
                .put(DocumentMetadata.Key.ORIGINAL_PATH, path.identifier())
                .put(DocumentMetadata.Key.TENANT_CODE, tenant.code())
                .put(DocumentMetadata.Key.MONTH_FOLDER, path.monthFolder());
    }

    private void reportReview(Tenant tenant, String identifier, List<DocumentRecord> documents) {
        for (DocumentRecord document : documents) {
            if (document.status() == DocumentStatus.REVIEW_NEEDED) {
                eventService.record(EventService.Level.WARNING, SOURCE, "File requires review: " + identifier,
                        Map.of("document_id", document.id(), "tenant", tenant.code()));
            }
        }
    }

    private static String spool(RawArtifact artifact, Path target) throws IOException {
        try (InputStream input = artifact.open(); OutputStream output = Files.newOutputStream(target)) {
            return ContentHasher.copyAndHash(input, output);
        }
    }

    private static Path createdDir(Path dir) throws IOException {
        return Files.createDirectories(dir);
    }

    private static String stem(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", path, e.getMessage());
        }
    }

    private static void deleteTree(Path dir) {
        if (dir == null || !Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(ArchiveFileIngestor::deleteQuietly);
        } catch (IOException e) {
            log.warn("Failed to clean up {}: {}", dir, e.getMessage());
        }
    }
}
