package com.kmg.dms.service;

import com.kmg.dms.model.DocumentMetadata;
import com.kmg.dms.model.DocumentRecord;
import com.kmg.dms.model.DocumentStatus;
import com.kmg.dms.model.ProcessedRecord;
import com.kmg.dms.model.ReviewSource;
import com.kmg.dms.repo.DocumentRepository;
import com.kmg.dms.repo.ProcessedRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Writes documents together with the dedup marker of their source file.
 * <p>
 * Content is encrypted into the {@link ContentStore} first. Documents and the {@code processed_records} row are
 * then inserted in one transaction; if the (tenant, hash) marker already exists the transaction is rolled back
 * and the stored content removed again.
 */
@Service
public class DocumentPersistenceService {
    private static final Logger log = LoggerFactory.getLogger(DocumentPersistenceService.class);

    private final DocumentRepository documentRepository;
    private final ProcessedRecordRepository processedRecordRepository;
    private final ContentStore contentStore;
    private final RuleEngine ruleEngine;
    private final ReviewTaskService reviewTaskService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DocumentPersistenceService(
            DocumentRepository documentRepository,
            ProcessedRecordRepository processedRecordRepository,
            ContentStore contentStore,
            RuleEngine ruleEngine,
            ReviewTaskService reviewTaskService,
            TransactionTemplate transactionTemplate,
            Clock clock
    ) {
        this.documentRepository = documentRepository;
        this.processedRecordRepository = processedRecordRepository;
        this.contentStore = contentStore;
        this.ruleEngine = ruleEngine;
        this.reviewTaskService = reviewTaskService;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Persists the documents of one source file. A single document is linked from the processed record; split
     * sources leave the link empty. Returns empty when the source turned out to be a duplicate.
     */
    public Optional<List<DocumentRecord>> persist(
            String tenantId,
            String sourceIdentifier,
            String sourceHash,
            List<PendingDocument> pending,
            ReviewSource reviewSource
    ) {
        if (pending.isEmpty()) {
            throw new IllegalArgumentException("Nothing to persist for " + sourceIdentifier);
        }

        List<DocumentRecord> stored = new ArrayList<>(pending.size());
        try {
            for (PendingDocument item : pending) {
                ContentStore.StoredContent content = contentStore.store(item.draft().id(), item.content());
                stored.add(item.draft().withContent(
                        content.ref(),
                        content.encryption().bytesRead(),
                        content.encryption().contentHash()
                ));
            }

            String linkedDocumentId = stored.size() == 1 ? stored.get(0).id() : null;
            ProcessedRecord marker = new ProcessedRecord(
                    tenantId, sourceHash, sourceIdentifier, linkedDocumentId, OffsetDateTime.now(clock));

            Boolean created = transactionTemplate.execute(status -> {
                for (DocumentRecord document : stored) {
                    documentRepository.insert(document);
                }
                if (!processedRecordRepository.insertIfAbsent(marker)) {
                    status.setRollbackOnly();
                    return false;
                }
                return true;
            });

            if (!Boolean.TRUE.equals(created)) {
                log.info("Duplicate content for {} detected at commit, discarding", sourceIdentifier);
                discardContent(stored);
                return Optional.empty();
            }
        } catch (RuntimeException e) {
            discardContent(stored);
            throw e;
        }

        List<DocumentRecord> finished = new ArrayList<>(stored.size());
        for (DocumentRecord document : stored) {
            finished.add(finishCommitted(document, reviewSource));
        }
        return Optional.of(finished);
    }

    /**
     * Persists documents derived from an already stored document (re-processing splits). No processed record is
     * written; the source file's marker already exists.
     */
    public List<DocumentRecord> persistDerived(List<PendingDocument> pending, ReviewSource reviewSource) {
        List<DocumentRecord> stored = new ArrayList<>(pending.size());
        try {
            for (PendingDocument item : pending) {
                ContentStore.StoredContent content = contentStore.store(item.draft().id(), item.content());
                stored.add(item.draft().withContent(
                        content.ref(),
                        content.encryption().bytesRead(),
                        content.encryption().contentHash()
                ));
            }
            transactionTemplate.executeWithoutResult(status -> stored.forEach(documentRepository::insert));
        } catch (RuntimeException e) {
            discardContent(stored);
            throw e;
        }

        List<DocumentRecord> finished = new ArrayList<>(stored.size());
        for (DocumentRecord document : stored) {
            finished.add(finishCommitted(document, reviewSource));
        }
        return finished;
    }

    /**
     * Applies the matching rules to a freshly created document, and raises a review task if it still needs one.
     */
    public DocumentRecord finish(DocumentRecord document, ReviewSource reviewSource) {
        DocumentRecord updated;
        try {
            updated = ruleEngine.apply(document).document();
        } catch (RuntimeException e) {
            log.warn("Matching rules failed for document {}, keeping analysis result: {}", document.id(), e.getMessage());
            updated = document;
        }

        if (updated.status() == DocumentStatus.UNASSIGNED
                && updated.documentTypeId() == null
                && updated.employeeId() == null) {
            updated = updated.withStatus(DocumentStatus.REVIEW_NEEDED)
                    .withMetadata(updated.metadata().copy().put(DocumentMetadata.Key.NEEDS_REVIEW, true));
        }

        if (!updated.equals(document)) {
            documentRepository.updateClassification(updated);
        }
        if (updated.status() == DocumentStatus.REVIEW_NEEDED) {
            reviewTaskService.createReviewTask(updated, reviewSource);
        }
        return updated;
    }

    /**
     * The document is already committed at this point; failures here must not turn the source file into an error.
     */
    private DocumentRecord finishCommitted(DocumentRecord document, ReviewSource reviewSource) {
        try {
            return finish(document, reviewSource);
        } catch (RuntimeException e) {
            log.error("Post-commit processing failed for document {}", document.id(), e);
            return document;
        }
    }

    private void discardContent(List<DocumentRecord> stored) {
        for (DocumentRecord document : stored) {
            contentStore.delete(document.contentRef());
        }
    }

    public record PendingDocument(DocumentRecord draft, Path content) {
    }
}
