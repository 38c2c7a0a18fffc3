package com.kmg.dms.service;

import com.kmg.dms.config.DmsProperties;
import com.kmg.dms.model.Classification;
import com.kmg.dms.model.CodeExtractionResult;
import com.kmg.dms.model.CodePayload;
import com.kmg.dms.model.DocumentMetadata;
import com.kmg.dms.model.DocumentStatus;
import com.kmg.dms.model.Employee;
import com.kmg.dms.model.Tenant;
import com.kmg.dms.repo.DocumentTypeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Classification of a single (not split) file: filename table, embedded codes for PDFs, identity and the
 * resulting status.
 */
@Service
public class DocumentAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(DocumentAnalyzer.class);

    private static final Map<String, DocumentMetadata.Key> CODE_FIELD_KEYS = Map.of(
            CodePayload.Tag.UN.field(), DocumentMetadata.Key.CODE_USERNAME,
            CodePayload.Tag.ED.field(), DocumentMetadata.Key.CODE_EFFECTIVE_DATE,
            CodePayload.Tag.ES.field(), DocumentMetadata.Key.CODE_PERIOD,
            CodePayload.Tag.YR.field(), DocumentMetadata.Key.CODE_YEAR
    );

    private final DocumentClassifier classifier;
    private final CodeExtractor codeExtractor;
    private final IdentityResolver identityResolver;
    private final DocumentTypeRepository documentTypeRepository;
    private final int codePages;
    private final Duration codeTimeout;

    public DocumentAnalyzer(
            DocumentClassifier classifier,
            CodeExtractor codeExtractor,
            IdentityResolver identityResolver,
            DocumentTypeRepository documentTypeRepository,
            DmsProperties properties
    ) {
        this.classifier = classifier;
        this.codeExtractor = codeExtractor;
        this.identityResolver = identityResolver;
        this.documentTypeRepository = documentTypeRepository;
        this.codePages = properties.getScan().getCodePages();
        this.codeTimeout = properties.getScan().getCodeTimeout();
    }

    public Classification classify(String filename) {
        return classifier.classify(filename);
    }

    public Analysis analyze(Tenant tenant, Path content, String filename, boolean pdf) {
        Classification classification = classifier.classify(filename);
        DocumentMetadata metadata = new DocumentMetadata();
        boolean subjectSpecific = classification.subjectSpecific();
        Employee employee = null;

        if (pdf) {
            CodeExtractionResult codes = codeExtractor.extract(content, codePages, codeTimeout);
            describeCodes(codes, metadata);
            if (codes.hasSubjects()) {
                subjectSpecific = true;
                for (String subjectId : codes.subjectIds()) {
                    Optional<Employee> resolved = identityResolver.resolve(subjectId, tenant, codes.tenantHint());
                    if (resolved.isPresent()) {
                        employee = resolved.get();
                        break;
                    }
                }
                if (employee == null) {
                    log.info("No employee for codes {} in {}", codes.subjectIds(), filename);
                }
            } else if (codes.hasCodes()) {
                subjectSpecific = true;
            }
        }

        DocumentStatus status = decideStatus(employee != null, subjectSpecific, classification);
        metadata.put(DocumentMetadata.Key.DOC_TYPE, classification.type())
                .put(DocumentMetadata.Key.DOC_TYPE_DESCRIPTION, classification.description())
                .put(DocumentMetadata.Key.CATEGORY_CODE, classification.categoryCode())
                .put(DocumentMetadata.Key.SUBJECT_SPECIFIC, subjectSpecific)
                .put(DocumentMetadata.Key.NEEDS_REVIEW, status == DocumentStatus.REVIEW_NEEDED);

        return new Analysis(
                classification,
                documentTypeId(tenant, classification),
                employee == null ? null : employee.id(),
                status,
                metadata
        );
    }

    /**
     * Document type row for a known classification, created on first use. Null for unknown documents.
     */
    public String documentTypeId(Tenant tenant, Classification classification) {
        if (!classification.isKnown()) {
            return null;
        }
        return documentTypeRepository.getOrCreate(tenant.id(), classification).id();
    }

    static DocumentStatus decideStatus(boolean employeeResolved, boolean subjectSpecific,
                                       Classification classification) {
        if (employeeResolved) {
            return DocumentStatus.ASSIGNED;
        }
        if (subjectSpecific) {
            return DocumentStatus.REVIEW_NEEDED;
        }
        if (classification.isKnown()) {
            return DocumentStatus.COMPANY;
        }
        return DocumentStatus.UNASSIGNED;
    }

    private static void describeCodes(CodeExtractionResult codes, DocumentMetadata metadata) {
        metadata.put(DocumentMetadata.Key.CODES_FOUND, codes.codes().size());
        if (!codes.subjectIds().isEmpty()) {
            metadata.put(DocumentMetadata.Key.CODE_SUBJECT_IDS, String.join(",", codes.subjectIds()));
        }
        metadata.put(DocumentMetadata.Key.CODE_TENANT_HINT, codes.tenantHint());
        metadata.put(DocumentMetadata.Key.CODE_ERROR, codes.error());
        codes.fields().forEach((field, value) -> {
            DocumentMetadata.Key key = CODE_FIELD_KEYS.get(field);
            if (key != null) {
                metadata.put(key, value);
            }
        });
    }

    public record Analysis(
            Classification classification,
            String documentTypeId,
            String employeeId,
            DocumentStatus status,
            DocumentMetadata metadata
    ) {
    }
}
