package com.kmg.dms.model;

import java.time.OffsetDateTime;
import java.util.List;

public record DocumentRecord(
        String id,
        String tenantId,
        String title,
        String originalFilename,
        String fileExtension,
        String mimeType,
        String contentRef,
        long fileSize,
        String contentHash,
        DocumentStatus status,
        DocumentSource source,
        DocumentMetadata metadata,
        List<String> tags,
        String employeeId,
        String documentTypeId,
        Integer periodYear,
        Integer periodMonth,
        String notes,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public DocumentRecord {
        metadata = metadata == null ? new DocumentMetadata() : metadata;
        tags = tags == null ? List.of() : List.copyOf(tags);
        notes = notes == null ? "" : notes;
    }

    public DocumentRecord withStatus(DocumentStatus newStatus) {
        return new DocumentRecord(id, tenantId, title, originalFilename, fileExtension, mimeType, contentRef,
                fileSize, contentHash, newStatus, source, metadata, tags, employeeId, documentTypeId,
                periodYear, periodMonth, notes, createdAt, updatedAt);
    }

    public DocumentRecord withEmployeeId(String newEmployeeId) {
        return new DocumentRecord(id, tenantId, title, originalFilename, fileExtension, mimeType, contentRef,
                fileSize, contentHash, status, source, metadata, tags, newEmployeeId, documentTypeId,
                periodYear, periodMonth, notes, createdAt, updatedAt);
    }

    public DocumentRecord withDocumentTypeId(String newDocumentTypeId) {
        return new DocumentRecord(id, tenantId, title, originalFilename, fileExtension, mimeType, contentRef,
                fileSize, contentHash, status, source, metadata, tags, employeeId, newDocumentTypeId,
                periodYear, periodMonth, notes, createdAt, updatedAt);
    }

    public DocumentRecord withTags(List<String> newTags) {
        return new DocumentRecord(id, tenantId, title, originalFilename, fileExtension, mimeType, contentRef,
                fileSize, contentHash, status, source, metadata, newTags, employeeId, documentTypeId,
                periodYear, periodMonth, notes, createdAt, updatedAt);
    }

    public DocumentRecord withMetadata(DocumentMetadata newMetadata) {
        return new DocumentRecord(id, tenantId, title, originalFilename, fileExtension, mimeType, contentRef,
                fileSize, contentHash, status, source, newMetadata, tags, employeeId, documentTypeId,
                periodYear, periodMonth, notes, createdAt, updatedAt);
    }

    public DocumentRecord withNotes(String newNotes) {
        return new DocumentRecord(id, tenantId, title, originalFilename, fileExtension, mimeType, contentRef,
                fileSize, contentHash, status, source, metadata, tags, employeeId, documentTypeId,
                periodYear, periodMonth, newNotes, createdAt, updatedAt);
    }

    public DocumentRecord withContent(String newContentRef, long newFileSize, String newContentHash) {
        return new DocumentRecord(id, tenantId, title, originalFilename, fileExtension, mimeType, newContentRef,
                newFileSize, newContentHash, status, source, metadata, tags, employeeId, documentTypeId,
                periodYear, periodMonth, notes, createdAt, updatedAt);
    }

    public boolean isPdf() {
        return "application/pdf".equals(mimeType) || ".pdf".equalsIgnoreCase(fileExtension);
    }
}
