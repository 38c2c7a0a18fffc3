package com.kmg.dms.model;

/**
 * Outcome of a streaming encryption: SHA-256 of the plaintext and the byte counts on both sides.
 */
public record EncryptionResult(String contentHash, long bytesRead, long bytesWritten) {
}
