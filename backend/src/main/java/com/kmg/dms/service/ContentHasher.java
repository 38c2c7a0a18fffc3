package com.kmg.dms.service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Chunked SHA-256 over streams. Content is never buffered as a whole.
 */
public final class ContentHasher {
    public static final int CHUNK_SIZE = 64 * 1024;

    private ContentHasher() {
    }

    public static String hash(InputStream input) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[CHUNK_SIZE];
        int read;
        while ((read = input.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Copies {@code input} to {@code output} and returns the SHA-256 of the copied bytes.
     */
    public static String copyAndHash(InputStream input, OutputStream output) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[CHUNK_SIZE];
        int read;
        while ((read = input.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
            output.write(buffer, 0, read);
        }
        output.flush();
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String hash(Path file) {
        try (InputStream input = Files.newInputStream(file)) {
            return hash(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash " + file, e);
        }
    }

    public static String hash(byte[] data) {
        return HexFormat.of().formatHex(newDigest().digest(data));
    }

    static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
