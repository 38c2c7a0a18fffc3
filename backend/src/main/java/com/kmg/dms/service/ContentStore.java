package com.kmg.dms.service;

import com.kmg.dms.config.DmsProperties;
import com.kmg.dms.model.DocumentRecord;
import com.kmg.dms.model.EncryptionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Encrypted content files addressed by document id: {@code {contentDir}/{id[0..2]}/{id}.enc}.
 */
@Service
public class ContentStore {
    private static final Logger log = LoggerFactory.getLogger(ContentStore.class);

    private final Path root;
    private final StreamingCipher cipher;

    @Autowired
    public ContentStore(DmsProperties properties, StreamingCipher cipher) {
        this(Path.of(properties.getStorage().getContentDir()), cipher);
    }

    public ContentStore(Path root, StreamingCipher cipher) {
        this.root = root.toAbsolutePath().normalize();
        this.cipher = cipher;
    }

    public StoredContent store(String documentId, InputStream plain) {
        String ref = referenceFor(documentId);
        Path target = resolve(ref);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), documentId, ".part");
            EncryptionResult result;
            try (OutputStream out = Files.newOutputStream(temp)) {
                result = cipher.encryptStream(plain, out);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return new StoredContent(ref, result);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Failed to store content for document " + documentId, e);
        }
    }

    public StoredContent store(String documentId, Path plainFile) {
        try (InputStream input = Files.newInputStream(plainFile)) {
            return store(documentId, input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + plainFile, e);
        }
    }

    public long open(DocumentRecord document, OutputStream output) {
        Path source = resolve(document.contentRef());
        try (InputStream input = Files.newInputStream(source)) {
            return cipher.decryptStream(input, output);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read content of document " + document.id(), e);
        }
    }

    public void delete(String ref) {
        deleteQuietly(resolve(ref));
    }

    public boolean exists(String ref) {
        return Files.exists(resolve(ref));
    }

    private String referenceFor(String documentId) {
        String shard = documentId.length() >= 2 ? documentId.substring(0, 2) : "00";
        return shard + "/" + documentId + ".enc";
    }

    private Path resolve(String ref) {
        Path resolved = root.resolve(ref).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Content reference escapes the store: " + ref);
        }
        return resolved;
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
        }
    }

    public record StoredContent(String ref, EncryptionResult encryption) {
    }
}
