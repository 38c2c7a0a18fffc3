package com.kmg.dms.service;

import com.kmg.dms.model.EncryptionResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * AES-GCM content encryption.
 * <p>
 * The streaming format is a sequence of independent frames, one per 64 KiB plaintext chunk:
 * {@code [4-byte big-endian length of ciphertext+tag][12-byte nonce][ciphertext+tag]}. Every chunk gets a fresh
 * random nonce. The legacy blob format is a single {@code [nonce][ciphertext+tag]} and is limited to
 * {@link #MAX_BLOB_BYTES} of plaintext.
 */
@Component
public class StreamingCipher {
    public static final int CHUNK_SIZE = ContentHasher.CHUNK_SIZE;
    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;
    public static final long MAX_BLOB_BYTES = 100L * 1024 * 1024;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";

    private final SecretKey key;
    private final SecureRandom random;

    @Autowired
    public StreamingCipher(SecretKey key) {
        this(key, new SecureRandom());
    }

    StreamingCipher(SecretKey key, SecureRandom random) {
        this.key = key;
        this.random = random;
    }

    public EncryptionResult encryptStream(InputStream input, OutputStream output) throws IOException {
        MessageDigest digest = ContentHasher.newDigest();
        DataOutputStream out = new DataOutputStream(output);
        byte[] chunk = new byte[CHUNK_SIZE];
        long bytesRead = 0;
        long bytesWritten = 0;

        int filled;
        while ((filled = input.readNBytes(chunk, 0, CHUNK_SIZE)) > 0) {
            digest.update(chunk, 0, filled);
            bytesRead += filled;

            byte[] nonce = newNonce();
            byte[] sealed = seal(nonce, chunk, filled);
            out.writeInt(sealed.length);
            out.write(nonce);
            out.write(sealed);
            bytesWritten += 4L + NONCE_LENGTH + sealed.length;
        }
        out.flush();
        return new EncryptionResult(HexFormat.of().formatHex(digest.digest()), bytesRead, bytesWritten);
    }

    public long decryptStream(InputStream input, OutputStream output) throws IOException {
        byte[] header = new byte[4];
        byte[] nonce = new byte[NONCE_LENGTH];
        long bytesWritten = 0;
        long frame = 0;

        while (true) {
            int headerRead = input.readNBytes(header, 0, header.length);
            if (headerRead == 0) {
                break;
            }
            if (headerRead < header.length) {
                throw new FramingException("Truncated length prefix in frame " + frame);
            }
            int length = ByteBuffer.wrap(header).getInt();
            if (length < TAG_LENGTH || length > CHUNK_SIZE + TAG_LENGTH) {
                throw new FramingException("Invalid frame length " + length + " in frame " + frame);
            }
            if (input.readNBytes(nonce, 0, NONCE_LENGTH) < NONCE_LENGTH) {
                throw new FramingException("Truncated nonce in frame " + frame);
            }
            byte[] sealed = input.readNBytes(length);
            if (sealed.length < length) {
                throw new FramingException("Truncated ciphertext in frame " + frame);
            }

            byte[] plain = open(nonce, sealed, 0, sealed.length);
            output.write(plain);
            bytesWritten += plain.length;
            frame++;
        }
        output.flush();
        return bytesWritten;
    }

    /**
     * Encrypts a payload in one piece. {@code declaredSize} is checked before anything is read.
     */
    public byte[] encryptBlob(InputStream input, long declaredSize) throws IOException {
        if (declaredSize > MAX_BLOB_BYTES) {
            throw new PayloadTooLargeException(declaredSize);
        }
        byte[] plain = input.readNBytes((int) MAX_BLOB_BYTES + 1);
        if (plain.length > MAX_BLOB_BYTES) {
            throw new PayloadTooLargeException(plain.length);
        }
        return encryptBlob(plain);
    }

    public byte[] encryptBlob(byte[] plain) {
        if (plain.length > MAX_BLOB_BYTES) {
            throw new PayloadTooLargeException(plain.length);
        }
        byte[] nonce = newNonce();
        byte[] sealed = seal(nonce, plain, plain.length);
        return ByteBuffer.allocate(NONCE_LENGTH + sealed.length).put(nonce).put(sealed).array();
    }

    public byte[] decryptBlob(byte[] blob) {
        if (blob.length < NONCE_LENGTH + TAG_LENGTH) {
            throw new FramingException("Blob too short: " + blob.length + " bytes");
        }
        byte[] nonce = new byte[NONCE_LENGTH];
        System.arraycopy(blob, 0, nonce, 0, NONCE_LENGTH);
        return open(nonce, blob, NONCE_LENGTH, blob.length - NONCE_LENGTH);
    }

    private byte[] newNonce() {
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        return nonce;
    }

    private byte[] seal(byte[] nonce, byte[] plain, int length) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            return cipher.doFinal(plain, 0, length);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    private byte[] open(byte[] nonce, byte[] sealed, int offset, int length) {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, nonce));
            return cipher.doFinal(sealed, offset, length);
        } catch (AEADBadTagException e) {
            throw new AuthenticationFailedException(e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM decryption failed", e);
        }
    }

    public static class FramingException extends RuntimeException {
        public FramingException(String message) {
            super(message);
        }
    }

    public static class AuthenticationFailedException extends RuntimeException {
        public AuthenticationFailedException(Throwable cause) {
            super("Ciphertext failed authentication", cause);
        }
    }

    public static class PayloadTooLargeException extends RuntimeException {
        public PayloadTooLargeException(long size) {
            super("Payload of " + size + " bytes exceeds the " + MAX_BLOB_BYTES + " byte limit");
        }
    }
}
