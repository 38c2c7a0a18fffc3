package com.kmg.dms.service;

import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

@Service
public class MediaTypeDetector {
    private static final Logger log = LoggerFactory.getLogger(MediaTypeDetector.class);

    static final String FALLBACK = "application/octet-stream";

    private final Tika tika;

    public MediaTypeDetector(Tika tika) {
        this.tika = tika;
    }

    /**
     * Detects from content, using {@code filename} as a hint.
     */
    public String detect(Path file, String filename) {
        try {
            try (InputStream input = Files.newInputStream(file)) {
                String detected = tika.detect(input, filename);
                return detected == null ? FALLBACK : detected;
            }
        } catch (IOException e) {
            log.warn("Media type detection failed for {}: {}", filename, e.getMessage());
            return FALLBACK;
        }
    }
}
