package com.kmg.dms.model;

import java.io.IOException;
import java.io.InputStream;

/**
 * One candidate file offered by an archive source. The content stream is opened lazily and read once.
 */
public record RawArtifact(String identifier, long sizeHint, ContentOpener content) {

    public InputStream open() throws IOException {
        return content.open();
    }

    @FunctionalInterface
    public interface ContentOpener {
        InputStream open() throws IOException;
    }
}
