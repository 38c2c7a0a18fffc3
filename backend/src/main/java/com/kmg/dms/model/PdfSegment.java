package com.kmg.dms.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A contiguous page run of a source PDF written out as its own file. Page indexes are zero based.
 */
public record PdfSegment(
        List<Integer> pages,
        String subjectId,
        String tenantHint,
        Path file,
        String sourceFile
) {
    public PdfSegment {
        pages = List.copyOf(pages);
    }

    public int pageCount() {
        return pages.size();
    }
}
