package com.kmg.dms.service;

import com.kmg.dms.model.CodePayload;
import com.kmg.dms.model.PdfSegment;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Splits batch scans that contain several employees into one PDF per contiguous page run.
 */
@Service
public class PdfSegmenter {
    private static final Logger log = LoggerFactory.getLogger(PdfSegmenter.class);

    private final CodeExtractor codeExtractor;

    public PdfSegmenter(CodeExtractor codeExtractor) {
        this.codeExtractor = codeExtractor;
    }

    public int countPages(Path pdf) {
        try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
            return document.getNumberOfPages();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open PDF: " + pdf, e);
        }
    }

    /**
     * Writes one PDF per subject run into {@code outputDir}. Returns an empty list when the source has at most
     * one page or fewer than two runs carry a subject id.
     */
    public List<PdfSegment> segment(Path sourcePdf, Path outputDir) {
        return segment(sourcePdf, sourcePdf.getFileName().toString(), outputDir);
    }

    /**
     * Same as {@link #segment(Path, Path)} with segment files named after {@code sourceName}.
     */
    public List<PdfSegment> segment(Path sourcePdf, String sourceName, Path outputDir) {
        try (PDDocument source = Loader.loadPDF(sourcePdf.toFile())) {
            return segment(source, sourceName, outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to split PDF: " + sourcePdf, e);
        }
    }

    public List<PdfSegment> segment(byte[] pdfBytes, String sourceName, Path outputDir) {
        try (PDDocument source = Loader.loadPDF(pdfBytes)) {
            return segment(source, sourceName, outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to split PDF: " + sourceName, e);
        }
    }

    private List<PdfSegment> segment(PDDocument source, String sourceName, Path outputDir) throws IOException {
        int totalPages = source.getNumberOfPages();
        if (totalPages <= 1) {
            return List.of();
        }

        PDFRenderer renderer = new PDFRenderer(source);
        List<String> pageSubjects = new ArrayList<>(totalPages);
        String tenantHint = null;
        for (int page = 0; page < totalPages; page++) {
            String subjectId = null;
            try {
                for (String raw : codeExtractor.decodePage(renderer, page)) {
                    subjectId = CodePayload.parseSubjectId(raw);
                    if (subjectId != null) {
                        if (tenantHint == null) {
                            tenantHint = CodePayload.tenantHint(raw);
                        }
                        break;
                    }
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Could not decode page {} of {}: {}", page, sourceName, e.getMessage());
            }
            pageSubjects.add(subjectId);
        }

        List<PageRun> runs = planRuns(pageSubjects);
        if (runs.isEmpty()) {
            log.info("Single subject in {}, not splitting", sourceName);
            return List.of();
        }

        Files.createDirectories(outputDir);
        String baseName = stem(sourceName);
        Map<String, Integer> occurrences = new HashMap<>();
        List<PdfSegment> segments = new ArrayList<>(runs.size());

        for (PageRun run : runs) {
            int occurrence = occurrences.merge(run.subjectId(), 1, Integer::sum);
            String suffix = occurrence > 1 ? "_" + occurrence : "";
            Path target = outputDir.resolve(baseName + "_MA" + run.subjectId() + suffix + ".pdf");

            try (PDDocument split = new PDDocument()) {
                for (int pageIndex : run.pages()) {
                    split.importPage(source.getPage(pageIndex));
                }
                split.save(target.toFile());
            }
            segments.add(new PdfSegment(run.pages(), run.subjectId(), tenantHint, target, sourceName));
            log.info("Wrote {} ({} pages, subject {})", target.getFileName(), run.pages().size(), run.subjectId());
        }
        return segments;
    }

    /**
     * Groups pages into contiguous runs. A page with a subject id different from the current run's starts a new
     * run; a page without one continues the current run. A leading run without subject is merged into the next
     * run. Returns an empty list unless at least two runs carry a subject id.
     */
    static List<PageRun> planRuns(List<String> pageSubjects) {
        List<PageRun> runs = new ArrayList<>();
        String currentSubject = null;
        List<Integer> currentPages = new ArrayList<>();

        for (int page = 0; page < pageSubjects.size(); page++) {
            String subject = blankToNull(pageSubjects.get(page));
            if (subject != null && !subject.equals(currentSubject)) {
                if (!currentPages.isEmpty()) {
                    runs.add(new PageRun(currentSubject, currentPages));
                }
                currentSubject = subject;
                currentPages = new ArrayList<>();
            }
            currentPages.add(page);
        }
        if (!currentPages.isEmpty()) {
            runs.add(new PageRun(currentSubject, currentPages));
        }

        long withSubject = runs.stream().map(PageRun::subjectId).filter(Objects::nonNull).count();
        if (withSubject <= 1) {
            return List.of();
        }

        if (runs.get(0).subjectId() == null) {
            PageRun leading = runs.remove(0);
            PageRun next = runs.remove(0);
            List<Integer> merged = new ArrayList<>(leading.pages());
            merged.addAll(next.pages());
            runs.add(0, new PageRun(next.subjectId(), merged));
        }
        return List.copyOf(runs);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String stem(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    record PageRun(String subjectId, List<Integer> pages) {
        PageRun {
            pages = List.copyOf(pages);
        }
    }
}
