package com.kmg.dms.service;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.DecodeHintType;
import com.google.zxing.LuminanceSource;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.multi.GenericMultipleBarcodeReader;
import com.kmg.dms.config.DmsProperties;
import com.kmg.dms.model.CodeExtractionResult;
import com.kmg.dms.model.CodePayload;
import com.kmg.dms.model.DecodedCode;
import jakarta.annotation.PreDestroy;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Renders PDF pages and decodes the 2D matrix codes printed on them.
 */
@Service
public class CodeExtractor {
    private static final Logger log = LoggerFactory.getLogger(CodeExtractor.class);

    static final float RENDER_SCALE = 1.5f;

    private static final Map<DecodeHintType, Object> HINTS = buildHints();

    private final ThreadPoolExecutor decodeExecutor;

    /**
     * One decode thread per scan worker. Timed-out renders keep their thread until PDFBox returns, so later
     * extractions queue behind them instead of spawning more threads.
     */
    public CodeExtractor(DmsProperties properties) {
        int threads = Math.max(1, properties.getScan().getMaxWorkers());
        this.decodeExecutor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), daemonThreads());
    }

    /**
     * Decodes up to {@code maxPages} pages of the PDF within {@code timeout}. An expired deadline is reported as
     * a successful extraction without codes; any other failure as {@code success=false}.
     */
    public CodeExtractionResult extract(byte[] pdfBytes, int maxPages, Duration timeout) {
        return runWithDeadline("in-memory PDF", () -> {
            try (PDDocument document = Loader.loadPDF(pdfBytes)) {
                return scan(document, maxPages);
            }
        }, timeout);
    }

    public CodeExtractionResult extract(Path pdf, int maxPages, Duration timeout) {
        return runWithDeadline(pdf.getFileName().toString(), () -> {
            try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
                return scan(document, maxPages);
            }
        }, timeout);
    }

    /**
     * Raw payloads of every code on one page, in reader order.
     */
    public List<String> decodePage(PDFRenderer renderer, int pageIndex) throws IOException {
        BufferedImage image = renderer.renderImage(pageIndex, RENDER_SCALE, ImageType.RGB);
        return decode(image);
    }

    List<String> decode(BufferedImage image) {
        LuminanceSource source = new BufferedImageLuminanceSource(image);
        BinaryBitmap bitmap = new BinaryBitmap(new HybridBinarizer(source));
        try {
            Result[] results = new GenericMultipleBarcodeReader(new MultiFormatReader()).decodeMultiple(bitmap, HINTS);
            List<String> payloads = new ArrayList<>(results.length);
            for (Result result : results) {
                if (result.getText() != null) {
                    payloads.add(result.getText());
                }
            }
            return payloads;
        } catch (NotFoundException e) {
            return List.of();
        }
    }

    private CodeExtractionResult scan(PDDocument document, int maxPages) throws IOException {
        PDFRenderer renderer = new PDFRenderer(document);
        int pages = Math.min(document.getNumberOfPages(), Math.max(1, maxPages));

        List<DecodedCode> codes = new ArrayList<>();
        List<String> subjectIds = new ArrayList<>();
        Map<String, String> fields = new LinkedHashMap<>();
        String tenantHint = null;

        for (int page = 0; page < pages; page++) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            for (String raw : decodePage(renderer, page)) {
                codes.add(new DecodedCode(page, raw));

                String subjectId = CodePayload.parseSubjectId(raw);
                if (subjectId != null && !subjectIds.contains(subjectId)) {
                    subjectIds.add(subjectId);
                }
                Map<String, String> parsed = CodePayload.parseFields(raw);
                if (!parsed.isEmpty()) {
                    fields = parsed;
                }
                if (tenantHint == null) {
                    tenantHint = CodePayload.tenantHint(raw);
                }
            }
            if (!subjectIds.isEmpty()) {
                break;
            }
        }
        return new CodeExtractionResult(true, null, codes, subjectIds, tenantHint, fields);
    }

    private CodeExtractionResult runWithDeadline(String label, DecodeTask task, Duration timeout) {
        Future<CodeExtractionResult> future = decodeExecutor.submit(task::run);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Code extraction timed out after {} ms for {}", timeout.toMillis(), label);
            return CodeExtractionResult.timedOut();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Code extraction failed for {}: {}", label, cause.getMessage());
            return CodeExtractionResult.failed(String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return CodeExtractionResult.failed("Interrupted");
        }
    }

    int decodeThreads() {
        return decodeExecutor.getMaximumPoolSize();
    }

    @PreDestroy
    public void shutdown() {
        decodeExecutor.shutdownNow();
    }

    private static Map<DecodeHintType, Object> buildHints() {
        Map<DecodeHintType, Object> hints = new EnumMap<>(DecodeHintType.class);
        hints.put(DecodeHintType.POSSIBLE_FORMATS, List.of(BarcodeFormat.DATA_MATRIX, BarcodeFormat.QR_CODE));
        hints.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
        hints.put(DecodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
        return hints;
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "code-decode-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @FunctionalInterface
    private interface DecodeTask {
        CodeExtractionResult run() throws IOException;
    }
}
