package com.kmg.dms.service;

import com.kmg.dms.config.DmsProperties;
import com.kmg.dms.model.CodeExtractionResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CodeExtractorTest {

    @TempDir
    Path tempDir;

    private final CodeExtractor extractor = new CodeExtractor(new DmsProperties());

    @AfterEach
    void tearDown() {
        extractor.shutdown();
    }

    @Test
    void decodesSubjectAndFieldsFromFirstPage() throws IOException {
        Path pdf = TestPdfs.write(tempDir.resolve("payslip.pdf"),
                List.of("DDLGA;MD1;PN1;UNjane.doe;ED01.12.2025;ES12/2025;YR2025"));

        CodeExtractionResult result = extractor.extract(pdf, 1, Duration.ofSeconds(30));

        assertThat(result.success()).isTrue();
        assertThat(result.subjectIds()).containsExactly("1");
        assertThat(result.tenantHint()).isEqualTo("1");
        assertThat(result.fields()).containsEntry("username", "jane.doe");
        assertThat(result.codes()).hasSize(1);
    }

    @Test
    void pageWithoutCodesYieldsEmptySuccess() throws IOException {
        byte[] pdf = TestPdfs.bytes(Arrays.asList((String) null));

        CodeExtractionResult result = extractor.extract(pdf, 1, Duration.ofSeconds(30));

        assertThat(result.success()).isTrue();
        assertThat(result.hasCodes()).isFalse();
        assertThat(result.hasSubjects()).isFalse();
    }

    @Test
    void unreadablePdfIsReportedAsFailure() {
        CodeExtractionResult result = extractor.extract("not a pdf".getBytes(), 1, Duration.ofSeconds(30));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isNotBlank();
    }

    @Test
    void expiredDeadlineCountsAsSuccessWithoutCodes() throws IOException {
        byte[] pdf = TestPdfs.bytes(Arrays.asList(null, null, null, null, "MD1;PN10"));

        CodeExtractionResult result = extractor.extract(pdf, 5, Duration.ofMillis(1));

        assertThat(result.success()).isTrue();
        assertThat(result.codes()).isEmpty();
        assertThat(result.hasSubjects()).isFalse();
    }

    @Test
    void decodePoolIsBoundedByScanWorkers() throws IOException {
        DmsProperties properties = new DmsProperties();
        properties.getScan().setMaxWorkers(2);
        CodeExtractor bounded = new CodeExtractor(properties);
        try {
            byte[] pdf = TestPdfs.bytes(Arrays.asList(null, null, null));
            for (int i = 0; i < 6; i++) {
                bounded.extract(pdf, 3, Duration.ofMillis(1));
            }

            assertThat(bounded.decodeThreads()).isEqualTo(2);
            CodeExtractionResult result = bounded.extract(
                    TestPdfs.bytes(List.of("MD1;PN7")), 1, Duration.ofSeconds(60));
            assertThat(result.subjectIds()).containsExactly("7");
        } finally {
            bounded.shutdown();
        }
    }

    @Test
    void decodesDataMatrixImage() {
        assertThat(extractor.decode(TestPdfs.dataMatrix("PN42"))).containsExactly("PN42");
    }
}
