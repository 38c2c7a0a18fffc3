package com.kmg.dms.service;

import com.kmg.dms.model.RawArtifact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryArchiveSourceTest {

    @TempDir
    Path root;

    @Test
    void listsTenantFoldersAndSupportedFiles() throws IOException {
        Files.createDirectories(root.resolve("00000002/202502"));
        Files.createDirectories(root.resolve("00000001/202501"));
        Files.createDirectories(root.resolve("archive-old"));
        Files.createDirectories(root.resolve("123"));
        Files.writeString(root.resolve("00000001/202501/Lohnjournal.pdf"), "pdf");
        Files.writeString(root.resolve("00000001/202501/readme.md"), "md");
        Files.writeString(root.resolve("00000001/202501/desktop.ini"), "ini");
        Files.writeString(root.resolve("00000001/top.txt"), "top");

        DirectoryArchiveSource source = source();

        assertThat(source.tenantCodes()).containsExactly("00000001", "00000002");
        List<RawArtifact> artifacts = source.artifacts("00000001");
        assertThat(artifacts).extracting(RawArtifact::identifier)
                .containsExactlyInAnyOrder("00000001/202501/Lohnjournal.pdf", "00000001/top.txt");
        assertThat(source.artifacts("00000002")).isEmpty();

        RawArtifact top = artifacts.stream().filter(a -> a.identifier().endsWith("top.txt")).findFirst().orElseThrow();
        try (InputStream input = top.open()) {
            assertThat(new String(input.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("top");
        }
    }

    @Test
    void missingRootIsAnError() {
        DirectoryArchiveSource source = new DirectoryArchiveSource(root.resolve("missing"), "^\\d{8}$",
                List.of("pdf"), List.of());

        assertThatThrownBy(source::tenantCodes).isInstanceOf(IllegalStateException.class);
    }

    private DirectoryArchiveSource source() {
        return new DirectoryArchiveSource(root, "^\\d{8}$", List.of("pdf", "txt"),
                List.of("thumbs.db", "desktop.ini", ".ds_store"));
    }
}
