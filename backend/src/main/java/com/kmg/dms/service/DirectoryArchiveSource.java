package com.kmg.dms.service;

import com.kmg.dms.config.DmsProperties;
import com.kmg.dms.model.RawArtifact;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Archive on the local filesystem. Identifiers are paths relative to the root with {@code /} separators.
 */
@Service
public class DirectoryArchiveSource implements ArchiveSource {
    private final Path root;
    private final Pattern tenantFolderPattern;
    private final Set<String> supportedExtensions;
    private final Set<String> skipNames;

    @Autowired
    public DirectoryArchiveSource(DmsProperties properties) {
        this(
                Path.of(properties.getArchive().getRootDir()),
                properties.getArchive().getTenantFolderPattern(),
                properties.getArchive().getSupportedExtensions(),
                properties.getArchive().getSkipNames()
        );
    }

    public DirectoryArchiveSource(Path root, String tenantFolderPattern, List<String> supportedExtensions,
                                  List<String> skipNames) {
        this.root = root.toAbsolutePath().normalize();
        this.tenantFolderPattern = Pattern.compile(tenantFolderPattern);
        this.supportedExtensions = lowerCase(supportedExtensions);
        this.skipNames = lowerCase(skipNames);
    }

    @Override
    public String name() {
        return "local:" + root;
    }

    @Override
    public List<String> tenantCodes() {
        if (!Files.isDirectory(root)) {
            throw new IllegalStateException("Archive root does not exist: " + root);
        }
        try (Stream<Path> children = Files.list(root)) {
            return children.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> tenantFolderPattern.matcher(name).matches())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list archive root " + root, e);
        }
    }

    @Override
    public List<RawArtifact> artifacts(String tenantCode) {
        Path tenantDir = root.resolve(tenantCode);
        if (!Files.isDirectory(tenantDir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.walk(tenantDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .sorted(Comparator.comparing(Path::toString))
                    .map(this::toArtifact)
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk tenant folder " + tenantDir, e);
        }
    }

    private RawArtifact toArtifact(Path file) {
        String identifier = root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            size = -1L;
        }
        return new RawArtifact(identifier, size, () -> Files.newInputStream(file));
    }

    private boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (skipNames.contains(name)) {
            return false;
        }
        int idx = name.lastIndexOf('.');
        if (idx < 0) {
            return false;
        }
        return supportedExtensions.contains(name.substring(idx + 1));
    }

    private static Set<String> lowerCase(List<String> values) {
        return values.stream()
                .map(value -> value.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toUnmodifiableSet());
    }
}
