package com.kmg.dms.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Archive identifier split into its conventional parts: {@code {tenant_code}/{YYYYMM}/{filename}}.
 * The month folder is optional; files directly below the tenant folder have none.
 */
public record ArchivePath(String identifier, String tenantCode, String monthFolder, String filename) {
    private static final Pattern MONTH_FOLDER = Pattern.compile("^\\d{6}$");

    public static Optional<ArchivePath> parse(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        String[] parts = identifier.replace('\\', '/').split("/");
        if (parts.length < 2 || parts[0].isBlank() || parts[parts.length - 1].isBlank()) {
            return Optional.empty();
        }
        String month = parts.length >= 3 && MONTH_FOLDER.matcher(parts[1]).matches() ? parts[1] : null;
        return Optional.of(new ArchivePath(identifier, parts[0], month, parts[parts.length - 1]));
    }

    public String extension() {
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public String stem() {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    public boolean isPdf() {
        return "pdf".equals(extension());
    }

    public Optional<Period> period() {
        return Period.parseFolder(monthFolder);
    }
}
