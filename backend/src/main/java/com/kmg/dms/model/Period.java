package com.kmg.dms.model;

import java.util.Optional;
import java.util.regex.Pattern;

public record Period(int year, int month) {
    private static final Pattern FOLDER = Pattern.compile("^\\d{6}$");

    /**
     * Parses a {@code YYYYMM} folder name. Months outside 1..12 and years outside 2000..2100 yield empty.
     */
    public static Optional<Period> parseFolder(String folder) {
        if (folder == null || !FOLDER.matcher(folder).matches()) {
            return Optional.empty();
        }
        int year = Integer.parseInt(folder.substring(0, 4));
        int month = Integer.parseInt(folder.substring(4, 6));
        if (month < 1 || month > 12 || year < 2000 || year > 2100) {
            return Optional.empty();
        }
        return Optional.of(new Period(year, month));
    }
}
