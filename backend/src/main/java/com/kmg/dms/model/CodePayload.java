package com.kmg.dms.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the payload carried by 2D codes on payroll prints, e.g.
 * {@code DDLGA;MD1;PN1;UNjane.doe;ED01.12.2025;ES12/2025;YR2025}. Tokens are separated by {@code ;}
 * and start with a two letter tag; there is no escaping.
 */
public final class CodePayload {

    public enum Tag {
        PN("subject_id"),
        MD("tenant_hint"),
        UN("username"),
        ED("effective_date"),
        ES("period"),
        YR("year");

        private final String field;

        Tag(String field) {
            this.field = field;
        }

        public String field() {
            return field;
        }
    }

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    // Older print layouts, tried in order after the tagged form.
    private static final List<Pattern> LEGACY_SUBJECT_PATTERNS = List.of(
            Pattern.compile(";PN(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^PN(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("PN(\\d+);", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\^1008=([^^\\s]+)\\^", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\^1010=(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("PersNr[:\\s]*(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Personalnummer[:\\s]*(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("PersonalNr[:\\s]*(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("MA[:\\s]*(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("EmpID[:\\s]*(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("EmployeeID[:\\s]*(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(\\d{4,8})$"),
            Pattern.compile("\\|(\\d+)\\|"),
            Pattern.compile("=(\\d{1,10})\\^")
    );

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[|;,\\s^=]+");

    private CodePayload() {
    }

    /**
     * Returns the tagged fields of a payload keyed by field name (see {@link Tag#field()}).
     * Unknown tags are ignored; a repeated tag keeps its last value.
     */
    public static Map<String, String> parseFields(String raw) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return fields;
        }
        for (String token : raw.strip().split(";")) {
            if (token.length() < 2) {
                continue;
            }
            String prefix = token.substring(0, 2);
            for (Tag tag : Tag.values()) {
                if (tag.name().equals(prefix)) {
                    fields.put(tag.field(), token.substring(2));
                    break;
                }
            }
        }
        return fields;
    }

    public static String tenantHint(String raw) {
        String hint = parseFields(raw).get(Tag.MD.field());
        return hint == null || hint.isBlank() ? null : hint;
    }

    /**
     * Extracts the numeric subject (personnel) id, or null when the payload carries none.
     */
    public static String parseSubjectId(String raw) {
        if (raw == null) {
            return null;
        }
        String data = raw.strip();
        if (data.isEmpty()) {
            return null;
        }
        if (isDigits(data)) {
            return data;
        }

        for (Pattern pattern : LEGACY_SUBJECT_PATTERNS) {
            Matcher matcher = pattern.matcher(data);
            if (matcher.find()) {
                String value = matcher.group(1);
                if (isDigits(value)) {
                    return value;
                }
                Matcher digits = DIGITS.matcher(value);
                if (digits.find()) {
                    return digits.group();
                }
            }
        }

        if (data.contains(";")) {
            for (String part : data.split(";")) {
                if (part.startsWith("PN") && part.length() > 2) {
                    Matcher digits = DIGITS.matcher(part.substring(2));
                    if (digits.find()) {
                        return digits.group();
                    }
                }
            }
        }

        for (String part : TOKEN_SPLIT.split(data)) {
            if (isDigits(part) && part.length() <= 10) {
                return part;
            }
        }
        return null;
    }

    private static boolean isDigits(String value) {
        return !value.isEmpty() && value.chars().allMatch(c -> c >= '0' && c <= '9');
    }
}
