package com.gamecatalog.dumpimport.service;

import com.gamecatalog.dumpimport.model.FieldParseResult;
import com.gamecatalog.dumpimport.model.SemanticType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Pure conversions from one raw dump value to one typed value.
 *
 * Every type except {@link SemanticType#BOOLEAN} maps the sentinels {@code null}, {@code ""},
 * {@code "None"} and {@code "null"} to absent. Booleans map a missing or empty value to {@code false}.
 */
public final class FieldParsers {

    private FieldParsers() {
    }

    private static final Set<String> SENTINELS = Set.of("", "None", "null");

    private static final Set<String> TRUE_VALUES = Set.of(
            "t", "true", "yes", "y", "1", "x", "on", "enabled", "active", "✓", "✔");
    private static final Set<String> FALSE_VALUES = Set.of(
            "f", "false", "no", "n", "0", "", "off", "disabled", "inactive", "none", "null");

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
    private static final Pattern INTEGER_ARRAY_PATTERN = Pattern.compile("\\{\\s*(-?\\d+(\\s*,\\s*-?\\d+)*)?\\s*}");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern NON_FINITE_PATTERN = Pattern.compile("(?i)[+-]?(nan|inf|infinity)");
    private static final Pattern HYPHENATED_UUID = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    private static final Pattern COMPACT_UUID = Pattern.compile("[0-9a-fA-F]{32}");

    // Tried in order; first match wins.
    private static final DateTimeFormatter PLAIN_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter MONTH_DAY_YEAR = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("MMM d, uuuu")
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter UTC_INSTANT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'")
            .withResolverStyle(ResolverStyle.STRICT);

    /**
     * Dispatches to the parser registered for {@code type}.
     */
    public static FieldParseResult parse(SemanticType type, String raw) {
        switch (type) {
            case INTEGER:
                return parseInteger(raw);
            case TEXT:
                return parseText(raw);
            case TIMESTAMP:
                return parseTimestamp(raw);
            case INTEGER_ARRAY:
                return parseIntegerArray(raw);
            case FLOAT:
                return parseFloat(raw);
            case UUID:
                return parseUuid(raw);
            case BOOLEAN:
                return parseBoolean(raw);
            default:
                throw new IllegalArgumentException("No parser registered for " + type);
        }
    }

    /**
     * True for the raw values that mean "no value present".
     */
    public static boolean isSentinel(String raw) {
        return raw == null || SENTINELS.contains(raw);
    }

    public static FieldParseResult parseInteger(String raw) {
        if (isSentinel(raw)) {
            return FieldParseResult.absent();
        }
        String trimmed = raw.trim();
        if (!INTEGER_PATTERN.matcher(trimmed).matches()) {
            return FieldParseResult.failure();
        }
        try {
            return FieldParseResult.of(Long.parseLong(trimmed));
        } catch (NumberFormatException e) {
            // out of range for a 64-bit column
            return FieldParseResult.failure();
        }
    }

    public static FieldParseResult parseText(String raw) {
        if (isSentinel(raw)) {
            return FieldParseResult.absent();
        }
        return FieldParseResult.of(raw);
    }

    /**
     * Accepts {@code 2020-01-31}, {@code Jan 31, 2020} and {@code 2020-01-31T10:15:00Z}, read as UTC.
     * A present value matching none of them is a failure.
     */
    public static FieldParseResult parseTimestamp(String raw) {
        if (isSentinel(raw)) {
            return FieldParseResult.absent();
        }
        try {
            return FieldParseResult.of(LocalDate.parse(raw, PLAIN_DATE).atStartOfDay());
        } catch (DateTimeParseException ignored) {
            // fall through to the next format
        }
        try {
            return FieldParseResult.of(LocalDate.parse(raw, MONTH_DAY_YEAR).atStartOfDay());
        } catch (DateTimeParseException ignored) {
            // fall through to the next format
        }
        try {
            return FieldParseResult.of(LocalDateTime.parse(raw, UTC_INSTANT));
        } catch (DateTimeParseException e) {
            return FieldParseResult.failure();
        }
    }

    /**
     * Parses {@code {1, 2, -3}}. A trailing comma or any other deviation fails; {@code {}} is empty.
     */
    public static FieldParseResult parseIntegerArray(String raw) {
        if (isSentinel(raw)) {
            return FieldParseResult.absent();
        }
        String trimmed = raw.trim();
        if (!INTEGER_ARRAY_PATTERN.matcher(trimmed).matches()) {
            return FieldParseResult.failure();
        }
        String body = trimmed.substring(1, trimmed.length() - 1);
        List<Long> values = new ArrayList<>();
        for (String part : body.split(",")) {
            String element = part.trim();
            if (element.isEmpty()) {
                continue;
            }
            try {
                values.add(Long.parseLong(element));
            } catch (NumberFormatException e) {
                return FieldParseResult.failure();
            }
        }
        return FieldParseResult.of(List.copyOf(values));
    }

    public static FieldParseResult parseFloat(String raw) {
        if (isSentinel(raw)) {
            return FieldParseResult.absent();
        }
        String trimmed = raw.trim();
        if (NON_FINITE_PATTERN.matcher(trimmed).matches()) {
            String lower = trimmed.toLowerCase(Locale.ROOT);
            if (lower.endsWith("nan")) {
                return FieldParseResult.of(Double.NaN);
            }
            return FieldParseResult.of(lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
        }
        if (!DECIMAL_PATTERN.matcher(trimmed).matches()) {
            return FieldParseResult.failure();
        }
        return FieldParseResult.of(Double.parseDouble(trimmed));
    }

    /**
     * Accepts hyphenated, braced, {@code urn:uuid:} prefixed or 32-digit compact forms in any case.
     */
    public static FieldParseResult parseUuid(String raw) {
        if (isSentinel(raw)) {
            return FieldParseResult.absent();
        }
        String candidate = raw.trim();
        if (candidate.regionMatches(true, 0, "urn:uuid:", 0, "urn:uuid:".length())) {
            candidate = candidate.substring("urn:uuid:".length());
        } else if (candidate.startsWith("{") && candidate.endsWith("}")) {
            candidate = candidate.substring(1, candidate.length() - 1);
        }
        if (COMPACT_UUID.matcher(candidate).matches()) {
            candidate = candidate.substring(0, 8) + "-" + candidate.substring(8, 12) + "-"
                    + candidate.substring(12, 16) + "-" + candidate.substring(16, 20) + "-" + candidate.substring(20);
        }
        if (!HYPHENATED_UUID.matcher(candidate).matches()) {
            return FieldParseResult.failure();
        }
        return FieldParseResult.of(UUID.fromString(candidate));
    }

    public static FieldParseResult parseBoolean(String raw) {
        if (raw == null || raw.isEmpty()) {
            return FieldParseResult.of(Boolean.FALSE);
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return FieldParseResult.of(Boolean.TRUE);
        }
        if (FALSE_VALUES.contains(normalized)) {
            return FieldParseResult.of(Boolean.FALSE);
        }
        return FieldParseResult.failure();
    }
}
