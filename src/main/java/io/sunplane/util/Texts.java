package io.sunplane.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

public final class Texts {
    private Texts() {
    }

    public static String trim(String raw) {
        return raw == null ? "" : raw.trim();
    }

    public static boolean isBlank(String raw) {
        return raw == null || raw.isBlank();
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }

    public static boolean isTruthy(String raw) {
        String value = trim(raw).toLowerCase(Locale.ROOT);
        return value.equals("1") || value.equals("true") || value.equals("yes") || value.equals("on");
    }

    /**
     * Comma separated list: trimmed, empties dropped, first occurrence wins.
     */
    public static List<String> splitCsv(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ArrayList<>();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String part : raw.split(",")) {
            String value = part.trim();
            if (!value.isEmpty()) {
                out.add(value);
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * Trims, drops empties and exact duplicates, keeps first-seen order. Returns null for an empty result.
     */
    public static List<String> normalizeList(List<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String value : values) {
            String item = trim(value);
            if (!item.isEmpty()) {
                out.add(item);
            }
        }
        return out.isEmpty() ? null : new ArrayList<>(out);
    }

    public static String truncate(String raw, int maxChars, String suffix) {
        if (raw == null || raw.length() <= maxChars) {
            return raw;
        }
        return raw.substring(0, maxChars) + suffix;
    }
}
