package io.sunplane.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Boundary sanitizers for agent, machine and operator identifiers.
 */
public final class Identities {
    private Identities() {
    }

    /**
     * Lowercase {@code [a-z0-9._-]}; anything else becomes '-', leading/trailing '-' trimmed.
     */
    public static String sanitizeSlug(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        return trimDashes(sb.toString());
    }

    /**
     * Case preserving {@code [A-Za-z0-9._:@-]}; anything else becomes '-'.
     */
    public static String sanitizeOperator(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.' || ch == ':' || ch == '@';
            sb.append(ok ? ch : '-');
        }
        return trimDashes(sb.toString()).trim();
    }

    /**
     * Sanitized, case-insensitively deduplicated and sorted operator list.
     */
    public static List<String> normalizeOperators(Collection<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) {
            return out;
        }
        Set<String> seen = new HashSet<>();
        for (String value : values) {
            String item = sanitizeOperator(value);
            if (item.isEmpty() || !seen.add(item.toLowerCase(Locale.ROOT))) {
                continue;
            }
            out.add(item);
        }
        out.sort(null);
        return out;
    }

    private static String trimDashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(start, end);
    }
}
