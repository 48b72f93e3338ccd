package io.sunplane.vault;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads dotenv assignments and classifies each non-empty value as encrypted or plaintext.
 */
public final class DotenvScanner {
    private static final String[] ENCRYPTED_PREFIXES = {"encrypted:", "es2:"};

    private DotenvScanner() {
    }

    public static Scan scan(byte[] raw) {
        List<String> encrypted = new ArrayList<>();
        List<String> plaintext = new ArrayList<>();
        String text = new String(raw == null ? new byte[0] : raw, StandardCharsets.UTF_8);
        for (String line : text.split("\r?\n", -1)) {
            Assignment assignment = parseAssignment(line);
            if (assignment == null || assignment.value().isEmpty()) {
                continue;
            }
            if (isEncrypted(assignment.value())) {
                encrypted.add(assignment.key());
            } else {
                plaintext.add(assignment.key());
            }
        }
        return new Scan(encrypted, plaintext);
    }

    public static boolean isEncrypted(String value) {
        for (String prefix : ENCRYPTED_PREFIXES) {
            if (value.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Null for blank lines, comments and lines without a key.
     */
    static Assignment parseAssignment(String line) {
        if (line == null || line.isBlank()) {
            return null;
        }
        if (line.stripLeading().startsWith("#")) {
            return null;
        }
        int eq = line.indexOf('=');
        if (eq < 0) {
            return null;
        }
        String key = line.substring(0, eq).trim();
        if (key.startsWith("export ") || key.startsWith("export\t")) {
            key = key.substring("export".length()).trim();
        }
        if (key.isEmpty()) {
            return null;
        }
        return new Assignment(key, unquote(valueWithoutComment(line.substring(eq + 1))));
    }

    static String valueWithoutComment(String right) {
        int start = 0;
        while (start < right.length() && (right.charAt(start) == ' ' || right.charAt(start) == '\t')) {
            start++;
        }
        if (start >= right.length() || right.charAt(start) == '#') {
            return "";
        }
        char first = right.charAt(start);
        if (first == '\'' || first == '"') {
            int end = closingQuote(right, start, first);
            return end < 0 ? right : right.substring(0, end + 1);
        }
        for (int i = start + 1; i < right.length(); i++) {
            char prev = right.charAt(i - 1);
            if (right.charAt(i) == '#' && (prev == ' ' || prev == '\t')) {
                return right.substring(0, i);
            }
        }
        return right;
    }

    private static int closingQuote(String right, int start, char quote) {
        boolean escaped = false;
        for (int i = start + 1; i < right.length(); i++) {
            char ch = right.charAt(i);
            if (quote == '"') {
                if (escaped) {
                    escaped = false;
                    continue;
                }
                if (ch == '\\') {
                    escaped = true;
                    continue;
                }
            }
            if (ch == quote) {
                return i;
            }
        }
        return -1;
    }

    static String unquote(String raw) {
        String value = raw.trim();
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    record Assignment(String key, String value) {
    }

    public record Scan(List<String> encryptedKeys, List<String> plaintextKeys) {
    }
}
