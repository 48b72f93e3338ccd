package io.sunplane.gateway;

public record Diagnostic(String level, String message, String source) {
    public static Diagnostic warn(String message, String source) {
        return new Diagnostic("warn", message, source);
    }

    public static Diagnostic error(String message, String source) {
        return new Diagnostic("error", message, source);
    }
}
