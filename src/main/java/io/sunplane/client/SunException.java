package io.sunplane.client;

public class SunException extends RuntimeException {
    private final ErrorKind kind;

    public SunException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public SunException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? ErrorKind.INTERNAL : kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean is(ErrorKind candidate) {
        return kind == candidate;
    }

    public static boolean isConflict(Throwable error) {
        return error instanceof SunException sun && sun.kind == ErrorKind.REVISION_CONFLICT;
    }
}
