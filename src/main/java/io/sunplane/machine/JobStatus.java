package io.sunplane.machine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.sunplane.client.ErrorKind;
import io.sunplane.client.SunException;

import java.util.Locale;

public enum JobStatus {
    QUEUED("queued"),
    RUNNING("running"),
    SUCCEEDED("succeeded"),
    FAILED("failed"),
    DENIED("denied");

    private final String wireName;

    JobStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean terminal() {
        return this == SUCCEEDED || this == FAILED || this == DENIED;
    }

    /**
     * Synonym lookup; null for anything unrecognised.
     */
    @JsonCreator
    public static JobStatus fromString(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "", "queued", "pending" -> QUEUED;
            case "running", "claimed" -> RUNNING;
            case "succeeded", "success", "ok" -> SUCCEEDED;
            case "failed", "error" -> FAILED;
            case "denied", "forbidden" -> DENIED;
            default -> null;
        };
    }

    public static JobStatus parseFilter(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        JobStatus status = fromString(raw);
        if (status == null) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "invalid --status \"" + raw.trim() + "\"");
        }
        return status;
    }
}
