package io.sunplane.taskboard;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.sunplane.client.ErrorKind;
import io.sunplane.client.SunException;

import java.util.Locale;

public enum TaskState {
    TODO("todo", 2),
    DOING("doing", 1),
    DONE("done", 3);

    private final String wireName;
    private final int displayRank;

    TaskState(String wireName, int displayRank) {
        this.wireName = wireName;
        this.displayRank = displayRank;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Display order: doing first, then todo, then done.
     */
    public int displayRank() {
        return displayRank;
    }

    /**
     * Lenient form used when decoding boards: unknown values become {@link #TODO}.
     */
    @JsonCreator
    public static TaskState fromString(String raw) {
        TaskState parsed = synonym(raw);
        return parsed == null ? TODO : parsed;
    }

    /**
     * Strict form used for user filters. Blank means no filter and yields null.
     */
    public static TaskState parseFilter(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        TaskState parsed = synonym(raw);
        if (parsed == null) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT,
                    "invalid --status \"" + raw.trim() + "\" (expected todo|doing|done)");
        }
        return parsed;
    }

    private static TaskState synonym(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "", "todo", "open", "queued", "backlog" -> TODO;
            case "doing", "in-progress", "in_progress", "claimed", "active" -> DOING;
            case "done", "closed", "complete", "completed" -> DONE;
            default -> null;
        };
    }
}
