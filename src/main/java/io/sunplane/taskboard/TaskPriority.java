package io.sunplane.taskboard;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskPriority {
    P1(1),
    P2(2),
    P3(3);

    private final int rank;

    TaskPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    @JsonValue
    public String wireName() {
        return name();
    }

    @JsonCreator
    public static TaskPriority fromString(String raw) {
        String value = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        return switch (value) {
            case "P1" -> P1;
            case "P3" -> P3;
            default -> P2;
        };
    }
}
