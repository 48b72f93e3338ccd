package io.sunplane.taskboard;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of a {@value TaskboardService#KIND} object.
 */
public final class Taskboard {
    public int version = 1;
    public String name;
    public String updatedAt;
    public List<BoardTask> tasks = new ArrayList<>();
    public Map<String, BoardAgent> agents = new LinkedHashMap<>();

    public static Taskboard empty(String name) {
        Taskboard board = new Taskboard();
        board.name = name == null ? "" : name.trim();
        return board;
    }
}
