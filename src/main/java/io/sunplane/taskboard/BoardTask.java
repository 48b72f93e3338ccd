package io.sunplane.taskboard;

import java.util.ArrayList;
import java.util.List;

public final class BoardTask {
    public String id;
    public String title;
    public String prompt;
    public TaskState status;
    public TaskPriority priority;
    public List<String> tags = new ArrayList<>();
    public String createdAt;
    public String updatedAt;
    public String completedAt;
    public String result;
    public TaskLock assignment;
}
