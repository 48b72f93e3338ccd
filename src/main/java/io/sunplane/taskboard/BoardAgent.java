package io.sunplane.taskboard;

public final class BoardAgent {
    public String id;
    public String dyad;
    public String machine;
    public String user;
    public String status;
    public String currentTaskId;
    public String lastSeenAt;
}
