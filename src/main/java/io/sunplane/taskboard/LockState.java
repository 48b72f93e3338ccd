package io.sunplane.taskboard;

/**
 * Tag for a task's assignment at a point in time.
 */
public enum LockState {
    NONE,
    EXPIRED,
    LIVE;

    public static LockState of(TaskLock lock, java.time.Instant now) {
        if (lock == null || lock.agentId == null || lock.agentId.isBlank()) {
            return NONE;
        }
        return lock.expired(now) ? EXPIRED : LIVE;
    }
}
