package io.sunplane.taskboard;

import io.sunplane.util.Timestamps;

import java.time.Instant;

public final class TaskLock {
    public String agentId;
    public String dyad;
    public String machine;
    public String user;
    public String lockToken;
    public String claimedAt;
    public int leaseSeconds;
    public String leaseExpiresAt;

    /**
     * Expired when {@code lease_expires_at <= now}; falls back to {@code claimed_at + lease_seconds}.
     * A lock with neither usable field never expires.
     */
    public boolean expired(Instant now) {
        Instant expires = Timestamps.parseOrNull(leaseExpiresAt);
        if (expires != null) {
            return !now.isBefore(expires);
        }
        if (leaseSeconds > 0) {
            Instant claimed = Timestamps.parseOrNull(claimedAt);
            if (claimed != null) {
                return !now.isBefore(claimed.plusSeconds(leaseSeconds));
            }
        }
        return false;
    }

    public boolean heldBy(String candidate) {
        return agentId != null && candidate != null && agentId.trim().equalsIgnoreCase(candidate.trim());
    }
}
