package io.sunplane.machine;

import java.util.ArrayList;
import java.util.List;

/**
 * Payload of a {@value MachineControlService#JOB_KIND} object, stored under {@code <machine_id>--<job_id>}.
 */
public final class MachineJob {
    public int version = 1;
    public String jobId;
    public String machineId;
    public String requestedBy;
    public String sourceMachine;
    public List<String> command = new ArrayList<>();
    public int timeoutSeconds;
    public JobStatus status;
    public String requestedAt;
    public String updatedAt;
    public String claimedBy;
    public String claimedAt;
    public String startedAt;
    public String completedAt;
    public int exitCode;
    public String stdout;
    public String stderr;
    public String error;
}
