package io.sunplane.machine;

import java.time.Duration;
import java.util.List;

/**
 * Executes the argument vector of a claimed job on this machine.
 */
public interface JobRunner {
    JobRunResult run(List<String> args, Duration timeout);
}
