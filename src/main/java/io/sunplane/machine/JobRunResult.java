package io.sunplane.machine;

/**
 * {@code error} is null when the process ran to completion, whatever its exit code.
 */
public record JobRunResult(String stdout, String stderr, int exitCode, String error) {
    public static JobRunResult failed(String error) {
        return new JobRunResult("", "", 1, error);
    }
}
