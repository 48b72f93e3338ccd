package io.sunplane.client;

/**
 * Tag carried by every {@link SunException}. Exit codes are stable per kind.
 */
public enum ErrorKind {
    INVALID_ARGUMENT(2),
    INVALID_CREDENTIAL(3),
    INSECURE_TRANSPORT(3),
    TRANSPORT_ERROR(4),
    REMOTE_ERROR(4),
    NOT_READY(4),
    ACCESS_DENIED_BY_EDGE(4),
    REVISION_CONFLICT(5),
    TASKBOARD_CONFLICT_EXCEEDED(5),
    TASK_NOT_FOUND(6),
    NO_CLAIMABLE_TASK(6),
    MACHINE_UNREGISTERED(6),
    TARGET_UNREGISTERED(6),
    SOURCE_UNREGISTERED(6),
    JOB_NOT_FOUND(6),
    ALREADY_DONE(7),
    TASK_LOCKED(7),
    NOT_ASSIGNED(7),
    TARGET_REFUSES_CONTROL(7),
    NOT_PERMITTED(7),
    SOURCE_NOT_AUTHORIZED(7),
    SOURCE_CANNOT_CONTROL(7),
    PLAINTEXT_REFUSED(7),
    MALFORMED_RESPONSE(8),
    MALFORMED_INDEX(8),
    MALFORMED_SHARD(8),
    CHECKSUM_MISMATCH(8),
    SIZE_MISMATCH(8),
    REMOTE_JOB_FAILED(9),
    WAIT_TIMEOUT(9),
    CANCELLED(10),
    LOCAL_IO(1),
    INTERNAL(1);

    private final int exitCode;

    ErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
