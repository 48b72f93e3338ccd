package io.sunplane.machine;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.ObjectMeta;
import io.sunplane.client.PutResult;
import io.sunplane.client.SunClient;
import io.sunplane.client.SunException;
import io.sunplane.config.Identities;
import io.sunplane.util.Ids;
import io.sunplane.util.Jsons;
import io.sunplane.util.Texts;
import io.sunplane.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Machine registry, ACL and remote job queue on top of the object store.
 */
public final class MachineControlService {
    public static final String MACHINE_KIND = "si_machine";
    public static final String JOB_KIND = "si_machine_job";
    public static final int OUTPUT_MAX_BYTES = 64 * 1024;
    public static final int MIN_TIMEOUT_SECONDS = 10;
    public static final int LIST_LIMIT = 200;

    private static final Logger log = LoggerFactory.getLogger(MachineControlService.class);
    private static final String CONTENT_TYPE = "application/json";
    private static final String TRUNCATED = "\n[truncated]";

    private static final Comparator<MachineJob> QUEUE_ORDER = Comparator
            .comparing((MachineJob j) -> Timestamps.sortKey(j.requestedAt))
            .thenComparing(j -> Texts.trim(j.jobId));

    private final SunClient client;
    private final Clock clock;
    private final JobRunner runner;

    public MachineControlService(SunClient client, JobRunner runner) {
        this(client, Clock.systemUTC(), runner);
    }

    public MachineControlService(SunClient client, Clock clock, JobRunner runner) {
        this.client = client;
        this.clock = clock;
        this.runner = runner;
    }

    public MachineUpdate register(RegisterRequest request) {
        String machineId = Identities.sanitizeSlug(request.machineId());
        String operator = Identities.sanitizeOperator(request.operatorId());
        if (machineId.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "machine id is required");
        }
        if (operator.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "operator id is required");
        }
        Optional<Stored<MachineRecord>> existing = loadMachine(machineId);
        String now = now();
        MachineRecord record;
        if (existing.isEmpty()) {
            record = new MachineRecord();
            record.ownerOperator = operator;
            record.registeredAt = now;
            record.capabilities.canControlOthers = Boolean.TRUE.equals(request.canControlOthers());
            record.capabilities.canBeControlled = request.canBeControlled() == null || request.canBeControlled();
        } else {
            record = existing.get().value();
            if (request.canControlOthers() != null) {
                record.capabilities.canControlOthers = request.canControlOthers();
            }
            if (request.canBeControlled() != null) {
                record.capabilities.canBeControlled = request.canBeControlled();
            }
        }
        record.machineId = machineId;
        if (Texts.isBlank(record.ownerOperator)) {
            record.ownerOperator = operator;
        }
        if (!Texts.isBlank(request.displayName())) {
            record.displayName = request.displayName().trim();
        }
        List<String> acl = new ArrayList<>(record.acl.allowedOperators);
        acl.add(operator);
        acl.add(record.ownerOperator);
        if (request.extraOperators() != null) {
            acl.addAll(request.extraOperators());
        }
        record.acl.allowedOperators = Identities.normalizeOperators(acl);
        record.updatedAt = now;
        record.heartbeat.lastSeenAt = now;
        record.heartbeat.lastState = "registered";
        long revision = persistMachine(record, existing.map(Stored::revision).orElse(null));
        log.info("registered machine {} for operator {} (revision {})", machineId, operator, revision);
        return new MachineUpdate(record, revision);
    }

    public MachineRecord status(String machineId) {
        return requireMachine(machineId).value();
    }

    public List<MachineRecord> list(int limit) {
        List<MachineRecord> rows = new ArrayList<>();
        for (ObjectMeta meta : client.listObjects(MACHINE_KIND, "", limit > 0 ? limit : LIST_LIMIT)) {
            tryLoad(() -> loadMachine(meta.name())).ifPresent(stored -> rows.add(stored.value()));
        }
        rows.sort(Comparator.comparing((MachineRecord r) -> r.machineId));
        return rows;
    }

    public MachineUpdate allow(String machineId, String grant, String caller) {
        String granted = Identities.sanitizeOperator(grant);
        if (granted.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "--grant is required");
        }
        Stored<MachineRecord> stored = requireMachine(machineId);
        MachineRecord record = stored.value();
        if (!record.ownerOperator.equalsIgnoreCase(Texts.trim(caller))) {
            throw new SunException(ErrorKind.NOT_PERMITTED, "only machine owner \"" + record.ownerOperator + "\" can grant operators");
        }
        List<String> acl = new ArrayList<>(record.acl.allowedOperators);
        acl.add(granted);
        record.acl.allowedOperators = Identities.normalizeOperators(acl);
        record.updatedAt = now();
        return new MachineUpdate(record, persistMachine(record, stored.revision()));
    }

    public MachineUpdate deny(String machineId, String revoke, String caller) {
        String revoked = Texts.trim(revoke);
        if (revoked.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "--revoke is required");
        }
        Stored<MachineRecord> stored = requireMachine(machineId);
        MachineRecord record = stored.value();
        if (revoked.equalsIgnoreCase(record.ownerOperator)) {
            throw new SunException(ErrorKind.NOT_PERMITTED, "cannot revoke owner operator \"" + record.ownerOperator + "\"");
        }
        if (!record.ownerOperator.equalsIgnoreCase(Texts.trim(caller))) {
            throw new SunException(ErrorKind.NOT_PERMITTED, "only machine owner \"" + record.ownerOperator + "\" can revoke operators");
        }
        List<String> acl = new ArrayList<>();
        for (String operator : record.acl.allowedOperators) {
            if (!operator.equalsIgnoreCase(revoked)) {
                acl.add(operator);
            }
        }
        record.acl.allowedOperators = Identities.normalizeOperators(acl);
        record.updatedAt = now();
        return new MachineUpdate(record, persistMachine(record, stored.revision()));
    }

    /**
     * Enqueues a job on the target machine and, when asked, waits for it to reach a terminal status.
     * A terminal job is returned as is; use {@link #failureOf(MachineJob)} to turn a non-success into an error.
     */
    public RunOutcome run(RunRequest request) {
        String target = Identities.sanitizeSlug(request.targetMachine());
        String source = Identities.sanitizeSlug(request.sourceMachine());
        String operator = Identities.sanitizeOperator(request.operatorId());
        List<String> command = normalizeCommand(request.command());

        MachineRecord targetRecord = loadMachine(target)
                .orElseThrow(() -> new SunException(ErrorKind.TARGET_UNREGISTERED,
                        "target machine \"" + target + "\" is not registered"))
                .value();
        if (!targetRecord.capabilities.canBeControlled) {
            throw new SunException(ErrorKind.TARGET_REFUSES_CONTROL,
                    "target machine \"" + target + "\" does not accept remote control (can_be_controlled=false)");
        }
        if (!operatorAllowed(targetRecord, operator)) {
            throw new SunException(ErrorKind.NOT_PERMITTED,
                    "operator \"" + operator + "\" is not allowed to control machine \"" + target + "\"");
        }
        MachineRecord sourceRecord = loadMachine(source)
                .orElseThrow(() -> new SunException(ErrorKind.SOURCE_UNREGISTERED,
                        "source machine \"" + source + "\" is not registered; run `sunctl machine register --machine "
                                + source + " --can-control-others` first"))
                .value();
        if (!operatorAllowed(sourceRecord, operator)) {
            throw new SunException(ErrorKind.SOURCE_NOT_AUTHORIZED,
                    "operator \"" + operator + "\" is not allowed on source machine \"" + source + "\"");
        }
        if (!sourceRecord.capabilities.canControlOthers) {
            throw new SunException(ErrorKind.SOURCE_CANNOT_CONTROL,
                    "source machine \"" + source + "\" cannot control other machines (can_control_others=false)");
        }

        Instant now = instant();
        MachineJob job = new MachineJob();
        job.jobId = Ids.timestamped("job", now, List.of());
        job.machineId = target;
        job.requestedBy = operator;
        job.sourceMachine = source;
        job.command = command;
        job.timeoutSeconds = Math.max(MIN_TIMEOUT_SECONDS, request.timeoutSeconds());
        job.status = JobStatus.QUEUED;
        job.requestedAt = Timestamps.format(now);
        job.updatedAt = job.requestedAt;
        String jobName = jobObjectName(target, job.jobId);
        long revision = persistJob(jobName, job, null);
        log.info("queued job {} on machine {} for {}", job.jobId, target, operator);
        if (!request.waitForResult()) {
            return new RunOutcome(jobName, revision, job);
        }
        Stored<MachineJob> finished = waitForJob(jobName, request.pollInterval(), request.waitTimeout());
        return new RunOutcome(jobName, finished.revision(), finished.value());
    }

    public Stored<MachineJob> waitForJob(String jobName, Duration pollInterval, Duration waitTimeout) {
        long deadline = System.nanoTime() + waitTimeout.toNanos();
        while (true) {
            Stored<MachineJob> stored = loadJob(jobName)
                    .orElseThrow(() -> new SunException(ErrorKind.JOB_NOT_FOUND,
                            "remote job \"" + Texts.trim(jobName) + "\" not found"));
            MachineJob job = stored.value();
            if (job.status != null && job.status.terminal()) {
                return stored;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new SunException(ErrorKind.WAIT_TIMEOUT, "timed out waiting for remote job \"" + job.jobId + "\"");
            }
            sleep(Duration.ofNanos(Math.min(remaining, pollInterval.toNanos())));
        }
    }

    public List<MachineJob> jobs(String machineFilter, String requestedBy, String statusFilter, int limit) {
        JobStatus status = JobStatus.parseFilter(statusFilter);
        String machine = Identities.sanitizeSlug(machineFilter);
        String requester = Texts.trim(requestedBy);
        List<MachineJob> rows = new ArrayList<>();
        for (ObjectMeta meta : client.listObjects(JOB_KIND, "", limit > 0 ? limit : LIST_LIMIT)) {
            Optional<Stored<MachineJob>> loaded = tryLoad(() -> loadJob(meta.name()));
            if (loaded.isEmpty()) {
                continue;
            }
            MachineJob job = loaded.get().value();
            if (!machine.isEmpty() && !machine.equalsIgnoreCase(job.machineId)) {
                continue;
            }
            if (!requester.isEmpty() && !requester.equalsIgnoreCase(job.requestedBy)) {
                continue;
            }
            if (status != null && job.status != status) {
                continue;
            }
            rows.add(job);
        }
        rows.sort(QUEUE_ORDER);
        return rows;
    }

    /**
     * Claims and executes queued jobs for {@code request.machineId()} until {@code once}, {@code maxJobs}
     * or thread interruption stops the loop.
     */
    public ServeSummary serve(ServeRequest request) {
        String machineId = Identities.sanitizeSlug(request.machineId());
        Stored<MachineRecord> stored = loadMachine(machineId)
                .orElseThrow(() -> new SunException(ErrorKind.MACHINE_UNREGISTERED,
                        "machine \"" + machineId + "\" is not registered; run `sunctl machine register --machine "
                                + machineId + "` first"));
        MachineRecord record = stored.value();
        if (!record.capabilities.canBeControlled) {
            throw new SunException(ErrorKind.TARGET_REFUSES_CONTROL,
                    "machine \"" + machineId + "\" is not accepting remote jobs (can_be_controlled=false)");
        }
        String now = now();
        record.heartbeat.lastSeenAt = now;
        record.heartbeat.lastState = "serving";
        record.updatedAt = now;
        persistMachine(record, stored.revision());
        log.info("serving remote jobs on machine {}", machineId);

        List<String> jobIds = new ArrayList<>();
        while (true) {
            Optional<MachineJob> processed = processNext(machineId);
            if (processed.isPresent()) {
                jobIds.add(processed.get().jobId);
            }
            if (request.once()) {
                break;
            }
            if (request.maxJobs() > 0 && jobIds.size() >= request.maxJobs()) {
                break;
            }
            if (processed.isEmpty()) {
                sleep(request.pollInterval());
            }
        }
        return new ServeSummary(machineId, jobIds.size(), jobIds);
    }

    /**
     * One serve step: claim the oldest queued job, check policy against the current machine record,
     * execute and store the terminal state.
     */
    public Optional<MachineJob> processNext(String machineId) {
        Optional<Claimed> claimed = claimNext(machineId);
        if (claimed.isEmpty()) {
            return Optional.empty();
        }
        Claimed job = claimed.get();
        Optional<Stored<MachineRecord>> machine = loadMachine(machineId);
        MachineJob finished = machine.isPresent()
                ? runClaimedJob(job.job(), machine.get().value())
                : deny(job.job(), "machine \"" + machineId + "\" is not registered");
        persistJob(job.name(), finished, job.revision());
        log.info("job {} on machine {} finished with status {}", finished.jobId, machineId, finished.status.wireName());
        return Optional.of(finished);
    }

    Optional<Claimed> claimNext(String machineId) {
        String self = Identities.sanitizeSlug(machineId);
        String prefix = jobNamePrefix(self).toLowerCase(Locale.ROOT);
        List<Claimed> candidates = new ArrayList<>();
        for (ObjectMeta meta : client.listObjects(JOB_KIND, "", LIST_LIMIT)) {
            String name = Texts.trim(meta.name());
            if (!name.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                continue;
            }
            Optional<Stored<MachineJob>> loaded = tryLoad(() -> loadJob(name));
            // "a--" also prefixes the jobs of machine "a--x"
            if (loaded.isPresent() && loaded.get().value().status == JobStatus.QUEUED
                    && self.equals(loaded.get().value().machineId)) {
                candidates.add(new Claimed(name, loaded.get().value(), loaded.get().revision()));
            }
        }
        candidates.sort(Comparator.comparing(Claimed::job, QUEUE_ORDER));
        for (Claimed candidate : candidates) {
            Optional<Stored<MachineJob>> fresh = tryLoad(() -> loadJob(candidate.name()));
            if (fresh.isEmpty() || fresh.get().value().status != JobStatus.QUEUED
                    || !self.equals(fresh.get().value().machineId)) {
                continue;
            }
            MachineJob job = fresh.get().value();
            String now = now();
            job.status = JobStatus.RUNNING;
            job.claimedBy = self;
            job.claimedAt = now;
            job.startedAt = now;
            job.updatedAt = now;
            try {
                long revision = persistJob(candidate.name(), job, fresh.get().revision());
                return Optional.of(new Claimed(candidate.name(), job, revision));
            } catch (SunException e) {
                if (!SunException.isConflict(e)) {
                    throw e;
                }
                log.debug("job {} claimed by another worker, skipping", candidate.name());
            }
        }
        return Optional.empty();
    }

    MachineJob runClaimedJob(MachineJob job, MachineRecord machine) {
        String started = now();
        job.status = JobStatus.RUNNING;
        job.updatedAt = started;
        if (Texts.isBlank(job.startedAt)) {
            job.startedAt = started;
        }
        if (!operatorAllowed(machine, job.requestedBy)) {
            return deny(job, "operator \"" + Texts.trim(job.requestedBy) + "\" is not allowed by machine \""
                    + machine.machineId + "\" ACL");
        }
        if (!machine.capabilities.canBeControlled) {
            return deny(job, "machine \"" + machine.machineId + "\" refuses remote control");
        }
        Duration timeout = Duration.ofSeconds(Math.max(MIN_TIMEOUT_SECONDS, job.timeoutSeconds));
        JobRunResult result = runner.run(job.command, timeout);
        job.stdout = truncateOutput(result.stdout());
        job.stderr = truncateOutput(result.stderr());
        job.exitCode = result.exitCode();
        String completed = now();
        job.completedAt = completed;
        job.updatedAt = completed;
        if (result.error() != null || result.exitCode() != 0) {
            job.status = JobStatus.FAILED;
            job.error = result.error() != null
                    ? result.error().trim()
                    : "command exited with code " + result.exitCode();
            return job;
        }
        job.status = JobStatus.SUCCEEDED;
        job.error = "";
        job.claimedBy = Texts.firstNonBlank(job.claimedBy, machine.machineId);
        job.claimedAt = Texts.firstNonBlank(job.claimedAt, started);
        return job;
    }

    /**
     * The error a caller should raise for a terminal job, empty when it succeeded.
     */
    public static Optional<SunException> failureOf(MachineJob job) {
        if (job.status == JobStatus.SUCCEEDED) {
            return Optional.empty();
        }
        String status = job.status == null ? "unknown" : job.status.wireName();
        String jobId = Texts.firstNonBlank(job.jobId, "unknown-job");
        String details = Texts.trim(job.error);
        String message;
        if (!details.isEmpty()) {
            message = "remote job " + jobId + " finished with status " + status + ": " + details;
        } else if (job.exitCode != 0) {
            message = "remote job " + jobId + " finished with status " + status + " (exit code " + job.exitCode + ")";
        } else {
            message = "remote job " + jobId + " finished with status " + status;
        }
        return Optional.of(new SunException(ErrorKind.REMOTE_JOB_FAILED, message));
    }

    public static boolean operatorAllowed(MachineRecord record, String operatorId) {
        String operator = Texts.trim(operatorId);
        if (operator.isEmpty()) {
            return false;
        }
        if (operator.equalsIgnoreCase(Texts.trim(record.ownerOperator))) {
            return true;
        }
        for (String allowed : record.acl.allowedOperators) {
            if (operator.equalsIgnoreCase(Texts.trim(allowed))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops blank arguments, a leading {@code --} and a leading {@code sunctl}.
     */
    public static List<String> normalizeCommand(List<String> raw) {
        List<String> args = new ArrayList<>();
        if (raw != null) {
            for (String arg : raw) {
                String trimmed = Texts.trim(arg);
                if (!trimmed.isEmpty()) {
                    args.add(trimmed);
                }
            }
        }
        if (!args.isEmpty() && args.get(0).equals("--")) {
            args.remove(0);
        }
        if (!args.isEmpty() && args.get(0).equalsIgnoreCase("sunctl")) {
            args.remove(0);
        }
        if (args.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "remote command required (pass it after --)");
        }
        return args;
    }

    public static String jobObjectName(String machineId, String jobId) {
        return jobNamePrefix(machineId) + Texts.trim(jobId);
    }

    static String jobNamePrefix(String machineId) {
        return Identities.sanitizeSlug(machineId) + "--";
    }

    static String truncateOutput(String raw) {
        if (raw == null) {
            return "";
        }
        byte[] bytes = raw.getBytes(java.nio.charset.StandardCharsets.UTF_8);
        if (bytes.length <= OUTPUT_MAX_BYTES) {
            return raw;
        }
        int cut = OUTPUT_MAX_BYTES;
        // back off continuation bytes (10xxxxxx) so the cut lands on a character boundary
        while (cut > 0 && (bytes[cut] & 0xC0) == 0x80) {
            cut--;
        }
        return new String(bytes, 0, cut, java.nio.charset.StandardCharsets.UTF_8) + TRUNCATED;
    }

    private MachineJob deny(MachineJob job, String reason) {
        String completed = now();
        job.status = JobStatus.DENIED;
        job.completedAt = completed;
        job.updatedAt = completed;
        job.exitCode = 1;
        job.error = reason;
        return job;
    }

    private Stored<MachineRecord> requireMachine(String machineId) {
        String id = Identities.sanitizeSlug(machineId);
        return loadMachine(id).orElseThrow(() -> new SunException(ErrorKind.MACHINE_UNREGISTERED,
                "machine \"" + id + "\" is not registered"));
    }

    Optional<Stored<MachineRecord>> loadMachine(String machineId) {
        String id = Texts.trim(machineId);
        if (id.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "machine id is required");
        }
        return load(MACHINE_KIND, id, MachineRecord.class).map(stored -> {
            normalizeMachine(stored.value(), id);
            return stored;
        });
    }

    Optional<Stored<MachineJob>> loadJob(String jobName) {
        String name = Texts.trim(jobName);
        if (name.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "job name is required");
        }
        return load(JOB_KIND, name, MachineJob.class).map(stored -> {
            normalizeJob(stored.value());
            return stored;
        });
    }

    private <T> Optional<Stored<T>> load(String kind, String name, Class<T> type) {
        Optional<ObjectMeta> meta = client.lookupObjectMeta(kind, name);
        if (meta.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Stored<>(client.getJson(kind, name, type), meta.get().latestRevision()));
    }

    /**
     * Listing paths skip entries that vanish or fail to decode between list and read.
     */
    private static <T> Optional<Stored<T>> tryLoad(Loader<T> loader) {
        try {
            return loader.load();
        } catch (SunException e) {
            if (e.is(ErrorKind.CANCELLED)) {
                throw e;
            }
            log.warn("skipping unreadable object: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private long persistMachine(MachineRecord record, Long expectedRevision) {
        normalizeMachine(record, record.machineId);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("machine_id", record.machineId);
        metadata.put("owner_operator", record.ownerOperator);
        metadata.put("can_control_others", record.capabilities.canControlOthers);
        metadata.put("can_be_controlled", record.capabilities.canBeControlled);
        metadata.put("allowed_operators_n", record.acl.allowedOperators.size());
        return revisionOf(client.putObject(MACHINE_KIND, record.machineId, Jsons.toPrettyBytes(record),
                CONTENT_TYPE, metadata, expectedRevision));
    }

    private long persistJob(String jobName, MachineJob job, Long expectedRevision) {
        normalizeJob(job);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("machine_id", job.machineId);
        metadata.put("job_id", job.jobId);
        metadata.put("status", job.status == null ? "" : job.status.wireName());
        metadata.put("requested_by", job.requestedBy);
        return revisionOf(client.putObject(JOB_KIND, Texts.trim(jobName), Jsons.toPrettyBytes(job),
                CONTENT_TYPE, metadata, expectedRevision));
    }

    private static long revisionOf(PutResult result) {
        return result.latestRevision() > 0 ? result.latestRevision() : result.revision();
    }

    static void normalizeMachine(MachineRecord record, String fallbackId) {
        record.version = Math.max(1, record.version);
        record.machineId = Identities.sanitizeSlug(Texts.firstNonBlank(record.machineId, fallbackId));
        record.ownerOperator = Identities.sanitizeOperator(record.ownerOperator);
        record.displayName = Texts.trim(record.displayName);
        if (record.capabilities == null) {
            record.capabilities = new MachineRecord.Capabilities();
        }
        if (record.heartbeat == null) {
            record.heartbeat = new MachineRecord.Heartbeat();
        }
        if (record.acl == null) {
            record.acl = new MachineRecord.AccessControl();
        }
        List<String> acl = record.acl.allowedOperators == null
                ? new ArrayList<>()
                : new ArrayList<>(record.acl.allowedOperators);
        if (!record.ownerOperator.isEmpty()) {
            acl.add(record.ownerOperator);
        }
        record.acl.allowedOperators = Identities.normalizeOperators(acl);
    }

    static void normalizeJob(MachineJob job) {
        job.version = Math.max(1, job.version);
        job.jobId = Texts.trim(job.jobId);
        job.machineId = Identities.sanitizeSlug(job.machineId);
        job.requestedBy = Identities.sanitizeOperator(job.requestedBy);
        job.sourceMachine = Identities.sanitizeSlug(job.sourceMachine);
        job.timeoutSeconds = Math.max(MIN_TIMEOUT_SECONDS, job.timeoutSeconds);
        List<String> args = new ArrayList<>();
        if (job.command != null) {
            for (String arg : job.command) {
                String trimmed = Texts.trim(arg);
                if (!trimmed.isEmpty()) {
                    args.add(trimmed);
                }
            }
        }
        job.command = args;
    }

    private void sleep(Duration interval) {
        try {
            Thread.sleep(Math.max(1L, interval.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SunException(ErrorKind.CANCELLED, "machine operation interrupted", e);
        }
    }

    private Instant instant() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private String now() {
        return Timestamps.format(instant());
    }

    @FunctionalInterface
    private interface Loader<T> {
        Optional<Stored<T>> load();
    }

    public record Stored<T>(T value, long revision) {
    }

    record Claimed(String name, MachineJob job, long revision) {
    }

    public record RegisterRequest(
            String machineId,
            String operatorId,
            String displayName,
            List<String> extraOperators,
            Boolean canControlOthers,
            Boolean canBeControlled
    ) {
    }

    public record RunRequest(
            String targetMachine,
            String sourceMachine,
            String operatorId,
            List<String> command,
            int timeoutSeconds,
            boolean waitForResult,
            Duration waitTimeout,
            Duration pollInterval
    ) {
    }

    public record ServeRequest(String machineId, Duration pollInterval, boolean once, int maxJobs) {
    }

    public record MachineUpdate(MachineRecord machine, long revision) {
    }

    public record RunOutcome(String jobName, long revision, MachineJob job) {
    }

    public record ServeSummary(String machineId, int processed, List<String> jobIds) {
    }
}
