package io.sunplane.taskboard;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.ObjectMeta;
import io.sunplane.client.PutResult;
import io.sunplane.client.SunClient;
import io.sunplane.client.SunException;
import io.sunplane.util.Ids;
import io.sunplane.util.Jsons;
import io.sunplane.util.Texts;
import io.sunplane.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
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
 * Cooperative work queue stored as one object per board.
 * Every mutation is read-modify-CAS with a bounded number of attempts.
 */
public final class TaskboardService {
    public static final String KIND = "dyad_taskboard";
    public static final int MAX_ATTEMPTS = 8;
    public static final int DEFAULT_LEASE_SECONDS = 1800;
    public static final int DEFAULT_LIST_LIMIT = 50;

    private static final Logger log = LoggerFactory.getLogger(TaskboardService.class);
    private static final String CONTENT_TYPE = "application/json";

    static final Comparator<BoardTask> DISPLAY_ORDER = Comparator
            .comparingInt((BoardTask t) -> t.status.displayRank())
            .thenComparingInt(t -> t.priority.rank())
            .thenComparing(t -> Timestamps.sortKey(t.createdAt))
            .thenComparing(t -> t.id);

    static final Comparator<BoardTask> CLAIM_ORDER = Comparator
            .comparingInt((BoardTask t) -> t.priority.rank())
            .thenComparing(t -> Timestamps.sortKey(t.createdAt))
            .thenComparing(t -> t.id);

    private final SunClient client;
    private final Clock clock;

    public TaskboardService(SunClient client) {
        this(client, Clock.systemUTC());
    }

    public TaskboardService(SunClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    public ShowOutcome show(String boardName) {
        Snapshot snapshot = load(requireBoardName(boardName));
        Taskboard board = snapshot.board();
        List<BoardTask> tasks = new ArrayList<>(board.tasks);
        tasks.sort(DISPLAY_ORDER);
        return new ShowOutcome(board.name, snapshot.revision(), board.updatedAt, counts(board), tasks, board.agents);
    }

    public ListOutcome list(String boardName, String statusFilter, String owner, int limit) {
        TaskState status = TaskState.parseFilter(statusFilter);
        String ownerId = Texts.trim(owner);
        Taskboard board = load(requireBoardName(boardName)).board();
        List<BoardTask> rows = new ArrayList<>();
        for (BoardTask task : board.tasks) {
            if (status != null && task.status != status) {
                continue;
            }
            if (!ownerId.isEmpty() && (task.assignment == null || !task.assignment.heldBy(ownerId))) {
                continue;
            }
            rows.add(task);
        }
        rows.sort(DISPLAY_ORDER);
        if (limit > 0 && rows.size() > limit) {
            rows = new ArrayList<>(rows.subList(0, limit));
        }
        return new ListOutcome(board.name, rows.size(), rows);
    }

    public BoardTask add(String boardName, String title, String prompt, String priority, List<String> tags) {
        String cleanTitle = Texts.trim(title);
        if (cleanTitle.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "task title required");
        }
        BoardTask[] created = new BoardTask[1];
        mutate(requireBoardName(boardName), (board, now) -> {
            List<String> existing = new ArrayList<>();
            for (BoardTask task : board.tasks) {
                existing.add(task.id);
            }
            BoardTask task = new BoardTask();
            task.id = Ids.timestamped("tsk", now, existing);
            task.title = cleanTitle;
            task.prompt = Texts.firstNonBlank(prompt, cleanTitle);
            task.status = TaskState.TODO;
            task.priority = TaskPriority.fromString(priority);
            List<String> cleanTags = Texts.normalizeList(tags);
            task.tags = cleanTags == null ? new ArrayList<>() : cleanTags;
            task.createdAt = Timestamps.format(now);
            task.updatedAt = task.createdAt;
            board.tasks.add(task);
            created[0] = task;
        });
        log.info("added task {} to board {}", created[0].id, boardName);
        return created[0];
    }

    /**
     * Claims {@code taskId}, or the next claimable task when it is blank.
     */
    public ClaimOutcome claim(String boardName, String taskId, AgentIdentity agent, int leaseSeconds) {
        requireAgent(agent);
        int lease = leaseSeconds > 0 ? leaseSeconds : DEFAULT_LEASE_SECONDS;
        BoardTask[] claimed = new BoardTask[1];
        Taskboard result = mutate(requireBoardName(boardName), (board, now) -> {
            BoardTask task = Texts.isBlank(taskId) ? selectNextClaimable(board, now) : findTask(board, taskId);
            if (task.status == TaskState.DONE) {
                throw new SunException(ErrorKind.ALREADY_DONE, "task " + task.id + " is already done");
            }
            rejectForeignLiveLock(task, agent, now);
            String stamp = Timestamps.format(now);
            TaskLock lock = new TaskLock();
            lock.agentId = agent.agentId();
            lock.dyad = agent.dyad();
            lock.machine = agent.machine();
            lock.user = agent.user();
            lock.lockToken = Ids.lockToken(now);
            lock.claimedAt = stamp;
            lock.leaseSeconds = lease;
            lock.leaseExpiresAt = Timestamps.format(now.plusSeconds(lease));
            task.assignment = lock;
            task.status = TaskState.DOING;
            task.updatedAt = stamp;
            touchAgent(board, agent, "working", task.id, now);
            clearOtherAgentsForTask(board, task.id, agent.agentId());
            claimed[0] = task;
        });
        log.info("agent {} claimed task {} on board {}", agent.agentId(), claimed[0].id, result.name);
        return new ClaimOutcome(result.name, claimed[0]);
    }

    public BoardTask release(String boardName, String taskId, AgentIdentity agent) {
        requireAgent(agent);
        BoardTask[] released = new BoardTask[1];
        mutate(requireBoardName(boardName), (board, now) -> {
            BoardTask task = findTask(board, taskId);
            if (task.assignment == null) {
                throw new SunException(ErrorKind.NOT_ASSIGNED, "task " + task.id + " is not currently assigned");
            }
            rejectForeignLiveLock(task, agent, now);
            String priorHolder = task.assignment.agentId;
            task.assignment = null;
            if (task.status != TaskState.DONE) {
                task.status = TaskState.TODO;
            }
            task.updatedAt = Timestamps.format(now);
            touchAgent(board, agent, "idle", "", now);
            if (!agent.agentId().equalsIgnoreCase(priorHolder)) {
                setAgentState(board, priorHolder, "idle", "");
            }
            released[0] = task;
        });
        return released[0];
    }

    public BoardTask done(String boardName, String taskId, AgentIdentity agent, String resultText) {
        requireAgent(agent);
        BoardTask[] finished = new BoardTask[1];
        mutate(requireBoardName(boardName), (board, now) -> {
            BoardTask task = findTask(board, taskId);
            if (task.assignment != null) {
                rejectForeignLiveLock(task, agent, now);
                String priorHolder = task.assignment.agentId;
                if (!agent.agentId().equalsIgnoreCase(priorHolder)) {
                    setAgentState(board, priorHolder, "idle", "");
                }
            }
            String stamp = Timestamps.format(now);
            task.status = TaskState.DONE;
            task.assignment = null;
            task.updatedAt = stamp;
            task.completedAt = stamp;
            String cleanResult = Texts.trim(resultText);
            if (!cleanResult.isEmpty()) {
                task.result = cleanResult;
            }
            touchAgent(board, agent, "idle", "", now);
            finished[0] = task;
        });
        return finished[0];
    }

    /**
     * Runs {@code mutation} against the current board and stores it with the observed revision.
     * Only revision conflicts are retried.
     */
    Taskboard mutate(String boardName, Mutation mutation) {
        SunException lastConflict = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Snapshot snapshot = load(boardName);
            Taskboard board = snapshot.board();
            Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
            mutation.apply(board, now);
            board.updatedAt = Timestamps.format(now);
            try {
                persist(boardName, board, snapshot.revision());
                return board;
            } catch (SunException e) {
                if (!SunException.isConflict(e)) {
                    throw e;
                }
                lastConflict = e;
                log.debug("taskboard {} conflict on attempt {}/{}", boardName, attempt, MAX_ATTEMPTS);
            }
        }
        throw new SunException(ErrorKind.TASKBOARD_CONFLICT_EXCEEDED,
                "taskboard update failed after retries: " + lastConflict.getMessage(), lastConflict);
    }

    Snapshot load(String boardName) {
        Optional<ObjectMeta> meta = client.lookupObjectMeta(KIND, boardName);
        if (meta.isEmpty()) {
            return new Snapshot(normalize(Taskboard.empty(boardName), boardName), null);
        }
        Taskboard board = client.getJson(KIND, boardName, Taskboard.class);
        return new Snapshot(normalize(board, boardName), meta.get().latestRevision());
    }

    private void persist(String boardName, Taskboard board, Long expectedRevision) {
        normalize(board, boardName);
        Counts counts = counts(board);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tasks_total", board.tasks.size());
        metadata.put("tasks_todo", counts.todo());
        metadata.put("tasks_doing", counts.doing());
        metadata.put("tasks_done", counts.done());
        PutResult result = client.putObject(KIND, boardName, Jsons.toPrettyBytes(board), CONTENT_TYPE, metadata, expectedRevision);
        log.debug("stored taskboard {} at revision {}", boardName, result.latestRevision());
    }

    static Taskboard normalize(Taskboard board, String fallbackName) {
        if (board == null) {
            board = Taskboard.empty(fallbackName);
        }
        if (board.version < 1) {
            board.version = 1;
        }
        board.name = Texts.firstNonBlank(board.name, fallbackName);
        if (board.tasks == null) {
            board.tasks = new ArrayList<>();
        }
        Map<String, BoardAgent> agents = new LinkedHashMap<>();
        if (board.agents != null) {
            for (Map.Entry<String, BoardAgent> entry : board.agents.entrySet()) {
                BoardAgent agent = entry.getValue() == null ? new BoardAgent() : entry.getValue();
                String key = Texts.firstNonBlank(entry.getKey(), agent.id).toLowerCase(Locale.ROOT);
                if (key.isEmpty()) {
                    continue;
                }
                agent.id = key;
                agents.put(key, agent);
            }
        }
        board.agents = agents;
        List<BoardTask> tasks = new ArrayList<>();
        for (BoardTask task : board.tasks) {
            if (task == null) {
                continue;
            }
            task.id = Texts.trim(task.id);
            task.title = Texts.trim(task.title);
            task.prompt = Texts.firstNonBlank(task.prompt, task.title);
            task.status = task.status == null ? TaskState.TODO : task.status;
            task.priority = task.priority == null ? TaskPriority.P2 : task.priority;
            if (task.tags == null) {
                task.tags = new ArrayList<>();
            }
            if (task.assignment != null) {
                task.assignment.agentId = Texts.trim(task.assignment.agentId).toLowerCase(Locale.ROOT);
                if (task.assignment.agentId.isEmpty() || task.status == TaskState.DONE) {
                    task.assignment = null;
                }
            }
            tasks.add(task);
        }
        board.tasks = tasks;
        return board;
    }

    static BoardTask selectNextClaimable(Taskboard board, Instant now) {
        List<BoardTask> candidates = new ArrayList<>();
        for (BoardTask task : board.tasks) {
            if (task.status == TaskState.DONE) {
                continue;
            }
            if (LockState.of(task.assignment, now) == LockState.LIVE) {
                continue;
            }
            candidates.add(task);
        }
        if (candidates.isEmpty()) {
            throw new SunException(ErrorKind.NO_CLAIMABLE_TASK, "no claimable tasks available");
        }
        candidates.sort(CLAIM_ORDER);
        return candidates.get(0);
    }

    static BoardTask findTask(Taskboard board, String taskId) {
        String wanted = Texts.trim(taskId);
        if (wanted.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "task id required");
        }
        for (BoardTask task : board.tasks) {
            if (task.id.equalsIgnoreCase(wanted)) {
                return task;
            }
        }
        throw new SunException(ErrorKind.TASK_NOT_FOUND, "task \"" + wanted + "\" not found");
    }

    static Counts counts(Taskboard board) {
        int todo = 0;
        int doing = 0;
        int done = 0;
        for (BoardTask task : board.tasks) {
            switch (task.status) {
                case DOING -> doing++;
                case DONE -> done++;
                default -> todo++;
            }
        }
        return new Counts(todo, doing, done);
    }

    private static void rejectForeignLiveLock(BoardTask task, AgentIdentity agent, Instant now) {
        TaskLock lock = task.assignment;
        if (LockState.of(lock, now) == LockState.LIVE && !lock.heldBy(agent.agentId())) {
            throw new SunException(ErrorKind.TASK_LOCKED, "task " + task.id + " is locked by " + lock.agentId);
        }
    }

    private static void touchAgent(Taskboard board, AgentIdentity identity, String status, String taskId, Instant now) {
        BoardAgent agent = board.agents.computeIfAbsent(identity.agentId(), key -> new BoardAgent());
        agent.id = identity.agentId();
        agent.dyad = Texts.firstNonBlank(identity.dyad(), agent.dyad);
        agent.machine = Texts.firstNonBlank(identity.machine(), agent.machine);
        agent.user = Texts.firstNonBlank(identity.user(), agent.user);
        agent.status = status;
        agent.currentTaskId = taskId;
        agent.lastSeenAt = Timestamps.format(now);
    }

    private static void setAgentState(Taskboard board, String agentId, String status, String taskId) {
        String key = Texts.trim(agentId).toLowerCase(Locale.ROOT);
        BoardAgent agent = board.agents.get(key);
        if (agent == null) {
            return;
        }
        agent.status = status;
        agent.currentTaskId = taskId;
    }

    private static void clearOtherAgentsForTask(Taskboard board, String taskId, String keepAgentId) {
        for (BoardAgent agent : board.agents.values()) {
            if (agent.id.equalsIgnoreCase(keepAgentId)) {
                continue;
            }
            if (taskId.equalsIgnoreCase(Texts.trim(agent.currentTaskId))) {
                agent.status = "idle";
                agent.currentTaskId = "";
            }
        }
    }

    private static String requireBoardName(String boardName) {
        String name = Texts.trim(boardName);
        if (name.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "taskboard name required");
        }
        return name;
    }

    private static void requireAgent(AgentIdentity agent) {
        if (agent == null || agent.agentId().isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "agent id required");
        }
    }

    @FunctionalInterface
    interface Mutation {
        void apply(Taskboard board, Instant now);
    }

    record Snapshot(Taskboard board, Long revision) {
    }

    public record Counts(int todo, int doing, int done) {
    }

    public record ShowOutcome(
            String board,
            Long revision,
            String updatedAt,
            Counts counts,
            List<BoardTask> tasks,
            Map<String, BoardAgent> agents
    ) {
    }

    public record ListOutcome(String board, int count, List<BoardTask> tasks) {
    }

    public record ClaimOutcome(String boardName, BoardTask task) {
    }
}
