package io.sunplane.taskboard;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.SunException;
import io.sunplane.testing.FakeSunServer;
import io.sunplane.testing.MutableClock;
import io.sunplane.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class TaskboardServiceTest {
    private static final Instant START = Instant.parse("2026-02-01T12:00:00Z");
    private static final String SEEDED_BOARD = "{\"version\":1,\"name\":\"b\",\"tasks\":["
            + "{\"id\":\"t1\",\"title\":\"one\",\"status\":\"todo\",\"priority\":\"P2\",\"created_at\":\"2026-01-01T00:00:00Z\"},"
            + "{\"id\":\"t2\",\"title\":\"two\",\"status\":\"todo\",\"priority\":\"P1\",\"created_at\":\"2026-01-01T01:00:00Z\"},"
            + "{\"id\":\"t3\",\"title\":\"three\",\"status\":\"todo\",\"priority\":\"P2\",\"created_at\":\"2025-12-31T00:00:00Z\"}"
            + "]}";

    private static AgentIdentity agent(String id) {
        return new AgentIdentity(id, "", "host", "user");
    }

    @Test
    void claimsWithoutTaskIdFollowPriorityThenAgeThenId() throws Exception {
        try (FakeSunServer server = FakeSunServer.start()) {
            seed(server, SEEDED_BOARD);
            TaskboardService service = new TaskboardService(server.client(), new MutableClock(START));

            List<String> order = new ArrayList<>();
            for (String id : new String[]{"a1", "a2", "a3"}) {
                order.add(service.claim("b", null, agent(id), 60).task().id);
            }

            Assertions.assertEquals(List.of("t2", "t3", "t1"), order);
            SunException exhausted = Assertions.assertThrows(SunException.class,
                    () -> service.claim("b", null, agent("a4"), 60));
            Assertions.assertEquals(ErrorKind.NO_CLAIMABLE_TASK, exhausted.kind());
        }
    }

    @Test
    void concurrentClaimsEachGetADistinctTask() throws Exception {
        try (FakeSunServer server = FakeSunServer.start()) {
            seed(server, SEEDED_BOARD);
            TaskboardService service = new TaskboardService(server.client());
            List<String> claimed = runConcurrently(3, i -> service.claim("b", null, agent("agent-" + i), 600).task().id);

            Assertions.assertEquals(Set.of("t1", "t2", "t3"), new HashSet<>(claimed));
            TaskboardService.ShowOutcome shown = service.show("b");
            Assertions.assertEquals(new TaskboardService.Counts(0, 3, 0), shown.counts());
            for (BoardTask task : shown.tasks()) {
                BoardAgent holder = shown.agents().get(task.assignment.agentId);
                Assertions.assertEquals(task.id, holder.currentTaskId);
                Assertions.assertEquals("working", holder.status);
            }
        }
    }

    @Test
    void concurrentAddsToAnExistingBoardAllLandWithDistinctIds() throws Exception {
        try (FakeSunServer server = FakeSunServer.start()) {
            // existing board only: the very first write of a new board carries no expected revision
            seed(server, "{\"name\":\"b\"}");
            TaskboardService first = new TaskboardService(server.client());
            TaskboardService second = new TaskboardService(server.client());

            List<String> ids = runConcurrently(4, i -> (i % 2 == 0 ? first : second).add("b", "T", null, null, null).id);

            Assertions.assertEquals(4, new HashSet<>(ids).size());
            Assertions.assertEquals(4, first.show("b").tasks().size());
        }
    }

    @Test
    void addNormalizesFieldsAndRecordsCountsInMetadata() throws Exception {
        try (FakeSunServer server = FakeSunServer.start()) {
            TaskboardService service = new TaskboardService(server.client(), new MutableClock(START));

            BoardTask task = service.add("b", "  Ship it ", null, " p1 ", List.of(" x ", "", "x", "y"));

            Assertions.assertTrue(task.id.startsWith("tsk-20260201-120000-"));
            Assertions.assertEquals("Ship it", task.title);
            Assertions.assertEquals("Ship it", task.prompt);
            Assertions.assertEquals(TaskPriority.P1, task.priority);
            Assertions.assertEquals(List.of("x", "y"), task.tags);
            Assertions.assertEquals(TaskState.TODO, task.status);
            Map<?, ?> stored = Jsons.read(server.payload(TaskboardService.KIND, "b"), Map.class);
            Assertions.assertEquals("b", stored.get("name"));
            Assertions.assertEquals(1L, server.latestRevision(TaskboardService.KIND, "b"));
            Assertions.assertEquals(1, server.client().lookupObjectMeta(TaskboardService.KIND, "b").orElseThrow()
                    .metadata().get("tasks_todo"));
            SunException blank = Assertions.assertThrows(SunException.class, () -> service.add("b", " ", null, null, null));
            Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, blank.kind());
        }
    }

    @Test
    void claimSetsLeaseAndLiveLockBlocksOthersUntilExpiry() throws Exception {
        try (FakeSunServer server = FakeSunServer.start()) {
            seed(server, SEEDED_BOARD);
            MutableClock clock = new MutableClock(START);
            TaskboardService service = new TaskboardService(server.client(), clock);

            BoardTask claimed = service.claim("b", "t1", agent("Alpha"), 60).task();
            Assertions.assertEquals(TaskState.DOING, claimed.status);
            Assertions.assertEquals("alpha", claimed.assignment.agentId);
            Assertions.assertEquals("2026-02-01T12:01:00Z", claimed.assignment.leaseExpiresAt);
            Assertions.assertTrue(claimed.assignment.lockToken.matches("lock-\\d+-\\d{6}"));

            clock.advance(Duration.ofSeconds(30));
            SunException locked = Assertions.assertThrows(SunException.class,
                    () -> service.claim("b", "t1", agent("beta"), 60));
            Assertions.assertEquals(ErrorKind.TASK_LOCKED, locked.kind());
            Assertions.assertTrue(locked.getMessage().contains("alpha"));
            Assertions.assertEquals("alpha", service.claim("b", "T1", agent("ALPHA"), 60).task().assignment.agentId);

            clock.advance(Duration.ofSeconds(120));
            BoardTask stolen = service.claim("b", "t1", agent("beta"), 60).task();
            Assertions.assertEquals("beta", stolen.assignment.agentId);
            TaskboardService.ShowOutcome shown = service.show("b");
            Assertions.assertEquals("", shown.agents().get("alpha").currentTaskId);
            Assertions.assertEquals("idle", shown.agents().get("alpha").status);
            Assertions.assertEquals("t1", shown.agents().get("beta").currentTaskId);
        }
    }

    @Test
    void releaseReturnsTaskToTodoAndIdlesAgents() throws Exception {
        try (FakeSunServer server = FakeSunServer.start()) {
            seed(server, SEEDED_BOARD);
            MutableClock clock = new MutableClock(START);
            TaskboardService service = new TaskboardService(server.client(), clock);

            SunException unassigned = Assertions.assertThrows(SunException.class,
                    () -> service.release("b", "t1", agent("alpha")));
            Assertions.assertEquals(ErrorKind.NOT_ASSIGNED, unassigned.kind());

            service.claim("b", "t1", agent("alpha"), 60);
            SunException foreign = Assertions.assertThrows(SunException.class,
                    () -> service.release("b", "t1", agent("beta")));
            Assertions.assertEquals(ErrorKind.TASK_LOCKED, foreign.kind());

            BoardTask released = service.release("b", "t1", agent("alpha"));
            Assertions.assertEquals(TaskState.TODO, released.status);
            Assertions.assertNull(released.assignment);
            Assertions.assertEquals("idle", service.show("b").agents().get("alpha").status);

            service.claim("b", "t1", agent("alpha"), 60);
            clock.advance(Duration.ofMinutes(5));
            service.release("b", "t1", agent("beta"));
            Map<String, BoardAgent> agents = service.show("b").agents();
            Assertions.assertEquals("idle", agents.get("alpha").status);
            Assertions.assertEquals("idle", agents.get("beta").status);
        }
    }

    @Test
    void doneClearsAssignmentAndBlocksFurtherClaims() throws Exception {
        try (FakeSunServer server = FakeSunServer.start()) {
            seed(server, SEEDED_BOARD);
            TaskboardService service = new TaskboardService(server.client(), new MutableClock(START));
            service.claim("b", "t2", agent("alpha"), 60);

            SunException foreign = Assertions.assertThrows(SunException.class,
                    () -> service.done("b", "t2", agent("beta"), "nope"));
            Assertions.assertEquals(ErrorKind.TASK_LOCKED, foreign.kind());

            BoardTask done = service.done("b", "t2", agent("alpha"), " shipped ");
            Assertions.assertEquals(TaskState.DONE, done.status);
            Assertions.assertNull(done.assignment);
            Assertions.assertEquals("shipped", done.result);
            Assertions.assertNotNull(done.completedAt);

            SunException again = Assertions.assertThrows(SunException.class,
                    () -> service.claim("b", "t2", agent("alpha"), 60));
            Assertions.assertEquals(ErrorKind.ALREADY_DONE, again.kind());
            SunException missing = Assertions.assertThrows(SunException.class,
                    () -> service.claim("b", "t9", agent("alpha"), 60));
            Assertions.assertEquals(ErrorKind.TASK_NOT_FOUND, missing.kind());
        }
    }

    @Test
    void listFiltersByStatusOwnerAndLimit() throws Exception {
        try (FakeSunServer server = FakeSunServer.start()) {
            seed(server, SEEDED_BOARD);
            TaskboardService service = new TaskboardService(server.client(), new MutableClock(START));
            service.claim("b", "t3", agent("alpha"), 60);

            Assertions.assertEquals(2, service.list("b", "todo", null, 0).count());
            Assertions.assertEquals(List.of("t3"), ids(service.list("b", null, "ALPHA", 0).tasks()));
            Assertions.assertEquals(List.of("t3"), ids(service.list("b", null, null, 1).tasks()));
            SunException invalid = Assertions.assertThrows(SunException.class,
                    () -> service.list("b", "blocked", null, 0));
            Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, invalid.kind());
        }
    }

    @Test
    void emptyBoardHasNothingToClaim() throws Exception {
        try (FakeSunServer server = FakeSunServer.start()) {
            TaskboardService service = new TaskboardService(server.client());

            SunException error = Assertions.assertThrows(SunException.class,
                    () -> service.claim("fresh", null, agent("alpha"), 0));

            Assertions.assertEquals(ErrorKind.NO_CLAIMABLE_TASK, error.kind());
            Assertions.assertEquals(0, service.show("fresh").tasks().size());
        }
    }

    @Test
    void conflictsAreRetriedUpToTheAttemptBudget() throws Exception {
        try (FakeSunServer server = FakeSunServer.start()) {
            seed(server, "{\"name\":\"b\"}");
            TaskboardService service = new TaskboardService(server.client());

            server.forcePutConflicts(TaskboardService.MAX_ATTEMPTS - 1);
            Assertions.assertNotNull(service.add("b", "survives churn", null, null, null));

            server.forcePutConflicts(TaskboardService.MAX_ATTEMPTS);
            SunException exhausted = Assertions.assertThrows(SunException.class,
                    () -> service.add("b", "gives up", null, null, null));
            Assertions.assertEquals(ErrorKind.TASKBOARD_CONFLICT_EXCEEDED, exhausted.kind());
            Assertions.assertEquals(1, service.show("b").tasks().size());
        }
    }

    @Test
    void normalizeRepairsLooseDocuments() throws Exception {
        Taskboard board = Jsons.read(("{\"version\":0,\"agents\":{\"Alpha\":{\"status\":\"idle\"}},\"tasks\":["
                + "{\"id\":\" x \",\"title\":\"t\",\"status\":\"Completed\",\"assignment\":{\"agent_id\":\"ALPHA\"}},"
                + "{\"id\":\"y\",\"title\":\"u\",\"status\":\"weird\",\"priority\":\"urgent\",\"assignment\":{\"agent_id\":\" \"}}"
                + "]}").getBytes(StandardCharsets.UTF_8), Taskboard.class);

        TaskboardService.normalize(board, "fallback");

        Assertions.assertEquals(1, board.version);
        Assertions.assertEquals("fallback", board.name);
        Assertions.assertTrue(board.agents.containsKey("alpha"));
        Assertions.assertEquals("x", board.tasks.get(0).id);
        Assertions.assertEquals(TaskState.DONE, board.tasks.get(0).status);
        Assertions.assertNull(board.tasks.get(0).assignment);
        Assertions.assertEquals(TaskState.TODO, board.tasks.get(1).status);
        Assertions.assertNull(board.tasks.get(1).assignment);
        Assertions.assertEquals("u", board.tasks.get(1).prompt);
    }

    private static List<String> ids(List<BoardTask> tasks) {
        List<String> out = new ArrayList<>();
        for (BoardTask task : tasks) {
            out.add(task.id);
        }
        return out;
    }

    private static void seed(FakeSunServer server, String json) {
        server.seedObject(TaskboardService.KIND, "b", json.getBytes(StandardCharsets.UTF_8), "application/json", null);
    }

    private interface Indexed<T> {
        T call(int index) throws Exception;
    }

    private static <T> List<T> runConcurrently(int workers, Indexed<T> work) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                int index = i;
                Callable<T> task = () -> {
                    start.await();
                    return work.call(index);
                };
                futures.add(pool.submit(task));
            }
            start.countDown();
            List<T> out = new ArrayList<>();
            for (Future<T> future : futures) {
                out.add(future.get(30, TimeUnit.SECONDS));
            }
            return out;
        } finally {
            pool.shutdownNow();
        }
    }
}
