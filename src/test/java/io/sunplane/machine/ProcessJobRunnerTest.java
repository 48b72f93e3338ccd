package io.sunplane.machine;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

final class ProcessJobRunnerTest {

    private static ProcessJobRunner shell() {
        Assumptions.assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "needs /bin/sh");
        return new ProcessJobRunner(List.of("/bin/sh", "-c"));
    }

    @Test
    void capturesOutputAndExitCode() {
        JobRunResult result = shell().run(List.of(" echo out; echo err 1>&2; exit 3 "), Duration.ofSeconds(10));

        Assertions.assertEquals("out\n", result.stdout());
        Assertions.assertEquals("err\n", result.stderr());
        Assertions.assertEquals(3, result.exitCode());
        Assertions.assertNull(result.error());
    }

    @Test
    void killsCommandsThatOutliveTheirTimeout() {
        JobRunResult result = shell().run(List.of("sleep 5"), Duration.ofMillis(200));

        Assertions.assertEquals(1, result.exitCode());
        Assertions.assertTrue(result.error().contains("timed out"));
    }

    @Test
    void blankCommandIsNotStarted() {
        JobRunResult result = new ProcessJobRunner(List.of("does-not-matter")).run(List.of(" ", ""), Duration.ofSeconds(1));

        Assertions.assertEquals("empty command", result.error());
    }

    @Test
    void selfLauncherPrefersConfiguredCommand() {
        Assertions.assertEquals(List.of("sunctl"), ProcessJobRunner.forSelf(List.of("sunctl")).launcher());
        List<String> jvm = ProcessJobRunner.forSelf(null).launcher();
        Assertions.assertEquals("io.sunplane.Main", jvm.get(jvm.size() - 1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ProcessJobRunner(List.of()));
    }
}
