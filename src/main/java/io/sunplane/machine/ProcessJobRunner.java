package io.sunplane.machine;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.SunException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs jobs as child processes of {@code launcher + args}. Output is spooled to temp files
 * so a chatty child never blocks on a full pipe.
 */
public final class ProcessJobRunner implements JobRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessJobRunner.class);

    private final List<String> launcher;

    public ProcessJobRunner(List<String> launcher) {
        if (launcher == null || launcher.isEmpty()) {
            throw new IllegalArgumentException("job launcher cannot be empty");
        }
        this.launcher = List.copyOf(launcher);
    }

    /**
     * Re-invokes this CLI: {@code selfCommand} when configured, otherwise the running JVM with the current class path.
     */
    public static ProcessJobRunner forSelf(List<String> selfCommand) {
        if (selfCommand != null && !selfCommand.isEmpty()) {
            return new ProcessJobRunner(selfCommand);
        }
        String java = ProcessHandle.current().info().command().orElse("java");
        return new ProcessJobRunner(List.of(java, "-cp", System.getProperty("java.class.path", "."), "io.sunplane.Main"));
    }

    public List<String> launcher() {
        return launcher;
    }

    @Override
    public JobRunResult run(List<String> args, Duration timeout) {
        List<String> command = new ArrayList<>(launcher);
        for (String arg : args) {
            String trimmed = arg == null ? "" : arg.trim();
            if (!trimmed.isEmpty()) {
                command.add(trimmed);
            }
        }
        if (command.size() == launcher.size()) {
            return JobRunResult.failed("empty command");
        }
        Path out = null;
        Path err = null;
        try {
            out = Files.createTempFile("sunplane-job-", ".out");
            err = Files.createTempFile("sunplane-job-", ".err");
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.environment().put("NO_COLOR", "1");
            pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
            pb.redirectOutput(out.toFile());
            pb.redirectError(err.toFile());
            log.debug("starting job process {}", command);
            return execute(pb, out, err, timeout);
        } catch (IOException e) {
            return JobRunResult.failed("job spawn failed: " + e.getMessage());
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    private JobRunResult execute(ProcessBuilder pb, Path out, Path err, Duration timeout) throws IOException {
        Process process = pb.start();
        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return new JobRunResult(read(out), read(err), 1, "command timed out after " + timeout.toSeconds() + "s");
            }
            return new JobRunResult(read(out), read(err), process.exitValue(), null);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new SunException(ErrorKind.CANCELLED, "job execution interrupted", e);
        }
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static java.io.File nullDevice() {
        boolean windows = System.getProperty("os.name", "").toLowerCase().startsWith("windows");
        return new java.io.File(windows ? "NUL" : "/dev/null");
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("could not delete job spool file {}: {}", file, e.getMessage());
        }
    }
}
