package io.sunplane.cli;

import io.sunplane.config.SunConfig;
import io.sunplane.machine.MachineControlService;
import io.sunplane.machine.MachineJob;
import io.sunplane.machine.MachineRecord;
import io.sunplane.machine.ProcessJobRunner;
import io.sunplane.util.Texts;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "machine",
        description = "Remote control of registered machines",
        subcommands = {
                MachineCommand.RegisterCommand.class,
                MachineCommand.StatusCommand.class,
                MachineCommand.ListCommand.class,
                MachineCommand.AllowCommand.class,
                MachineCommand.DenyCommand.class,
                MachineCommand.RunCommand.class,
                MachineCommand.JobsCommand.class,
                MachineCommand.ServeCommand.class
        }
)
final class MachineCommand implements Runnable {
    static final int MIN_POLL_SECONDS = 1;
    static final int MIN_WAIT_SECONDS = 10;

    @ParentCommand
    SunCommand root;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        SunCommand.usage(spec);
    }

    MachineControlService service() {
        return new MachineControlService(root.client(), ProcessJobRunner.forSelf(root.config().selfCommand()));
    }

    String machine(String explicit) {
        return root.config().machineId(explicit);
    }

    String operator(String explicit, String machine) {
        return root.config().operatorId(explicit, machine);
    }

    @Command(name = "register", description = "Register or update this machine")
    static final class RegisterCommand implements Callable<Integer> {
        @ParentCommand
        MachineCommand parent;

        @Option(names = {"--machine"}, description = "Machine id (default: host name)")
        String machineId;

        @Option(names = {"--operator"}, description = "Operator id (default op:<user>@<machine>)")
        String operatorId;

        @Option(names = {"--display-name"}, description = "Human readable name")
        String displayName;

        @Option(names = {"--allow-operators"}, description = "Comma separated operators to add to the ACL")
        String allowOperators;

        @Option(names = {"--can-control-others"}, arity = "0..1", fallbackValue = "true",
                description = "Whether this machine may enqueue jobs elsewhere")
        Boolean canControlOthers;

        @Option(names = {"--can-be-controlled"}, arity = "0..1", fallbackValue = "true",
                description = "Whether this machine accepts remote jobs")
        Boolean canBeControlled;

        @Override
        public Integer call() {
            String machine = parent.machine(machineId);
            MachineControlService.MachineUpdate update = parent.service().register(new MachineControlService.RegisterRequest(
                    machine,
                    parent.operator(operatorId, machine),
                    displayName,
                    Texts.splitCsv(allowOperators),
                    canControlOthers,
                    canBeControlled
            ));
            parent.root.print(update);
            return 0;
        }
    }

    @Command(name = "status", description = "Show one machine record")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        MachineCommand parent;

        @Option(names = {"--machine"}, description = "Machine id (default: this machine)")
        String machineId;

        @Override
        public Integer call() {
            MachineRecord record = parent.service().status(parent.machine(machineId));
            parent.root.print(record);
            return 0;
        }
    }

    @Command(name = "list", description = "List registered machines")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        MachineCommand parent;

        @Option(names = {"--limit"}, defaultValue = "200", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            parent.root.print(parent.service().list(limit));
            return 0;
        }
    }

    @Command(name = "allow", description = "Grant an operator access (owner only)")
    static final class AllowCommand implements Callable<Integer> {
        @ParentCommand
        MachineCommand parent;

        @Option(names = {"--machine"}, description = "Machine id (default: this machine)")
        String machineId;

        @Option(names = {"--operator"}, description = "Acting operator id")
        String operatorId;

        @Option(names = {"--grant"}, required = true, description = "Operator to allow")
        String grant;

        @Override
        public Integer call() {
            String machine = parent.machine(machineId);
            parent.root.print(parent.service().allow(machine, grant, parent.operator(operatorId, parent.machine(null))));
            return 0;
        }
    }

    @Command(name = "deny", description = "Revoke an operator's access (owner only)")
    static final class DenyCommand implements Callable<Integer> {
        @ParentCommand
        MachineCommand parent;

        @Option(names = {"--machine"}, description = "Machine id (default: this machine)")
        String machineId;

        @Option(names = {"--operator"}, description = "Acting operator id")
        String operatorId;

        @Option(names = {"--revoke"}, required = true, description = "Operator to remove")
        String revoke;

        @Override
        public Integer call() {
            String machine = parent.machine(machineId);
            parent.root.print(parent.service().deny(machine, revoke, parent.operator(operatorId, parent.machine(null))));
            return 0;
        }
    }

    @Command(name = "run", description = "Enqueue a command on a remote machine: run --machine <id> -- <args>")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        MachineCommand parent;

        @Option(names = {"--machine"}, required = true, description = "Target machine id")
        String target;

        @Option(names = {"--source"}, description = "Source machine id (default: this machine)")
        String source;

        @Option(names = {"--operator"}, description = "Operator id")
        String operatorId;

        @Option(names = {"--timeout-seconds"}, defaultValue = "900", description = "Remote execution timeout")
        int timeoutSeconds;

        @Option(names = {"--wait"}, description = "Wait for the job to finish")
        boolean waitForResult;

        @Option(names = {"--wait-timeout-seconds"}, defaultValue = "1200", description = "How long --wait polls")
        int waitTimeoutSeconds;

        @Option(names = {"--poll-seconds"}, defaultValue = "2", description = "Poll interval for --wait")
        int pollSeconds;

        @Parameters(arity = "0..*", description = "Command to run remotely")
        List<String> command = new ArrayList<>();

        @Override
        public Integer call() {
            String sourceMachine = parent.machine(source);
            MachineControlService.RunOutcome outcome = parent.service().run(new MachineControlService.RunRequest(
                    target,
                    sourceMachine,
                    parent.operator(operatorId, sourceMachine),
                    command,
                    timeoutSeconds,
                    waitForResult,
                    Duration.ofSeconds(Math.max(MIN_WAIT_SECONDS, waitTimeoutSeconds)),
                    Duration.ofSeconds(Math.max(MIN_POLL_SECONDS, pollSeconds))
            ));
            parent.root.print(outcome);
            if (waitForResult) {
                MachineJob job = outcome.job();
                MachineControlService.failureOf(job).ifPresent(failure -> {
                    throw failure;
                });
            }
            return 0;
        }
    }

    @Command(name = "jobs", description = "List remote jobs")
    static final class JobsCommand implements Callable<Integer> {
        @ParentCommand
        MachineCommand parent;

        @Option(names = {"--machine"}, description = "Filter by target machine")
        String machineId;

        @Option(names = {"--requested-by"}, description = "Filter by requesting operator")
        String requestedBy;

        @Option(names = {"--status"}, description = "Filter by status: queued|running|succeeded|failed|denied")
        String status;

        @Option(names = {"--limit"}, defaultValue = "200", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            parent.root.print(parent.service().jobs(machineId, requestedBy, status, limit));
            return 0;
        }
    }

    @Command(name = "serve", description = "Execute jobs queued for this machine")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        MachineCommand parent;

        @Option(names = {"--machine"}, description = "Machine id (default: this machine)")
        String machineId;

        @Option(names = {"--poll-seconds"}, defaultValue = "2", description = "Queue poll interval")
        int pollSeconds;

        @Option(names = {"--once"}, description = "Process at most one job and exit")
        boolean once;

        @Option(names = {"--max-jobs"}, defaultValue = "0", description = "Stop after this many jobs (0 = no limit)")
        int maxJobs;

        @Override
        public Integer call() {
            SunConfig config = parent.root.config();
            MachineControlService.ServeSummary summary = parent.service().serve(new MachineControlService.ServeRequest(
                    config.machineId(machineId),
                    Duration.ofSeconds(Math.max(MIN_POLL_SECONDS, pollSeconds)),
                    once,
                    maxJobs
            ));
            parent.root.print(summary);
            return 0;
        }
    }
}
