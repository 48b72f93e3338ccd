package io.sunplane.cli;

import io.sunplane.config.SunConfig;
import io.sunplane.taskboard.AgentIdentity;
import io.sunplane.taskboard.BoardTask;
import io.sunplane.taskboard.TaskboardService;
import io.sunplane.util.Texts;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
        name = "taskboard",
        description = "Shared task board with leased claims",
        subcommands = {
                TaskboardCommand.ShowCommand.class,
                TaskboardCommand.ListCommand.class,
                TaskboardCommand.AddCommand.class,
                TaskboardCommand.ClaimCommand.class,
                TaskboardCommand.ReleaseCommand.class,
                TaskboardCommand.DoneCommand.class
        }
)
final class TaskboardCommand implements Runnable {
    @ParentCommand
    SunCommand root;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        SunCommand.usage(spec);
    }

    TaskboardService service() {
        return new TaskboardService(root.client());
    }

    String board(String explicit) {
        return root.config().taskboardName(explicit);
    }

    static final class AgentOptions {
        @Option(names = {"--agent"}, description = "Agent id (default dyad:<dyad or user>@<machine>)")
        String agent;

        @Option(names = {"--dyad"}, description = "Dyad slug used in the synthesized agent id")
        String dyad;

        @Option(names = {"--machine"}, description = "Machine slug used in the synthesized agent id")
        String machine;

        AgentIdentity identity(SunConfig config) {
            return AgentIdentity.resolve(config, agent, dyad, machine);
        }
    }

    @Command(name = "show", description = "Show a board with counts")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        TaskboardCommand parent;

        @Option(names = {"--name"}, description = "Board name")
        String name;

        @Override
        public Integer call() {
            parent.root.print(parent.service().show(parent.board(name)));
            return 0;
        }
    }

    @Command(name = "list", description = "List tasks")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        TaskboardCommand parent;

        @Option(names = {"--name"}, description = "Board name")
        String name;

        @Option(names = {"--status"}, description = "Filter by status: todo|doing|done")
        String status;

        @Option(names = {"--owner"}, description = "Filter by assigned agent id")
        String owner;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows (0 = all)")
        int limit;

        @Override
        public Integer call() {
            parent.root.print(parent.service().list(parent.board(name), status, owner, limit));
            return 0;
        }
    }

    @Command(name = "add", description = "Add a task")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        TaskboardCommand parent;

        @Option(names = {"--name"}, description = "Board name")
        String name;

        @Option(names = {"--title"}, required = true, description = "Task title")
        String title;

        @Option(names = {"--prompt"}, description = "Task prompt")
        String prompt;

        @Option(names = {"--priority"}, description = "Priority: P1|P2|P3")
        String priority;

        @Option(names = {"--tags"}, description = "Comma separated tags")
        String tags;

        @Override
        public Integer call() {
            BoardTask task = parent.service().add(parent.board(name), title, prompt, priority, Texts.splitCsv(tags));
            parent.root.print(task);
            return 0;
        }
    }

    @Command(name = "claim", description = "Claim a task (the next claimable one when --id is omitted)")
    static final class ClaimCommand implements Callable<Integer> {
        @ParentCommand
        TaskboardCommand parent;

        @Mixin
        AgentOptions agent;

        @Option(names = {"--name"}, description = "Board name")
        String name;

        @Option(names = {"--id"}, description = "Task id")
        String taskId;

        @Option(names = {"--lease-seconds"}, defaultValue = "0", description = "Lease length in seconds")
        int leaseSeconds;

        @Override
        public Integer call() {
            SunConfig config = parent.root.config();
            TaskboardService.ClaimOutcome outcome = parent.service().claim(
                    parent.board(name), taskId, agent.identity(config), config.leaseSeconds(leaseSeconds));
            parent.root.print(outcome);
            return 0;
        }
    }

    @Command(name = "release", description = "Release a claimed task back to todo")
    static final class ReleaseCommand implements Callable<Integer> {
        @ParentCommand
        TaskboardCommand parent;

        @Mixin
        AgentOptions agent;

        @Option(names = {"--name"}, description = "Board name")
        String name;

        @Option(names = {"--id"}, required = true, description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            BoardTask task = parent.service().release(parent.board(name), taskId, agent.identity(parent.root.config()));
            parent.root.print(task);
            return 0;
        }
    }

    @Command(name = "done", description = "Mark a task done")
    static final class DoneCommand implements Callable<Integer> {
        @ParentCommand
        TaskboardCommand parent;

        @Mixin
        AgentOptions agent;

        @Option(names = {"--name"}, description = "Board name")
        String name;

        @Option(names = {"--id"}, required = true, description = "Task id")
        String taskId;

        @Option(names = {"--result"}, description = "Result summary")
        String result;

        @Override
        public Integer call() {
            BoardTask task = parent.service().done(parent.board(name), taskId, agent.identity(parent.root.config()), result);
            parent.root.print(task);
            return 0;
        }
    }
}
