package io.sunplane.cli;

import io.sunplane.config.SunConfig;
import io.sunplane.vault.VaultSyncService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "vault", description = "Encrypted dotenv backups", subcommands = {VaultCommand.SyncCommand.class})
final class VaultCommand implements Runnable {
    @ParentCommand
    SunCommand root;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        SunCommand.usage(spec);
    }

    @Command(
            name = "sync",
            description = "Push, pull or compare a vault backup",
            subcommands = {PushCommand.class, PullCommand.class, StatusCommand.class}
    )
    static final class SyncCommand implements Runnable {
        @ParentCommand
        VaultCommand vault;

        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            SunCommand.usage(spec);
        }

        SunCommand root() {
            return vault.root;
        }

        VaultSyncService service() {
            return new VaultSyncService(root().client());
        }
    }

    @Command(name = "push", description = "Upload the local vault file")
    static final class PushCommand implements Callable<Integer> {
        @ParentCommand
        SyncCommand parent;

        @Option(names = {"--file"}, description = "Vault file (default ~/.sunplane/vault/.env)")
        String file;

        @Option(names = {"--name"}, description = "Backup name")
        String name;

        @Option(names = {"--allow-plaintext"}, description = "Upload even if some values are not encrypted")
        boolean allowPlaintext;

        @Override
        public Integer call() {
            SunConfig config = parent.root().config();
            parent.root().print(parent.service().push(config.vaultFile(file), config.vaultBackup(name), allowPlaintext));
            return 0;
        }
    }

    @Command(name = "pull", description = "Download and verify a backup, replacing the local file")
    static final class PullCommand implements Callable<Integer> {
        @ParentCommand
        SyncCommand parent;

        @Option(names = {"--file"}, description = "Vault file (default ~/.sunplane/vault/.env)")
        String file;

        @Option(names = {"--name"}, description = "Backup name")
        String name;

        @Override
        public Integer call() {
            SunConfig config = parent.root().config();
            parent.root().print(parent.service().pull(config.vaultFile(file), config.vaultBackup(name)));
            return 0;
        }
    }

    @Command(name = "status", description = "Compare the local file with the stored backup")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        SyncCommand parent;

        @Option(names = {"--file"}, description = "Vault file (default ~/.sunplane/vault/.env)")
        String file;

        @Option(names = {"--name"}, description = "Backup name")
        String name;

        @Override
        public Integer call() {
            SunConfig config = parent.root().config();
            parent.root().print(parent.service().status(config.vaultFile(file), config.vaultBackup(name)));
            return 0;
        }
    }
}
