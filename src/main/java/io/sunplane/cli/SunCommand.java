package io.sunplane.cli;

import io.sunplane.client.AuditEvent;
import io.sunplane.client.IssuedToken;
import io.sunplane.client.ObjectMeta;
import io.sunplane.client.ObjectRevision;
import io.sunplane.client.SunClient;
import io.sunplane.client.SunEndpoint;
import io.sunplane.client.TokenRecord;
import io.sunplane.client.WhoAmI;
import io.sunplane.config.SunConfig;
import io.sunplane.security.SensitiveDataMasker;
import io.sunplane.util.Jsons;
import io.sunplane.util.Texts;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;

@Command(
        name = "sunctl",
        mixinStandardHelpOptions = true,
        version = "sunctl 0.1.0",
        description = "Coordination tools backed by the Sun object store",
        subcommands = {
                SunCommand.DoctorCommand.class,
                SunCommand.WhoAmICommand.class,
                SunCommand.TokenCommand.class,
                SunCommand.AuditCommand.class,
                SunCommand.ObjectCommand.class,
                TaskboardCommand.class,
                MachineCommand.class,
                VaultCommand.class,
                GatewayCommand.class
        }
)
public final class SunCommand implements Runnable {
    @Spec
    CommandSpec spec;

    @Option(names = {"--settings"}, description = "Settings file (default ~/.sunplane/settings.json)")
    String settings;

    @Option(names = {"--json"}, description = "Also report failures as JSON on stdout")
    boolean json;

    private final Function<String, SunConfig> configLoader;
    private SunConfig config;

    public SunCommand() {
        this(SunConfig::fromEnvironment);
    }

    /**
     * @param configLoader receives the {@code --settings} value and returns the resolved configuration
     */
    public SunCommand(Function<String, SunConfig> configLoader) {
        this.configLoader = configLoader;
    }

    public static CommandLine commandLine(SunCommand root) {
        return new CommandLine(root).setExecutionExceptionHandler(new CommandFailureHandler());
    }

    @Override
    public void run() {
        usage(spec);
    }

    SunConfig config() {
        if (config == null) {
            config = configLoader.apply(settings);
        }
        return config;
    }

    SunClient client() {
        return new SunClient(SunEndpoint.fromConfig(config()));
    }

    void print(Object value) {
        PrintWriter out = spec.commandLine().getOut();
        out.println(Jsons.toJson(value));
        out.flush();
    }

    static void usage(CommandSpec spec) {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "doctor", description = "Check connectivity and credentials")
    static final class DoctorCommand implements Callable<Integer> {
        @ParentCommand
        SunCommand root;

        @Override
        public Integer call() {
            SunClient client = root.client();
            client.ready();
            WhoAmI who = client.whoAmI();
            root.print(new DoctorReport(
                    client.endpoint().baseUrl(),
                    SensitiveDataMasker.maskToken(client.endpoint().token()),
                    true,
                    who.accountId(),
                    who.accountSlug(),
                    who.tokenId(),
                    who.scopes() == null ? List.of() : who.scopes()
            ));
            return 0;
        }
    }

    record DoctorReport(
            String baseUrl,
            String token,
            boolean ready,
            String accountId,
            String accountSlug,
            String tokenId,
            List<String> scopes
    ) {
    }

    @Command(name = "whoami", description = "Show the account behind the current token")
    static final class WhoAmICommand implements Callable<Integer> {
        @ParentCommand
        SunCommand root;

        @Override
        public Integer call() {
            root.print(root.client().whoAmI());
            return 0;
        }
    }

    @Command(
            name = "token",
            description = "Manage API tokens",
            subcommands = {
                    TokenListCommand.class,
                    TokenCreateCommand.class,
                    TokenRevokeCommand.class
            }
    )
    static final class TokenCommand implements Runnable {
        @ParentCommand
        SunCommand root;

        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            usage(spec);
        }
    }

    @Command(name = "list", description = "List tokens")
    static final class TokenListCommand implements Callable<Integer> {
        @ParentCommand
        TokenCommand parent;

        @Option(names = {"--include-revoked"}, description = "Include revoked tokens")
        boolean includeRevoked;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            List<TokenRecord> tokens = parent.root.client().listTokens(includeRevoked, limit);
            parent.root.print(SensitiveDataMasker.masked(tokens));
            return 0;
        }
    }

    @Command(name = "create", description = "Issue a token; the secret is shown once")
    static final class TokenCreateCommand implements Callable<Integer> {
        @ParentCommand
        TokenCommand parent;

        @Option(names = {"--label"}, required = true, description = "Token label")
        String label;

        @Option(names = {"--scopes"}, description = "Comma separated scopes")
        String scopes;

        @Option(names = {"--expires-in-hours"}, defaultValue = "0", description = "Expiry in hours (0 = server default)")
        int expiresInHours;

        @Override
        public Integer call() {
            IssuedToken issued = parent.root.client().createToken(label, Texts.splitCsv(scopes), expiresInHours);
            parent.root.print(issued);
            return 0;
        }
    }

    @Command(name = "revoke", description = "Revoke a token")
    static final class TokenRevokeCommand implements Callable<Integer> {
        @ParentCommand
        TokenCommand parent;

        @Option(names = {"--id"}, required = true, description = "Token id")
        String tokenId;

        @Override
        public Integer call() {
            parent.root.client().revokeToken(tokenId);
            parent.root.print(new Revoked(Texts.trim(tokenId), true));
            return 0;
        }
    }

    record Revoked(String tokenId, boolean revoked) {
    }

    @Command(name = "audit", description = "Inspect the audit log", subcommands = {AuditListCommand.class})
    static final class AuditCommand implements Runnable {
        @ParentCommand
        SunCommand root;

        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            usage(spec);
        }
    }

    @Command(name = "list", description = "List audit events")
    static final class AuditListCommand implements Callable<Integer> {
        @ParentCommand
        AuditCommand parent;

        @Option(names = {"--action"}, description = "Filter by action")
        String action;

        @Option(names = {"--kind"}, description = "Filter by object kind")
        String kind;

        @Option(names = {"--name"}, description = "Filter by object name")
        String name;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            List<AuditEvent> events = parent.root.client().listAuditEvents(action, kind, name, limit);
            parent.root.print(SensitiveDataMasker.masked(events));
            return 0;
        }
    }

    @Command(
            name = "object",
            description = "Inspect stored objects",
            subcommands = {ObjectListCommand.class, ObjectRevisionsCommand.class}
    )
    static final class ObjectCommand implements Runnable {
        @ParentCommand
        SunCommand root;

        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            usage(spec);
        }
    }

    @Command(name = "list", description = "List objects")
    static final class ObjectListCommand implements Callable<Integer> {
        @ParentCommand
        ObjectCommand parent;

        @Option(names = {"--kind"}, description = "Filter by kind")
        String kind;

        @Option(names = {"--name"}, description = "Filter by name")
        String name;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            List<ObjectMeta> objects = parent.root.client().listObjects(kind, name, limit);
            parent.root.print(objects);
            return 0;
        }
    }

    @Command(name = "revisions", description = "List revisions of one object")
    static final class ObjectRevisionsCommand implements Callable<Integer> {
        @ParentCommand
        ObjectCommand parent;

        @Option(names = {"--kind"}, required = true, description = "Object kind")
        String kind;

        @Option(names = {"--name"}, required = true, description = "Object name")
        String name;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            List<ObjectRevision> revisions = parent.root.client().listRevisions(kind, name, limit);
            parent.root.print(revisions);
            return 0;
        }
    }
}
