package io.sunplane.cli;

import io.sunplane.config.SunConfig;
import io.sunplane.gateway.CatalogBuilder;
import io.sunplane.gateway.Diagnostic;
import io.sunplane.gateway.GatewayBuilder;
import io.sunplane.gateway.GatewayService;
import io.sunplane.util.Texts;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "gateway",
        description = "Sharded integration catalog registries",
        subcommands = {
                GatewayCommand.BuildCommand.class,
                GatewayCommand.PushCommand.class,
                GatewayCommand.PullCommand.class,
                GatewayCommand.StatusCommand.class
        }
)
final class GatewayCommand implements Runnable {
    @ParentCommand
    SunCommand root;

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        SunCommand.usage(spec);
    }

    GatewayService service() {
        return new GatewayService(root.client());
    }

    static final class SourceOptions {
        @Option(names = {"--source"}, required = true, description = "Manifest file or directory of manifests")
        String source;

        @Option(names = {"--registry"}, description = "Registry name (default: global)")
        String registry;

        @Option(names = {"--slots"}, defaultValue = "0", description = "Shards per namespace (default 16, max 256)")
        int slots;

        @Option(names = {"--channel"}, defaultValue = "community", description = "Catalog channel")
        String channel;

        @Option(names = {"--verified"}, description = "Mark entries as verified")
        boolean verified;

        @Option(names = {"--tags"}, description = "Comma separated tags added to every entry")
        String tags;

        CatalogBuilder.Result catalog() {
            CatalogBuilder.Options options = new CatalogBuilder.Options(channel, verified, null, Texts.splitCsv(tags));
            return new CatalogBuilder(Clock.systemUTC()).build(Paths.get(source), options);
        }
    }

    @Command(name = "build", description = "Build a registry locally without publishing it")
    static final class BuildCommand implements Callable<Integer> {
        @ParentCommand
        GatewayCommand parent;

        @Mixin
        SourceOptions options;

        @Option(names = {"--output-dir"}, description = "Write index.json and shards/ here")
        String outputDir;

        @Override
        public Integer call() {
            SunConfig config = parent.root.config();
            CatalogBuilder.Result built = options.catalog();
            GatewayBuilder.Gateway gateway = GatewayBuilder.build(built.catalog(),
                    config.gatewayRegistry(options.registry), config.gatewaySlots(options.slots), Clock.systemUTC().instant());
            String written = null;
            if (!Texts.isBlank(outputDir)) {
                Path dir = SunConfig.expandHome(outputDir, config.homeDir());
                GatewayService.writeBundle(dir, gateway);
                written = dir.toString();
            }
            parent.root.print(new BuildReport(
                    gateway.index().registry,
                    gateway.index().totalEntries,
                    gateway.shards().size(),
                    written,
                    built.diagnostics()
            ));
            return 0;
        }
    }

    record BuildReport(String registry, int totalEntries, int shards, String outputDir, List<Diagnostic> diagnostics) {
    }

    @Command(name = "push", description = "Build and publish a registry")
    static final class PushCommand implements Callable<Integer> {
        @ParentCommand
        GatewayCommand parent;

        @Mixin
        SourceOptions options;

        @Override
        public Integer call() {
            SunConfig config = parent.root.config();
            GatewayService.PublishOutcome outcome = parent.service().publish(options.catalog(),
                    config.gatewayRegistry(options.registry), config.gatewaySlots(options.slots));
            parent.root.print(outcome);
            return 0;
        }
    }

    @Command(name = "pull", description = "Fetch matching shards and write a catalog file")
    static final class PullCommand implements Callable<Integer> {
        @ParentCommand
        GatewayCommand parent;

        @Option(names = {"--registry"}, description = "Registry name (default: global)")
        String registry;

        @Option(names = {"--namespace"}, description = "Only this namespace")
        String namespace;

        @Option(names = {"--capability"}, description = "Only entries with this capability")
        String capability;

        @Option(names = {"--prefix"}, description = "Only ids starting with this prefix")
        String prefix;

        @Option(names = {"--limit"}, defaultValue = "0", description = "Max entries (0 = all)")
        int limit;

        @Option(names = {"--out"}, description = "Catalog file (default ~/.sunplane/catalog/gateway-<registry>.json)")
        String out;

        @Override
        public Integer call() {
            SunConfig config = parent.root.config();
            String name = config.gatewayRegistry(registry);
            Path target = Texts.isBlank(out)
                    ? config.gatewayCatalogDir().resolve("gateway-" + name + ".json")
                    : SunConfig.expandHome(out, config.homeDir());
            GatewayBuilder.SelectFilter filter = new GatewayBuilder.SelectFilter(namespace, capability, prefix, limit);
            parent.root.print(parent.service().pull(name, filter, target));
            return 0;
        }
    }

    @Command(name = "status", description = "Summarize a published registry")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        GatewayCommand parent;

        @Option(names = {"--registry"}, description = "Registry name (default: global)")
        String registry;

        @Override
        public Integer call() {
            parent.root.print(parent.service().status(parent.root.config().gatewayRegistry(registry)));
            return 0;
        }
    }
}
