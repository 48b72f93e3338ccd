package io.sunplane.gateway;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.PutResult;
import io.sunplane.client.SunClient;
import io.sunplane.client.SunException;
import io.sunplane.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes gateway registries to the object store and pulls filtered catalogs back.
 * Publishing is unconditional; concurrent publishers of one registry must coordinate elsewhere.
 */
public final class GatewayService {
    private static final Logger log = LoggerFactory.getLogger(GatewayService.class);

    private final SunClient client;
    private final Clock clock;

    public GatewayService(SunClient client) {
        this(client, Clock.systemUTC());
    }

    public GatewayService(SunClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    public GatewayBuilder.Gateway build(Catalog catalog, String registry, int slots) {
        return GatewayBuilder.build(catalog, registry, slots, clock.instant());
    }

    public PublishOutcome publish(CatalogBuilder.Result built, String registry, int slots) {
        GatewayBuilder.Gateway gateway = build(built.catalog(), registry, slots);
        GatewayIndex index = gateway.index();
        PutResult indexPut = client.putGatewayIndex(index.registry, Jsons.toCompactBytes(index), null);
        for (Map.Entry<String, GatewayShard> shard : gateway.shards().entrySet()) {
            client.putGatewayShard(index.registry, shard.getKey(), Jsons.toCompactBytes(shard.getValue()), null);
            log.debug("published shard {} of registry {}", shard.getKey(), index.registry);
        }
        log.info("published registry {} with {} entries in {} shards", index.registry, index.totalEntries, gateway.shards().size());
        return new PublishOutcome(index.registry, index.totalEntries, gateway.shards().size(),
                indexPut.latestRevision(), built.diagnostics());
    }

    public GatewayIndex fetchIndex(String registry) {
        String name = GatewayBuilder.normalizeRegistryName(registry);
        try {
            return Jsons.read(client.getGatewayIndex(name), GatewayIndex.class);
        } catch (IOException e) {
            throw new SunException(ErrorKind.MALFORMED_INDEX, "decode gateway index: " + e.getMessage(), e);
        }
    }

    /**
     * Fetches only the shards the filter can match, materializes them and writes the catalog to {@code out}.
     */
    public PullOutcome pull(String registry, GatewayBuilder.SelectFilter filter, Path out) {
        GatewayIndex index = fetchIndex(registry);
        Map<String, GatewayShard> shards = new LinkedHashMap<>();
        for (String key : GatewayBuilder.selectShards(index, filter)) {
            try {
                shards.put(key, Jsons.read(client.getGatewayShard(index.registry, key), GatewayShard.class));
            } catch (IOException e) {
                throw new SunException(ErrorKind.MALFORMED_SHARD, "decode gateway shard " + key + ": " + e.getMessage(), e);
            }
        }
        Catalog catalog = GatewayBuilder.materialize(index, shards, filter);
        write(out, Jsons.toPrettyBytes(catalog));
        return new PullOutcome(index.registry, catalog.entries.size(), shards.size(), out.toString());
    }

    public StatusOutcome status(String registry) {
        GatewayIndex index = fetchIndex(registry);
        return new StatusOutcome(index.registry, index.generatedAt, index.totalEntries,
                index.shards.size(), index.namespaces.size());
    }

    /**
     * Writes {@code index.json} and one {@code shards/<key>.json} per shard, {@code --} in keys becoming {@code _}.
     */
    public static void writeBundle(Path dir, GatewayBuilder.Gateway gateway) {
        write(dir.resolve("index.json"), Jsons.toPrettyBytes(gateway.index()));
        for (Map.Entry<String, GatewayShard> shard : gateway.shards().entrySet()) {
            String safeName = shard.getKey().replace("/", "_").replace("--", "_");
            write(dir.resolve("shards").resolve(safeName + ".json"), Jsons.toPrettyBytes(shard.getValue()));
        }
    }

    private static void write(Path path, byte[] data) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, data);
        } catch (IOException e) {
            throw new SunException(ErrorKind.LOCAL_IO, "write " + path + ": " + e.getMessage(), e);
        }
    }

    public record PublishOutcome(
            String registry,
            int totalEntries,
            int shardsWritten,
            long indexRevision,
            List<Diagnostic> diagnostics
    ) {
    }

    public record PullOutcome(String registry, int entries, int shardsFetched, String path) {
    }

    public record StatusOutcome(String registry, String generatedAt, int totalEntries, int shards, int namespaces) {
    }
}
