package io.sunplane.gateway;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.SunException;
import io.sunplane.util.Hashing;
import io.sunplane.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

final class GatewayBuilderTest {
    private static final Instant NOW = Instant.parse("2026-03-04T05:06:07Z");

    static CatalogEntry entry(String id, String... capabilities) {
        CatalogEntry entry = new CatalogEntry();
        entry.manifest.id = id;
        entry.manifest.integration.capabilities = capabilities.length == 0 ? null : List.of(capabilities);
        entry.channel = "community";
        entry.addedAt = "2026-03-04";
        return entry;
    }

    static Catalog catalog(CatalogEntry... entries) {
        Catalog catalog = new Catalog();
        catalog.entries = new ArrayList<>(List.of(entries));
        return catalog;
    }

    static Catalog sample() {
        List<CatalogEntry> entries = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            entries.add(i % 3 == 0 ? entry("alpha/p" + i, "search") : entry("alpha/p" + i));
        }
        entries.add(entry("beta/one", "search"));
        entries.add(entry("beta/two"));
        return catalog(entries.toArray(new CatalogEntry[0]));
    }

    private static Set<String> ids(Catalog catalog) {
        return catalog.entries.stream().map(CatalogEntry::id).collect(Collectors.toCollection(TreeSet::new));
    }

    @Test
    void shardKeyHashesTheFullIdIntoANamespaceSlot() {
        GatewayBuilder.ShardKey key = GatewayBuilder.shardKey("alpha/p1", 8);

        long expectedSlot = Hashing.fnv1a32("alpha/p1") % 8;
        Assertions.assertEquals("alpha", key.namespace());
        Assertions.assertEquals(expectedSlot, key.slot());
        Assertions.assertEquals(String.format("alpha--%02d", expectedSlot), key.key());
        Assertions.assertEquals(Hashing.fnv1a32("alpha/p1") % 16, GatewayBuilder.shardKey("alpha/p1", 0).slot());
        Assertions.assertThrows(SunException.class, () -> GatewayBuilder.shardKey("alpha/p1", 257));
        Assertions.assertThrows(SunException.class, () -> GatewayBuilder.shardKey("no-namespace", 8));
    }

    @Test
    void buildSummarizesShardsAndNamespaces() {
        GatewayBuilder.Gateway gateway = GatewayBuilder.build(sample(), " Global ", 4, NOW);
        GatewayIndex index = gateway.index();

        Assertions.assertEquals("global", index.registry);
        Assertions.assertEquals("2026-03-04T05:06:07Z", index.generatedAt);
        Assertions.assertEquals(4, index.slotsPerNamespace);
        Assertions.assertEquals(14, index.totalEntries);
        Assertions.assertEquals(List.of("alpha", "beta"),
                index.namespaces.stream().map(n -> n.namespace).collect(Collectors.toList()));
        Assertions.assertEquals(12, index.namespaces.get(0).count);
        Assertions.assertEquals(gateway.shards().size(), index.shards.size());

        int counted = 0;
        for (GatewayIndex.ShardSummary summary : index.shards) {
            GatewayShard shard = gateway.shards().get(summary.key);
            Assertions.assertEquals(summary.count, shard.entries.size());
            Assertions.assertEquals(Hashing.sha256Hex(Jsons.toCompactBytes(shard.entries)), summary.checksum);
            Assertions.assertTrue(summary.slot < 4);
            for (CatalogEntry entry : shard.entries) {
                Assertions.assertEquals(summary.key, GatewayBuilder.shardKey(entry.id(), 4).key());
            }
            counted += summary.count;
        }
        Assertions.assertEquals(14, counted);
    }

    @Test
    void materializingEveryShardRestoresTheCatalog() {
        Catalog source = sample();
        GatewayBuilder.Gateway gateway = GatewayBuilder.build(source, "global", 4, NOW);

        Catalog restored = GatewayBuilder.materialize(gateway.index(), gateway.shards(), GatewayBuilder.SelectFilter.none());

        Assertions.assertEquals(ids(source), ids(restored));
        List<String> order = restored.entries.stream().map(CatalogEntry::id).collect(Collectors.toList());
        Assertions.assertEquals(new ArrayList<>(new TreeSet<>(order)), order);
    }

    @Test
    void filtersNarrowShardsAndEntries() {
        GatewayBuilder.Gateway gateway = GatewayBuilder.build(sample(), "global", 4, NOW);
        GatewayIndex index = gateway.index();

        List<String> betaShards = GatewayBuilder.selectShards(index, new GatewayBuilder.SelectFilter("beta", null, null, 0));
        Assertions.assertEquals(index.namespaces.get(1).shards, betaShards);

        Catalog searchable = GatewayBuilder.materialize(index, gateway.shards(),
                new GatewayBuilder.SelectFilter(null, "search", null, 0));
        Assertions.assertEquals(Set.of("alpha/p0", "alpha/p3", "alpha/p6", "alpha/p9", "beta/one"), ids(searchable));

        Catalog prefixed = GatewayBuilder.materialize(index, gateway.shards(),
                new GatewayBuilder.SelectFilter("alpha", null, "alpha/p1", 0));
        Assertions.assertEquals(Set.of("alpha/p1", "alpha/p10", "alpha/p11"), ids(prefixed));

        Catalog limited = GatewayBuilder.materialize(index, gateway.shards(),
                new GatewayBuilder.SelectFilter("alpha", null, null, 4));
        Assertions.assertEquals(4, limited.entries.size());
        Assertions.assertTrue(limited.entries.stream().allMatch(e -> e.id().startsWith("alpha/")));
    }

    @Test
    void invalidEntriesFailTheBuild() {
        SunException error = Assertions.assertThrows(SunException.class,
                () -> GatewayBuilder.build(catalog(entry("alpha/ok"), entry("Nope")), "global", 4, NOW));

        Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, error.kind());
        Assertions.assertTrue(error.getMessage().contains("Nope"));
    }

    @Test
    void registryNamesAreLowercaseSegments() {
        Assertions.assertEquals("team.x", GatewayBuilder.normalizeRegistryName(" Team.X "));
        Assertions.assertThrows(SunException.class, () -> GatewayBuilder.normalizeRegistryName(""));
        Assertions.assertThrows(SunException.class, () -> GatewayBuilder.normalizeRegistryName("a/b"));
    }

    @Test
    void shardObjectNamesRoundTrip() {
        String objectName = GatewayBuilder.shardObjectName("Global", "alpha--03");

        Assertions.assertEquals("global:alpha:03", objectName);
        Assertions.assertEquals("alpha--03", GatewayBuilder.parseShardObjectName("global", objectName));
        Assertions.assertThrows(SunException.class, () -> GatewayBuilder.shardObjectName("global", "alpha-03"));
        Assertions.assertThrows(SunException.class, () -> GatewayBuilder.shardObjectName("global", "Alpha--03"));
        Assertions.assertThrows(SunException.class, () -> GatewayBuilder.shardObjectName("global", "alpha--"));
        Assertions.assertThrows(SunException.class, () -> GatewayBuilder.parseShardObjectName("other", objectName));
        Assertions.assertThrows(SunException.class, () -> GatewayBuilder.parseShardObjectName("global", "global:alpha"));
    }
}
