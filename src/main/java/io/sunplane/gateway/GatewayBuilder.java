package io.sunplane.gateway;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.SunException;
import io.sunplane.util.Hashing;
import io.sunplane.util.Jsons;
import io.sunplane.util.Texts;
import io.sunplane.util.Timestamps;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Splits a catalog into namespace shards keyed {@code <namespace>--<slot>} and reassembles them.
 */
public final class GatewayBuilder {
    public static final int SCHEMA_VERSION = 1;
    public static final int DEFAULT_SLOTS = 16;
    public static final int MAX_SLOTS = 256;

    private GatewayBuilder() {
    }

    public static String normalizeRegistryName(String raw) {
        String normalized = Texts.trim(raw).toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "gateway registry name required");
        }
        if (!PluginManifest.SEGMENT.matcher(normalized).matches()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "invalid gateway registry name \"" + raw + "\"");
        }
        return normalized;
    }

    public static int normalizeSlots(int slots) {
        if (slots <= 0) {
            return DEFAULT_SLOTS;
        }
        if (slots > MAX_SLOTS) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "slots_per_namespace cannot exceed " + MAX_SLOTS);
        }
        return slots;
    }

    public static ShardKey shardKey(String pluginId, int slotsPerNamespace) {
        PluginManifest.validateId(pluginId);
        String namespace = PluginManifest.namespaceFromId(pluginId);
        int slots = normalizeSlots(slotsPerNamespace);
        int slot = (int) (Hashing.fnv1a32(pluginId) % slots);
        return new ShardKey(String.format(Locale.ROOT, "%s--%02d", namespace, slot), namespace, slot);
    }

    public static Gateway build(Catalog catalog, String registryName, int slotsPerNamespace, Instant generatedAt) {
        String registry = normalizeRegistryName(registryName);
        int slots = normalizeSlots(slotsPerNamespace);

        SortedMap<String, GatewayShard> shards = new TreeMap<>();
        Map<String, Set<String>> shardCapabilities = new TreeMap<>();
        Map<String, Set<String>> namespaceShards = new TreeMap<>();
        Map<String, Integer> namespaceCounts = new TreeMap<>();
        int total = 0;
        for (CatalogEntry entry : catalog.entries) {
            try {
                entry.manifest.validate();
            } catch (SunException e) {
                throw new SunException(ErrorKind.INVALID_ARGUMENT,
                        "invalid catalog entry \"" + entry.id() + "\": " + e.getMessage(), e);
            }
            ShardKey key = shardKey(entry.manifest.id, slots);
            GatewayShard shard = shards.computeIfAbsent(key.key(), k -> {
                GatewayShard created = new GatewayShard();
                created.registry = registry;
                created.key = key.key();
                created.namespace = key.namespace();
                created.slot = key.slot();
                return created;
            });
            shard.entries.add(entry);
            Set<String> capabilities = shardCapabilities.computeIfAbsent(key.key(), k -> new TreeSet<>());
            if (entry.manifest.integration.capabilities != null) {
                capabilities.addAll(entry.manifest.integration.capabilities);
            }
            namespaceShards.computeIfAbsent(key.namespace(), k -> new TreeSet<>()).add(key.key());
            namespaceCounts.merge(key.namespace(), 1, Integer::sum);
            total++;
        }

        GatewayIndex index = new GatewayIndex();
        index.registry = registry;
        index.generatedAt = Timestamps.format(generatedAt);
        index.slotsPerNamespace = slots;
        index.totalEntries = total;
        for (GatewayShard shard : shards.values()) {
            shard.entries.sort(Comparator.comparing(CatalogEntry::id));
            GatewayIndex.ShardSummary summary = new GatewayIndex.ShardSummary();
            summary.key = shard.key;
            summary.namespace = shard.namespace;
            summary.slot = shard.slot;
            summary.count = shard.entries.size();
            Set<String> capabilities = shardCapabilities.get(shard.key);
            summary.capabilities = capabilities.isEmpty() ? null : new ArrayList<>(capabilities);
            summary.checksum = checksum(shard);
            index.shards.add(summary);
        }
        for (Map.Entry<String, Set<String>> namespace : namespaceShards.entrySet()) {
            GatewayIndex.NamespaceIndex row = new GatewayIndex.NamespaceIndex();
            row.namespace = namespace.getKey();
            row.count = namespaceCounts.get(namespace.getKey());
            row.shards = new ArrayList<>(namespace.getValue());
            index.namespaces.add(row);
        }
        return new Gateway(index, shards);
    }

    /**
     * Sorted keys of the shards that may hold entries matching {@code filter}.
     */
    public static List<String> selectShards(GatewayIndex index, SelectFilter filter) {
        String namespace = Texts.trim(filter.namespace());
        String capability = Texts.trim(filter.capability());
        List<String> keys = new ArrayList<>();
        for (GatewayIndex.ShardSummary shard : index.shards) {
            if (!namespace.isEmpty() && !namespace.equals(shard.namespace)) {
                continue;
            }
            if (!capability.isEmpty() && (shard.capabilities == null || !shard.capabilities.contains(capability))) {
                continue;
            }
            keys.add(shard.key);
        }
        keys.sort(null);
        return keys;
    }

    /**
     * Walks the selected shards in key order, keeping the first {@code limit} matching entries,
     * and returns them sorted by id.
     */
    public static Catalog materialize(GatewayIndex index, Map<String, GatewayShard> shards, SelectFilter filter) {
        String prefix = Texts.trim(filter.prefix());
        String capability = Texts.trim(filter.capability());
        int limit = Math.max(0, filter.limit());
        Catalog out = new Catalog();
        Set<String> seen = new HashSet<>();
        collect:
        for (String key : selectShards(index, filter)) {
            GatewayShard shard = shards.get(key);
            if (shard == null) {
                continue;
            }
            for (CatalogEntry entry : shard.entries) {
                String id = entry.id();
                if (id.isEmpty() || seen.contains(id)) {
                    continue;
                }
                if (!prefix.isEmpty() && !id.startsWith(prefix)) {
                    continue;
                }
                List<String> capabilities = entry.manifest.integration == null ? null : entry.manifest.integration.capabilities;
                if (!capability.isEmpty() && (capabilities == null || !capabilities.contains(capability))) {
                    continue;
                }
                seen.add(id);
                out.entries.add(entry);
                if (limit > 0 && out.entries.size() >= limit) {
                    break collect;
                }
            }
        }
        out.entries.sort(Comparator.comparing(CatalogEntry::id));
        return out;
    }

    public static String shardObjectName(String registry, String shardKey) {
        String normalized = normalizeRegistryName(registry);
        String key = Texts.trim(shardKey);
        if (key.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "shard key required");
        }
        String[] segments = key.split("--", -1);
        if (segments.length != 2) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "invalid shard key \"" + key + "\"");
        }
        String namespace = segments[0].trim();
        if (!PluginManifest.SEGMENT.matcher(namespace).matches()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "invalid shard namespace \"" + namespace + "\"");
        }
        String slot = segments[1].trim();
        if (slot.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "invalid shard slot in \"" + key + "\"");
        }
        return normalized + ":" + namespace + ":" + slot;
    }

    public static String parseShardObjectName(String registry, String objectName) {
        String normalized = normalizeRegistryName(registry);
        String name = Texts.trim(objectName);
        String prefix = normalized + ":";
        if (!name.startsWith(prefix)) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT,
                    "object \"" + name + "\" does not belong to registry \"" + normalized + "\"");
        }
        String[] parts = name.substring(prefix.length()).split(":", -1);
        if (parts.length != 2) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "invalid shard object name \"" + name + "\"");
        }
        return parts[0] + "--" + parts[1];
    }

    static String checksum(GatewayShard shard) {
        return Hashing.sha256Hex(Jsons.toCompactBytes(shard.entries));
    }

    public record ShardKey(String key, String namespace, int slot) {
    }

    public record SelectFilter(String namespace, String capability, String prefix, int limit) {
        public static SelectFilter none() {
            return new SelectFilter(null, null, null, 0);
        }
    }

    public record Gateway(GatewayIndex index, SortedMap<String, GatewayShard> shards) {
    }
}
