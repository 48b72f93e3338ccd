package io.sunplane.gateway;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry index: one summary per shard and the shard keys of each namespace.
 */
public final class GatewayIndex {
    public int schemaVersion = GatewayBuilder.SCHEMA_VERSION;
    public String registry;
    public String generatedAt;
    public int slotsPerNamespace;
    public int totalEntries;
    public List<ShardSummary> shards = new ArrayList<>();
    public List<NamespaceIndex> namespaces = new ArrayList<>();

    public static final class ShardSummary {
        public String key;
        public String namespace;
        public int slot;
        public int count;
        public List<String> capabilities;
        public String checksum;
    }

    public static final class NamespaceIndex {
        public String namespace;
        public int count;
        public List<String> shards = new ArrayList<>();
    }
}
