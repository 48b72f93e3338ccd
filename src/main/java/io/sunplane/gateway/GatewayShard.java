package io.sunplane.gateway;

import java.util.ArrayList;
import java.util.List;

public final class GatewayShard {
    public int schemaVersion = GatewayBuilder.SCHEMA_VERSION;
    public String registry;
    public String key;
    public String namespace;
    public int slot;
    public List<CatalogEntry> entries = new ArrayList<>();
}
