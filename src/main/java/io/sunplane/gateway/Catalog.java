package io.sunplane.gateway;

import java.util.ArrayList;
import java.util.List;

public final class Catalog {
    public int schemaVersion = PluginManifest.SCHEMA_VERSION;
    public List<CatalogEntry> entries = new ArrayList<>();
}
