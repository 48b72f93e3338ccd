package io.sunplane.gateway;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public final class CatalogEntry {
    public PluginManifest manifest = new PluginManifest();
    public String channel;
    public boolean verified;
    public String addedAt;
    public List<String> tags;

    /**
     * File the entry was loaded from; never serialized.
     */
    @JsonIgnore
    public String source;

    @JsonIgnore
    public String id() {
        return manifest == null || manifest.id == null ? "" : manifest.id.trim();
    }
}
