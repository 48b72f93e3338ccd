package io.sunplane.gateway;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.SunException;
import io.sunplane.util.Texts;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Contents of a {@value #FILE_NAME} file.
 */
public final class PluginManifest {
    public static final String FILE_NAME = "sunplane.plugin.json";
    public static final int SCHEMA_VERSION = 1;

    static final Pattern SEGMENT = Pattern.compile("^[a-z0-9][a-z0-9._-]*$");
    private static final Set<String> MATURITIES = Set.of("", "experimental", "beta", "ga");
    private static final Set<String> INSTALL_TYPES = Set.of("none", "local_path", "mcp_http", "oci_image", "git");

    public int schemaVersion;
    public String id;
    public String namespace;
    public String name;
    public String version;
    public String summary;
    public String description;
    public String homepage;
    public String termsUrl;
    public String privacyUrl;
    public String license;
    public String maturity;
    public String kind;
    public Install install = new Install();
    public Integration integration = new Integration();
    public Map<String, Object> metadata;

    public static final class Install {
        public String type;
        public String source;
        public List<String> entryCommand;
        public List<String> env;
        public Map<String, String> params;
    }

    public static final class Integration {
        public List<String> providerIds;
        public List<String> commands;
        public List<McpServer> mcpServers;
        public List<String> capabilities;
    }

    public static final class McpServer {
        public String name;
        public String transport;
        public String endpoint;
        public List<String> command;
    }

    public PluginManifest normalize() {
        id = Texts.trim(id);
        namespace = Texts.trim(namespace);
        name = Texts.trim(name);
        version = Texts.trim(version);
        summary = Texts.trim(summary);
        description = Texts.trim(description);
        homepage = Texts.trim(homepage);
        termsUrl = Texts.trim(termsUrl);
        privacyUrl = Texts.trim(privacyUrl);
        license = Texts.trim(license);
        maturity = Texts.trim(maturity).toLowerCase(Locale.ROOT);
        kind = Texts.trim(kind).toLowerCase(Locale.ROOT);
        if (install == null) {
            install = new Install();
        }
        install.type = Texts.trim(install.type).toLowerCase(Locale.ROOT);
        install.source = Texts.trim(install.source);
        if (install.type.isEmpty()) {
            install.type = "none";
        }
        if (schemaVersion == 0) {
            schemaVersion = SCHEMA_VERSION;
        }
        if (namespace.isEmpty()) {
            namespace = namespaceFromId(id);
        }
        if (integration == null) {
            integration = new Integration();
        }
        integration.providerIds = Texts.normalizeList(integration.providerIds);
        integration.commands = Texts.normalizeList(integration.commands);
        integration.capabilities = Texts.normalizeList(integration.capabilities);
        if (integration.mcpServers != null && !integration.mcpServers.isEmpty()) {
            List<McpServer> servers = new ArrayList<>();
            for (McpServer server : integration.mcpServers) {
                if (server == null) {
                    continue;
                }
                server.name = Texts.trim(server.name);
                server.transport = Texts.trim(server.transport).toLowerCase(Locale.ROOT);
                server.endpoint = Texts.trim(server.endpoint);
                server.command = Texts.normalizeList(server.command);
                servers.add(server);
            }
            integration.mcpServers = servers;
        }
        return this;
    }

    /**
     * Throws {@link ErrorKind#INVALID_ARGUMENT} describing the first rule the normalized manifest breaks.
     */
    public void validate() {
        normalize();
        validateId(id);
        String idNamespace = namespaceFromId(id);
        if (!namespace.isEmpty() && !namespace.equals(idNamespace)) {
            throw invalid("namespace \"" + namespace + "\" does not match id namespace \"" + idNamespace + "\"");
        }
        if (schemaVersion < 1) {
            throw invalid("schema_version must be >= 1");
        }
        if (!MATURITIES.contains(maturity)) {
            throw invalid("unsupported maturity \"" + maturity + "\"");
        }
        if (!INSTALL_TYPES.contains(install.type)) {
            throw invalid("unsupported install.type \"" + install.type + "\"");
        }
        if (install.type.equals("local_path") && install.source.isEmpty()) {
            throw invalid("install.source required for install.type=local_path");
        }
        boolean hasServers = integration.mcpServers != null && !integration.mcpServers.isEmpty();
        if (install.type.equals("mcp_http") && install.source.isEmpty() && !hasServers) {
            throw invalid("install.source or integration.mcp_servers required for install.type=mcp_http");
        }
        requireAbsoluteUrl(homepage, "homepage");
        requireAbsoluteUrl(termsUrl, "terms_url");
        requireAbsoluteUrl(privacyUrl, "privacy_url");
        if (hasServers) {
            for (McpServer server : integration.mcpServers) {
                validateServer(server);
            }
        }
    }

    private static void validateServer(McpServer server) {
        if (server.name.isEmpty()) {
            throw invalid("integration.mcp_servers.name required");
        }
        switch (server.transport) {
            case "stdio" -> {
                if (server.command == null || server.command.isEmpty()) {
                    throw invalid("integration.mcp_servers[" + server.name + "].command required for stdio transport");
                }
            }
            case "http", "sse" -> {
                requireAbsoluteUrl(server.endpoint, "integration.mcp_servers.endpoint");
                if (server.endpoint.isEmpty()) {
                    throw invalid("integration.mcp_servers[" + server.name + "].endpoint required for "
                            + server.transport + " transport");
                }
            }
            default -> throw invalid("unsupported integration.mcp_servers[" + server.name + "].transport \""
                    + server.transport + "\"");
        }
    }

    public static void validateId(String raw) {
        String value = Texts.trim(raw);
        if (value.isEmpty()) {
            throw invalid("plugin id required");
        }
        String[] parts = value.split("/", -1);
        if (parts.length != 2) {
            throw invalid("plugin id must be namespaced as <namespace>/<name>");
        }
        for (String part : parts) {
            if (!SEGMENT.matcher(part).matches() || part.equals(".") || part.equals("..")) {
                throw invalid("invalid plugin id segment \"" + part + "\"");
            }
        }
    }

    public static String namespaceFromId(String raw) {
        String value = Texts.trim(raw);
        int slash = value.indexOf('/');
        return slash <= 0 ? "" : value.substring(0, slash);
    }

    private static void requireAbsoluteUrl(String raw, String field) {
        if (raw == null || raw.isEmpty()) {
            return;
        }
        try {
            URI uri = new URI(raw);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw invalid("invalid " + field + ": absolute URL required");
            }
        } catch (URISyntaxException e) {
            throw invalid("invalid " + field + ": " + e.getMessage());
        }
    }

    private static SunException invalid(String message) {
        return new SunException(ErrorKind.INVALID_ARGUMENT, message);
    }
}
