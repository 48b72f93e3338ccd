package io.sunplane.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sunplane.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Typed client for the Sun object store. Safe for concurrent use; the underlying
 * {@link HttpClient} is shared and its settings are fixed at construction.
 */
public final class SunClient {
    private static final Logger log = LoggerFactory.getLogger(SunClient.class);
    private static final String USER_AGENT = "sunplane/0.1.0";
    private static final int LOOKUP_LIMIT = 5;
    private static final String EDGE_DENIED_MARKER = "error code: 1010";
    private static final String EDGE_DENIED_MESSAGE =
            "access denied by edge firewall (error 1010); check firewall/bot rules for this client IP and user-agent";

    private final SunEndpoint endpoint;
    private final RetryPolicy retryPolicy;
    private final HttpClient http;

    public SunClient(SunEndpoint endpoint) {
        this(endpoint, RetryPolicy.DEFAULT);
    }

    public SunClient(SunEndpoint endpoint, RetryPolicy retryPolicy) {
        this.endpoint = endpoint;
        this.retryPolicy = retryPolicy == null ? RetryPolicy.DEFAULT : retryPolicy;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(endpoint.timeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    public SunEndpoint endpoint() {
        return endpoint;
    }

    public void ready() {
        HttpRequest request = HttpRequest.newBuilder(uri("/v1/readyz"))
                .timeout(endpoint.timeout())
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();
        HttpResponse<byte[]> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new SunException(ErrorKind.TRANSPORT_ERROR, "sun readiness probe failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SunException(ErrorKind.CANCELLED, "sun readiness probe cancelled", e);
        }
        if (response.statusCode() / 100 != 2) {
            RemoteException error = decodeError(response.statusCode(), response.body());
            if (error.is(ErrorKind.REMOTE_ERROR)) {
                throw new RemoteException(ErrorKind.NOT_READY, error.status(), error.remoteMessage());
            }
            throw error;
        }
    }

    public WhoAmI whoAmI() {
        return decode(execute("GET", "/v1/auth/whoami", null), WhoAmI.class, "whoami");
    }

    public List<ObjectMeta> listObjects(String kind, String name, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        putIfPresent(params, "kind", kind);
        putIfPresent(params, "name", name);
        if (limit > 0) {
            params.put("limit", Integer.toString(limit));
        }
        JsonNode root = tree(execute("GET", "/v1/objects" + query(params), null), "list objects");
        return items(root, new TypeReference<List<ObjectMeta>>() {
        }, "list objects");
    }

    /**
     * First listed object whose name matches case-insensitively.
     */
    public Optional<ObjectMeta> lookupObjectMeta(String kind, String name) {
        String target = name == null ? "" : name.trim();
        for (ObjectMeta meta : listObjects(kind, target, LOOKUP_LIMIT)) {
            if (meta.name() != null && meta.name().trim().equalsIgnoreCase(target)) {
                return Optional.of(meta);
            }
        }
        return Optional.empty();
    }

    public List<ObjectRevision> listRevisions(String kind, String name, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        if (limit > 0) {
            params.put("limit", Integer.toString(limit));
        }
        String path = objectPath(kind, name) + "/revisions" + query(params);
        JsonNode root = tree(execute("GET", path, null), "list revisions");
        return items(root, new TypeReference<List<ObjectRevision>>() {
        }, "list revisions");
    }

    public byte[] getPayload(String kind, String name) {
        return execute("GET", objectPath(kind, name) + "/payload", null);
    }

    public <T> T getJson(String kind, String name, Class<T> type) {
        byte[] payload = getPayload(kind, name);
        try {
            return Jsons.read(payload, type);
        } catch (IOException e) {
            throw new SunException(ErrorKind.MALFORMED_RESPONSE, kind + " " + name + " payload invalid: " + e.getMessage(), e);
        }
    }

    public PutResult putObject(
            String kind,
            String name,
            byte[] payload,
            String contentType,
            Map<String, Object> metadata,
            Long expectedRevision
    ) {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("content_type", contentType == null ? "" : contentType.trim());
        body.put("payload_base64", Base64.getEncoder().encodeToString(payload == null ? new byte[0] : payload));
        if (metadata != null && !metadata.isEmpty()) {
            body.set("metadata", Jsons.mapper().valueToTree(metadata));
        }
        if (expectedRevision != null) {
            body.put("expected_revision", expectedRevision.longValue());
        }
        return putResult(execute("PUT", objectPath(kind, name), Jsons.toCompactBytes(body)), "put object");
    }

    public List<TokenRecord> listTokens(boolean includeRevoked, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        if (includeRevoked) {
            params.put("include_revoked", "true");
        }
        if (limit > 0) {
            params.put("limit", Integer.toString(limit));
        }
        JsonNode root = tree(execute("GET", "/v1/tokens" + query(params), null), "list tokens");
        return items(root, new TypeReference<List<TokenRecord>>() {
        }, "list tokens");
    }

    public IssuedToken createToken(String label, List<String> scopes, int expiresInHours) {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("label", label == null ? "" : label.trim());
        body.set("scopes", Jsons.mapper().valueToTree(scopes == null ? List.of() : scopes));
        if (expiresInHours > 0) {
            body.put("expires_in_hours", expiresInHours);
        }
        return decode(execute("POST", "/v1/tokens", Jsons.toCompactBytes(body)), IssuedToken.class, "create token");
    }

    public void revokeToken(String tokenId) {
        String id = tokenId == null ? "" : tokenId.trim();
        if (id.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "token id is required");
        }
        execute("POST", "/v1/tokens/" + escape(id) + "/revoke", "{}".getBytes(StandardCharsets.UTF_8));
    }

    public List<AuditEvent> listAuditEvents(String action, String kind, String name, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        putIfPresent(params, "action", action);
        putIfPresent(params, "kind", kind);
        putIfPresent(params, "name", name);
        if (limit > 0) {
            params.put("limit", Integer.toString(limit));
        }
        JsonNode root = tree(execute("GET", "/v1/audit" + query(params), null), "list audit events");
        return items(root, new TypeReference<List<AuditEvent>>() {
        }, "list audit events");
    }

    /**
     * Raw index document of a gateway registry.
     */
    public byte[] getGatewayIndex(String registry) {
        JsonNode root = tree(execute("GET", registryPath(registry), null), "gateway index");
        JsonNode index = root.get("index");
        if (index == null || index.isNull() || index.isMissingNode() || (index.isTextual() && index.asText().isBlank())) {
            throw new SunException(ErrorKind.MALFORMED_INDEX, "gateway registry " + registry + " returned an empty index");
        }
        return Jsons.toCompactBytes(index);
    }

    public PutResult putGatewayIndex(String registry, byte[] index, Long expectedRevision) {
        return putResult(execute("PUT", registryPath(registry), rawPayloadBody(index, expectedRevision)), "put gateway index");
    }

    public byte[] getGatewayShard(String registry, String shard) {
        JsonNode root = tree(execute("GET", shardPath(registry, shard), null), "gateway shard");
        JsonNode payload = root.get("payload");
        if (payload == null || payload.isNull() || payload.isMissingNode() || (payload.isTextual() && payload.asText().isBlank())) {
            throw new SunException(ErrorKind.MALFORMED_SHARD, "gateway shard " + shard + " returned an empty payload");
        }
        return Jsons.toCompactBytes(payload);
    }

    public PutResult putGatewayShard(String registry, String shard, byte[] payload, Long expectedRevision) {
        return putResult(execute("PUT", shardPath(registry, shard), rawPayloadBody(payload, expectedRevision)), "put gateway shard");
    }

    private byte[] rawPayloadBody(byte[] payload, Long expectedRevision) {
        ObjectNode body = Jsons.mapper().createObjectNode();
        try {
            body.set("payload", Jsons.mapper().readTree(payload));
        } catch (IOException e) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "gateway payload is not valid JSON: " + e.getMessage(), e);
        }
        if (expectedRevision != null) {
            body.put("expected_revision", expectedRevision.longValue());
        }
        return Jsons.toCompactBytes(body);
    }

    private byte[] execute(String method, String path, byte[] jsonBody) {
        URI target = uri(path);
        SunException lastError = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            HttpRequest.Builder builder = HttpRequest.newBuilder(target)
                    .timeout(endpoint.timeout())
                    .header("Authorization", "Bearer " + endpoint.token())
                    .header("User-Agent", USER_AGENT);
            if (jsonBody != null) {
                builder.header("Content-Type", "application/json");
                builder.method(method, HttpRequest.BodyPublishers.ofByteArray(jsonBody));
            } else {
                builder.method(method, HttpRequest.BodyPublishers.noBody());
            }
            boolean last = attempt == retryPolicy.maxAttempts();
            HttpResponse<byte[]> response;
            try {
                response = http.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            } catch (IOException e) {
                lastError = new SunException(ErrorKind.TRANSPORT_ERROR,
                        "sun request " + method + " " + path + " failed: " + describe(e), e);
                if (last) {
                    break;
                }
                log.debug("sun request {} {} attempt {} failed: {}", method, path, attempt, describe(e));
                pause(retryPolicy.delayAfter(attempt, null, Instant.now()));
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SunException(ErrorKind.CANCELLED, "sun request " + method + " " + path + " cancelled", e);
            }
            int status = response.statusCode();
            if (status / 100 == 2) {
                return response.body() == null ? new byte[0] : response.body();
            }
            if (!last && RetryPolicy.retryableStatus(status)) {
                String retryAfter = response.headers().firstValue("Retry-After").orElse("");
                Duration delay = retryPolicy.delayAfter(attempt, retryAfter, Instant.now());
                log.debug("sun request {} {} attempt {} got status {}, retrying in {} ms",
                        method, path, attempt, status, delay.toMillis());
                pause(delay);
                continue;
            }
            throw decodeError(status, response.body());
        }
        log.warn("sun request {} {} failed after {} attempts", method, path, retryPolicy.maxAttempts());
        throw lastError == null
                ? new SunException(ErrorKind.TRANSPORT_ERROR, "sun request " + method + " " + path + " failed")
                : lastError;
    }

    static RemoteException decodeError(int status, byte[] body) {
        String text = body == null ? "" : new String(body, StandardCharsets.UTF_8).trim();
        ErrorKind kind = status == 409 ? ErrorKind.REVISION_CONFLICT : ErrorKind.REMOTE_ERROR;
        if (!text.isEmpty()) {
            try {
                JsonNode parsed = Jsons.mapper().readTree(text);
                if (parsed != null && parsed.path("error").isTextual() && !parsed.path("error").asText().isBlank()) {
                    return new RemoteException(kind, status, parsed.path("error").asText().trim());
                }
            } catch (IOException ignored) {
                // not JSON; fall through to the raw body
            }
        }
        if (status == 403 && text.toLowerCase(Locale.ROOT).contains(EDGE_DENIED_MARKER)) {
            return new RemoteException(ErrorKind.ACCESS_DENIED_BY_EDGE, status, EDGE_DENIED_MESSAGE);
        }
        if (text.isEmpty()) {
            text = reasonPhrase(status);
        }
        return new RemoteException(kind, status, text);
    }

    private static void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SunException(ErrorKind.CANCELLED, "sun request retry cancelled", e);
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static JsonNode tree(byte[] body, String what) {
        try {
            JsonNode node = Jsons.mapper().readTree(body);
            if (node == null || !node.isObject()) {
                throw new SunException(ErrorKind.MALFORMED_RESPONSE, "parse " + what + " response: expected a JSON object");
            }
            return node;
        } catch (IOException e) {
            throw new SunException(ErrorKind.MALFORMED_RESPONSE, "parse " + what + " response: " + e.getMessage(), e);
        }
    }

    private static <T> T decode(byte[] body, Class<T> type, String what) {
        try {
            return Jsons.read(body, type);
        } catch (IOException e) {
            throw new SunException(ErrorKind.MALFORMED_RESPONSE, "parse " + what + " response: " + e.getMessage(), e);
        }
    }

    private static <T> List<T> items(JsonNode root, TypeReference<List<T>> type, String what) {
        JsonNode items = root.path("items");
        if (items.isMissingNode() || items.isNull()) {
            return new ArrayList<>();
        }
        try {
            List<T> out = Jsons.mapper().convertValue(items, type);
            return out == null ? new ArrayList<>() : out;
        } catch (IllegalArgumentException e) {
            throw new SunException(ErrorKind.MALFORMED_RESPONSE, "parse " + what + " response: " + e.getMessage(), e);
        }
    }

    private static PutResult putResult(byte[] body, String what) {
        JsonNode result = tree(body, what).path("result");
        return new PutResult(
                result.path("object").path("latest_revision").asLong(0L),
                result.path("revision").path("revision").asLong(0L)
        );
    }

    private URI uri(String path) {
        return URI.create(endpoint.baseUrl() + path);
    }

    private static String objectPath(String kind, String name) {
        return "/v1/objects/" + escape(kind) + "/" + escape(name);
    }

    private static String registryPath(String registry) {
        return "/v1/integrations/registries/" + escape(registry);
    }

    private static String shardPath(String registry, String shard) {
        return registryPath(registry) + "/shards/" + escape(shard);
    }

    static String escape(String segment) {
        String value = segment == null ? "" : segment.trim();
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static void putIfPresent(Map<String, String> params, String key, String value) {
        if (value != null && !value.isBlank()) {
            params.put(key, value.trim());
        }
    }

    private static String query(Map<String, String> params) {
        if (params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        params.forEach((key, value) -> joiner.add(key + "=" + escape(value)));
        return joiner.toString();
    }

    private static String reasonPhrase(int status) {
        return switch (status) {
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 408 -> "Request Timeout";
            case 409 -> "Conflict";
            case 425 -> "Too Early";
            case 429 -> "Too Many Requests";
            case 500 -> "Internal Server Error";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "HTTP " + status;
        };
    }
}
