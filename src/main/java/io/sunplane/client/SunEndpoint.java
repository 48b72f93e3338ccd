package io.sunplane.client;

import io.sunplane.config.SunConfig;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;

/**
 * Validated connection parameters: absolute base URL, bearer token and per-request timeout.
 */
public record SunEndpoint(String baseUrl, String token, Duration timeout) {
    public static final int MAX_TOKEN_CHARS = 256;

    public static SunEndpoint fromConfig(SunConfig config) {
        return resolve(config.baseUrl(), config.token(), config.timeout(), config.allowInsecureHttp());
    }

    public static SunEndpoint resolve(String rawBaseUrl, String rawToken, Duration timeout, boolean allowInsecureHttp) {
        String baseUrl = rawBaseUrl == null ? "" : rawBaseUrl.trim();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (baseUrl.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT,
                    "sun base url is required (set sun.base_url in settings or " + SunConfig.ENV_BASE_URL + ")");
        }
        URI uri;
        try {
            uri = new URI(baseUrl);
        } catch (URISyntaxException e) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "invalid sun base url \"" + baseUrl + "\"", e);
        }
        if (!uri.isAbsolute() || uri.getHost() == null) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "invalid sun base url \"" + baseUrl + "\"");
        }
        if (!transportAllowed(uri, allowInsecureHttp)) {
            throw new SunException(ErrorKind.INSECURE_TRANSPORT,
                    "sun base url must use https for non-local hosts (set " + SunConfig.ENV_ALLOW_INSECURE_HTTP + "=1 to override)");
        }
        String token = rawToken == null ? "" : rawToken.trim();
        validateToken(token);
        Duration effective = timeout == null || timeout.isZero() || timeout.isNegative() ? SunConfig.DEFAULT_TIMEOUT : timeout;
        return new SunEndpoint(baseUrl, token, effective);
    }

    static boolean transportAllowed(URI uri, boolean allowInsecureHttp) {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (scheme.equals("https")) {
            return true;
        }
        if (!scheme.equals("http")) {
            return false;
        }
        if (allowInsecureHttp) {
            return true;
        }
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        return host.equals("localhost") || host.equals("127.0.0.1") || host.equals("::1");
    }

    static void validateToken(String token) {
        if (token.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_CREDENTIAL,
                    "sun token is required (set sun.token in settings or " + SunConfig.ENV_TOKEN + ")");
        }
        if (token.length() > MAX_TOKEN_CHARS) {
            throw new SunException(ErrorKind.INVALID_CREDENTIAL, "sun token is too long");
        }
        for (int i = 0; i < token.length(); i++) {
            char ch = token.charAt(i);
            if (ch <= 0x20 || ch == 0x7f) {
                throw new SunException(ErrorKind.INVALID_CREDENTIAL, "sun token must not contain whitespace or control characters");
            }
        }
    }
}
