package io.sunplane.config;

import io.sunplane.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Process-wide configuration, resolved once at the CLI entry point from the environment and the
 * settings file. Protocol code only ever sees an instance of this class.
 */
public final class SunConfig {
    private static final Logger log = LoggerFactory.getLogger(SunConfig.class);

    public static final String ENV_BASE_URL = "SUN_BASE_URL";
    public static final String ENV_TOKEN = "SUN_TOKEN";
    public static final String ENV_TIMEOUT_SECONDS = "SUN_TIMEOUT_SECONDS";
    public static final String ENV_ALLOW_INSECURE_HTTP = "SUN_ALLOW_INSECURE_HTTP";
    public static final String ENV_TASKBOARD = "SUN_TASKBOARD";
    public static final String ENV_TASKBOARD_AGENT = "SUN_TASKBOARD_AGENT";
    public static final String ENV_TASKBOARD_LEASE_SECONDS = "SUN_TASKBOARD_LEASE_SECONDS";
    public static final String ENV_MACHINE_ID = "SUN_MACHINE_ID";
    public static final String ENV_OPERATOR_ID = "SUN_OPERATOR_ID";
    public static final String ENV_GATEWAY_REGISTRY = "SUN_GATEWAY_REGISTRY";
    public static final String ENV_GATEWAY_SLOTS = "SUN_GATEWAY_SLOTS";
    public static final String ENV_VAULT_FILE = "SUN_VAULT_FILE";
    public static final String ENV_VAULT_BACKUP = "SUN_VAULT_BACKUP";
    public static final String ENV_SELF_COMMAND = "SUN_SELF_COMMAND";
    public static final String ENV_SETTINGS_FILE = "SUN_SETTINGS_FILE";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);
    public static final String DEFAULT_TASKBOARD = "default";
    public static final int DEFAULT_LEASE_SECONDS = 1800;
    public static final String DEFAULT_GATEWAY_REGISTRY = "global";
    public static final int DEFAULT_GATEWAY_SLOTS = 16;
    public static final String DEFAULT_VAULT_BACKUP = "default";
    public static final String DEFAULT_MACHINE_ID = "machine-unknown";
    public static final String SETTINGS_DIR = ".sunplane";

    private final String baseUrl;
    private final String token;
    private final Duration timeout;
    private final boolean allowInsecureHttp;
    private final String taskboard;
    private final String taskboardAgent;
    private final int taskboardLeaseSeconds;
    private final String machineId;
    private final String operatorId;
    private final String gatewayRegistry;
    private final int gatewaySlots;
    private final String vaultFile;
    private final String vaultBackup;
    private final List<String> selfCommand;
    private final String hostName;
    private final String userName;
    private final Path homeDir;

    private SunConfig(Map<String, String> env, SunSettings settings, Path homeDir, String hostName) {
        SunSettings.Section sun = (settings == null ? SunSettings.EMPTY : settings).sun();
        this.homeDir = homeDir == null ? Paths.get(".").toAbsolutePath().normalize() : homeDir;
        this.baseUrl = Texts.firstNonBlank(env.get(ENV_BASE_URL), sun.baseUrl());
        this.token = Texts.firstNonBlank(env.get(ENV_TOKEN), sun.token());
        int timeoutSeconds = firstPositive(parseInt(env.get(ENV_TIMEOUT_SECONDS)), sun.timeoutSeconds());
        this.timeout = timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : DEFAULT_TIMEOUT;
        this.allowInsecureHttp = Texts.isTruthy(env.get(ENV_ALLOW_INSECURE_HTTP));
        this.taskboard = Texts.firstNonBlank(env.get(ENV_TASKBOARD), sun.taskboard());
        this.taskboardAgent = Texts.firstNonBlank(env.get(ENV_TASKBOARD_AGENT), sun.taskboardAgent());
        this.taskboardLeaseSeconds = firstPositive(parseInt(env.get(ENV_TASKBOARD_LEASE_SECONDS)), sun.taskboardLeaseSeconds());
        this.machineId = Texts.firstNonBlank(env.get(ENV_MACHINE_ID), sun.machineId());
        this.operatorId = Texts.firstNonBlank(env.get(ENV_OPERATOR_ID), sun.operatorId());
        this.gatewayRegistry = Texts.firstNonBlank(env.get(ENV_GATEWAY_REGISTRY), sun.gatewayRegistry());
        this.gatewaySlots = firstPositive(parseInt(env.get(ENV_GATEWAY_SLOTS)), sun.gatewaySlots());
        this.vaultFile = Texts.firstNonBlank(env.get(ENV_VAULT_FILE), sun.vaultFile());
        this.vaultBackup = Texts.firstNonBlank(env.get(ENV_VAULT_BACKUP), sun.vaultBackup());
        this.selfCommand = splitCommand(env.get(ENV_SELF_COMMAND));
        this.hostName = Texts.trim(hostName);
        this.userName = Texts.firstNonBlank(env.get("USER"), env.get("USERNAME"), "user");
    }

    public static SunConfig resolve(Map<String, String> env, SunSettings settings, Path homeDir, String hostName) {
        return new SunConfig(env == null ? Map.of() : env, settings, homeDir, hostName);
    }

    /**
     * Reads the real process environment and settings file. Only the CLI entry point calls this.
     */
    public static SunConfig fromEnvironment(String settingsFile) {
        Map<String, String> env = System.getenv();
        Path home = Paths.get(System.getProperty("user.home", ".")).toAbsolutePath().normalize();
        String explicit = Texts.firstNonBlank(settingsFile, env.get(ENV_SETTINGS_FILE));
        Path file = explicit.isEmpty()
                ? home.resolve(SETTINGS_DIR).resolve("settings.json")
                : expandHome(explicit, home);
        return resolve(env, SunSettings.load(file), home, localHostName());
    }

    public static Path expandHome(String raw, Path home) {
        String value = Texts.trim(raw);
        if (value.equals("~")) {
            return home;
        }
        if (value.startsWith("~/")) {
            return home.resolve(value.substring(2)).normalize();
        }
        return Paths.get(value).toAbsolutePath().normalize();
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("local host name unavailable: {}", e.getMessage());
            return "";
        }
    }

    private static int parseInt(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static int firstPositive(int candidate, Integer fallback) {
        if (candidate > 0) {
            return candidate;
        }
        return fallback != null && fallback > 0 ? fallback : 0;
    }

    private static List<String> splitCommand(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String part : raw.trim().split("\\s+")) {
            if (!part.isEmpty()) {
                out.add(part);
            }
        }
        return out;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String token() {
        return token;
    }

    public Duration timeout() {
        return timeout;
    }

    public boolean allowInsecureHttp() {
        return allowInsecureHttp;
    }

    public String taskboardName(String explicit) {
        return Texts.firstNonBlank(explicit, taskboard, DEFAULT_TASKBOARD);
    }

    public String taskboardAgent() {
        return taskboardAgent;
    }

    public int leaseSeconds(int explicit) {
        if (explicit > 0) {
            return explicit;
        }
        return taskboardLeaseSeconds > 0 ? taskboardLeaseSeconds : DEFAULT_LEASE_SECONDS;
    }

    /**
     * Flag, environment, settings, local host name, then {@value #DEFAULT_MACHINE_ID}; always sanitized.
     */
    public String machineId(String explicit) {
        for (String candidate : new String[]{explicit, machineId, hostName}) {
            String value = Identities.sanitizeSlug(candidate);
            if (!value.isEmpty()) {
                return value;
            }
        }
        return DEFAULT_MACHINE_ID;
    }

    public String operatorId(String explicit, String machine) {
        for (String candidate : new String[]{explicit, operatorId}) {
            String value = Identities.sanitizeOperator(candidate);
            if (!value.isEmpty()) {
                return value;
            }
        }
        return Identities.sanitizeOperator("op:" + Identities.sanitizeSlug(userName) + "@" + Identities.sanitizeSlug(machine));
    }

    public String gatewayRegistry(String explicit) {
        return Texts.firstNonBlank(explicit, gatewayRegistry, DEFAULT_GATEWAY_REGISTRY).toLowerCase(Locale.ROOT);
    }

    public int gatewaySlots(int explicit) {
        if (explicit > 0) {
            return explicit;
        }
        return gatewaySlots > 0 ? gatewaySlots : DEFAULT_GATEWAY_SLOTS;
    }

    public Path vaultFile(String explicit) {
        String value = Texts.firstNonBlank(explicit, vaultFile);
        if (value.isEmpty()) {
            return homeDir.resolve(SETTINGS_DIR).resolve("vault").resolve(".env");
        }
        return expandHome(value, homeDir);
    }

    public String vaultBackup(String explicit) {
        return Texts.firstNonBlank(explicit, vaultBackup, DEFAULT_VAULT_BACKUP);
    }

    public Path gatewayCatalogDir() {
        return homeDir.resolve(SETTINGS_DIR).resolve("catalog");
    }

    public List<String> selfCommand() {
        return List.copyOf(selfCommand);
    }

    public String hostName() {
        return hostName;
    }

    public String userName() {
        return userName;
    }

    public Path homeDir() {
        return homeDir;
    }
}
