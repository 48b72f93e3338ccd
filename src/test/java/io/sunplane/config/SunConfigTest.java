package io.sunplane.config;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.SunException;
import io.sunplane.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

final class SunConfigTest {

    @Test
    void environmentWinsOverSettingsAndDefaultsFillTheRest() throws Exception {
        Path home = Files.createTempDirectory("sunplane-config-");
        try {
            Path file = home.resolve("settings.json");
            Files.writeString(file, "{\"sun\":{\"base_url\":\"https://settings.example\",\"token\":\"settings-token\","
                    + "\"timeout_seconds\":30,\"taskboard\":\"ops\",\"gateway_slots\":8,\"unknown\":true}}", StandardCharsets.UTF_8);
            SunSettings settings = SunSettings.load(file);
            Map<String, String> env = Map.of(
                    SunConfig.ENV_BASE_URL, "https://env.example",
                    SunConfig.ENV_TASKBOARD_LEASE_SECONDS, "90",
                    SunConfig.ENV_SELF_COMMAND, " java  -jar sunctl.jar ",
                    "USER", "Alice"
            );

            SunConfig config = SunConfig.resolve(env, settings, home, "Build-Host.local");

            Assertions.assertEquals("https://env.example", config.baseUrl());
            Assertions.assertEquals("settings-token", config.token());
            Assertions.assertEquals(Duration.ofSeconds(30), config.timeout());
            Assertions.assertEquals("ops", config.taskboardName(null));
            Assertions.assertEquals("flag", config.taskboardName("flag"));
            Assertions.assertEquals(90, config.leaseSeconds(0));
            Assertions.assertEquals(5, config.leaseSeconds(5));
            Assertions.assertEquals(8, config.gatewaySlots(0));
            Assertions.assertEquals("global", config.gatewayRegistry(null));
            Assertions.assertEquals("default", config.vaultBackup(null));
            Assertions.assertEquals(List.of("java", "-jar", "sunctl.jar"), config.selfCommand());
            Assertions.assertEquals(home.resolve(".sunplane").resolve("vault").resolve(".env"), config.vaultFile(null));
            Assertions.assertEquals(home.resolve("x.env"), config.vaultFile("~/x.env"));
            Assertions.assertFalse(config.allowInsecureHttp());
        } finally {
            TestFiles.deleteRecursively(home);
        }
    }

    @Test
    void machineAndOperatorFallBackToHostAndUser() {
        SunConfig config = SunConfig.resolve(Map.of("USER", "Alice"), SunSettings.EMPTY, Path.of("/tmp"), "Build Host");

        Assertions.assertEquals("build-host", config.machineId(null));
        Assertions.assertEquals("worker-1", config.machineId(" Worker 1 "));
        Assertions.assertEquals("op:alice@build-host", config.operatorId(null, config.machineId(null)));
        Assertions.assertEquals("op:ctl@local", config.operatorId("op:ctl@local", "ignored"));

        SunConfig nameless = SunConfig.resolve(Map.of(), SunSettings.EMPTY, Path.of("/tmp"), "");
        Assertions.assertEquals(SunConfig.DEFAULT_MACHINE_ID, nameless.machineId(null));
        Assertions.assertEquals(SunConfig.DEFAULT_TIMEOUT, nameless.timeout());
    }

    @Test
    void insecureEscapeHatchAcceptsTruthyValues() {
        for (String value : new String[]{"1", "true", "YES", "on"}) {
            SunConfig config = SunConfig.resolve(Map.of(SunConfig.ENV_ALLOW_INSECURE_HTTP, value), SunSettings.EMPTY, Path.of("/tmp"), "h");
            Assertions.assertTrue(config.allowInsecureHttp(), value);
        }
        SunConfig off = SunConfig.resolve(Map.of(SunConfig.ENV_ALLOW_INSECURE_HTTP, "0"), SunSettings.EMPTY, Path.of("/tmp"), "h");
        Assertions.assertFalse(off.allowInsecureHttp());
    }

    @Test
    void missingSettingsFileIsEmptyAndMalformedIsRejected() throws Exception {
        Path dir = Files.createTempDirectory("sunplane-settings-");
        try {
            Assertions.assertSame(SunSettings.EMPTY, SunSettings.load(dir.resolve("absent.json")));
            Path broken = dir.resolve("broken.json");
            Files.writeString(broken, "{not json", StandardCharsets.UTF_8);

            SunException error = Assertions.assertThrows(SunException.class, () -> SunSettings.load(broken));
            Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, error.kind());
        } finally {
            TestFiles.deleteRecursively(dir);
        }
    }
}
