package io.sunplane.config;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.SunException;
import io.sunplane.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Read-only view of the operator settings file. Only the {@code sun} section is consumed.
 */
public record SunSettings(Section sun) {
    public static final SunSettings EMPTY = new SunSettings(Section.EMPTY);

    public SunSettings {
        sun = sun == null ? Section.EMPTY : sun;
    }

    public static SunSettings load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return EMPTY;
        }
        try {
            SunSettings loaded = Jsons.read(Files.readAllBytes(file), SunSettings.class);
            return loaded == null ? EMPTY : loaded;
        } catch (IOException e) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "invalid settings file " + file + ": " + e.getMessage(), e);
        }
    }

    public record Section(
            String baseUrl,
            String token,
            Integer timeoutSeconds,
            String taskboard,
            String taskboardAgent,
            Integer taskboardLeaseSeconds,
            String machineId,
            String operatorId,
            String gatewayRegistry,
            Integer gatewaySlots,
            String vaultFile,
            String vaultBackup
    ) {
        public static final Section EMPTY = new Section(null, null, null, null, null, null, null, null, null, null, null, null);
    }
}
