package io.sunplane.vault;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.ObjectMeta;
import io.sunplane.client.PutResult;
import io.sunplane.client.SunClient;
import io.sunplane.client.SunException;
import io.sunplane.util.Hashing;
import io.sunplane.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Backup and restore of the local vault dotenv file as a {@value #KIND} object.
 */
public final class VaultSyncService {
    public static final String KIND = "vault_backup";

    private static final Logger log = LoggerFactory.getLogger(VaultSyncService.class);
    private static final String CONTENT_TYPE = "text/plain";

    private final SunClient client;

    public VaultSyncService(SunClient client) {
        this.client = client;
    }

    public PushOutcome push(Path file, String backupName, boolean allowPlaintext) {
        String name = requireName(backupName);
        byte[] data = readLocal(file);
        if (!allowPlaintext) {
            DotenvScanner.Scan scan = DotenvScanner.scan(data);
            if (!scan.plaintextKeys().isEmpty()) {
                log.debug("plaintext keys in {}: {}", file, scan.plaintextKeys());
                throw new SunException(ErrorKind.PLAINTEXT_REFUSED,
                        "vault file contains plaintext keys; encrypt them first or re-run with --allow-plaintext");
            }
        }
        String sha256 = Hashing.sha256Hex(data);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("path", file.getFileName() == null ? "" : file.getFileName().toString());
        metadata.put("sha256", sha256);
        PutResult result = client.putObject(KIND, name, data, CONTENT_TYPE, metadata, null);
        log.info("pushed vault backup {} revision {}", name, result.revision());
        return new PushOutcome(name, file.toString(), sha256, data.length, result.revision());
    }

    /**
     * Fetches the backup, checks it against the stored size and checksums, then replaces {@code file}.
     * Nothing is written when verification fails.
     */
    public PullOutcome pull(Path file, String backupName) {
        String name = requireName(backupName);
        Optional<ObjectMeta> meta = Optional.empty();
        try {
            meta = client.lookupObjectMeta(KIND, name);
        } catch (SunException e) {
            if (e.is(ErrorKind.CANCELLED)) {
                throw e;
            }
            log.warn("vault backup checksum verification preflight skipped: {}", e.getMessage());
        }
        byte[] data = client.getPayload(KIND, name);
        String actual = Hashing.sha256Hex(data);
        boolean verified = false;
        if (meta.isPresent()) {
            verify(name, meta.get(), data, actual);
            verified = true;
        }
        try {
            AtomicFiles.writeOwnerOnly(file, data);
        } catch (IOException e) {
            throw new SunException(ErrorKind.LOCAL_IO, "write vault file " + file + ": " + e.getMessage(), e);
        }
        log.info("pulled vault backup {} to {}", name, file);
        return new PullOutcome(name, file.toString(), actual, data.length, verified);
    }

    public StatusOutcome status(Path file, String backupName) {
        String name = Texts.firstNonBlank(backupName, "default");
        boolean exists = Files.isRegularFile(file);
        String localSha = exists ? Hashing.sha256Hex(readLocal(file)) : null;
        Optional<ObjectMeta> meta = client.lookupObjectMeta(KIND, name);
        String remoteSha = meta.map(m -> Texts.trim(m.checksum())).orElse(null);
        Boolean inSync = localSha != null && remoteSha != null ? localSha.equalsIgnoreCase(remoteSha) : null;
        return new StatusOutcome(
                file.toString(),
                exists,
                localSha,
                name,
                client.endpoint().baseUrl(),
                meta.isPresent(),
                meta.map(ObjectMeta::latestRevision).orElse(null),
                remoteSha,
                meta.map(ObjectMeta::sizeBytes).orElse(null),
                meta.map(ObjectMeta::updatedAt).orElse(null),
                inSync
        );
    }

    static void verify(String name, ObjectMeta meta, byte[] data, String actual) {
        if (meta.sizeBytes() > 0 && meta.sizeBytes() != data.length) {
            throw new SunException(ErrorKind.SIZE_MISMATCH, "vault backup size mismatch for " + name
                    + ": expected " + meta.sizeBytes() + " bytes got " + data.length);
        }
        String checksum = Texts.trim(meta.checksum());
        if (!checksum.isEmpty() && !checksum.equalsIgnoreCase(actual)) {
            throw new SunException(ErrorKind.CHECKSUM_MISMATCH, "vault backup checksum mismatch for " + name
                    + ": expected " + checksum + " got " + actual);
        }
        Object declared = meta.metadata() == null ? null : meta.metadata().get("sha256");
        String declaredSha = declared == null ? "" : declared.toString().trim();
        if (!declaredSha.isEmpty() && !declaredSha.equalsIgnoreCase(actual)) {
            throw new SunException(ErrorKind.CHECKSUM_MISMATCH, "vault backup checksum mismatch for " + name
                    + ": metadata sha256 " + declaredSha + " got " + actual);
        }
    }

    private static byte[] readLocal(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "vault file not found: " + file, e);
        } catch (IOException e) {
            throw new SunException(ErrorKind.LOCAL_IO, "read vault file " + file + ": " + e.getMessage(), e);
        }
    }

    private static String requireName(String backupName) {
        String name = Texts.trim(backupName);
        if (name.isEmpty()) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "backup name required (--name or SUN_VAULT_BACKUP)");
        }
        return name;
    }

    public record PushOutcome(String backupName, String file, String sha256, long sizeBytes, long revision) {
    }

    public record PullOutcome(String backupName, String file, String sha256, long sizeBytes, boolean verified) {
    }

    public record StatusOutcome(
            String file,
            boolean fileExists,
            String localSha256,
            String backupName,
            String baseUrl,
            boolean backupExists,
            Long revision,
            String checksum,
            Long sizeBytes,
            String updatedAt,
            Boolean inSync
    ) {
    }
}
