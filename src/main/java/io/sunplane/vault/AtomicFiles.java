package io.sunplane.vault;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

public final class AtomicFiles {
    private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private AtomicFiles() {
    }

    /**
     * Writes through a sibling temp file and renames it over {@code target}, mode 0600 where POSIX applies.
     */
    public static void writeOwnerOnly(Path target, byte[] data) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, ".sun-", ".tmp");
        try {
            restrict(tmp);
            Files.write(tmp, data, StandardOpenOption.TRUNCATE_EXISTING);
            restrict(tmp);
            try {
                move(tmp, absolute);
            } catch (IOException e) {
                if (!Files.isRegularFile(absolute)) {
                    throw e;
                }
                log.warn("rename over {} failed ({}), rewriting in place", absolute, e.getMessage());
                Files.write(absolute, data, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            }
            restrict(absolute);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void restrict(Path path) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(path, OWNER_ONLY);
        }
    }
}
