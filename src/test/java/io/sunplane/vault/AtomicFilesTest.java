package io.sunplane.vault;

import io.sunplane.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.stream.Stream;

final class AtomicFilesTest {

    @Test
    void replacesTargetAndLeavesNoTempFiles() throws Exception {
        Path root = Files.createTempDirectory("sunplane-atomic-");
        try {
            Path target = root.resolve("nested").resolve(".env");
            AtomicFiles.writeOwnerOnly(target, "A=1\n".getBytes());
            AtomicFiles.writeOwnerOnly(target, "A=2\n".getBytes());

            Assertions.assertEquals("A=2\n", Files.readString(target));
            try (Stream<Path> files = Files.list(target.getParent())) {
                Assertions.assertEquals(1, files.count());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void restrictsPermissionsToOwnerOnPosix() throws Exception {
        Assumptions.assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path root = Files.createTempDirectory("sunplane-atomic-");
        try {
            Path target = root.resolve(".env");
            Files.writeString(target, "old");
            Files.setPosixFilePermissions(target, PosixFilePermissions.fromString("rw-r--r--"));

            AtomicFiles.writeOwnerOnly(target, "new".getBytes());

            Assertions.assertEquals("rw-------", PosixFilePermissions.toString(Files.getPosixFilePermissions(target)));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}
