package io.sunplane.gateway;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.SunException;
import io.sunplane.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

final class CatalogBuilderTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-04T05:06:07Z"), ZoneOffset.UTC);

    static Path writeManifest(Path dir, String json) throws Exception {
        Files.createDirectories(dir);
        return Files.writeString(dir.resolve(PluginManifest.FILE_NAME), json);
    }

    @Test
    void walksTreeAndKeepsFirstOfDuplicateIds() throws Exception {
        Path root = Files.createTempDirectory("sunplane-catalog-");
        try {
            writeManifest(root.resolve("a"), "{\"id\":\"acme/one\",\"integration\":{\"capabilities\":[\"search\"]}}");
            writeManifest(root.resolve("b"), "{\"id\":\"acme/one\",\"summary\":\"second copy\"}");
            writeManifest(root.resolve("c"), "{\"id\":\"beta/two\"}");
            writeManifest(root.resolve("d"), "{\"id\":\"Bad Id\"}");
            writeManifest(root.resolve("e"), "{not json");
            Files.writeString(root.resolve("README.md"), "ignored");

            CatalogBuilder.Result result = new CatalogBuilder(CLOCK).build(root,
                    new CatalogBuilder.Options("official", true, null, List.of("x", " x ", "y")));

            List<CatalogEntry> entries = result.catalog().entries;
            Assertions.assertEquals(2, entries.size());
            Assertions.assertEquals("acme/one", entries.get(0).id());
            Assertions.assertEquals(root.resolve("a").resolve(PluginManifest.FILE_NAME).toAbsolutePath().normalize().toString(),
                    entries.get(0).source);
            Assertions.assertEquals("", entries.get(0).manifest.summary);
            Assertions.assertEquals("official", entries.get(0).channel);
            Assertions.assertTrue(entries.get(0).verified);
            Assertions.assertEquals("2026-03-04", entries.get(0).addedAt);
            Assertions.assertEquals(List.of("x", "y"), entries.get(0).tags);
            Assertions.assertEquals("beta/two", entries.get(1).id());

            List<Diagnostic> diagnostics = result.diagnostics();
            Assertions.assertEquals(3, diagnostics.size());
            Assertions.assertEquals(1, diagnostics.stream().filter(d -> d.level().equals("warn")).count());
            Assertions.assertEquals(2, diagnostics.stream().filter(d -> d.level().equals("error")).count());
            Assertions.assertTrue(diagnostics.stream().anyMatch(d -> d.message().contains("duplicate plugin id \"acme/one\"")));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void singleManifestFileIsAccepted() throws Exception {
        Path root = Files.createTempDirectory("sunplane-catalog-");
        try {
            Path file = writeManifest(root, "{\"id\":\"acme/one\"}");

            CatalogBuilder.Result result = new CatalogBuilder(CLOCK).build(file, CatalogBuilder.Options.defaults());

            Assertions.assertEquals(1, result.catalog().entries.size());
            Assertions.assertEquals("community", result.catalog().entries.get(0).channel);
            Assertions.assertTrue(result.diagnostics().isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void unusableSourcesFailTheBuild() throws Exception {
        Path root = Files.createTempDirectory("sunplane-catalog-");
        try {
            CatalogBuilder builder = new CatalogBuilder(CLOCK);
            Path other = Files.writeString(root.resolve("plugin.json"), "{}");

            assertInvalid(() -> builder.build(root, CatalogBuilder.Options.defaults()));
            assertInvalid(() -> builder.build(root.resolve("missing"), CatalogBuilder.Options.defaults()));
            assertInvalid(() -> builder.build(other, CatalogBuilder.Options.defaults()));

            Path file = writeManifest(root, "{\"id\":\"acme/one\"}");
            assertInvalid(() -> builder.build(file, new CatalogBuilder.Options(null, false, "03/04/2026", null)));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static void assertInvalid(org.junit.jupiter.api.function.Executable action) {
        SunException error = Assertions.assertThrows(SunException.class, action);
        Assertions.assertEquals(ErrorKind.INVALID_ARGUMENT, error.kind());
    }
}
