package io.sunplane.gateway;

import io.sunplane.client.ErrorKind;
import io.sunplane.client.SunException;
import io.sunplane.util.Jsons;
import io.sunplane.util.Texts;
import io.sunplane.util.Timestamps;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns a manifest file or a tree of manifests into a catalog. Problems with a single manifest
 * become diagnostics; a missing source, an empty tree or a bad option fails the build.
 */
public final class CatalogBuilder {
    private final Clock clock;

    public CatalogBuilder() {
        this(Clock.systemUTC());
    }

    public CatalogBuilder(Clock clock) {
        this.clock = clock;
    }

    public Result build(Path source, Options options) {
        List<Path> paths = discover(source);
        String channel = Texts.firstNonBlank(options.channel(), "community");
        String addedAt = Texts.firstNonBlank(options.addedAt(), Timestamps.day(clock.instant()));
        try {
            LocalDate.parse(addedAt);
        } catch (DateTimeParseException e) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT,
                    "invalid added_at date \"" + addedAt + "\" (expected YYYY-MM-DD)", e);
        }
        List<String> tags = Texts.normalizeList(options.tags());

        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, CatalogEntry> entries = new LinkedHashMap<>();
        for (Path path : paths) {
            PluginManifest manifest;
            try {
                manifest = readManifest(path);
            } catch (SunException e) {
                diagnostics.add(Diagnostic.error("manifest " + path + " invalid: " + e.getMessage(), path.toString()));
                continue;
            }
            CatalogEntry previous = entries.get(manifest.id);
            if (previous != null) {
                diagnostics.add(Diagnostic.warn("duplicate plugin id \"" + manifest.id
                        + "\" skipped (already loaded from " + previous.source + ")", path.toString()));
                continue;
            }
            CatalogEntry entry = new CatalogEntry();
            entry.manifest = manifest;
            entry.channel = channel;
            entry.verified = options.verified();
            entry.addedAt = addedAt;
            entry.tags = tags;
            entry.source = path.toString();
            entries.put(manifest.id, entry);
        }
        Catalog catalog = new Catalog();
        catalog.entries = new ArrayList<>(entries.values());
        catalog.entries.sort(Comparator.comparing(CatalogEntry::id));
        return new Result(catalog, diagnostics);
    }

    static List<Path> discover(Path source) {
        Path resolved = source.toAbsolutePath().normalize();
        if (Files.isDirectory(resolved)) {
            List<Path> paths;
            try (Stream<Path> walk = Files.walk(resolved)) {
                paths = walk.filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().equalsIgnoreCase(PluginManifest.FILE_NAME))
                        .sorted(Comparator.comparing(Path::toString))
                        .collect(Collectors.toList());
            } catch (IOException e) {
                throw new SunException(ErrorKind.LOCAL_IO, "walk " + resolved + ": " + e.getMessage(), e);
            }
            if (paths.isEmpty()) {
                throw new SunException(ErrorKind.INVALID_ARGUMENT,
                        "no " + PluginManifest.FILE_NAME + " files found in " + resolved);
            }
            return paths;
        }
        if (!Files.isRegularFile(resolved)) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "unsupported source: " + resolved);
        }
        if (!resolved.getFileName().toString().equalsIgnoreCase(PluginManifest.FILE_NAME)) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT,
                    "source file must be " + PluginManifest.FILE_NAME + ", got " + resolved);
        }
        return List.of(resolved);
    }

    static PluginManifest readManifest(Path path) {
        PluginManifest manifest;
        try {
            manifest = Jsons.read(Files.readAllBytes(path), PluginManifest.class);
        } catch (IOException e) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "parse manifest: " + e.getMessage(), e);
        }
        if (manifest == null) {
            throw new SunException(ErrorKind.INVALID_ARGUMENT, "empty manifest");
        }
        manifest.validate();
        return manifest;
    }

    public record Options(String channel, boolean verified, String addedAt, List<String> tags) {
        public static Options defaults() {
            return new Options("community", false, null, null);
        }
    }

    public record Result(Catalog catalog, List<Diagnostic> diagnostics) {
    }
}
