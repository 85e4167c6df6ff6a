package work.layerflow.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.layerflow.file.DataFile;
import work.layerflow.file.FileIntent;
import work.layerflow.registry.EngineRegistry;
import work.layerflow.spec.FileSpec;

/**
 * Maps a code to a concrete file in the workspace, named {@code d<code:4>_<name>_v<version>.<extension>}.
 * <p>
 * Writes are stamped with the run timestamp. Reads take the version stamped with the run timestamp when
 * one exists (so concurrent runs sharing a workspace see their own intermediates), otherwise the greatest
 * version present.
 */
public final class VersionedFileResolver {
    private static final Logger LOG = LoggerFactory.getLogger(VersionedFileResolver.class);

    private final EngineRegistry registry;

    public VersionedFileResolver(EngineRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Path resolve(Path workspace, int code, FileIntent intent, long runTimestamp) {
        return resolve(workspace, registry.spec(code), intent, runTimestamp);
    }

    public Path resolve(Path workspace, FileSpec spec, FileIntent intent, long runTimestamp) {
        long version = runTimestamp;
        if (intent == FileIntent.READ) {
            var versions = versions(workspace, spec);
            if (versions.isEmpty()) {
                throw new NoInputFileException(String.format(Locale.ROOT, "No input files for code %04d", spec.code()));
            }
            if (!versions.contains(runTimestamp)) {
                version = versions.get(versions.size() - 1);
            }
        }
        return workspace.resolve(fileName(spec, version));
    }

    /**
     * Resolves the path and wraps it in the handle type matching its file spec.
     */
    public DataFile open(Path workspace, int code, FileIntent intent, long runTimestamp) {
        var spec = registry.spec(code);
        return DataFile.of(resolve(workspace, spec, intent, runTimestamp), intent, spec);
    }

    public List<Long> versions(Path workspace, int code) {
        return versions(workspace, registry.spec(code));
    }

    /**
     * Versions of a file spec present in the workspace, ascending.
     */
    public List<Long> versions(Path workspace, FileSpec spec) {
        var pattern = filePattern(spec);
        var found = new TreeSet<Long>();
        List<Path> entries;
        try (var listing = Files.list(workspace)) {
            entries = listing.collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to list workspace " + workspace, ex);
        }
        for (Path entry : entries) {
            Matcher matcher = pattern.matcher(entry.getFileName().toString());
            if (!matcher.matches() || Files.isDirectory(entry) != spec.isDirectory()) {
                continue;
            }
            try {
                found.add(Long.parseLong(matcher.group(1)));
            } catch (NumberFormatException ex) {
                LOG.warn("Ignoring {}: version does not fit a timestamp", entry);
            }
        }
        return new ArrayList<>(found);
    }

    public static String fileName(FileSpec spec, long version) {
        var stem = String.format(Locale.ROOT, "d%04d_%s_v%d", spec.code(), spec.name(), version);
        return spec.extension().isEmpty() ? stem : stem + "." + spec.extension();
    }

    private static Pattern filePattern(FileSpec spec) {
        var prefix = String.format(Locale.ROOT, "d%04d_", spec.code());
        var suffix = spec.extension().isEmpty() ? "" : Pattern.quote("." + spec.extension());
        return Pattern.compile(Pattern.quote(prefix + spec.name() + "_v") + "(\\d+)" + suffix);
    }
}
