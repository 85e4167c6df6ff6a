package work.layerflow.spec;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Format of a data file kind, addressed by its integer code. A spec with a schema is tabular (CSV).
 */
public record FileSpec(int code, String name, String extension, Set<FileFlag> flags, Optional<TableSchema> schema) {
    public FileSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(schema, "schema");
        if (name.isBlank()) {
            throw new IllegalArgumentException("File spec " + code + " needs a name");
        }
        extension = extension == null ? "" : extension;
        flags = flags == null || flags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(flags));
    }

    public static FileSpec generic(int code, String name, String extension, FileFlag... flags) {
        return new FileSpec(code, name, extension, toSet(flags), Optional.empty());
    }

    public static FileSpec tabular(int code, String name, TableSchema schema, FileFlag... flags) {
        return new FileSpec(code, name, "csv", toSet(flags), Optional.of(schema));
    }

    public boolean isBinary() {
        return flags.contains(FileFlag.BINARY);
    }

    public boolean isGzipped() {
        return flags.contains(FileFlag.GZIPPED);
    }

    public boolean isDirectory() {
        return flags.contains(FileFlag.DIRECTORY);
    }

    public boolean isTabular() {
        return schema.isPresent();
    }

    private static Set<FileFlag> toSet(FileFlag... flags) {
        if (flags == null || flags.length == 0) {
            return Set.of();
        }
        return EnumSet.of(flags[0], flags);
    }
}
