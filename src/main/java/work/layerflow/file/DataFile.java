package work.layerflow.file;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import work.layerflow.spec.FileSpec;

/**
 * Handle on one concrete version of a data file, opened for reading or for writing.
 * <p>
 * Gzipped specs are (de)compressed transparently. Output is written to a hidden {@code .<name>.partial}
 * sibling and only appears under its final name once {@link #publish()} is called; the orchestrator
 * publishes the outputs of a task after it returns and discards them when it fails.
 */
public class DataFile {
    private final Path path;
    private final FileIntent intent;
    private final FileSpec spec;

    public DataFile(Path path, FileIntent intent, FileSpec spec) {
        this.path = Objects.requireNonNull(path, "path");
        this.intent = Objects.requireNonNull(intent, "intent");
        this.spec = Objects.requireNonNull(spec, "spec");
    }

    /**
     * Creates the handle type matching the file spec: tabular specs get a {@link TabularDataFile}.
     */
    public static DataFile of(Path path, FileIntent intent, FileSpec spec) {
        if (spec.isTabular()) {
            return new TabularDataFile(path, intent, spec);
        }
        return new DataFile(path, intent, spec);
    }

    public Path path() {
        return path;
    }

    public FileIntent intent() {
        return intent;
    }

    public FileSpec spec() {
        return spec;
    }

    public InputStream openInputStream() throws IOException {
        requireStream(FileIntent.READ);
        InputStream in = Files.newInputStream(path);
        if (spec.isGzipped()) {
            try {
                return new GzipCompressorInputStream(in);
            } catch (IOException ex) {
                in.close();
                throw ex;
            }
        }
        return in;
    }

    public OutputStream openOutputStream() throws IOException {
        requireStream(FileIntent.WRITE);
        OutputStream out = Files.newOutputStream(partialPath());
        if (spec.isGzipped()) {
            return new GzipCompressorOutputStream(out);
        }
        return out;
    }

    public BufferedReader openReader() throws IOException {
        requireText();
        return new BufferedReader(new InputStreamReader(openInputStream(), StandardCharsets.UTF_8));
    }

    public BufferedWriter openWriter() throws IOException {
        requireText();
        return new BufferedWriter(new OutputStreamWriter(openOutputStream(), StandardCharsets.UTF_8));
    }

    /**
     * Creates the (unpublished) directory of a directory-flagged spec and returns the path to fill.
     */
    public Path createDirectory() throws IOException {
        if (!spec.isDirectory()) {
            throw new IllegalStateException("Data file " + spec.code() + " is not a directory");
        }
        requireWrite();
        return Files.createDirectories(partialPath());
    }

    /**
     * Where output goes until it is published.
     */
    public Path partialPath() {
        return path.resolveSibling("." + path.getFileName() + ".partial");
    }

    /**
     * Moves the written output onto its final name.
     *
     * @return {@code false} when nothing was written
     */
    public boolean publish() throws IOException {
        requireWrite();
        var partial = partialPath();
        if (!Files.exists(partial, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        try {
            Files.move(partial, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(partial, path, StandardCopyOption.REPLACE_EXISTING);
        }
        return true;
    }

    /**
     * Deletes unpublished output, directory contents included.
     */
    public void discard() throws IOException {
        requireWrite();
        var partial = partialPath();
        if (!Files.isDirectory(partial, LinkOption.NOFOLLOW_LINKS)) {
            Files.deleteIfExists(partial);
            return;
        }
        Files.walkFileTree(partial, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    @Override
    public String toString() {
        return intent + " " + path;
    }

    void requireStream(FileIntent expected) {
        if (spec.isDirectory()) {
            throw new IllegalStateException("Cannot open a directory: " + path);
        }
        if (intent != expected) {
            throw new IllegalStateException("Data file " + path + " was resolved for " + intent + ", not " + expected);
        }
    }

    private void requireWrite() {
        if (intent != FileIntent.WRITE) {
            throw new IllegalStateException("Data file " + path + " was resolved for reading");
        }
    }

    private void requireText() {
        if (spec.isBinary()) {
            throw new IllegalStateException("Data file " + spec.code() + " is binary, use the stream methods");
        }
    }
}
