package work.layerflow.file;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import work.layerflow.spec.FileSpec;
import work.layerflow.spec.SchemaField;
import work.layerflow.spec.TableSchema;

/**
 * CSV data file whose rows follow the schema of its spec.
 */
public final class TabularDataFile extends DataFile {
    private final TableSchema schema;

    public TabularDataFile(Path path, FileIntent intent, FileSpec spec) {
        super(path, intent, spec);
        this.schema = spec.schema()
            .orElseThrow(() -> new IllegalArgumentException("Data file " + spec.code() + " has no schema"));
    }

    public TableSchema schema() {
        return schema;
    }

    /**
     * Lazily reads the records of the file. The returned stream holds the file open and must be closed;
     * call again to read from the start.
     *
     * @param validate whether the header must match the schema field names (an empty file is then an error)
     */
    public Stream<Map<String, Object>> records(boolean validate) throws IOException {
        var reader = openReader();
        CSVParser parser;
        try {
            parser = new CSVParser(reader, schema.dialect().toFormat());
        } catch (IOException ex) {
            reader.close();
            throw ex;
        }
        Iterator<CSVRecord> rows = parser.iterator();
        if (!rows.hasNext()) {
            parser.close();
            if (validate) {
                throw new SchemaMismatchException("Empty file without header: " + path());
            }
            return Stream.empty();
        }
        var header = rows.next();
        if (validate) {
            List<String> actual = new ArrayList<>(header.size());
            header.forEach(actual::add);
            if (!actual.equals(schema.fieldNames())) {
                parser.close();
                throw new SchemaMismatchException(
                    "Header " + actual + " of " + path() + " does not match schema " + schema.fieldNames()
                );
            }
        }
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(rows, Spliterator.ORDERED), false)
            .map(this::toRecord)
            .onClose(() -> {
                try {
                    parser.close();
                } catch (IOException ex) {
                    throw new UncheckedIOException(ex);
                }
            });
    }

    public Stream<Map<String, Object>> records() throws IOException {
        return records(true);
    }

    public List<Map<String, Object>> readAll(boolean validate) throws IOException {
        try (var records = records(validate)) {
            return records.collect(Collectors.toList());
        }
    }

    public List<Map<String, Object>> readAll() throws IOException {
        return readAll(true);
    }

    public RecordWriter openRecordWriter(boolean validate) throws IOException {
        return new RecordWriter(openWriter(), schema, validate);
    }

    public RecordWriter openRecordWriter() throws IOException {
        return openRecordWriter(true);
    }

    public long writeAll(Iterable<? extends Map<String, ?>> records, boolean validate) throws IOException {
        try (var writer = openRecordWriter(validate)) {
            for (Map<String, ?> record : records) {
                writer.write(record);
            }
            return writer.recordsWritten();
        }
    }

    private Map<String, Object> toRecord(CSVRecord row) {
        Map<String, Object> record = new LinkedHashMap<>();
        int width = Math.min(row.size(), schema.fields().size());
        for (int i = 0; i < width; i++) {
            SchemaField field = schema.fields().get(i);
            record.put(field.name(), field.type().parse(row.get(i)));
        }
        return record;
    }
}
