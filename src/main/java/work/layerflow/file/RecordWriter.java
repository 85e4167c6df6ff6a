package work.layerflow.file;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVPrinter;
import work.layerflow.spec.SchemaField;
import work.layerflow.spec.TableSchema;

/**
 * Streams records into a tabular data file. The header row is written when the writer is opened.
 */
public final class RecordWriter implements Closeable {
    private final CSVPrinter printer;
    private final TableSchema schema;
    private final boolean validate;
    private long written;

    RecordWriter(Writer out, TableSchema schema, boolean validate) throws IOException {
        this.schema = schema;
        this.validate = validate;
        this.printer = new CSVPrinter(out, schema.dialect().toFormat());
        try {
            printer.printRecord(schema.fieldNames());
        } catch (IOException ex) {
            printer.close();
            throw ex;
        }
    }

    /**
     * Writes one record; fields missing from the map are left empty.
     */
    public void write(Map<String, ?> record) throws IOException {
        if (validate) {
            var names = schema.fieldNames();
            for (String key : record.keySet()) {
                if (!names.contains(key)) {
                    throw new SchemaMismatchException("Field " + key + " is not part of schema " + names);
                }
            }
        }
        List<String> row = new ArrayList<>(schema.fields().size());
        for (SchemaField field : schema.fields()) {
            row.add(field.type().format(record.get(field.name())));
        }
        printer.printRecord(row);
        written++;
    }

    public long recordsWritten() {
        return written;
    }

    @Override
    public void close() throws IOException {
        printer.close(true);
    }
}
