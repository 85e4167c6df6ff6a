package work.layerflow.support;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import work.layerflow.file.DataFile;
import work.layerflow.file.TabularDataFile;
import work.layerflow.task.TaskCatalog;
import work.layerflow.task.TaskProvider;

/**
 * Tasks referenced by {@code engines/mock_engine.yaml}; registered for {@link java.util.ServiceLoader} discovery.
 */
public final class MockTaskProvider implements TaskProvider {
    @Override
    public void contribute(TaskCatalog catalog) {
        catalog
            .register("foo", Foo::new)
            .register("bar", () -> new RecordingTask("bar", List.of(1000), List.of(2000)))
            .register("baz", () -> new RecordingTask("baz", List.of(2000), List.of(3000)))
            .register("baz_alternative", BazAlternative::new)
            .register("report_and_plots", () -> new RecordingTask("report_and_plots", List.of(3000), List.of(9100, 9200)))
            .register("summary", Summary::new);
    }

    /** Starts a fresh roll call and writes an empty table. */
    static final class Foo extends RecordingTask {
        Foo() {
            super("foo", List.of(), List.of(1000));
        }

        @Override
        public void run(Map<Integer, DataFile> inputs, Map<Integer, DataFile> outputs, Map<String, Object> context) throws IOException {
            context.remove(ROLL_CALL);
            rollCall(context).add(name());
            for (var output : outputs.values()) {
                ((TabularDataFile) output).openRecordWriter().close();
            }
        }
    }

    static final class BazAlternative extends RecordingTask {
        BazAlternative() {
            super("baz_alternative", List.of(1000), List.of(3000));
        }

        @Override
        public void run(Map<Integer, DataFile> inputs, Map<Integer, DataFile> outputs, Map<String, Object> context) throws IOException {
            super.run(inputs, outputs, context);
            rollCall(context).add(String.valueOf(context.get("baz_alternative.fake")));
        }
    }

    static final class Summary extends RecordingTask {
        Summary() {
            super("summary", List.of(), List.of(9900));
        }

        @Override
        public void run(Map<Integer, DataFile> inputs, Map<Integer, DataFile> outputs, Map<String, Object> context) throws IOException {
            rollCall(context).add(name());
            try (var writer = outputs.get(9900).openWriter()) {
                writer.write(String.join(" ", rollCall(context)));
            }
        }
    }
}
