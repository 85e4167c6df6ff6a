package work.layerflow.task;

import java.util.List;
import java.util.Map;
import work.layerflow.file.DataFile;

/**
 * Describes how to produce output data files from input data files.
 * <p>
 * The lowest output code has to be greater than the highest input code, and at most one registered task
 * may write a given code. Implementations should keep no state beyond the codes they declare.
 */
public interface Task {
    /**
     * Codes of the data files this task reads. One data file can feed several tasks.
     */
    List<Integer> inputCodes();

    /**
     * Codes of the data files this task writes.
     */
    List<Integer> outputCodes();

    /**
     * Runs the task.
     *
     * @param inputs one read handle per input code
     * @param outputs one write handle per output code
     * @param context values shared by every task of the run, in execution order
     */
    void run(Map<Integer, DataFile> inputs, Map<Integer, DataFile> outputs, Map<String, Object> context) throws Exception;

    default String describe() {
        return inputCodes() + " -> " + outputCodes();
    }
}
