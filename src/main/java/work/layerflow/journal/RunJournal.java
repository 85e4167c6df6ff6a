package work.layerflow.journal;

import java.util.List;
import java.util.Map;

/**
 * Records the start and the outcome of each run.
 */
public interface RunJournal {
    RunJournal NOOP = new RunJournal() {
        @Override
        public void reportStart(long timestamp, List<Integer> targets, Map<String, Object> params) {}

        @Override
        public void reportFinish(long timestamp, boolean success) {}
    };

    void reportStart(long timestamp, List<Integer> targets, Map<String, Object> params);

    void reportFinish(long timestamp, boolean success);
}
