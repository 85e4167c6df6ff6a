package work.layerflow.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.layerflow.registry.EngineRegistry;
import work.layerflow.registry.UnknownTaskException;
import work.layerflow.spec.FileSpec;
import work.layerflow.support.RecordingTask;

class DependencyResolverTest {
    private EngineRegistry registry;
    private DependencyResolver resolver;

    @BeforeEach
    void setUp() {
        registry = new EngineRegistry();
        for (int code = 1000; code < 9000; code += 100) {
            registry.registerFileSpec(FileSpec.generic(code, "foo", "dat"));
        }
        registry.registerTask(new RecordingTask("A", List.of(), List.of(1000, 1100)));
        registry.registerTask(new RecordingTask("B1", List.of(1000), List.of(2000)));
        registry.registerTask(new RecordingTask("C", List.of(1000), List.of(3000)));
        registry.registerTask(new RecordingTask("D", List.of(1000, 2000), List.of(4000)));
        registry.registerTask(new RecordingTask("E5", List.of(), List.of(5000)));
        registry.registerTask(new RecordingTask("F", List.of(3000), List.of(6000)));
        registry.registerWorkflow("wf", List.of(6000, 2000, 6000));
        resolver = new DependencyResolver(registry);
    }

    @Test
    void workflowWithoutDependenciesIsReturnedAsStored() {
        assertEquals(List.of(6000, 2000, 6000), resolver.expandTargets(List.of("wf"), false));
    }

    @Test
    void requestsAreConcatenatedInOrder() {
        assertEquals(List.of(5000, 6000, 2000, 6000, 1100), resolver.expandTargets(List.of("5000", "wf", " 1100 "), false));
    }

    @Test
    void dependenciesAreAddedAndSorted() {
        assertEquals(List.of(1000, 2000, 4000), resolver.expandTargets(List.of("4000"), true));
    }

    @Test
    void transitiveDependenciesAcrossSeveralTargets() {
        assertEquals(List.of(1000, 2000, 3000, 5000, 6000), resolver.expandTargets(List.of("6000", "5000", "2000"), true));
    }

    @Test
    void repeatedSeedsCollapseOnlyWhenDependenciesAreIncluded() {
        assertEquals(List.of(4000, 4000), resolver.expandTargets(List.of("4000", "4000"), false));
        assertEquals(List.of(1000, 2000, 4000), resolver.expandTargets(List.of("4000", "4000"), true));
    }

    @Test
    void workflowWithDependencies() {
        assertEquals(List.of(1000, 2000, 3000, 6000), resolver.expandTargets(List.of("wf"), true));
    }

    @Test
    void malformedTargetFails() {
        var thrown = assertThrows(InvalidTargetException.class, () -> resolver.expandTargets(List.of("monthly"), false));
        assertEquals("invalid_target", thrown.code());
    }

    @Test
    void targetWithoutProducerFailsDuringClosure() {
        assertThrows(UnknownTaskException.class, () -> resolver.expandTargets(List.of("1200"), true));
    }

    @Test
    void targetWithoutProducerPassesWithoutClosure() {
        assertEquals(List.of(1200), resolver.expandTargets(List.of("1200"), false));
    }

    @Test
    void dependencyWithoutProducerIsLeftToTheWorkspace() {
        registry.registerTask(new RecordingTask("G", List.of(1200, 2000), List.of(7000)));
        assertEquals(List.of(1000, 2000, 7000), resolver.expandTargets(List.of("7000"), true));
    }
}
