package io.tessera.core.discovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import io.tessera.core.exception.StructuralException;
import io.tessera.core.model.Connection;
import io.tessera.core.model.Include;
import io.tessera.core.model.Pool;
import io.tessera.core.model.Requirement;
import io.tessera.core.model.Variable;
import io.tessera.core.workflow.callback.Callback;
import io.tessera.core.workflow.task.OperatorTask;
import io.tessera.core.workflow.task.Task;
import io.tessera.core.workflow.task.TaskGroup;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class DependencyWalkerTest {

    @Mock private DependencySink sink;

    // -------------------------------------------------------------------------
    // Reporting
    // -------------------------------------------------------------------------

    @Nested
    class ReportingTest {

        @Test
        void shouldReportDependenciesOfTask() {
            var pool = new Pool("p1", 2);
            var connection = Connection.of("c1");
            var task =
                    OperatorTask.builder()
                            .taskId("t")
                            .operator("BashOperator")
                            .pool(pool)
                            .connection(connection)
                            .build();

            new DependencyWalker(sink, 8).walk(task);

            verify(sink).onPool(pool);
            verify(sink).onConnections(Set.of(connection));
        }

        @Test
        void shouldIgnoreLeaves() {
            var walker = new DependencyWalker(sink, 8);

            walker.walk("a string");
            walker.walk(42);
            walker.walk(null);

            verifyNoInteractions(sink);
        }

        @Test
        void shouldNotReportEmptyCollections() {
            new DependencyWalker(sink, 8)
                    .walk(OperatorTask.builder().taskId("t").operator("EmptyOperator").build());

            verifyNoInteractions(sink);
        }
    }

    // -------------------------------------------------------------------------
    // Traversal
    // -------------------------------------------------------------------------

    @Nested
    class TraversalTest {

        @Test
        void shouldFindDependenciesInNestedGroups() {
            var inner =
                    TaskGroup.builder()
                            .taskId("inner")
                            .task(task("leaf", new Pool("deep", 1)))
                            .build();
            var outer = TaskGroup.builder().taskId("outer").task(inner).build();
            var recorder = new RecordingSink();

            new DependencyWalker(recorder, 8).walk(outer);

            assertThat(recorder.pools).containsExactly(new Pool("deep", 1));
        }

        @Test
        void shouldFindCallbackInsideOperatorArgumentList() {
            var callback =
                    Callback.builder()
                            .function("notify")
                            .connection(Connection.of("slack"))
                            .build();
            var task =
                    OperatorTask.builder()
                            .taskId("t")
                            .operator("PythonOperator")
                            .argument("on_retry", List.of(Map.of("hook", callback)))
                            .build();
            var recorder = new RecordingSink();

            new DependencyWalker(recorder, 8).walk(task);

            assertThat(recorder.connections).containsExactly(Connection.of("slack"));
        }

        @Test
        void shouldTraverseOptionalsAndArrays() {
            var recorder = new RecordingSink();
            Object[] array = {task("a", new Pool("p1", 1))};

            new DependencyWalker(recorder, 8)
                    .walk(List.of(Optional.of(task("b", new Pool("p2", 1))), array));

            assertThat(recorder.pools).containsExactly(new Pool("p2", 1), new Pool("p1", 1));
        }

        @Test
        void shouldVisitCallbacksOfTasks() {
            var callback =
                    Callback.builder()
                            .function("alert")
                            .variables(List.of(new Variable("channel", "#ops")))
                            .build();
            var task =
                    OperatorTask.builder()
                            .taskId("t")
                            .operator("EmptyOperator")
                            .callback("on_failure_callback", callback)
                            .build();
            var recorder = new RecordingSink();

            new DependencyWalker(recorder, 8).walk(task);

            assertThat(recorder.variables).containsExactly(new Variable("channel", "#ops"));
        }
    }

    // -------------------------------------------------------------------------
    // Depth bound
    // -------------------------------------------------------------------------

    @Nested
    class DepthBoundTest {

        @Test
        void shouldFailWhenNestingExceedsBound() {
            Task current = task("leaf", null);
            for (int i = 0; i < 5; i++) {
                current = TaskGroup.builder().taskId("g" + i).task(current).build();
            }
            var root = current;

            assertThatThrownBy(() -> new DependencyWalker(sink, 3).walk(root))
                    .isInstanceOfSatisfying(
                            StructuralException.class,
                            e -> {
                                assertThat(e.getDepth()).isEqualTo(3);
                                assertThat(e.getPath()).hasSize(4).containsOnly("TaskGroup");
                            });
        }

        @Test
        void shouldWalkGraphAtExactlyTheBound() {
            var group = TaskGroup.builder().taskId("g").task(task("leaf", null)).build();
            var recorder = new RecordingSink();

            new DependencyWalker(recorder, 1).walk(group);

            assertThat(recorder.requirements).contains(TaskGroup.TASK_GROUP_IMPORT);
        }

        @Test
        void shouldRejectNonPositiveBound() {
            assertThatThrownBy(() -> new DependencyWalker(sink, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void shouldCollectImportsInDiscoveryOrder() {
        var requirement = Requirement.of("pkg", "pkg.ops", "Load");
        var task =
                OperatorTask.builder()
                        .taskId("t")
                        .operator("Load")
                        .importing(requirement)
                        .build();
        var group = TaskGroup.builder().taskId("g").task(task).build();

        assertThat(DependencyWalker.collectImports(group, 8))
                .containsExactly(TaskGroup.TASK_GROUP_IMPORT, requirement);
    }

    @Test
    void shouldCollectIncludesFromTasks() {
        var include = new Include("include/run.sh", "echo hi");
        var task =
                OperatorTask.builder()
                        .taskId("t")
                        .operator("BashOperator")
                        .include(include)
                        .build();
        var recorder = new RecordingSink();

        new DependencyWalker(recorder, 8).walk(task);

        assertThat(recorder.includes).containsExactly(include);
    }

    private static OperatorTask task(String id, Pool pool) {
        return OperatorTask.builder().taskId(id).operator("EmptyOperator").pool(pool).build();
    }

    private static final class RecordingSink implements DependencySink {
        final List<Pool> pools = new ArrayList<>();
        final List<Connection> connections = new ArrayList<>();
        final List<Variable> variables = new ArrayList<>();
        final List<Include> includes = new ArrayList<>();
        final List<Requirement> requirements = new ArrayList<>();

        @Override
        public void onPool(Pool pool) {
            pools.add(pool);
        }

        @Override
        public void onConnections(Collection<Connection> found) {
            connections.addAll(found);
        }

        @Override
        public void onVariables(Collection<Variable> found) {
            variables.addAll(found);
        }

        @Override
        public void onIncludes(Collection<Include> found) {
            includes.addAll(found);
        }

        @Override
        public void onRequirements(Collection<Requirement> found) {
            requirements.addAll(found);
        }
    }
}
