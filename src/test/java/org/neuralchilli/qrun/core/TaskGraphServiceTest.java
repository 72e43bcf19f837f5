package org.neuralchilli.qrun.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.qrun.domain.DagStatistics;
import org.neuralchilli.qrun.domain.ExecutionLevel;
import org.neuralchilli.qrun.domain.Task;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskGraphServiceTest {

    private final TaskGraphService service = new TaskGraphService();

    private static Task task(String id, String... dependencies) {
        return Task.builder(id).command("echo " + id).dependsOn(dependencies).build();
    }

    /**
     * a -> {b, c} -> d, i.e. d depends on b and c, which both depend on a.
     */
    private static List<Task> diamond() {
        return List.of(
                task("a"),
                task("b", "a"),
                task("c", "a"),
                task("d", "b", "c")
        );
    }

    @Test
    void shouldAcceptValidGraph() {
        assertThatCode(() -> service.validate(diamond())).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectDuplicateIds() {
        assertThatThrownBy(() -> service.validate(List.of(task("a"), task("a"))))
                .isInstanceOf(DependencyException.class)
                .hasMessageContaining("'a' is defined more than once");
    }

    @Test
    void shouldRejectSelfDependency() {
        assertThatThrownBy(() -> service.validate(List.of(task("a", "a"))))
                .isInstanceOf(DependencyException.class)
                .hasMessage("Task 'a' depends on itself");
    }

    @Test
    void shouldRejectMissingDependency() {
        assertThatThrownBy(() -> service.validate(List.of(task("a", "ghost"))))
                .isInstanceOf(DependencyException.class)
                .hasMessage("Task 'a' depends on 'ghost' which doesn't exist");
    }

    @Test
    void shouldRejectAliasMatchingTaskId() {
        List<Task> tasks = List.of(
                task("build"),
                Task.builder("test").command("true").aliases(List.of("build")).build()
        );

        assertThatThrownBy(() -> service.validate(tasks))
                .isInstanceOf(DependencyException.class)
                .hasMessageContaining("alias 'build' which conflicts with task ID 'build'");
    }

    @Test
    void shouldRejectAliasUsedTwice() {
        List<Task> tasks = List.of(
                Task.builder("a").command("true").aliases(List.of("x")).build(),
                Task.builder("b").command("true").aliases(List.of("x")).build()
        );

        assertThatThrownBy(() -> service.validate(tasks))
                .isInstanceOf(DependencyException.class)
                .hasMessageContaining("alias 'x' which is already used by task 'a'");
    }

    @Test
    void shouldReportCyclePath() {
        List<Task> tasks = List.of(task("a", "b"), task("b", "a"));

        assertThatThrownBy(() -> service.validate(tasks))
                .isInstanceOf(DependencyException.class)
                .hasMessage("Circular dependency: a -> b -> a");
    }

    @Test
    void shouldReportLongerCycle() {
        List<Task> tasks = List.of(task("x"), task("a", "b"), task("b", "c"), task("c", "a"));

        assertThatThrownBy(() -> service.validate(tasks))
                .isInstanceOf(DependencyException.class)
                .hasMessage("Circular dependency: a -> b -> c -> a");
    }

    @Test
    void shouldAcceptGraphOnceBackEdgeIsRemoved() {
        List<Task> cyclic = List.of(task("a", "c"), task("b", "a"), task("c", "b"));
        assertThatThrownBy(() -> service.validate(cyclic)).isInstanceOf(DependencyException.class);

        List<Task> acyclic = List.of(task("a"), task("b", "a"), task("c", "b"));
        assertThatCode(() -> service.validate(acyclic)).doesNotThrowAnyException();
    }

    @Test
    void sortShouldPlaceDependenciesFirst() {
        List<Task> tasks = List.of(task("d", "b", "c"), task("c", "a"), task("b", "a"), task("a"));

        List<String> order = service.sortTopologically(tasks);

        assertThat(order).containsExactlyInAnyOrder("a", "b", "c", "d");
        for (Task task : tasks) {
            for (String dependency : task.dependencies()) {
                assertThat(order.indexOf(dependency)).isLessThan(order.indexOf(task.id()));
            }
        }
    }

    @Test
    void shouldCollectClosureOfTarget() {
        List<Task> tasks = new ArrayList<>(diamond());
        tasks.add(task("unrelated"));

        List<String> required = service.getRequiredTasks(tasks, "b");

        assertThat(required).containsExactly("a", "b");
    }

    @Test
    void shouldResolveTargetByAlias() {
        List<Task> tasks = List.of(
                task("gen"),
                Task.builder("build").command("make").dependsOn("gen").aliases(List.of("b")).build()
        );

        assertThat(service.resolveTarget(tasks, "b")).isEqualTo("build");
        assertThat(service.getRequiredTasks(tasks, "b")).containsExactly("gen", "build");
    }

    @Test
    void shouldFailForUnknownTarget() {
        assertThatThrownBy(() -> service.getRequiredTasks(diamond(), "nope"))
                .isInstanceOf(TaskNotFoundException.class)
                .hasMessage("Task 'nope' not found");
    }

    @Test
    void shouldAssignDiamondLevels() {
        List<ExecutionLevel> levels = service.calculateDependencyLevels(diamond());

        assertThat(levels).hasSize(3);
        assertThat(levels.get(0).taskIds()).containsExactly("a");
        assertThat(levels.get(1).taskIds()).containsExactly("b", "c");
        assertThat(levels.get(2).taskIds()).containsExactly("d");
    }

    @Test
    void levelShouldFollowDeepestDependency() {
        // e depends on a (level 0) and d (level 2)
        List<Task> tasks = new ArrayList<>(diamond());
        tasks.add(task("e", "a", "d"));

        List<ExecutionLevel> levels = service.calculateDependencyLevels(tasks);

        assertThat(levels.get(3).taskIds()).containsExactly("e");
    }

    @Test
    void shouldComputeLevelsForSubset() {
        List<ExecutionLevel> levels = service.calculateDependencyLevels(diamond(), List.of("a", "c"));

        assertThat(levels).extracting(ExecutionLevel::taskIds)
                .containsExactly(List.of("a"), List.of("c"));
    }

    @Test
    void shouldHandleLongChains() {
        List<Task> chain = new ArrayList<>();
        chain.add(task("t0"));
        for (int i = 1; i < 2000; i++) {
            chain.add(task("t" + i, "t" + (i - 1)));
        }

        service.validate(chain);
        List<ExecutionLevel> levels = service.calculateDependencyLevels(chain);

        assertThat(levels).hasSize(2000);
        assertThat(levels.get(1999).taskIds()).containsExactly("t1999");
    }

    @Test
    void shouldDescribeGraphShape() {
        DagStatistics stats = service.getStatistics(diamond());

        assertThat(stats.tasks()).isEqualTo(4);
        assertThat(stats.dependencies()).isEqualTo(4);
        assertThat(stats.roots()).isEqualTo(1);
        assertThat(stats.leaves()).isEqualTo(1);
        assertThat(stats.levelWidths()).containsExactly(1, 2, 1);
        assertThat(stats.isSequential()).isFalse();
    }

    @Test
    void shouldFindOrderingOnlyDependencies() {
        List<Task> tasks = List.of(
                Task.builder("gen").command("gen").outputs(List.of("gen/out.c")).build(),
                Task.builder("lint").command("lint").build(),
                Task.builder("build").command("make")
                        .dependsOn("gen", "lint")
                        .inputs(List.of("gen/**/*.c"))
                        .build()
        );

        Map<String, List<String>> orderingOnly = service.findOrderingOnlyDependencies(tasks);

        assertThat(orderingOnly).containsOnlyKeys("build");
        assertThat(orderingOnly.get("build")).containsExactly("lint");
    }
}
