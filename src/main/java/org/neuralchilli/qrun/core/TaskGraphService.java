package org.neuralchilli.qrun.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.graph.EdgeReversedGraph;
import org.jgrapht.traverse.BreadthFirstIterator;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.qrun.domain.DagStatistics;
import org.neuralchilli.qrun.domain.ExecutionLevel;
import org.neuralchilli.qrun.domain.Task;
import org.neuralchilli.qrun.service.GlobPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Validation and ordering of task graphs, backed by JGraphT.
 * <p>
 * Vertices are task ids; an edge runs from a dependency to its dependent.
 * Every ordering this service returns is deterministic: ties are broken by
 * the tasks' declaration order.
 */
@ApplicationScoped
public class TaskGraphService {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphService.class);

    /**
     * Validate a task set.
     *
     * @throws DependencyException on duplicate ids, self or missing dependencies,
     *                             alias collisions, or cycles
     */
    public void validate(List<Task> tasks) {
        Set<String> taskIds = new HashSet<>();
        for (Task task : tasks) {
            if (!taskIds.add(task.id())) {
                throw new DependencyException("Task id '" + task.id() + "' is defined more than once");
            }
        }

        Map<String, String> aliasOwners = new HashMap<>();

        for (Task task : tasks) {
            for (String dependency : task.dependencies()) {
                if (dependency.equals(task.id())) {
                    throw new DependencyException("Task '" + task.id() + "' depends on itself");
                }
                if (!taskIds.contains(dependency)) {
                    throw new DependencyException(
                            "Task '" + task.id() + "' depends on '" + dependency + "' which doesn't exist");
                }
            }

            for (String alias : task.aliases()) {
                if (taskIds.contains(alias)) {
                    throw new DependencyException(
                            "Task '" + task.id() + "' defines alias '" + alias +
                                    "' which conflicts with task ID '" + alias + "'");
                }

                String existing = aliasOwners.putIfAbsent(alias, task.id());
                if (existing != null) {
                    throw new DependencyException(
                            "Task '" + task.id() + "' defines alias '" + alias +
                                    "' which is already used by task '" + existing + "'");
                }
            }
        }

        detectCycles(tasks);
        log.debug("Validated {} tasks", tasks.size());
    }

    /**
     * Depth-first search over dependencies with an explicit stack.
     * A dependency already on the active path closes a cycle, reported as the
     * path followed by the closing task. Tasks fully explored from an earlier
     * root are not walked again.
     */
    private void detectCycles(List<Task> tasks) {
        Map<String, Task> taskMap = indexById(tasks);
        Set<String> visited = new HashSet<>();

        for (Task root : tasks) {
            if (visited.contains(root.id())) {
                continue;
            }

            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            Set<String> onPath = new HashSet<>();

            visited.add(root.id());
            stack.push(new Frame(root));
            path.add(root.id());
            onPath.add(root.id());

            while (!stack.isEmpty()) {
                Frame top = stack.peek();

                if (!top.dependencies.hasNext()) {
                    stack.pop();
                    path.remove(path.size() - 1);
                    onPath.remove(top.taskId);
                    continue;
                }

                String dependency = top.dependencies.next();

                if (onPath.contains(dependency)) {
                    path.add(dependency);
                    throw new DependencyException("Circular dependency: " + String.join(" -> ", path));
                }

                Task next = taskMap.get(dependency);
                if (next == null || !visited.add(dependency)) {
                    continue;
                }

                stack.push(new Frame(next));
                path.add(dependency);
                onPath.add(dependency);
            }
        }
    }

    private static final class Frame {
        private final String taskId;
        private final Iterator<String> dependencies;

        private Frame(Task task) {
            this.taskId = task.id();
            this.dependencies = task.dependencies().iterator();
        }
    }

    /**
     * Build a DAG from a task set whose dependencies all lie within the set.
     *
     * @throws DependencyException if a dependency is outside the set or an edge would close a cycle
     */
    public DirectedAcyclicGraph<String, DefaultEdge> buildDag(List<Task> tasks) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);

        // First pass: vertices
        for (Task task : tasks) {
            dag.addVertex(task.id());
        }

        // Second pass: dependency -> dependent edges
        for (Task task : tasks) {
            for (String dependency : task.dependencies()) {
                if (!dag.containsVertex(dependency)) {
                    throw new DependencyException(
                            "Task '" + task.id() + "' depends on '" + dependency + "' which doesn't exist");
                }

                try {
                    dag.addEdge(dependency, task.id());
                } catch (IllegalArgumentException e) {
                    // JGraphT rejects edges that would close a cycle
                    throw new DependencyException(
                            "Adding dependency '" + dependency + "' -> '" + task.id() +
                                    "' would create a cycle in the graph", e);
                }
            }
        }

        log.trace("DAG built: {} vertices, {} edges", dag.vertexSet().size(), dag.edgeSet().size());
        return dag;
    }

    /**
     * Kahn's algorithm: a task is emitted once every one of its direct
     * dependencies has been emitted. Among ready tasks, the earliest declared goes first.
     */
    public List<String> sortTopologically(List<Task> tasks) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = buildDag(tasks);

        TopologicalOrderIterator<String, DefaultEdge> iterator =
                new TopologicalOrderIterator<>(dag, declarationOrder(tasks));

        List<String> order = new ArrayList<>(tasks.size());
        while (iterator.hasNext()) {
            order.add(iterator.next());
        }
        return order;
    }

    /**
     * Everything needed to run {@code target}, in dependency order.
     *
     * @param target a task id or an alias
     * @throws TaskNotFoundException if the target matches neither
     */
    public List<String> getRequiredTasks(List<Task> tasks, String target) {
        String resolvedId = resolveTarget(tasks, target);
        DirectedAcyclicGraph<String, DefaultEdge> dag = buildDag(tasks);

        // Walk against the edge direction: from the target back to its dependencies
        Set<String> required = new HashSet<>();
        BreadthFirstIterator<String, DefaultEdge> iterator =
                new BreadthFirstIterator<>(new EdgeReversedGraph<>(dag), resolvedId);
        while (iterator.hasNext()) {
            required.add(iterator.next());
        }

        List<Task> subset = tasks.stream()
                .filter(task -> required.contains(task.id()))
                .toList();

        log.debug("Target '{}' requires {} task(s)", target, subset.size());
        return sortTopologically(subset);
    }

    /**
     * Resolve a target to a task id. Ids take precedence; aliases are unique
     * by validation, so at most one task can match.
     */
    public String resolveTarget(List<Task> tasks, String target) {
        for (Task task : tasks) {
            if (task.id().equals(target)) {
                return task.id();
            }
        }
        for (Task task : tasks) {
            if (task.aliases().contains(target)) {
                return task.id();
            }
        }
        throw new TaskNotFoundException(target);
    }

    /**
     * Group tasks by level: 0 without dependencies, otherwise one more than
     * the deepest dependency. Levels are computed along a topological order,
     * so each dependency's level is known before it is needed.
     */
    public List<ExecutionLevel> calculateDependencyLevels(List<Task> tasks) {
        Map<String, Task> taskMap = indexById(tasks);
        Map<String, Integer> levels = new HashMap<>();

        for (String taskId : sortTopologically(tasks)) {
            int level = 0;
            for (String dependency : taskMap.get(taskId).dependencies()) {
                level = Math.max(level, levels.get(dependency) + 1);
            }
            levels.put(taskId, level);
        }

        TreeMap<Integer, List<String>> grouped = new TreeMap<>();
        for (Task task : tasks) {
            grouped.computeIfAbsent(levels.get(task.id()), l -> new ArrayList<>()).add(task.id());
        }

        return grouped.entrySet().stream()
                .map(entry -> new ExecutionLevel(entry.getKey(), entry.getValue()))
                .toList();
    }

    /**
     * Levels for an already ordered subset of task ids, e.g. a target's closure.
     */
    public List<ExecutionLevel> calculateDependencyLevels(List<Task> tasks, List<String> taskIds) {
        Set<String> wanted = new HashSet<>(taskIds);
        return calculateDependencyLevels(tasks.stream()
                .filter(task -> wanted.contains(task.id()))
                .toList());
    }

    public DagStatistics getStatistics(List<Task> tasks) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = buildDag(tasks);
        List<ExecutionLevel> levels = calculateDependencyLevels(tasks);

        int roots = (int) dag.vertexSet().stream().filter(v -> dag.inDegreeOf(v) == 0).count();
        int leaves = (int) dag.vertexSet().stream().filter(v -> dag.outDegreeOf(v) == 0).count();
        List<Integer> widths = levels.stream().map(ExecutionLevel::size).toList();

        return new DagStatistics(tasks.size(), dag.edgeSet().size(), roots, leaves, widths);
    }

    /**
     * Dependencies that only constrain ordering: none of the dependency's
     * declared outputs feeds the dependent's declared inputs.
     *
     * @return dependent id mapped to its ordering-only dependency ids
     */
    public Map<String, List<String>> findOrderingOnlyDependencies(List<Task> tasks) {
        Map<String, Task> taskMap = indexById(tasks);
        Map<String, List<String>> result = new LinkedHashMap<>();

        for (Task task : tasks) {
            List<String> orderingOnly = task.dependencies().stream()
                    .map(taskMap::get)
                    .filter(dependency -> dependency != null && !hasFileRelationship(task, dependency))
                    .map(Task::id)
                    .collect(Collectors.toList());

            if (!orderingOnly.isEmpty()) {
                result.put(task.id(), orderingOnly);
            }
        }
        return result;
    }

    private boolean hasFileRelationship(Task task, Task dependency) {
        if (!dependency.hasOutputs() || !task.isCacheable()) {
            return false;
        }

        for (String output : dependency.outputs()) {
            for (String input : task.inputs()) {
                if (pathsMatch(output, input)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean pathsMatch(String output, String input) {
        if (output.equals(input)) {
            return true;
        }

        if (GlobPattern.isGlob(input)) {
            try {
                if (GlobPattern.compile(input).matches(output)) {
                    return true;
                }
            } catch (RuntimeException e) {
                log.debug("Cannot compare '{}' with '{}': {}", output, input, e.getMessage());
            }
        }

        int doubleStar = input.indexOf("**");
        if (doubleStar > 0) {
            String prefix = input.substring(0, doubleStar);
            return output.startsWith(prefix);
        }

        return false;
    }

    private static Map<String, Task> indexById(List<Task> tasks) {
        Map<String, Task> taskMap = new HashMap<>();
        for (Task task : tasks) {
            taskMap.put(task.id(), task);
        }
        return taskMap;
    }

    private static Comparator<String> declarationOrder(List<Task> tasks) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < tasks.size(); i++) {
            index.put(tasks.get(i).id(), i);
        }
        return Comparator.comparingInt(index::get);
    }
}
