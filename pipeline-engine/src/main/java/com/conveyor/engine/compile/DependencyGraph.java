package com.conveyor.engine.compile;

import com.conveyor.engine.model.Pipeline;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.conveyor.engine.compile.PipelineConfigException.Kind.DEPENDENCY_CYCLE;
import static com.conveyor.engine.compile.PipelineConfigException.Kind.DUPLICATE_PIPELINE;
import static com.conveyor.engine.compile.PipelineConfigException.Kind.MISSING_DEPENDENCY;

/**
 * The compiled, acyclic dependency relation between concrete pipelines.
 *
 * {@code depends_on} names are resolved to indices once, when the graph is
 * built; the scheduler only ever walks int arrays. A name may be a concrete
 * pipeline name or a template name, which stands for every matrix instance
 * of that template. An exact pipeline name wins over a template name.
 *
 * Pipelines are grouped into topological layers: a pipeline sits one layer
 * above its deepest dependency, so layer 0 holds the pipelines without
 * dependencies.
 *
 * Immutable once built.
 */
public final class DependencyGraph {

    private final List<Pipeline>       pipelines;
    private final Map<String, Integer> indexByName;
    private final int[][]              dependencies;
    private final int[][]              dependents;
    private final int[]                layerOf;
    private final List<List<Integer>>  layers;
    private final int[]                topologicalOrder;

    private DependencyGraph(List<Pipeline> pipelines, Map<String, Integer> indexByName,
                            int[][] dependencies, int[] postOrder) {
        this.pipelines        = pipelines;
        this.indexByName      = indexByName;
        this.dependencies     = dependencies;
        this.dependents       = invert(dependencies);
        this.layerOf          = new int[pipelines.size()];
        this.layers           = new ArrayList<>();

        // postOrder lists every dependency before its dependents.
        for (int node : postOrder) {
            int layer = 0;
            for (int dependency : dependencies[node]) {
                layer = Math.max(layer, layerOf[dependency] + 1);
            }
            layerOf[node] = layer;
        }
        for (int node = 0; node < pipelines.size(); node++) {
            while (layers.size() <= layerOf[node]) layers.add(new ArrayList<>());
            layers.get(layerOf[node]).add(node);
        }
        this.topologicalOrder = layers.stream().flatMap(List::stream).mapToInt(Integer::intValue).toArray();
    }

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    /**
     * Resolve dependencies and check the graph.
     *
     * @throws PipelineConfigException on a duplicate name, an unknown
     *         dependency, or a cycle (the message carries the full cycle path)
     */
    public static DependencyGraph build(List<Pipeline> pipelines) {
        List<Pipeline> nodes = List.copyOf(pipelines);

        Map<String, Integer> indexByName = new HashMap<>();
        Map<String, List<Integer>> indicesByTemplate = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            Pipeline p = nodes.get(i);
            if (indexByName.putIfAbsent(p.name(), i) != null) {
                throw new PipelineConfigException(DUPLICATE_PIPELINE,
                        "Pipeline name '" + p.name() + "' is defined more than once");
            }
            indicesByTemplate.computeIfAbsent(p.templateName(), t -> new ArrayList<>()).add(i);
        }

        int[][] dependencies = new int[nodes.size()][];
        for (int i = 0; i < nodes.size(); i++) {
            Pipeline p = nodes.get(i);
            Set<Integer> resolved = new LinkedHashSet<>();
            for (String target : p.dependsOn()) {
                Integer exact = indexByName.get(target);
                if (exact != null) {
                    resolved.add(exact);
                } else if (indicesByTemplate.containsKey(target)) {
                    resolved.addAll(indicesByTemplate.get(target));
                } else {
                    throw new PipelineConfigException(MISSING_DEPENDENCY,
                            "Pipeline '" + p.name() + "' depends on unknown pipeline '" + target + "'");
                }
            }
            dependencies[i] = resolved.stream().mapToInt(Integer::intValue).toArray();
        }

        int[] postOrder = new CycleCheck(nodes, dependencies).run();
        return new DependencyGraph(nodes, Map.copyOf(indexByName), dependencies, postOrder);
    }

    /**
     * Depth-first search over "depends on" edges. A back edge to a node
     * still on the stack is a cycle; the stack slice from that node is the
     * cycle path.
     */
    private static final class CycleCheck {
        private static final int UNVISITED = 0, ON_STACK = 1, DONE = 2;

        private final List<Pipeline> nodes;
        private final int[][]        dependencies;
        private final int[]          color;
        private final Deque<Integer> stack = new ArrayDeque<>();
        private final int[]          postOrder;
        private int                  emitted;

        CycleCheck(List<Pipeline> nodes, int[][] dependencies) {
            this.nodes        = nodes;
            this.dependencies = dependencies;
            this.color        = new int[nodes.size()];
            this.postOrder    = new int[nodes.size()];
        }

        int[] run() {
            for (int node = 0; node < nodes.size(); node++) {
                if (color[node] == UNVISITED) visit(node);
            }
            return postOrder;
        }

        private void visit(int node) {
            color[node] = ON_STACK;
            stack.addLast(node);
            for (int dependency : dependencies[node]) {
                if (color[dependency] == ON_STACK) {
                    throw new PipelineConfigException(DEPENDENCY_CYCLE,
                            "Dependency cycle: " + describeCycle(dependency));
                }
                if (color[dependency] == UNVISITED) visit(dependency);
            }
            stack.removeLast();
            color[node] = DONE;
            postOrder[emitted++] = node;
        }

        private String describeCycle(int start) {
            List<String> path = new ArrayList<>();
            boolean inCycle = false;
            for (int node : stack) {
                if (node == start) inCycle = true;
                if (inCycle) path.add(nodes.get(node).name());
            }
            path.add(nodes.get(start).name());
            return String.join(" -> ", path);
        }
    }

    private static int[][] invert(int[][] dependencies) {
        List<List<Integer>> reversed = new ArrayList<>();
        for (int i = 0; i < dependencies.length; i++) reversed.add(new ArrayList<>());
        for (int node = 0; node < dependencies.length; node++) {
            for (int dependency : dependencies[node]) reversed.get(dependency).add(node);
        }
        return reversed.stream()
                .map(list -> list.stream().mapToInt(Integer::intValue).toArray())
                .toArray(int[][]::new);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public int size()                     { return pipelines.size(); }
    public Pipeline pipeline(int index)   { return pipelines.get(index); }
    public List<Pipeline> pipelines()     { return pipelines; }
    public int layerOf(int index)         { return layerOf[index]; }

    public Optional<Integer> indexOf(String name) {
        return Optional.ofNullable(indexByName.get(name));
    }

    public int[] dependenciesOf(int index) {
        return dependencies[index].clone();
    }

    public int[] dependentsOf(int index) {
        return dependents[index].clone();
    }

    /** Node indices, layer by layer; within a layer in declaration order. */
    public int[] topologicalOrder() {
        return topologicalOrder.clone();
    }

    public List<List<Pipeline>> layers() {
        return layers.stream()
                .map(layer -> layer.stream().map(pipelines::get).toList())
                .toList();
    }

    /** Names of the pipelines {@code name} depends on directly, in resolution order. */
    public List<String> dependencyNames(String name) {
        int index = indexOf(name).orElseThrow(() ->
                new IllegalArgumentException("Unknown pipeline: " + name));
        return Arrays.stream(dependencies[index]).mapToObj(i -> pipelines.get(i).name()).toList();
    }

    @Override
    public String toString() {
        return layers().stream()
                .map(layer -> layer.stream().map(Pipeline::name).collect(Collectors.joining(", ", "[", "]")))
                .collect(Collectors.joining(" -> "));
    }
}
