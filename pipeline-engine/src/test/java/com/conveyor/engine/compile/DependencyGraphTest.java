package com.conveyor.engine.compile;

import com.conveyor.engine.model.Pipeline;
import com.conveyor.engine.model.Step;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for DependencyGraph: resolution, layering and cycle reporting.
 */
class DependencyGraphTest {

    private static Pipeline pipeline(String name, String... dependsOn) {
        return instance(name, name, dependsOn);
    }

    private static Pipeline instance(String name, String template, String... dependsOn) {
        return new Pipeline(name, template, null, List.of(Step.of("run", "alpine")),
                List.of(dependsOn), null, null, Map.of());
    }

    private static List<String> names(List<Pipeline> layer) {
        return layer.stream().map(Pipeline::name).toList();
    }

    private static PipelineConfigException.Kind kindOf(Throwable e) {
        return ((PipelineConfigException) e).getKind();
    }

    // ------------------------------------------------------------------
    // Layers
    // ------------------------------------------------------------------

    @Test
    void build_chainAndFanOut_layersByDeepestDependency() {
        DependencyGraph graph = DependencyGraph.build(List.of(
                pipeline("docs", "build"),
                pipeline("lint"),
                pipeline("test", "lint"),
                pipeline("build", "test"),
                pipeline("security", "test")));

        List<List<Pipeline>> layers = graph.layers();
        assertThat(layers).hasSize(4);
        assertThat(names(layers.get(0))).containsExactly("lint");
        assertThat(names(layers.get(1))).containsExactly("test");
        assertThat(names(layers.get(2))).containsExactly("build", "security");
        assertThat(names(layers.get(3))).containsExactly("docs");
        assertThat(graph.toString()).isEqualTo("[lint] -> [test] -> [build, security] -> [docs]");
    }

    @Test
    void build_everyDependencyInEarlierLayer() {
        DependencyGraph graph = DependencyGraph.build(List.of(
                pipeline("a"), pipeline("b", "a"), pipeline("c", "a", "b"), pipeline("d", "c"), pipeline("e")));

        for (int node = 0; node < graph.size(); node++) {
            for (int dependency : graph.dependenciesOf(node)) {
                assertThat(graph.layerOf(dependency)).isLessThan(graph.layerOf(node));
            }
        }
        int[] order = graph.topologicalOrder();
        assertThat(order).hasSize(5);
        assertThat(Arrays.stream(order).mapToObj(i -> graph.pipeline(i).name()))
                .containsExactly("a", "e", "b", "c", "d");
    }

    @Test
    void build_templateNameDependency_dependsOnEveryInstance() {
        DependencyGraph graph = DependencyGraph.build(List.of(
                instance("test[PY=3.11]", "test"),
                instance("test[PY=3.12]", "test"),
                pipeline("build", "test")));

        assertThat(graph.dependencyNames("build")).containsExactly("test[PY=3.11]", "test[PY=3.12]");
        int build = graph.indexOf("build").orElseThrow();
        assertThat(graph.layerOf(build)).isEqualTo(1);
        int first = graph.indexOf("test[PY=3.11]").orElseThrow();
        assertThat(graph.dependentsOf(first)).containsExactly(build);
    }

    @Test
    void build_concreteInstanceDependency_dependsOnThatInstanceOnly() {
        DependencyGraph graph = DependencyGraph.build(List.of(
                instance("test[PY=3.11]", "test"),
                instance("test[PY=3.12]", "test"),
                pipeline("build", "test[PY=3.12]")));

        assertThat(graph.dependencyNames("build")).containsExactly("test[PY=3.12]");
    }

    @Test
    void indexOf_unknownName_isEmpty() {
        DependencyGraph graph = DependencyGraph.build(List.of(pipeline("a")));

        assertThat(graph.indexOf("b")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Errors
    // ------------------------------------------------------------------

    @Test
    void build_missingDependency_isConfigError() {
        assertThatThrownBy(() -> DependencyGraph.build(List.of(pipeline("build", "tests"))))
                .isInstanceOf(PipelineConfigException.class)
                .hasMessageContaining("'tests'")
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(PipelineConfigException.Kind.MISSING_DEPENDENCY));
    }

    @Test
    void build_threeNodeCycle_reportsFullPath() {
        assertThatThrownBy(() -> DependencyGraph.build(List.of(
                pipeline("a", "b"), pipeline("b", "c"), pipeline("c", "a"))))
                .isInstanceOf(PipelineConfigException.class)
                .hasMessageContaining("a -> b -> c -> a")
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(PipelineConfigException.Kind.DEPENDENCY_CYCLE));
    }

    @Test
    void build_selfDependency_isCycle() {
        assertThatThrownBy(() -> DependencyGraph.build(List.of(pipeline("lint"), pipeline("docs", "docs"))))
                .isInstanceOf(PipelineConfigException.class)
                .hasMessageContaining("docs -> docs")
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(PipelineConfigException.Kind.DEPENDENCY_CYCLE));
    }

    @Test
    void build_duplicateName_isConfigError() {
        assertThatThrownBy(() -> DependencyGraph.build(List.of(pipeline("lint"), pipeline("lint"))))
                .isInstanceOf(PipelineConfigException.class)
                .satisfies(e -> assertThat(kindOf(e)).isEqualTo(PipelineConfigException.Kind.DUPLICATE_PIPELINE));
    }
}
