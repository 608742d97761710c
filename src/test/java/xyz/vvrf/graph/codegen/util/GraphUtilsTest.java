package xyz.vvrf.graph.codegen.util;

import org.junit.jupiter.api.Test;
import xyz.vvrf.graph.codegen.core.*;
import xyz.vvrf.graph.codegen.core.exception.CyclicDependencyException;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class GraphUtilsTest {

    private static NodeInstance node(String id, Map<String, PinBinding> bindings) {
        return new NodeInstance(id, "t", bindings);
    }

    private static GraphIR graph(List<NodeInstance> nodes, List<DataEdge> dataEdges, List<SignalBinding> signals) {
        return new GraphIR("g", "测试图", "", nodes, Collections.emptyList(), dataEdges, signals);
    }

    @Test
    void danglingBindingReferenceFailsValidation() {
        Map<String, PinBinding> bindings = Map.of("x", PinBinding.output("ghost", "value"));
        GraphIR graph = graph(List.of(node("a", bindings)), Collections.emptyList(), Collections.emptyList());

        assertThatThrownBy(() -> GraphUtils.validateGraphStructure(graph))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ghost");
    }

    @Test
    void danglingDataEdgeFailsValidation() {
        GraphIR graph = graph(List.of(node("a", Map.of())), List.of(new DataEdge("a", "b")), Collections.emptyList());

        assertThatThrownBy(() -> GraphUtils.validateGraphStructure(graph))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'b'");
    }

    @Test
    void duplicateSignalNameFailsValidation() {
        GraphIR graph = graph(List.of(node("e1", Map.of()), node("e2", Map.of())), Collections.emptyList(),
                List.of(new SignalBinding("on_hit", "e1"), new SignalBinding("on_hit", "e2")));

        assertThatThrownBy(() -> GraphUtils.validateGraphStructure(graph))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("on_hit");
    }

    @Test
    void dataDependenciesMergeEdgesAndBindingsWithoutDuplicates() {
        Map<String, PinBinding> cBindings = new LinkedHashMap<>();
        cBindings.put("x", PinBinding.output("a", "value"));
        cBindings.put("y", PinBinding.template(List.of(
                TemplatePart.text("v="), TemplatePart.reference("b", "value"))));
        GraphIR graph = graph(List.of(node("a", Map.of()), node("b", Map.of()), node("c", cBindings)),
                List.of(new DataEdge("a", "c")), Collections.emptyList());

        Map<String, List<String>> deps = GraphUtils.dataDependencies(graph);

        assertThat(deps).containsExactly(
                entry("a", List.of("c")),
                entry("b", List.of("c")),
                entry("c", List.of()));
        assertThat(GraphUtils.invert(deps)).containsEntry("c", List.of("a", "b"));
    }

    @Test
    void topologicalSortBreaksTiesByDeclarationOrder() {
        Map<String, List<String>> adj = new LinkedHashMap<>();
        adj.put("z", List.of("m"));
        adj.put("a", List.of("m"));
        adj.put("m", List.of());
        adj.put("k", List.of());

        assertThat(GraphUtils.topologicalSort(adj, "g")).containsExactly("z", "a", "k", "m");
    }

    @Test
    void cycleReportsEveryUnsortedNode() {
        Map<String, List<String>> adj = new LinkedHashMap<>();
        adj.put("root", List.of("x"));
        adj.put("x", List.of("y"));
        adj.put("y", List.of("x", "tail"));
        adj.put("tail", List.of());

        assertThatThrownBy(() -> GraphUtils.topologicalSort(adj, "环图"))
                .isInstanceOfSatisfying(CyclicDependencyException.class, e ->
                        assertThat(e.getUnsortedInstanceIds()).containsExactly("tail", "x", "y"));
    }
}
