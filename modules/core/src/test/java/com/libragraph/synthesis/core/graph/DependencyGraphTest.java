package com.libragraph.synthesis.core.graph;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.libragraph.synthesis.core.store.TestData.edge;
import static com.libragraph.synthesis.core.store.TestData.id;
import static org.assertj.core.api.Assertions.*;

class DependencyGraphTest {

    @Test
    void nodes_areIndexedInFirstAppearanceOrder() {
        DependencyGraph graph = DependencyGraph.fromEdges(List.of(edge(id(7), id(3), 0.5), edge(id(3), id(9), 0.5)));

        assertThat(graph.nodes()).containsExactly(id(7), id(3), id(9));
        assertThat(graph.edgeCount()).isEqualTo(2);
        assertThat(graph.outDegree(graph.indexOf(id(3)))).isEqualTo(1);
        assertThat(graph.inDegree(graph.indexOf(id(3)))).isEqualTo(1);
    }

    @Test
    void parallelEdges_collapseKeepingHighestWeight() {
        DependencyGraph graph = DependencyGraph.fromEdges(List.of(
                edge(id(1), id(2), 0.4), edge(id(1), id(2), 0.9), edge(id(1), id(2), 0.6)));

        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.successors(0)).containsEntry(1, 0.9);
        assertThat(graph.outWeight(0)).isEqualTo(0.9);
    }

    @Test
    void oppositeEdges_areKeptSeparately() {
        DependencyGraph graph = DependencyGraph.fromEdges(List.of(edge(id(1), id(2), 0.4), edge(id(2), id(1), 0.4)));

        assertThat(graph.edgeCount()).isEqualTo(2);
    }

    @Test
    void selfLoops_areSkipped() {
        DependencyGraph graph = DependencyGraph.fromEdges(List.of(edge(id(1), id(1), 0.4)));

        assertThat(graph.isEmpty()).isTrue();
        assertThat(graph.nodeCount()).isZero();
    }

    @Test
    void indexOf_unknownNodeThrows() {
        DependencyGraph graph = DependencyGraph.fromEdges(List.of(edge(id(1), id(2), 0.4)));

        assertThatThrownBy(() -> graph.indexOf(id(5))).isInstanceOf(IllegalArgumentException.class);
    }
}
