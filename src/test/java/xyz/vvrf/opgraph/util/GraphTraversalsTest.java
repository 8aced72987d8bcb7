package xyz.vvrf.opgraph.util;

import org.junit.jupiter.api.Test;
import xyz.vvrf.opgraph.builder.OpGraphBuilder;
import xyz.vvrf.opgraph.core.EdgeDefinition;
import xyz.vvrf.opgraph.core.OpGraph;
import xyz.vvrf.opgraph.test.util.TestGraphs;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphTraversalsTest {

    @Test
    void bfsOrderVisitsInFirstDiscoveryOrder() {
        OpGraph graph = TestGraphs.diamond();

        assertThat(GraphTraversals.bfsOrder(graph, Collections.singletonList("a")))
                .containsExactly("a", "b", "c", "d");
    }

    @Test
    void bfsOrderStartsFromZeroInDegreeNodesWhenNoStartGiven() {
        OpGraph graph = TestGraphs.operators("roots", "r1", "r2", "x", "y")
                .addEdge("r1", "x")
                .addEdge("r2", "x")
                .addEdge("x", "y")
                .build();

        assertThat(GraphTraversals.bfsOrder(graph)).containsExactly("r1", "r2", "x", "y");
        assertThat(GraphTraversals.bfsOrder(graph, Collections.emptyList())).containsExactly("r1", "r2", "x", "y");
    }

    @Test
    void bfsOrderVisitsEachNodeOnceWithParallelEdgesAndCycles() {
        OpGraph graph = TestGraphs.operators("cyclic", "a", "b", "c")
                .addEdge("a", "b")
                .addEdge("a", "b")
                .addEdge("b", "a")
                .addEdge("b", "c")
                .build();

        List<String> order = GraphTraversals.bfsOrder(graph, Arrays.asList("a", "a"));

        assertThat(order).containsExactly("a", "b", "c");
    }

    @Test
    void bfsOrderPlacesEveryNodeAfterOneOfItsPredecessors() {
        OpGraph graph = TestGraphs.operators("wide", "s", "a", "b", "c", "d", "e")
                .addEdge("s", "a")
                .addEdge("s", "b")
                .addEdge("a", "c")
                .addEdge("b", "c")
                .addEdge("c", "d")
                .addEdge("b", "e")
                .addEdge("e", "d")
                .build();

        List<String> order = GraphTraversals.bfsOrder(graph, Collections.singletonList("s"));

        assertThat(order).hasSize(6).doesNotHaveDuplicates();
        for (int i = 1; i < order.size(); i++) {
            List<String> earlier = order.subList(0, i);
            assertThat(graph.getPredecessorIds(order.get(i))).anyMatch(earlier::contains);
        }
    }

    @Test
    void dfsPostorderEmitsNodeAfterItsSuccessors() {
        OpGraph graph = TestGraphs.chain("a", "b", "c");
        Set<String> visited = new HashSet<>();

        List<String> order = GraphTraversals.dfsPostorder(graph, "a", visited);

        assertThat(order).containsExactly("c", "b", "a");
        assertThat(visited).containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    void dfsPostorderSharesVisitedSetAcrossCalls() {
        OpGraph graph = TestGraphs.operators("shared", "a", "b", "c")
                .addEdge("a", "c")
                .addEdge("b", "c")
                .build();
        Set<String> visited = new HashSet<>();

        assertThat(GraphTraversals.dfsPostorder(graph, "a", visited)).containsExactly("c", "a");
        assertThat(GraphTraversals.dfsPostorder(graph, "b", visited)).containsExactly("b");
        assertThat(GraphTraversals.dfsPostorder(graph, "a", visited)).isEmpty();
    }

    @Test
    void dfsPostorderHandlesLongChainsWithoutRecursion() {
        int length = 20_000;
        String[] ids = new String[length];
        for (int i = 0; i < length; i++) {
            ids[i] = "n" + i;
        }
        OpGraph graph = TestGraphs.chain(ids);

        List<String> order = GraphTraversals.dfsPostorder(graph, "n0", new HashSet<>());

        assertThat(order).hasSize(length);
        assertThat(order.get(0)).isEqualTo("n" + (length - 1));
        assertThat(order.get(length - 1)).isEqualTo("n0");
    }

    @Test
    void dfsPostorderRejectsUnknownStart() {
        OpGraph graph = TestGraphs.chain("a", "b");

        assertThatThrownBy(() -> GraphTraversals.dfsPostorder(graph, "missing", new HashSet<>()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void pseudoTopologicalOrderRespectsEveryEdgeOnAcyclicGraph() {
        OpGraph graph = new OpGraphBuilder("dag")
                .addOperator("in1", "Placeholder")
                .addOperator("in2", "Placeholder")
                .addData("t1")
                .addConstant("w", 1.0)
                .addOperator("mul", "Mul")
                .addData("t2")
                .addOperator("add", "Add")
                .addOperator("out", "Result")
                .addEdge("in1", "t1")
                .addEdge("t1", "mul")
                .addEdge("w", "mul")
                .addEdge("mul", "t2")
                .addEdge("t2", "add")
                .addEdge("in2", "add")
                .addEdge("t1", "add")
                .addEdge("add", "out")
                .build();

        List<String> order = GraphTraversals.pseudoTopologicalOrder(graph, false);

        assertThat(order).containsExactlyInAnyOrderElementsOf(graph.getNodeIds());
        for (String nodeId : graph.getNodeIds()) {
            for (EdgeDefinition edge : graph.getOutgoingEdges(nodeId)) {
                assertThat(order.indexOf(edge.getSourceId()))
                        .as("edge %s", edge)
                        .isLessThan(order.indexOf(edge.getDestinationId()));
            }
        }

        List<String> reversed = new ArrayList<>(GraphTraversals.pseudoTopologicalOrder(graph, true));
        Collections.reverse(reversed);
        assertThat(reversed).isEqualTo(order);
    }

    @Test
    void pseudoTopologicalSortReportsNoBackEdgeForAcyclicGraphWithParallelEdges() {
        OpGraph graph = TestGraphs.operators("parallel", "a", "b", "c")
                .addEdge("a", "b")
                .addEdge("a", "b")
                .addEdge("b", "c")
                .addEdge("a", "c")
                .build();

        TopologicalOrder result = GraphTraversals.pseudoTopologicalSort(graph, false);

        assertThat(result.getOrder()).containsExactly("a", "b", "c");
        assertThat(result.isBackEdgeDetected()).isFalse();
        assertThat(result.isStrict()).isTrue();
    }

    @Test
    void pseudoTopologicalSortToleratesCycles() {
        OpGraph graph = TestGraphs.operators("loop", "a", "b", "c")
                .addEdge("a", "b")
                .addEdge("b", "c")
                .addEdge("c", "b")
                .build();

        TopologicalOrder result = GraphTraversals.pseudoTopologicalSort(graph, false);

        assertThat(result.getOrder()).containsExactly("a", "b", "c");
        assertThat(result.isBackEdgeDetected()).isTrue();
        assertThat(result.isStrict()).isFalse();
    }

    @Test
    void pseudoTopologicalOrderSkipsCyclesWithoutEntryNode() {
        OpGraph graph = TestGraphs.operators("island", "a", "x", "y")
                .addEdge("x", "y")
                .addEdge("y", "x")
                .build();

        assertThat(GraphTraversals.pseudoTopologicalOrder(graph, false)).containsExactly("a");
    }

    @Test
    void zeroInDegreeNodesFollowGraphOrder() {
        OpGraph graph = TestGraphs.operators("roots", "x", "r2", "r1")
                .addEdge("r1", "x")
                .build();

        assertThat(GraphTraversals.zeroInDegreeNodes(graph)).containsExactly("r2", "r1");
    }
}
