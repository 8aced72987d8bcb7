package xyz.vvrf.opgraph.util;

import org.junit.jupiter.api.Test;
import xyz.vvrf.opgraph.core.OpGraph;
import xyz.vvrf.opgraph.test.util.TestGraphs;

import java.util.*;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NeighborhoodSearchTest {

    @Test
    void depthZeroYieldsOnlyStartNode() {
        OpGraph graph = TestGraphs.chain("a", "b", "c");

        assertThat(NeighborhoodSearch.outgoingNeighborhood(graph, "a", 0)).containsExactly("a");
        assertThat(NeighborhoodSearch.incomingNeighborhood(graph, "c", 0)).containsExactly("c");
    }

    @Test
    void outgoingNeighborhoodIsBoundedByDepth() {
        OpGraph graph = TestGraphs.chain("a", "b", "c", "d");

        assertThat(NeighborhoodSearch.outgoingNeighborhood(graph, "a", 2)).containsExactly("a", "b", "c");
        assertThat(NeighborhoodSearch.outgoingNeighborhood(graph, "c", 5)).containsExactly("c", "d");
    }

    @Test
    void incomingNeighborhoodFollowsPredecessors() {
        OpGraph graph = TestGraphs.diamond();

        assertThat(NeighborhoodSearch.incomingNeighborhood(graph, "d", 1)).containsExactlyInAnyOrder("d", "b", "c");
        assertThat(NeighborhoodSearch.incomingNeighborhood(graph, "d", 2)).containsExactlyInAnyOrder("d", "b", "c", "a");
    }

    @Test
    void resultSizeGrowsMonotonicallyWithDepth() {
        OpGraph graph = TestGraphs.operators("tree", "r", "a", "b", "c", "d", "e")
                .addEdge("r", "a")
                .addEdge("r", "b")
                .addEdge("a", "c")
                .addEdge("c", "d")
                .addEdge("d", "e")
                .addEdge("b", "e")
                .build();

        int previous = 0;
        for (int depth = 0; depth <= 6; depth++) {
            int size = NeighborhoodSearch.outgoingNeighborhood(graph, "r", depth).size();
            assertThat(size).isGreaterThanOrEqualTo(previous);
            previous = size;
        }
        assertThat(previous).isEqualTo(6);
    }

    @Test
    void boundedNeighborhoodTerminatesOnCycles() {
        Map<String, List<String>> adjacency = new HashMap<>();
        adjacency.put("x", Collections.singletonList("y"));
        adjacency.put("y", Collections.singletonList("x"));
        Function<String, List<String>> neighbors = node -> adjacency.getOrDefault(node, Collections.emptyList());

        assertThat(NeighborhoodSearch.boundedNeighborhood("x", 10, neighbors)).containsExactly("x", "y");
    }

    @Test
    void boundedNeighborhoodWorksOnArbitraryNodeTypes() {
        Function<Integer, List<Integer>> next = n -> Arrays.asList(n + 1, n * 2);

        Set<Integer> result = NeighborhoodSearch.boundedNeighborhood(1, 2, next);

        assertThat(result).containsExactlyInAnyOrder(1, 2, 3, 4);
    }

    @Test
    void negativeDepthIsRejected() {
        assertThatThrownBy(() -> NeighborhoodSearch.boundedNeighborhood("a", -1, n -> Collections.<String>emptyList()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void unknownNodeIsRejected() {
        OpGraph graph = TestGraphs.chain("a", "b");

        assertThatThrownBy(() -> NeighborhoodSearch.outgoingNeighborhood(graph, "zzz", 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("zzz");
    }
}
