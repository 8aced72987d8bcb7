package xyz.vvrf.opgraph.util;

import org.junit.jupiter.api.Test;
import xyz.vvrf.opgraph.core.GraphNode;
import xyz.vvrf.opgraph.core.OpGraph;
import xyz.vvrf.opgraph.test.util.TestGraphs;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphNodesTest {

    @Test
    void resolveAndIdsAreInverse() {
        OpGraph graph = TestGraphs.chain("a", "b", "c");

        List<GraphNode> nodes = GraphNodes.resolve(graph, Arrays.asList("c", "a"));

        assertThat(nodes).extracting(GraphNode::getId).containsExactly("c", "a");
        assertThat(GraphNodes.ids(nodes)).containsExactly("c", "a");
        assertThat(nodes.get(0)).isEqualTo(graph.requireNode("c"));
    }

    @Test
    void resolveRejectsUnknownIds() {
        OpGraph graph = TestGraphs.chain("a");

        assertThatThrownBy(() -> GraphNodes.resolve(graph, Arrays.asList("a", "b")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'b'");
    }
}
