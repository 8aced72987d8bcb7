package xyz.vvrf.opgraph.util;

import xyz.vvrf.opgraph.core.GraphNode;
import xyz.vvrf.opgraph.core.OpGraph;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 节点句柄与节点 ID 之间的转换。
 */
public final class GraphNodes {

    private GraphNodes() {}

    public static List<String> ids(Collection<? extends GraphNode> nodes) {
        Objects.requireNonNull(nodes, "节点集合不能为空");
        return nodes.stream().map(GraphNode::getId).collect(Collectors.toList());
    }

    /**
     * 将节点 ID 解析为句柄，保持输入顺序。
     *
     * @throws IllegalArgumentException 如果某个 ID 不存在
     */
    public static List<GraphNode> resolve(OpGraph graph, Collection<String> nodeIds) {
        Objects.requireNonNull(graph, "图不能为空");
        Objects.requireNonNull(nodeIds, "节点 ID 集合不能为空");
        return nodeIds.stream().map(graph::requireNode).collect(Collectors.toList());
    }
}
