package xyz.vvrf.opgraph.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.opgraph.core.EdgeDefinition;
import xyz.vvrf.opgraph.core.NodeDefinition;
import xyz.vvrf.opgraph.core.OpGraph;
import xyz.vvrf.opgraph.impl.DefaultOpGraph;

import java.util.*;

/**
 * 用于以编程方式构建拓扑不可变的 OpGraph。
 * 节点 ID 在图内必须唯一，边的两端必须引用已添加的节点。
 * 允许重复边（多重图）。
 */
@Slf4j
public class OpGraphBuilder {

    private String graphName;

    private final Map<String, NodeDefinition> nodeDefinitions = new LinkedHashMap<>();
    private final List<EdgeDefinition> edgeDefinitions = new ArrayList<>();
    // 节点ID -> [属性键 -> 值]，构建时写入图
    private final Map<String, Map<String, Object>> initialAttributes = new LinkedHashMap<>();

    public OpGraphBuilder(String graphName) {
        this.graphName = Objects.requireNonNull(graphName, "图名称不能为空");
    }

    public OpGraphBuilder name(String name) {
        this.graphName = Objects.requireNonNull(name, "图名称不能为空");
        return this;
    }

    public OpGraphBuilder addNode(NodeDefinition nodeDefinition) {
        Objects.requireNonNull(nodeDefinition, "节点定义不能为空");
        String nodeId = nodeDefinition.getId();
        if (nodeDefinitions.containsKey(nodeId)) {
            throw new IllegalArgumentException(String.format("Node id '%s' already exists in graph '%s'.", nodeId, graphName));
        }
        nodeDefinitions.put(nodeId, nodeDefinition);
        log.trace("Graph '{}': added node {}", graphName, nodeDefinition);
        return this;
    }

    public OpGraphBuilder addOperator(String nodeId, String op) {
        return addNode(NodeDefinition.operator(nodeId, op));
    }

    /**
     * 添加不带常量值的数据节点。
     */
    public OpGraphBuilder addData(String nodeId) {
        return addNode(NodeDefinition.data(nodeId));
    }

    public OpGraphBuilder addConstant(String nodeId, Object value) {
        return addNode(NodeDefinition.constant(nodeId, value));
    }

    /**
     * 添加一条边。重复调用会添加平行边。
     */
    public OpGraphBuilder addEdge(String sourceId, String destinationId) {
        Objects.requireNonNull(sourceId, "源节点 ID 不能为空");
        Objects.requireNonNull(destinationId, "目标节点 ID 不能为空");
        requireKnownNode(sourceId);
        requireKnownNode(destinationId);
        edgeDefinitions.add(new EdgeDefinition(sourceId, destinationId));
        log.trace("Graph '{}': added edge {} -> {}", graphName, sourceId, destinationId);
        return this;
    }

    /**
     * 按顺序连接节点：a -> b -> c ...
     */
    public OpGraphBuilder addChain(String... nodeIds) {
        for (int i = 1; i < nodeIds.length; i++) {
            addEdge(nodeIds[i - 1], nodeIds[i]);
        }
        return this;
    }

    public OpGraphBuilder withAttribute(String nodeId, String key, Object value) {
        Objects.requireNonNull(key, "节点 " + nodeId + " 的属性键不能为空");
        requireKnownNode(nodeId);
        initialAttributes.computeIfAbsent(nodeId, k -> new LinkedHashMap<>()).put(key, value);
        return this;
    }

    public OpGraph build() {
        log.debug("Building graph '{}'...", graphName);
        DefaultOpGraph graph = new DefaultOpGraph(graphName, nodeDefinitions, edgeDefinitions);
        initialAttributes.forEach((nodeId, attrs) -> attrs.forEach((key, value) -> graph.setNodeAttribute(nodeId, key, value)));
        log.debug("Graph '{}' built: {} nodes, {} edges.", graphName, nodeDefinitions.size(), edgeDefinitions.size());
        return graph;
    }

    private void requireKnownNode(String nodeId) {
        if (!nodeDefinitions.containsKey(nodeId)) {
            throw new IllegalArgumentException(String.format("Node '%s' not found in graph '%s'. Add the node before referencing it.", nodeId, graphName));
        }
    }
}
