package xyz.vvrf.opgraph.impl;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.opgraph.core.EdgeDefinition;
import xyz.vvrf.opgraph.core.GraphNode;
import xyz.vvrf.opgraph.core.NodeDefinition;
import xyz.vvrf.opgraph.core.OpGraph;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * OpGraph 的内存实现：基于邻接表的有向多重图。
 * <p>
 * 拓扑在构造时固定（由 {@link xyz.vvrf.opgraph.builder.OpGraphBuilder} 创建），
 * 节点属性存放在独立的可变 Map 中。
 * </p>
 */
@Slf4j
public class DefaultOpGraph implements OpGraph {

    private final String graphName;
    private final Map<String, NodeDefinition> nodeDefinitions;
    private final List<String> nodeIds;
    // 入边：目标节点 -> [边列表]
    private final Map<String, List<EdgeDefinition>> incomingEdges;
    // 出边：源节点 -> [边列表]
    private final Map<String, List<EdgeDefinition>> outgoingEdges;
    private final Map<String, Map<String, Object>> attributes = new ConcurrentHashMap<>();

    /**
     * 创建图实例。
     *
     * @param graphName       图名称
     * @param nodeDefinitions 节点定义，按插入顺序 (ID -> 定义)
     * @param edgeDefinitions 边定义列表
     * @throws IllegalArgumentException 如果边引用了不存在的节点
     */
    public DefaultOpGraph(String graphName, Map<String, NodeDefinition> nodeDefinitions, List<EdgeDefinition> edgeDefinitions) {
        this.graphName = Objects.requireNonNull(graphName, "图名称不能为空");
        Objects.requireNonNull(nodeDefinitions, "节点定义不能为空");
        Objects.requireNonNull(edgeDefinitions, "边定义不能为空");

        this.nodeDefinitions = Collections.unmodifiableMap(new LinkedHashMap<>(nodeDefinitions));
        this.nodeIds = Collections.unmodifiableList(new ArrayList<>(this.nodeDefinitions.keySet()));

        Map<String, List<EdgeDefinition>> incoming = new HashMap<>();
        Map<String, List<EdgeDefinition>> outgoing = new HashMap<>();
        for (String nodeId : nodeIds) {
            incoming.put(nodeId, new ArrayList<>());
            outgoing.put(nodeId, new ArrayList<>());
            attributes.put(nodeId, new ConcurrentHashMap<>());
        }
        for (EdgeDefinition edge : edgeDefinitions) {
            if (!this.nodeDefinitions.containsKey(edge.getSourceId())) {
                throw new IllegalArgumentException(String.format("Graph '%s': edge references non-existent source node '%s'.", graphName, edge.getSourceId()));
            }
            if (!this.nodeDefinitions.containsKey(edge.getDestinationId())) {
                throw new IllegalArgumentException(String.format("Graph '%s': edge references non-existent destination node '%s'.", graphName, edge.getDestinationId()));
            }
            outgoing.get(edge.getSourceId()).add(edge);
            incoming.get(edge.getDestinationId()).add(edge);
        }
        // 设置为不可修改的视图
        incoming.replaceAll((k, v) -> Collections.unmodifiableList(v));
        outgoing.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.incomingEdges = Collections.unmodifiableMap(incoming);
        this.outgoingEdges = Collections.unmodifiableMap(outgoing);

        log.debug("Graph '{}': created with {} nodes and {} edges.", graphName, nodeIds.size(), edgeDefinitions.size());
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public boolean containsNode(String nodeId) {
        return nodeId != null && nodeDefinitions.containsKey(nodeId);
    }

    @Override
    public Optional<GraphNode> getNode(String nodeId) {
        if (!containsNode(nodeId)) {
            return Optional.empty();
        }
        return Optional.of(new DefaultGraphNode(this, nodeDefinitions.get(nodeId)));
    }

    @Override
    public GraphNode requireNode(String nodeId) {
        return getNode(nodeId).orElseThrow(() -> unknownNode(nodeId));
    }

    /**
     * 获取节点定义。
     */
    public Optional<NodeDefinition> getNodeDefinition(String nodeId) {
        return Optional.ofNullable(nodeId == null ? null : nodeDefinitions.get(nodeId));
    }

    @Override
    public List<String> getNodeIds() {
        return nodeIds;
    }

    @Override
    public List<EdgeDefinition> getIncomingEdges(String nodeId) {
        return edgesOrThrow(incomingEdges, nodeId);
    }

    @Override
    public List<EdgeDefinition> getOutgoingEdges(String nodeId) {
        return edgesOrThrow(outgoingEdges, nodeId);
    }

    @Override
    public List<String> getPredecessorIds(String nodeId) {
        return getIncomingEdges(nodeId).stream()
                .map(EdgeDefinition::getSourceId)
                .collect(Collectors.toList());
    }

    @Override
    public List<String> getSuccessorIds(String nodeId) {
        return getOutgoingEdges(nodeId).stream()
                .map(EdgeDefinition::getDestinationId)
                .collect(Collectors.toList());
    }

    @Override
    public int inDegree(String nodeId) {
        return getIncomingEdges(nodeId).size();
    }

    @Override
    public int outDegree(String nodeId) {
        return getOutgoingEdges(nodeId).size();
    }

    @Override
    public Optional<Object> getNodeAttribute(String nodeId, String key) {
        Objects.requireNonNull(key, "属性键不能为空");
        return Optional.ofNullable(attributesOrThrow(nodeId).get(key));
    }

    @Override
    public void setNodeAttribute(String nodeId, String key, Object value) {
        Objects.requireNonNull(key, "属性键不能为空");
        Map<String, Object> nodeAttributes = attributesOrThrow(nodeId);
        if (value == null) {
            nodeAttributes.remove(key);
        } else {
            nodeAttributes.put(key, value);
        }
    }

    @Override
    public void setNodeAttributeForAll(String key, Object value) {
        Objects.requireNonNull(key, "属性键不能为空");
        for (String nodeId : nodeIds) {
            setNodeAttribute(nodeId, key, value);
        }
        log.debug("Graph '{}': attribute '{}' set on all {} nodes.", graphName, key, nodeIds.size());
    }

    private List<EdgeDefinition> edgesOrThrow(Map<String, List<EdgeDefinition>> edges, String nodeId) {
        List<EdgeDefinition> result = nodeId == null ? null : edges.get(nodeId);
        if (result == null) {
            throw unknownNode(nodeId);
        }
        return result;
    }

    private Map<String, Object> attributesOrThrow(String nodeId) {
        Map<String, Object> result = nodeId == null ? null : attributes.get(nodeId);
        if (result == null) {
            throw unknownNode(nodeId);
        }
        return result;
    }

    private IllegalArgumentException unknownNode(String nodeId) {
        return new IllegalArgumentException(String.format("Graph '%s': node '%s' does not exist.", graphName, nodeId));
    }

    @Override
    public String toString() {
        int edgeCount = outgoingEdges.values().stream().mapToInt(List::size).sum();
        return String.format("OpGraph[name=%s, nodes=%d, edges=%d]", graphName, nodeIds.size(), edgeCount);
    }
}
