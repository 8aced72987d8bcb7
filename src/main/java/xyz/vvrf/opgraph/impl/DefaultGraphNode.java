package xyz.vvrf.opgraph.impl;

import xyz.vvrf.opgraph.core.*;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * DefaultOpGraph 的节点句柄。
 * 只持有图引用和节点定义，邻接信息每次从图中读取。
 */
final class DefaultGraphNode implements GraphNode {

    private final DefaultOpGraph graph;
    private final NodeDefinition definition;

    DefaultGraphNode(DefaultOpGraph graph, NodeDefinition definition) {
        this.graph = Objects.requireNonNull(graph, "图不能为空");
        this.definition = Objects.requireNonNull(definition, "节点定义不能为空");
    }

    @Override
    public String getId() {
        return definition.getId();
    }

    @Override
    public NodeKind getKind() {
        return definition.getKind();
    }

    @Override
    public Optional<String> getOp() {
        return definition.getOp();
    }

    @Override
    public Optional<Object> getValue() {
        return definition.getValue();
    }

    @Override
    public boolean isOperator() {
        return definition.isOperator();
    }

    @Override
    public boolean isData() {
        return definition.isData();
    }

    @Override
    public boolean hasConstantValue() {
        return definition.isData() && definition.getValue().isPresent();
    }

    @Override
    public List<GraphNode> getInNodes() {
        return graph.getPredecessorIds(getId()).stream()
                .map(graph::requireNode)
                .collect(Collectors.collectingAndThen(Collectors.toList(), Collections::unmodifiableList));
    }

    @Override
    public GraphNode getInNode(int index) {
        List<EdgeDefinition> incoming = graph.getIncomingEdges(getId());
        if (index < 0 || index >= incoming.size()) {
            throw new IndexOutOfBoundsException(String.format("Node '%s' has %d input(s), index %d is out of range.", getId(), incoming.size(), index));
        }
        return graph.requireNode(incoming.get(index).getSourceId());
    }

    @Override
    public List<GraphNode> getOutNodes() {
        return graph.getSuccessorIds(getId()).stream()
                .map(graph::requireNode)
                .collect(Collectors.collectingAndThen(Collectors.toList(), Collections::unmodifiableList));
    }

    @Override
    public <T> Optional<T> getAttribute(String key, Class<T> expectedType) {
        Objects.requireNonNull(expectedType, "期望类型不能为空");
        return graph.getNodeAttribute(getId(), key)
                .filter(expectedType::isInstance)
                .map(expectedType::cast);
    }

    @Override
    public OpGraph getGraph() {
        return graph;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DefaultGraphNode that = (DefaultGraphNode) o;
        return graph == that.graph && getId().equals(that.getId());
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(graph), getId());
    }

    @Override
    public String toString() {
        return String.format("GraphNode[%s@%s]", getId(), graph.getGraphName());
    }
}
