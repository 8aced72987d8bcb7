package xyz.vvrf.opgraph.core;

import java.util.List;
import java.util.Optional;

/**
 * 计算图（有向多重图）的访问契约。
 * <p>
 * 图的拓扑在构建后不可变；只有节点属性可以修改。
 * 遍历期间调用方不得修改图，也不得在同一个图上并发写入节点属性。
 * </p>
 */
public interface OpGraph {

    /**
     * 获取图的名称，用于日志和监控。
     */
    String getGraphName();

    boolean containsNode(String nodeId);

    /**
     * 获取指定 ID 的节点句柄。
     */
    Optional<GraphNode> getNode(String nodeId);

    /**
     * 获取指定 ID 的节点句柄，节点不存在时抛出异常。
     *
     * @throws IllegalArgumentException 如果节点不存在
     */
    GraphNode requireNode(String nodeId);

    /**
     * 获取所有节点 ID，按插入顺序排列。
     * 列表是不可变的。
     */
    List<String> getNodeIds();

    /**
     * 获取指向指定节点的所有入边，按插入顺序排列，平行边各出现一次。
     * 列表是不可变的。
     */
    List<EdgeDefinition> getIncomingEdges(String nodeId);

    /**
     * 获取从指定节点出发的所有出边，按插入顺序排列，平行边各出现一次。
     * 列表是不可变的。
     */
    List<EdgeDefinition> getOutgoingEdges(String nodeId);

    /**
     * 直接前驱 ID，每条入边一个条目（保留重复）。
     */
    List<String> getPredecessorIds(String nodeId);

    /**
     * 直接后继 ID，每条出边一个条目（保留重复）。
     */
    List<String> getSuccessorIds(String nodeId);

    int inDegree(String nodeId);

    int outDegree(String nodeId);

    /**
     * 获取节点的任意属性。
     */
    Optional<Object> getNodeAttribute(String nodeId, String key);

    /**
     * 设置节点的任意属性。value 为 null 时移除该属性。
     */
    void setNodeAttribute(String nodeId, String key, Object value);

    /**
     * 为所有节点设置同一属性。value 为 null 时从所有节点移除该属性。
     */
    void setNodeAttributeForAll(String key, Object value);
}
