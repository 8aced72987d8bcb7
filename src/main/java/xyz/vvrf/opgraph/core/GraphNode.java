package xyz.vvrf.opgraph.core;

import java.util.List;
import java.util.Optional;

/**
 * 图中单个节点的句柄。
 * 句柄是轻量视图：同一图中相同 ID 的两个句柄相等。
 */
public interface GraphNode {

    String getId();

    NodeKind getKind();

    /**
     * 算子节点的 op 标签；数据节点为空。
     */
    Optional<String> getOp();

    /**
     * 数据节点的常量值；运行时张量和算子节点为空。
     */
    Optional<Object> getValue();

    boolean isOperator();

    boolean isData();

    /**
     * 是否为携带常量值的数据节点。
     */
    boolean hasConstantValue();

    /**
     * 直接前驱句柄，顺序固定（入边插入顺序），每条入边一个条目。
     * 列表是不可变的，支持按位置访问。
     */
    List<GraphNode> getInNodes();

    /**
     * 按位置获取直接前驱。
     *
     * @throws IndexOutOfBoundsException 如果索引越界
     */
    GraphNode getInNode(int index);

    /**
     * 直接后继句柄，顺序固定（出边插入顺序）。
     */
    List<GraphNode> getOutNodes();

    /**
     * 安全获取特定类型属性值的辅助方法。
     *
     * @return 属性值，键不存在或类型不匹配时为空
     */
    <T> Optional<T> getAttribute(String key, Class<T> expectedType);

    /**
     * 句柄所属的图。
     */
    OpGraph getGraph();
}
