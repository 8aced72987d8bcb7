package xyz.vvrf.opgraph.search;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.opgraph.core.GraphNode;

import java.util.*;

/**
 * 沿入边方向查找最近的指定类型算子。
 */
@Slf4j
public final class BackwardOperatorSearch {

    private BackwardOperatorSearch() {}

    /**
     * 从起始节点沿前驱做广度优先搜索，查找 op 标签属于 opNames 的算子节点。
     * <ul>
     *   <li>op 匹配的算子节点：加入结果（去重，按首次发现顺序），不再越过它继续搜索。</li>
     *   <li>op 不匹配的算子节点：继续搜索其前驱。</li>
     *   <li>不带常量值的数据节点：透明穿过，继续搜索其前驱。</li>
     *   <li>携带常量值的数据节点：死路，不再展开。</li>
     * </ul>
     * 起始节点本身不参与匹配。每个节点最多展开一次，环上也能终止。
     *
     * @param startNode 起始节点
     * @param opNames   要查找的 op 标签
     * @return 匹配的节点句柄
     */
    public static List<GraphNode> backwardSearchForOperation(GraphNode startNode, Collection<String> opNames) {
        Objects.requireNonNull(startNode, "起始节点不能为空");
        Objects.requireNonNull(opNames, "op 名称列表不能为空");
        Set<String> targetOps = new HashSet<>(opNames);

        Map<String, GraphNode> matched = new LinkedHashMap<>();
        Set<String> expanded = new HashSet<>();
        Deque<GraphNode> queue = new ArrayDeque<>();
        queue.add(startNode);
        expanded.add(startNode.getId());

        while (!queue.isEmpty()) {
            GraphNode node = queue.poll();
            List<GraphNode> inNodes = node.getInNodes();
            for (int i = 0; i < inNodes.size(); i++) {
                GraphNode predecessor = inNodes.get(i);
                if (predecessor.isOperator()) {
                    String op = predecessor.getOp().orElse(null);
                    if (op != null && targetOps.contains(op)) {
                        matched.putIfAbsent(predecessor.getId(), predecessor);
                    } else if (expanded.add(predecessor.getId())) {
                        queue.add(predecessor);
                    }
                } else if (!predecessor.hasConstantValue() && expanded.add(predecessor.getId())) {
                    queue.add(predecessor);
                }
            }
        }
        log.debug("Backward search from '{}' for {} found {}.", startNode.getId(), targetOps, matched.keySet());
        return new ArrayList<>(matched.values());
    }

    public static List<GraphNode> backwardSearchForOperation(GraphNode startNode, String... opNames) {
        return backwardSearchForOperation(startNode, Arrays.asList(opNames));
    }
}
