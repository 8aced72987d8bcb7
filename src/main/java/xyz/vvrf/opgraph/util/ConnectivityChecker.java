package xyz.vvrf.opgraph.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.opgraph.core.OpGraph;

import java.util.*;

/**
 * 检查节点集合在导出子图上是否连通。
 */
@Slf4j
public final class ConnectivityChecker {

    private ConnectivityChecker() {}

    /**
     * 检查指定节点是否构成连通的子图（忽略边方向）。
     * <p>
     * 从列表的第一个节点开始做广度优先扩展，只走成员之间的直接边：
     * 不在集合内的节点即使相邻也不会被访问，经由集合外节点的间接路径不算连通。
     * 空集合视为连通。
     * </p>
     *
     * @param graph   要检查的图
     * @param nodeIds 节点 ID 列表
     * @return 所有节点都被访问到时返回 true
     */
    public static boolean isConnectedComponent(OpGraph graph, List<String> nodeIds) {
        Objects.requireNonNull(graph, "图不能为空");
        Objects.requireNonNull(nodeIds, "节点列表不能为空");
        if (nodeIds.isEmpty()) {
            return true;
        }
        Set<String> members = new HashSet<>(nodeIds);
        for (String nodeId : members) {
            graph.requireNode(nodeId);
        }

        String first = nodeIds.get(0);
        Set<String> visited = new HashSet<>();
        visited.add(first);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(first);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            List<String> adjacent = new ArrayList<>(graph.getPredecessorIds(current));
            adjacent.addAll(graph.getSuccessorIds(current));
            for (String neighbor : adjacent) {
                if (members.contains(neighbor) && visited.add(neighbor)) {
                    queue.add(neighbor);
                }
            }
        }
        boolean connected = visited.containsAll(members);
        if (!connected && log.isDebugEnabled()) {
            Set<String> unreached = new LinkedHashSet<>(nodeIds);
            unreached.removeAll(visited);
            log.debug("Graph '{}': nodes {} are not connected to '{}' inside the given set.", graph.getGraphName(), unreached, first);
        }
        return connected;
    }
}
