package xyz.vvrf.opgraph.util;

import xyz.vvrf.opgraph.core.OpGraph;

import java.util.*;
import java.util.function.Function;

/**
 * 有界深度的邻域搜索（单源最短跳数）。
 */
public final class NeighborhoodSearch {

    private NeighborhoodSearch() {}

    /**
     * 查找起始节点在给定深度内的邻域。
     * <p>
     * 起始节点距离为 0。只展开当前已知距离小于 depth 的节点；
     * 发现更短路径时更新距离并重新入队。depth 为 0 时结果恰好是 {startNode}。
     * </p>
     *
     * @param startNode  起始节点
     * @param depth      最大跳数 (>= 0)
     * @param neighborFn 返回相邻节点的函数
     * @return 发现的所有节点（包括起始节点），按发现顺序排列
     * @throws IllegalArgumentException 如果 depth 为负数
     */
    public static <T> Set<T> boundedNeighborhood(T startNode, int depth, Function<? super T, ? extends Iterable<? extends T>> neighborFn) {
        Objects.requireNonNull(startNode, "起始节点不能为空");
        Objects.requireNonNull(neighborFn, "邻居函数不能为空");
        if (depth < 0) {
            throw new IllegalArgumentException("Neighborhood depth cannot be negative: " + depth);
        }

        Map<T, Integer> distances = new LinkedHashMap<>();
        distances.put(startNode, 0);
        Deque<T> queue = new ArrayDeque<>();
        queue.add(startNode);

        while (!queue.isEmpty()) {
            T current = queue.poll();
            int currentDistance = distances.get(current);
            if (currentDistance >= depth) {
                continue;
            }
            for (T next : neighborFn.apply(current)) {
                Integer known = distances.get(next);
                if (known == null || known > currentDistance + 1) {
                    distances.put(next, currentDistance + 1);
                    queue.add(next);
                }
            }
        }
        return Collections.unmodifiableSet(distances.keySet());
    }

    /**
     * 沿入边方向（前驱）的邻域。
     */
    public static Set<String> incomingNeighborhood(OpGraph graph, String nodeId, int depth) {
        Objects.requireNonNull(graph, "图不能为空");
        graph.requireNode(nodeId);
        return boundedNeighborhood(nodeId, depth, graph::getPredecessorIds);
    }

    /**
     * 沿出边方向（后继）的邻域。
     */
    public static Set<String> outgoingNeighborhood(OpGraph graph, String nodeId, int depth) {
        Objects.requireNonNull(graph, "图不能为空");
        graph.requireNode(nodeId);
        return boundedNeighborhood(nodeId, depth, graph::getSuccessorIds);
    }
}
