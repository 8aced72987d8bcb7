package xyz.vvrf.opgraph.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.opgraph.core.OpGraph;

import java.util.*;

/**
 * 图遍历基础工具：广度优先顺序、深度优先后序和伪拓扑排序。
 * 所有方法以节点 ID 作为输入输出，遇到环时通过 visited 集合保证终止。
 */
@Slf4j
public final class GraphTraversals {

    private GraphTraversals() {}

    /**
     * 广度优先遍历，返回按首次发现顺序排列的节点 ID。
     * 每个可达节点恰好出现一次。
     *
     * @param graph      要遍历的图
     * @param startNodes 起始节点；为空时使用所有入度为 0 的节点
     * @return BFS 顺序的节点 ID 列表
     */
    public static List<String> bfsOrder(OpGraph graph, Collection<String> startNodes) {
        Objects.requireNonNull(graph, "图不能为空");
        Collection<String> starts = (startNodes == null || startNodes.isEmpty())
                ? zeroInDegreeNodes(graph)
                : startNodes;

        List<String> result = new ArrayList<>();
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String start : starts) {
            requireNode(graph, start);
            if (visited.add(start)) {
                queue.add(start);
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            result.add(current);
            for (String successor : graph.getSuccessorIds(current)) {
                if (visited.add(successor)) {
                    queue.add(successor);
                }
            }
        }
        log.debug("Graph '{}': BFS from {} visited {} nodes.", graph.getGraphName(), starts, result.size());
        return result;
    }

    public static List<String> bfsOrder(OpGraph graph) {
        return bfsOrder(graph, Collections.emptyList());
    }

    /**
     * 从指定节点开始的迭代式深度优先遍历，返回后序（完成顺序）。
     * 节点在其所有未访问的后继都被完全探索之后才加入结果。
     * <p>
     * visited 由调用方提供并被原地扩展，便于在多个起点之间重复调用而不重复访问。
     * 如果起点已在 visited 中，返回空列表。
     * </p>
     *
     * @param graph   要遍历的图
     * @param nodeId  起始节点
     * @param visited 已访问节点集合（会被修改）
     * @return 后序排列的节点 ID
     */
    public static List<String> dfsPostorder(OpGraph graph, String nodeId, Set<String> visited) {
        return walkPostorder(graph, nodeId, visited, new WalkState());
    }

    /**
     * 伪拓扑排序：从每个未访问的入度为 0 的节点执行后序 DFS，拼接结果。
     * reverse 为 false 时反转拼接结果，得到从输入到输出的顺序；为 true 时保持后序（从输出到输入）。
     * <p>
     * 不检测也不拒绝环。无环图总是得到真正的拓扑顺序；环内的边可能违反先后关系，
     * 没有入度为 0 的入口的环不会出现在结果中。
     * </p>
     */
    public static List<String> pseudoTopologicalOrder(OpGraph graph, boolean reverse) {
        return pseudoTopologicalSort(graph, reverse).getOrder();
    }

    /**
     * 同 {@link #pseudoTopologicalOrder(OpGraph, boolean)}，额外返回是否遇到回边。
     */
    public static TopologicalOrder pseudoTopologicalSort(OpGraph graph, boolean reverse) {
        Objects.requireNonNull(graph, "图不能为空");
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        WalkState state = new WalkState();

        for (String nodeId : zeroInDegreeNodes(graph)) {
            if (!visited.contains(nodeId)) {
                order.addAll(walkPostorder(graph, nodeId, visited, state));
            }
        }
        if (!reverse) {
            Collections.reverse(order);
        }
        if (state.backEdgeDetected) {
            log.debug("Graph '{}': back edge detected, pseudo-topological order may violate precedence inside cycles.", graph.getGraphName());
        }
        return new TopologicalOrder(order, state.backEdgeDetected);
    }

    /**
     * 所有入度为 0 的节点，按图的节点顺序排列。
     */
    public static List<String> zeroInDegreeNodes(OpGraph graph) {
        List<String> result = new ArrayList<>();
        for (String nodeId : graph.getNodeIds()) {
            if (graph.inDegree(nodeId) == 0) {
                result.add(nodeId);
            }
        }
        return result;
    }

    // 显式栈实现，避免深图上的递归栈溢出
    private static List<String> walkPostorder(OpGraph graph, String startId, Set<String> visited, WalkState state) {
        Objects.requireNonNull(graph, "图不能为空");
        Objects.requireNonNull(visited, "visited 集合不能为空");
        requireNode(graph, startId);

        List<String> order = new ArrayList<>();
        if (!visited.add(startId)) {
            return order;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        stack.push(new Frame(startId, graph.getSuccessorIds(startId).iterator()));
        onStack.add(startId);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            String next = null;
            while (frame.successors.hasNext()) {
                String candidate = frame.successors.next();
                if (!visited.contains(candidate)) {
                    next = candidate;
                    break;
                }
                if (onStack.contains(candidate)) {
                    state.backEdgeDetected = true;
                }
            }
            if (next != null) {
                visited.add(next);
                onStack.add(next);
                stack.push(new Frame(next, graph.getSuccessorIds(next).iterator()));
            } else {
                stack.pop();
                onStack.remove(frame.nodeId);
                order.add(frame.nodeId);
            }
        }
        return order;
    }

    private static void requireNode(OpGraph graph, String nodeId) {
        if (!graph.containsNode(nodeId)) {
            throw new IllegalArgumentException(String.format("Graph '%s': node '%s' does not exist.", graph.getGraphName(), nodeId));
        }
    }

    private static final class Frame {
        private final String nodeId;
        private final Iterator<String> successors;

        private Frame(String nodeId, Iterator<String> successors) {
            this.nodeId = nodeId;
            this.successors = successors;
        }
    }

    private static final class WalkState {
        private boolean backEdgeDetected;
    }
}
