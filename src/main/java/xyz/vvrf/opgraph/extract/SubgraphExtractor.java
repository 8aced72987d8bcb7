package xyz.vvrf.opgraph.extract;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.opgraph.core.GraphNode;
import xyz.vvrf.opgraph.core.OpGraph;
import xyz.vvrf.opgraph.monitor.ExtractionListener;
import xyz.vvrf.opgraph.util.GraphTraversals;

import java.time.Duration;
import java.util.*;

/**
 * 提取起始节点与终止节点之间的子图（区域），并对结果进行校验。
 * <p>
 * 区域增长规则：
 * <ol>
 *   <li>非终止节点的后继被拉入区域（增长在终止节点处停止）。</li>
 *   <li>非起始节点的前驱被拉入区域，因此区域内节点的所有上游输入（例如常量、旁路输入的生产者）
 *       都会被自动包含，即使它们无法从起始节点正向到达。</li>
 * </ol>
 * 校验（均为致命错误）：
 * <ol>
 *   <li>每个终止节点必须能从至少一个起始节点正向到达。</li>
 *   <li>区域内不能包含图输入节点（op 为 graphInputOp 的算子）。</li>
 * </ol>
 * 发现关系保存在调用内部的 Map 中，不写入图的属性，因此提取器对同一个图的并发只读调用是安全的。
 * </p>
 */
@Slf4j
public class SubgraphExtractor {

    /**
     * 默认的图输入节点 op 标签。
     */
    public static final String DEFAULT_GRAPH_INPUT_OP = "Placeholder";

    private final String graphInputOp;
    private final List<ExtractionListener> listeners;

    public SubgraphExtractor() {
        this(DEFAULT_GRAPH_INPUT_OP, Collections.emptyList());
    }

    /**
     * @param graphInputOp 图输入节点的 op 标签
     * @param listeners    提取监听器 (可为空列表)
     */
    public SubgraphExtractor(String graphInputOp, List<ExtractionListener> listeners) {
        Objects.requireNonNull(graphInputOp, "图输入 op 标签不能为空");
        if (graphInputOp.trim().isEmpty()) {
            throw new IllegalArgumentException("Graph input op tag cannot be blank.");
        }
        this.graphInputOp = graphInputOp;
        this.listeners = listeners == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(listeners));
    }

    public String getGraphInputOp() {
        return graphInputOp;
    }

    /**
     * 提取起始节点与终止节点之间的子图。
     *
     * @param graph      要操作的图
     * @param startNodes 起始节点 ID
     * @param endNodes   终止节点 ID
     * @return 区域节点（按发现顺序）及发现关系
     * @throws SubgraphExtractionException 如果终止节点不可达，或区域包含图输入节点
     * @throws IllegalArgumentException    如果某个节点 ID 不存在
     */
    public ExtractedSubgraph extractSubgraph(OpGraph graph, Collection<String> startNodes, Collection<String> endNodes) {
        Objects.requireNonNull(graph, "图不能为空");
        Objects.requireNonNull(startNodes, "起始节点不能为空");
        Objects.requireNonNull(endNodes, "终止节点不能为空");
        List<String> starts = new ArrayList<>(new LinkedHashSet<>(startNodes));
        List<String> ends = new ArrayList<>(new LinkedHashSet<>(endNodes));
        requireNodes(graph, starts);
        requireNodes(graph, ends);

        String graphName = graph.getGraphName();
        log.debug("Graph '{}': extracting sub-graph between {} and {}...", graphName, starts, ends);
        long startTime = System.nanoTime();
        try {
            ExtractedSubgraph result = extractInternal(graph, starts, ends);
            Duration duration = Duration.ofNanos(System.nanoTime() - startTime);
            log.debug("Graph '{}': extracted sub-graph of {} nodes in {}ms.", graphName, result.size(), duration.toMillis());
            notifySuccess(graphName, starts, ends, duration, result);
            return result;
        } catch (SubgraphExtractionException e) {
            Duration duration = Duration.ofNanos(System.nanoTime() - startTime);
            log.warn("Graph '{}': sub-graph extraction failed ({}): {}", graphName, e.getReason(), e.getMessage());
            notifyFailure(graphName, starts, ends, duration, e);
            throw e;
        }
    }

    private ExtractedSubgraph extractInternal(OpGraph graph, List<String> starts, List<String> ends) {
        Set<String> startSet = new HashSet<>(starts);
        Set<String> endSet = new HashSet<>(ends);

        List<String> subgraphNodes = new ArrayList<>();
        Map<String, String> discoveredFrom = new HashMap<>();
        Set<String> visited = new HashSet<>(starts);
        Deque<String> queue = new ArrayDeque<>(starts);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            subgraphNodes.add(current);
            // 不把终止节点的后继加入区域
            if (!endSet.contains(current)) {
                for (String successor : graph.getSuccessorIds(current)) {
                    if (visited.add(successor)) {
                        queue.add(successor);
                        discoveredFrom.put(successor, current);
                    }
                }
            }
            // 非起始节点的输入都属于区域
            if (!startSet.contains(current)) {
                for (String predecessor : graph.getPredecessorIds(current)) {
                    if (visited.add(predecessor)) {
                        queue.add(predecessor);
                        discoveredFrom.put(predecessor, current);
                    }
                }
            }
        }

        Set<String> forwardVisited = new HashSet<>();
        for (String start : starts) {
            GraphTraversals.dfsPostorder(graph, start, forwardVisited);
        }
        for (String end : ends) {
            if (!forwardVisited.contains(end)) {
                throw SubgraphExtractionException.unreachableEndNode(end, starts);
            }
        }

        for (String nodeId : subgraphNodes) {
            if (isGraphInput(graph.requireNode(nodeId))) {
                List<String> path = tracePath(nodeId, discoveredFrom);
                log.debug("The path from input node is the following:\n{}", String.join("\n", path));
                throw SubgraphExtractionException.graphInputInSubgraph(nodeId, starts, path);
            }
        }
        return new ExtractedSubgraph(graph.getGraphName(), subgraphNodes, discoveredFrom);
    }

    private boolean isGraphInput(GraphNode node) {
        return node.isOperator() && graphInputOp.equals(node.getOp().orElse(null));
    }

    static List<String> tracePath(String nodeId, Map<String, String> discoveredFrom) {
        List<String> path = new ArrayList<>();
        String current = nodeId;
        while (current != null) {
            path.add(current);
            current = discoveredFrom.get(current);
        }
        return path;
    }

    private static void requireNodes(OpGraph graph, List<String> nodeIds) {
        for (String nodeId : nodeIds) {
            graph.requireNode(nodeId);
        }
    }

    private void notifySuccess(String graphName, List<String> starts, List<String> ends, Duration duration, ExtractedSubgraph result) {
        for (ExtractionListener listener : listeners) {
            try {
                listener.onExtractionSuccess(graphName, starts, ends, duration, result);
            } catch (Exception e) {
                log.error("ExtractionListener {} failed in onExtractionSuccess for graph '{}'.", listener.getClass().getSimpleName(), graphName, e);
            }
        }
    }

    private void notifyFailure(String graphName, List<String> starts, List<String> ends, Duration duration, SubgraphExtractionException error) {
        for (ExtractionListener listener : listeners) {
            try {
                listener.onExtractionFailure(graphName, starts, ends, duration, error);
            } catch (Exception e) {
                log.error("ExtractionListener {} failed in onExtractionFailure for graph '{}'.", listener.getClass().getSimpleName(), graphName, e);
            }
        }
    }
}
