package xyz.vvrf.opgraph.extract;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 子图提取失败。两种情况都是致命的，本层不会重试：
 * 终止节点不可达，或者区域中包含了图输入节点。
 */
public class SubgraphExtractionException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** 某个终止节点无法从任何起始节点沿正向边到达。 */
        UNREACHABLE_END_NODE,
        /** 提取的区域包含图输入节点。 */
        GRAPH_INPUT_IN_SUBGRAPH
    }

    private final Reason reason;
    private final String nodeId;
    private final List<String> startNodes;
    private final List<String> discoveryPath;

    SubgraphExtractionException(Reason reason, String nodeId, List<String> startNodes, List<String> discoveryPath, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.nodeId = nodeId;
        this.startNodes = Collections.unmodifiableList(startNodes);
        this.discoveryPath = Collections.unmodifiableList(discoveryPath);
    }

    static SubgraphExtractionException unreachableEndNode(String endNode, List<String> startNodes) {
        String message = String.format("End node '%s' is not reachable from start nodes: %s.", endNode, startNodes);
        return new SubgraphExtractionException(Reason.UNREACHABLE_END_NODE, endNode, startNodes, Collections.emptyList(), message);
    }

    static SubgraphExtractionException graphInputInSubgraph(String inputNode, List<String> startNodes, List<String> path) {
        String message = String.format("Sub-graph contains network input node '%s'. Discovery path from the input node: %s.",
                inputNode, String.join(" <- ", path));
        return new SubgraphExtractionException(Reason.GRAPH_INPUT_IN_SUBGRAPH, inputNode, startNodes, path, message);
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * 引发失败的节点：不可达的终止节点，或区域内的图输入节点。
     */
    public String getNodeId() {
        return nodeId;
    }

    public List<String> getStartNodes() {
        return startNodes;
    }

    /**
     * 图输入节点的发现路径：从该节点开始，沿发现关系回溯到某个起始节点。
     * 终止节点不可达时为空。
     */
    public List<String> getDiscoveryPath() {
        return discoveryPath;
    }
}
