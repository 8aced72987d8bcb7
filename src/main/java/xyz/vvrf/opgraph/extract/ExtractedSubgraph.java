package xyz.vvrf.opgraph.extract;

import java.util.*;

/**
 * 子图提取的结果（不可变）。
 * <p>
 * 包含按发现顺序排列的节点 ID，以及本次调用的发现关系
 * (节点 -> 发现它的节点；起始节点没有条目)。发现关系只用于诊断。
 * </p>
 */
public final class ExtractedSubgraph {

    private final String graphName;
    private final List<String> nodeIds;
    private final Set<String> nodeIdSet;
    private final Map<String, String> discoveredFrom;

    ExtractedSubgraph(String graphName, List<String> nodeIds, Map<String, String> discoveredFrom) {
        this.graphName = graphName;
        this.nodeIds = Collections.unmodifiableList(new ArrayList<>(nodeIds));
        this.nodeIdSet = Collections.unmodifiableSet(new LinkedHashSet<>(nodeIds));
        this.discoveredFrom = Collections.unmodifiableMap(new LinkedHashMap<>(discoveredFrom));
    }

    public String getGraphName() {
        return graphName;
    }

    /**
     * 区域内的节点 ID，按发现顺序排列。
     */
    public List<String> getNodeIds() {
        return nodeIds;
    }

    public Set<String> getNodeIdSet() {
        return nodeIdSet;
    }

    public boolean contains(String nodeId) {
        return nodeIdSet.contains(nodeId);
    }

    public int size() {
        return nodeIds.size();
    }

    public Map<String, String> getDiscoveredFrom() {
        return discoveredFrom;
    }

    /**
     * 从指定节点沿发现关系回溯到起始节点的路径（包含两端）。
     *
     * @throws IllegalArgumentException 如果节点不在区域内
     */
    public List<String> discoveryPath(String nodeId) {
        if (!contains(nodeId)) {
            throw new IllegalArgumentException(String.format("Node '%s' is not part of the extracted sub-graph of '%s'.", nodeId, graphName));
        }
        return SubgraphExtractor.tracePath(nodeId, discoveredFrom);
    }

    @Override
    public String toString() {
        return "ExtractedSubgraph{graph=" + graphName + ", nodes=" + nodeIds + '}';
    }
}
