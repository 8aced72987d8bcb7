package xyz.vvrf.opgraph.util;

import xyz.vvrf.opgraph.core.GraphNode;
import xyz.vvrf.opgraph.core.OpGraph;

import java.util.*;
import java.util.regex.Pattern;

/**
 * 基于节点名称约定的工具：作用域（名称前缀）边界检测和名称模式匹配。
 */
public final class ScopeUtils {

    public static final String DEFAULT_SCOPE_DELIMITER = "/";

    private ScopeUtils() {}

    /**
     * 返回产生作用域输出的节点：节点在作用域内，且至少有一条出边指向作用域外的节点。
     * 作用域不以分隔符结尾时自动追加分隔符。
     *
     * @param graph     要检查的图
     * @param scope     作用域（节点名前缀）
     * @param delimiter 作用域分隔符
     * @return 去重后的输出节点句柄，按图的节点顺序排列
     */
    public static List<GraphNode> scopeOutputNodes(OpGraph graph, String scope, String delimiter) {
        Objects.requireNonNull(graph, "图不能为空");
        Objects.requireNonNull(scope, "作用域不能为空");
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("Scope delimiter cannot be empty.");
        }
        if (scope.isEmpty()) {
            throw new IllegalArgumentException("Scope cannot be empty.");
        }
        String prefix = scope.endsWith(delimiter) ? scope : scope + delimiter;

        List<GraphNode> result = new ArrayList<>();
        for (String nodeId : graph.getNodeIds()) {
            if (!nodeId.startsWith(prefix)) {
                continue;
            }
            for (String successor : graph.getSuccessorIds(nodeId)) {
                if (!successor.startsWith(prefix)) {
                    result.add(graph.requireNode(nodeId));
                    break;
                }
            }
        }
        return result;
    }

    public static List<GraphNode> scopeOutputNodes(OpGraph graph, String scope) {
        return scopeOutputNodes(graph, scope, DEFAULT_SCOPE_DELIMITER);
    }

    /**
     * 返回名称匹配正则表达式的节点 ID。匹配锚定在名称开头（前缀匹配，而非完全匹配）。
     *
     * @param graph   要检查的图
     * @param pattern 正则表达式
     * @return 匹配的节点 ID，按图的节点顺序排列
     */
    public static List<String> nodesMatchingNamePattern(OpGraph graph, String pattern) {
        Objects.requireNonNull(graph, "图不能为空");
        Objects.requireNonNull(pattern, "名称模式不能为空");
        Pattern compiled = Pattern.compile(pattern);
        List<String> result = new ArrayList<>();
        for (String nodeId : graph.getNodeIds()) {
            if (compiled.matcher(nodeId).lookingAt()) {
                result.add(nodeId);
            }
        }
        return result;
    }
}
