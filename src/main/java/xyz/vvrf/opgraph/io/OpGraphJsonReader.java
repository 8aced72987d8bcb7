package xyz.vvrf.opgraph.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.opgraph.builder.OpGraphBuilder;
import xyz.vvrf.opgraph.core.NodeDefinition;
import xyz.vvrf.opgraph.core.NodeKind;
import xyz.vvrf.opgraph.core.OpGraph;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * 从 JSON 描述读取 OpGraph。
 * <pre>{@code
 * {
 *   "name": "conv-block",
 *   "nodes": [
 *     {"id": "input", "kind": "op", "op": "Placeholder"},
 *     {"id": "weights", "kind": "data", "value": [1, 2, 3], "attrs": {"shape": [3]}}
 *   ],
 *   "edges": [ {"from": "input", "to": "weights"} ]
 * }
 * }</pre>
 * 数据节点的 value 不存在或为 null 时表示运行时张量。
 */
@Slf4j
public class OpGraphJsonReader {

    private static final String DEFAULT_GRAPH_NAME = "graph";

    private final ObjectMapper objectMapper;

    public OpGraphJsonReader() {
        this(new ObjectMapper());
    }

    public OpGraphJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
    }

    /**
     * @throws IOException              如果读取或 JSON 解析失败
     * @throws IllegalArgumentException 如果描述的结构无效
     */
    public OpGraph read(InputStream input) throws IOException {
        Objects.requireNonNull(input, "输入流不能为空");
        return fromTree(objectMapper.readTree(input));
    }

    public OpGraph read(Path path) throws IOException {
        Objects.requireNonNull(path, "路径不能为空");
        try (InputStream input = Files.newInputStream(path)) {
            return read(input);
        }
    }

    public OpGraph read(String json) throws IOException {
        Objects.requireNonNull(json, "JSON 不能为空");
        return fromTree(objectMapper.readTree(json));
    }

    /**
     * 从类路径资源读取。
     *
     * @throws FileNotFoundException 如果资源不存在
     */
    public OpGraph readResource(String resourceName) throws IOException {
        Objects.requireNonNull(resourceName, "资源名称不能为空");
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = OpGraphJsonReader.class.getClassLoader();
        }
        try (InputStream input = classLoader.getResourceAsStream(resourceName)) {
            if (input == null) {
                throw new FileNotFoundException("Graph resource not found on classpath: " + resourceName);
            }
            return read(input);
        }
    }

    private OpGraph fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Graph description must be a JSON object.");
        }
        String graphName = root.path("name").asText(DEFAULT_GRAPH_NAME);
        OpGraphBuilder builder = new OpGraphBuilder(graphName);

        JsonNode nodes = root.path("nodes");
        if (!nodes.isArray()) {
            throw new IllegalArgumentException(String.format("Graph '%s': 'nodes' must be an array.", graphName));
        }
        for (JsonNode node : nodes) {
            builder.addNode(toNodeDefinition(graphName, node));
            JsonNode attrs = node.path("attrs");
            if (attrs.isObject()) {
                String nodeId = node.get("id").asText();
                Iterator<Map.Entry<String, JsonNode>> fields = attrs.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    builder.withAttribute(nodeId, field.getKey(), toValue(field.getValue()));
                }
            }
        }

        JsonNode edges = root.path("edges");
        if (!edges.isMissingNode()) {
            if (!edges.isArray()) {
                throw new IllegalArgumentException(String.format("Graph '%s': 'edges' must be an array.", graphName));
            }
            for (JsonNode edge : edges) {
                String from = requireText(graphName, edge, "from");
                String to = requireText(graphName, edge, "to");
                builder.addEdge(from, to);
            }
        }
        OpGraph graph = builder.build();
        log.debug("Read graph '{}' with {} nodes.", graphName, graph.getNodeIds().size());
        return graph;
    }

    private NodeDefinition toNodeDefinition(String graphName, JsonNode node) {
        String id = requireText(graphName, node, "id");
        NodeKind kind = NodeKind.fromTag(requireText(graphName, node, "kind"));
        if (kind == NodeKind.OPERATOR) {
            JsonNode op = node.get("op");
            if (op == null || !op.isTextual()) {
                throw new IllegalArgumentException(String.format("Graph '%s': operator node '%s' has no 'op' tag.", graphName, id));
            }
            return NodeDefinition.operator(id, op.asText());
        }
        JsonNode value = node.get("value");
        if (value == null || value.isNull()) {
            return NodeDefinition.data(id);
        }
        return NodeDefinition.constant(id, toValue(value));
    }

    private Object toValue(JsonNode value) {
        if (value.isNull()) {
            return null;
        }
        return objectMapper.convertValue(value, Object.class);
    }

    private static String requireText(String graphName, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new IllegalArgumentException(String.format("Graph '%s': missing or non-text field '%s' in %s.", graphName, field, node));
        }
        return value.asText();
    }
}
