package xyz.vvrf.opgraph.core;

import java.util.Objects;
import java.util.Optional;

/**
 * 图中一个节点的定义（不可变数据类）。
 * <p>
 * 算子节点必须携带 op 标签且不能携带常量值；数据节点没有 op 标签，
 * 可选地携带常量值（存在表示编译期常量，缺失表示运行时产生的张量）。
 * </p>
 */
public final class NodeDefinition {
    private final String id;
    private final NodeKind kind;
    private final String op;     // 仅算子节点
    private final Object value;  // 仅数据节点，可为 null

    private NodeDefinition(String id, NodeKind kind, String op, Object value) {
        this.id = Objects.requireNonNull(id, "节点 ID 不能为空");
        this.kind = Objects.requireNonNull(kind, "节点种类不能为空");
        if (kind == NodeKind.OPERATOR) {
            if (op == null || op.trim().isEmpty()) {
                throw new IllegalArgumentException(String.format("Operator node '%s' must carry a non-empty op tag.", id));
            }
            if (value != null) {
                throw new IllegalArgumentException(String.format("Operator node '%s' cannot carry a constant value.", id));
            }
        } else if (op != null) {
            throw new IllegalArgumentException(String.format("Data node '%s' cannot carry an op tag (got '%s').", id, op));
        }
        this.op = op;
        this.value = value;
    }

    public static NodeDefinition operator(String id, String op) {
        return new NodeDefinition(id, NodeKind.OPERATOR, op, null);
    }

    /**
     * 创建不带常量值的数据节点（运行时张量）。
     */
    public static NodeDefinition data(String id) {
        return new NodeDefinition(id, NodeKind.DATA, null, null);
    }

    /**
     * 创建携带常量值的数据节点。
     */
    public static NodeDefinition constant(String id, Object value) {
        return new NodeDefinition(id, NodeKind.DATA, null, Objects.requireNonNull(value, "常量值不能为空"));
    }

    /**
     * 通用工厂方法，供读取器根据种类标签构造节点。
     */
    public static NodeDefinition of(String id, NodeKind kind, String op, Object value) {
        return new NodeDefinition(id, kind, op, value);
    }

    public String getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    public Optional<String> getOp() {
        return Optional.ofNullable(op);
    }

    public Optional<Object> getValue() {
        return Optional.ofNullable(value);
    }

    public boolean isOperator() {
        return kind == NodeKind.OPERATOR;
    }

    public boolean isData() {
        return kind == NodeKind.DATA;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeDefinition that = (NodeDefinition) o;
        return id.equals(that.id) &&
                kind == that.kind &&
                Objects.equals(op, that.op) &&
                Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, op, value);
    }

    @Override
    public String toString() {
        if (isOperator()) {
            return String.format("NodeDef[id=%s, kind=%s, op=%s]", id, kind.getTag(), op);
        }
        return String.format("NodeDef[id=%s, kind=%s, constant=%s]", id, kind.getTag(), value != null);
    }
}
