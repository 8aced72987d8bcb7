package xyz.vvrf.opgraph.core;

import java.util.Objects;

/**
 * 有向边的定义（不可变数据类）。
 * 图是多重图：相同 (source, destination) 的边可以出现多次，每条都会被独立遍历。
 */
public final class EdgeDefinition {
    private final String sourceId;
    private final String destinationId;

    public EdgeDefinition(String sourceId, String destinationId) {
        this.sourceId = Objects.requireNonNull(sourceId, "源节点 ID 不能为空");
        this.destinationId = Objects.requireNonNull(destinationId, "目标节点 ID 不能为空");
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getDestinationId() {
        return destinationId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EdgeDefinition that = (EdgeDefinition) o;
        return sourceId.equals(that.sourceId) && destinationId.equals(that.destinationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, destinationId);
    }

    @Override
    public String toString() {
        return String.format("Edge[%s -> %s]", sourceId, destinationId);
    }
}
