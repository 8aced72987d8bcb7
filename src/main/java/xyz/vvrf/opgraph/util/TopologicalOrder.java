package xyz.vvrf.opgraph.util;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 伪拓扑排序的结果（不可变）。
 * <p>
 * backEdgeDetected 为 true 表示深度优先遍历中遇到了指向仍在遍历栈上节点的边，
 * 即图中存在可达的环，此时 order 不保证满足所有边的先后关系。
 * </p>
 */
@Getter
public final class TopologicalOrder {

    private final List<String> order;
    private final boolean backEdgeDetected;

    TopologicalOrder(List<String> order, boolean backEdgeDetected) {
        this.order = Collections.unmodifiableList(Objects.requireNonNull(order, "order"));
        this.backEdgeDetected = backEdgeDetected;
    }

    /**
     * 顺序是否可以作为严格的拓扑顺序使用。
     */
    public boolean isStrict() {
        return !backEdgeDetected;
    }

    @Override
    public String toString() {
        return "TopologicalOrder{order=" + order + ", backEdgeDetected=" + backEdgeDetected + '}';
    }
}
