package xyz.vvrf.opgraph.core;

import java.util.Objects;

/**
 * 图节点的种类标签。
 * 算子节点表示一个计算步骤，数据节点表示在算子之间流动的值。
 */
public enum NodeKind {

    OPERATOR("op"),
    DATA("data");

    private final String tag;

    NodeKind(String tag) {
        this.tag = tag;
    }

    /**
     * 图描述中使用的短标签 ("op" / "data")。
     */
    public String getTag() {
        return tag;
    }

    /**
     * 根据标签解析节点种类。接受 "op"、"operator" 和 "data"，不区分大小写。
     *
     * @param tag 种类标签
     * @return 对应的 NodeKind
     * @throws IllegalArgumentException 如果标签未知
     */
    public static NodeKind fromTag(String tag) {
        Objects.requireNonNull(tag, "节点种类标签不能为空");
        String normalized = tag.trim().toLowerCase();
        if (normalized.equals("op") || normalized.equals("operator")) {
            return OPERATOR;
        }
        if (normalized.equals("data")) {
            return DATA;
        }
        throw new IllegalArgumentException(String.format("Unknown node kind '%s'. Expected one of: op, operator, data.", tag));
    }
}
