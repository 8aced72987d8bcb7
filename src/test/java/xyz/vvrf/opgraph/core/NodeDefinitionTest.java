package xyz.vvrf.opgraph.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeDefinitionTest {

    @Test
    void operatorCarriesOpTagOnly() {
        NodeDefinition conv = NodeDefinition.operator("conv", "Conv");

        assertThat(conv.isOperator()).isTrue();
        assertThat(conv.getOp()).contains("Conv");
        assertThat(conv.getValue()).isEmpty();
        assertThat(conv).isEqualTo(NodeDefinition.of("conv", NodeKind.OPERATOR, "Conv", null));
    }

    @Test
    void dataNodeMayCarryConstant() {
        assertThat(NodeDefinition.data("t").getValue()).isEmpty();
        assertThat(NodeDefinition.constant("w", 2.0).getValue()).contains(2.0);
        assertThat(NodeDefinition.constant("w", 2.0).toString()).contains("constant=true");
    }

    @Test
    void rejectsInconsistentDefinitions() {
        assertThatThrownBy(() -> NodeDefinition.operator("x", " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("op tag");
        assertThatThrownBy(() -> NodeDefinition.of("x", NodeKind.OPERATOR, "Conv", 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodeDefinition.of("x", NodeKind.DATA, "Conv", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodeDefinition.constant("x", null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void kindTagsAreParsedCaseInsensitively() {
        assertThat(NodeKind.fromTag("op")).isEqualTo(NodeKind.OPERATOR);
        assertThat(NodeKind.fromTag("Operator")).isEqualTo(NodeKind.OPERATOR);
        assertThat(NodeKind.fromTag(" DATA ")).isEqualTo(NodeKind.DATA);
        assertThatThrownBy(() -> NodeKind.fromTag("tensor"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tensor");
    }
}
