package xyz.vvrf.opgraph.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import xyz.vvrf.opgraph.extract.SubgraphExtractor;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;

/**
 * 图工具库的配置属性类。
 * 绑定 'opgraph' 前缀下的属性。
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "opgraph")
@Validated
public class OpGraphProperties {

    @Valid
    private final Extraction extraction = new Extraction();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Extraction {
        /**
         * 图输入节点的 op 标签。包含此类节点的子图提取会失败。
         */
        @NotBlank
        private String graphInputOp = SubgraphExtractor.DEFAULT_GRAPH_INPUT_OP;
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册日志监听器。
         */
        private boolean loggingEnabled = true;

        /**
         * 是否注册 Micrometer 监听器（需要 MeterRegistry Bean）。
         */
        private boolean metricsEnabled = true;
    }

    @Override
    public String toString() {
        return "OpGraphProperties{" +
                "extraction={graphInputOp='" + extraction.graphInputOp + '\'' +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                ", metricsEnabled=" + monitor.metricsEnabled +
                "}}";
    }
}
