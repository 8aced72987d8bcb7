package xyz.vvrf.opgraph.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.vvrf.opgraph.extract.SubgraphExtractor;
import xyz.vvrf.opgraph.io.OpGraphJsonReader;
import xyz.vvrf.opgraph.monitor.ExtractionListener;
import xyz.vvrf.opgraph.monitor.LoggingExtractionListener;
import xyz.vvrf.opgraph.monitor.MicrometerExtractionListener;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 图工具库的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link OpGraphProperties}。
 * 2. 提供 {@link SubgraphExtractor} Bean，使用配置的图输入 op 标签，并注入所有 {@link ExtractionListener}。
 * 3. 提供 {@link OpGraphJsonReader} Bean，优先使用上下文中的 Jackson ObjectMapper。
 * 4. 按配置提供日志监听器和 Micrometer 监听器。
 * <p>
 * 遍历、邻域、连通性、反向搜索和作用域工具都是静态方法，不需要 Bean。
 */
@Configuration
@EnableConfigurationProperties(OpGraphProperties.class)
@Slf4j
public class OpGraphAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(SubgraphExtractor.class)
    public SubgraphExtractor subgraphExtractor(OpGraphProperties properties, ObjectProvider<ExtractionListener> listenersProvider) {
        List<ExtractionListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        log.info("Creating SubgraphExtractor: graphInputOp='{}', listeners={}",
                properties.getExtraction().getGraphInputOp(),
                listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ", "[", "]")));
        return new SubgraphExtractor(properties.getExtraction().getGraphInputOp(), listeners);
    }

    @Bean
    @ConditionalOnMissingBean(OpGraphJsonReader.class)
    public OpGraphJsonReader opGraphJsonReader(ObjectProvider<ObjectMapper> objectMapperProvider) {
        return new OpGraphJsonReader(objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean(LoggingExtractionListener.class)
    @ConditionalOnProperty(prefix = "opgraph.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingExtractionListener loggingExtractionListener() {
        return new LoggingExtractionListener();
    }

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MicrometerExtractionListener.class)
        @ConditionalOnProperty(prefix = "opgraph.monitor", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
        public MicrometerExtractionListener micrometerExtractionListener(MeterRegistry meterRegistry) {
            log.info("Creating MicrometerExtractionListener.");
            return new MicrometerExtractionListener(meterRegistry);
        }
    }
}
