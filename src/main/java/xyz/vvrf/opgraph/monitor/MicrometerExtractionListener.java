package xyz.vvrf.opgraph.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.opgraph.extract.ExtractedSubgraph;
import xyz.vvrf.opgraph.extract.SubgraphExtractionException;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

@Slf4j
public class MicrometerExtractionListener implements ExtractionListener {

    // 指标名称
    public static final String METRIC_EXTRACTION_TIME = "opgraph.extraction.time";
    public static final String METRIC_EXTRACTION_TOTAL = "opgraph.extraction.total";
    public static final String METRIC_REGION_SIZE = "opgraph.extraction.region.size";

    // 标签键
    public static final String TAG_GRAPH_NAME = "graph.name";
    public static final String TAG_STATUS = "status";
    public static final String TAG_REASON = "reason";

    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILURE = "FAILURE";
    private static final String REASON_NONE = "NONE";

    private final MeterRegistry meterRegistry;

    public MicrometerExtractionListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onExtractionSuccess(String graphName, List<String> startNodes, List<String> endNodes, Duration duration, ExtractedSubgraph result) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_STATUS, STATUS_SUCCESS),
                Tag.of(TAG_REASON, REASON_NONE)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
        try {
            DistributionSummary.builder(METRIC_REGION_SIZE)
                    .tag(TAG_GRAPH_NAME, graphName)
                    .description("提取的子图节点数")
                    .register(meterRegistry)
                    .record(result.size());
        } catch (Exception e) {
            log.error("Failed to record region size metric: {}", e.getMessage(), e);
        }
    }

    @Override
    public void onExtractionFailure(String graphName, List<String> startNodes, List<String> endNodes, Duration duration, SubgraphExtractionException error) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_STATUS, STATUS_FAILURE),
                Tag.of(TAG_REASON, error.getReason().name())
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(METRIC_EXTRACTION_TIME)
                    .tags(tags)
                    .description("子图提取耗时")
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("Failed to record timer metric: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter.builder(METRIC_EXTRACTION_TOTAL)
                    .tags(tags)
                    .description("按状态统计的子图提取次数")
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("Failed to increment counter metric: {}", e.getMessage(), e);
        }
    }
}
