package xyz.vvrf.opgraph.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.opgraph.extract.ExtractedSubgraph;
import xyz.vvrf.opgraph.extract.SubgraphExtractionException;

import java.time.Duration;
import java.util.List;

@Slf4j
public class LoggingExtractionListener implements ExtractionListener {

    @Override
    public void onExtractionSuccess(String graphName, List<String> startNodes, List<String> endNodes, Duration duration, ExtractedSubgraph result) {
        log.info("[MONITOR] Graph:[{}] extraction {} -> {} succeeded. Nodes:[{}], Duration:[{}ms]",
                graphName, startNodes, endNodes, result.size(), duration.toMillis());
    }

    @Override
    public void onExtractionFailure(String graphName, List<String> startNodes, List<String> endNodes, Duration duration, SubgraphExtractionException error) {
        log.warn("[MONITOR] Graph:[{}] extraction {} -> {} failed. Reason:[{}], Node:[{}], Duration:[{}ms], Error:[{}]",
                graphName, startNodes, endNodes, error.getReason(), error.getNodeId(), duration.toMillis(), error.getMessage());
    }
}
