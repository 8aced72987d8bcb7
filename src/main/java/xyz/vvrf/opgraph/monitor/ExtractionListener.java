package xyz.vvrf.opgraph.monitor;

import xyz.vvrf.opgraph.extract.ExtractedSubgraph;
import xyz.vvrf.opgraph.extract.SubgraphExtractionException;

import java.time.Duration;
import java.util.List;

/**
 * 用于监控子图提取的监听器接口。
 * 实现抛出的异常会被记录并忽略，不影响提取结果。
 */
public interface ExtractionListener {

    /**
     * 提取成功时调用。
     *
     * @param graphName  图名称
     * @param startNodes 起始节点
     * @param endNodes   终止节点
     * @param duration   提取耗时
     * @param result     提取结果
     */
    void onExtractionSuccess(String graphName, List<String> startNodes, List<String> endNodes, Duration duration, ExtractedSubgraph result);

    /**
     * 提取失败时调用。
     *
     * @param graphName  图名称
     * @param startNodes 起始节点
     * @param endNodes   终止节点
     * @param duration   提取耗时
     * @param error      失败原因
     */
    void onExtractionFailure(String graphName, List<String> startNodes, List<String> endNodes, Duration duration, SubgraphExtractionException error);
}
