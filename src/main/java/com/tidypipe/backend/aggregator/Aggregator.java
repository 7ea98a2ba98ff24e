package com.tidypipe.backend.aggregator;

import java.util.Map;

import com.tidypipe.common.PipelineException;

/**
 * 聚合器接口，封装单个聚合函数在一个分组上的状态与运算。
 */
public interface Aggregator {
    /** 分组内每行调用一次 */
    void accept(Map<String, Object> row) throws PipelineException;

    /** 结果列名，如 red_sum */
    String label();

    /** 聚合结果，可能是 MISSING */
    Object value();
}
