package com.tidypipe.backend.aggregator;

import java.util.Map;

/**
 * 统计分组内的行数，MISSING 也计入。
 */
public class CountAggregator implements Aggregator {
    private final String label;
    private long count = 0;

    public CountAggregator(String column) {
        this.label = column + "_" + AggregateFunc.COUNT.label();
    }

    @Override
    public void accept(Map<String, Object> row) {
        count++;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public Object value() {
        return (double) count;
    }
}
