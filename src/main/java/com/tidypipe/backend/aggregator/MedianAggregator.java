package com.tidypipe.backend.aggregator;

import java.util.Arrays;

/**
 * 中位数，偶数个值时取中间两个的平均。
 */
public class MedianAggregator extends NumericAggregator {

    public MedianAggregator(String column) {
        super(column, AggregateFunc.MEDIAN);
    }

    @Override
    protected double compute(double[] values) {
        Arrays.sort(values);
        int mid = values.length / 2;
        if(values.length % 2 == 1) {
            return values[mid];
        }
        return (values[mid - 1] + values[mid]) / 2;
    }
}
