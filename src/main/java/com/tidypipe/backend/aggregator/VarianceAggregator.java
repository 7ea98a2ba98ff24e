package com.tidypipe.backend.aggregator;

/**
 * 样本方差（n - 1）。
 */
public class VarianceAggregator extends NumericAggregator {

    public VarianceAggregator(String column) {
        super(column, AggregateFunc.VARIANCE);
    }

    @Override
    protected double compute(double[] values) {
        return sampleVariance(values);
    }
}
