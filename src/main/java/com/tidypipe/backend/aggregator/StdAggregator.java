package com.tidypipe.backend.aggregator;

public class StdAggregator extends NumericAggregator {

    public StdAggregator(String column) {
        super(column, AggregateFunc.STD);
    }

    @Override
    protected double compute(double[] values) {
        return Math.sqrt(sampleVariance(values));
    }
}
