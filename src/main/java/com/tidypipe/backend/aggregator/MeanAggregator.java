package com.tidypipe.backend.aggregator;

public class MeanAggregator extends NumericAggregator {

    public MeanAggregator(String column) {
        super(column, AggregateFunc.MEAN);
    }

    @Override
    protected double compute(double[] values) {
        return mean(values);
    }
}
