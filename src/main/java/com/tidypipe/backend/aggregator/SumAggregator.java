package com.tidypipe.backend.aggregator;

public class SumAggregator extends NumericAggregator {

    public SumAggregator(String column) {
        super(column, AggregateFunc.SUM);
    }

    @Override
    protected double compute(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum;
    }
}
