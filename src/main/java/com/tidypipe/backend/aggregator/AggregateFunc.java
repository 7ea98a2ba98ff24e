package com.tidypipe.backend.aggregator;

import java.util.Locale;

import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;

public enum AggregateFunc {
    COUNT("count"),
    SUM("sum"),
    MEAN("mean"),
    MEDIAN("median"),
    MIN("min"),
    MAX("max"),
    VARIANCE("variance"),
    STD("std");

    private final String label;

    AggregateFunc(String label) {
        this.label = label;
    }

    /** 结果列名后缀，例如 red_mean 中的 mean */
    public String label() {
        return label;
    }

    public Aggregator create(String column) {
        switch (this) {
            case COUNT:
                return new CountAggregator(column);
            case SUM:
                return new SumAggregator(column);
            case MEAN:
                return new MeanAggregator(column);
            case MEDIAN:
                return new MedianAggregator(column);
            case MIN:
                return new MinAggregator(column);
            case MAX:
                return new MaxAggregator(column);
            case VARIANCE:
                return new VarianceAggregator(column);
            default:
                return new StdAggregator(column);
        }
    }

    public static AggregateFunc from(String s) throws PipelineException {
        if(s == null) {
            throw Error.malformedPipeline("Missing aggregate function name");
        }
        for (AggregateFunc func : values()) {
            if(func.label.equals(s.toLowerCase(Locale.ROOT))) {
                return func;
            }
        }
        throw Error.malformedPipeline("Unknown aggregate function \"" + s + "\"");
    }

    @Override
    public String toString() {
        return label;
    }
}
