package com.tidypipe.backend.aggregator;

import java.util.Map;

import com.tidypipe.backend.value.Missing;
import com.tidypipe.backend.value.ValueType;
import com.tidypipe.backend.value.Values;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;

/**
 * 只接受数字的聚合器基类。分组内出现任何 MISSING，结果即为 MISSING。
 */
public abstract class NumericAggregator implements Aggregator {
    private final String column;
    private final AggregateFunc func;
    private final String label;
    private double[] values = new double[8];
    private int size = 0;
    private boolean missing = false;

    protected NumericAggregator(String column, AggregateFunc func) {
        this.column = column;
        this.func = func;
        this.label = column + "_" + func.label();
    }

    @Override
    public void accept(Map<String, Object> row) throws PipelineException {
        Object v = row.get(column);
        ValueType type = ValueType.of(v);
        if(type == ValueType.MISSING) {
            missing = true;
            return;
        }
        if(type != ValueType.NUMBER) {
            throw Error.requireNumber(func.label());
        }
        if(size == values.length) {
            double[] grown = new double[size * 2];
            System.arraycopy(values, 0, grown, 0, size);
            values = grown;
        }
        values[size++] = (Double) v;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public Object value() {
        if(missing || size == 0) {
            return Missing.MISSING;
        }
        double[] present = new double[size];
        System.arraycopy(values, 0, present, 0, size);
        return Values.safe(compute(present));
    }

    /**
     * 在全部非缺失值上计算结果，数组至少有一个元素，可以原地修改。
     * 返回 NaN 表示结果无定义。
     */
    protected abstract double compute(double[] values);

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * 样本方差（除以 n - 1），少于两个值时无定义。
     */
    static double sampleVariance(double[] values) {
        if(values.length < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return squares / (values.length - 1);
    }
}
