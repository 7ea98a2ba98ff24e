package com.tidypipe.backend.aggregator;

import java.util.Map;

import com.tidypipe.backend.value.Missing;
import com.tidypipe.backend.value.ValueType;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;

public class MaxAggregator implements Aggregator {
    private final String column;
    private final String label;
    private ValueType type;
    private Object max;
    private boolean missing = false;

    public MaxAggregator(String column) {
        this.column = column;
        this.label = column + "_" + AggregateFunc.MAX.label();
    }

    @Override
    public void accept(Map<String, Object> row) throws PipelineException {
        Object v = row.get(column);
        ValueType vt = ValueType.of(v);
        if(vt == ValueType.MISSING) {
            missing = true;
            return;
        }
        if(type == null) {
            type = vt;
        } else if(type != vt) {
            throw Error.typeMismatch(AggregateFunc.MAX.label(), type, vt);
        }
        if(max == null || type.compare(v, max) > 0) {
            max = v;
        }
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public Object value() {
        return (missing || max == null) ? Missing.MISSING : max;
    }
}
