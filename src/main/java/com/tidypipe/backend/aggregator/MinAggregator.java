package com.tidypipe.backend.aggregator;

import java.util.Map;

import com.tidypipe.backend.value.Missing;
import com.tidypipe.backend.value.ValueType;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;

public class MinAggregator implements Aggregator {
    private final String column;
    private final String label;
    private ValueType type;
    private Object min;
    private boolean missing = false;

    public MinAggregator(String column) {
        this.column = column;
        this.label = column + "_" + AggregateFunc.MIN.label();
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
            throw Error.typeMismatch(AggregateFunc.MIN.label(), type, vt);
        }
        if(min == null || type.compare(v, min) < 0) {
            min = v;
        }
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public Object value() {
        return (missing || min == null) ? Missing.MISSING : min;
    }
}
