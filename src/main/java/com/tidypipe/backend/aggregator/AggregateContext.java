package com.tidypipe.backend.aggregator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tidypipe.backend.parser.statement.Summarize;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;

/**
 * 一个分组上的聚合器列表容器，顺序与 summarize 中的 (函数, 列) 对一致。
 */
public class AggregateContext {
    private final List<Aggregator> aggregators;

    public AggregateContext(List<Aggregator> aggregators) {
        this.aggregators = aggregators;
    }

    public void accept(Map<String, Object> row) throws PipelineException {
        for (Aggregator agg : aggregators) {
            agg.accept(row);
        }
    }

    public List<String> labels() {
        List<String> headers = new ArrayList<>();
        for (Aggregator agg : aggregators) {
            headers.add(agg.label());
        }
        return headers;
    }

    public List<Object> values() {
        List<Object> values = new ArrayList<>();
        for (Aggregator agg : aggregators) {
            values.add(agg.value());
        }
        return values;
    }

    /**
     * 将当前聚合结果转为 结果列名 -> 值 的映射。
     */
    public Map<String, Object> toValueMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Aggregator agg : aggregators) {
            map.put(agg.label(), agg.value());
        }
        return map;
    }

    /**
     * 为一个分组创建聚合器，聚合列必须存在于表中。
     */
    public static AggregateContext of(List<String> columns, List<Summarize.Item> items) throws PipelineException {
        List<Aggregator> list = new ArrayList<>();
        for (Summarize.Item item : items) {
            if(!columns.contains(item.column)) {
                throw Error.unknownColumn(item.column);
            }
            list.add(item.func.create(item.column));
        }
        return new AggregateContext(list);
    }
}
