package com.tidypipe.backend.parser.statement;

import java.util.List;

import com.tidypipe.backend.aggregator.AggregateFunc;
import com.tidypipe.backend.expr.Expr;

/**
 * 表级操作的标记接口。所有实现都是不可变的纯描述对象，不携带运行期状态。
 */
public interface Transform {

    /** operation 数组中的第一个元素 */
    String TAG = "@transform";

    /** operation 名称，例如 filter / mutate */
    String name();

    /** 是否可以作为 pipeline 的第一个操作（产生数据） */
    default boolean isSource() {
        return false;
    }

    static Data data(String name) {
        return new Data(name);
    }

    static Sequence sequence(String column, int count) {
        return new Sequence(column, count);
    }

    static Filter filter(Expr predicate) {
        return new Filter(predicate);
    }

    static Mutate mutate(String column, Expr value) {
        return new Mutate(column, value);
    }

    static Select select(List<String> columns) {
        return new Select(columns);
    }

    static Sort sort(List<String> columns, boolean descending) {
        return new Sort(columns, descending);
    }

    static GroupBy groupBy(String column) {
        return new GroupBy(column);
    }

    static Ungroup ungroup() {
        return Ungroup.INSTANCE;
    }

    static Summarize summarize(List<Summarize.Item> items) {
        return new Summarize(items);
    }

    static Summarize summarize(AggregateFunc func, String column) {
        return new Summarize(List.of(new Summarize.Item(func, column)));
    }

    static Join join(String leftName, String leftColumn, String rightName, String rightColumn) {
        return new Join(leftName, leftColumn, rightName, rightColumn);
    }

    static Notify publish(String name) {
        return new Notify(name);
    }
}
