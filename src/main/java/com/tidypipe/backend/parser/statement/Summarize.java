package com.tidypipe.backend.parser.statement;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.tidypipe.backend.aggregator.AggregateFunc;

public final class Summarize implements Transform {
    public final ImmutableList<Item> items;

    public Summarize(List<Item> items) {
        Preconditions.checkArgument(!items.isEmpty(), "summarize needs at least one (function, column) pair");
        Set<String> labels = new HashSet<>();
        for (Item item : items) {
            Preconditions.checkArgument(labels.add(item.label()), "summarize produces %s twice", item.label());
        }
        this.items = ImmutableList.copyOf(items);
    }

    @Override
    public String name() {
        return "summarize";
    }

    /**
     * 一个 (聚合函数, 列) 对，结果列名为 {@code column_func}。
     */
    public static final class Item {
        public final AggregateFunc func;
        public final String column;

        public Item(AggregateFunc func, String column) {
            this.func = Objects.requireNonNull(func, "func");
            Preconditions.checkArgument(column != null && !column.isEmpty(), "column name must not be empty");
            this.column = column;
        }

        public String label() {
            return column + "_" + func.label();
        }
    }
}
