package com.tidypipe.backend.parser.statement;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * 稳定的多键排序，descending 对所有键统一生效。
 */
public final class Sort implements Transform {
    public final ImmutableList<String> columns;
    public final boolean descending;

    public Sort(List<String> columns, boolean descending) {
        Preconditions.checkArgument(!columns.isEmpty(), "sort needs at least one column");
        this.columns = ImmutableList.copyOf(columns);
        this.descending = descending;
    }

    @Override
    public String name() {
        return "sort";
    }
}
