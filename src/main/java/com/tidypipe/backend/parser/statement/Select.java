package com.tidypipe.backend.parser.statement;

import java.util.HashSet;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

public final class Select implements Transform {
    public final ImmutableList<String> columns;

    public Select(List<String> columns) {
        Preconditions.checkArgument(!columns.isEmpty(), "select needs at least one column");
        Preconditions.checkArgument(new HashSet<>(columns).size() == columns.size(),
                "select lists a column twice: %s", columns);
        this.columns = ImmutableList.copyOf(columns);
    }

    @Override
    public String name() {
        return "select";
    }
}
