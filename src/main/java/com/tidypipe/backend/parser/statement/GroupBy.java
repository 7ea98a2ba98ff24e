package com.tidypipe.backend.parser.statement;

import com.google.common.base.Preconditions;

public final class GroupBy implements Transform {
    /** 分组后写入的列名 */
    public static final String GROUP_COLUMN = "_group_";

    public final String column;

    public GroupBy(String column) {
        Preconditions.checkArgument(column != null && !column.isEmpty(), "column name must not be empty");
        this.column = column;
    }

    @Override
    public String name() {
        return "groupBy";
    }
}
