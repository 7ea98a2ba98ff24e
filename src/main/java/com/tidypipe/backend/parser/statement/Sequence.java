package com.tidypipe.backend.parser.statement;

import com.google.common.base.Preconditions;

/**
 * 数据源：生成单列 1..count。
 */
public final class Sequence implements Transform {
    public final String column;
    public final int count;

    public Sequence(String column, int count) {
        Preconditions.checkArgument(column != null && !column.isEmpty(), "column name must not be empty");
        Preconditions.checkArgument(count >= 0, "sequence length must not be negative: %s", count);
        this.column = column;
        this.count = count;
    }

    @Override
    public String name() {
        return "sequence";
    }

    @Override
    public boolean isSource() {
        return true;
    }
}
