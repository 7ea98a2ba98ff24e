package com.tidypipe.backend.parser.statement;

import java.util.Objects;

import com.google.common.base.Preconditions;
import com.tidypipe.backend.expr.Expr;

public final class Mutate implements Transform {
    public final String column;
    public final Expr value;

    public Mutate(String column, Expr value) {
        Preconditions.checkArgument(column != null && !column.isEmpty(), "column name must not be empty");
        this.column = column;
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public String name() {
        return "mutate";
    }
}
