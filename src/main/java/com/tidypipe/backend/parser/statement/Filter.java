package com.tidypipe.backend.parser.statement;

import java.util.Objects;

import com.tidypipe.backend.expr.Expr;

public final class Filter implements Transform {
    public final Expr predicate;

    public Filter(Expr predicate) {
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    @Override
    public String name() {
        return "filter";
    }
}
