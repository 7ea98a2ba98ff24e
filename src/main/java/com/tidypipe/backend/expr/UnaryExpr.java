package com.tidypipe.backend.expr;

import java.util.List;

import com.google.common.collect.ImmutableList;

public final class UnaryExpr extends Expr {

    private final Expr arg;

    UnaryExpr(ExprKind kind, Expr arg) {
        super(kind);
        this.arg = arg;
    }

    public Expr arg() {
        return arg;
    }

    @Override
    public List<Expr> children() {
        return ImmutableList.of(arg);
    }
}
