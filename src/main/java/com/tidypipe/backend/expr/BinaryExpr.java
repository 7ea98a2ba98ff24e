package com.tidypipe.backend.expr;

import java.util.List;

import com.google.common.collect.ImmutableList;

public final class BinaryExpr extends Expr {

    private final Expr left;
    private final Expr right;

    BinaryExpr(ExprKind kind, Expr left, Expr right) {
        super(kind);
        this.left = left;
        this.right = right;
    }

    public Expr left() {
        return left;
    }

    public Expr right() {
        return right;
    }

    @Override
    public List<Expr> children() {
        return ImmutableList.of(left, right);
    }
}
