package com.tidypipe.backend.expr;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * 三元节点，目前只有 ifElse：left 为条件，middle / right 为两个分支。
 */
public final class TernaryExpr extends Expr {

    private final Expr left;
    private final Expr middle;
    private final Expr right;

    TernaryExpr(ExprKind kind, Expr left, Expr middle, Expr right) {
        super(kind);
        this.left = left;
        this.middle = middle;
        this.right = right;
    }

    public Expr left() {
        return left;
    }

    public Expr middle() {
        return middle;
    }

    public Expr right() {
        return right;
    }

    @Override
    public List<Expr> children() {
        return ImmutableList.of(left, middle, right);
    }
}
