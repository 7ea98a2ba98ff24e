package com.tidypipe.backend.expr;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * 字面量或列引用。列引用时 value 为列名。
 */
public final class ValueExpr extends Expr {

    private final Object value;

    ValueExpr(ExprKind kind, Object value) {
        super(kind);
        this.value = value;
    }

    public Object value() {
        return value;
    }

    @Override
    public List<Expr> children() {
        return ImmutableList.of();
    }
}
