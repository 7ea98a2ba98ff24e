package com.tidypipe.backend.expr;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * 随机变量：exponential(rate) / normal(mean, stdDev) / uniform(low, high)。
 * 每次求值都重新抽样，不具备引用透明性。
 */
public final class VariateExpr extends Expr {

    private final ImmutableList<Double> params;

    VariateExpr(ExprKind kind, ImmutableList<Double> params) {
        super(kind);
        this.params = params;
    }

    public ImmutableList<Double> params() {
        return params;
    }

    public double param(int index) {
        return params.get(index);
    }

    @Override
    public List<Expr> children() {
        return ImmutableList.of();
    }
}
