package com.tidypipe.backend.expr;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * 当前行在表中的下标（从 0 开始）。
 */
public final class RowNumExpr extends Expr {

    static final RowNumExpr INSTANCE = new RowNumExpr();

    private RowNumExpr() {
        super(ExprKind.ROWNUM);
    }

    @Override
    public List<Expr> children() {
        return ImmutableList.of();
    }
}
