package com.tidypipe.backend.expr;

/**
 * 表达式节点的形状，决定节点携带哪些字段。
 */
public enum ExprShape {
    /** 字面量与列引用：一个标量值 */
    VALUE(0),
    /** 行号：无字段 */
    ROWNUM(0),
    /** 随机变量：若干数值参数 */
    VARIATE(0),
    UNARY(1),
    BINARY(2),
    TERNARY(3);

    private final int children;

    ExprShape(int children) {
        this.children = children;
    }

    public int children() {
        return children;
    }
}
