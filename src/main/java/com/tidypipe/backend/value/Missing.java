package com.tidypipe.backend.value;

/**
 * 缺失值哨兵。表中的单元格永远不会是 {@code null}，缺失一律用 {@link #MISSING} 表示。
 * 非法数值（NaN、Infinity）和非法日期在进入表之前同样折叠为 MISSING。
 */
public enum Missing {
    MISSING;

    @Override
    public String toString() {
        return "MISSING";
    }
}
