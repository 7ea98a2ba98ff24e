package com.tidypipe.backend.parser.statement;

import com.google.common.base.Preconditions;

/**
 * 读取两张已发布的表做等值连接。也可以作为 pipeline 的第一个操作。
 */
public final class Join implements Transform {
    public static final String JOIN_COLUMN = "_join_";
    public static final String LEFT_PREFIX = "left_";
    public static final String RIGHT_PREFIX = "right_";

    public final String leftName;
    public final String leftColumn;
    public final String rightName;
    public final String rightColumn;

    public Join(String leftName, String leftColumn, String rightName, String rightColumn) {
        Preconditions.checkArgument(leftName != null && !leftName.isEmpty(), "left table name must not be empty");
        Preconditions.checkArgument(leftColumn != null && !leftColumn.isEmpty(), "left column must not be empty");
        Preconditions.checkArgument(rightName != null && !rightName.isEmpty(), "right table name must not be empty");
        Preconditions.checkArgument(rightColumn != null && !rightColumn.isEmpty(), "right column must not be empty");
        this.leftName = leftName;
        this.leftColumn = leftColumn;
        this.rightName = rightName;
        this.rightColumn = rightColumn;
    }

    @Override
    public String name() {
        return "join";
    }

    @Override
    public boolean isSource() {
        return true;
    }
}
