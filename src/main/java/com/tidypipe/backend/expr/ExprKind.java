package com.tidypipe.backend.expr;

import java.util.HashMap;
import java.util.Map;

/**
 * 全部表达式变体。{@link #wireName()} 是序列化数组中的第二个元素。
 */
public enum ExprKind {
    // 字面量
    COLUMN("column", ExprShape.VALUE),
    DATETIME("datetime", ExprShape.VALUE),
    LOGICAL("logical", ExprShape.VALUE),
    NUMBER("number", ExprShape.VALUE),
    TEXT("text", ExprShape.VALUE),
    ROWNUM("rownum", ExprShape.ROWNUM),

    // 随机变量，参数个数见 variateParams
    EXPONENTIAL("exponential", ExprShape.VARIATE, 1),
    NORMAL("normal", ExprShape.VARIATE, 2),
    UNIFORM("uniform", ExprShape.VARIATE, 2),

    // 取反
    NEGATE("negate", ExprShape.UNARY),
    NOT("not", ExprShape.UNARY),

    // 类型判断
    IS_DATETIME("isDatetime", ExprShape.UNARY),
    IS_LOGICAL("isLogical", ExprShape.UNARY),
    IS_MISSING("isMissing", ExprShape.UNARY),
    IS_NUMBER("isNumber", ExprShape.UNARY),
    IS_TEXT("isText", ExprShape.UNARY),

    // 类型转换
    TO_LOGICAL("toLogical", ExprShape.UNARY),
    TO_DATETIME("toDatetime", ExprShape.UNARY),
    TO_NUMBER("toNumber", ExprShape.UNARY),
    TO_TEXT("toText", ExprShape.UNARY),

    // 日期字段
    TO_YEAR("toYear", ExprShape.UNARY),
    TO_MONTH("toMonth", ExprShape.UNARY),
    TO_DAY("toDay", ExprShape.UNARY),
    TO_WEEKDAY("toWeekday", ExprShape.UNARY),
    TO_HOURS("toHours", ExprShape.UNARY),
    TO_MINUTES("toMinutes", ExprShape.UNARY),
    TO_SECONDS("toSeconds", ExprShape.UNARY),

    // 算术
    ADD("add", ExprShape.BINARY),
    SUBTRACT("subtract", ExprShape.BINARY),
    MULTIPLY("multiply", ExprShape.BINARY),
    DIVIDE("divide", ExprShape.BINARY),
    REMAINDER("remainder", ExprShape.BINARY),
    POWER("power", ExprShape.BINARY),

    // 比较
    EQUAL("equal", ExprShape.BINARY),
    NOT_EQUAL("notEqual", ExprShape.BINARY),
    GREATER("greater", ExprShape.BINARY),
    GREATER_EQUAL("greaterEqual", ExprShape.BINARY),
    LESS("less", ExprShape.BINARY),
    LESS_EQUAL("lessEqual", ExprShape.BINARY),

    // 短路逻辑
    AND("and", ExprShape.BINARY),
    OR("or", ExprShape.BINARY),

    IF_ELSE("ifElse", ExprShape.TERNARY);

    private static final Map<String, ExprKind> BY_WIRE_NAME = new HashMap<>();

    static {
        for (ExprKind kind : values()) {
            BY_WIRE_NAME.put(kind.wireName, kind);
        }
        // 编辑器把文本转换写作 toString，读取时一并接受
        BY_WIRE_NAME.put("toString", TO_TEXT);
    }

    private final String wireName;
    private final ExprShape shape;
    private final int variateParams;

    ExprKind(String wireName, ExprShape shape) {
        this(wireName, shape, 0);
    }

    ExprKind(String wireName, ExprShape shape, int variateParams) {
        this.wireName = wireName;
        this.shape = shape;
        this.variateParams = variateParams;
    }

    public String wireName() {
        return wireName;
    }

    public ExprShape shape() {
        return shape;
    }

    public int variateParams() {
        return variateParams;
    }

    /**
     * 按序列化名称查找，找不到返回 null。
     */
    public static ExprKind fromWireName(String name) {
        return BY_WIRE_NAME.get(name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
