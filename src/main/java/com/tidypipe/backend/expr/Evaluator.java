package com.tidypipe.backend.expr;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.tidypipe.backend.value.Missing;
import com.tidypipe.backend.value.ValueType;
import com.tidypipe.backend.value.Values;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;

/**
 * 行级求值器：{@code evaluate(node, row, rowIndex) -> value}。
 * <p>
 * 规则：
 * <ul>
 *     <li>算术、比较、类型转换中任一操作数为 MISSING，结果为 MISSING</li>
 *     <li>and / or 短路求值，返回决定结果的那个操作数本身</li>
 *     <li>算术结果经过 {@link Values#safe(double)}，非有限值折叠为 MISSING</li>
 *     <li>转换失败（非法日期、无法解析的数字）返回 MISSING，不报错</li>
 * </ul>
 */
public class Evaluator {

    /** 与 JavaScript Date 相同的可表示范围（毫秒） */
    private static final double MAX_EPOCH_MILLIS = 8.64e15;

    /** 取文本开头的数字前缀，"12.5kg" 解析为 12.5 */
    private static final Pattern NUMBER_PREFIX =
            Pattern.compile("^\\s*([+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?)");

    private final EvalContext context;

    public Evaluator(EvalContext context) {
        this.context = context;
    }

    public Evaluator() {
        this(EvalContext.defaults());
    }

    public EvalContext getContext() {
        return context;
    }

    public Object evaluate(Expr expr, Map<String, Object> row, int rowIndex) throws PipelineException {
        switch (expr.kind()) {
            case COLUMN:
                return column((String) ((ValueExpr) expr).value(), row);
            case DATETIME:
            case LOGICAL:
            case NUMBER:
            case TEXT:
                return ((ValueExpr) expr).value();
            case ROWNUM:
                return (double) rowIndex;

            case EXPONENTIAL:
                return exponential(((VariateExpr) expr).param(0));
            case NORMAL: {
                VariateExpr v = (VariateExpr) expr;
                return Values.safe(v.param(0) + v.param(1) * context.getRandom().nextGaussian());
            }
            case UNIFORM: {
                VariateExpr v = (VariateExpr) expr;
                return Values.safe(v.param(0) + (v.param(1) - v.param(0)) * context.getRandom().nextDouble());
            }

            case NEGATE: {
                Object value = arg(expr, row, rowIndex);
                checkNumber(value, expr.kind());
                return Values.isMissing(value) ? Missing.MISSING : Values.safe(-(Double) value);
            }
            case NOT: {
                Object value = arg(expr, row, rowIndex);
                return Values.isMissing(value) ? Missing.MISSING : !Values.isTruthy(value);
            }

            case IS_DATETIME:
                return typeCheck(arg(expr, row, rowIndex), ValueType.DATETIME);
            case IS_LOGICAL:
                return typeCheck(arg(expr, row, rowIndex), ValueType.LOGICAL);
            case IS_NUMBER:
                return typeCheck(arg(expr, row, rowIndex), ValueType.NUMBER);
            case IS_TEXT:
                return typeCheck(arg(expr, row, rowIndex), ValueType.TEXT);
            case IS_MISSING:
                return Values.isMissing(arg(expr, row, rowIndex));

            case TO_LOGICAL: {
                Object value = arg(expr, row, rowIndex);
                return Values.isMissing(value) ? Missing.MISSING : Values.isTruthy(value);
            }
            case TO_DATETIME:
                return toDatetime(arg(expr, row, rowIndex));
            case TO_NUMBER:
                return toNumber(arg(expr, row, rowIndex));
            case TO_TEXT: {
                Object value = arg(expr, row, rowIndex);
                return Values.isMissing(value) ? Missing.MISSING : Values.toText(value);
            }

            case TO_YEAR:
            case TO_MONTH:
            case TO_DAY:
            case TO_WEEKDAY:
            case TO_HOURS:
            case TO_MINUTES:
            case TO_SECONDS:
                return dateField(expr.kind(), arg(expr, row, rowIndex));

            case ADD:
                return arithmetic((BinaryExpr) expr, row, rowIndex, Double::sum);
            case SUBTRACT:
                return arithmetic((BinaryExpr) expr, row, rowIndex, (l, r) -> l - r);
            case MULTIPLY:
                return arithmetic((BinaryExpr) expr, row, rowIndex, (l, r) -> l * r);
            case DIVIDE:
                return arithmetic((BinaryExpr) expr, row, rowIndex, (l, r) -> l / r);
            case REMAINDER:
                return arithmetic((BinaryExpr) expr, row, rowIndex, (l, r) -> l % r);
            case POWER:
                return arithmetic((BinaryExpr) expr, row, rowIndex, Math::pow);

            case EQUAL:
            case NOT_EQUAL:
            case GREATER:
            case GREATER_EQUAL:
            case LESS:
            case LESS_EQUAL:
                return comparison((BinaryExpr) expr, row, rowIndex);

            case AND: {
                BinaryExpr b = (BinaryExpr) expr;
                Object left = evaluate(b.left(), row, rowIndex);
                if(!Values.isTruthy(left)) {
                    return left;
                }
                return evaluate(b.right(), row, rowIndex);
            }
            case OR: {
                BinaryExpr b = (BinaryExpr) expr;
                Object left = evaluate(b.left(), row, rowIndex);
                if(Values.isTruthy(left)) {
                    return left;
                }
                return evaluate(b.right(), row, rowIndex);
            }

            case IF_ELSE: {
                TernaryExpr t = (TernaryExpr) expr;
                Object cond = evaluate(t.left(), row, rowIndex);
                if(Values.isMissing(cond)) {
                    return Missing.MISSING;
                }
                return Values.isTruthy(cond)
                        ? evaluate(t.middle(), row, rowIndex)
                        : evaluate(t.right(), row, rowIndex);
            }

            default:
                throw Error.malformedExpression("Unknown expression kind " + expr.kind());
        }
    }

    private Object column(String name, Map<String, Object> row) throws PipelineException {
        if(!row.containsKey(name)) {
            throw Error.unknownColumn(name);
        }
        return row.get(name);
    }

    private Object arg(Expr expr, Map<String, Object> row, int rowIndex) throws PipelineException {
        return evaluate(((UnaryExpr) expr).arg(), row, rowIndex);
    }

    private Object exponential(double rate) {
        // 逆变换抽样，1 - u 落在 (0, 1]
        double u = context.getRandom().nextDouble();
        return Values.safe(-Math.log(1.0 - u) / rate);
    }

    private Object typeCheck(Object value, ValueType expected) {
        if(Values.isMissing(value)) {
            return Missing.MISSING;
        }
        return ValueType.of(value) == expected;
    }

    private Object arithmetic(BinaryExpr expr, Map<String, Object> row, int rowIndex,
                              DoubleBinaryOperator func) throws PipelineException {
        Object left = evaluate(expr.left(), row, rowIndex);
        checkNumber(left, expr.kind());
        Object right = evaluate(expr.right(), row, rowIndex);
        checkNumber(right, expr.kind());
        if(Values.isMissing(left) || Values.isMissing(right)) {
            return Missing.MISSING;
        }
        return Values.safe(func.applyAsDouble((Double) left, (Double) right));
    }

    private static void checkNumber(Object value, ExprKind kind) throws PipelineException {
        ValueType type = ValueType.of(value);
        if(type != ValueType.NUMBER && type != ValueType.MISSING) {
            throw Error.requireNumber(kind.wireName());
        }
    }

    private Object comparison(BinaryExpr expr, Map<String, Object> row, int rowIndex) throws PipelineException {
        Object left = evaluate(expr.left(), row, rowIndex);
        Object right = evaluate(expr.right(), row, rowIndex);
        if(Values.isMissing(left) || Values.isMissing(right)) {
            return Missing.MISSING;
        }
        ValueType leftType = ValueType.of(left);
        ValueType rightType = ValueType.of(right);
        if(leftType != rightType) {
            throw Error.typeMismatch(expr.kind().wireName(), leftType, rightType);
        }
        int cmp = leftType.compare(left, right);
        switch (expr.kind()) {
            case EQUAL:
                return cmp == 0;
            case NOT_EQUAL:
                return cmp != 0;
            case GREATER:
                return cmp > 0;
            case GREATER_EQUAL:
                return cmp >= 0;
            case LESS:
                return cmp < 0;
            default:
                return cmp <= 0;
        }
    }

    private Object toNumber(Object value) {
        switch (ValueType.of(value)) {
            case LOGICAL:
                return (Boolean) value ? 1.0 : 0.0;
            case DATETIME:
                return (double) ((Instant) value).toEpochMilli();
            case TEXT:
                Matcher m = NUMBER_PREFIX.matcher((String) value);
                if(!m.find()) {
                    return Missing.MISSING;
                }
                return Values.safe(Double.parseDouble(m.group(1)));
            default:
                // NUMBER 原样返回，MISSING 继续传播
                return value;
        }
    }

    private Object toDatetime(Object value) {
        switch (ValueType.of(value)) {
            case DATETIME:
                return value;
            case NUMBER:
                double millis = (Double) value;
                if(Math.abs(millis) > MAX_EPOCH_MILLIS) {
                    return Missing.MISSING;
                }
                return Instant.ofEpochMilli((long) millis);
            case TEXT:
                return parseDatetime(((String) value).trim());
            default:
                return Missing.MISSING;
        }
    }

    /**
     * 依次尝试 ISO 时间点、带偏移时间、本地时间、本地日期；不带时区的按配置时区解释。
     */
    private Object parseDatetime(String text) {
        if(text.isEmpty()) {
            return Missing.MISSING;
        }
        String iso = text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        try {
            return Instant.parse(iso);
        } catch (DateTimeParseException ignore) {
            // 继续尝试其它格式
        }
        try {
            return OffsetDateTime.parse(iso).toInstant();
        } catch (DateTimeParseException ignore) {
            // 继续尝试其它格式
        }
        try {
            return LocalDateTime.parse(iso).atZone(context.getZone()).toInstant();
        } catch (DateTimeParseException ignore) {
            // 继续尝试其它格式
        }
        try {
            return LocalDate.parse(iso).atStartOfDay(context.getZone()).toInstant();
        } catch (DateTimeException e) {
            return Missing.MISSING;
        }
    }

    private Object dateField(ExprKind kind, Object value) throws PipelineException {
        if(Values.isMissing(value)) {
            return Missing.MISSING;
        }
        if(ValueType.of(value) != ValueType.DATETIME) {
            throw Error.requireDatetime(kind.wireName());
        }
        ZonedDateTime when = ((Instant) value).atZone(context.getZone());
        switch (kind) {
            case TO_YEAR:
                return (double) when.getYear();
            case TO_MONTH:
                return (double) when.getMonthValue();
            case TO_DAY:
                return (double) when.getDayOfMonth();
            case TO_WEEKDAY:
                // ISO 编号：周一 = 1 … 周日 = 7
                return (double) when.getDayOfWeek().getValue();
            case TO_HOURS:
                return (double) when.getHour();
            case TO_MINUTES:
                return (double) when.getMinute();
            default:
                return (double) when.getSecond();
        }
    }
}
