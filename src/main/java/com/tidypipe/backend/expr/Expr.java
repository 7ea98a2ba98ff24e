package com.tidypipe.backend.expr;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.tidypipe.backend.value.Missing;
import com.tidypipe.backend.value.Values;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;

/**
 * 行级标量表达式的 AST 节点。
 * <p>
 * 节点是一个带标签的联合：{@link ExprKind} 决定变体，{@link ExprShape} 决定携带的字段
 * （{@link ValueExpr} / {@link RowNumExpr} / {@link VariateExpr} / {@link UnaryExpr} /
 * {@link BinaryExpr} / {@link TernaryExpr}）。求值、序列化、相等比较都按 kind / shape
 * 分派，节点本身只保存数据。子节点独占，构成一棵树。
 */
public abstract class Expr {

    /** 序列化数组的第一个元素，表示“这是一个表达式” */
    public static final String TAG = "@expr";

    private final ExprKind kind;

    Expr(ExprKind kind) {
        this.kind = kind;
    }

    public ExprKind kind() {
        return kind;
    }

    public ExprShape shape() {
        return kind.shape();
    }

    /**
     * 子节点，按序列化顺序排列；叶子节点返回空列表。
     */
    public abstract List<Expr> children();

    // ---------------------------------------------------------------- 构造

    public static Expr column(String name) throws PipelineException {
        if(name == null || name.isEmpty()) {
            throw Error.malformedExpression("Column name must be a non-empty string");
        }
        return new ValueExpr(ExprKind.COLUMN, name);
    }

    public static Expr number(double value) throws PipelineException {
        return literal(ExprKind.NUMBER, value);
    }

    public static Expr text(String value) throws PipelineException {
        return literal(ExprKind.TEXT, value);
    }

    public static Expr logical(boolean value) throws PipelineException {
        return literal(ExprKind.LOGICAL, value);
    }

    public static Expr datetime(Instant value) throws PipelineException {
        return literal(ExprKind.DATETIME, value);
    }

    /**
     * 构造字面量，值必须与 kind 匹配或者是 {@link Missing#MISSING}。
     */
    public static Expr literal(ExprKind kind, Object value) throws PipelineException {
        if(kind == ExprKind.COLUMN) {
            if(!(value instanceof String)) {
                throw Error.malformedExpression("Column name must be a non-empty string");
            }
            return column((String) value);
        }
        if(kind.shape() != ExprShape.VALUE) {
            throw Error.malformedExpression(kind + " is not a literal");
        }
        if(value == Missing.MISSING) {
            return new ValueExpr(kind, value);
        }
        switch (kind) {
            case NUMBER:
                if(!(value instanceof Double) || !Double.isFinite((Double) value)) {
                    throw Error.malformedExpression("Numeric value must be missing or a finite number");
                }
                // -0 与 0 视为同一个值
                return new ValueExpr(kind, Values.safe((Double) value));
            case TEXT:
                if(!(value instanceof String)) {
                    throw Error.malformedExpression("Text value must be missing or string");
                }
                break;
            case LOGICAL:
                if(!(value instanceof Boolean)) {
                    throw Error.malformedExpression("Logical value must be missing or true/false");
                }
                break;
            case DATETIME:
                if(!(value instanceof Instant)) {
                    throw Error.malformedExpression("Datetime value must be missing or date");
                }
                break;
            default:
                throw Error.malformedExpression(kind + " is not a literal");
        }
        return new ValueExpr(kind, value);
    }

    public static Expr rownum() {
        return RowNumExpr.INSTANCE;
    }

    public static Expr exponential(double rate) throws PipelineException {
        if(!Double.isFinite(rate) || rate <= 0) {
            throw Error.malformedExpression("Exponential rate must be a positive number");
        }
        return new VariateExpr(ExprKind.EXPONENTIAL, ImmutableList.of(rate));
    }

    public static Expr normal(double mean, double stdDev) throws PipelineException {
        if(!Double.isFinite(mean) || !Double.isFinite(stdDev) || stdDev < 0) {
            throw Error.malformedExpression("Normal distribution needs a finite mean and a non-negative standard deviation");
        }
        return new VariateExpr(ExprKind.NORMAL, ImmutableList.of(mean, stdDev));
    }

    public static Expr uniform(double low, double high) throws PipelineException {
        if(!Double.isFinite(low) || !Double.isFinite(high) || low > high) {
            throw Error.malformedExpression("Uniform distribution needs finite bounds with low <= high");
        }
        return new VariateExpr(ExprKind.UNIFORM, ImmutableList.of(low, high));
    }

    /**
     * 按 kind 构造随机变量节点，参数个数必须与 kind 一致。
     */
    public static Expr variate(ExprKind kind, List<Double> params) throws PipelineException {
        if(kind.shape() != ExprShape.VARIATE) {
            throw Error.malformedExpression(kind + " is not a random variate");
        }
        if(params.size() != kind.variateParams()) {
            throw Error.malformedExpression(kind + " requires " + kind.variateParams() + " parameter(s)");
        }
        switch (kind) {
            case EXPONENTIAL:
                return exponential(params.get(0));
            case NORMAL:
                return normal(params.get(0), params.get(1));
            default:
                return uniform(params.get(0), params.get(1));
        }
    }

    public static Expr unary(ExprKind kind, Expr arg) throws PipelineException {
        requireShape(kind, ExprShape.UNARY);
        requireChild(arg, "child", kind);
        return new UnaryExpr(kind, arg);
    }

    public static Expr binary(ExprKind kind, Expr left, Expr right) throws PipelineException {
        requireShape(kind, ExprShape.BINARY);
        requireChild(left, "left child", kind);
        requireChild(right, "right child", kind);
        return new BinaryExpr(kind, left, right);
    }

    public static Expr ternary(ExprKind kind, Expr left, Expr middle, Expr right) throws PipelineException {
        requireShape(kind, ExprShape.TERNARY);
        requireChild(left, "left child", kind);
        requireChild(middle, "middle child", kind);
        requireChild(right, "right child", kind);
        return new TernaryExpr(kind, left, middle, right);
    }

    public static Expr ifElse(Expr condition, Expr whenTrue, Expr whenFalse) throws PipelineException {
        return ternary(ExprKind.IF_ELSE, condition, whenTrue, whenFalse);
    }

    private static void requireShape(ExprKind kind, ExprShape shape) throws PipelineException {
        if(kind == null || kind.shape() != shape) {
            throw Error.malformedExpression(kind + " is not a " + shape.name().toLowerCase() + " expression");
        }
    }

    private static void requireChild(Expr child, String slot, ExprKind kind) throws PipelineException {
        if(child == null) {
            throw Error.malformedExpression("Require expression as " + slot + " of " + kind);
        }
    }

    // ---------------------------------------------------------------- 结构相等

    @Override
    public final boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Expr)) {
            return false;
        }
        Expr other = (Expr) o;
        if(kind != other.kind) {
            return false;
        }
        switch (shape()) {
            case VALUE:
                return ((ValueExpr) this).value().equals(((ValueExpr) other).value());
            case ROWNUM:
                return true;
            case VARIATE:
                return ((VariateExpr) this).params().equals(((VariateExpr) other).params());
            default:
                // 一元、二元、三元节点逐个比较子树
                return children().equals(other.children());
        }
    }

    @Override
    public final int hashCode() {
        switch (shape()) {
            case VALUE:
                return Objects.hash(kind, ((ValueExpr) this).value());
            case ROWNUM:
                return kind.hashCode();
            case VARIATE:
                return Objects.hash(kind, ((VariateExpr) this).params());
            default:
                return Objects.hash(kind, children());
        }
    }

    @Override
    public String toString() {
        switch (shape()) {
            case VALUE:
                return kind + "(" + ((ValueExpr) this).value() + ")";
            case ROWNUM:
                return kind + "()";
            case VARIATE:
                return kind + ((VariateExpr) this).params().toString();
            default:
                return kind + children().toString();
        }
    }
}
