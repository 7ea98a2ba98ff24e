package com.tidypipe.backend.parser;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.tidypipe.backend.expr.BinaryExpr;
import com.tidypipe.backend.expr.Expr;
import com.tidypipe.backend.expr.ExprKind;
import com.tidypipe.backend.expr.TernaryExpr;
import com.tidypipe.backend.expr.UnaryExpr;
import com.tidypipe.backend.expr.ValueExpr;
import com.tidypipe.backend.expr.VariateExpr;
import com.tidypipe.backend.value.Missing;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;

/**
 * 表达式的数组序列化格式：{@code ["@expr", kind, ...children]}。
 * <p>
 * 叶子节点的子元素是标量：数字、字符串、布尔、ISO-8601 日期字符串，MISSING 写作 null。
 * 保证 {@code serialize(deserialize(x))} 与 x 相等（按 JSON 值比较）。
 */
public final class ExprCodec {

    private static final Gson GSON = new Gson();
    private static final DateTimeFormatter DATETIME_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSX").withZone(ZoneOffset.UTC);

    private ExprCodec() {
    }

    public static String toJson(Expr expr) {
        return GSON.toJson(serialize(expr));
    }

    public static Expr fromJson(String json) throws PipelineException {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw Error.malformedExpression("Expression is not valid JSON: " + e.getMessage());
        }
        return deserialize(element);
    }

    public static JsonArray serialize(Expr expr) {
        JsonArray array = new JsonArray();
        array.add(Expr.TAG);
        array.add(expr.kind().wireName());
        switch (expr.shape()) {
            case VALUE:
                array.add(scalar(((ValueExpr) expr).value()));
                break;
            case ROWNUM:
                break;
            case VARIATE:
                for (Double param : ((VariateExpr) expr).params()) {
                    array.add(number(param));
                }
                break;
            case UNARY:
                array.add(serialize(((UnaryExpr) expr).arg()));
                break;
            case BINARY:
                array.add(serialize(((BinaryExpr) expr).left()));
                array.add(serialize(((BinaryExpr) expr).right()));
                break;
            case TERNARY:
                TernaryExpr t = (TernaryExpr) expr;
                array.add(serialize(t.left()));
                array.add(serialize(t.middle()));
                array.add(serialize(t.right()));
                break;
        }
        return array;
    }

    public static boolean isExpression(JsonElement element) {
        if(!element.isJsonArray() || element.getAsJsonArray().size() < 2) {
            return false;
        }
        JsonElement tag = element.getAsJsonArray().get(0);
        return tag.isJsonPrimitive() && Expr.TAG.equals(tag.getAsString());
    }

    public static Expr deserialize(JsonElement element) throws PipelineException {
        if(!isExpression(element)) {
            throw Error.malformedExpression("Not an expression: " + element);
        }
        JsonArray array = element.getAsJsonArray();
        JsonElement kindElement = array.get(1);
        ExprKind kind = kindElement.isJsonPrimitive() ? ExprKind.fromWireName(kindElement.getAsString()) : null;
        if(kind == null) {
            throw Error.malformedExpression("Unknown expression kind " + kindElement);
        }
        int operands = array.size() - 2;
        switch (kind.shape()) {
            case VALUE:
                expectOperands(kind, operands, 1);
                return Expr.literal(kind, literal(kind, array.get(2)));
            case ROWNUM:
                expectOperands(kind, operands, 0);
                return Expr.rownum();
            case VARIATE: {
                expectOperands(kind, operands, kind.variateParams());
                List<Double> params = new ArrayList<>();
                for (int i = 2; i < array.size(); i++) {
                    params.add(numberParam(kind, array.get(i)));
                }
                return Expr.variate(kind, params);
            }
            case UNARY:
                expectOperands(kind, operands, 1);
                return Expr.unary(kind, child(kind, array.get(2)));
            case BINARY:
                expectOperands(kind, operands, 2);
                return Expr.binary(kind, child(kind, array.get(2)), child(kind, array.get(3)));
            default:
                expectOperands(kind, operands, 3);
                return Expr.ternary(kind, child(kind, array.get(2)), child(kind, array.get(3)),
                        child(kind, array.get(4)));
        }
    }

    private static void expectOperands(ExprKind kind, int actual, int expected) throws PipelineException {
        if(actual != expected) {
            throw Error.malformedExpression(kind + " requires " + expected + " operand(s), got " + actual);
        }
    }

    private static Expr child(ExprKind kind, JsonElement element) throws PipelineException {
        if(!isExpression(element)) {
            throw Error.malformedExpression("Require expression as child of " + kind + ", got " + element);
        }
        return deserialize(element);
    }

    private static double numberParam(ExprKind kind, JsonElement element) throws PipelineException {
        if(!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw Error.malformedExpression(kind + " parameters must be numbers, got " + element);
        }
        return element.getAsDouble();
    }

    private static Object literal(ExprKind kind, JsonElement element) throws PipelineException {
        if(element.isJsonNull()) {
            return Missing.MISSING;
        }
        if(!element.isJsonPrimitive()) {
            throw Error.malformedExpression(kind + " value must be a scalar, got " + element);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        switch (kind) {
            case NUMBER:
                if(!primitive.isNumber()) {
                    throw Error.malformedExpression("Numeric value must be missing or number");
                }
                return primitive.getAsDouble();
            case LOGICAL:
                if(!primitive.isBoolean()) {
                    throw Error.malformedExpression("Logical value must be missing or true/false");
                }
                return primitive.getAsBoolean();
            case DATETIME:
                if(!primitive.isString()) {
                    throw Error.malformedExpression("Datetime value must be missing or an ISO-8601 string");
                }
                try {
                    return Instant.parse(primitive.getAsString());
                } catch (DateTimeParseException e) {
                    throw Error.malformedExpression("Invalid datetime literal " + primitive.getAsString());
                }
            default:
                // column / text
                if(!primitive.isString()) {
                    throw Error.malformedExpression(kind + " value must be a string");
                }
                return primitive.getAsString();
        }
    }

    private static JsonElement scalar(Object value) {
        if(value == Missing.MISSING) {
            return JsonNull.INSTANCE;
        }
        if(value instanceof Double) {
            return number((Double) value);
        }
        if(value instanceof Boolean) {
            return new JsonPrimitive((Boolean) value);
        }
        if(value instanceof Instant) {
            return new JsonPrimitive(datetime((Instant) value));
        }
        return new JsonPrimitive(value.toString());
    }

    /**
     * 日期写成带毫秒的 UTC 形式（与 Date.toJSON 一致），精度超过毫秒时保留完整的 ISO-8601 文本。
     */
    static String datetime(Instant value) {
        if(value.getNano() % 1_000_000 != 0) {
            return value.toString();
        }
        return DATETIME_FORMAT.format(value);
    }

    /**
     * 整数值写成不带小数点的形式，与 JSON 编辑器输出保持一致。
     */
    static JsonPrimitive number(double value) {
        if(value == Math.rint(value) && Math.abs(value) < 1e15) {
            return new JsonPrimitive((long) value);
        }
        return new JsonPrimitive(value);
    }
}
