package com.tidypipe.backend.value;

import java.time.Instant;
import java.util.Date;

/**
 * 值模型的工具方法：规范化、真值判断、相等性以及文本化。
 */
public final class Values {

    private Values() {
    }

    /**
     * 把外部传入的 Java 对象规范化为表中的值。
     * null → MISSING，所有数字统一为 Double，非有限数字 → MISSING，Date → Instant。
     */
    public static Object normalize(Object raw) {
        if(raw == null || raw == Missing.MISSING) {
            return Missing.MISSING;
        }
        if(raw instanceof Number) {
            return safe(((Number) raw).doubleValue());
        }
        if(raw instanceof String || raw instanceof Boolean || raw instanceof Instant) {
            return raw;
        }
        if(raw instanceof Date) {
            return ((Date) raw).toInstant();
        }
        throw new IllegalArgumentException("Unsupported value type: " + raw.getClass().getName());
    }

    /**
     * 算术结果过滤：非有限值折叠为 MISSING，-0.0 统一为 0.0。
     */
    public static Object safe(double value) {
        if(!Double.isFinite(value)) {
            return Missing.MISSING;
        }
        return value == 0.0 ? 0.0 : value;
    }

    public static boolean isMissing(Object value) {
        return value == Missing.MISSING;
    }

    /**
     * 真值判断：MISSING、false、0、空字符串为假，其余为真。
     */
    public static boolean isTruthy(Object value) {
        switch (ValueType.of(value)) {
            case MISSING:
                return false;
            case NUMBER:
                return (Double) value != 0.0;
            case TEXT:
                return !((String) value).isEmpty();
            case LOGICAL:
                return (Boolean) value;
            default:
                return true;
        }
    }

    /**
     * 同类型值相等。日期按时间点比较。调用方负责排除 MISSING 并检查类型。
     */
    public static boolean equal(Object left, Object right) {
        return ValueType.of(left).compare(left, right) == 0;
    }

    /**
     * 值的文本表示，整数值不带小数点。
     */
    public static String toText(Object value) {
        switch (ValueType.of(value)) {
            case MISSING:
                return "";
            case NUMBER:
                return formatNumber((Double) value);
            case DATETIME:
                return value.toString();
            default:
                return String.valueOf(value);
        }
    }

    public static String formatNumber(double value) {
        if(value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    /**
     * 对外展示时使用的普通 Java 值：MISSING → null，日期 → ISO-8601 字符串，整数 → Long。
     */
    public static Object toPlain(Object value) {
        switch (ValueType.of(value)) {
            case MISSING:
                return null;
            case NUMBER:
                double d = (Double) value;
                if(d == Math.rint(d) && Math.abs(d) < 1e15) {
                    return (long) d;
                }
                return d;
            case DATETIME:
                return value.toString();
            default:
                return value;
        }
    }
}
