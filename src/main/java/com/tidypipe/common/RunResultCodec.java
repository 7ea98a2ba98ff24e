package com.tidypipe.common;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.tidypipe.backend.value.Values;

/**
 * Codec 编码器
 * 把 {@link RunResult} 编码成 JSON：MISSING 写作 null，日期写作 ISO-8601 字符串，整数不带小数点。
 * 这是 MISSING 变成 null 的唯一位置。
 */
public final class RunResultCodec {

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private RunResultCodec() {
    }

    public static byte[] encode(RunResult result) {
        return toJson(result).getBytes(StandardCharsets.UTF_8);
    }

    public static String toJson(RunResult result) {
        return GSON.toJson(Content.from(result));
    }

    /**
     * 表的普通 Java 表示：每行一个 列名 -> 值 的有序映射。
     */
    public static List<Map<String, Object>> plainRows(RunResult result) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> row : result.getTable().getRows()) {
            Map<String, Object> plain = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : row.entrySet()) {
                plain.put(e.getKey(), Values.toPlain(e.getValue()));
            }
            rows.add(plain);
        }
        return rows;
    }

    private static class Content {
        List<String> columns;
        List<Map<String, Object>> table;
        String error;
        String errorKind;
        long elapsedNanos;

        static Content from(RunResult result) {
            Content content = new Content();
            content.columns = new ArrayList<>(result.getTable().getColumns());
            content.table = plainRows(result);
            content.error = result.getError();
            content.errorKind = result.getErrorKind() == null ? null : result.getErrorKind().name();
            content.elapsedNanos = result.getElapsedNanos();
            return content;
        }
    }
}
