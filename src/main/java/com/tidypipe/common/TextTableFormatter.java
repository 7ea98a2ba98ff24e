package com.tidypipe.common;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.tidypipe.backend.value.Missing;
import com.tidypipe.backend.value.Table;
import com.tidypipe.backend.value.Values;

/**
 * 把 {@link Table} 渲染成 MySQL CLI 风格的 ASCII 表格。MISSING 单元格显示为 {@code MISSING}。
 */
public final class TextTableFormatter {
    private TextTableFormatter() {}

    public static String format(Table table) {
        List<String> headers = table.getColumns();
        List<List<String>> cells = new ArrayList<>(table.size());
        for (Map<String, Object> row : table.getRows()) {
            List<String> line = new ArrayList<>(headers.size());
            for (String column : headers) {
                line.add(cell(row.get(column)));
            }
            cells.add(line);
        }

        int[] widths = new int[headers.size()];
        for (int i = 0; i < headers.size(); i++) {
            widths[i] = headers.get(i).length();
        }
        for (List<String> line : cells) {
            for (int i = 0; i < widths.length; i++) {
                widths[i] = Math.max(widths[i], line.get(i).length());
            }
        }

        String horizontal = buildHorizontal(widths);
        StringBuilder sb = new StringBuilder();
        sb.append(horizontal).append("\n");
        sb.append(buildRow(headers, widths)).append("\n");
        sb.append(horizontal).append("\n");
        for (List<String> line : cells) {
            sb.append(buildRow(line, widths)).append("\n");
        }
        sb.append(horizontal);
        return sb.toString();
    }

    private static String cell(Object value) {
        return Values.isMissing(value) ? Missing.MISSING.toString() : Values.toText(value);
    }

    private static String buildHorizontal(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append("+");
        }
        return sb.toString();
    }

    private static String buildRow(List<String> values, int[] widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            sb.append(" ").append(value).append(" ".repeat(widths[i] - value.length())).append(" |");
        }
        return sb.toString();
    }
}
