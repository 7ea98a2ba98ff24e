package com.tidypipe.api.entity;

import java.util.List;
import java.util.Map;

import com.tidypipe.common.RunResult;
import com.tidypipe.common.RunResultCodec;

/**
 * 结构化的运行结果：列名 + 行（MISSING 为 null，日期为 ISO-8601 字符串）。
 */
public class RunTableResult {
    private final List<String> columns;
    private final List<Map<String, Object>> rows;
    private final int rowCount;
    private final long elapsedNanos;

    private RunTableResult(List<String> columns, List<Map<String, Object>> rows, long elapsedNanos) {
        this.columns = columns;
        this.rows = rows;
        this.rowCount = rows.size();
        this.elapsedNanos = elapsedNanos;
    }

    public static RunTableResult from(RunResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result must not be null");
        }
        return new RunTableResult(result.getTable().getColumns(), RunResultCodec.plainRows(result),
                result.getElapsedNanos());
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rowCount;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }
}
