package com.tidypipe.common;

import com.tidypipe.backend.value.Table;

/**
 * 一次运行的结构化结果，供不同的输出层自定义格式化逻辑。
 * 成功时 error 为空串；失败时 table 为空表。
 */
public class RunResult {

    private final Table table;
    private final String error;
    private final ErrorKind errorKind;
    private final long elapsedNanos;

    private RunResult(Table table, String error, ErrorKind errorKind, long elapsedNanos) {
        this.table = table;
        this.error = error;
        this.errorKind = errorKind;
        this.elapsedNanos = elapsedNanos;
    }

    public static RunResult success(Table table, long elapsedNanos) {
        return new RunResult(table, "", null, elapsedNanos);
    }

    public static RunResult failure(PipelineException e, long elapsedNanos) {
        String message = e.getMessage() == null || e.getMessage().isEmpty() ? e.getKind().name() : e.getMessage();
        return new RunResult(Table.empty(), message, e.getKind(), elapsedNanos);
    }

    public Table getTable() {
        return table;
    }

    public String getError() {
        return error;
    }

    /** 成功时为 null */
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    public boolean isSuccess() {
        return error.isEmpty();
    }
}
