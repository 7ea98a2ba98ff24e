package com.tidypipe.common;

/**
 * 引擎内唯一的受检异常，携带 {@link ErrorKind}。
 * 由 PipelineExecutor 统一转换为运行结果中的 error 字符串。
 */
public class PipelineException extends Exception {

    private final ErrorKind kind;

    public PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
