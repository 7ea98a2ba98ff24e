package com.tidypipe.api.entity.response;

/**
 * 通用运行响应，getData 可为文本或结构化结果。
 */
public class RunResponse<T> {

    private final boolean success;
    private final T data;
    private final String error;

    private RunResponse(boolean success, T data, String error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static <T> RunResponse<T> success(T data) {
        return new RunResponse<>(true, data, null);
    }

    public static <T> RunResponse<T> failure(String message) {
        return new RunResponse<>(false, null, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public T getData() {
        return data;
    }

    public String getError() {
        return error;
    }
}
