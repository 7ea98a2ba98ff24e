package com.tidypipe.api.entity.enums;

/**
 * 运行结果返回格式：文本表格或结构化行。
 */
public enum ResponseFormat {
    TEXT,
    STRUCTURED;

    public boolean isText() {
        return this == TEXT;
    }
}
