package com.tidypipe.api.entity.request;

import com.tidypipe.api.entity.enums.ResponseFormat;

import javax.validation.constraints.NotBlank;

public class RunRequest {

    /**
     * JSON 文本：program、pipeline 数组均可
     */
    @NotBlank(message = "program must not be blank")
    private String program;

    /**
     * 返回格式：STRUCTURED（默认）或 TEXT
     */
    private ResponseFormat format;

    public String getProgram() {
        return program;
    }

    public void setProgram(String program) {
        this.program = program;
    }

    public ResponseFormat getFormat() {
        return format;
    }

    public void setFormat(ResponseFormat format) {
        this.format = format;
    }
}
