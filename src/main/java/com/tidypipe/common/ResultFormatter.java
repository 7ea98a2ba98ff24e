package com.tidypipe.common;

/**
 * 定义运行结果到字节输出的转换，便于不同客户端实现自定义格式。
 */
public interface ResultFormatter {

    byte[] format(RunResult result);
}
