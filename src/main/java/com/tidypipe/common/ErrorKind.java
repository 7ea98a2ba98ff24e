package com.tidypipe.common;

/**
 * 运行期错误分类。所有分类都会中止当前 pipeline 的运行。
 */
public enum ErrorKind {
    /** 操作数类型不满足运算要求，例如对文本做算术 */
    TYPE_ERROR,
    /** 比较运算两侧类型不同 */
    TYPE_MISMATCH,
    /** 引用了当前表中不存在的列 */
    UNKNOWN_COLUMN,
    /** join / lookup 了未发布的名字 */
    UNKNOWN_REGISTRY_NAME,
    /** 表达式节点不满足构造约束 */
    MALFORMED_EXPRESSION,
    /** operation 数组无法解析 */
    MALFORMED_PIPELINE,
    /** 数据源不认识该数据集 */
    UNKNOWN_DATASET,
    /** program 中存在永远无法满足的 join 依赖 */
    UNRESOLVED_DEPENDENCY
}
