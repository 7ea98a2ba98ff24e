package com.tidypipe.common;

/**
 * 统一的错误构造入口，引擎各处通过这里创建异常，保证提示信息格式一致。
 */
public final class Error {

    private Error() {
    }

    public static PipelineException typeError(String message) {
        return new PipelineException(ErrorKind.TYPE_ERROR, message);
    }

    public static PipelineException requireNumber(String operation) {
        return typeError("Require number for " + operation);
    }

    public static PipelineException requireDatetime(String operation) {
        return typeError("Require datetime for " + operation);
    }

    public static PipelineException typeMismatch(String operation, Object leftType, Object rightType) {
        return new PipelineException(ErrorKind.TYPE_MISMATCH,
                "Require equal types for " + operation + " (" + leftType + " vs " + rightType + ")");
    }

    public static PipelineException unknownColumn(String column) {
        return new PipelineException(ErrorKind.UNKNOWN_COLUMN, "Unknown column \"" + column + "\"");
    }

    public static PipelineException unknownRegistryName(String name) {
        return new PipelineException(ErrorKind.UNKNOWN_REGISTRY_NAME, "No table registered under \"" + name + "\"");
    }

    public static PipelineException malformedExpression(String message) {
        return new PipelineException(ErrorKind.MALFORMED_EXPRESSION, message);
    }

    public static PipelineException malformedPipeline(String message) {
        return new PipelineException(ErrorKind.MALFORMED_PIPELINE, message);
    }

    public static PipelineException malformedPipeline(String message, Throwable cause) {
        return new PipelineException(ErrorKind.MALFORMED_PIPELINE, message, cause);
    }

    public static PipelineException unknownDataset(String name) {
        return new PipelineException(ErrorKind.UNKNOWN_DATASET, "Unknown dataset \"" + name + "\"");
    }

    public static PipelineException unresolvedDependency(Iterable<String> names) {
        return new PipelineException(ErrorKind.UNRESOLVED_DEPENDENCY,
                "Pipelines wait for tables that are never published: " + String.join(", ", names));
    }
}
