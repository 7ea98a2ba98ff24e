package com.tidypipe.common;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 控制台结果格式化器
 */
public class ConsoleResultFormatter implements ResultFormatter {

    @Override
    public byte[] format(RunResult result) {
        if(result.isSuccess()) {
            return formatTable(result);
        }
        return formatError(result);
    }

    private byte[] formatTable(RunResult result) {
        StringBuilder sb = new StringBuilder();
        if(!result.getTable().getColumns().isEmpty()) {
            sb.append(TextTableFormatter.format(result.getTable())).append("\n");
        }
        int rows = result.getTable().size();
        sb.append(rows).append(rows == 1 ? " row" : " rows")
                .append(" (").append(formatSeconds(result.getElapsedNanos())).append(" sec)");
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private byte[] formatError(RunResult result) {
        String kind = result.getErrorKind() == null ? "ERROR" : result.getErrorKind().name();
        String text = "ERROR (" + kind + "): " + result.getError()
                + " (" + formatSeconds(result.getElapsedNanos()) + " sec)";
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private String formatSeconds(long nanos) {
        double seconds = nanos / 1_000_000_000d;
        return String.format(Locale.ROOT, "%.2f", seconds);
    }
}
