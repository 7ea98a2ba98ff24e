package com.tidypipe.common;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.tidypipe.backend.value.Table;

import static org.junit.jupiter.api.Assertions.*;

public class ConsoleResultFormatterTest {

    private final ResultFormatter formatter = new ConsoleResultFormatter();

    private String format(RunResult result) {
        return new String(formatter.format(result), StandardCharsets.UTF_8);
    }

    @Test
    public void testTable() {
        Table table = Table.builder(List.of("name", "red")).addRow("black", 0).addRow("maroon", null).build();
        String expected = String.join("\n",
                "+--------+---------+",
                "| name   | red     |",
                "+--------+---------+",
                "| black  | 0       |",
                "| maroon | MISSING |",
                "+--------+---------+",
                "2 rows (0.00 sec)");
        assertEquals(expected, format(RunResult.success(table, 1000)));
    }

    @Test
    public void testSingleRowAndNoColumns() {
        Table one = Table.builder(List.of("n")).addRow(1.5).build();
        assertTrue(format(RunResult.success(one, 0)).endsWith("1 row (0.00 sec)"));
        assertEquals("0 rows (0.00 sec)", format(RunResult.success(Table.empty(), 0)));
    }

    @Test
    public void testError() {
        RunResult failed = RunResult.failure(new PipelineException(ErrorKind.TYPE_MISMATCH, "Require equal types"), 0);
        assertEquals("ERROR (TYPE_MISMATCH): Require equal types (0.00 sec)", format(failed));
    }
}
