package com.tidypipe.backend.engine;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.tidypipe.Fixtures;
import com.tidypipe.backend.value.Table;
import com.tidypipe.common.ErrorKind;
import com.tidypipe.common.PipelineException;

import static org.junit.jupiter.api.Assertions.*;

public class JoinerTest {

    @Test
    public void testSingleRowJoin() throws Exception {
        Table joined = Joiner.join(Fixtures.single(), "first", Fixtures.pair(), "first");
        assertEquals(List.of("_join_", "right_second"), joined.getColumns());
        assertEquals(1, joined.size());
        assertEquals(1.0, joined.getRow(0).get("_join_"));
        assertEquals(100.0, joined.getRow(0).get("right_second"));
    }

    @Test
    public void testAllMatchingPairsInLeftThenRightOrder() throws Exception {
        Table left = Table.builder(List.of("k", "v")).addRow(1, "a").addRow(2, "b").addRow(1, "c").build();
        Table right = Table.builder(List.of("k", "w")).addRow(1, "x").addRow(1, "y").addRow(3, "z").build();
        Table joined = Joiner.join(left, "k", right, "k");
        assertEquals(List.of("_join_", "left_v", "right_w"), joined.getColumns());
        assertEquals(List.of("a", "a", "c", "c"), joined.column("left_v"));
        assertEquals(List.of("x", "y", "x", "y"), joined.column("right_w"));
    }

    @Test
    public void testMissingKeysNeverMatch() throws Exception {
        Table left = Table.builder(List.of("k")).addRow((Object) null).addRow(1).build();
        Table right = Table.builder(List.of("k")).addRow((Object) null).addRow(1).build();
        Table joined = Joiner.join(left, "k", right, "k");
        assertEquals(1, joined.size());
        assertEquals(1.0, joined.getRow(0).get("_join_"));
    }

    @Test
    public void testDifferentKeyColumns() throws Exception {
        Table joined = Joiner.join(Fixtures.colors(), "red", Fixtures.colors(), "green");
        assertEquals(List.of("_join_", "left_name", "left_green", "left_blue",
                "right_name", "right_red", "right_blue"), joined.getColumns());
        // red 取值 0 x6、128 x1、255 x4，green 取值 0 x6、128 x1、255 x4
        assertEquals(6 * 6 + 1 + 4 * 4, joined.size());
    }

    @Test
    public void testErrors() {
        PipelineException e = assertThrows(PipelineException.class,
                () -> Joiner.join(Fixtures.single(), "nope", Fixtures.pair(), "first"));
        assertEquals(ErrorKind.UNKNOWN_COLUMN, e.getKind());
        Table text = Table.builder(List.of("first")).addRow("1").build();
        e = assertThrows(PipelineException.class, () -> Joiner.join(Fixtures.single(), "first", text, "first"));
        assertEquals(ErrorKind.TYPE_MISMATCH, e.getKind());
    }

    @Test
    public void testEmptySides() throws Exception {
        Table empty = Table.empty(List.of("first"));
        Table joined = Joiner.join(empty, "first", Fixtures.pair(), "first");
        assertTrue(joined.isEmpty());
        assertEquals(List.of("_join_", "right_second"), joined.getColumns());
    }
}
