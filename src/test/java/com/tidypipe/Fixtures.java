package com.tidypipe;

import java.util.List;

import com.tidypipe.backend.value.Table;

/**
 * 测试共用的数据表。
 */
public final class Fixtures {

    private Fixtures() {
    }

    /** 11 种颜色的 RGB 值 */
    public static Table colors() {
        return Table.builder(List.of("name", "red", "green", "blue"))
                .addRow("black", 0, 0, 0)
                .addRow("red", 255, 0, 0)
                .addRow("maroon", 128, 0, 0)
                .addRow("lime", 0, 255, 0)
                .addRow("green", 0, 128, 0)
                .addRow("yellow", 255, 255, 0)
                .addRow("blue", 0, 0, 255)
                .addRow("navy", 0, 0, 128)
                .addRow("fuchsia", 255, 0, 255)
                .addRow("aqua", 0, 255, 255)
                .addRow("white", 255, 255, 255)
                .build();
    }

    /** 单行单列 {first: 1} */
    public static Table single() {
        return Table.builder(List.of("first")).addRow(1).build();
    }

    /** 单行两列 {first: 1, second: 100} */
    public static Table pair() {
        return Table.builder(List.of("first", "second")).addRow(1, 100).build();
    }

    /** 一列 letter，值依次为 A A B C C C */
    public static Table letters() {
        return Table.builder(List.of("letter"))
                .addRow("A").addRow("A").addRow("B")
                .addRow("C").addRow("C").addRow("C")
                .build();
    }
}
