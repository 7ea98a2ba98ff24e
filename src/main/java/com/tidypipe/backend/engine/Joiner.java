package com.tidypipe.backend.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tidypipe.backend.parser.statement.Join;
import com.tidypipe.backend.value.Table;
import com.tidypipe.backend.value.ValueType;
import com.tidypipe.backend.value.Values;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;

/**
 * 两张表的等值内连接。
 * <p>
 * 输出列：{@code _join_}（共同的键值），随后是左表其余列（加 {@code left_} 前缀，保持原顺序），
 * 再是右表其余列（加 {@code right_} 前缀）。外层循环左表、内层循环右表，因此输出顺序稳定。
 * MISSING 键不与任何值匹配；两侧键类型不同时报 TYPE_MISMATCH。
 */
public final class Joiner {

    private Joiner() {
    }

    public static Table join(Table left, String leftColumn, Table right, String rightColumn) throws PipelineException {
        TableOperations.requireColumns(left, List.of(leftColumn));
        TableOperations.requireColumns(right, List.of(rightColumn));

        List<String> leftRest = without(left.getColumns(), leftColumn);
        List<String> rightRest = without(right.getColumns(), rightColumn);

        List<String> columns = new ArrayList<>();
        columns.add(Join.JOIN_COLUMN);
        for (String c : leftRest) {
            columns.add(Join.LEFT_PREFIX + c);
        }
        for (String c : rightRest) {
            columns.add(Join.RIGHT_PREFIX + c);
        }

        Table.Builder builder = Table.builder(columns);
        for (Map<String, Object> l : left.getRows()) {
            Object key = l.get(leftColumn);
            if(Values.isMissing(key)) {
                continue;
            }
            for (Map<String, Object> r : right.getRows()) {
                Object other = r.get(rightColumn);
                if(Values.isMissing(other)) {
                    continue;
                }
                ValueType lt = ValueType.of(key);
                ValueType rt = ValueType.of(other);
                if(lt != rt) {
                    throw Error.typeMismatch("join", lt, rt);
                }
                if(!Values.equal(key, other)) {
                    continue;
                }
                Map<String, Object> row = new LinkedHashMap<>();
                row.put(Join.JOIN_COLUMN, key);
                for (String c : leftRest) {
                    row.put(Join.LEFT_PREFIX + c, l.get(c));
                }
                for (String c : rightRest) {
                    row.put(Join.RIGHT_PREFIX + c, r.get(c));
                }
                builder.addRow(row);
            }
        }
        return builder.build();
    }

    private static List<String> without(List<String> columns, String removed) {
        List<String> rest = new ArrayList<>(columns);
        rest.remove(removed);
        return rest;
    }
}
