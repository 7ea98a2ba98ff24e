package com.tidypipe.backend.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tidypipe.backend.aggregator.AggregateContext;
import com.tidypipe.backend.expr.Evaluator;
import com.tidypipe.backend.expr.Expr;
import com.tidypipe.backend.parser.statement.GroupBy;
import com.tidypipe.backend.parser.statement.Summarize;
import com.tidypipe.backend.value.Table;
import com.tidypipe.backend.value.ValueType;
import com.tidypipe.backend.value.Values;
import com.tidypipe.common.Error;
import com.tidypipe.common.PipelineException;

/**
 * 单个表级操作的实现。所有方法都不修改输入表，返回新表；零行输入总是合法的。
 */
public final class TableOperations {

    private TableOperations() {
    }

    /**
     * 保留谓词为真值的行，谓词为 MISSING 的行被丢弃。
     */
    public static Table filter(Table table, Expr predicate, Evaluator evaluator) throws PipelineException {
        Table.Builder builder = Table.builder(table.getColumns());
        List<Map<String, Object>> rows = table.getRows();
        for (int i = 0; i < rows.size(); i++) {
            if(Values.isTruthy(evaluator.evaluate(predicate, rows.get(i), i))) {
                builder.addRow(rows.get(i));
            }
        }
        return builder.build();
    }

    /**
     * 新增或覆盖一列。覆盖时列的位置不变，新增的列追加在末尾。
     * 表达式看到的是修改前的行。
     */
    public static Table mutate(Table table, String column, Expr value, Evaluator evaluator) throws PipelineException {
        List<String> columns = new ArrayList<>(table.getColumns());
        if(!columns.contains(column)) {
            columns.add(column);
        }
        Table.Builder builder = Table.builder(columns);
        List<Map<String, Object>> rows = table.getRows();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = new LinkedHashMap<>(rows.get(i));
            row.put(column, evaluator.evaluate(value, rows.get(i), i));
            builder.addRow(row);
        }
        return builder.build();
    }

    public static Table select(Table table, List<String> columns) throws PipelineException {
        requireColumns(table, columns);
        Table.Builder builder = Table.builder(columns);
        for (Map<String, Object> row : table.getRows()) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (String column : columns) {
                projected.put(column, row.get(column));
            }
            builder.addRow(projected);
        }
        return builder.build();
    }

    /**
     * 稳定的多键排序。MISSING 小于同列的任何具体值；同一列中出现两种具体类型时报 TYPE_MISMATCH。
     */
    public static Table sort(Table table, List<String> columns, boolean descending) throws PipelineException {
        requireColumns(table, columns);
        for (String column : columns) {
            requireSingleType(table, column, "sort");
        }
        Comparator<Map<String, Object>> comparator = (a, b) -> {
            for (String column : columns) {
                int cmp = compareValues(a.get(column), b.get(column));
                if(cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
        if(descending) {
            comparator = comparator.reversed();
        }
        List<Map<String, Object>> rows = new ArrayList<>(table.getRows());
        rows.sort(comparator);
        return Table.of(table.getColumns(), rows);
    }

    /**
     * 按列值第一次出现的顺序编号，写入 {@code _group_} 列。MISSING 自成一组。
     */
    public static Table groupBy(Table table, String column) throws PipelineException {
        requireColumns(table, List.of(column));
        List<String> columns = new ArrayList<>(table.getColumns());
        if(!columns.contains(GroupBy.GROUP_COLUMN)) {
            columns.add(GroupBy.GROUP_COLUMN);
        }
        Map<Object, Double> groups = new LinkedHashMap<>();
        Table.Builder builder = Table.builder(columns);
        for (Map<String, Object> row : table.getRows()) {
            Object key = row.get(column);
            Double group = groups.get(key);
            if(group == null) {
                group = (double) groups.size();
                groups.put(key, group);
            }
            Map<String, Object> grouped = new LinkedHashMap<>(row);
            grouped.put(GroupBy.GROUP_COLUMN, group);
            builder.addRow(grouped);
        }
        return builder.build();
    }

    public static Table ungroup(Table table) {
        if(!table.hasColumn(GroupBy.GROUP_COLUMN)) {
            return table;
        }
        List<String> columns = new ArrayList<>(table.getColumns());
        columns.remove(GroupBy.GROUP_COLUMN);
        Table.Builder builder = Table.builder(columns);
        for (Map<String, Object> row : table.getRows()) {
            Map<String, Object> copy = new LinkedHashMap<>(row);
            copy.remove(GroupBy.GROUP_COLUMN);
            builder.addRow(copy);
        }
        return builder.build();
    }

    /**
     * 每个分组输出一行，按分组编号排序；未分组时整张表视为一组。空表输出零行。
     */
    public static Table summarize(Table table, List<Summarize.Item> items) throws PipelineException {
        boolean grouped = table.hasColumn(GroupBy.GROUP_COLUMN);
        // 先构造一次，空表上也能检查未知列
        AggregateContext probe = AggregateContext.of(table.getColumns(), items);

        List<String> columns = new ArrayList<>();
        if(grouped) {
            columns.add(GroupBy.GROUP_COLUMN);
        }
        columns.addAll(probe.labels());
        Table.Builder builder = Table.builder(columns);
        if(table.isEmpty()) {
            return builder.build();
        }

        Map<Object, AggregateContext> contexts = new LinkedHashMap<>();
        for (Map<String, Object> row : table.getRows()) {
            Object key = grouped ? row.get(GroupBy.GROUP_COLUMN) : GroupBy.GROUP_COLUMN;
            AggregateContext ctx = contexts.get(key);
            if(ctx == null) {
                ctx = AggregateContext.of(table.getColumns(), items);
                contexts.put(key, ctx);
            }
            ctx.accept(row);
        }

        List<Object> keys = new ArrayList<>(contexts.keySet());
        if(grouped) {
            requireSingleType(table, GroupBy.GROUP_COLUMN, "summarize");
            keys.sort(TableOperations::compareValues);
        }
        for (Object key : keys) {
            Map<String, Object> row = new LinkedHashMap<>();
            if(grouped) {
                row.put(GroupBy.GROUP_COLUMN, key);
            }
            row.putAll(contexts.get(key).toValueMap());
            builder.addRow(row);
        }
        return builder.build();
    }

    // ---------------------------------------------------------------- 工具

    static void requireColumns(Table table, List<String> columns) throws PipelineException {
        for (String column : columns) {
            if(!table.hasColumn(column)) {
                throw Error.unknownColumn(column);
            }
        }
    }

    /**
     * 同一列的具体值必须是同一种类型，MISSING 不参与判断。
     */
    private static void requireSingleType(Table table, String column, String operation) throws PipelineException {
        ValueType seen = null;
        for (Map<String, Object> row : table.getRows()) {
            ValueType type = ValueType.of(row.get(column));
            if(type == ValueType.MISSING) {
                continue;
            }
            if(seen == null) {
                seen = type;
            } else if(seen != type) {
                throw Error.typeMismatch(operation, seen, type);
            }
        }
    }

    /**
     * MISSING 排在前面，其余按同类型比较；调用方已经保证类型一致。
     */
    private static int compareValues(Object a, Object b) {
        boolean aMissing = Values.isMissing(a);
        boolean bMissing = Values.isMissing(b);
        if(aMissing || bMissing) {
            return aMissing == bMissing ? 0 : (aMissing ? -1 : 1);
        }
        return ValueType.of(a).compare(a, b);
    }
}
