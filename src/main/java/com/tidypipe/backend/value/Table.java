package com.tidypipe.backend.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * 内存表：有序的列名列表 + 有序的行。
 * <p>
 * 不变式：每一行的列集合与 {@link #getColumns()} 完全一致，行内按列顺序存放；
 * 单元格只可能是 Double / String / Boolean / Instant / {@link Missing#MISSING}。
 * 零行表是合法的，并且仍然保留列信息，便于在空表上检查未知列。
 */
public final class Table {

    private final ImmutableList<String> columns;
    private final List<Map<String, Object>> rows;

    private Table(ImmutableList<String> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = Collections.unmodifiableList(rows);
    }

    public static Table empty() {
        return new Table(ImmutableList.of(), new ArrayList<>());
    }

    public static Table empty(List<String> columns) {
        return builder(columns).build();
    }

    /**
     * 从任意行构建表，值会被规范化，列按 columns 顺序重排。
     */
    public static Table of(List<String> columns, List<? extends Map<String, ?>> rows) {
        Builder builder = builder(columns);
        for (Map<String, ?> row : rows) {
            builder.addRow(row);
        }
        return builder.build();
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public Map<String, Object> getRow(int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * 取某一列的全部值（按行顺序）。
     */
    public List<Object> column(String column) {
        Preconditions.checkArgument(hasColumn(column), "no column %s", column);
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) {
            return true;
        }
        if(!(o instanceof Table)) {
            return false;
        }
        Table other = (Table) o;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Table" + columns + rows;
    }

    public static final class Builder {
        private final ImmutableList<String> columns;
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            Set<String> unique = new LinkedHashSet<>(columns);
            Preconditions.checkArgument(unique.size() == columns.size(), "duplicate column in %s", columns);
            this.columns = ImmutableList.copyOf(columns);
        }

        public Builder addRow(Map<String, ?> row) {
            Preconditions.checkArgument(row.size() == columns.size() && row.keySet().containsAll(columns),
                    "row %s does not match columns %s", row.keySet(), columns);
            Map<String, Object> copy = new LinkedHashMap<>();
            for (String column : columns) {
                copy.put(column, Values.normalize(row.get(column)));
            }
            rows.add(Collections.unmodifiableMap(copy));
            return this;
        }

        public Builder addRow(Object... values) {
            Preconditions.checkArgument(values.length == columns.size(),
                    "expected %s values, got %s", columns.size(), values.length);
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < values.length; i++) {
                row.put(columns.get(i), values[i]);
            }
            return addRow(row);
        }

        public Table build() {
            return new Table(columns, rows);
        }
    }
}
