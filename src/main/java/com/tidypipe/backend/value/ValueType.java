package com.tidypipe.backend.value;

import java.time.Instant;

/**
 * 运行期的值类型标签，负责同类型值之间的比较。
 */
public enum ValueType {
    MISSING("missing") {
        @Override
        public int compare(Object left, Object right) {
            return 0;
        }
    },

    NUMBER("number") {
        @Override
        public int compare(Object left, Object right) {
            return Double.compare((Double) left, (Double) right);
        }
    },

    TEXT("text") {
        @Override
        public int compare(Object left, Object right) {
            return ((String) left).compareTo((String) right);
        }
    },

    LOGICAL("logical") {
        @Override
        public int compare(Object left, Object right) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }
    },

    DATETIME("datetime") {
        @Override
        public int compare(Object left, Object right) {
            return ((Instant) left).compareTo((Instant) right);
        }
    };

    private final String label;

    ValueType(String label) {
        this.label = label;
    }

    /**
     * 比较两个同类型的值，调用方负责保证类型一致。
     */
    public abstract int compare(Object left, Object right);

    public static ValueType of(Object value) {
        if(value == Missing.MISSING) {
            return MISSING;
        }
        if(value instanceof Double) {
            return NUMBER;
        }
        if(value instanceof String) {
            return TEXT;
        }
        if(value instanceof Boolean) {
            return LOGICAL;
        }
        if(value instanceof Instant) {
            return DATETIME;
        }
        throw new IllegalArgumentException("Not a table value: " + value
                + (value == null ? "" : " (" + value.getClass().getName() + ")"));
    }

    @Override
    public String toString() {
        return label;
    }
}
