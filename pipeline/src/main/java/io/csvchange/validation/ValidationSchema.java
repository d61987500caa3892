package io.csvchange.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared shape of a file: required columns, per-column rules, and whether undeclared columns are allowed.
 */
public final class ValidationSchema {
    private final List<String> required;
    private final Map<String, ColumnRule> columns;
    private final boolean additionalColumns;

    private ValidationSchema(Builder b) {
        this.required = List.copyOf(b.required);
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(b.columns));
        this.additionalColumns = b.additionalColumns;
    }

    public static Builder builder() { return new Builder(); }

    public List<String> required() { return required; }
    public Map<String, ColumnRule> columns() { return columns; }
    public boolean additionalColumns() { return additionalColumns; }

    public static final class Builder {
        private final List<String> required = new ArrayList<>();
        private final Map<String, ColumnRule> columns = new LinkedHashMap<>();
        private boolean additionalColumns = true;

        public Builder require(String... names) {
            for (String n : names) {
                required.add(n);
                columns.putIfAbsent(n, ColumnRule.any());
            }
            return this;
        }

        public Builder column(String name, ColumnRule rule) { columns.put(name, rule); return this; }

        public Builder columns(ColumnRule rule, String... names) {
            for (String n : names) columns.put(n, rule);
            return this;
        }

        public Builder additionalColumns(boolean allowed) { this.additionalColumns = allowed; return this; }

        public ValidationSchema build() { return new ValidationSchema(this); }
    }
}
