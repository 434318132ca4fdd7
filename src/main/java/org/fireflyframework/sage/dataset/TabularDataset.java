/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.sage.dataset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only table of named columns aligned by row index.
 *
 * <p>Rows carry no identity beyond their index. Column names are unique and all
 * columns have the same length. Instances are built once through {@link #builder()}
 * and shared freely between metrics.</p>
 *
 * <pre>{@code
 * TabularDataset dataset = TabularDataset.builder()
 *         .column("id", List.of(1, 2, 3))
 *         .column("email", Arrays.asList("a@b.com", null, "c@d.com"))
 *         .build();
 * }</pre>
 */
public final class TabularDataset {

    private final List<Column> columns;
    private final Map<String, Column> columnsByName;
    private final int rowCount;

    private TabularDataset(List<Column> columns, int rowCount) {
        this.columns = Collections.unmodifiableList(columns);
        Map<String, Column> byName = new LinkedHashMap<>();
        for (Column column : columns) {
            byName.put(column.getName(), column);
        }
        this.columnsByName = Collections.unmodifiableMap(byName);
        this.rowCount = rowCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TabularDataset empty() {
        return new TabularDataset(new ArrayList<>(), 0);
    }

    public List<Column> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        return new ArrayList<>(columnsByName.keySet());
    }

    public int rowCount() {
        return rowCount;
    }

    public int columnCount() {
        return columns.size();
    }

    public long totalCells() {
        return (long) rowCount * columns.size();
    }

    public long missingCells() {
        long missing = 0;
        for (Column column : columns) {
            missing += column.missingCount();
        }
        return missing;
    }

    /**
     * Returns whether the dataset has no rows or no columns.
     *
     * @return {@code true} when there is nothing to evaluate
     */
    public boolean isEmpty() {
        return rowCount == 0 || columns.isEmpty();
    }

    public boolean hasColumn(String name) {
        return columnsByName.containsKey(name);
    }

    public Optional<Column> findColumn(String name) {
        return Optional.ofNullable(columnsByName.get(name));
    }

    /**
     * Returns the column with the given name.
     *
     * @param name the column name
     * @return the column
     * @throws IllegalArgumentException if the column does not exist
     */
    public Column column(String name) {
        Column column = columnsByName.get(name);
        if (column == null) {
            throw new IllegalArgumentException("Column '" + name + "' not found in data");
        }
        return column;
    }

    /**
     * Returns one row as an ordered column-name to value map.
     *
     * @param index the row index
     * @return the row values keyed by column name
     */
    public Map<String, Object> row(int index) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Column column : columns) {
            row.put(column.getName(), column.get(index));
        }
        return row;
    }

    /**
     * Counts rows that repeat an earlier row exactly. The first occurrence of each
     * distinct row is not counted.
     *
     * @return the number of duplicate rows
     */
    public int duplicateRowCount() {
        Set<List<Object>> seen = new HashSet<>();
        int duplicates = 0;
        for (int i = 0; i < rowCount; i++) {
            List<Object> key = new ArrayList<>(columns.size());
            for (Column column : columns) {
                key.add(column.isMissing(i) ? null : column.get(i));
            }
            if (!seen.add(key)) {
                duplicates++;
            }
        }
        return duplicates;
    }

    @Override
    public String toString() {
        return "TabularDataset(" + rowCount + " rows, " + columns.size() + " columns)";
    }

    /**
     * Builder collecting columns in declaration order.
     */
    public static final class Builder {

        private final List<Column> columns = new ArrayList<>();

        private Builder() {}

        public Builder column(Column column) {
            columns.add(column);
            return this;
        }

        public Builder column(String name, List<?> values) {
            return column(Column.of(name, values));
        }

        public Builder column(String name, ValueKind kind, List<?> values) {
            return column(new Column(name, kind, values));
        }

        public Builder column(String name, Object... values) {
            return column(name, Arrays.asList(values));
        }

        /**
         * Validates the collected columns and builds the dataset.
         *
         * @return the dataset
         * @throws IllegalArgumentException on duplicate names or unequal lengths
         */
        public TabularDataset build() {
            Set<String> names = new HashSet<>();
            int rows = -1;
            for (Column column : columns) {
                if (!names.add(column.getName())) {
                    throw new IllegalArgumentException("Duplicate column name: " + column.getName());
                }
                if (rows >= 0 && column.size() != rows) {
                    throw new IllegalArgumentException("Column '" + column.getName() + "' has "
                            + column.size() + " values, expected " + rows);
                }
                rows = column.size();
            }
            return new TabularDataset(new ArrayList<>(columns), Math.max(rows, 0));
        }
    }
}
