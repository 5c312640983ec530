package io.github.yok.flexetl.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.EqualsAndHashCode;

/**
 * In-memory tabular value passed between source adapters, transform stages and the table loader.
 *
 * <p>
 * A dataset is an ordered list of uniquely named {@link Column}s of equal length. Instances are
 * immutable: every transformation produces a new {@code Dataset}, so a caller holding an earlier
 * instance never observes a later stage's changes.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
public final class Dataset {

    private static final Dataset EMPTY = new Dataset(ImmutableList.of());

    private final List<Column> columns;

    @EqualsAndHashCode.Exclude
    private final Map<String, Column> byName;

    /**
     * Creates a dataset from the given columns.
     *
     * @param columns columns in display order
     * @throws IllegalArgumentException if column names repeat or column lengths differ
     */
    public Dataset(List<Column> columns) {
        Preconditions.checkNotNull(columns, "columns must not be null");
        Map<String, Column> index = new LinkedHashMap<>();
        int expectedRows = -1;
        for (Column column : columns) {
            Preconditions.checkNotNull(column, "column must not be null");
            if (index.putIfAbsent(column.getName(), column) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
            if (expectedRows < 0) {
                expectedRows = column.size();
            } else if (column.size() != expectedRows) {
                throw new IllegalArgumentException("Column '" + column.getName() + "' has "
                        + column.size() + " rows, expected " + expectedRows);
            }
        }
        this.columns = ImmutableList.copyOf(columns);
        this.byName = Collections.unmodifiableMap(index);
    }

    /**
     * Returns the dataset with no columns and no rows.
     *
     * @return empty dataset
     */
    public static Dataset empty() {
        return EMPTY;
    }

    /**
     * Starts building a dataset row by row.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public List<Column> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::getName).collect(Collectors.toList());
    }

    public int columnCount() {
        return columns.size();
    }

    /**
     * Returns the number of rows. A dataset without columns has zero rows.
     *
     * @return row count
     */
    public int rowCount() {
        return columns.isEmpty() ? 0 : columns.get(0).size();
    }

    public boolean isEmpty() {
        return rowCount() == 0;
    }

    public boolean hasColumn(String name) {
        return byName.containsKey(name);
    }

    /**
     * Looks up a column by its exact name.
     *
     * @param name column name
     * @return the column, or {@link Optional#empty()} if there is none
     */
    public Optional<Column> column(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Returns the columns of the given type, in display order.
     *
     * @param type semantic type
     * @return matching columns
     */
    public List<Column> columnsOfType(ColumnType type) {
        return columns.stream().filter(c -> c.getType() == type).collect(Collectors.toList());
    }

    /**
     * Returns the cells of one row, in column order.
     *
     * @param row zero-based row index
     * @return cell values; missing cells are {@code null}
     */
    public List<Object> row(int row) {
        Preconditions.checkElementIndex(row, rowCount(), "row");
        List<Object> cells = new ArrayList<>(columns.size());
        for (Column column : columns) {
            cells.add(column.get(row));
        }
        return cells;
    }

    /**
     * Returns a dataset made of the given rows, in the given order.
     *
     * @param rows zero-based row indices
     * @return dataset restricted to those rows
     */
    public Dataset selectRows(List<Integer> rows) {
        List<Column> selected = new ArrayList<>(columns.size());
        for (Column column : columns) {
            selected.add(column.select(rows));
        }
        return new Dataset(selected);
    }

    /**
     * Returns a dataset keeping only the rows accepted by the predicate, preserving order.
     *
     * @param keep predicate on zero-based row indices
     * @return filtered dataset
     */
    public Dataset filterRows(IntPredicate keep) {
        List<Integer> kept =
                IntStream.range(0, rowCount()).filter(keep).boxed().collect(Collectors.toList());
        if (kept.size() == rowCount()) {
            return this;
        }
        return selectRows(kept);
    }

    /**
     * Returns the first rows of this dataset.
     *
     * @param n maximum number of rows
     * @return dataset of at most {@code n} rows
     */
    public Dataset head(int n) {
        int limit = Math.max(0, Math.min(n, rowCount()));
        return filterRows(i -> i < limit);
    }

    /**
     * Returns a dataset with the same rows and the given columns.
     *
     * @param replacement columns of the new dataset
     * @return new dataset
     */
    public Dataset withColumns(List<Column> replacement) {
        return new Dataset(replacement);
    }

    /**
     * Returns a name that does not clash with any column of this dataset nor with
     * {@code reserved}. The base name is returned when free; otherwise {@code _2}, {@code _3}, … is
     * appended.
     *
     * @param base preferred name
     * @param reserved names already taken by the caller
     * @return unused name
     */
    public String uniqueName(String base, Set<String> reserved) {
        Set<String> taken = new HashSet<>(byName.keySet());
        taken.addAll(reserved);
        if (!taken.contains(base)) {
            return base;
        }
        int suffix = 2;
        while (taken.contains(base + "_" + suffix)) {
            suffix++;
        }
        return base + "_" + suffix;
    }

    @Override
    public String toString() {
        return "Dataset" + columns.stream().map(c -> c.getName() + ":" + c.getType())
                .collect(Collectors.joining(", ", "[", "]")) + " rows=" + rowCount();
    }

    /**
     * Row-oriented builder, used by source adapters and tests.
     */
    public static final class Builder {

        private final List<String> names = new ArrayList<>();
        private final List<ColumnType> types = new ArrayList<>();
        private final List<List<Object>> rows = new ArrayList<>();

        private Builder() {}

        /**
         * Declares the next column.
         *
         * @param name column name
         * @param type semantic type
         * @return this builder
         */
        public Builder column(String name, ColumnType type) {
            Preconditions.checkState(rows.isEmpty(), "columns must be declared before rows");
            names.add(name);
            types.add(type);
            return this;
        }

        /**
         * Appends a row.
         *
         * @param cells cell values in column order; {@code null} marks a missing cell
         * @return this builder
         * @throws IllegalArgumentException if the number of cells differs from the column count
         */
        public Builder row(Object... cells) {
            if (cells.length != names.size()) {
                throw new IllegalArgumentException(
                        "Row has " + cells.length + " cells, expected " + names.size());
            }
            List<Object> row = new ArrayList<>(cells.length);
            Collections.addAll(row, cells);
            rows.add(row);
            return this;
        }

        /**
         * Builds the dataset.
         *
         * @return new dataset
         */
        public Dataset build() {
            List<Column> columns = new ArrayList<>(names.size());
            for (int c = 0; c < names.size(); c++) {
                List<Object> values = new ArrayList<>(rows.size());
                for (List<Object> row : rows) {
                    values.add(row.get(c));
                }
                columns.add(new Column(names.get(c), types.get(c), values));
            }
            return new Dataset(columns);
        }
    }
}
