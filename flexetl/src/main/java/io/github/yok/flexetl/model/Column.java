package io.github.yok.flexetl.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A named, typed column of a {@link Dataset}.
 *
 * <p>
 * Instances are immutable. The value list may contain {@code null} entries, each of which marks a
 * missing cell.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Column {

    private final String name;
    private final ColumnType type;
    private final List<Object> values;

    /**
     * Creates a column, copying the given values.
     *
     * @param name column name
     * @param type semantic type
     * @param values cell values; {@code null} entries are missing cells
     * @throws IllegalArgumentException if a non-missing value does not match {@code type}
     */
    public Column(String name, ColumnType type, List<?> values) {
        Preconditions.checkNotNull(name, "name must not be null");
        Preconditions.checkNotNull(type, "type must not be null");
        Preconditions.checkNotNull(values, "values must not be null");
        List<Object> copy = new ArrayList<>(values.size());
        for (Object value : values) {
            if (!type.accepts(value)) {
                throw new IllegalArgumentException("Column '" + name + "' of type " + type
                        + " cannot hold " + value.getClass().getSimpleName() + " value: " + value);
            }
            copy.add(value);
        }
        this.name = name;
        this.type = type;
        this.values = Collections.unmodifiableList(copy);
    }

    /**
     * Returns the number of cells.
     *
     * @return cell count
     */
    public int size() {
        return values.size();
    }

    /**
     * Returns the cell at the given row.
     *
     * @param row zero-based row index
     * @return cell value, or {@code null} when missing
     */
    public Object get(int row) {
        return values.get(row);
    }

    /**
     * Returns the cell at the given row as a double.
     *
     * @param row zero-based row index
     * @return numeric value, or {@code null} when missing
     * @throws IllegalStateException if this column is not {@link ColumnType#NUMERIC}
     */
    public Double getNumber(int row) {
        if (type != ColumnType.NUMERIC) {
            throw new IllegalStateException("Column '" + name + "' is not numeric: " + type);
        }
        return (Double) values.get(row);
    }

    /**
     * Returns whether any cell is missing.
     *
     * @return {@code true} if at least one cell is {@code null}
     */
    public boolean hasMissing() {
        return values.stream().anyMatch(Objects::isNull);
    }

    /**
     * Returns a copy of this column under another name.
     *
     * @param newName new column name
     * @return renamed column
     */
    public Column rename(String newName) {
        return new Column(newName, type, values);
    }

    /**
     * Returns a column with the same name and new contents.
     *
     * @param newType semantic type of the new values
     * @param newValues new cell values
     * @return replacement column
     */
    public Column withValues(ColumnType newType, List<?> newValues) {
        return new Column(name, newType, newValues);
    }

    /**
     * Returns a column made of the cells at the given row indices, in that order.
     *
     * @param rows zero-based row indices
     * @return column restricted to the given rows
     */
    public Column select(List<Integer> rows) {
        List<Object> selected = new ArrayList<>(rows.size());
        for (int row : rows) {
            selected.add(values.get(row));
        }
        return new Column(name, type, selected);
    }
}
