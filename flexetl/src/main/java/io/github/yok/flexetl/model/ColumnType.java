package io.github.yok.flexetl.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Semantic type of a {@link Column}.
 *
 * <p>
 * Each type fixes the Java class that non-missing cells of the column hold. The missing marker is
 * always {@code null}, whatever the type.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum ColumnType {

    // Floating point numbers, stored as Double.
    NUMERIC(Double.class),

    // Free text or categorical labels, stored as String.
    TEXT(String.class),

    // Local date-time values, stored as LocalDateTime.
    DATETIME(LocalDateTime.class),

    // Truth values, stored as Boolean.
    BOOLEAN(Boolean.class);

    // Java class of non-missing cells
    private final Class<?> valueClass;

    /**
     * Determines whether the given cell value may be stored in a column of this type.
     *
     * @param value cell value, {@code null} meaning missing
     * @return {@code true} if the value is missing or an instance of {@link #getValueClass()}
     */
    public boolean accepts(Object value) {
        return value == null || valueClass.isInstance(value);
    }
}
