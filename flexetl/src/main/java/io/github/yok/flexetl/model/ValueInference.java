package io.github.yok.flexetl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Infers the narrowest consistent {@link ColumnType} of text cells and converts them.
 *
 * <p>
 * Inference order:
 * </p>
 * <ol>
 * <li>{@link ColumnType#NUMERIC}: every non-missing cell is a finite decimal number such as
 * {@code 42}, {@code -3.5}, {@code .5} or {@code 1e3}</li>
 * <li>{@link ColumnType#BOOLEAN}: every non-missing cell is {@code true} or {@code false}
 * (case-insensitive)</li>
 * <li>{@link ColumnType#TEXT}: anything else, including columns without any non-missing cell</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ValueInference {

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ValueInference() {}

    /**
     * Parses a decimal number.
     *
     * @param text cell text
     * @return the number, or {@code null} if the text is not a finite decimal number
     */
    public static Double parseNumber(String text) {
        String value = text.strip();
        if (!DECIMAL.matcher(value).matches()) {
            return null;
        }
        double parsed = Double.parseDouble(value);
        return Double.isFinite(parsed) ? parsed : null;
    }

    /**
     * Parses a truth value.
     *
     * @param text cell text
     * @return the truth value, or {@code null} if the text is neither {@code true} nor
     *         {@code false}
     */
    public static Boolean parseBoolean(String text) {
        String value = text.strip();
        if ("true".equalsIgnoreCase(value)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value)) {
            return Boolean.FALSE;
        }
        return null;
    }

    /**
     * Infers the type of text cells.
     *
     * @param values cells; {@code null} entries are missing and do not take part
     * @return inferred type
     */
    public static ColumnType infer(List<String> values) {
        boolean any = false;
        boolean numeric = true;
        boolean bool = true;
        for (String value : values) {
            if (value == null) {
                continue;
            }
            any = true;
            numeric = numeric && parseNumber(value) != null;
            bool = bool && parseBoolean(value) != null;
            if (!numeric && !bool) {
                return ColumnType.TEXT;
            }
        }
        if (!any) {
            return ColumnType.TEXT;
        }
        return numeric ? ColumnType.NUMERIC : ColumnType.BOOLEAN;
    }

    /**
     * Builds a typed column from text cells, inferring its type.
     *
     * @param name column name
     * @param values cells; {@code null} entries are missing
     * @return typed column
     */
    public static Column toColumn(String name, List<String> values) {
        ColumnType type = infer(values);
        List<Object> converted = new ArrayList<>(values.size());
        for (String value : values) {
            converted.add(value == null ? null : convert(value, type));
        }
        return new Column(name, type, converted);
    }

    private static Object convert(String value, ColumnType type) {
        switch (type) {
            case NUMERIC:
                return parseNumber(value);
            case BOOLEAN:
                return parseBoolean(value);
            default:
                return value;
        }
    }
}
