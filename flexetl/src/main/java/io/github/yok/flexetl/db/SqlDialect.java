package io.github.yok.flexetl.db;

import io.github.yok.flexetl.model.ColumnType;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.function.Supplier;
import lombok.AccessLevel;
import lombok.Getter;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;
import org.dbunit.ext.mssql.MsSqlDataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;
import org.dbunit.ext.oracle.Oracle10DataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;

/**
 * Relational products the table loader can write to.
 *
 * <p>
 * Each dialect supplies what differs between products when a table is recreated from a
 * {@link io.github.yok.flexetl.model.Dataset}:
 * </p>
 * <ul>
 * <li>identifier quoting, used for both DDL and DBUnit's escape pattern</li>
 * <li>the column type used in {@code CREATE TABLE} for each {@link ColumnType}</li>
 * <li>the DBUnit {@link IDataTypeFactory}</li>
 * <li>conversion of cell values to JDBC-bindable values</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum SqlDialect {

    H2("\"", "\"", "DOUBLE PRECISION", "VARCHAR", "TIMESTAMP", "BOOLEAN", H2DataTypeFactory::new),

    POSTGRESQL("\"", "\"", "DOUBLE PRECISION", "TEXT", "TIMESTAMP", "BOOLEAN",
            PostgresqlDataTypeFactory::new),

    MYSQL("`", "`", "DOUBLE", "TEXT", "DATETIME(6)", "BOOLEAN", MySqlDataTypeFactory::new),

    SQLSERVER("[", "]", "FLOAT", "NVARCHAR(MAX)", "DATETIME2", "BIT", MsSqlDataTypeFactory::new),

    ORACLE("\"", "\"", "BINARY_DOUBLE", "VARCHAR2(4000)", "TIMESTAMP", "NUMBER(1)",
            Oracle10DataTypeFactory::new);

    private final String openQuote;
    private final String closeQuote;
    private final String numericType;
    private final String textType;
    private final String dateTimeType;
    private final String booleanType;
    @Getter(AccessLevel.NONE)
    private final Supplier<IDataTypeFactory> dataTypeFactory;

    SqlDialect(String openQuote, String closeQuote, String numericType, String textType,
            String dateTimeType, String booleanType, Supplier<IDataTypeFactory> dataTypeFactory) {
        this.openQuote = openQuote;
        this.closeQuote = closeQuote;
        this.numericType = numericType;
        this.textType = textType;
        this.dateTimeType = dateTimeType;
        this.booleanType = booleanType;
        this.dataTypeFactory = dataTypeFactory;
    }

    /**
     * Resolves the dialect from a JDBC URL prefix ({@code jdbc:h2:}, {@code jdbc:postgresql:},
     * {@code jdbc:mysql:}/{@code jdbc:mariadb:}, {@code jdbc:sqlserver:}, {@code jdbc:oracle:}).
     *
     * @param url JDBC URL
     * @return matching dialect
     * @throws IllegalArgumentException if the URL names an unsupported product
     */
    public static SqlDialect fromUrl(String url) {
        String lower = url == null ? "" : url.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("jdbc:h2:")) {
            return H2;
        }
        if (lower.startsWith("jdbc:postgresql:")) {
            return POSTGRESQL;
        }
        if (lower.startsWith("jdbc:mysql:") || lower.startsWith("jdbc:mariadb:")) {
            return MYSQL;
        }
        if (lower.startsWith("jdbc:sqlserver:")) {
            return SQLSERVER;
        }
        if (lower.startsWith("jdbc:oracle:")) {
            return ORACLE;
        }
        throw new IllegalArgumentException("Unsupported JDBC URL: " + url);
    }

    /**
     * Quotes an identifier.
     *
     * @param identifier table or column name (must not contain quote characters)
     * @return quoted identifier
     */
    public String quote(String identifier) {
        return openQuote + identifier + closeQuote;
    }

    /**
     * Returns the DBUnit escape pattern matching {@link #quote(String)}.
     *
     * @return escape pattern with {@code ?} as the placeholder
     */
    public String escapePattern() {
        return quote("?");
    }

    /**
     * Returns the DDL type of a column.
     *
     * @param type column type
     * @return SQL type name for {@code CREATE TABLE}
     */
    public String sqlType(ColumnType type) {
        switch (type) {
            case NUMERIC:
                return numericType;
            case DATETIME:
                return dateTimeType;
            case BOOLEAN:
                return booleanType;
            case TEXT:
            default:
                return textType;
        }
    }

    /**
     * Creates a new DBUnit data type factory for this product.
     *
     * @return data type factory
     */
    public IDataTypeFactory createDataTypeFactory() {
        return dataTypeFactory.get();
    }

    /**
     * Converts a cell value to the value bound through JDBC.
     *
     * <p>
     * Date-times become {@link Timestamp}; booleans become {@code 1}/{@code 0} where the product
     * stores them as numbers. Other values and {@code null} are returned unchanged.
     * </p>
     *
     * @param value cell value
     * @return bindable value
     */
    public Object toJdbcValue(Object value) {
        if (value instanceof LocalDateTime) {
            return Timestamp.valueOf((LocalDateTime) value);
        }
        if (value instanceof Boolean && this == ORACLE) {
            return ((Boolean) value) ? 1 : 0;
        }
        return value;
    }
}
