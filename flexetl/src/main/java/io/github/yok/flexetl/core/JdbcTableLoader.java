package io.github.yok.flexetl.core;

import io.github.yok.flexetl.config.ConnectionConfig;
import io.github.yok.flexetl.db.DbUnitConfigFactory;
import io.github.yok.flexetl.db.SqlDialect;
import io.github.yok.flexetl.model.Column;
import io.github.yok.flexetl.model.ColumnType;
import io.github.yok.flexetl.model.Dataset;
import io.github.yok.flexetl.util.JdbcConnections;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.datatype.DataType;
import org.dbunit.operation.DatabaseOperation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link TableLoader} that recreates the target table over JDBC and inserts the rows through
 * DBUnit.
 *
 * <p>
 * <strong>Processing flow:</strong>
 * </p>
 * <ol>
 * <li>Validate the table name and the column names.</li>
 * <li>Resolve the {@link SqlDialect} from the JDBC URL and open a connection.</li>
 * <li>In one transaction: drop the table if it exists, create it from the dataset's columns and
 * insert every row with {@link DatabaseOperation#INSERT}.</li>
 * <li>Commit; on any failure roll back and throw {@link LoadException}.</li>
 * </ol>
 *
 * <p>
 * On products where DDL commits implicitly (MySQL, Oracle) the rollback only covers the inserted
 * rows. The dataset's row positions are not written.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class JdbcTableLoader implements TableLoader {

    /**
     * Abstraction for the DBUnit write operation used by this loader.
     */
    interface OperationExecutor {

        /**
         * Executes DBUnit INSERT.
         *
         * @param connection DBUnit connection
         * @param dataSet dataset to write
         * @throws Exception execution failure
         */
        void insert(IDatabaseConnection connection, IDataSet dataSet) throws Exception;
    }

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

    // Applies DBUnit settings per dialect
    private final DbUnitConfigFactory configFactory;

    // DBUnit operation executor (replaceable in tests)
    private final OperationExecutor operationExecutor;

    @Autowired
    public JdbcTableLoader(DbUnitConfigFactory configFactory) {
        this(configFactory, DatabaseOperation.INSERT::execute);
    }

    JdbcTableLoader(DbUnitConfigFactory configFactory, OperationExecutor operationExecutor) {
        this.configFactory = configFactory;
        this.operationExecutor = operationExecutor;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void load(Dataset dataset, ConnectionConfig.Entry connection, String tableName)
            throws LoadException {
        validate(dataset, tableName);
        SqlDialect dialect;
        try {
            dialect = SqlDialect.fromUrl(connection.getUrl());
        } catch (IllegalArgumentException e) {
            throw new LoadException(e.getMessage(), e);
        }
        log.info("Loading table '{}' ({} rows, {} columns) into [{}]", tableName,
                dataset.rowCount(), dataset.columnCount(),
                JdbcConnections.describe(connection));

        try (Connection jdbc = JdbcConnections.open(connection)) {
            jdbc.setAutoCommit(false);
            try {
                replaceTable(jdbc, dialect, dataset, tableName);
                jdbc.commit();
                log.info("Table '{}' committed ({} rows)", tableName, dataset.rowCount());
            } catch (Exception e) {
                rollback(jdbc, tableName);
                throw new LoadException("Failed to load table '" + tableName + "': "
                        + ExceptionUtils.getRootCauseMessage(e), e);
            }
        } catch (SQLException e) {
            throw new LoadException("Database error while loading table '" + tableName + "': "
                    + e.getMessage(), e);
        }
    }

    /**
     * Drops, recreates and fills the table on an open connection.
     *
     * @param jdbc connection in manual-commit mode
     * @param dialect target product
     * @param dataset rows to write
     * @param tableName table name
     * @throws Exception if a statement or the DBUnit insert fails
     */
    private void replaceTable(Connection jdbc, SqlDialect dialect, Dataset dataset,
            String tableName) throws Exception {
        String schema = jdbc.getSchema();
        try (Statement stmt = jdbc.createStatement()) {
            if (tableExists(jdbc, schema, tableName)) {
                stmt.execute("DROP TABLE " + dialect.quote(tableName));
                log.debug("Dropped existing table '{}'", tableName);
            }
            String ddl = createTableSql(dialect, dataset, tableName);
            log.debug("DDL: {}", ddl);
            stmt.execute(ddl);
        }
        if (dataset.rowCount() == 0) {
            log.info("Table '{}' created without rows", tableName);
            return;
        }

        DatabaseConnection dbConn = new DatabaseConnection(jdbc, schema);
        configFactory.configure(dbConn.getConfig(), dialect);
        operationExecutor.insert(dbConn, toDataSet(dialect, dataset, tableName));
    }

    /**
     * Builds the {@code CREATE TABLE} statement for the dataset's columns.
     *
     * @param dialect target product
     * @param dataset dataset whose columns define the table
     * @param tableName table name
     * @return DDL statement
     */
    static String createTableSql(SqlDialect dialect, Dataset dataset, String tableName) {
        return dataset.columns().stream()
                .map(c -> dialect.quote(c.getName()) + " " + dialect.sqlType(c.getType()))
                .collect(Collectors.joining(", ",
                        "CREATE TABLE " + dialect.quote(tableName) + " (", ")"));
    }

    private static boolean tableExists(Connection jdbc, String schema, String tableName)
            throws SQLException {
        DatabaseMetaData meta = jdbc.getMetaData();
        try (ResultSet rs = meta.getTables(jdbc.getCatalog(), schema, null, TABLE_TYPES)) {
            while (rs.next()) {
                if (tableName.equals(rs.getString("TABLE_NAME"))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static IDataSet toDataSet(SqlDialect dialect, Dataset dataset, String tableName)
            throws Exception {
        List<Column> columns = dataset.columns();
        org.dbunit.dataset.Column[] meta = new org.dbunit.dataset.Column[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            meta[c] = new org.dbunit.dataset.Column(columns.get(c).getName(),
                    dataType(columns.get(c).getType()));
        }
        DefaultTable table = new DefaultTable(new DefaultTableMetaData(tableName, meta));
        for (int r = 0; r < dataset.rowCount(); r++) {
            Object[] values = new Object[columns.size()];
            for (int c = 0; c < columns.size(); c++) {
                values[c] = dialect.toJdbcValue(columns.get(c).get(r));
            }
            table.addRow(values);
        }
        return new DefaultDataSet(table);
    }

    private static DataType dataType(ColumnType type) {
        switch (type) {
            case NUMERIC:
                return DataType.DOUBLE;
            case DATETIME:
                return DataType.TIMESTAMP;
            case BOOLEAN:
                return DataType.BOOLEAN;
            case TEXT:
            default:
                return DataType.VARCHAR;
        }
    }

    private static void validate(Dataset dataset, String tableName) throws LoadException {
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw new LoadException("Invalid table name: '" + tableName
                    + "' (letters, digits and underscores; must not start with a digit)");
        }
        if (dataset.columnCount() == 0) {
            throw new LoadException(
                    "Cannot load table '" + tableName + "': the dataset has no columns");
        }
        Set<String> seen = new HashSet<>();
        for (String name : dataset.columnNames()) {
            if (name.isEmpty() || name.chars().anyMatch(ch -> "\"`[]".indexOf(ch) >= 0)) {
                throw new LoadException("Invalid column name for table '" + tableName + "': '"
                        + name + "'");
            }
            if (!seen.add(name.toLowerCase(Locale.ROOT))) {
                throw new LoadException("Column names of table '" + tableName
                        + "' differ only by case: '" + name + "'");
            }
        }
    }

    private static void rollback(Connection jdbc, String tableName) {
        try {
            jdbc.rollback();
            log.warn("Transaction rolled back (table '{}')", tableName);
        } catch (SQLException rollbackEx) {
            log.warn("Rollback failed (table '{}'): {}", tableName, rollbackEx.getMessage(),
                    rollbackEx);
        }
    }
}
