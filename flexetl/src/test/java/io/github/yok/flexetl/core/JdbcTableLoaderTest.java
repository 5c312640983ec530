package io.github.yok.flexetl.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import io.github.yok.flexetl.config.ConnectionConfig;
import io.github.yok.flexetl.db.DbUnitConfigFactory;
import io.github.yok.flexetl.db.SqlDialect;
import io.github.yok.flexetl.model.ColumnType;
import io.github.yok.flexetl.model.Dataset;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.IDataSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcTableLoaderTest {

    private ConnectionConfig.Entry entry;

    private final JdbcTableLoader loader = new JdbcTableLoader(new DbUnitConfigFactory());

    @BeforeEach
    void setUp() {
        entry = new ConnectionConfig.Entry();
        entry.setId("h2");
        entry.setUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        entry.setUser("sa");
        entry.setPassword("");
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
    }

    private List<String> columnNames(String table) throws SQLException {
        try (Connection conn = connect(); Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT * FROM \"" + table + "\"")) {
            ResultSetMetaData meta = rs.getMetaData();
            List<String> names = new ArrayList<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                names.add(meta.getColumnName(i));
            }
            return names;
        }
    }

    private int count(String table) throws SQLException {
        try (Connection conn = connect(); Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM \"" + table + "\"")) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private static Dataset sales() {
        return Dataset.builder().column("price", ColumnType.NUMERIC)
                .column("region", ColumnType.TEXT).column("order_date", ColumnType.DATETIME)
                .column("active", ColumnType.BOOLEAN)
                .row(10.0, "east", LocalDateTime.of(2024, 1, 5, 10, 30), true)
                .row(5.5, null, null, false).build();
    }

    @Test
    void load_正常ケース_新規テーブル_列と行がそのまま書き込まれること() throws Exception {
        loader.load(sales(), entry, "sales");

        assertEquals(List.of("price", "region", "order_date", "active"), columnNames("sales"));
        try (Connection conn = connect(); Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(
                        "SELECT \"price\", \"region\", \"order_date\", \"active\" FROM \"sales\""
                                + " ORDER BY \"price\" DESC")) {
            assertTrue(rs.next());
            assertEquals(10.0, rs.getDouble(1));
            assertEquals("east", rs.getString(2));
            assertEquals(Timestamp.valueOf(LocalDateTime.of(2024, 1, 5, 10, 30)),
                    rs.getTimestamp(3));
            assertTrue(rs.getBoolean(4));
            assertTrue(rs.next());
            assertEquals(5.5, rs.getDouble(1));
            assertNull(rs.getString(2));
            assertNull(rs.getTimestamp(3));
            assertFalse(rs.getBoolean(4));
            assertFalse(rs.next());
        }
    }

    @Test
    void load_正常ケース_既存テーブルがある_テーブルが置き換えられること() throws Exception {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE \"sales\" (\"legacy\" VARCHAR(10))");
            stmt.execute("INSERT INTO \"sales\" VALUES ('old'), ('older'), ('oldest')");
        }

        loader.load(sales(), entry, "sales");
        Dataset replacement = Dataset.builder().column("id", ColumnType.NUMERIC).row(1.0)
                .build();
        loader.load(replacement, entry, "sales");

        assertEquals(List.of("id"), columnNames("sales"));
        assertEquals(1, count("sales"));
    }

    @Test
    void load_正常ケース_行がない_空のテーブルが作成されること() throws Exception {
        Dataset empty = Dataset.builder().column("a", ColumnType.TEXT).build();

        loader.load(empty, entry, "empty_table");

        assertEquals(List.of("a"), columnNames("empty_table"));
        assertEquals(0, count("empty_table"));
    }

    @Test
    void load_異常ケース_不正なテーブル名_LoadExceptionが送出され接続しないこと() throws Exception {
        JdbcTableLoader.OperationExecutor executor = mock(JdbcTableLoader.OperationExecutor.class);
        JdbcTableLoader sut = new JdbcTableLoader(new DbUnitConfigFactory(), executor);

        LoadException ex =
                assertThrows(LoadException.class, () -> sut.load(sales(), entry, "1sales"));
        assertTrue(ex.getMessage().contains("Invalid table name"));
        assertThrows(LoadException.class, () -> sut.load(sales(), entry, "sales; DROP"));
        verifyNoInteractions(executor);
    }

    @Test
    void load_異常ケース_大文字小文字のみ異なる列名_LoadExceptionが送出されること() {
        Dataset dataset = Dataset.builder().column("Price", ColumnType.NUMERIC)
                .column("price", ColumnType.NUMERIC).row(1.0, 2.0).build();

        LoadException ex =
                assertThrows(LoadException.class, () -> loader.load(dataset, entry, "t"));
        assertTrue(ex.getMessage().contains("differ only by case"));
    }

    @Test
    void load_異常ケース_引用符を含む列名_LoadExceptionが送出されること() {
        Dataset dataset =
                Dataset.builder().column("a\"b", ColumnType.NUMERIC).row(1.0).build();

        assertThrows(LoadException.class, () -> loader.load(dataset, entry, "t"));
    }

    @Test
    void load_異常ケース_列がない_LoadExceptionが送出されること() {
        assertThrows(LoadException.class, () -> loader.load(Dataset.empty(), entry, "t"));
    }

    @Test
    void load_異常ケース_未対応のJDBC_URL_LoadExceptionが送出されること() {
        entry.setUrl("jdbc:unknown://host/db");

        LoadException ex =
                assertThrows(LoadException.class, () -> loader.load(sales(), entry, "t"));
        assertTrue(ex.getMessage().contains("Unsupported JDBC URL"));
    }

    @Test
    void load_異常ケース_挿入が失敗する_ロールバックされLoadExceptionが送出されること() throws Exception {
        JdbcTableLoader.OperationExecutor executor = mock(JdbcTableLoader.OperationExecutor.class);
        doThrow(new SQLException("disk full")).when(executor)
                .insert(any(IDatabaseConnection.class), any(IDataSet.class));
        JdbcTableLoader sut = new JdbcTableLoader(new DbUnitConfigFactory(), executor);

        LoadException ex =
                assertThrows(LoadException.class, () -> sut.load(sales(), entry, "sales"));

        assertEquals("Failed to load table 'sales': SQLException: disk full", ex.getMessage());
        verify(executor).insert(any(IDatabaseConnection.class), any(IDataSet.class));
    }

    @Test
    void createTableSql_正常ケース_方言を指定する_引用符と型が方言に従うこと() {
        Dataset dataset = Dataset.builder().column("n", ColumnType.NUMERIC)
                .column("t", ColumnType.TEXT).build();

        assertEquals("CREATE TABLE `x` (`n` DOUBLE, `t` TEXT)",
                JdbcTableLoader.createTableSql(SqlDialect.MYSQL, dataset, "x"));
        assertEquals("CREATE TABLE [x] ([n] FLOAT, [t] NVARCHAR(MAX))",
                JdbcTableLoader.createTableSql(SqlDialect.SQLSERVER, dataset, "x"));
    }
}
