package io.github.yok.flexetl.db;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import io.github.yok.flexetl.config.DbUnitConfigProperties;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;
import org.junit.jupiter.api.Test;

class DbUnitConfigFactoryTest {

    @Test
    void configure_正常ケース_プロパティと方言を指定する_DatabaseConfigに反映されること() {
        DbUnitConfigProperties props = new DbUnitConfigProperties();
        props.setBatchedStatements(false);
        props.setBatchSize(42);
        DatabaseConfig cfg = new DatabaseConfig();

        new DbUnitConfigFactory(props).configure(cfg, SqlDialect.MYSQL);

        assertInstanceOf(MySqlDataTypeFactory.class,
                cfg.getProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY));
        assertEquals("`?`", cfg.getProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN));
        assertArrayEquals(new String[] {"TABLE", "BASE TABLE"},
                (String[]) cfg.getProperty(DatabaseConfig.PROPERTY_TABLE_TYPE));
        assertEquals(Boolean.TRUE,
                cfg.getProperty(DatabaseConfig.FEATURE_CASE_SENSITIVE_TABLE_NAMES));
        assertEquals(Boolean.FALSE, cfg.getProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS));
        assertEquals(42, cfg.getProperty(DatabaseConfig.PROPERTY_BATCH_SIZE));
    }

    @Test
    void constructor_正常ケース_引数なしで生成する_デフォルト値が適用されること() {
        DatabaseConfig cfg = new DatabaseConfig();

        new DbUnitConfigFactory().configure(cfg, SqlDialect.H2);

        assertEquals(Boolean.TRUE, cfg.getProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS));
        assertEquals(100, cfg.getProperty(DatabaseConfig.PROPERTY_BATCH_SIZE));
        assertEquals("\"?\"", cfg.getProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN));
    }
}
