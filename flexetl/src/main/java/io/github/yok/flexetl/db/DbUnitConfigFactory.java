package io.github.yok.flexetl.db;

import io.github.yok.flexetl.config.DbUnitConfigProperties;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Factory class that centrally applies application-wide settings to DBUnit's
 * {@link DatabaseConfig}.
 *
 * <p>
 * Combines the {@code dbunit.config.*} properties with the settings that depend on the target
 * product (data type factory, identifier escape pattern), so the table loader only needs to call
 * {@link #configure(DatabaseConfig, SqlDialect)}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbUnitConfigFactory {

    // Table types reported by JDBC metadata; H2 2.x reports ordinary tables as "BASE TABLE"
    private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

    // Properties class that externalizes DBUnit settings
    private final DbUnitConfigProperties props;

    /**
     * Creates the factory with the bound {@code dbunit.config.*} properties.
     *
     * @param props DBUnit properties
     */
    @Autowired
    public DbUnitConfigFactory(DbUnitConfigProperties props) {
        this.props = props;
    }

    /**
     * No-args constructor using default {@link DbUnitConfigProperties} values, for use outside the
     * Spring container.
     */
    public DbUnitConfigFactory() {
        this.props = new DbUnitConfigProperties();
    }

    /**
     * Applies application-wide settings to the specified {@link DatabaseConfig}.
     *
     * @param cfg DBUnit {@link DatabaseConfig} object
     * @param dialect target product
     */
    public void configure(DatabaseConfig cfg, SqlDialect dialect) {
        // 1) Set the data type factory
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY,
                dialect.createDataTypeFactory());
        log.debug("DBUnit: DataTypeFactory set for {}", dialect);

        // 2) Escape identifiers the same way the DDL does
        cfg.setProperty(DatabaseConfig.PROPERTY_ESCAPE_PATTERN, dialect.escapePattern());
        log.debug("DBUnit: escape pattern = {}", dialect.escapePattern());

        // 3) Table types visible to DBUnit
        cfg.setProperty(DatabaseConfig.PROPERTY_TABLE_TYPE, TABLE_TYPES);

        // 4) Tables are created with quoted names, so look them up exactly as written
        cfg.setProperty(DatabaseConfig.FEATURE_CASE_SENSITIVE_TABLE_NAMES, Boolean.TRUE);

        // 5) Configure whether to enable batched statements execution
        cfg.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, props.isBatchedStatements());
        log.debug("DBUnit: batched statements enabled = {}", props.isBatchedStatements());

        // 6) Configure batch size
        cfg.setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, props.getBatchSize());
        log.debug("DBUnit: batch size = {}", props.getBatchSize());
    }
}
