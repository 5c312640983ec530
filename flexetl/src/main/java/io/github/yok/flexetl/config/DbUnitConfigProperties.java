package io.github.yok.flexetl.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Holds properties applied to DBUnit's {@code DatabaseConfig} when rows are written.
 *
 * <ul>
 * <li>{@code dbunit.config.batched-statements}: whether inserts are sent as JDBC batches</li>
 * <li>{@code dbunit.config.batch-size}: number of rows per batch</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "dbunit.config")
@Getter
@Setter
@NoArgsConstructor
public class DbUnitConfigProperties {

    /**
     * Specifies whether DBUnit's batched statement execution should be enabled.
     */
    private boolean batchedStatements = true;

    /**
     * Specifies the number of rows sent per batch when batching is enabled.
     */
    private int batchSize = 100;
}
