package io.github.yok.flexetl.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds the relational stores a dataset can be loaded into.
 *
 * <pre>
 * connections:
 *   - id: warehouse
 *     url: jdbc:postgresql://localhost:5432/warehouse
 *     user: etl
 *     password: secret
 *     driverClass: org.postgresql.Driver
 * </pre>
 *
 * <p>
 * An {@link Entry} is handed to the table loader explicitly for each load; nothing reads the
 * connection settings from global state.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections = new ArrayList<>();

    /**
     * Finds a connection entry by its logical ID.
     *
     * @param id logical ID; when {@code null} or blank the first entry is returned
     * @return the matching entry, or {@link Optional#empty()} if none matches
     */
    public Optional<Entry> find(String id) {
        if (connections == null || connections.isEmpty()) {
            return Optional.empty();
        }
        if (id == null || id.isBlank()) {
            return Optional.of(connections.get(0));
        }
        return connections.stream().filter(e -> id.equals(e.getId())).findFirst();
    }

    /**
     * One relational store.
     */
    @Data
    public static class Entry {
        // Logical ID of the store (e.g., "warehouse")
        private String id;
        // JDBC connection URL (e.g., jdbc:h2:file:./data/etl)
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
        private String driverClass;
    }
}
