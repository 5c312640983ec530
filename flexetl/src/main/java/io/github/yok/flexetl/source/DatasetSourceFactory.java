package io.github.yok.flexetl.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.flexetl.config.SourceConfig;
import java.util.EnumMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory that resolves the {@link DatasetSource} for a {@link SourceKind}.
 *
 * <p>
 * One adapter instance per kind is created up front from {@link SourceConfig}; adapters hold no
 * per-request state and may be reused.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DatasetSourceFactory {

    private final Map<SourceKind, DatasetSource> sources = new EnumMap<>(SourceKind.class);

    public DatasetSourceFactory(SourceConfig config) {
        JsonDatasetSource json = new JsonDatasetSource(new ObjectMapper());
        sources.put(SourceKind.CSV, new CsvDatasetSource(config));
        sources.put(SourceKind.JSON, json);
        sources.put(SourceKind.API, new ApiDatasetSource(config, json));
    }

    /**
     * Returns the adapter for the given kind.
     *
     * @param kind source kind
     * @return adapter
     * @throws IllegalArgumentException if no adapter is registered for the kind
     */
    public DatasetSource create(SourceKind kind) {
        DatasetSource source = sources.get(kind);
        if (source == null) {
            throw new IllegalArgumentException("Unsupported source kind: " + kind);
        }
        log.debug("Resolved source adapter: {} -> {}", kind, source.getClass().getSimpleName());
        return source;
    }
}
