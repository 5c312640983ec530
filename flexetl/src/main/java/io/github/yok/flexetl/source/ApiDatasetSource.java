package io.github.yok.flexetl.source;

import com.google.common.base.Preconditions;
import io.github.yok.flexetl.config.SourceConfig;
import io.github.yok.flexetl.model.Dataset;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of {@link DatasetSource} that fetches a JSON document with a single HTTP GET.
 *
 * <p>
 * Only a {@code 200} response is read; its body is handed to {@link JsonDatasetSource}. A location
 * that is not an {@code http} or {@code https} URL, any other status, or a body that is not a JSON
 * array or object yields no dataset. Connection failures and
 * timeouts are thrown as {@link IOException}. No retry is attempted.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ApiDatasetSource implements DatasetSource {

    private final HttpClient httpClient;
    private final SourceConfig config;
    private final JsonDatasetSource json;

    public ApiDatasetSource(SourceConfig config, JsonDatasetSource json) {
        this(HttpClient.newBuilder().connectTimeout(config.getHttp().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL).build(), config, json);
    }

    ApiDatasetSource(HttpClient httpClient, SourceConfig config, JsonDatasetSource json) {
        this.httpClient = httpClient;
        this.config = config;
        this.json = json;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<Dataset> extract(SourceDescriptor descriptor) throws IOException {
        URI uri;
        HttpRequest request;
        try {
            uri = URI.create(descriptor.getLocation());
            Preconditions.checkArgument(
                    "http".equalsIgnoreCase(uri.getScheme())
                            || "https".equalsIgnoreCase(uri.getScheme()),
                    "scheme must be http or https");
            request = HttpRequest.newBuilder(uri).timeout(config.getHttp().getRequestTimeout())
                    .header("Accept", "application/json").GET().build();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid URL: {} ({})", descriptor.getLocation(), e.getMessage());
            return Optional.empty();
        }

        log.info("Fetching {}", uri);
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching " + uri, e);
        }

        if (response.statusCode() != 200) {
            log.warn("HTTP {} from {}; no data extracted", response.statusCode(), uri);
            return Optional.empty();
        }
        return json.read(response.body(), uri.toString());
    }
}
