package io.github.yok.flexetl.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code source} section in {@code application.yml}.
 *
 * <pre>
 * source:
 *   missing-tokens: ["", "NA", "N/A", "NaN", "null", "NULL", "None"]
 *   csv:
 *     delimiter: ","
 *     charset: UTF-8
 *   http:
 *     connect-timeout: 10s
 *     request-timeout: 30s
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "source")
@Data
public class SourceConfig {

    /**
     * Cell texts read as missing values by the CSV source.
     */
    private List<String> missingTokens =
            new ArrayList<>(List.of("", "NA", "N/A", "NaN", "null", "NULL", "None"));

    /**
     * CSV settings.
     */
    private Csv csv = new Csv();

    /**
     * HTTP settings for the API source.
     */
    private Http http = new Http();

    /**
     * CSV settings.
     */
    @Data
    public static class Csv {
        // Field delimiter; null infers it from the header line
        private Character delimiter;
        // Character set of the input bytes
        private Charset charset = StandardCharsets.UTF_8;
    }

    /**
     * HTTP settings.
     */
    @Data
    public static class Http {
        // Time allowed to establish the TCP connection
        private Duration connectTimeout = Duration.ofSeconds(10);
        // Time allowed for the whole request
        private Duration requestTimeout = Duration.ofSeconds(30);
    }
}
