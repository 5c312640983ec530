package io.github.yok.flexetl;

import io.github.yok.flexetl.config.ConnectionConfig;
import io.github.yok.flexetl.config.DbUnitConfigProperties;
import io.github.yok.flexetl.config.PipelineConfig;
import io.github.yok.flexetl.config.SourceConfig;
import io.github.yok.flexetl.core.EtlOutcome;
import io.github.yok.flexetl.core.EtlRequest;
import io.github.yok.flexetl.core.EtlService;
import io.github.yok.flexetl.source.SourceDescriptor;
import io.github.yok.flexetl.source.SourceKind;
import io.github.yok.flexetl.transform.StageId;
import io.github.yok.flexetl.util.ErrorHandler;
import java.util.Arrays;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --input <path|url>} or {@code -i <path|url>}: CSV file, JSON file or HTTP(S) URL to
 * extract. Required.</li>
 * <li>{@code --table <name>} or {@code -t <name>}: target table, replaced on every run.
 * Required.</li>
 * <li>{@code --source csv|json|api} or {@code -s ...}: source kind. If omitted, it is detected
 * from the input.</li>
 * <li>{@code --stages a,b,c} or {@code -p a,b,c}: stage keys to enable. If omitted,
 * {@code pipeline.enabled-stages} in {@code application.yml} is used. The order given here has no
 * effect.</li>
 * <li>{@code --target <id>} or {@code -c <id>}: connection ID. If omitted, the first entry of
 * {@code connections} is used.</li>
 * <li>{@code --preview <rows>} or {@code -n <rows>}: rows shown in preview logs.</li>
 * </ul>
 *
 * <p>
 * Spring Boot binds {@link ConnectionConfig}, {@link PipelineConfig}, {@link SourceConfig} and
 * {@link DbUnitConfigProperties} from {@code application.yml} and wires them into
 * {@link EtlService}.
 * </p>
 *
 * @see EtlService
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final EtlService etlService;
    private final PipelineConfig pipelineConfig;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String sourceKind = null;
        String input = null;
        String table = null;
        String stages = null;
        String target = null;
        String preview = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--source":
                case "-s":
                    sourceKind = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--input":
                case "-i":
                    input = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--table":
                case "-t":
                    table = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--stages":
                case "-p":
                    stages = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--target":
                case "-c":
                    target = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--preview":
                case "-n":
                    preview = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (input == null || input.isBlank()) {
            ErrorHandler.errorAndExit("Input is required (--input <path|url>).");
            return;
        }
        if (table == null || table.isBlank()) {
            ErrorHandler.errorAndExit("Target table is required (--table <name>).");
            return;
        }

        EtlRequest request;
        try {
            SourceDescriptor source = sourceKind == null ? SourceDescriptor.of(input)
                    : new SourceDescriptor(SourceKind.parse(sourceKind), input);
            Set<StageId> enabled = stages == null ? null
                    : StageId.parseAll(Arrays.asList(stages.split(",")));
            if (preview != null) {
                pipelineConfig.setPreviewRows(Integer.parseInt(preview.trim()));
            }
            request = EtlRequest.builder().source(source).stages(enabled).connectionId(target)
                    .tableName(table).build();
        } catch (IllegalArgumentException e) {
            ErrorHandler.errorAndExit("Invalid argument: " + e.getMessage(), e);
            return;
        }

        log.info("Source: {} [{}], Stages: {}, Target: {}, Table: {}",
                request.getSource().getKind(), request.getSource().getLocation(),
                enabled(request), target == null ? "<default>" : target, table);

        EtlOutcome outcome = etlService.execute(request);
        if (outcome.isSuccess()) {
            log.info("Loaded {} rows into table '{}'", outcome.getRowsLoaded(),
                    outcome.getTableName());
        } else {
            ErrorHandler.errorAndExit("ETL failed: " + outcome.getReason());
        }
    }

    private Set<StageId> enabled(EtlRequest request) {
        return request.getStages() != null ? request.getStages()
                : pipelineConfig.resolveEnabledStages();
    }
}
