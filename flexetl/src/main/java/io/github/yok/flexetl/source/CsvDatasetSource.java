package io.github.yok.flexetl.source;

import io.github.yok.flexetl.config.SourceConfig;
import io.github.yok.flexetl.model.Column;
import io.github.yok.flexetl.model.Dataset;
import io.github.yok.flexetl.model.ValueInference;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.IOUtils;

/**
 * Implementation of {@link DatasetSource} that reads a CSV file into a {@link Dataset}.
 *
 * <p>
 * The first record is the header. The delimiter is taken from {@code source.csv.delimiter} or, when
 * unset, inferred from the header line as the most frequent of {@code , ; TAB |} outside quotes
 * (comma on a tie or when none occurs). Empty lines are skipped. Cells equal to one of
 * {@code source.missing-tokens} become missing, as do the trailing cells of a short record. Column
 * types are inferred with {@link ValueInference}.
 * </p>
 *
 * <p>
 * Header names are kept as written; an empty name becomes {@code Unnamed: <index>} and a repeated
 * name gets a {@code .1}, {@code .2}, … suffix so that column names stay unique.
 * </p>
 *
 * <p>
 * Input that is not well-formed CSV (no header, unterminated quote, a record longer than the
 * header) yields no dataset.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvDatasetSource implements DatasetSource {

    private static final char[] DELIMITER_CANDIDATES = {',', ';', '\t', '|'};

    private final SourceConfig config;

    public CsvDatasetSource(SourceConfig config) {
        this.config = config;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<Dataset> extract(SourceDescriptor descriptor) throws IOException {
        Path path = Path.of(descriptor.getLocation());
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, descriptor.getLocation());
        }
    }

    /**
     * Reads CSV bytes.
     *
     * @param in CSV bytes in the configured character set
     * @param origin description of the input for logs
     * @return the dataset, or {@link Optional#empty()} if the bytes are not well-formed CSV
     * @throws IOException if the stream cannot be read
     */
    public Optional<Dataset> read(InputStream in, String origin) throws IOException {
        Charset charset = config.getCsv().getCharset();
        String text = IOUtils.toString(in, charset);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        Character configured = config.getCsv().getDelimiter();
        char delimiter = configured != null ? configured : inferDelimiter(firstLine(text));
        try {
            return parse(text, delimiter, origin);
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            log.warn("CSV could not be parsed ({}): {}", origin, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Infers the delimiter of a header line.
     *
     * @param headerLine first line of the file
     * @return most frequent candidate outside quotes; comma on a tie or when none occurs
     */
    static char inferDelimiter(String headerLine) {
        int[] counts = new int[DELIMITER_CANDIDATES.length];
        boolean quoted = false;
        for (char ch : headerLine.toCharArray()) {
            if (ch == '"') {
                quoted = !quoted;
                continue;
            }
            if (quoted) {
                continue;
            }
            for (int i = 0; i < DELIMITER_CANDIDATES.length; i++) {
                if (ch == DELIMITER_CANDIDATES[i]) {
                    counts[i]++;
                }
            }
        }
        int best = 0;
        for (int i = 1; i < counts.length; i++) {
            if (counts[i] > counts[best]) {
                best = i;
            }
        }
        return DELIMITER_CANDIDATES[best];
    }

    private static String firstLine(String text) {
        for (String line : text.split("\\R", -1)) {
            if (!line.isBlank()) {
                return line;
            }
        }
        return "";
    }

    private Optional<Dataset> parse(String text, char delimiter, String origin)
            throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder().setDelimiter(delimiter)
                .setIgnoreEmptyLines(true).get();
        Set<String> missingTokens = new HashSet<>(config.getMissingTokens());

        List<String> header = null;
        List<List<String>> cells = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(new StringReader(text), format)) {
            for (CSVRecord record : parser) {
                if (header == null) {
                    header = uniqueHeader(record.toList());
                    for (int c = 0; c < header.size(); c++) {
                        cells.add(new ArrayList<>());
                    }
                    continue;
                }
                if (record.size() > header.size()) {
                    throw new IllegalStateException("Expected " + header.size()
                            + " fields in line " + record.getRecordNumber() + ", saw "
                            + record.size());
                }
                for (int c = 0; c < header.size(); c++) {
                    String value = c < record.size() ? record.get(c) : null;
                    cells.get(c).add(value == null || missingTokens.contains(value) ? null : value);
                }
            }
        }
        if (header == null) {
            log.warn("CSV has no header ({})", origin);
            return Optional.empty();
        }

        List<Column> columns = new ArrayList<>(header.size());
        for (int c = 0; c < header.size(); c++) {
            columns.add(ValueInference.toColumn(header.get(c), cells.get(c)));
        }
        Dataset dataset = new Dataset(columns);
        log.info("CSV extracted ({}): rows={}, columns={}, delimiter='{}'", origin,
                dataset.rowCount(), dataset.columnCount(), delimiter);
        return Optional.of(dataset);
    }

    private static List<String> uniqueHeader(List<String> raw) {
        Set<String> used = new LinkedHashSet<>();
        List<String> names = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            String base = raw.get(i);
            if (base == null || base.isBlank()) {
                base = "Unnamed: " + i;
            }
            String name = base;
            int suffix = 1;
            while (used.contains(name)) {
                name = base + "." + suffix++;
            }
            used.add(name);
            names.add(name);
        }
        return names;
    }
}
