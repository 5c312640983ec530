package io.github.yok.flexetl.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.flexetl.model.Column;
import io.github.yok.flexetl.model.ColumnType;
import io.github.yok.flexetl.model.Dataset;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of {@link DatasetSource} that reads a JSON document into a {@link Dataset}.
 *
 * <p>
 * Accepted shapes:
 * </p>
 * <ul>
 * <li>an array of objects: one row per object; the columns are the union of the keys in
 * first-seen order and an absent key is a missing cell</li>
 * <li>an object whose values are all arrays of the same length: one column per key</li>
 * <li>any other object: a single row</li>
 * </ul>
 *
 * <p>
 * A column whose non-null values are all numbers is numeric, all booleans is boolean; otherwise it
 * is text and numbers, booleans and nested values are kept as their JSON text. JSON {@code null}
 * is a missing cell. Any other document yields no dataset.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JsonDatasetSource implements DatasetSource {

    private final ObjectMapper mapper;

    public JsonDatasetSource() {
        this(new ObjectMapper());
    }

    public JsonDatasetSource(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<Dataset> extract(SourceDescriptor descriptor) throws IOException {
        Path path = Path.of(descriptor.getLocation());
        try (InputStream in = Files.newInputStream(path)) {
            return read(in.readAllBytes(), descriptor.getLocation());
        }
    }

    /**
     * Reads JSON bytes.
     *
     * @param body UTF-8 (or other Jackson-detected encoding) JSON bytes
     * @param origin description of the input for logs
     * @return the dataset, or {@link Optional#empty()} if the bytes are not a JSON array or object
     *         of the accepted shapes
     */
    public Optional<Dataset> read(byte[] body, String origin) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("JSON could not be parsed ({}): {}", origin, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.warn("JSON could not be read ({}): {}", origin, e.getMessage());
            return Optional.empty();
        }
        Optional<Dataset> dataset = toDataset(root, origin);
        dataset.ifPresent(d -> log.info("JSON extracted ({}): rows={}, columns={}", origin,
                d.rowCount(), d.columnCount()));
        return dataset;
    }

    private Optional<Dataset> toDataset(JsonNode root, String origin) {
        if (root == null || root.isMissingNode()) {
            log.warn("JSON document is empty ({})", origin);
            return Optional.empty();
        }
        if (root.isArray()) {
            List<JsonNode> rows = new ArrayList<>();
            for (JsonNode element : root) {
                if (!element.isObject()) {
                    log.warn("JSON array element is not an object ({}): {}", origin, element);
                    return Optional.empty();
                }
                rows.add(element);
            }
            return Optional.of(fromRows(rows));
        }
        if (root.isObject()) {
            if (isColumnOriented(root)) {
                return Optional.of(fromColumns(root));
            }
            return Optional.of(fromRows(List.of(root)));
        }
        log.warn("JSON document is neither an array nor an object ({})", origin);
        return Optional.empty();
    }

    private static boolean isColumnOriented(JsonNode root) {
        if (root.size() == 0) {
            return false;
        }
        int length = -1;
        for (JsonNode value : root) {
            if (!value.isArray()) {
                return false;
            }
            if (length >= 0 && value.size() != length) {
                return false;
            }
            length = value.size();
        }
        return true;
    }

    private static Dataset fromRows(List<JsonNode> rows) {
        Map<String, List<JsonNode>> cells = new LinkedHashMap<>();
        for (int r = 0; r < rows.size(); r++) {
            Iterator<Map.Entry<String, JsonNode>> fields = rows.get(r).fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                List<JsonNode> values = cells.get(field.getKey());
                if (values == null) {
                    values = new ArrayList<>(rows.size());
                    for (int pad = 0; pad < rows.size(); pad++) {
                        values.add(null);
                    }
                    cells.put(field.getKey(), values);
                }
                values.set(r, field.getValue());
            }
        }
        List<Column> columns = new ArrayList<>(cells.size());
        for (Map.Entry<String, List<JsonNode>> entry : cells.entrySet()) {
            columns.add(toColumn(entry.getKey(), entry.getValue()));
        }
        return new Dataset(columns);
    }

    private static Dataset fromColumns(JsonNode root) {
        List<Column> columns = new ArrayList<>(root.size());
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<JsonNode> values = new ArrayList<>(field.getValue().size());
            field.getValue().forEach(values::add);
            columns.add(toColumn(field.getKey(), values));
        }
        return new Dataset(columns);
    }

    private static Column toColumn(String name, List<JsonNode> nodes) {
        boolean any = false;
        boolean numeric = true;
        boolean bool = true;
        for (JsonNode node : nodes) {
            if (isMissing(node)) {
                continue;
            }
            any = true;
            numeric = numeric && node.isNumber();
            bool = bool && node.isBoolean();
        }
        ColumnType type = !any ? ColumnType.TEXT
                : numeric ? ColumnType.NUMERIC : bool ? ColumnType.BOOLEAN : ColumnType.TEXT;

        List<Object> values = new ArrayList<>(nodes.size());
        for (JsonNode node : nodes) {
            if (isMissing(node)) {
                values.add(null);
            } else if (type == ColumnType.NUMERIC) {
                values.add(node.doubleValue());
            } else if (type == ColumnType.BOOLEAN) {
                values.add(node.booleanValue());
            } else {
                values.add(node.isValueNode() ? node.asText() : node.toString());
            }
        }
        return new Column(name, type, values);
    }

    private static boolean isMissing(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
