package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.model.Column;
import io.github.yok.flexetl.model.Dataset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Cleans column names and removes exact-duplicate rows.
 *
 * <p>
 * <strong>Column names</strong> are lower-cased and trimmed. Each internal whitespace character
 * becomes its own underscore, as does any other character outside {@code [a-z0-9_]}. A name
 * left empty becomes {@code column_<n>} (1-based position). Names that collide after cleaning get
 * {@code _2}, {@code _3}, … suffixes in column order.
 * </p>
 *
 * <p>
 * <strong>Rows</strong> that equal an earlier row in every column (missing equals missing) are
 * dropped; the first occurrence keeps its position.
 * </p>
 *
 * <p>
 * Applying this stage to its own output changes nothing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ColumnNormalizer implements TransformStage {

    private static final Pattern INVALID_CHARS = Pattern.compile("[^a-z0-9_]");

    @Override
    public StageId id() {
        return StageId.NORMALIZE_COLUMNS;
    }

    @Override
    public Dataset apply(Dataset input) {
        Dataset renamed = renameColumns(input);
        return removeDuplicateRows(renamed);
    }

    /**
     * Cleans a single column name without resolving collisions.
     *
     * @param name raw column name
     * @return cleaned name, possibly empty
     */
    static String cleanName(String name) {
        String cleaned = name.toLowerCase(Locale.ROOT).strip();
        return INVALID_CHARS.matcher(cleaned).replaceAll("_");
    }

    private Dataset renameColumns(Dataset input) {
        List<Column> renamed = new ArrayList<>(input.columnCount());
        Set<String> used = new HashSet<>();
        int position = 0;
        for (Column column : input.columns()) {
            position++;
            String base = cleanName(column.getName());
            if (base.isEmpty()) {
                base = "column_" + position;
            }
            String name = base;
            int suffix = 2;
            while (used.contains(name)) {
                name = base + "_" + suffix++;
            }
            used.add(name);
            if (!name.equals(column.getName())) {
                log.debug("Column renamed: '{}' -> '{}'", column.getName(), name);
            }
            renamed.add(column.rename(name));
        }
        return input.withColumns(renamed);
    }

    private Dataset removeDuplicateRows(Dataset input) {
        Set<List<Object>> seen = new HashSet<>();
        List<Integer> kept = new ArrayList<>(input.rowCount());
        for (int row = 0; row < input.rowCount(); row++) {
            if (seen.add(input.row(row))) {
                kept.add(row);
            }
        }
        int dropped = input.rowCount() - kept.size();
        if (dropped == 0) {
            return input;
        }
        log.debug("Duplicate rows removed: {}", dropped);
        return input.selectRows(kept);
    }
}
