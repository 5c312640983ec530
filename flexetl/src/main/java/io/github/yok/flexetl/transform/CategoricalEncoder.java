package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.model.Column;
import io.github.yok.flexetl.model.ColumnType;
import io.github.yok.flexetl.model.Dataset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * One-hot encodes every text column, dropping the first category.
 *
 * <p>
 * For a text column with {@code k} distinct non-missing values, the categories are sorted with
 * {@link String#compareTo(String)} and the first one is dropped; each remaining category
 * {@code v} yields a boolean column {@code <column>_<v>} that is {@code true} exactly where the
 * source cell equals {@code v}. The {@code k - 1} indicator columns take the source column's
 * position and the source column is removed. A row whose source cell is missing gets
 * {@code false} in every indicator.
 * </p>
 *
 * <p>
 * An indicator name that clashes with an existing column gets a {@code _2}, {@code _3}, …
 * suffix. Numeric, date-time and boolean columns pass through unchanged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CategoricalEncoder implements TransformStage {

    @Override
    public StageId id() {
        return StageId.ENCODE_CATEGORICAL;
    }

    @Override
    public Dataset apply(Dataset input) {
        List<Column> columns = new ArrayList<>(input.columnCount());
        Set<String> produced = new HashSet<>();
        for (Column column : input.columns()) {
            if (column.getType() != ColumnType.TEXT) {
                columns.add(column);
                continue;
            }
            List<Column> indicators = encode(input, column, produced);
            log.debug("Column '{}' encoded into {} indicator column(s)", column.getName(),
                    indicators.size());
            columns.addAll(indicators);
        }
        return input.withColumns(columns);
    }

    private List<Column> encode(Dataset input, Column column, Set<String> produced) {
        TreeSet<String> categories = new TreeSet<>();
        for (Object value : column.getValues()) {
            if (value != null) {
                categories.add((String) value);
            }
        }
        List<Column> indicators = new ArrayList<>();
        if (categories.isEmpty()) {
            return indicators;
        }
        categories.pollFirst();
        for (String category : categories) {
            List<Object> flags = new ArrayList<>(column.size());
            for (Object value : column.getValues()) {
                flags.add(category.equals(value));
            }
            String name = input.uniqueName(column.getName() + "_" + category, produced);
            produced.add(name);
            indicators.add(new Column(name, ColumnType.BOOLEAN, flags));
        }
        return indicators;
    }
}
