package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.model.Column;
import io.github.yok.flexetl.model.ColumnType;
import io.github.yok.flexetl.model.Dataset;
import io.github.yok.flexetl.model.ValueInference;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Re-infers the type of every text column from its current values.
 *
 * <p>
 * A text column whose non-missing cells are all numbers becomes numeric; one whose cells are all
 * {@code true}/{@code false} becomes boolean. Ambiguous columns stay text. Numeric, boolean and
 * date-time columns are already typed and pass through. This stage never fails.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TypeCoercion implements TransformStage {

    @Override
    public StageId id() {
        return StageId.CONVERT_TYPES;
    }

    @Override
    public Dataset apply(Dataset input) {
        List<Column> columns = new ArrayList<>(input.columnCount());
        for (Column column : input.columns()) {
            if (column.getType() != ColumnType.TEXT) {
                columns.add(column);
                continue;
            }
            List<String> texts = new ArrayList<>(column.size());
            for (Object value : column.getValues()) {
                texts.add((String) value);
            }
            Column coerced = ValueInference.toColumn(column.getName(), texts);
            if (coerced.getType() != ColumnType.TEXT) {
                log.debug("Column '{}' converted to {}", column.getName(), coerced.getType());
                columns.add(coerced);
            } else {
                columns.add(column);
            }
        }
        return input.withColumns(columns);
    }
}
