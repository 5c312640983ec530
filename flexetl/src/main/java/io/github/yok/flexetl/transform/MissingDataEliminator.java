package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.model.Column;
import io.github.yok.flexetl.model.Dataset;
import lombok.extern.slf4j.Slf4j;

/**
 * Drops every row that has a missing cell in any column. The column set is unchanged; a result
 * without rows is a valid dataset, not an error.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MissingDataEliminator implements TransformStage {

    @Override
    public StageId id() {
        return StageId.DROP_MISSING;
    }

    @Override
    public Dataset apply(Dataset input) {
        Dataset result = input.filterRows(row -> {
            for (Column column : input.columns()) {
                if (column.get(row) == null) {
                    return false;
                }
            }
            return true;
        });
        log.debug("Rows with missing values dropped: {}", input.rowCount() - result.rowCount());
        return result;
    }
}
