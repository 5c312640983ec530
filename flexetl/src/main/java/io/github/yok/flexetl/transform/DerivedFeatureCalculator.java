package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.model.Column;
import io.github.yok.flexetl.model.ColumnType;
import io.github.yok.flexetl.model.Dataset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Adds {@code total_value = price * quantity} when both input columns exist.
 *
 * <p>
 * Column names are matched exactly. The product is missing when either factor is missing. An
 * existing {@code total_value} column is replaced in place; otherwise the new column is appended.
 * Without both inputs the dataset is returned unchanged.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DerivedFeatureCalculator implements TransformStage {

    static final String PRICE = "price";
    static final String QUANTITY = "quantity";
    static final String TOTAL_VALUE = "total_value";

    @Override
    public StageId id() {
        return StageId.DERIVE_FEATURES;
    }

    /**
     * {@inheritDoc}
     *
     * @throws TransformException if {@code price} or {@code quantity} is not numeric
     */
    @Override
    public Dataset apply(Dataset input) throws TransformException {
        Optional<Column> price = input.column(PRICE);
        Optional<Column> quantity = input.column(QUANTITY);
        if (price.isEmpty() || quantity.isEmpty()) {
            return input;
        }
        requireNumeric(price.get());
        requireNumeric(quantity.get());

        List<Object> totals = new ArrayList<>(input.rowCount());
        for (int row = 0; row < input.rowCount(); row++) {
            Double p = price.get().getNumber(row);
            Double q = quantity.get().getNumber(row);
            totals.add(p == null || q == null ? null : p * q);
        }
        Column total = new Column(TOTAL_VALUE, ColumnType.NUMERIC, totals);

        List<Column> columns = new ArrayList<>(input.columnCount() + 1);
        boolean replaced = false;
        for (Column column : input.columns()) {
            if (column.getName().equals(TOTAL_VALUE)) {
                columns.add(total);
                replaced = true;
            } else {
                columns.add(column);
            }
        }
        if (!replaced) {
            columns.add(total);
        }
        log.debug("Column '{}' derived from '{}' and '{}'", TOTAL_VALUE, PRICE, QUANTITY);
        return input.withColumns(columns);
    }

    private void requireNumeric(Column column) throws TransformException {
        if (column.getType() != ColumnType.NUMERIC) {
            throw new TransformException("Column '" + column.getName()
                    + "' must be numeric to derive " + TOTAL_VALUE + " but is "
                    + column.getType());
        }
    }
}
