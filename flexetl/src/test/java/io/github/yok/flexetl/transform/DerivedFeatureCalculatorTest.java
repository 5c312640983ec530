package io.github.yok.flexetl.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexetl.model.ColumnType;
import io.github.yok.flexetl.model.Dataset;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class DerivedFeatureCalculatorTest {

    private final DerivedFeatureCalculator stage = new DerivedFeatureCalculator();

    @Test
    void apply_正常ケース_priceとquantityがある_total_valueが末尾に追加されること() throws Exception {
        Dataset input = Dataset.builder().column("price", ColumnType.NUMERIC)
                .column("quantity", ColumnType.NUMERIC).row(10.0, 2.0).row(5.0, 4.0)
                .row(null, 1.0).build();

        Dataset output = stage.apply(input);

        assertEquals(List.of("price", "quantity", "total_value"), output.columnNames());
        assertEquals(Arrays.asList(20.0, 20.0, null),
                output.column("total_value").get().getValues());
    }

    @Test
    void apply_正常ケース_total_valueが既に存在する_同じ位置で置き換えられること() throws Exception {
        Dataset input = Dataset.builder().column("total_value", ColumnType.TEXT)
                .column("price", ColumnType.NUMERIC).column("quantity", ColumnType.NUMERIC)
                .row("old", 3.0, 3.0).build();

        Dataset output = stage.apply(input);

        assertEquals(List.of("total_value", "price", "quantity"), output.columnNames());
        assertEquals(9.0, output.row(0).get(0));
    }

    @Test
    void apply_正常ケース_quantity列がない_入力がそのまま返ること() throws Exception {
        Dataset input = Dataset.builder().column("price", ColumnType.NUMERIC).row(1.0).build();

        assertSame(input, stage.apply(input));
    }

    @Test
    void apply_異常ケース_priceが数値でない_TransformExceptionが送出されること() {
        Dataset input = Dataset.builder().column("price", ColumnType.TEXT)
                .column("quantity", ColumnType.NUMERIC).row("cheap", 1.0).build();

        TransformException ex = assertThrows(TransformException.class, () -> stage.apply(input));
        assertTrue(ex.getMessage().contains("price"));
    }
}
