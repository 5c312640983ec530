package io.github.yok.flexetl.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DatasetTest {

    private static Dataset sample() {
        return Dataset.builder().column("id", ColumnType.NUMERIC).column("name", ColumnType.TEXT)
                .row(1.0, "a").row(2.0, null).row(3.0, "c").build();
    }

    @Test
    void constructor_異常ケース_列名が重複する_IllegalArgumentExceptionが送出されること() {
        Column a = new Column("x", ColumnType.NUMERIC, List.of(1.0));
        Column b = new Column("x", ColumnType.TEXT, List.of("t"));
        IllegalArgumentException ex =
                assertThrows(IllegalArgumentException.class, () -> new Dataset(List.of(a, b)));
        assertTrue(ex.getMessage().contains("Duplicate column name"));
    }

    @Test
    void constructor_異常ケース_列の長さが異なる_IllegalArgumentExceptionが送出されること() {
        Column a = new Column("a", ColumnType.NUMERIC, List.of(1.0, 2.0));
        Column b = new Column("b", ColumnType.NUMERIC, List.of(1.0));
        assertThrows(IllegalArgumentException.class, () -> new Dataset(List.of(a, b)));
    }

    @Test
    void column_異常ケース_型と値が一致しない_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> new Column("a", ColumnType.NUMERIC, List.of("text")));
    }

    @Test
    void empty_正常ケース_空データセットを取得する_行数と列数が0であること() {
        Dataset empty = Dataset.empty();
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.rowCount());
        assertEquals(0, empty.columnCount());
    }

    @Test
    void row_正常ケース_行を取得する_欠損はnullで返ること() {
        Dataset dataset = sample();
        assertEquals(Arrays.asList(2.0, null), dataset.row(1));
        assertEquals(3, dataset.rowCount());
        assertEquals(List.of("id", "name"), dataset.columnNames());
    }

    @Test
    void filterRows_正常ケース_全行を残す_同一インスタンスが返ること() {
        Dataset dataset = sample();
        assertSame(dataset, dataset.filterRows(i -> true));
    }

    @Test
    void filterRows_正常ケース_一部行を除外する_順序を保って残ること() {
        Dataset filtered = sample().filterRows(i -> i != 1);
        assertEquals(2, filtered.rowCount());
        assertEquals(List.of(1.0, "a"), filtered.row(0));
        assertEquals(List.of(3.0, "c"), filtered.row(1));
    }

    @Test
    void head_正常ケース_行数より大きい値を指定する_全行が返ること() {
        assertEquals(3, sample().head(10).rowCount());
        assertEquals(2, sample().head(2).rowCount());
        assertEquals(0, sample().head(-1).rowCount());
    }

    @Test
    void column_正常ケース_存在しない列名を指定する_空のOptionalが返ること() {
        assertFalse(sample().column("missing").isPresent());
        assertTrue(sample().hasColumn("name"));
        assertNull(sample().column("name").get().get(1));
    }

    @Test
    void uniqueName_正常ケース_既存列と予約名が衝突する_連番が付与されること() {
        Dataset dataset = sample();
        assertEquals("other", dataset.uniqueName("other", Set.of()));
        assertEquals("name_2", dataset.uniqueName("name", Set.of()));
        assertEquals("name_3", dataset.uniqueName("name", Set.of("name_2")));
    }

    @Test
    void builder_異常ケース_セル数が列数と異なる_IllegalArgumentExceptionが送出されること() {
        Dataset.Builder builder = Dataset.builder().column("a", ColumnType.TEXT);
        assertThrows(IllegalArgumentException.class, () -> builder.row("x", "y"));
    }

    @Test
    void equals_正常ケース_同じ内容のデータセットを比較する_等しいと判定されること() {
        assertEquals(sample(), sample());
    }
}
