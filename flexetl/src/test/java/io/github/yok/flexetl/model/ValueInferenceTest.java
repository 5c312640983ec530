package io.github.yok.flexetl.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import java.lang.reflect.Constructor;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ValueInferenceTest {

    @Test
    void コンストラクタ_正常ケース_リフレクションで生成する_インスタンスが生成されること() throws Exception {
        Constructor<ValueInference> constructor = ValueInference.class.getDeclaredConstructor();
        constructor.setAccessible(true);
        assertEquals(ValueInference.class, constructor.newInstance().getClass());
    }

    @Test
    void parseNumber_正常ケース_各種数値表記を指定する_Doubleが返ること() {
        assertEquals(12.0, ValueInference.parseNumber("12"));
        assertEquals(-0.5, ValueInference.parseNumber(" -.5 "));
        assertEquals(1500.0, ValueInference.parseNumber("1.5e3"));
    }

    @Test
    void parseNumber_異常ケース_数値でない文字列を指定する_nullが返ること() {
        assertNull(ValueInference.parseNumber("abc"));
        assertNull(ValueInference.parseNumber("NaN"));
        assertNull(ValueInference.parseNumber("Infinity"));
        assertNull(ValueInference.parseNumber("1,000"));
    }

    @Test
    void infer_正常ケース_数値と欠損が混在する_NUMERICが返ること() {
        assertEquals(ColumnType.NUMERIC, ValueInference.infer(Arrays.asList("1", null, "2.5")));
    }

    @Test
    void infer_正常ケース_真偽値のみを指定する_BOOLEANが返ること() {
        assertEquals(ColumnType.BOOLEAN, ValueInference.infer(List.of("true", "FALSE")));
    }

    @Test
    void infer_正常ケース_全て欠損を指定する_TEXTが返ること() {
        assertEquals(ColumnType.TEXT, ValueInference.infer(Arrays.asList(null, null)));
        assertEquals(ColumnType.TEXT, ValueInference.infer(List.of("1", "x")));
    }

    @Test
    void toColumn_正常ケース_数値列を変換する_Double値の列が返ること() {
        Column column = ValueInference.toColumn("n", Arrays.asList("1", null, "3"));
        assertEquals(ColumnType.NUMERIC, column.getType());
        assertEquals(Arrays.asList(1.0, null, 3.0), column.getValues());
    }
}
