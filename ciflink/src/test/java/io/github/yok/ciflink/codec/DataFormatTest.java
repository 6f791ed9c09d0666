package io.github.yok.ciflink.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class DataFormatTest {

    @Test
    void fromExtension_正常ケース_大文字小文字混在の拡張子を指定する_対応する形式が返却されること() {
        assertEquals(DataFormat.CIF, DataFormat.fromExtension("mmCIF"));
        assertEquals(DataFormat.CIF, DataFormat.fromExtension("dic"));
        assertEquals(DataFormat.YAML, DataFormat.fromExtension("YML"));
        assertEquals(DataFormat.JSON, DataFormat.fromExtension("json"));
        assertEquals(DataFormat.XML, DataFormat.fromExtension("xml"));
    }

    @Test
    void fromExtension_異常ケース_未知の拡張子を指定する_nullが返却されること() {
        assertNull(DataFormat.fromExtension("txt"));
        assertNull(DataFormat.fromExtension(null));
    }

    @Test
    void matches_正常ケース_拡張子を指定する_判定結果が返却されること() {
        assertTrue(DataFormat.CSV.matches("CSV"));
        assertFalse(DataFormat.CSV.matches(null));
        assertFalse(DataFormat.JSON.matches("yaml"));
    }
}
