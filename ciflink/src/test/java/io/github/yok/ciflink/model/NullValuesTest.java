package io.github.yok.ciflink.model;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class NullValuesTest {

    @Test
    void isNull_正常ケース_ヌルトークンを指定する_trueが返却されること() {
        assertTrue(NullValues.isNull(null));
        assertTrue(NullValues.isNull("?"));
        assertTrue(NullValues.isNull("."));
        assertTrue(NullValues.isNull(" ? "));
        assertTrue(NullValues.isNull(""));
        assertTrue(NullValues.isNull("''"));
        assertTrue(NullValues.isNull("\"\""));
    }

    @Test
    void isNull_正常ケース_通常の値を指定する_falseが返却されること() {
        assertFalse(NullValues.isNull("0"));
        assertFalse(NullValues.isNull("?A"));
        assertFalse(NullValues.isNull("1.5"));
    }
}
