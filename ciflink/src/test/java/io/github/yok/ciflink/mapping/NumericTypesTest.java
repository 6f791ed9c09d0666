package io.github.yok.ciflink.mapping;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class NumericTypesTest {

    @Test
    void isNumeric_正常ケース_辞書とXSDの数値型を指定する_trueが返却されること() {
        assertTrue(NumericTypes.isNumeric("int"));
        assertTrue(NumericTypes.isNumeric("Float"));
        assertTrue(NumericTypes.isNumeric("positive_int"));
        assertTrue(NumericTypes.isNumeric("xsd:decimal"));
        assertTrue(NumericTypes.isNumeric("xs:integer"));
    }

    @Test
    void isNumeric_正常ケース_数値以外の型を指定する_falseが返却されること() {
        assertFalse(NumericTypes.isNumeric(null));
        assertFalse(NumericTypes.isNumeric("code"));
        assertFalse(NumericTypes.isNumeric("text"));
        assertFalse(NumericTypes.isNumeric("xsd:string"));
        assertFalse(NumericTypes.isNumeric("foo:int"));
    }
}
