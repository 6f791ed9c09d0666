package io.github.yok.ciflink.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class JsonValuesTest {

    @Test
    void toJson_正常ケース_数値項目の整数を指定する_整数ノードが返却されること() {
        JsonNode node = JsonValues.toJson("42", true);
        assertTrue(node.isIntegralNumber());
        assertEquals("42", node.asText());
    }

    @Test
    void toJson_正常ケース_数値項目の小数を指定する_末尾のゼロを保持した小数ノードが返却されること() {
        JsonNode node = JsonValues.toJson("14331.160", true);
        assertTrue(node.isBigDecimal());
        assertEquals(new BigDecimal("14331.160"), node.decimalValue());
    }

    @Test
    void toJson_正常ケース_数値項目の指数表記を指定する_指数表記のまま文字列へ戻ること() {
        JsonNode node = JsonValues.toJson("1E+3", true);
        assertTrue(node.isBigDecimal());
        assertFalse(node.isIntegralNumber());
        assertEquals("1E+3", JsonValues.toText(node));
        assertEquals("1.5E+10", JsonValues.toText(JsonValues.toJson("1.5E+10", true)));
    }

    @Test
    void toJson_正常ケース_数値項目の非数値を指定する_文字列ノードが返却されること() {
        JsonNode node = JsonValues.toJson("1.2(3)", true);
        assertTrue(node.isTextual());
        assertEquals("1.2(3)", node.asText());
    }

    @Test
    void toJson_正常ケース_文字列項目の数字を指定する_文字列ノードが返却されること() {
        JsonNode node = JsonValues.toJson("007", false);
        assertTrue(node.isTextual());
        assertEquals("007", node.asText());
    }

    @Test
    void toJson_正常ケース_ヌルトークンを指定する_NullNodeが返却されること() {
        assertTrue(JsonValues.toJson("?", true).isNull());
        assertTrue(JsonValues.toJson(".", false).isNull());
    }

    @Test
    void toText_正常ケース_各種ノードを指定する_CIF値の文字列が返却されること() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        assertEquals("?", JsonValues.toText(NullNode.getInstance()));
        assertEquals("?", JsonValues.toText(MissingNode.getInstance()));
        assertEquals("?", JsonValues.toText(null));
        assertEquals("18.015", JsonValues.toText(f.numberNode(new BigDecimal("18.015"))));
        assertEquals("0.5", JsonValues.toText(f.numberNode(0.5d)));
        assertEquals("7", JsonValues.toText(f.numberNode(7)));
        assertEquals("true", JsonValues.toText(f.booleanNode(true)));
        assertEquals("A", JsonValues.toText(f.textNode("A")));
    }

    @Test
    void isNumber_正常ケース_各種の文字列を指定する_数値判定が返却されること() {
        assertTrue(JsonValues.isNumber("1e3"));
        assertTrue(JsonValues.isNumber(" -2.5 "));
        assertFalse(JsonValues.isNumber("1.2(3)"));
        assertFalse(JsonValues.isNumber("abc"));
    }
}
