package io.github.yok.ciflink.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.yok.ciflink.model.NullValues;
import java.math.BigDecimal;

/**
 * Conversion of item values between CIF text and JSON scalars.
 *
 * <p>
 * Null tokens map to JSON {@code null}. A numeric item becomes a JSON number only when its text is
 * the canonical form of that number, so the number reads back to the same text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class JsonValues {

    private JsonValues() {
        throw new AssertionError("JsonValues must not be instantiated.");
    }

    /**
     * Converts a CIF value to a JSON scalar.
     *
     * @param value CIF value
     * @param numeric whether the item holds numbers
     * @return JSON scalar
     */
    public static JsonNode toJson(String value, boolean numeric) {
        if (NullValues.isNull(value)) {
            return NullNode.getInstance();
        }
        if (numeric) {
            BigDecimal number = parseCanonical(value);
            if (number != null) {
                // 1E+3 has a negative scale and must keep its exponent form
                if (number.scale() == 0) {
                    return JsonNodeFactory.instance.numberNode(number.toBigIntegerExact());
                }
                return DecimalNode.valueOf(number);
            }
        }
        return TextNode.valueOf(value);
    }

    /**
     * Converts a JSON scalar to CIF text. JSON {@code null} and missing nodes become {@code ?}.
     *
     * @param node JSON scalar
     * @return CIF value
     */
    public static String toText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullValues.UNKNOWN;
        }
        if (node.isBigDecimal()) {
            return node.decimalValue().toString();
        }
        if (node.isFloatingPointNumber()) {
            return BigDecimal.valueOf(node.doubleValue()).toString();
        }
        return node.asText();
    }

    /**
     * Returns whether the value parses as a number.
     *
     * @param value text
     * @return {@code true} if numeric
     */
    public static boolean isNumber(String value) {
        try {
            new BigDecimal(value.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static BigDecimal parseCanonical(String value) {
        try {
            BigDecimal number = new BigDecimal(value);
            return number.toString().equals(value) ? number : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
