package io.github.yok.ciflink.mapping;

import com.google.common.collect.ImmutableSet;
import java.util.Locale;
import java.util.Set;

/**
 * Type codes whose values are numbers.
 *
 * <p>
 * Dictionary codes and XSD type names are both recognized; {@code xs:} and {@code xsd:} prefixes
 * are ignored and comparison is case-insensitive.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class NumericTypes {

    private static final Set<String> CODES = ImmutableSet.of("int", "float", "real", "number",
            "numb", "positive_int", "integer", "decimal", "double", "long", "short",
            "nonnegativeinteger", "positiveinteger");

    private NumericTypes() {
        throw new AssertionError("NumericTypes must not be instantiated.");
    }

    /**
     * Returns whether a type code denotes numbers.
     *
     * @param typeCode dictionary type code or XSD type name; may be {@code null}
     * @return {@code true} for numeric types
     */
    public static boolean isNumeric(String typeCode) {
        if (typeCode == null) {
            return false;
        }
        String code = typeCode.trim().toLowerCase(Locale.ROOT);
        int colon = code.indexOf(':');
        if (colon >= 0) {
            String prefix = code.substring(0, colon);
            if (!prefix.equals("xs") && !prefix.equals("xsd")) {
                return false;
            }
            code = code.substring(colon + 1);
        }
        return CODES.contains(code);
    }
}
