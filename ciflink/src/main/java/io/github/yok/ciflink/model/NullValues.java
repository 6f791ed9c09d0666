package io.github.yok.ciflink.model;

import com.google.common.collect.ImmutableSet;
import java.util.Set;

/**
 * Null tokens of the CIF data model.
 *
 * <p>
 * {@code ?} marks an unknown value and {@code .} an inapplicable one. The empty string and the
 * quoted empties {@code ''} / {@code ""} are treated the same way when relationships and types are
 * inferred.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class NullValues {

    /** Token written for values that are missing. */
    public static final String UNKNOWN = "?";

    /** Token for inapplicable values. */
    public static final String INAPPLICABLE = ".";

    private static final Set<String> TOKENS =
            ImmutableSet.of(UNKNOWN, INAPPLICABLE, "", "''", "\"\"");

    private NullValues() {
        throw new AssertionError("NullValues must not be instantiated.");
    }

    /**
     * Returns whether the given value is a null token. {@code null} itself counts as one.
     *
     * @param value raw value
     * @return {@code true} if the value carries no data
     */
    public static boolean isNull(String value) {
        return value == null || TOKENS.contains(value.trim());
    }
}
