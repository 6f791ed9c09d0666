package io.github.yok.ciflink.config;

/**
 * How strictly a conversion treats invalid or inconsistent data.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ConversionMode {

    // Validation gates run; orphans and duplicate single children fail the conversion.
    STRICT,

    // Gates are skipped; orphans become top-level records and duplicates fall back to lists.
    PERMISSIVE;

    public static ConversionMode of(boolean permissive) {
        return permissive ? PERMISSIVE : STRICT;
    }
}
