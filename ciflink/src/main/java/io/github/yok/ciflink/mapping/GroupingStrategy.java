package io.github.yok.ciflink.mapping;

/**
 * How rows of a category are identified.
 *
 * @author Yasuharu.Okawauchi
 */
public enum GroupingStrategy {

    // At most one key item.
    SINGLE_KEY,

    // Two or more key items.
    COMPOSITE_KEY
}
