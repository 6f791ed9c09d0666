package io.github.yok.ciflink.metadata;

/**
 * Where a parent-child link was declared. Grouped declarations are more specific than general
 * ones.
 *
 * @author Yasuharu.Okawauchi
 */
public enum LinkSource {

    // item_linked rows inside item save frames.
    GENERAL,

    // pdbx_item_linked_group_list rows.
    GROUPED;

    /**
     * Returns whether this source outranks the other one.
     *
     * @param other other source
     * @return {@code true} if this source is more specific
     */
    public boolean isMoreSpecificThan(LinkSource other) {
        return ordinal() > other.ordinal();
    }
}
