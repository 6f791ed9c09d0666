package io.github.yok.ciflink.metadata;

/**
 * Placement of an item in the hierarchical XML document.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ItemLocation {

    // Attribute of the row element.
    ATTRIBUTE,

    // Text content of the row element itself.
    ELEMENT_CONTENT,

    // Child element of the row element.
    ELEMENT
}
