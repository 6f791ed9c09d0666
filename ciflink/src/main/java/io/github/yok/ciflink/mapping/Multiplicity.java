package io.github.yok.ciflink.mapping;

/**
 * Number of child records a parent record may own through one relation.
 *
 * @author Yasuharu.Okawauchi
 */
public enum Multiplicity {

    // The links fix the child's whole key: one child per parent, rendered as an object.
    SINGLE,

    // Any number of children per parent, rendered as a list.
    MULTIPLE
}
