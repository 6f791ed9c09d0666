/**
 * Flattening of nested JSON trees into categories, with foreign keys filled from the enclosing
 * records.
 */
package io.github.yok.ciflink.flatten;
