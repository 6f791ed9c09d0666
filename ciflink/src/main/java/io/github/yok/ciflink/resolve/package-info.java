/**
 * Nesting of flat records into a hierarchical JSON tree driven by the foreign-key map.
 */
package io.github.yok.ciflink.resolve;
