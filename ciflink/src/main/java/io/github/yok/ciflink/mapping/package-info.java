/**
 * Mapping rules between flat categories and hierarchical documents.
 *
 * <p>
 * {@link io.github.yok.ciflink.mapping.MappingGenerator} combines dictionary and schema metadata
 * into {@link io.github.yok.ciflink.mapping.MappingRules}: per-category item placement, the
 * foreign-key map and the candidate parent relations.
 * </p>
 */
package io.github.yok.ciflink.mapping;
