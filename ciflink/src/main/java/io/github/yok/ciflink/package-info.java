/**
 * Root package of CifLink.
 *
 * <p>
 * Provides a CLI/library that converts between flat mmCIF categories and nested JSON/YAML/XML
 * documents, driven by a CIF dictionary and an XML schema.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.ciflink.model}: in-memory record store</li>
 * <li>{@code io.github.yok.ciflink.metadata}: dictionary/schema parsing and caching</li>
 * <li>{@code io.github.yok.ciflink.mapping}: mapping rules and the foreign-key map</li>
 * <li>{@code io.github.yok.ciflink.resolve}: nesting of flat records</li>
 * <li>{@code io.github.yok.ciflink.flatten}: flattening of nested trees</li>
 * <li>{@code io.github.yok.ciflink.validation}: validation gates and conversion errors</li>
 * <li>{@code io.github.yok.ciflink.codec}: file formats</li>
 * <li>{@code io.github.yok.ciflink.core}: conversion pipeline</li>
 * </ul>
 */
package io.github.yok.ciflink;
