/**
 * Dictionary and schema metadata.
 *
 * <p>
 * Parses CIF dictionaries and XML schemas into plain beans and caches them per source version in
 * memory and, optionally, on disk.
 * </p>
 */
package io.github.yok.ciflink.metadata;
