/**
 * Codecs at the boundaries of a conversion.
 *
 * <p>
 * Reads and writes CIF text, nested JSON/YAML trees, PDBML-style XML, flat JSON records and CSV
 * directories.
 * </p>
 */
package io.github.yok.ciflink.codec;
