/**
 * Validation gates and the conversion error hierarchy.
 *
 * <p>
 * Gates check documents at conversion boundaries: JSON structure against a JSON Schema, XML
 * against an XSD, and values against the dictionary. Caller-owned record validators are kept in a
 * {@link io.github.yok.ciflink.validation.ValidatorRegistry}.
 * </p>
 */
package io.github.yok.ciflink.validation;
