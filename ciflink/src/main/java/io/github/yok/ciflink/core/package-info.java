/**
 * Core conversion workflow of CifLink.
 *
 * <p>
 * {@link io.github.yok.ciflink.core.ConversionPipeline} ties metadata, mapping, nesting,
 * flattening and the validation gates together.
 * </p>
 */
package io.github.yok.ciflink.core;
