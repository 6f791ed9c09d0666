/**
 * In-memory record store of CifLink.
 *
 * <p>
 * A {@link io.github.yok.ciflink.model.DataContainer} holds ordered data blocks, each block holds
 * ordered categories, and each category stores its items column-wise with equal column lengths.
 * </p>
 */
package io.github.yok.ciflink.model;
