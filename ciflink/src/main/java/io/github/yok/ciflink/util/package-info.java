/**
 * Utility package for CifLink.
 *
 * <p>
 * Provides category dependency ordering and fatal-error reporting for the command line.
 * </p>
 */
package io.github.yok.ciflink.util;
