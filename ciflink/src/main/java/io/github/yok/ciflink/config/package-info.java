/**
 * Configuration model package for CifLink.
 *
 * <p>
 * Defines the classes bound from {@code application.yml} and the conversion mode.
 * </p>
 */
package io.github.yok.ciflink.config;
