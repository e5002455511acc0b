/**
 * Configuration model package for StatLink.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} (backend connection,
 * data paths, import jobs) and the immutable {@link io.github.yok.statlink.config.BackendSettings}
 * derived from them once at startup.
 * </p>
 *
 * <p>
 * This package primarily holds configuration data; execution logic is implemented in {@code core}
 * and {@code db}.
 * </p>
 */
package io.github.yok.statlink.config;
