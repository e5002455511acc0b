/**
 * Small helpers shared by the CLI and the engine: fatal error reporting, log masking and driver
 * loading.
 */
package io.github.yok.statlink.util;
