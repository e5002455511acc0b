/**
 * Root package of StatLink.
 *
 * <p>
 * Provides a CLI/library that loads statistical datasets (CSV exports of indicator tables, JSON
 * and GeoJSON region files) into relational databases while keeping a versioned history of every
 * record.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.statlink.config}: configuration models</li>
 * <li>{@code io.github.yok.statlink.schema}: entity definitions and storage types</li>
 * <li>{@code io.github.yok.statlink.model}: typed records of an entity</li>
 * <li>{@code io.github.yok.statlink.core}: versioned upsert workflow and units of work</li>
 * <li>{@code io.github.yok.statlink.db}: database dialects and table access</li>
 * <li>{@code io.github.yok.statlink.parser}, {@code io.github.yok.statlink.dataset}: dataset
 * input and reshaping</li>
 * </ul>
 */
package io.github.yok.statlink;
