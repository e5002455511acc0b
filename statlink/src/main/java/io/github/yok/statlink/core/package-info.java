/**
 * Core engine: versioned upsert (classify then apply), bulk loading of candidate rows, connection
 * and unit-of-work management, and the import runner.
 */
package io.github.yok.statlink.core;
