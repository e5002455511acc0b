/**
 * Dataset file parsers producing DBUnit {@link org.dbunit.dataset.ITable}s.
 */
package io.github.yok.statlink.parser;
