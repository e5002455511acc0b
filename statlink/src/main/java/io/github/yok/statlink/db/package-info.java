/**
 * Database access: per-backend dialect handlers and the JDBC data access object for versioned
 * entity tables.
 */
package io.github.yok.statlink.db;
