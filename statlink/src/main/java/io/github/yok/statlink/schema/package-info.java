/**
 * Entity definitions.
 *
 * <p>
 * An entity description (a small JSON document naming the table, its unique identifier column and
 * its typed columns) is validated by {@link io.github.yok.statlink.schema.SchemaRegistry} into an
 * immutable {@link io.github.yok.statlink.schema.EntityType}. Column types are restricted to the
 * enumerated {@link io.github.yok.statlink.schema.StorageType}s, which also own the conversion of
 * raw dataset values and JDBC values into comparable Java values.
 * </p>
 */
package io.github.yok.statlink.schema;
