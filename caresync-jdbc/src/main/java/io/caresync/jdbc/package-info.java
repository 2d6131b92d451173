/**
 * JDBC implementations of the care persistence SPIs.
 *
 * <p>{@link io.caresync.jdbc.JdbcCareStores} builds the stores and creates the schema;
 * {@link io.caresync.jdbc.dialect.Dialects} picks the SQL dialect for a database.
 */
package io.caresync.jdbc;
