/**
 * Database product support of FlexETL.
 *
 * <p>
 * {@code SqlDialect} captures what differs between the supported relational products and
 * {@code DbUnitConfigFactory} applies it, together with the {@code dbunit.config.*} settings, to
 * DBUnit.
 * </p>
 */
package io.github.yok.flexetl.db;
