/**
 * End-to-end processing of FlexETL.
 *
 * <p>
 * {@code EtlService} chains a source adapter, the transform pipeline and the {@code TableLoader}
 * sink. {@code JdbcTableLoader} replaces the target table over JDBC and DBUnit.
 * </p>
 */
package io.github.yok.flexetl.core;
