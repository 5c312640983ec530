/**
 * Shared helpers of FlexETL: fatal error reporting and JDBC connection handling.
 */
package io.github.yok.flexetl.util;
