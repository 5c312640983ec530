/**
 * Root package of FlexETL, a command-line tool that extracts a tabular dataset from a CSV file, a
 * JSON file or an HTTP endpoint, applies a configurable chain of cleaning and feature-engineering
 * stages, and replaces a relational table with the result.
 *
 * <p>
 * {@code Main} is the Spring Boot entry point; the work is done in the sub-packages.
 * </p>
 */
package io.github.yok.flexetl;
