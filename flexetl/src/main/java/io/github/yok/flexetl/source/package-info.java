/**
 * Source adapters of FlexETL.
 *
 * <p>
 * Defines the {@code DatasetSource} abstraction and adapters for CSV files, JSON files and JSON
 * documents served over HTTP. Adapter selection is handled by {@code DatasetSourceFactory} and
 * {@code SourceKind}.
 * </p>
 */
package io.github.yok.flexetl.source;
