/**
 * In-memory dataset model.
 *
 * <p>
 * {@link io.github.yok.flexetl.model.Dataset} is the single value that flows from a source
 * adapter through the transform stages to the table loader.
 * </p>
 */
package io.github.yok.flexetl.model;
