package io.github.yok.flexetl.source;

import io.github.yok.flexetl.model.Dataset;
import java.io.IOException;
import java.util.Optional;

/**
 * Source adapter that turns external data into a {@link Dataset}.
 *
 * <p>
 * An empty result means "no data": the source answered but its content cannot be read as a table
 * (unparseable bytes, HTTP status other than 200). It is not an error; the caller decides how to
 * report it. Genuine I/O failures are thrown.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DatasetSource {

    /**
     * Extracts a dataset.
     *
     * @param descriptor location of the data
     * @return the dataset, or {@link Optional#empty()} when the source yields no table
     * @throws IOException if the location cannot be read
     */
    Optional<Dataset> extract(SourceDescriptor descriptor) throws IOException;
}
