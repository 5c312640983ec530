package io.github.yok.flexetl.core;

import io.github.yok.flexetl.config.ConnectionConfig;
import io.github.yok.flexetl.model.Dataset;

/**
 * Writes a dataset to a relational table.
 *
 * @author Yasuharu.Okawauchi
 */
public interface TableLoader {

    /**
     * Replaces the named table with the contents of the dataset.
     *
     * <p>
     * After a successful call the table holds exactly the dataset's columns, in order, and exactly
     * its rows. Any previous table of that name is gone.
     * </p>
     *
     * @param dataset dataset to write
     * @param connection target store, passed explicitly for every load
     * @param tableName table name
     * @throws LoadException if the dataset cannot be written
     */
    void load(Dataset dataset, ConnectionConfig.Entry connection, String tableName)
            throws LoadException;
}
