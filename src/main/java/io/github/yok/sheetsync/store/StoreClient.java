package io.github.yok.sheetsync.store;

import java.util.List;
import java.util.Map;

/**
 * Boundary to the relational store.
 *
 * <p>
 * Every operation may fail with a {@link StoreException}; callers never depend on the message
 * content beyond logging it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface StoreClient extends AutoCloseable {

    /**
     * Deletes every row of a table.
     *
     * @param table table name
     * @throws StoreException on failure
     */
    void clearTable(String table) throws StoreException;

    /**
     * Inserts rows in one request. Either all rows are stored or none is.
     *
     * @param table table name
     * @param rows rows as column to value maps; a column missing from a row is not written
     * @throws StoreException on failure (no row of the request is stored)
     */
    void insertBatch(String table, List<Map<String, Object>> rows) throws StoreException;

    /**
     * Reads all values of one column.
     *
     * @param table table name
     * @param column column name
     * @return values in store order, {@code null}s included
     * @throws StoreException on failure
     */
    List<Object> selectColumn(String table, String column) throws StoreException;

    /**
     * Releases the connection. The default implementation does nothing.
     *
     * @throws StoreException on failure
     */
    @Override
    default void close() throws StoreException {
        // nothing to release
    }
}
