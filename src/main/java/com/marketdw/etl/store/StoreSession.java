package com.marketdw.etl.store;

import java.sql.SQLException;
import java.util.List;

/**
 * Transactional handle handed to unit transformations. Nothing is visible to other sessions until {@link #commit()}.
 */
public interface StoreSession extends AutoCloseable {

    int execute(SqlStatement statement) throws SQLException;

    /**
     * Insert-or-update rows keyed by {@code keyColumns}, so replaying the same unit rewrites instead of duplicating.
     */
    int upsertRows(String table, List<String> columns, List<String> keyColumns, List<List<Object>> rows) throws SQLException;

    /**
     * Watermarks bound to this session's transaction.
     */
    WatermarkStore watermarks();

    void commit() throws SQLException;

    void rollback() throws SQLException;

    @Override
    void close() throws SQLException;
}
