package com.marketdw.db;

import com.marketdw.etl.store.PipelineStore;
import com.marketdw.etl.store.StoreSession;

import java.sql.Connection;
import java.sql.SQLException;

public final class JdbcPipelineStore implements PipelineStore {
    private final Database database;

    public JdbcPipelineStore(Database database) {
        this.database = database;
    }

    @Override
    public StoreSession openSession() throws SQLException {
        Connection conn = database.connect();
        try {
            conn.setAutoCommit(false);
            return new JdbcStoreSession(conn);
        } catch (SQLException | RuntimeException e) {
            try {
                conn.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }
}
