package com.marketdw.db;

import com.marketdw.db.mybatis.MyBatisSupport;
import com.marketdw.db.mybatis.WatermarkMapper;
import com.marketdw.etl.store.SqlStatement;
import com.marketdw.etl.store.StoreSession;
import com.marketdw.etl.store.WatermarkStore;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * One connection in manual-commit mode. Unit statements run over plain JDBC, watermarks go through
 * MyBatis on the same connection so both land in the same transaction.
 */
final class JdbcStoreSession implements StoreSession {
    static final int UPSERT_BATCH_SIZE = 2000;

    private final Connection conn;
    private final SqlSession sqlSession;
    private final WatermarkStore watermarks;

    JdbcStoreSession(Connection conn) {
        this.conn = conn;
        this.sqlSession = MyBatisSupport.openSession(conn);
        this.watermarks = new MyBatisWatermarkStore(sqlSession.getMapper(WatermarkMapper.class));
    }

    @Override
    public int execute(SqlStatement statement) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(statement.sql())) {
            bind(ps, statement.params());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new SQLException("statement failed: " + statement.summary() + ", cause=" + e.getMessage(),
                    e.getSQLState(), e.getErrorCode(), e);
        }
    }

    @Override
    public int upsertRows(String table, List<String> columns, List<String> keyColumns, List<List<Object>> rows)
            throws SQLException {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        String sql = SqlStatement.upsertSql(table, columns, keyColumns);
        int written = 0;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int pending = 0;
            for (List<Object> row : rows) {
                if (row.size() != columns.size()) {
                    throw new IllegalArgumentException("row width " + row.size() + " != " + columns.size() + " columns for " + table);
                }
                bind(ps, row);
                ps.addBatch();
                pending++;
                if (pending == UPSERT_BATCH_SIZE) {
                    ps.executeBatch();
                    written += pending;
                    pending = 0;
                }
            }
            if (pending > 0) {
                ps.executeBatch();
                written += pending;
            }
        }
        return written;
    }

    @Override
    public WatermarkStore watermarks() {
        return watermarks;
    }

    @Override
    public void commit() throws SQLException {
        conn.commit();
        sqlSession.clearCache();
    }

    @Override
    public void rollback() throws SQLException {
        conn.rollback();
        sqlSession.clearCache();
    }

    @Override
    public void close() throws SQLException {
        try {
            if (!conn.isClosed() && !conn.getAutoCommit()) {
                conn.rollback();
            }
        } finally {
            sqlSession.close();
            conn.close();
        }
    }

    private static void bind(PreparedStatement ps, List<Object> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            ps.setObject(i + 1, values.get(i));
        }
    }
}
