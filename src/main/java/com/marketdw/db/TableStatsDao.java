package com.marketdw.db;

import com.marketdw.db.mybatis.MyBatisSupport;
import com.marketdw.db.mybatis.TableStatsMapper;
import com.marketdw.db.mybatis.TableStatsRow;
import com.marketdw.etl.health.TableSpec;
import com.marketdw.etl.health.TableStats;
import com.marketdw.etl.health.TableStatsSource;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;

public final class TableStatsDao implements TableStatsSource {
    private final Database database;

    public TableStatsDao(Database database) {
        this.database = database;
    }

    @Override
    public TableStats stats(TableSpec table) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            TableStatsRow row = session.getMapper(TableStatsMapper.class).selectStats(table.table, table.unitColumn);
            if (row == null) {
                return new TableStats(null, 0L);
            }
            return new TableStats(row.getMaxUnit(), row.getRowCount());
        }
    }
}
