package com.marketdw.etl.health;

import java.sql.SQLException;

public interface TableStatsSource {
    TableStats stats(TableSpec table) throws SQLException;
}
