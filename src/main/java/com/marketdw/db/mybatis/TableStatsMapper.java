package com.marketdw.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface TableStatsMapper {
    // identifiers are validated by the caller; they cannot be bound as parameters
    @Select("SELECT MAX(${unitColumn}) AS max_unit, COUNT(*) AS row_count FROM ${table}")
    TableStatsRow selectStats(@Param("table") String table, @Param("unitColumn") String unitColumn);
}
