package com.marketdw.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TableStatsRow {
    private Integer maxUnit;
    private long rowCount;
}
