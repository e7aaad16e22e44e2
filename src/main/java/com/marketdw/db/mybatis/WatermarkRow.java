package com.marketdw.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WatermarkRow {
    private String streamName;
    private int waterMark;
    private String status;
    private OffsetDateTime lastRunAt;
    private String lastErr;
}
