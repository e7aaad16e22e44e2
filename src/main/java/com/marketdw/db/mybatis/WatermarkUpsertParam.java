package com.marketdw.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WatermarkUpsertParam {
    private String streamName;
    private int waterMark;
    private String status;
    private String lastErr;
}
