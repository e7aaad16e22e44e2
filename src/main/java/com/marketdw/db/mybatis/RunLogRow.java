package com.marketdw.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunLogRow {
    private long id;
    private String streamName;
    private String runType;
    private OffsetDateTime startAt;
    private OffsetDateTime endAt;
    private String status;
    private String errMsg;
    private int requestCount;
    private int failCount;
}
