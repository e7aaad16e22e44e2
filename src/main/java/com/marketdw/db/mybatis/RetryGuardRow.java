package com.marketdw.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetryGuardRow {
    private long id;
    private String taskName;
    private String idempotencyKey;
    private String status;
    private int attempt;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private int timeoutSec;
    private String errMsg;
}
