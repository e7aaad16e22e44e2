package com.marketdw.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryGuardUpsertParam {
    private String taskName;
    private String idempotencyKey;
    private String status;
    private int attempt;
    private int timeoutSec;
    private String errMsg;
}
