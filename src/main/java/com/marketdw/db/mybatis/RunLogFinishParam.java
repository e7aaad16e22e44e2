package com.marketdw.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunLogFinishParam {
    private long id;
    private String status;
    private String errMsg;
    private int requestCount;
    private int failCount;
}
