package com.marketdw.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunLogInsertParam {
    private Long id;
    private String streamName;
    private String runType;
}
