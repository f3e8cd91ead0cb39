package com.example.loanmerge.dto;

import com.example.loanmerge.enums.PoolCategory;
import com.example.loanmerge.enums.UnitStatus;
import lombok.Data;

@Data
public class PoolMergeResult {
    private String poolId;
    private PoolCategory category;
    private UnitStatus status;

    // DIRECT / CHUNKED
    private String mode;

    private long ecbRows;
    private long esmaRows;
    // 写出的行数
    private long rows;
    // 去重时丢弃的 ECB 行数
    private long droppedRows;
    private int columns;
    private long elapsedMs;
    private String errorMsg;
}
