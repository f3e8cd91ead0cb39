package com.example.loanmerge.dto;

import lombok.Value;

import java.util.List;

@Value
public class DedupResult {
    // 保留下来的 ECB 行在前, ESMA 行在后
    List<LoanRow> rows;
    // 因为 ESMA 已有同一贷款同一月份而丢弃的 ECB 行数
    long droppedRows;
}
