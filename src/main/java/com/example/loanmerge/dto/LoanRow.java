package com.example.loanmerge.dto;

import com.example.loanmerge.enums.SourceFeed;
import lombok.Value;

/**
 * 一行已经完成列名映射的贷款记录
 * values 已经按所在 pool 的输出列排列 (含 source 和两个 pool id 列), 没有值的位置为 null
 */
@Value
public class LoanRow {
    SourceFeed provenance;
    String loanId;
    String yearMonth;
    String[] values;

    public LoanKey key() {
        return new LoanKey(loanId, yearMonth);
    }
}
