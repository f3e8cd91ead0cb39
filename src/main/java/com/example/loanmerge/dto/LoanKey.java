package com.example.loanmerge.dto;

import lombok.Value;

/**
 * 去重键: (贷款编号, 年月)
 */
@Value
public class LoanKey {
    String loanId;
    String yearMonth;
}
