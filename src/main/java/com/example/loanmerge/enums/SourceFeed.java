package com.example.loanmerge.enums;

/**
 * 数据来源 (输出文件 source 列的值)
 */
public enum SourceFeed {
    ECB,  // 来源 A: ECB 贷款级数据, 列名需要映射成 ESMA 代码
    ESMA  // 来源 B: ESMA 数据, 已经是目标 schema; 同一贷款同一月份以 ESMA 为准
}
