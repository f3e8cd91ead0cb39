package com.example.loanmerge.enums;

public enum MergeStage {
    POOL,    // pool 级合并
    COUNTRY  // 国家级合并
}
