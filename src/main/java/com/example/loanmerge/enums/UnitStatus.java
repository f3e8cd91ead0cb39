package com.example.loanmerge.enums;

/**
 * 单个处理单元 (pool 或国家) 在本次运行中的结果
 */
public enum UnitStatus {
    DONE,     // 本次处理完成
    SKIPPED,  // 之前已完成 (checkpoint), 或没有可处理的数据
    FAILED    // 失败, 临时文件已清理, 下次运行重试
}
