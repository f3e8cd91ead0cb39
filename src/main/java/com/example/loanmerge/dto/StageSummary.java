package com.example.loanmerge.dto;

import com.example.loanmerge.enums.MergeStage;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个阶段的运行汇总 (写入 _run_summary.json)
 */
@Data
public class StageSummary {
    private MergeStage stage;
    private String startedAt;
    private String finishedAt;

    private int done;
    private int skipped;
    private int failed;
    private long totalRows;
    // 去重丢弃的 ECB 行数 (只有 pool 阶段有)
    private long droppedRows;

    // 声明 matched 但一侧缺文件的 pool
    private List<String> ambiguousPools = new ArrayList<>();
    // 国家阶段无法读取样本的 pool 级文件
    private List<String> unreadableFiles = new ArrayList<>();
    private List<PoolMergeResult> pools = new ArrayList<>();
    private List<CountryMergeResult> countries = new ArrayList<>();
}
