package com.example.loanmerge.dto;

import com.example.loanmerge.enums.MergeStage;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RunSummary {
    private String startedAt;
    private String finishedAt;
    private List<StageSummary> stages = new ArrayList<>();
    // 因前一阶段有失败单元而没有执行的阶段
    private List<MergeStage> skippedStages = new ArrayList<>();
}
