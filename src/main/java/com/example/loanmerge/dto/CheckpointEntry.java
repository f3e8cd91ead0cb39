package com.example.loanmerge.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * checkpoint 文件中的一条记录
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointEntry {
    // 输出文件相对阶段输出目录的路径, 例如 matched/RMBM....csv 或 IT.csv
    private String unit;
    private String stage;
    private String state;
    private String completedAt;
    // -1 表示从磁盘恢复的记录, 行数未知
    private long rows;
}
