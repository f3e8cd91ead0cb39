package com.example.loanmerge.dto;

import com.example.loanmerge.enums.UnitStatus;
import lombok.Data;

@Data
public class CountryMergeResult {
    private String country;
    private UnitStatus status;
    private int filesMerged;
    private long rows;
    private int columns;
    private long sizeBytes;
    private long elapsedMs;
    private String errorMsg;
}
