package com.example.loanmerge.dto;

import com.example.loanmerge.enums.PoolCategory;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * 一个待处理的 pool
 */
@Value
@Builder
public class PoolTask {
    PoolCategory category;
    String ecbPoolId;   // ESMA_ONLY 时为 null
    String esmaPoolId;  // ECB_ONLY 时为 null
    @Singular
    List<Path> ecbFiles;
    @Singular
    List<Path> esmaFiles;

    /**
     * 输出文件使用的 pool id: 有 ECB id 时用 ECB id, 否则用 ESMA id
     */
    public String outputPoolId() {
        return ecbPoolId != null ? ecbPoolId : esmaPoolId;
    }
}
