package com.example.loanmerge.dto;

import com.google.gson.annotations.SerializedName;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * pool_mapping.json 的结构
 * <pre>
 * {
 *   "pools": { "RMBMBE000095100120084": { "esma_pool": "RMBMBE000095100120084" } },
 *   "overlap_pools": [ "RMBMBE000095100120084" ]
 * }
 * </pre>
 */
@Data
public class PoolCorrespondence {

    // key 是 ECB pool id
    private Map<String, PoolPair> pools = new LinkedHashMap<>();

    // 经过分析确认 ECB 和 ESMA 在同一月份都有数据的 pool, 只有它们需要去重
    @SerializedName("overlap_pools")
    private List<String> overlapPools = new ArrayList<>();

    @Data
    public static class PoolPair {
        @SerializedName("esma_pool")
        private String esmaPool;
    }
}
