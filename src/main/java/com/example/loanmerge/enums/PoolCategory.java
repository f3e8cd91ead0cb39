package com.example.loanmerge.enums;

/**
 * pool 的分类, 同时也是 pool 级输出的子目录名
 */
public enum PoolCategory {
    MATCHED("matched"),     // ECB 和 ESMA 都有数据
    ECB_ONLY("ecb_only"),   // 只有 ECB
    ESMA_ONLY("esma_only"); // 只有 ESMA

    private final String folder;

    PoolCategory(String folder) {
        this.folder = folder;
    }

    public String getFolder() {
        return folder;
    }
}
