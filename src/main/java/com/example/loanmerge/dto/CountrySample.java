package com.example.loanmerge.dto;

import lombok.Value;

import java.util.List;

/**
 * pool 级文件的前若干行, 用于识别国家
 */
@Value
public class CountrySample {
    String poolId;
    String[] header;
    List<String[]> rows;

    /**
     * @return 列下标, 不存在时为 -1
     */
    public int columnIndex(String column) {
        for (int i = 0; i < header.length; i++) {
            if (column.equals(header[i])) {
                return i;
            }
        }
        return -1;
    }
}
