package com.example.loanmerge.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * pool 的三分类结果: matched / ecb only / esma only, 三者互不重叠
 */
@Data
public class PoolClassification {

    // ECB pool id -> ESMA pool id
    private SortedMap<String, String> matched = new TreeMap<>();

    private SortedSet<String> ecbOnly = new TreeSet<>();

    private SortedSet<String> esmaOnly = new TreeSet<>();

    // 声明为 matched 但某一侧在磁盘上没有文件的 pool (记录 ECB id)
    private List<String> ambiguous = new ArrayList<>();

    public int total() {
        return matched.size() + ecbOnly.size() + esmaOnly.size();
    }
}
