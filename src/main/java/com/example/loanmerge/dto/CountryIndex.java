package com.example.loanmerge.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 国家代码 -> 属于该国家的文件 (顺序固定)
 */
public class CountryIndex {

    private final SortedMap<String, List<CountryFile>> filesByCountry = new TreeMap<>();

    // 读取样本失败的文件, 不参与合并
    private final List<String> unreadableFiles = new ArrayList<>();

    public void add(CountryFile file) {
        filesByCountry.computeIfAbsent(file.getCountry(), k -> new ArrayList<>()).add(file);
    }

    public List<String> countries() {
        return new ArrayList<>(filesByCountry.keySet());
    }

    public List<CountryFile> filesOf(String country) {
        return Collections.unmodifiableList(filesByCountry.getOrDefault(country, Collections.emptyList()));
    }

    public void addUnreadable(String file) {
        unreadableFiles.add(file);
    }

    public List<String> getUnreadableFiles() {
        return Collections.unmodifiableList(unreadableFiles);
    }

    public int fileCount() {
        return filesByCountry.values().stream().mapToInt(List::size).sum();
    }
}
