package com.example.loanmerge.dto;

import lombok.Getter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * 按 pool id 归类的输入文件 (每个 pool 的文件按文件名排序)
 */
@Getter
public class PoolFileIndex {

    private final SortedMap<String, List<Path>> ecbFiles;
    private final SortedMap<String, List<Path>> esmaFiles;

    public PoolFileIndex(SortedMap<String, List<Path>> ecbFiles, SortedMap<String, List<Path>> esmaFiles) {
        this.ecbFiles = Collections.unmodifiableSortedMap(ecbFiles);
        this.esmaFiles = Collections.unmodifiableSortedMap(esmaFiles);
    }

    public List<Path> ecbFilesOf(String poolId) {
        return filesOf(ecbFiles, poolId);
    }

    public List<Path> esmaFilesOf(String poolId) {
        return filesOf(esmaFiles, poolId);
    }

    private static List<Path> filesOf(Map<String, List<Path>> index, String poolId) {
        if (poolId == null) {
            return Collections.emptyList();
        }
        return index.getOrDefault(poolId, Collections.emptyList());
    }

    /**
     * 文件在磁盘上的大小之和 (gzip 文件即压缩后大小)
     */
    public static long totalSize(List<Path> files) {
        long total = 0;
        for (Path file : files) {
            try {
                total += Files.size(file);
            } catch (IOException e) {
                throw new UncheckedIOException("无法获取文件大小: " + file, e);
            }
        }
        return total;
    }
}
