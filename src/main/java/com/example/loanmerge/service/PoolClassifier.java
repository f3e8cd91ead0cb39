package com.example.loanmerge.service;

import com.example.loanmerge.dto.PoolClassification;
import com.example.loanmerge.dto.PoolCorrespondence;
import com.example.loanmerge.dto.PoolFileIndex;
import com.example.loanmerge.dto.PoolTask;
import com.example.loanmerge.enums.PoolCategory;
import com.example.loanmerge.exception.MappingLoadException;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 扫描两个数据源目录, 按对应关系把 pool 分成 matched / ecb only / esma only
 */
@Component
@Slf4j
public class PoolClassifier {

    private final Gson gson = new Gson();

    public PoolCorrespondence loadCorrespondence(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            PoolCorrespondence correspondence = gson.fromJson(reader, PoolCorrespondence.class);
            if (correspondence == null || correspondence.getPools() == null) {
                throw new MappingLoadException("pool 对应关系文件缺少 pools 节点: " + path);
            }
            if (correspondence.getOverlapPools() == null) {
                correspondence.setOverlapPools(new ArrayList<>());
            }
            log.info("加载 pool 对应关系: {}, 对应 {} 对, 重叠 pool {} 个",
                    path, correspondence.getPools().size(), correspondence.getOverlapPools().size());
            return correspondence;
        } catch (IOException | JsonParseException e) {
            throw new MappingLoadException("无法读取 pool 对应关系文件: " + path, e);
        }
    }

    public PoolFileIndex buildFileIndex(Path ecbDir, Path esmaDir) {
        SortedMap<String, List<Path>> ecbFiles = index(ecbDir, PoolClassifier::ecbPoolIdOf);
        SortedMap<String, List<Path>> esmaFiles = index(esmaDir, PoolClassifier::esmaPoolIdOf);
        log.info("扫描输入目录: ECB {} 个 pool, ESMA {} 个 pool", ecbFiles.size(), esmaFiles.size());
        return new PoolFileIndex(ecbFiles, esmaFiles);
    }

    /**
     * ECB 文件名: {poolId}_{其他}.gz, pool id 是第一个下划线之前的部分
     */
    static String ecbPoolIdOf(String fileName) {
        String base = stripExtension(fileName);
        int idx = base.indexOf('_');
        return idx > 0 ? base.substring(0, idx) : base;
    }

    /**
     * ESMA 文件名: ..._{poolId}_{x}_{y}.csv, pool id 是倒数第三段
     */
    static String esmaPoolIdOf(String fileName) {
        String base = stripExtension(fileName);
        String[] parts = base.split("_");
        return parts.length >= 3 ? parts[parts.length - 3] : base;
    }

    private static String stripExtension(String fileName) {
        String name = fileName;
        if (name.toLowerCase().endsWith(".gz")) {
            name = name.substring(0, name.length() - 3);
        }
        if (name.toLowerCase().endsWith(".csv")) {
            name = name.substring(0, name.length() - 4);
        }
        return name;
    }

    private SortedMap<String, List<Path>> index(Path dir, Function<String, String> poolIdOf) {
        SortedMap<String, List<Path>> result = new TreeMap<>();
        try (Stream<Path> files = Files.list(dir)) {
            List<Path> sorted = files.filter(Files::isRegularFile)
                    .filter(f -> isInputFile(f.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
            for (Path file : sorted) {
                String poolId = poolIdOf.apply(file.getFileName().toString());
                if (StringUtils.isEmpty(poolId)) {
                    log.warn("无法从文件名解析 pool id, 忽略: {}", file);
                    continue;
                }
                result.computeIfAbsent(poolId, k -> new ArrayList<>()).add(file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("无法扫描目录: " + dir, e);
        }
        return result;
    }

    private static boolean isInputFile(String name) {
        String lower = name.toLowerCase();
        return lower.endsWith(".gz") || lower.endsWith(".csv");
    }

    public PoolClassification classify(Set<String> ecbIds, Set<String> esmaIds, PoolCorrespondence correspondence) {
        PoolClassification result = new PoolClassification();
        Set<String> matchedEsma = new HashSet<>();
        for (Map.Entry<String, PoolCorrespondence.PoolPair> entry : correspondence.getPools().entrySet()) {
            String ecbId = entry.getKey();
            String esmaId = entry.getValue() == null ? null : entry.getValue().getEsmaPool();
            if (StringUtils.isEmpty(esmaId)) {
                log.warn("对应关系中 ECB pool {} 没有 esma_pool, 忽略该条", ecbId);
                continue;
            }
            result.getMatched().put(ecbId, esmaId);
            matchedEsma.add(esmaId);

            boolean hasEcb = ecbIds.contains(ecbId);
            boolean hasEsma = esmaIds.contains(esmaId);
            if (!hasEcb || !hasEsma) {
                result.getAmbiguous().add(ecbId);
                log.warn("matched pool 一侧缺少文件: ECB {} ({}), ESMA {} ({})",
                        ecbId, hasEcb ? "有" : "无", esmaId, hasEsma ? "有" : "无");
            }
        }
        for (String ecbId : ecbIds) {
            if (!result.getMatched().containsKey(ecbId)) {
                result.getEcbOnly().add(ecbId);
            }
        }
        for (String esmaId : esmaIds) {
            if (!matchedEsma.contains(esmaId)) {
                result.getEsmaOnly().add(esmaId);
            }
        }
        log.info("pool 分类完成: matched {}, ecb only {}, esma only {}, 一侧缺文件 {}",
                result.getMatched().size(), result.getEcbOnly().size(), result.getEsmaOnly().size(),
                result.getAmbiguous().size());
        return result;
    }

    /**
     * 生成待处理任务, 顺序: matched, ecb only, esma only (各自按 pool id 排序)
     * 两侧都没有文件的 matched pool 不生成任务
     */
    public List<PoolTask> buildTasks(PoolClassification classification, PoolFileIndex index) {
        List<PoolTask> tasks = new ArrayList<>();
        for (Map.Entry<String, String> entry : classification.getMatched().entrySet()) {
            List<Path> ecbFiles = index.ecbFilesOf(entry.getKey());
            List<Path> esmaFiles = index.esmaFilesOf(entry.getValue());
            if (ecbFiles.isEmpty() && esmaFiles.isEmpty()) {
                log.warn("matched pool 两侧都没有文件, 跳过: ECB {}, ESMA {}", entry.getKey(), entry.getValue());
                continue;
            }
            tasks.add(PoolTask.builder()
                    .category(PoolCategory.MATCHED)
                    .ecbPoolId(entry.getKey())
                    .esmaPoolId(entry.getValue())
                    .ecbFiles(ecbFiles)
                    .esmaFiles(esmaFiles)
                    .build());
        }
        for (String ecbId : classification.getEcbOnly()) {
            tasks.add(PoolTask.builder()
                    .category(PoolCategory.ECB_ONLY)
                    .ecbPoolId(ecbId)
                    .ecbFiles(index.ecbFilesOf(ecbId))
                    .build());
        }
        for (String esmaId : classification.getEsmaOnly()) {
            tasks.add(PoolTask.builder()
                    .category(PoolCategory.ESMA_ONLY)
                    .esmaPoolId(esmaId)
                    .esmaFiles(index.esmaFilesOf(esmaId))
                    .build());
        }
        return tasks;
    }
}
