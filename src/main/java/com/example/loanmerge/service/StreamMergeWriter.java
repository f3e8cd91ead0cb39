package com.example.loanmerge.service;

import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.dto.CountryFile;
import com.example.loanmerge.dto.CountryMergeResult;
import com.example.loanmerge.enums.UnitStatus;
import com.example.loanmerge.exception.OutputWriteException;
import com.example.loanmerge.exception.PoolReadException;
import com.example.loanmerge.service.impl.CsvRowIterator;
import com.example.loanmerge.util.CharsetFactory;
import com.example.loanmerge.util.OutputDirectoryUtil;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 把一个国家的所有 pool 级文件流式合并成 国家代码.csv
 * 列按统一 schema 重排, 文件中没有的列填 null marker; 表头只写一次
 */
@Slf4j
public class StreamMergeWriter {

    private final AppProperties config;
    private final SchemaUnionBuilder schemaUnionBuilder;
    private final CheckpointManager checkpoint;
    private final TaskLockManager lockManager;

    public StreamMergeWriter(AppProperties config, SchemaUnionBuilder schemaUnionBuilder,
                             CheckpointManager checkpoint, TaskLockManager lockManager) {
        this.config = config;
        this.schemaUnionBuilder = schemaUnionBuilder;
        this.checkpoint = checkpoint;
        this.lockManager = lockManager;
    }

    public CountryMergeResult merge(String country, List<CountryFile> files) {
        String unit = OutputDirectoryUtil.countryUnit(country);
        CountryMergeResult result = new CountryMergeResult();
        result.setCountry(country);
        long start = System.currentTimeMillis();

        if (files.isEmpty()) {
            // 没有文件的国家不产生输出, 也不登记
            result.setStatus(UnitStatus.SKIPPED);
            return result;
        }
        if (checkpoint.isDone(unit)) {
            log.info("国家已完成, 跳过: {}", unit);
            result.setStatus(UnitStatus.SKIPPED);
            return result;
        }
        if (!lockManager.tryLock(unit)) {
            log.info("国家正在处理中, 跳过: {}", unit);
            result.setStatus(UnitStatus.SKIPPED);
            result.setErrorMsg("正在处理中");
            return result;
        }
        try {
            checkpoint.cleanupTemp(unit);
            List<Path> paths = files.stream().map(CountryFile::getPath).collect(Collectors.toList());
            // 1. 只读表头, 求并集
            List<String> unified = schemaUnionBuilder.build(paths);
            String[] header = unified.toArray(new String[0]);
            log.info(">>> 开始合并国家: {}, 文件 {} 个, 统一后 {} 列", country, files.size(), header.length);

            // 2. 按批读取, 重排列后追加写出
            Path finalPath = checkpoint.finalPath(unit);
            try (AtomicCsvOutput output = AtomicCsvOutput.open(finalPath, config.getCsv().getOutput(),
                    config.getPerformance().getWriteBufferSize())) {
                output.writeHeader(header);
                for (Path path : paths) {
                    appendFile(path, unified, output);
                }
                output.commit();
                result.setRows(output.getRows());
            }
            checkpoint.markDone(unit, result.getRows());
            result.setStatus(UnitStatus.DONE);
            result.setFilesMerged(files.size());
            result.setColumns(header.length);
            result.setSizeBytes(Files.size(finalPath));
            log.info(">>> 国家合并完成: {}, {} 行 {} 列", unit, result.getRows(), header.length);
        } catch (PoolReadException | OutputWriteException e) {
            log.error(">>> 国家合并读写失败, 临时文件已清理: {}", unit, e);
            fail(result, e);
        } catch (Exception e) {
            log.error(">>> 国家合并失败: {}", unit, e);
            fail(result, e);
        } finally {
            result.setElapsedMs(System.currentTimeMillis() - start);
            lockManager.releaseLock(unit);
        }
        return result;
    }

    private static void fail(CountryMergeResult result, Exception e) {
        result.setStatus(UnitStatus.FAILED);
        result.setRows(0);
        result.setErrorMsg(e.getMessage());
    }

    private void appendFile(Path path, List<String> unified, AtomicCsvOutput output) {
        AppProperties.CsvDetailConfig csv = config.getCsv().getOutput();
        String nullMarker = config.getCountry().getNullMarker();
        int chunkRows = config.getPerformance().getChunkRows();
        try (CsvRowIterator iterator = new CsvRowIterator(path, csv.toParserSettings(),
                CharsetFactory.resolveCharset(csv.getEncoding()), config.getPerformance().getReadBufferSize())) {
            int[] projection = projectionOf(iterator.getHeader(), unified);
            List<String[]> batch;
            while (!(batch = iterator.nextBatch(chunkRows)).isEmpty()) {
                for (String[] row : batch) {
                    String[] out = new String[projection.length];
                    for (int i = 0; i < projection.length; i++) {
                        out[i] = projection[i] >= 0 ? row[projection[i]] : nullMarker;
                    }
                    output.writeRow(out);
                }
            }
        }
    }

    /**
     * @return 统一列 i 在文件中的下标, 文件没有该列时为 -1
     */
    static int[] projectionOf(String[] fileHeader, List<String> unified) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < fileHeader.length; i++) {
            if (fileHeader[i] != null) {
                positions.putIfAbsent(fileHeader[i], i);
            }
        }
        int[] projection = new int[unified.size()];
        for (int i = 0; i < projection.length; i++) {
            projection[i] = positions.getOrDefault(unified.get(i), -1);
        }
        return projection;
    }
}
