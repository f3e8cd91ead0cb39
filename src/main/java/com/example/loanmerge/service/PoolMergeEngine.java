package com.example.loanmerge.service;

import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.dto.DedupResult;
import com.example.loanmerge.dto.LoanKey;
import com.example.loanmerge.dto.LoanRow;
import com.example.loanmerge.dto.PoolFileIndex;
import com.example.loanmerge.dto.PoolMergeResult;
import com.example.loanmerge.dto.PoolTask;
import com.example.loanmerge.enums.SourceFeed;
import com.example.loanmerge.enums.UnitStatus;
import com.example.loanmerge.exception.OutputWriteException;
import com.example.loanmerge.exception.PoolReadException;
import com.example.loanmerge.service.LoanRowHarmoniser.HarmonisedHeader;
import com.example.loanmerge.service.impl.CsvRowIterator;
import com.example.loanmerge.util.CharsetFactory;
import com.example.loanmerge.util.OutputDirectoryUtil;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 单个 pool 的合并: 读取两侧文件, 统一列名, (重叠 pool) 去重, 写出 pool 级文件
 *
 * <p>小 pool 一次性读入内存 (DIRECT); 任意一侧压缩后大小超过阈值时分块流式处理 (CHUNKED).
 * 两种模式对同样的输入写出完全相同的文件.
 */
@Slf4j
public class PoolMergeEngine {

    public static final String MODE_DIRECT = "DIRECT";
    public static final String MODE_CHUNKED = "CHUNKED";

    private final AppProperties config;
    private final LoanRowHarmoniser harmoniser;
    private final OverlapDedupEngine dedupEngine;
    private final CheckpointManager checkpoint;
    private final TaskLockManager lockManager;

    public PoolMergeEngine(AppProperties config, LoanRowHarmoniser harmoniser, OverlapDedupEngine dedupEngine,
                           CheckpointManager checkpoint, TaskLockManager lockManager) {
        this.config = config;
        this.harmoniser = harmoniser;
        this.dedupEngine = dedupEngine;
        this.checkpoint = checkpoint;
        this.lockManager = lockManager;
    }

    public boolean isLarge(PoolTask task) {
        long threshold = config.getPerformance().getLargePoolThresholdBytes();
        return PoolFileIndex.totalSize(task.getEcbFiles()) > threshold
                || PoolFileIndex.totalSize(task.getEsmaFiles()) > threshold;
    }

    /**
     * 处理一个 pool, 不抛异常: 失败记录在结果里, 临时文件已清理, 下次运行重试
     */
    public PoolMergeResult merge(PoolTask task) {
        String unit = OutputDirectoryUtil.poolUnit(task.getCategory(), task.outputPoolId());
        PoolMergeResult result = new PoolMergeResult();
        result.setPoolId(task.outputPoolId());
        result.setCategory(task.getCategory());
        long start = System.currentTimeMillis();

        if (checkpoint.isDone(unit)) {
            log.info("pool 已完成, 跳过: {}", unit);
            result.setStatus(UnitStatus.SKIPPED);
            return result;
        }
        // 1. 【进门加锁】
        if (!lockManager.tryLock(unit)) {
            log.info("pool 正在处理中, 跳过: {}", unit);
            result.setStatus(UnitStatus.SKIPPED);
            result.setErrorMsg("正在处理中");
            return result;
        }
        try {
            checkpoint.cleanupTemp(unit);
            boolean large = isLarge(task);
            result.setMode(large ? MODE_CHUNKED : MODE_DIRECT);
            log.info(">>> 开始合并 pool: {}, 模式 {}, ECB 文件 {} 个, ESMA 文件 {} 个",
                    unit, result.getMode(), task.getEcbFiles().size(), task.getEsmaFiles().size());

            if (large) {
                mergeChunked(task, unit, result);
            } else {
                mergeDirect(task, unit, result);
            }

            if (result.getRows() == 0) {
                log.warn("pool 没有数据行, 不生成输出文件: {}", unit);
                result.setStatus(UnitStatus.SKIPPED);
            } else {
                checkpoint.markDone(unit, result.getRows());
                result.setStatus(UnitStatus.DONE);
                log.info(">>> pool 合并完成: {}, 输出 {} 行 {} 列, ECB {} 行 (去重丢弃 {}), ESMA {} 行",
                        unit, result.getRows(), result.getColumns(), result.getEcbRows(),
                        result.getDroppedRows(), result.getEsmaRows());
            }
        } catch (PoolReadException e) {
            log.error(">>> pool 输入文件无法读取, 跳过: {}", unit, e);
            fail(result, e);
        } catch (OutputWriteException e) {
            log.error(">>> pool 输出写入失败: {}", unit, e);
            fail(result, e);
        } catch (Exception e) {
            log.error(">>> pool 合并失败: {}", unit, e);
            fail(result, e);
        } finally {
            result.setElapsedMs(System.currentTimeMillis() - start);
            // 【出门解锁】
            lockManager.releaseLock(unit);
        }
        return result;
    }

    private static void fail(PoolMergeResult result, Exception e) {
        result.setStatus(UnitStatus.FAILED);
        result.setRows(0);
        result.setErrorMsg(e.getMessage());
    }

    private void mergeDirect(PoolTask task, String unit, PoolMergeResult result) {
        List<Path> files = inputsOf(task);
        int ecbCount = task.getEcbFiles().size();
        PoolLayout layout = buildLayout(task, files);

        List<LoanRow> ecbRows = new ArrayList<>();
        List<LoanRow> esmaRows = new ArrayList<>();
        forEachBatch(layout, files, 0, ecbCount, ecbRows::addAll);
        forEachBatch(layout, files, ecbCount, files.size(), esmaRows::addAll);
        result.setEcbRows(ecbRows.size());
        result.setEsmaRows(esmaRows.size());

        List<LoanRow> rows;
        if (dedupEnabled(task, layout)) {
            DedupResult dedup = dedupEngine.dedup(ecbRows, esmaRows);
            rows = dedup.getRows();
            result.setDroppedRows(dedup.getDroppedRows());
        } else {
            rows = new ArrayList<>(ecbRows.size() + esmaRows.size());
            rows.addAll(ecbRows);
            rows.addAll(esmaRows);
        }
        if (rows.isEmpty()) {
            return;
        }
        rows.forEach(layout::markNonEmpty);

        int[] kept = layout.keptColumns(config.getPool().isDropEmptyColumns());
        try (AtomicCsvOutput output = openOutput(unit)) {
            output.writeHeader(layout.header(kept));
            for (LoanRow row : rows) {
                output.writeRow(PoolLayout.select(row.getValues(), kept));
            }
            output.commit();
            result.setRows(output.getRows());
            result.setColumns(kept.length);
        }
    }

    /**
     * 第一遍: 统计非空列, 重叠 pool 收集 ESMA 的 (贷款号, 年月)
     * 第二遍: 按批读取, 过滤后追加写出 (先 ECB 后 ESMA)
     */
    private void mergeChunked(PoolTask task, String unit, PoolMergeResult result) {
        List<Path> files = inputsOf(task);
        int ecbCount = task.getEcbFiles().size();
        PoolLayout layout = buildLayout(task, files);
        boolean dedup = dedupEnabled(task, layout);

        Set<LoanKey> esmaKeys = dedup ? new HashSet<>() : Collections.emptySet();
        long esmaRows = forEachBatch(layout, files, ecbCount, files.size(), batch -> {
            for (LoanRow row : batch) {
                layout.markNonEmpty(row);
                if (dedup) {
                    esmaKeys.add(row.key());
                }
            }
        });
        AtomicLong keptEcb = new AtomicLong();
        long ecbRows = forEachBatch(layout, files, 0, ecbCount, batch -> {
            for (LoanRow row : batch) {
                if (!dedup || dedupEngine.retain(row, esmaKeys)) {
                    layout.markNonEmpty(row);
                    keptEcb.incrementAndGet();
                }
            }
        });
        result.setEcbRows(ecbRows);
        result.setEsmaRows(esmaRows);
        result.setDroppedRows(ecbRows - keptEcb.get());
        log.info("pool {} 第一遍扫描完成: ECB {} 行 (保留 {}), ESMA {} 行, ESMA 键 {} 个",
                unit, ecbRows, keptEcb.get(), esmaRows, esmaKeys.size());
        if (keptEcb.get() + esmaRows == 0) {
            return;
        }

        int[] kept = layout.keptColumns(config.getPool().isDropEmptyColumns());
        try (AtomicCsvOutput output = openOutput(unit)) {
            output.writeHeader(layout.header(kept));
            forEachBatch(layout, files, 0, ecbCount, batch -> {
                for (LoanRow row : batch) {
                    if (!dedup || dedupEngine.retain(row, esmaKeys)) {
                        output.writeRow(PoolLayout.select(row.getValues(), kept));
                    }
                }
            });
            forEachBatch(layout, files, ecbCount, files.size(), batch -> {
                for (LoanRow row : batch) {
                    output.writeRow(PoolLayout.select(row.getValues(), kept));
                }
            });
            output.commit();
            result.setRows(output.getRows());
            result.setColumns(kept.length);
        }
    }

    private boolean dedupEnabled(PoolTask task, PoolLayout layout) {
        if (task.getEcbFiles().isEmpty() || task.getEsmaFiles().isEmpty()) {
            return false;
        }
        if (!dedupEngine.requiresDedup(task.getEcbPoolId(), task.getEsmaPoolId())) {
            return false;
        }
        boolean hasLoanId = false;
        int fileCount = task.getEcbFiles().size() + task.getEsmaFiles().size();
        for (int i = 0; i < fileCount; i++) {
            hasLoanId |= layout.headerOf(i).hasLoanId();
        }
        if (!hasLoanId) {
            log.warn("重叠 pool {} 两侧都没有贷款号列 {}, 不做去重",
                    task.outputPoolId(), config.getPool().getLoanIdColumn());
            return false;
        }
        return true;
    }

    private static List<Path> inputsOf(PoolTask task) {
        List<Path> files = new ArrayList<>(task.getEcbFiles());
        files.addAll(task.getEsmaFiles());
        return files;
    }

    private PoolLayout buildLayout(PoolTask task, List<Path> files) {
        int ecbCount = task.getEcbFiles().size();
        List<HarmonisedHeader> headers = new ArrayList<>(files.size());
        for (int i = 0; i < files.size(); i++) {
            SourceFeed source = i < ecbCount ? SourceFeed.ECB : SourceFeed.ESMA;
            AppProperties.CsvDetailConfig csv = csvConfigOf(source);
            String[] rawHeader = CsvRowIterator.readHeader(files.get(i), csv.toParserSettings(),
                    CharsetFactory.resolveCharset(csv.getEncoding()), config.getPerformance().getReadBufferSize());
            headers.add(harmoniser.harmoniseHeader(rawHeader, source));
        }
        return new PoolLayout(harmoniser, config.getPool(), headers, task.getEcbPoolId(), task.getEsmaPoolId());
    }

    /**
     * 按 chunk-rows 分批读取 [from, to) 范围内的文件, 每批转换成 LoanRow 交给 consumer
     * @return 读取的总行数
     */
    private long forEachBatch(PoolLayout layout, List<Path> files, int from, int to, Consumer<List<LoanRow>> consumer) {
        int chunkRows = config.getPerformance().getChunkRows();
        long count = 0;
        for (int f = from; f < to; f++) {
            AppProperties.CsvDetailConfig csv = csvConfigOf(layout.headerOf(f).getSource());
            try (CsvRowIterator iterator = new CsvRowIterator(files.get(f), csv.toParserSettings(),
                    CharsetFactory.resolveCharset(csv.getEncoding()), config.getPerformance().getReadBufferSize())) {
                List<String[]> batch;
                while (!(batch = iterator.nextBatch(chunkRows)).isEmpty()) {
                    List<LoanRow> rows = new ArrayList<>(batch.size());
                    for (String[] raw : batch) {
                        rows.add(layout.toLoanRow(f, raw));
                    }
                    consumer.accept(rows);
                    count += rows.size();
                }
            }
        }
        return count;
    }

    private AppProperties.CsvDetailConfig csvConfigOf(SourceFeed source) {
        return source == SourceFeed.ECB ? config.getCsv().getEcbSource() : config.getCsv().getEsmaSource();
    }

    private AtomicCsvOutput openOutput(String unit) {
        return AtomicCsvOutput.open(checkpoint.finalPath(unit), config.getCsv().getOutput(),
                config.getPerformance().getWriteBufferSize());
    }
}
