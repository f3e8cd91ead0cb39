package com.example.loanmerge.service;

import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.dto.ColumnMapping;
import com.example.loanmerge.dto.PoolClassification;
import com.example.loanmerge.dto.PoolCorrespondence;
import com.example.loanmerge.dto.PoolFileIndex;
import com.example.loanmerge.dto.PoolMergeResult;
import com.example.loanmerge.dto.PoolTask;
import com.example.loanmerge.dto.StageSummary;
import com.example.loanmerge.enums.MergeStage;
import com.example.loanmerge.enums.UnitStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * pool 阶段: 加载映射和对应关系, 分类, 每个 pool 一个任务并发执行, 全部结束后返回汇总
 */
@Service
@Slf4j
public class PoolMergeService {

    private final AppProperties config;
    private final MappingLoader mappingLoader;
    private final PoolClassifier classifier;
    private final TaskLockManager lockManager;
    private final ThreadPoolTaskExecutor executor;

    public PoolMergeService(AppProperties config, MappingLoader mappingLoader, PoolClassifier classifier,
                            TaskLockManager lockManager,
                            @Qualifier("poolMergeExecutor") ThreadPoolTaskExecutor executor) {
        this.config = config;
        this.mappingLoader = mappingLoader;
        this.classifier = classifier;
        this.lockManager = lockManager;
        this.executor = executor;
    }

    public StageSummary runStage() {
        StageSummary summary = new StageSummary();
        summary.setStage(MergeStage.POOL);
        summary.setStartedAt(LocalDateTime.now().toString());

        // 映射或对应关系加载失败直接抛出, 整个阶段不执行
        ColumnMapping mapping = mappingLoader.load(Paths.get(config.getMapping().getTemplatePath()));
        PoolCorrespondence correspondence = classifier.loadCorrespondence(Paths.get(config.getPool().getCorrespondencePath()));

        PoolFileIndex index = classifier.buildFileIndex(Paths.get(config.getSource().getEcbDir()),
                Paths.get(config.getSource().getEsmaDir()));
        PoolClassification classification = classifier.classify(index.getEcbFiles().keySet(),
                index.getEsmaFiles().keySet(), correspondence);
        summary.getAmbiguousPools().addAll(classification.getAmbiguous());

        Set<String> overlapPools = new LinkedHashSet<>(correspondence.getOverlapPools());
        overlapPools.addAll(config.getPool().getOverlapPools());
        log.info("重叠 pool 清单: {}", overlapPools);

        CheckpointManager checkpoint = CheckpointManager.open(MergeStage.POOL, Paths.get(config.getOutput().getPoolDir()));
        PoolMergeEngine engine = new PoolMergeEngine(config, new LoanRowHarmoniser(mapping, config.getPool()),
                new OverlapDedupEngine(overlapPools), checkpoint, lockManager);

        List<PoolTask> tasks = orderTasks(classifier.buildTasks(classification, index), engine);
        log.info(">>> pool 阶段开始, 共 {} 个 pool", tasks.size());

        List<CompletableFuture<PoolMergeResult>> futures = tasks.stream()
                .map(task -> CompletableFuture.supplyAsync(() -> engine.merge(task), executor))
                .collect(Collectors.toList());
        // 所有 pool 结束后才返回, 国家阶段依赖完整的 pool 级输出
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        for (CompletableFuture<PoolMergeResult> future : futures) {
            PoolMergeResult result = future.join();
            summary.getPools().add(result);
            count(summary, result.getStatus());
            summary.setTotalRows(summary.getTotalRows() + result.getRows());
            summary.setDroppedRows(summary.getDroppedRows() + result.getDroppedRows());
        }
        summary.setFinishedAt(LocalDateTime.now().toString());
        log.info("<<< pool 阶段结束: 完成 {}, 跳过 {}, 失败 {}, 输出 {} 行, 去重丢弃 {} 行",
                summary.getDone(), summary.getSkipped(), summary.getFailed(),
                summary.getTotalRows(), summary.getDroppedRows());
        return summary;
    }

    /**
     * 类别顺序不变 (matched, ecb only, esma only), 每个类别内普通 pool 在前, 大 pool 在后
     */
    List<PoolTask> orderTasks(List<PoolTask> tasks, PoolMergeEngine engine) {
        List<PoolTask> ordered = new ArrayList<>(tasks.size());
        List<PoolTask> large = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            PoolTask task = tasks.get(i);
            if (engine.isLarge(task)) {
                large.add(task);
            } else {
                ordered.add(task);
            }
            boolean lastOfCategory = i == tasks.size() - 1 || tasks.get(i + 1).getCategory() != task.getCategory();
            if (lastOfCategory) {
                ordered.addAll(large);
                large.clear();
            }
        }
        return ordered;
    }

    static void count(StageSummary summary, UnitStatus status) {
        switch (status) {
            case DONE:
                summary.setDone(summary.getDone() + 1);
                break;
            case SKIPPED:
                summary.setSkipped(summary.getSkipped() + 1);
                break;
            default:
                summary.setFailed(summary.getFailed() + 1);
        }
    }
}
