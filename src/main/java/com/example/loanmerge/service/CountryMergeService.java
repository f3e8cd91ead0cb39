package com.example.loanmerge.service;

import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.dto.CountryIndex;
import com.example.loanmerge.dto.CountryMergeResult;
import com.example.loanmerge.dto.StageSummary;
import com.example.loanmerge.enums.MergeStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * 国家阶段: 按国家对 pool 级文件分组, 每个国家一个任务并发合并
 */
@Service
@Slf4j
public class CountryMergeService {

    private final AppProperties config;
    private final CountryIndexBuilder indexBuilder;
    private final SchemaUnionBuilder schemaUnionBuilder;
    private final TaskLockManager lockManager;
    private final ThreadPoolTaskExecutor executor;

    public CountryMergeService(AppProperties config, CountryIndexBuilder indexBuilder,
                               SchemaUnionBuilder schemaUnionBuilder, TaskLockManager lockManager,
                               @Qualifier("countryMergeExecutor") ThreadPoolTaskExecutor executor) {
        this.config = config;
        this.indexBuilder = indexBuilder;
        this.schemaUnionBuilder = schemaUnionBuilder;
        this.lockManager = lockManager;
        this.executor = executor;
    }

    public StageSummary runStage() {
        StageSummary summary = new StageSummary();
        summary.setStage(MergeStage.COUNTRY);
        summary.setStartedAt(LocalDateTime.now().toString());

        CountryIndex index = indexBuilder.build(Paths.get(config.getOutput().getPoolDir()));
        summary.getUnreadableFiles().addAll(index.getUnreadableFiles());

        CheckpointManager checkpoint = CheckpointManager.open(MergeStage.COUNTRY,
                Paths.get(config.getOutput().getCountryDir()));
        StreamMergeWriter writer = new StreamMergeWriter(config, schemaUnionBuilder, checkpoint, lockManager);

        List<String> countries = index.countries();
        log.info(">>> 国家阶段开始, 共 {} 个国家: {}", countries.size(), countries);
        List<CompletableFuture<CountryMergeResult>> futures = countries.stream()
                .map(country -> CompletableFuture.supplyAsync(() -> writer.merge(country, index.filesOf(country)), executor))
                .collect(Collectors.toList());
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        for (CompletableFuture<CountryMergeResult> future : futures) {
            CountryMergeResult result = future.join();
            summary.getCountries().add(result);
            PoolMergeService.count(summary, result.getStatus());
            summary.setTotalRows(summary.getTotalRows() + result.getRows());
        }
        summary.setFinishedAt(LocalDateTime.now().toString());
        log.info("<<< 国家阶段结束: 完成 {}, 跳过 {}, 失败 {}, 输出 {} 行",
                summary.getDone(), summary.getSkipped(), summary.getFailed(), summary.getTotalRows());
        return summary;
    }
}
