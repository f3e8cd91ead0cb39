package com.example.loanmerge.scheduler;

import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.dto.RunSummary;
import com.example.loanmerge.dto.StageSummary;
import com.example.loanmerge.enums.MergeStage;
import com.example.loanmerge.exception.MappingLoadException;
import com.example.loanmerge.service.CountryMergeService;
import com.example.loanmerge.service.PoolMergeService;
import com.example.loanmerge.service.RunSummaryWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.time.LocalDateTime;

/**
 * 按配置顺序执行各阶段; 上一个阶段的所有单元结束后才开始下一个阶段
 * pool 阶段有失败单元时不执行国家阶段
 */
@Component
@Order(2) // 在启动自检之后
@Slf4j
public class PipelineRunner implements ApplicationRunner {

    @Autowired private AppProperties config;
    @Autowired private PoolMergeService poolMergeService;
    @Autowired private CountryMergeService countryMergeService;
    @Autowired private RunSummaryWriter summaryWriter;

    @Override
    public void run(ApplicationArguments args) {
        RunSummary summary = new RunSummary();
        summary.setStartedAt(LocalDateTime.now().toString());
        log.info(">>> 开始运行, 阶段: {}", config.getStages());

        try {
            boolean poolFailed = false;
            for (String stageName : config.getStages()) {
                MergeStage stage = MergeStage.valueOf(stageName);
                if (stage == MergeStage.COUNTRY && poolFailed) {
                    // 国家文件一旦登记完成就不会重建, 缺 pool 时不能合并
                    log.warn(">>> pool 阶段有失败的 pool, 本次不执行国家阶段, 修复后重新运行");
                    summary.getSkippedStages().add(stage);
                    continue;
                }
                StageSummary stageSummary = stage == MergeStage.POOL
                        ? poolMergeService.runStage()
                        : countryMergeService.runStage();
                summary.getStages().add(stageSummary);
                if (stage == MergeStage.POOL && stageSummary.getFailed() > 0) {
                    poolFailed = true;
                }
            }
        } catch (MappingLoadException e) {
            log.error(">>> 映射加载失败, 运行终止: {}", e.getMessage(), e);
            throw e;
        } finally {
            summary.setFinishedAt(LocalDateTime.now().toString());
            summaryWriter.write(summary, Paths.get(config.getOutput().getPoolDir(), config.getOutput().getSummaryFile()));
        }

        int failed = summary.getStages().stream().mapToInt(StageSummary::getFailed).sum();
        if (failed > 0) {
            log.warn("<<< 运行结束, {} 个单元失败, 重新运行即可从断点继续", failed);
        } else {
            log.info("<<< 运行结束");
        }
    }
}
