package com.example.loanmerge.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

@Component
@Order(1) // 保证它最先执行 (优先级高)
@Slf4j
@RequiredArgsConstructor
public class StartupValidator implements ApplicationRunner {
    private static final List<String> KNOWN_STAGES = List.of("POOL", "COUNTRY");

    private final AppProperties config;

    @Override
    public void run(ApplicationArguments args) {
        log.info(">>> 开始应用启动自检...");
        validate(config);
        log.info("<<< 应用自检通过，开始执行阶段: {}", config.getStages());
    }

    /**
     * 配置错误属于整个运行的致命错误, 直接抛出, 由 Spring 终止启动
     */
    public static void validate(AppProperties config) {
        List<String> stages = config.getStages();
        if (stages == null || stages.isEmpty()) {
            throw new IllegalStateException("app.stages 不能为空");
        }
        for (String stage : stages) {
            if (!KNOWN_STAGES.contains(stage)) {
                throw new IllegalStateException("未知的阶段: " + stage + ", 可选值 " + KNOWN_STAGES);
            }
        }
        if (stages.indexOf("COUNTRY") >= 0 && stages.indexOf("POOL") > stages.indexOf("COUNTRY")) {
            throw new IllegalStateException("POOL 阶段必须在 COUNTRY 阶段之前执行");
        }

        requireText(config.getOutput().getPoolDir(), "app.output.pool-dir");
        if (stages.contains("POOL")) {
            requireDirectory(config.getSource().getEcbDir(), "app.source.ecb-dir");
            requireDirectory(config.getSource().getEsmaDir(), "app.source.esma-dir");
            requireFile(config.getMapping().getTemplatePath(), "app.mapping.template-path");
            requireFile(config.getPool().getCorrespondencePath(), "app.pool.correspondence-path");
        }
        if (stages.contains("COUNTRY")) {
            requireText(config.getOutput().getCountryDir(), "app.output.country-dir");
            Path poolDir = Paths.get(config.getOutput().getPoolDir()).toAbsolutePath().normalize();
            Path countryDir = Paths.get(config.getOutput().getCountryDir()).toAbsolutePath().normalize();
            // 国家级输出不能落在 pool 级目录里, 否则会被当成 pool 文件再次扫描
            if (countryDir.startsWith(poolDir)) {
                throw new IllegalStateException("app.output.country-dir 不能位于 app.output.pool-dir 之下: " + countryDir);
            }
        }

        AppProperties.Performance performance = config.getPerformance();
        if (performance.getChunkRows() <= 0) {
            throw new IllegalStateException("app.performance.chunk-rows 必须大于 0");
        }
        if (config.getCountry().getSampleRows() <= 0) {
            throw new IllegalStateException("app.country.sample-rows 必须大于 0");
        }
    }

    private static void requireText(String value, String name) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalStateException(name + " 未配置");
        }
    }

    private static void requireDirectory(String value, String name) {
        requireText(value, name);
        Path path = Paths.get(value);
        if (!Files.isDirectory(path)) {
            throw new IllegalStateException(name + " 不是目录: " + value);
        }
    }

    private static void requireFile(String value, String name) {
        requireText(value, name);
        if (!Files.isRegularFile(Paths.get(value))) {
            throw new IllegalStateException(name + " 文件不存在: " + value);
        }
    }

}
