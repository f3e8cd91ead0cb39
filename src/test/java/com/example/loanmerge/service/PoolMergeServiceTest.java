package com.example.loanmerge.service;

import com.example.loanmerge.PoolFixtures;
import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.dto.PoolMergeResult;
import com.example.loanmerge.dto.StageSummary;
import com.example.loanmerge.enums.PoolCategory;
import com.example.loanmerge.enums.UnitStatus;
import com.example.loanmerge.exception.MappingLoadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PoolMergeServiceTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        PoolFixtures.writeMatchedPool(tempDir);
        for (int i = 1; i <= 5; i++) {
            StringBuilder sb = new StringBuilder("AR3,AR1,AR20\n");
            for (int row = 0; row < 7; row++) {
                sb.append("L").append(i).append('_').append(row).append(",2021-0").append(1 + row % 9).append("-28,").append(row * i).append('\n');
            }
            PoolFixtures.writeGzip(tempDir.resolve("ecb/RMBMFR00000" + i + "_2021.gz"), sb.toString());
        }
        PoolFixtures.writeText(tempDir.resolve("esma/ESMA_RMBSNL000009_2021_01.csv"), "RREL3,RREL6\nN1,2021-01-31\nN2,2021-02-28\n");
    }

    private StageSummary run(String outDir, int threads) {
        AppProperties config = PoolFixtures.properties(tempDir);
        config.getOutput().setPoolDir(tempDir.resolve(outDir).toString());
        config.getPool().getOverlapPools().add(PoolFixtures.ECB_POOL);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.initialize();
        try {
            PoolMergeService service = new PoolMergeService(config, new MappingLoader(config), new PoolClassifier(),
                    new TaskLockManager(), executor);
            return service.runStage();
        } finally {
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("并发执行与串行执行的输出完全相同")
    void concurrentRunMatchesSequentialRun() throws IOException {
        StageSummary sequential = run("out/seq", 1);
        StageSummary concurrent = run("out/par", 4);

        assertEquals(7, sequential.getDone());
        assertEquals(0, sequential.getFailed());
        assertEquals(sequential.getTotalRows(), concurrent.getTotalRows());
        assertEquals(1, concurrent.getDroppedRows());

        Map<String, byte[]> seqFiles = outputs(tempDir.resolve("out/seq"));
        Map<String, byte[]> parFiles = outputs(tempDir.resolve("out/par"));
        assertEquals(seqFiles.keySet(), parFiles.keySet());
        assertEquals(7, seqFiles.size());
        for (String name : seqFiles.keySet()) {
            assertArrayEquals(seqFiles.get(name), parFiles.get(name), name);
        }
    }

    @Test
    void summaryFollowsCategoryOrder() {
        StageSummary summary = run("out/seq", 2);

        assertEquals(PoolCategory.MATCHED, summary.getPools().get(0).getCategory());
        assertEquals(PoolCategory.ESMA_ONLY, summary.getPools().get(summary.getPools().size() - 1).getCategory());
        assertTrue(summary.getPools().stream().allMatch(r -> r.getStatus() == UnitStatus.DONE));
        assertTrue(Files.exists(tempDir.resolve("out/seq/esma_only/RMBSNL000009.csv")));
    }

    @Test
    void secondRunSkipsEverything() {
        run("out/seq", 2);
        StageSummary second = run("out/seq", 2);

        assertEquals(0, second.getDone());
        assertEquals(7, second.getSkipped());
        assertEquals(0, second.getPools().stream().mapToLong(PoolMergeResult::getRows).sum());
    }

    @Test
    void brokenMappingAbortsStage() throws IOException {
        PoolFixtures.writeText(tempDir.resolve("template.csv"), "FIELD CODE\nRREL3\n");

        assertThrows(MappingLoadException.class, () -> run("out/seq", 1));
        assertFalse(Files.exists(tempDir.resolve("out/seq/matched")));
    }

    private static Map<String, byte[]> outputs(Path dir) throws IOException {
        try (Stream<Path> files = Files.walk(dir)) {
            Map<String, byte[]> result = new TreeMap<>();
            for (Path file : files.filter(Files::isRegularFile)
                    .filter(f -> f.toString().endsWith(".csv"))
                    .collect(Collectors.toList())) {
                result.put(dir.relativize(file).toString(), Files.readAllBytes(file));
            }
            return result;
        }
    }
}
