package com.example.loanmerge.service;

import com.example.loanmerge.PoolFixtures;
import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.dto.CountryFile;
import com.example.loanmerge.dto.CountryMergeResult;
import com.example.loanmerge.enums.MergeStage;
import com.example.loanmerge.enums.UnitStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StreamMergeWriterTest {

    @TempDir
    Path tempDir;

    private AppProperties config;
    private Path countryDir;
    private List<CountryFile> files;

    @BeforeEach
    void setUp() throws IOException {
        config = PoolFixtures.properties(tempDir);
        countryDir = tempDir.resolve("countries");
        Path first = PoolFixtures.writeText(tempDir.resolve("pools/matched/P1.csv"), "b,a\n1,2\n3,4\n5,6\n");
        Path second = PoolFixtures.writeText(tempDir.resolve("pools/ecb_only/P2.csv"), "a,c\n7,8\n");
        files = List.of(
                new CountryFile(first, "P1", "matched", "IT", Files.size(first)),
                new CountryFile(second, "P2", "ecb_only", "IT", Files.size(second)));
    }

    private StreamMergeWriter writer() {
        return new StreamMergeWriter(config, new SchemaUnionBuilder(config),
                CheckpointManager.open(MergeStage.COUNTRY, countryDir), new TaskLockManager());
    }

    @Test
    @DisplayName("表头是排序后的并集, 每行列数相同, 缺失列填 null marker")
    void unifiesSchema() throws IOException {
        CountryMergeResult result = writer().merge("IT", files);

        assertEquals(UnitStatus.DONE, result.getStatus());
        assertEquals(4, result.getRows());
        assertEquals(3, result.getColumns());
        assertEquals(2, result.getFilesMerged());
        assertEquals("a,b,c\n2,1,\n4,3,\n6,5,\n8,,7\n", PoolFixtures.read(countryDir.resolve("IT.csv")));
    }

    @Test
    void customNullMarker() throws IOException {
        config.getCountry().setNullMarker("NA");

        writer().merge("IT", files);

        assertEquals("a,b,c\n2,1,NA\n4,3,NA\n6,5,NA\n8,NA,7\n", PoolFixtures.read(countryDir.resolve("IT.csv")));
    }

    @Test
    @DisplayName("没有文件的国家: 不产生输出, 不登记 checkpoint")
    void zeroContributorsProducesNothing() {
        StreamMergeWriter writer = writer();

        CountryMergeResult result = writer.merge("DE", Collections.emptyList());

        assertEquals(UnitStatus.SKIPPED, result.getStatus());
        assertFalse(Files.exists(countryDir.resolve("DE.csv")));
        assertTrue(CheckpointManager.open(MergeStage.COUNTRY, countryDir).entries().isEmpty());
    }

    @Test
    void rerunSkipsCompletedCountry() throws IOException {
        writer().merge("IT", files);
        byte[] first = Files.readAllBytes(countryDir.resolve("IT.csv"));

        CountryMergeResult second = writer().merge("IT", files);

        assertEquals(UnitStatus.SKIPPED, second.getStatus());
        assertArrayEquals(first, Files.readAllBytes(countryDir.resolve("IT.csv")));
    }

    @Test
    @DisplayName("残留的临时文件被清理后重新合并")
    void resumesAfterStaleTempFile() throws IOException {
        Path stale = PoolFixtures.writeText(countryDir.resolve("IT.csv.tmp"), "a,b,c\n2,1");

        CountryMergeResult result = writer().merge("IT", files);

        assertEquals(UnitStatus.DONE, result.getStatus());
        assertFalse(Files.exists(stale));
        assertEquals("a,b,c\n2,1,\n4,3,\n6,5,\n8,,7\n", PoolFixtures.read(countryDir.resolve("IT.csv")));
    }

    @Test
    void unreadableFileFailsCountry() throws IOException {
        Files.delete(files.get(1).getPath());

        CountryMergeResult result = writer().merge("IT", files);

        assertEquals(UnitStatus.FAILED, result.getStatus());
        assertFalse(Files.exists(countryDir.resolve("IT.csv")));
        assertFalse(Files.exists(countryDir.resolve("IT.csv.tmp")));
    }

    @Test
    void projectionFollowsUnifiedOrder() {
        int[] projection = StreamMergeWriter.projectionOf(new String[]{"b", "a"}, List.of("a", "b", "c"));

        assertArrayEquals(new int[]{1, 0, -1}, projection);
    }
}
