package com.example.loanmerge.service;

import com.example.loanmerge.PoolFixtures;
import com.example.loanmerge.config.AppProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AtomicCsvOutputTest {

    @TempDir
    Path tempDir;

    private final AppProperties.CsvDetailConfig csv = new AppProperties.CsvDetailConfig();

    @Test
    void commitRenamesTempFile() throws IOException {
        Path target = tempDir.resolve("matched/P1.csv");

        try (AtomicCsvOutput output = AtomicCsvOutput.open(target, csv, 1024)) {
            output.writeHeader(new String[]{"a", "b"});
            output.writeRow(new String[]{"1", "x,y"});
            assertTrue(Files.exists(output.getTempPath()));
            assertFalse(Files.exists(target));
            output.commit();
            assertEquals(1, output.getRows());
        }

        assertEquals("a,b\n1,\"x,y\"\n", PoolFixtures.read(target));
        assertFalse(Files.exists(tempDir.resolve("matched/P1.csv.tmp")));
    }

    @Test
    void closeWithoutCommitLeavesNothing() {
        Path target = tempDir.resolve("IT.csv");

        try (AtomicCsvOutput output = AtomicCsvOutput.open(target, csv, 1024)) {
            output.writeHeader(new String[]{"a"});
            output.writeRow(new String[]{"1"});
        }

        assertFalse(Files.exists(target));
        assertFalse(Files.exists(tempDir.resolve("IT.csv.tmp")));
    }
}
