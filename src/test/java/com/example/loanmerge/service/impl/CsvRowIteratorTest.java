package com.example.loanmerge.service.impl;

import com.example.loanmerge.PoolFixtures;
import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.exception.PoolReadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvRowIteratorTest {

    @TempDir
    Path tempDir;

    private final AppProperties.CsvDetailConfig csv = new AppProperties.CsvDetailConfig();

    private CsvRowIterator open(Path file) {
        return new CsvRowIterator(file, csv.toParserSettings(), StandardCharsets.UTF_8, 4096);
    }

    @Test
    void readsGzipInBatches() throws IOException {
        Path file = PoolFixtures.writeGzip(tempDir.resolve("P_2020.gz"), "a,b\n1,2\n3,4\n5,6\n");

        try (CsvRowIterator iterator = open(file)) {
            assertArrayEquals(new String[]{"a", "b"}, iterator.getHeader());
            assertEquals(2, iterator.nextBatch(2).size());
            List<String[]> last = iterator.nextBatch(2);
            assertEquals(1, last.size());
            assertArrayEquals(new String[]{"5", "6"}, last.get(0));
            assertTrue(iterator.nextBatch(2).isEmpty());
            assertEquals(3, iterator.getRowCount());
        }
    }

    @Test
    @DisplayName("短行按表头长度补 null")
    void shortRowsArePadded() throws IOException {
        Path file = PoolFixtures.writeText(tempDir.resolve("a.csv"), "a,b,c\n1\n\"x,y\",,z\n");

        try (CsvRowIterator iterator = open(file)) {
            assertArrayEquals(new String[]{"1", null, null}, iterator.next());
            assertArrayEquals(new String[]{"x,y", null, "z"}, iterator.next());
            assertFalse(iterator.hasNext());
        }
    }

    @Test
    @DisplayName("列数多于表头的行不能静默截断")
    void rowLongerThanHeaderIsRejected() throws IOException {
        Path file = PoolFixtures.writeText(tempDir.resolve("long.csv"), "A,B\n1,2\n1,2,3\n");

        try (CsvRowIterator iterator = open(file)) {
            assertArrayEquals(new String[]{"1", "2"}, iterator.next());
            PoolReadException e = assertThrows(PoolReadException.class, iterator::next);
            assertTrue(e.getMessage().contains("第 3 行"));
        }
    }

    @Test
    @DisplayName("gzip 头不规范时按 raw deflate 读取")
    void fallsBackToRawInflate() throws IOException {
        Path file = PoolFixtures.writeGzip(tempDir.resolve("P_bad.gz"), "a,b\n1,2\n");
        byte[] bytes = Files.readAllBytes(file);
        bytes[0] = 0;
        bytes[1] = 0;
        Files.write(file, bytes);

        try (CsvRowIterator iterator = open(file)) {
            assertArrayEquals(new String[]{"a", "b"}, iterator.getHeader());
            assertArrayEquals(new String[]{"1", "2"}, iterator.next());
        }
    }

    @Test
    void emptyFileHasEmptyHeader() throws IOException {
        Path file = PoolFixtures.writeText(tempDir.resolve("empty.csv"), "");

        assertEquals(0, CsvRowIterator.readHeader(file, csv.toParserSettings(), StandardCharsets.UTF_8, 4096).length);
    }

    @Test
    void missingFileRaisesPoolReadException() {
        assertThrows(PoolReadException.class, () -> open(tempDir.resolve("missing.csv")));
    }
}
