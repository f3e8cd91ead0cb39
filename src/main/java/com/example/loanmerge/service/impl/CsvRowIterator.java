package com.example.loanmerge.service.impl;

import com.example.loanmerge.exception.PoolReadException;
import com.example.loanmerge.service.CloseableRowIterator;
import com.example.loanmerge.util.CompressedInputs;
import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 流式读取一个 CSV (或 .gz) 文件
 * 第一行是表头; 短行按表头长度补 null, 列数多于表头的行抛 PoolReadException
 */
@Slf4j
public class CsvRowIterator implements CloseableRowIterator {
    private final Path file;
    private final Reader reader;
    private final CsvParser parser;
    private final String[] header;
    private String[] nextRow;
    private long rowCount;

    public CsvRowIterator(Path file, CsvParserSettings settings, Charset charset, int bufferSize) {
        this.file = file;
        try {
            this.reader = new InputStreamReader(CompressedInputs.open(file, bufferSize), charset);
        } catch (IOException e) {
            throw new PoolReadException("无法打开输入文件: " + file, e);
        }
        this.parser = new CsvParser(settings);
        try {
            this.parser.beginParsing(reader);
            String[] firstRow = parser.parseNext();
            this.header = firstRow == null ? new String[0] : firstRow;
            this.nextRow = firstRow == null ? null : parser.parseNext(); // 预读
        } catch (TextParsingException | IllegalStateException e) {
            close();
            throw new PoolReadException("解析文件失败: " + file + ", " + e.getMessage(), e);
        }
        if (log.isDebugEnabled()) {
            log.debug("打开文件: {}, 列数: {}", file, header.length);
        }
    }

    /**
     * 只读取表头, 不读数据
     */
    public static String[] readHeader(Path file, CsvParserSettings settings, Charset charset, int bufferSize) {
        try (CsvRowIterator iterator = new CsvRowIterator(file, settings, charset, bufferSize)) {
            return iterator.getHeader();
        }
    }

    @Override
    public String[] getHeader() {
        return header;
    }

    public long getRowCount() {
        return rowCount;
    }

    @Override
    public boolean hasNext() {
        return nextRow != null;
    }

    @Override
    public String[] next() {
        if (nextRow == null) {
            throw new NoSuchElementException("文件已读完: " + file);
        }
        String[] current = nextRow;
        try {
            nextRow = parser.parseNext(); // 预读下一行
        } catch (TextParsingException | IllegalStateException e) {
            throw new PoolReadException("解析文件失败: " + file + " 第 " + (rowCount + 2) + " 行附近, " + e.getMessage(), e);
        }
        rowCount++;
        return align(current);
    }

    @Override
    public List<String[]> nextBatch(int maxRows) {
        List<String[]> batch = new ArrayList<>(Math.min(maxRows, 10_000));
        while (batch.size() < maxRows && hasNext()) {
            batch.add(next());
        }
        return batch;
    }

    private String[] align(String[] row) {
        if (row.length == header.length) {
            return row;
        }
        if (row.length > header.length) {
            // 多出的值无处安放, 整个文件按无法读取处理
            throw new PoolReadException("文件 " + file + " 第 " + (rowCount + 1) + " 行有 " + row.length
                    + " 列, 多于表头的 " + header.length + " 列");
        }
        return Arrays.copyOf(row, header.length);
    }

    @Override
    public void close() {
        parser.stopParsing();
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("关闭文件失败: {}", file, e);
        }
    }
}
