package com.example.loanmerge.service;

import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.exception.OutputWriteException;
import com.example.loanmerge.util.CharsetFactory;
import com.example.loanmerge.util.OutputDirectoryUtil;
import com.univocity.parsers.csv.CsvWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * 先写临时文件 (xxx.csv.tmp), commit 时再原子 rename 成正式文件
 * 没有 commit 就 close 的话 (异常或没有数据), 临时文件会被删除, 正式文件不会出现
 */
@Slf4j
public class AtomicCsvOutput implements AutoCloseable {
    private final Path finalPath;
    private final Path tempPath;
    private final CsvWriter csvWriter;
    private boolean committed;
    private boolean closed;
    private long rows;

    private AtomicCsvOutput(Path finalPath, Path tempPath, CsvWriter csvWriter) {
        this.finalPath = finalPath;
        this.tempPath = tempPath;
        this.csvWriter = csvWriter;
    }

    public static AtomicCsvOutput open(Path finalPath, AppProperties.CsvDetailConfig csvConfig, int bufferSize) {
        Path tempPath = OutputDirectoryUtil.tempPathOf(finalPath);
        try {
            Files.createDirectories(finalPath.toAbsolutePath().getParent());
            Writer out = new BufferedWriter(new OutputStreamWriter(
                    Files.newOutputStream(tempPath, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE),
                    CharsetFactory.resolveCharset(csvConfig.getEncoding())), bufferSize);
            return new AtomicCsvOutput(finalPath, tempPath, new CsvWriter(out, csvConfig.toWriterSettings()));
        } catch (IOException e) {
            deleteQuietly(tempPath);
            throw new OutputWriteException("无法创建输出文件: " + tempPath, e);
        }
    }

    public void writeHeader(String[] header) {
        write(header);
    }

    public void writeRow(String[] row) {
        write(row);
        rows++;
    }

    private void write(String[] row) {
        try {
            csvWriter.writeRow((Object[]) row);
        } catch (RuntimeException e) {
            // univocity 把 IOException 包成运行时异常
            throw new OutputWriteException("写入失败: " + tempPath, e);
        }
    }

    public long getRows() {
        return rows;
    }

    public Path getTempPath() {
        return tempPath;
    }

    /**
     * 关闭 writer 并 rename 成正式文件; 只有这一步成功后才能登记 checkpoint
     */
    public void commit() {
        try {
            csvWriter.close();
        } catch (RuntimeException e) {
            throw new OutputWriteException("关闭输出文件失败: " + tempPath, e);
        } finally {
            closed = true;
        }
        try {
            try {
                Files.move(tempPath, finalPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempPath, finalPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new OutputWriteException("重命名失败: " + tempPath + " -> " + finalPath, e);
        }
        committed = true;
    }

    @Override
    public void close() {
        if (committed) {
            return;
        }
        if (!closed) {
            try {
                csvWriter.close();
            } catch (RuntimeException e) {
                log.warn("关闭未提交的输出文件失败: {}", tempPath, e);
            }
            closed = true;
        }
        deleteQuietly(tempPath);
    }

    private static void deleteQuietly(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                log.info("已清理临时文件: {}", path);
            }
        } catch (IOException e) {
            log.warn("清理临时文件失败: {}", path, e);
        }
    }
}
