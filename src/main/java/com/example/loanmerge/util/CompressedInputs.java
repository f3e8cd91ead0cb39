package com.example.loanmerge.util;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;

/**
 * 打开输入文件, .gz 文件自动解压
 */
@Slf4j
public abstract class CompressedInputs {

    // gzip 固定头长度
    private static final int GZIP_HEADER_LENGTH = 10;

    public static boolean isGzip(Path file) {
        return file.getFileName().toString().toLowerCase().endsWith(".gz");
    }

    public static InputStream open(Path file, int bufferSize) throws IOException {
        InputStream raw = new BufferedInputStream(Files.newInputStream(file), bufferSize);
        if (!isGzip(file)) {
            return raw;
        }
        try {
            return new GZIPInputStream(raw, 64 * 1024);
        } catch (ZipException e) {
            // 部分 ECB 文件的 gzip 头不规范, GZIPInputStream 拒绝, 跳过固定头后按原始 deflate 流解压
            raw.close();
            log.warn("gzip 头无法识别, 使用 raw inflate 读取: {} ({})", file.getFileName(), e.getMessage());
            return openRawDeflate(file, bufferSize);
        }
    }

    private static InputStream openRawDeflate(Path file, int bufferSize) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(file), bufferSize);
        try {
            long skipped = in.skip(GZIP_HEADER_LENGTH);
            if (skipped != GZIP_HEADER_LENGTH) {
                throw new ZipException("文件太短, 不是 gzip: " + file);
            }
        } catch (IOException e) {
            in.close();
            throw e;
        }
        return new InflaterInputStream(in, new Inflater(true), 64 * 1024);
    }
}
