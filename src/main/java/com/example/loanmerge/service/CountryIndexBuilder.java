package com.example.loanmerge.service;

import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.dto.CountryFile;
import com.example.loanmerge.dto.CountryIndex;
import com.example.loanmerge.dto.CountrySample;
import com.example.loanmerge.enums.PoolCategory;
import com.example.loanmerge.exception.PoolReadException;
import com.example.loanmerge.service.impl.CsvRowIterator;
import com.example.loanmerge.util.CharsetFactory;
import com.example.loanmerge.util.OutputDirectoryUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 扫描 pool 级输出, 读取每个文件的样本识别国家, 建立 国家 -> 文件 的索引
 * 文件顺序: matched, ecb_only, esma_only, 目录内按文件名
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CountryIndexBuilder {

    private final AppProperties config;
    private final CountryDetector detector;

    public CountryIndex build(Path poolDir) {
        CountryIndex index = new CountryIndex();
        for (PoolCategory category : PoolCategory.values()) {
            Path folder = poolDir.resolve(category.getFolder());
            if (!Files.isDirectory(folder)) {
                continue;
            }
            for (Path file : listCsv(folder)) {
                try {
                    CountrySample sample = readSample(file);
                    String country = detector.detect(sample);
                    index.add(new CountryFile(file, sample.getPoolId(), category.getFolder(), country, Files.size(file)));
                } catch (PoolReadException | IOException e) {
                    log.error("无法读取 pool 级文件样本, 不参与国家合并: {}", file, e);
                    index.addUnreadable(file.toString());
                }
            }
        }
        log.info("国家索引建立完成: {} 个国家, {} 个文件, 无法读取 {} 个",
                index.countries().size(), index.fileCount(), index.getUnreadableFiles().size());
        return index;
    }

    CountrySample readSample(Path file) {
        AppProperties.CsvDetailConfig csv = config.getCsv().getOutput();
        try (CsvRowIterator iterator = new CsvRowIterator(file, csv.toParserSettings(),
                CharsetFactory.resolveCharset(csv.getEncoding()), config.getPerformance().getReadBufferSize())) {
            List<String[]> rows = iterator.nextBatch(config.getCountry().getSampleRows());
            return new CountrySample(OutputDirectoryUtil.poolIdOf(file), iterator.getHeader(), rows);
        }
    }

    private static List<Path> listCsv(Path folder) {
        try (Stream<Path> files = Files.list(folder)) {
            return files.filter(Files::isRegularFile)
                    .filter(OutputDirectoryUtil::isFinalCsv)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("无法扫描目录: " + folder, e);
        }
    }
}
