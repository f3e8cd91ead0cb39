package com.example.loanmerge.service;

import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.service.impl.CsvRowIterator;
import com.example.loanmerge.util.CharsetFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 只读表头, 求一组文件的列名并集 (按字符串自然顺序排序)
 */
@Component
@RequiredArgsConstructor
public class SchemaUnionBuilder {

    private final AppProperties config;

    public List<String> build(List<Path> files) {
        AppProperties.CsvDetailConfig csv = config.getCsv().getOutput();
        SortedSet<String> columns = new TreeSet<>();
        for (Path file : files) {
            String[] header = CsvRowIterator.readHeader(file, csv.toParserSettings(),
                    CharsetFactory.resolveCharset(csv.getEncoding()), config.getPerformance().getReadBufferSize());
            for (String column : header) {
                if (column != null) {
                    columns.add(column);
                }
            }
        }
        return new ArrayList<>(columns);
    }
}
