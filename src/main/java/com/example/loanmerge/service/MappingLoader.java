package com.example.loanmerge.service;

import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.dto.ColumnMapping;
import com.example.loanmerge.exception.MappingLoadException;
import com.example.loanmerge.exception.PoolReadException;
import com.example.loanmerge.service.impl.CsvRowIterator;
import com.example.loanmerge.util.CharsetFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 读取 ESMA 模板, 生成 ECB <-> ESMA 字段代码的双向映射
 *
 * <p>多个代码映射到同一个目标时: 名称里带 "New" (或 PREFERRED 列为真) 的行优先,
 * 否则先出现的行胜出.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MappingLoader {

    private final AppProperties config;

    public ColumnMapping load(Path templatePath) {
        List<MappingRow> rows = readRows(templatePath);
        ColumnMapping mapping = build(rows);
        log.info("加载字段映射: {}, 有效行 {}, ECB->ESMA {} 个, ESMA->ECB {} 个",
                templatePath, rows.size(), mapping.getEcbToEsma().size(), mapping.getEsmaToEcb().size());
        return mapping;
    }

    ColumnMapping build(List<MappingRow> rows) {
        Map<String, String> ecbToEsma = new LinkedHashMap<>();
        Map<String, String> esmaToEcb = new LinkedHashMap<>();
        Set<String> preferredEcb = new HashSet<>();
        Set<String> preferredEsma = new HashSet<>();
        for (MappingRow row : rows) {
            put(ecbToEsma, preferredEcb, row.ecbCode, row.esmaCode, row.preferred);
            put(esmaToEcb, preferredEsma, row.esmaCode, row.ecbCode, row.preferred);
        }
        return new ColumnMapping(ecbToEsma, esmaToEcb);
    }

    private void put(Map<String, String> map, Set<String> preferredKeys, String key, String value, boolean preferred) {
        String existing = map.get(key);
        if (existing == null) {
            map.put(key, value);
            if (preferred) {
                preferredKeys.add(key);
            }
        } else if (preferred && !preferredKeys.contains(key)) {
            log.debug("映射冲突 {}: 优先行 {} 替换 {}", key, value, existing);
            map.put(key, value);
            preferredKeys.add(key);
        } else if (!existing.equals(value)) {
            log.debug("映射冲突 {}: 保留先出现的 {}, 忽略 {}", key, existing, value);
        }
    }

    private List<MappingRow> readRows(Path templatePath) {
        if (templatePath == null || !Files.isRegularFile(templatePath)) {
            throw new MappingLoadException("映射模板不存在: " + templatePath);
        }
        String name = templatePath.getFileName().toString().toLowerCase();
        List<String[]> table;
        if (name.endsWith(".xlsx") || name.endsWith(".xls")) {
            table = readExcel(templatePath);
        } else if (name.endsWith(".csv")) {
            table = readCsv(templatePath);
        } else {
            throw new MappingLoadException("不支持的映射模板格式: " + templatePath);
        }
        if (table.isEmpty()) {
            throw new MappingLoadException("映射模板为空: " + templatePath);
        }
        return toMappingRows(table, templatePath);
    }

    private List<MappingRow> toMappingRows(List<String[]> table, Path templatePath) {
        AppProperties.Mapping mappingConfig = config.getMapping();
        String[] header = table.get(0);
        int esmaIdx = indexOf(header, mappingConfig.getEsmaCodeColumn());
        int ecbIdx = indexOf(header, mappingConfig.getEcbCodeColumn());
        if (esmaIdx < 0 || ecbIdx < 0) {
            throw new MappingLoadException("映射模板缺少必需的列 [" + mappingConfig.getEsmaCodeColumn() + "] 或 ["
                    + mappingConfig.getEcbCodeColumn() + "]: " + templatePath);
        }
        int nameIdx = indexOf(header, mappingConfig.getEsmaNameColumn());
        int preferredIdx = indexOf(header, mappingConfig.getPreferredColumn());

        List<MappingRow> rows = new ArrayList<>();
        for (int i = 1; i < table.size(); i++) {
            String[] line = table.get(i);
            String esmaCode = StringUtils.trimToNull(cell(line, esmaIdx));
            String ecbCode = StringUtils.trimToNull(cell(line, ecbIdx));
            // ECB 代码为空的行没有对应关系
            if (esmaCode == null || ecbCode == null) {
                continue;
            }
            boolean preferred = StringUtils.contains(cell(line, nameIdx), mappingConfig.getPreferredMarker())
                    || isTrue(cell(line, preferredIdx));
            rows.add(new MappingRow(esmaCode, ecbCode, preferred));
        }
        return rows;
    }

    private List<String[]> readCsv(Path templatePath) {
        List<String[]> table = new ArrayList<>();
        AppProperties.CsvDetailConfig csv = config.getCsv().getEsmaSource();
        try (CsvRowIterator iterator = new CsvRowIterator(templatePath, csv.toParserSettings(),
                CharsetFactory.resolveCharset(csv.getEncoding()), config.getPerformance().getReadBufferSize())) {
            table.add(iterator.getHeader());
            while (iterator.hasNext()) {
                table.add(iterator.next());
            }
        } catch (PoolReadException e) {
            throw new MappingLoadException("无法读取映射模板: " + templatePath, e);
        }
        return table;
    }

    private List<String[]> readExcel(Path templatePath) {
        String sheetName = config.getMapping().getSheet();
        try (InputStream is = Files.newInputStream(templatePath);
             Workbook workbook = WorkbookFactory.create(is)) {
            Sheet sheet = StringUtils.isNotEmpty(sheetName) ? workbook.getSheet(sheetName) : workbook.getSheetAt(0);
            if (sheet == null) {
                throw new MappingLoadException("映射模板中找不到 sheet: " + sheetName);
            }
            List<String[]> table = new ArrayList<>();
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return table;
            }
            int width = headerRow.getLastCellNum();
            for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                String[] values = new String[width];
                if (row != null) {
                    for (int c = 0; c < width; c++) {
                        values[c] = getCellStringValue(row.getCell(c));
                    }
                }
                table.add(values);
            }
            return table;
        } catch (IOException | RuntimeException e) {
            if (e instanceof MappingLoadException) {
                throw (MappingLoadException) e;
            }
            throw new MappingLoadException("无法读取映射模板: " + templatePath, e);
        }
    }

    private String getCellStringValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                return String.valueOf((long) cell.getNumericCellValue());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case FORMULA:
                return cell.getCellFormula();
            default:
                return null;
        }
    }

    private static int indexOf(String[] header, String column) {
        if (column == null) {
            return -1;
        }
        for (int i = 0; i < header.length; i++) {
            if (header[i] != null && column.equalsIgnoreCase(header[i].trim())) {
                return i;
            }
        }
        return -1;
    }

    private static String cell(String[] line, int idx) {
        return idx >= 0 && idx < line.length ? line[idx] : null;
    }

    private static boolean isTrue(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim().toLowerCase();
        return v.equals("true") || v.equals("y") || v.equals("yes") || v.equals("1");
    }

    static class MappingRow {
        final String esmaCode;
        final String ecbCode;
        final boolean preferred;

        MappingRow(String esmaCode, String ecbCode, boolean preferred) {
            this.esmaCode = esmaCode;
            this.ecbCode = ecbCode;
            this.preferred = preferred;
        }
    }
}
