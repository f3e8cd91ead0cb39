package com.example.loanmerge.util;

import com.example.loanmerge.enums.PoolCategory;

import java.nio.file.Path;

/**
 * 输出文件命名
 * 为了避免目录名代码散布在各个地方，统一管理
 */
public abstract class OutputDirectoryUtil {

    public static final String CSV_SUFFIX = ".csv";

    public static final String TEMP_SUFFIX = ".tmp";

    /**
     * pool 级输出的单元 id: 分类目录/pool id.csv
     */
    public static String poolUnit(PoolCategory category, String poolId) {
        return category.getFolder() + "/" + safeFileName(poolId) + CSV_SUFFIX;
    }

    /**
     * 国家级输出的单元 id: 国家代码.csv
     */
    public static String countryUnit(String country) {
        return safeFileName(country) + CSV_SUFFIX;
    }

    public static Path tempPathOf(Path finalPath) {
        return finalPath.resolveSibling(finalPath.getFileName().toString() + TEMP_SUFFIX);
    }

    /**
     * pool 级文件名去掉 .csv 就是 pool id
     */
    public static String poolIdOf(Path outputFile) {
        String name = outputFile.getFileName().toString();
        return name.endsWith(CSV_SUFFIX) ? name.substring(0, name.length() - CSV_SUFFIX.length()) : name;
    }

    public static boolean isFinalCsv(Path file) {
        return file.getFileName().toString().endsWith(CSV_SUFFIX);
    }

    public static String safeFileName(String id) {
        return id.replace('/', '_').replace('\\', '_');
    }
}
