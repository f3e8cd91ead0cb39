package com.example.loanmerge.service;

import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.dto.LoanRow;
import com.example.loanmerge.service.LoanRowHarmoniser.HarmonisedHeader;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一个 pool 的输出列布局
 *
 * <pre>
 * source, [各文件改名后列的并集, 按首次出现顺序: 先 ECB 文件再 ESMA 文件], ecb_pool_id, esma_pool_id
 * </pre>
 *
 * 同时记录哪些输出列出现过非空值, 用于去掉全空列.
 */
public class PoolLayout {

    private final LoanRowHarmoniser harmoniser;
    private final List<HarmonisedHeader> headers;
    private final String ecbPoolId;
    private final String esmaPoolId;

    private final String[] columns;
    private final List<int[]> projections = new ArrayList<>();
    private final int ecbPoolIdIdx;
    private final int esmaPoolIdIdx;
    private final boolean[] nonEmpty;

    /**
     * @param headers 按处理顺序排列的文件表头 (ECB 文件在前)
     */
    public PoolLayout(LoanRowHarmoniser harmoniser, AppProperties.Pool poolConfig, List<HarmonisedHeader> headers,
                      String ecbPoolId, String esmaPoolId) {
        this.harmoniser = harmoniser;
        this.headers = headers;
        this.ecbPoolId = ecbPoolId;
        this.esmaPoolId = esmaPoolId;

        String sourceColumn = poolConfig.getSourceColumn();
        String ecbIdColumn = poolConfig.getEcbPoolIdColumn();
        String esmaIdColumn = poolConfig.getEsmaPoolIdColumn();

        Map<String, Integer> positions = new LinkedHashMap<>();
        positions.put(sourceColumn, 0);
        for (HarmonisedHeader header : headers) {
            for (String column : header.getColumns()) {
                if (!column.equals(ecbIdColumn) && !column.equals(esmaIdColumn)) {
                    positions.putIfAbsent(column, positions.size());
                }
            }
        }
        this.ecbPoolIdIdx = positions.size();
        positions.put(ecbIdColumn, ecbPoolIdIdx);
        this.esmaPoolIdIdx = positions.size();
        positions.put(esmaIdColumn, esmaPoolIdIdx);
        this.columns = positions.keySet().toArray(new String[0]);
        this.nonEmpty = new boolean[columns.length];

        for (HarmonisedHeader header : headers) {
            String[] fileColumns = header.getColumns();
            int[] projection = new int[fileColumns.length];
            boolean[] taken = new boolean[columns.length];
            // source 和 pool id 列由程序填写, 文件里的同名列忽略
            taken[0] = true;
            taken[ecbPoolIdIdx] = true;
            taken[esmaPoolIdIdx] = true;
            for (int i = 0; i < fileColumns.length; i++) {
                int target = positions.get(fileColumns[i]);
                if (taken[target]) {
                    projection[i] = -1;
                } else {
                    projection[i] = target;
                    taken[target] = true;
                }
            }
            projections.add(projection);
        }
    }

    public String[] getColumns() {
        return columns;
    }

    public HarmonisedHeader headerOf(int fileIdx) {
        return headers.get(fileIdx);
    }

    /**
     * 把某个文件的一行原始数据转换成按输出列排列的 LoanRow
     */
    public LoanRow toLoanRow(int fileIdx, String[] raw) {
        HarmonisedHeader header = headers.get(fileIdx);
        int[] projection = projections.get(fileIdx);
        String[] values = new String[columns.length];
        int n = Math.min(raw.length, projection.length);
        for (int i = 0; i < n; i++) {
            if (projection[i] >= 0) {
                values[projection[i]] = raw[i];
            }
        }
        values[0] = header.getSource().name();
        values[ecbPoolIdIdx] = ecbPoolId;
        values[esmaPoolIdIdx] = esmaPoolId;
        return new LoanRow(header.getSource(), harmoniser.loanIdOf(header, raw),
                harmoniser.yearMonthOf(header, raw), values);
    }

    public void markNonEmpty(LoanRow row) {
        String[] values = row.getValues();
        for (int i = 0; i < values.length; i++) {
            if (!nonEmpty[i] && StringUtils.isNotEmpty(values[i])) {
                nonEmpty[i] = true;
            }
        }
    }

    /**
     * @param dropEmpty 为 true 时只保留出现过非空值的列
     * @return 要输出的列下标
     */
    public int[] keptColumns(boolean dropEmpty) {
        int[] kept = new int[columns.length];
        int count = 0;
        for (int i = 0; i < columns.length; i++) {
            if (!dropEmpty || nonEmpty[i]) {
                kept[count++] = i;
            }
        }
        return Arrays.copyOf(kept, count);
    }

    public String[] header(int[] kept) {
        return select(columns, kept);
    }

    public static String[] select(String[] values, int[] kept) {
        String[] out = new String[kept.length];
        for (int i = 0; i < kept.length; i++) {
            out[i] = values[kept[i]];
        }
        return out;
    }
}
