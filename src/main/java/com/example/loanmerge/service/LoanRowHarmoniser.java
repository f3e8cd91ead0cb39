package com.example.loanmerge.service;

import com.example.loanmerge.config.AppProperties;
import com.example.loanmerge.dto.ColumnMapping;
import com.example.loanmerge.enums.SourceFeed;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.HashSet;
import java.util.Set;

/**
 * 把某个数据源文件的表头统一成 ESMA 代码, 并从行里取出贷款号和年月
 */
@Slf4j
public class LoanRowHarmoniser {

    private static final int YEAR_MONTH_LENGTH = 7; // yyyy-MM

    private final ColumnMapping mapping;
    private final AppProperties.Pool poolConfig;

    public LoanRowHarmoniser(ColumnMapping mapping, AppProperties.Pool poolConfig) {
        this.mapping = mapping;
        this.poolConfig = poolConfig;
    }

    /**
     * ECB 列按映射改名; 两个列映射到同一个目标时, 先出现的用目标名, 后面的保留原代码
     * ESMA 列原样保留
     */
    public HarmonisedHeader harmoniseHeader(String[] rawHeader, SourceFeed source) {
        String[] columns = new String[rawHeader.length];
        Set<String> used = new HashSet<>();
        for (int i = 0; i < rawHeader.length; i++) {
            String raw = StringUtils.isEmpty(rawHeader[i]) ? "Unnamed: " + i : rawHeader[i];
            String target = source == SourceFeed.ECB ? mapping.toEsma(raw) : raw;
            if (!used.add(target)) {
                if (!target.equals(raw)) {
                    log.debug("列 {} 映射到 {} 与前面的列冲突, 保留原代码", raw, target);
                }
                target = raw;
                used.add(raw);
            }
            columns[i] = target;
        }

        int loanIdIdx = indexOf(columns, poolConfig.getLoanIdColumn());
        int cutoffIdx = indexOf(columns, poolConfig.getCutoffDateColumn());
        int fallbackIdx = indexOf(columns, poolConfig.getFallbackDateColumn());
        if (fallbackIdx < 0) {
            // AR1 在模板里可能有映射, 改名后再按原代码找一次
            fallbackIdx = indexOf(rawHeader, poolConfig.getFallbackDateColumn());
        }
        return new HarmonisedHeader(source, columns, loanIdIdx, cutoffIdx, fallbackIdx);
    }

    public String loanIdOf(HarmonisedHeader header, String[] raw) {
        String value = valueAt(raw, header.getLoanIdIdx());
        return value == null ? "" : value;
    }

    /**
     * 年月 = 截止日期列前 7 个字符; 该列不存在或为空时用备用日期列
     */
    public String yearMonthOf(HarmonisedHeader header, String[] raw) {
        String value = valueAt(raw, header.getCutoffIdx());
        if (StringUtils.isBlank(value)) {
            value = valueAt(raw, header.getFallbackIdx());
        }
        if (StringUtils.isBlank(value)) {
            return "";
        }
        return StringUtils.left(value.trim(), YEAR_MONTH_LENGTH);
    }

    private static String valueAt(String[] raw, int idx) {
        return idx >= 0 && idx < raw.length ? raw[idx] : null;
    }

    private static int indexOf(String[] columns, String name) {
        if (name == null) {
            return -1;
        }
        for (int i = 0; i < columns.length; i++) {
            if (name.equals(columns[i])) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 某个输入文件改名后的表头, 以及关键列的位置 (不存在为 -1)
     */
    @Value
    public static class HarmonisedHeader {
        SourceFeed source;
        String[] columns;
        int loanIdIdx;
        int cutoffIdx;
        int fallbackIdx;

        public boolean hasLoanId() {
            return loanIdIdx >= 0;
        }
    }
}
