package com.example.loanmerge.service;

import com.example.loanmerge.dto.CountrySample;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 国家识别规则: 从样本中取候选值, 第一个合法值即为国家代码
 */
public class CountryRule {

    private final String name;
    private final Function<CountrySample, Optional<String>> detector;

    public CountryRule(String name, Function<CountrySample, Optional<String>> detector) {
        this.name = name;
        this.detector = detector;
    }

    public String getName() {
        return name;
    }

    public Optional<String> detect(CountrySample sample) {
        return detector.apply(sample).map(code -> code.toUpperCase(Locale.ROOT));
    }

    /**
     * 列值本身就是两位字母的国家代码 (如 RREL81 = "IT")
     */
    public static CountryRule directCode(String column) {
        return columnRule(column, value -> value.length() == 2 && StringUtils.isAlpha(value), Function.identity());
    }

    /**
     * NUTS 地区代码, 前两位是国家 (如 RREC6 = "ITC4C"); excludedPrefix 开头的值 (ND 表示无数据) 不算
     */
    public static CountryRule regionPrefix(String column, String excludedPrefix) {
        Predicate<String> valid = value -> value.length() >= 2
                && StringUtils.isAlpha(value.substring(0, 2))
                && (excludedPrefix == null || !value.startsWith(excludedPrefix));
        return columnRule(column, valid, value -> value.substring(0, 2));
    }

    /**
     * 从 pool id 中取国家, 如 RMBMFR000083100220149 -> FR
     */
    public static CountryRule poolIdPrefix(int offset, String... prefixes) {
        return new CountryRule("poolId", sample -> {
            String poolId = sample.getPoolId();
            if (poolId == null || !StringUtils.startsWithAny(poolId, prefixes) || poolId.length() < offset + 2) {
                return Optional.empty();
            }
            String code = poolId.substring(offset, offset + 2);
            return StringUtils.isAlpha(code) ? Optional.of(code) : Optional.empty();
        });
    }

    private static CountryRule columnRule(String column, Predicate<String> valid, Function<String, String> extractor) {
        return new CountryRule(column, sample -> {
            int idx = sample.columnIndex(column);
            if (idx < 0) {
                return Optional.empty();
            }
            for (String[] row : sample.getRows()) {
                String value = idx < row.length ? row[idx] : null;
                // 值不做 trim, 带空格的代码视为不合法
                if (StringUtils.isNotEmpty(value) && valid.test(value)) {
                    return Optional.of(extractor.apply(value));
                }
            }
            return Optional.empty();
        });
    }

    @Override
    public String toString() {
        return "CountryRule{" + name + "}";
    }
}
