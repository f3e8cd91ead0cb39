package com.example.loanmerge.service;

import com.example.loanmerge.dto.CountrySample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 按优先级依次尝试各个规则, 第一个成功的规则决定国家; 全部失败时为 UNKNOWN
 */
@Component
@Slf4j
public class CountryDetector {

    public static final String UNKNOWN = "UNKNOWN";

    private final List<CountryRule> rules;

    public CountryDetector() {
        this(defaultRules());
    }

    public CountryDetector(List<CountryRule> rules) {
        this.rules = Collections.unmodifiableList(rules);
    }

    public static List<CountryRule> defaultRules() {
        return List.of(
                CountryRule.directCode("RREL81"),         // 贷款人所在国
                CountryRule.directCode("RREL84"),         // 发起人所在国
                CountryRule.regionPrefix("RREC6", null),  // 抵押物所在 NUTS 地区
                CountryRule.regionPrefix("RREL11", "ND"), // 借款人所在 NUTS 地区
                CountryRule.regionPrefix("AR129", "ND"),  // ECB 模板的地区字段
                CountryRule.directCode("NPEL20"),
                CountryRule.directCode("NPEL23"),
                CountryRule.poolIdPrefix(4, "RMBM", "RMBS"));
    }

    public String detect(CountrySample sample) {
        for (CountryRule rule : rules) {
            Optional<String> country = rule.detect(sample);
            if (country.isPresent()) {
                log.debug("pool {} 国家 {} (规则 {})", sample.getPoolId(), country.get(), rule.getName());
                return country.get();
            }
        }
        log.warn("无法识别 pool {} 的国家, 归入 {}", sample.getPoolId(), UNKNOWN);
        return UNKNOWN;
    }
}
