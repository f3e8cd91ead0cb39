package com.example.loanmerge.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ECB 字段代码与 ESMA 字段代码的双向映射, 加载后不可变
 */
public final class ColumnMapping {

    private final Map<String, String> ecbToEsma;
    private final Map<String, String> esmaToEcb;

    public ColumnMapping(Map<String, String> ecbToEsma, Map<String, String> esmaToEcb) {
        this.ecbToEsma = Collections.unmodifiableMap(new LinkedHashMap<>(ecbToEsma));
        this.esmaToEcb = Collections.unmodifiableMap(new LinkedHashMap<>(esmaToEcb));
    }

    /**
     * @return ECB 列对应的 ESMA 代码, 没有映射时原样返回
     */
    public String toEsma(String ecbCode) {
        return ecbToEsma.getOrDefault(ecbCode, ecbCode);
    }

    public String toEcb(String esmaCode) {
        return esmaToEcb.getOrDefault(esmaCode, esmaCode);
    }

    public Map<String, String> getEcbToEsma() {
        return ecbToEsma;
    }

    public Map<String, String> getEsmaToEcb() {
        return esmaToEcb;
    }

    @Override
    public String toString() {
        return "ColumnMapping{ecbToEsma=" + ecbToEsma.size() + ", esmaToEcb=" + esmaToEcb.size() + "}";
    }
}
