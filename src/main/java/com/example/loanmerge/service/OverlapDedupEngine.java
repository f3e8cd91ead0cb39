package com.example.loanmerge.service;

import com.example.loanmerge.dto.DedupResult;
import com.example.loanmerge.dto.LoanKey;
import com.example.loanmerge.dto.LoanRow;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 重叠 pool 的去重: 同一 (贷款号, 年月) 两边都有时保留 ESMA, 丢弃 ECB
 * 只有在重叠清单里的 pool 才需要去重
 */
@Slf4j
public class OverlapDedupEngine {

    private final Set<String> overlapPools;

    public OverlapDedupEngine(Collection<String> overlapPools) {
        this.overlapPools = Collections.unmodifiableSet(new LinkedHashSet<>(overlapPools));
    }

    public Set<String> getOverlapPools() {
        return overlapPools;
    }

    /**
     * ECB id 或 ESMA id 任意一个在清单里就需要去重
     */
    public boolean requiresDedup(String ecbPoolId, String esmaPoolId) {
        return (ecbPoolId != null && overlapPools.contains(ecbPoolId))
                || (esmaPoolId != null && overlapPools.contains(esmaPoolId));
    }

    public DedupResult dedup(List<LoanRow> ecbRows, List<LoanRow> esmaRows) {
        Set<LoanKey> esmaKeys = collectKeys(esmaRows);
        List<LoanRow> rows = new ArrayList<>(ecbRows.size() + esmaRows.size());
        long dropped = 0;
        for (LoanRow row : ecbRows) {
            if (retain(row, esmaKeys)) {
                rows.add(row);
            } else {
                dropped++;
            }
        }
        rows.addAll(esmaRows);
        log.debug("去重: ECB {} 行, ESMA {} 行, ESMA 键 {} 个, 丢弃 ECB {} 行",
                ecbRows.size(), esmaRows.size(), esmaKeys.size(), dropped);
        return new DedupResult(rows, dropped);
    }

    public Set<LoanKey> collectKeys(Iterable<LoanRow> esmaRows) {
        Set<LoanKey> keys = new HashSet<>();
        for (LoanRow row : esmaRows) {
            keys.add(row.key());
        }
        return keys;
    }

    /**
     * @return ECB 行是否保留 (ESMA 中没有同样的键)
     */
    public boolean retain(LoanRow ecbRow, Set<LoanKey> esmaKeys) {
        return !esmaKeys.contains(ecbRow.key());
    }
}
