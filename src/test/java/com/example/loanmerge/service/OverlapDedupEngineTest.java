package com.example.loanmerge.service;

import com.example.loanmerge.dto.DedupResult;
import com.example.loanmerge.dto.LoanRow;
import com.example.loanmerge.enums.SourceFeed;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class OverlapDedupEngineTest {

    private final OverlapDedupEngine engine = new OverlapDedupEngine(List.of("RMBMBE000095100120084"));

    @Test
    void requiresDedupWhenEitherIdListed() {
        assertTrue(engine.requiresDedup("RMBMBE000095100120084", "OTHER"));
        assertTrue(engine.requiresDedup("OTHER", "RMBMBE000095100120084"));
        assertTrue(engine.requiresDedup(null, "RMBMBE000095100120084"));
        assertFalse(engine.requiresDedup("OTHER", null));
    }

    @Test
    @DisplayName("同一贷款同一月份保留 ESMA, 丢弃 ECB; 顺序: 保留的 ECB 行, 然后全部 ESMA 行")
    void esmaWinsOnCollision() {
        List<LoanRow> ecb = List.of(
                row(SourceFeed.ECB, "L1", "2020-03", "e1"),
                row(SourceFeed.ECB, "L2", "2020-03", "e2"),
                row(SourceFeed.ECB, "L1", "2020-06", "e3"));
        List<LoanRow> esma = List.of(
                row(SourceFeed.ESMA, "L1", "2020-03", "s1"),
                row(SourceFeed.ESMA, "L9", "2020-03", "s2"));

        DedupResult result = engine.dedup(ecb, esma);

        assertEquals(List.of("e2", "e3", "s1", "s2"),
                result.getRows().stream().map(r -> r.getValues()[0]).collect(Collectors.toList()));
        assertEquals(1, result.getDroppedRows());
    }

    @Test
    void sameLoanDifferentMonthIsKept() {
        DedupResult result = engine.dedup(
                List.of(row(SourceFeed.ECB, "L1", "2019-12", "e1")),
                List.of(row(SourceFeed.ESMA, "L1", "2020-01", "s1")));

        assertEquals(2, result.getRows().size());
        assertEquals(0, result.getDroppedRows());
    }

    private static LoanRow row(SourceFeed source, String loanId, String yearMonth, String value) {
        return new LoanRow(source, loanId, yearMonth, new String[]{value});
    }
}
