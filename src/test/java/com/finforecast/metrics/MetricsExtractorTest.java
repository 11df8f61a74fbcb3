package com.finforecast.metrics;

import com.finforecast.Fixtures;
import com.finforecast.core.diagnostics.CauseCode;
import com.finforecast.core.diagnostics.Outcome;
import com.finforecast.facts.FactNodes;
import com.finforecast.facts.ListNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsExtractorTest {
    private final MetricsExtractor extractor = new MetricsExtractor();

    @Test
    void extractYearShouldResolveSectionedDocument() {
        Outcome<MetricRecord> outcome = extractor.extractYear(Fixtures.document("ACME_2023.json"), 2023);

        assertTrue(outcome.success);
        MetricRecord row = outcome.value;
        assertEquals(2023, row.fiscalYear);
        assertEquals(1500.0, row.get(Metric.REVENUE), 1e-9);
        assertEquals(900.0, row.get(Metric.COGS), 1e-9);
        assertEquals(150.0, row.get(Metric.RD_EXPENSE), 1e-9);
        assertEquals(200.0, row.get(Metric.SGA_EXPENSE), 1e-9);
        assertEquals(250.0, row.get(Metric.OPERATING_INCOME), 1e-9);
        assertEquals(180.0, row.get(Metric.NET_INCOME), 1e-9);
        assertEquals(1.8, row.get(Metric.EPS), 1e-12);
        assertEquals(100_000_000.0, row.get(Metric.SHARES_DILUTED), 1e-3);
        assertEquals(300.0, row.get(Metric.CFO), 1e-9);
        assertEquals(-60.0, row.get(Metric.CAPEX), 1e-9);
        assertEquals(400.0, row.get(Metric.TOTAL_DEBT), 1e-9);
        assertEquals(150.0, row.get(Metric.CASH), 1e-9);
        assertEquals(800.0, row.get(Metric.BOOK_VALUE), 1e-9);
    }

    @Test
    void statementSectionOfPlainScalarsShouldResolve() {
        Map<String, Object> income = new LinkedHashMap<>();
        income.put("Revenues", 1000);
        income.put("CostOfRevenue", "600");
        income.put("NetIncomeLoss", "(25)");

        MetricRecord row = extractor.extractYear(FactNodes.of(Map.of("StatementsOfIncome", income)), 2023)
                .orElseThrow();

        assertEquals(1000.0, row.get(Metric.REVENUE), 1e-9);
        assertEquals(600.0, row.get(Metric.COGS), 1e-9);
        assertEquals(-25.0, row.get(Metric.NET_INCOME), 1e-9);
        assertEquals(0.4, row.get(Metric.GROSS_MARGIN), 1e-12);
    }

    @Test
    void extractYearShouldComputeDerivedMetrics() {
        MetricRecord row = extractor.extractYear(Fixtures.document("ACME_2023.json"), 2023).orElseThrow();

        assertEquals(600.0, row.get(Metric.GROSS_PROFIT), 1e-9);
        assertEquals(0.4, row.get(Metric.GROSS_MARGIN), 1e-12);
        assertEquals(250.0 / 1500.0, row.get(Metric.OPERATING_MARGIN), 1e-12);
        assertEquals(0.12, row.get(Metric.NET_MARGIN), 1e-12);
        assertEquals(240.0, row.get(Metric.FCF), 1e-9);
        assertEquals(0.16, row.get(Metric.FCF_MARGIN), 1e-12);
        assertEquals(250.0, row.get(Metric.NET_DEBT), 1e-9);
        assertEquals(0.5, row.get(Metric.DEBT_TO_EQUITY), 1e-12);
    }

    @Test
    void extractYearShouldLeaveUnresolvedMetricsMissing() {
        MetricRecord row = extractor.extractYear(Fixtures.document("ACME_2022.json"), 2022).orElseThrow();

        assertEquals(1200.0, row.get(Metric.REVENUE), 1e-9);
        assertEquals(420.0, row.get(Metric.GROSS_PROFIT), 1e-9);
        assertNull(row.get(Metric.CFO));
        assertNull(row.get(Metric.FCF));
        assertNull(row.get(Metric.FCF_MARGIN));
        assertNull(row.get(Metric.OPERATING_MARGIN));
        assertNull(row.get(Metric.EPS));
        assertNull(row.get(Metric.NET_DEBT));
    }

    @Test
    void extractYearShouldReadFlatNumericDocumentAndDeriveEps() {
        MetricRecord row = extractor.extractYear(Fixtures.document("flat_2021.json"), 2021).orElseThrow();

        assertEquals(1000.0, row.get(Metric.REVENUE), 1e-9);
        assertEquals(600.0, row.get(Metric.COGS), 1e-9);
        assertEquals(0.09, row.get(Metric.NET_MARGIN), 1e-12);
        assertEquals(3.0, row.get(Metric.EPS), 1e-12);
    }

    @Test
    void extractYearShouldReadTaggedSeriesDocument() {
        Map<String, Object> doc = Map.of(
                "us-gaap:Revenues", List.of(
                        Map.of("val", 900, "start", "2022-01-01", "end", "2022-12-31"),
                        Map.of("val", 1000, "start", "2023-01-01", "end", "2023-12-31")
                ),
                "us-gaap:NetIncomeLoss", List.of(
                        Map.of("val", -50, "start", "2023-01-01", "end", "2023-12-31")
                )
        );

        MetricRecord row = extractor.extractYear(FactNodes.of(doc), 2023).orElseThrow();

        assertEquals(1000.0, row.get(Metric.REVENUE), 1e-9);
        assertEquals(-50.0, row.get(Metric.NET_INCOME), 1e-9);
        assertEquals(-0.05, row.get(Metric.NET_MARGIN), 1e-12);
    }

    @Test
    void marginsShouldRequirePositiveRevenue() {
        MetricRecord row = extractor.extractYear(FactNodes.of(Map.of("Revenues", 0, "NetIncomeLoss", -10)), 2023)
                .orElseThrow();

        assertEquals(0.0, row.get(Metric.REVENUE), 1e-12);
        assertNull(row.get(Metric.NET_MARGIN));
        assertNull(row.get(Metric.GROSS_MARGIN));
    }

    @Test
    void extractYearShouldRejectOutOfRangeYearsAndNonMappingDocuments() {
        Outcome<MetricRecord> early = extractor.extractYear(FactNodes.of(Map.of()), 1899);
        Outcome<MetricRecord> late = extractor.extractYear(FactNodes.of(Map.of()), 2101);
        Outcome<MetricRecord> list = extractor.extractYear(FactNodes.of(List.of(1, 2)), 2023);

        assertFalse(early.success);
        assertEquals(CauseCode.FISCAL_YEAR_OUT_OF_RANGE, early.causeCode);
        assertEquals(CauseCode.FISCAL_YEAR_OUT_OF_RANGE, late.causeCode);
        assertEquals(CauseCode.DOCUMENT_NOT_MAPPING, list.causeCode);
        assertTrue(FactNodes.of(List.of(1, 2)) instanceof ListNode);
    }

    @Test
    void emptyDocumentShouldGiveRowWithNoMetrics() {
        MetricRecord row = extractor.extractYear(FactNodes.of(Map.of()), 2023).orElseThrow();

        assertTrue(row.values().isEmpty());
    }
}
