package com.finforecast.valuation;

import com.finforecast.metrics.Metric;
import com.finforecast.metrics.MetricRecord;
import com.finforecast.metrics.MetricsTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PriceProjectorTest {

    @Test
    void positiveEpsShouldUseMultiple() {
        MetricsTable table = MetricsTable.of(List.of(
                eps(2023, 1.0),
                eps(2024, 2.0),
                eps(2025, 2.5)
        ));

        Map<Integer, Double> prices = new PriceProjector(15.0, 2023, 40.0, null, 3).project(table);

        assertEquals(40.0, prices.get(2023), 1e-9);
        assertEquals(30.0, prices.get(2024), 1e-9);
        assertEquals(37.5, prices.get(2025), 1e-9);
    }

    @Test
    void negativeEpsShouldMoveTowardTargetPrice() {
        MetricsTable table = MetricsTable.of(List.of(
                eps(2023, -1.0),
                eps(2024, -1.0),
                eps(2025, -0.5),
                eps(2026, -0.2)
        ));

        Map<Integer, Double> prices = new PriceProjector(15.0, 2023, 50.0, 20.0, 2).project(table);

        assertEquals(50.0, prices.get(2023), 1e-9);
        assertEquals(25.1, prices.get(2024), 1e-9);
        assertEquals(0.2, prices.get(2025), 1e-9);
        assertEquals(0.2, prices.get(2026), 1e-9);
    }

    @Test
    void missingEpsAndPastLossesShouldHaveNoPrice() {
        MetricsTable table = MetricsTable.of(List.of(
                eps(2022, -3.0),
                MetricRecord.builder(2023).build(),
                MetricRecord.builder(2024).build()
        ));

        Map<Integer, Double> prices = new PriceProjector(15.0, 2023, 10.0, null, 3).project(table);

        assertNull(prices.get(2022));
        assertEquals(10.0, prices.get(2023), 1e-9);
        assertNull(prices.get(2024));
    }

    private static MetricRecord eps(int year, double value) {
        return MetricRecord.builder(year).put(Metric.EPS, value).build();
    }
}
