package com.finforecast.metrics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Rows ordered by fiscal year, one row per year. Immutable; {@link #append} returns a new table.
 */
public final class MetricsTable {
    private static final MetricsTable EMPTY = new MetricsTable(List.of());

    private final List<MetricRecord> rows;

    private MetricsTable(List<MetricRecord> rows) {
        this.rows = rows;
    }

    public static MetricsTable empty() {
        return EMPTY;
    }

    public static MetricsTable of(Collection<MetricRecord> records) {
        if (records == null || records.isEmpty()) {
            return EMPTY;
        }
        List<MetricRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparingInt(r -> r.fiscalYear));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).fiscalYear == sorted.get(i - 1).fiscalYear) {
                throw new IllegalArgumentException("duplicate fiscal year " + sorted.get(i).fiscalYear);
            }
        }
        return new MetricsTable(Collections.unmodifiableList(sorted));
    }

    public MetricsTable append(MetricRecord record) {
        MetricRecord last = lastRow();
        if (last != null && record.fiscalYear <= last.fiscalYear) {
            throw new IllegalArgumentException(
                    "year " + record.fiscalYear + " does not follow last year " + last.fiscalYear);
        }
        List<MetricRecord> next = new ArrayList<>(rows.size() + 1);
        next.addAll(rows);
        next.add(record);
        return new MetricsTable(Collections.unmodifiableList(next));
    }

    public MetricsTable concat(MetricsTable other) {
        MetricsTable out = this;
        for (MetricRecord record : other.rows) {
            out = out.append(record);
        }
        return out;
    }

    public List<MetricRecord> rows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    public MetricRecord lastRow() {
        return rows.isEmpty() ? null : rows.get(rows.size() - 1);
    }

    public MetricRecord row(int fiscalYear) {
        for (MetricRecord record : rows) {
            if (record.fiscalYear == fiscalYear) {
                return record;
            }
        }
        return null;
    }

    public List<Integer> years() {
        List<Integer> out = new ArrayList<>(rows.size());
        for (MetricRecord record : rows) {
            out.add(record.fiscalYear);
        }
        return out;
    }

    /**
     * Values of one metric in year order; missing values stay {@code null}.
     */
    public List<Double> column(Metric metric) {
        List<Double> out = new ArrayList<>(rows.size());
        for (MetricRecord record : rows) {
            out.add(record.get(metric));
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetricsTable)) {
            return false;
        }
        return rows.equals(((MetricsTable) o).rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return "MetricsTable" + years();
    }
}
