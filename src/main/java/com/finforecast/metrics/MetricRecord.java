package com.finforecast.metrics;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One fiscal year of metrics. A metric that is absent is missing, never zero.
 */
public final class MetricRecord {
    public final int fiscalYear;
    private final Map<Metric, Double> values;

    private MetricRecord(int fiscalYear, EnumMap<Metric, Double> values) {
        this.fiscalYear = fiscalYear;
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder(int fiscalYear) {
        return new Builder(fiscalYear);
    }

    public Double get(Metric metric) {
        return values.get(metric);
    }

    public boolean has(Metric metric) {
        return values.get(metric) != null;
    }

    public Map<Metric, Double> values() {
        return values;
    }

    public MetricRecord with(Metric metric, Double value) {
        return toBuilder().put(metric, value).build();
    }

    public MetricRecord withYear(int year) {
        Builder builder = builder(year);
        builder.values.putAll(values);
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = builder(fiscalYear);
        builder.values.putAll(values);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetricRecord)) {
            return false;
        }
        MetricRecord other = (MetricRecord) o;
        return fiscalYear == other.fiscalYear && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fiscalYear, values);
    }

    @Override
    public String toString() {
        return "MetricRecord{year=" + fiscalYear + ", values=" + values + "}";
    }

    public static final class Builder {
        private final int fiscalYear;
        private final EnumMap<Metric, Double> values = new EnumMap<>(Metric.class);

        private Builder(int fiscalYear) {
            this.fiscalYear = fiscalYear;
        }

        public Builder put(Metric metric, Double value) {
            if (value == null || !Double.isFinite(value)) {
                values.remove(metric);
            } else {
                values.put(metric, value);
            }
            return this;
        }

        public Double get(Metric metric) {
            return values.get(metric);
        }

        public MetricRecord build() {
            return new MetricRecord(fiscalYear, new EnumMap<>(values));
        }
    }
}
