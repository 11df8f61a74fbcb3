package com.finforecast.projection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters of one projection run: per-scenario inputs plus values shared by all scenarios.
 * Immutable; build with {@link #builder()}.
 */
public final class ProjectionParams {
    public static final double DEFAULT_DISCOUNT_RATE = 0.10;
    public static final double DEFAULT_TERMINAL_GROWTH = 0.025;
    public static final double DEFAULT_DILUTION = 0.01;
    public static final int DEFAULT_YEARS = 5;

    public final Map<Scenario, ScenarioInputs> scenarios;
    public final double discountRate;
    public final double terminalGrowth;
    public final double shareDilution;
    public final Integer startYear;
    public final int years;

    private ProjectionParams(Builder b) {
        EnumMap<Scenario, ScenarioInputs> copy = new EnumMap<>(Scenario.class);
        for (Scenario scenario : Scenario.values()) {
            ScenarioInputs inputs = b.scenarios.get(scenario);
            copy.put(scenario, inputs == null ? ScenarioInputs.defaults(scenario) : inputs);
        }
        this.scenarios = Collections.unmodifiableMap(copy);
        this.discountRate = b.discountRate;
        this.terminalGrowth = b.terminalGrowth;
        this.shareDilution = b.shareDilution;
        this.startYear = b.startYear;
        this.years = b.years;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ProjectionParams defaults() {
        return builder().build();
    }

    public ScenarioInputs inputs(Scenario scenario) {
        return scenarios.get(scenario);
    }

    /**
     * Problems that make these parameters unusable for projection; empty when valid.
     */
    public List<String> problems() {
        List<String> out = new ArrayList<>();
        if (years < 0) {
            out.add("years must be >= 0, got " + years);
        }
        if (!Double.isFinite(shareDilution) || shareDilution <= -1.0) {
            out.add("share dilution must be > -1, got " + shareDilution);
        }
        for (Map.Entry<Scenario, ScenarioInputs> e : scenarios.entrySet()) {
            ScenarioInputs in = e.getValue();
            String key = e.getKey().key;
            if (!Double.isFinite(in.revenueGrowth) || in.revenueGrowth <= -1.0) {
                out.add(key + ": revenue growth must be > -1, got " + in.revenueGrowth);
            }
            if (!Double.isFinite(in.capexPct) || in.capexPct < 0.0) {
                out.add(key + ": capex ratio must be >= 0, got " + in.capexPct);
            }
            if (!Double.isFinite(in.peMultiple) || in.peMultiple < 0.0) {
                out.add(key + ": P/E multiple must be >= 0, got " + in.peMultiple);
            }
            if (in.targetNetMargin != null && (in.targetNetMargin <= -1.0 || in.targetNetMargin >= 1.0)) {
                out.add(key + ": target net margin must be in (-1, 1), got " + in.targetNetMargin);
            }
            if (in.yearsToProfitability != null && in.yearsToProfitability < 0) {
                out.add(key + ": years to profitability must be >= 0, got " + in.yearsToProfitability);
            }
        }
        return out;
    }

    public static final class Builder {
        private final EnumMap<Scenario, ScenarioInputs> scenarios = new EnumMap<>(Scenario.class);
        private double discountRate = DEFAULT_DISCOUNT_RATE;
        private double terminalGrowth = DEFAULT_TERMINAL_GROWTH;
        private double shareDilution = DEFAULT_DILUTION;
        private Integer startYear;
        private int years = DEFAULT_YEARS;

        private Builder() {
        }

        public Builder scenario(Scenario scenario, ScenarioInputs inputs) {
            scenarios.put(scenario, inputs);
            return this;
        }

        public Builder growth(Scenario scenario, double growth) {
            ScenarioInputs current = scenarios.get(scenario);
            scenarios.put(scenario, (current == null ? ScenarioInputs.defaults(scenario) : current).withGrowth(growth));
            return this;
        }

        public Builder discountRate(double discountRate) {
            this.discountRate = discountRate;
            return this;
        }

        public Builder terminalGrowth(double terminalGrowth) {
            this.terminalGrowth = terminalGrowth;
            return this;
        }

        public Builder shareDilution(double shareDilution) {
            this.shareDilution = shareDilution;
            return this;
        }

        public Builder startYear(Integer startYear) {
            this.startYear = startYear;
            return this;
        }

        public Builder years(int years) {
            this.years = years;
            return this;
        }

        public ProjectionParams build() {
            return new ProjectionParams(this);
        }
    }
}
