package com.finforecast.model;

import com.finforecast.config.Config;
import com.finforecast.projection.ModelAssumptions;
import com.finforecast.projection.ProjectionParams;
import com.finforecast.projection.Scenario;
import com.finforecast.projection.ScenarioInputs;

/**
 * Maps configuration keys onto the projection and valuation inputs.
 */
public final class ForecastSettings {
    private ForecastSettings() {
    }

    public static ModelAssumptions modelAssumptions(Config config) {
        ModelAssumptions d = ModelAssumptions.defaults();
        return new ModelAssumptions(
                config.getDouble("model.tax_rate", d.taxRate),
                config.getDouble("model.depreciation_pct", d.depreciationPct),
                config.getDouble("model.working_capital_pct", d.workingCapitalPct),
                config.getDouble("model.cogs_efficiency_step", d.cogsEfficiencyStep),
                config.getDouble("model.default_cogs_ratio", d.defaultCogsRatio),
                config.getDouble("model.rd_growth_leverage", d.rdGrowthLeverage),
                config.getDouble("model.sga_growth_leverage", d.sgaGrowthLeverage)
        );
    }

    public static ProjectionParams.Builder projectionParams(Config config) {
        ProjectionParams.Builder builder = ProjectionParams.builder()
                .years(config.getInt("projection.years", ProjectionParams.DEFAULT_YEARS))
                .shareDilution(config.getDouble("projection.share_dilution", ProjectionParams.DEFAULT_DILUTION))
                .discountRate(config.getDouble("valuation.discount_rate", ProjectionParams.DEFAULT_DISCOUNT_RATE))
                .terminalGrowth(config.getDouble("valuation.terminal_growth", ProjectionParams.DEFAULT_TERMINAL_GROWTH));
        double capexPct = config.getDouble("projection.capex_pct", ScenarioInputs.DEFAULT_CAPEX_PCT);
        Double targetMargin = config.getOptionalDouble("projection.target_net_margin");
        Integer yearsToProfit = config.getOptionalInt("projection.years_to_profitability");
        for (Scenario scenario : Scenario.values()) {
            builder.scenario(scenario, new ScenarioInputs(
                    config.getDouble("projection.growth." + scenario.key, scenario.defaultGrowth),
                    capexPct,
                    config.getDouble("valuation.pe." + scenario.key, scenario.defaultPeMultiple),
                    targetMargin,
                    yearsToProfit
            ));
        }
        return builder;
    }
}
