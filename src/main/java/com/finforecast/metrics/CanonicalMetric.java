package com.finforecast.metrics;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reported line items with the tag aliases they are filed under, in priority order, and the
 * statement sections searched before any other.
 */
public enum CanonicalMetric {
    REVENUE(Metric.REVENUE,
            List.of(
                    "Revenue",
                    "Revenues",
                    "SalesRevenueNet",
                    "SalesRevenueGoodsNet",
                    "NetSales",
                    "RevenueFromContractWithCustomerExcludingAssessedTax",
                    "TotalRevenuesAndOtherIncome",
                    "RevenueFromContractWithCustomerIncludingAssessedTax"
            ),
            List.of("StatementsOfIncome", "Revenue", "RevenueTables")),
    COGS(Metric.COGS,
            List.of(
                    "CostOfGoodsSold",
                    "CostOfSales",
                    "CostOfGoodsAndServicesSold",
                    "CostOfRevenue",
                    "CostsAndExpenses",
                    "CostOfGoodsAndServicesSoldExcludingDepreciationDepletionAndAmortization"
            ),
            List.of("StatementsOfIncome")),
    RD_EXPENSE(Metric.RD_EXPENSE,
            List.of(
                    "ResearchAndDevelopmentExpense",
                    "ResearchAndDevelopmentExpenseExcludingAcquiredInProcess",
                    "ResearchDevelopmentAndRelatedExpenses"
            ),
            List.of("StatementsOfIncome")),
    SGA_EXPENSE(Metric.SGA_EXPENSE,
            List.of(
                    "SellingGeneralAndAdministrativeExpense",
                    "SellingAndMarketingExpense",
                    "GeneralAndAdministrativeExpense"
            ),
            List.of("StatementsOfIncome")),
    OPERATING_INCOME(Metric.OPERATING_INCOME,
            List.of("OperatingIncome", "OperatingIncomeLoss", "IncomeLossFromOperations"),
            List.of("StatementsOfIncome")),
    NET_INCOME(Metric.NET_INCOME,
            List.of("NetIncome", "NetIncomeLoss", "ProfitLoss", "NetEarnings", "NetEarningsLoss"),
            List.of("StatementsOfIncome")),
    EPS(Metric.EPS,
            List.of("EarningsPerShareDiluted", "EarningsPerShareBasicAndDiluted", "EarningsPerShareBasic"),
            List.of("StatementsOfIncome", "EarningsPerShare", "EarningsPerShareTables")),
    SHARES_DILUTED(Metric.SHARES_DILUTED,
            List.of(
                    "WeightedAverageNumberOfDilutedSharesOutstanding",
                    "WeightedAverageNumberOfSharesOutstandingDiluted",
                    "WeightedAverageSharesOutstandingDiluted"
            ),
            List.of("EarningsPerShare", "EarningsPerShareTables")),
    CFO(Metric.CFO,
            List.of("NetCashProvidedByUsedInOperatingActivities", "NetCashProvidedByOperatingActivities"),
            List.of("StatementsOfCashFlows")),
    CAPEX(Metric.CAPEX,
            List.of(
                    "PaymentsToAcquirePropertyPlantAndEquipment",
                    "PaymentsForPropertyPlantAndEquipment",
                    "CapitalExpendituresIncurredButNotYetPaid"
            ),
            List.of("StatementsOfCashFlows")),
    TOTAL_DEBT(Metric.TOTAL_DEBT,
            List.of("LongTermDebt", "DebtCurrent", "LongTermDebtNoncurrent", "DebtInstrumentCarryingAmount"),
            Sections.BALANCE_SHEET),
    CASH(Metric.CASH,
            List.of(
                    "CashAndCashEquivalentsAtCarryingValue",
                    "Cash",
                    "CashCashEquivalentsRestrictedCashAndRestrictedCashEquivalents"
            ),
            Sections.BALANCE_SHEET),
    BOOK_VALUE(Metric.BOOK_VALUE,
            List.of(
                    "StockholdersEquity",
                    "StockholdersEquityIncludingPortionAttributableToNoncontrollingInterest"
            ),
            Sections.BALANCE_SHEET);

    public final Metric metric;
    public final List<String> aliases;
    public final List<String> prioritySections;

    CanonicalMetric(Metric metric, List<String> aliases, List<String> prioritySections) {
        this.metric = metric;
        this.aliases = aliases;
        this.prioritySections = prioritySections;
    }

    /**
     * Every section name that appears in some priority list.
     */
    public static Set<String> knownSections() {
        Set<String> out = new LinkedHashSet<>(Sections.DEFAULT);
        for (CanonicalMetric metric : values()) {
            out.addAll(metric.prioritySections);
        }
        return out;
    }

    public static final class Sections {
        public static final List<String> DEFAULT = List.of("StatementsOfIncome", "StatementsOfCashFlows");
        public static final List<String> BALANCE_SHEET = List.of(
                "BalanceSheets",
                "BalanceSheet",
                "StatementsOfFinancialPosition"
        );

        private Sections() {
        }
    }
}
