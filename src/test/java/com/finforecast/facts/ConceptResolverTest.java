package com.finforecast.facts;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.finforecast.facts.Facts.aliases;
import static com.finforecast.facts.Facts.annual;
import static com.finforecast.facts.Facts.list;
import static com.finforecast.facts.Facts.map;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConceptResolverTest {
    private final ConceptResolver resolver = new ConceptResolver();

    @Test
    void resolveShouldMatchNamespacePrefixedTags() {
        MappingNode doc = map("StatementsOfIncome", map("us-gaap:Revenues", list(annual(500, 2023))));

        Double value = resolver.resolve(doc, aliases("Revenues"), 2023, List.of("StatementsOfIncome"));

        assertEquals(500.0, value, 1e-9);
    }

    @Test
    void matchesAliasShouldRequireWholeTagAfterNamespace() {
        assertTrue(ConceptResolver.matchesAlias("Revenues", "Revenues"));
        assertTrue(ConceptResolver.matchesAlias("us-gaap:Revenues", "Revenues"));
        assertFalse(ConceptResolver.matchesAlias("us-gaap:OtherRevenues", "Revenues"));
        assertFalse(ConceptResolver.matchesAlias("RevenuesNet", "Revenues"));
    }

    @Test
    void resolveShouldPreferPrioritySectionOverEarlierFallbackSection() {
        MappingNode doc = map(
                "StatementsOfOperationsSupplement", map("Revenues", list(annual(1, 2023))),
                "StatementsOfIncome", map("Revenues", list(annual(2, 2023)))
        );

        assertEquals(2.0, resolver.resolve(doc, aliases("Revenues"), 2023, List.of("StatementsOfIncome")), 1e-9);
    }

    @Test
    void resolveShouldTryAliasesInPriorityOrderWithinSection() {
        MappingNode doc = map("StatementsOfIncome", map(
                "SalesRevenueNet", list(annual(10, 2023)),
                "Revenues", list(annual(20, 2023))
        ));

        Double value = resolver.resolve(doc, aliases("Revenues", "SalesRevenueNet"), 2023, List.of("StatementsOfIncome"));

        assertEquals(20.0, value, 1e-9);
    }

    @Test
    void resolveShouldFallBackToPrefixedSectionsInDocumentOrder() {
        MappingNode doc = map(
                "Notes", map("Revenues", list(annual(99, 2023))),
                "RevenueTables", map("Revenues", list(annual(7, 2023))),
                "StatementsOfOperations", map("Revenues", list(annual(8, 2023)))
        );

        assertEquals(7.0, resolver.resolve(doc, aliases("Revenues"), 2023, List.of("StatementsOfIncome")), 1e-9);
    }

    @Test
    void resolveShouldSearchNestedMappingsAndLists() {
        MappingNode doc = map("StatementsOfCashFlows", map(
                "Details", list(
                        map("Other", 1),
                        map("Group", map("us-gaap:NetCashProvidedByUsedInOperatingActivities", list(annual(333, 2023))))
                )
        ));

        Double value = resolver.resolve(doc, aliases("NetCashProvidedByUsedInOperatingActivities"), 2023,
                List.of("StatementsOfCashFlows"));

        assertEquals(333.0, value, 1e-9);
    }

    @Test
    void resolveShouldKeepSearchingWhenMatchedMappingHasNoValueForYear() {
        MappingNode doc = map("StatementsOfIncome", map(
                "Revenues", map("Revenues", list(annual(41, 2023))),
                "Later", map("Revenues", list(annual(42, 2022)))
        ));

        assertEquals(41.0, resolver.resolve(doc, aliases("Revenues"), 2023, List.of("StatementsOfIncome")), 1e-9);
    }

    @Test
    void resolveShouldReturnNullWhenNothingMatches() {
        MappingNode doc = map(
                "StatementsOfIncome", map("Revenues", list(annual(1, 2022))),
                "Notes", map("NetIncomeLoss", list(annual(5, 2023)))
        );

        assertNull(resolver.resolve(doc, aliases("Revenues"), 2023, List.of("StatementsOfIncome")));
        assertNull(resolver.resolve(doc, aliases("NetIncomeLoss"), 2023, List.of("StatementsOfIncome")));
    }

    @Test
    void resolveTopLevelShouldRunPeriodSelectionOnTaggedSeries() {
        MappingNode doc = map(
                "us-gaap:Revenues", list(annual(3, 2022), annual(4, 2023)),
                "dei:EntityRegistrantName", "Example Corp"
        );

        assertEquals(4.0, resolver.resolveTopLevel(doc, aliases("Revenue", "Revenues"), 2023), 1e-9);
        assertNull(resolver.resolveTopLevel(doc, aliases("NetIncomeLoss"), 2023));
    }

    @Test
    void resolveShouldTakeBareScalarUnderMatchedTag() {
        MappingNode doc = map("StatementsOfIncome", map("Revenues", 1234));

        assertEquals(1234.0, resolver.resolve(doc, aliases("Revenues"), 2023, List.of("StatementsOfIncome")), 1e-9);
    }

    @Test
    void resolveShouldNormalizeUndatedScaledRecord() {
        MappingNode doc = map("StatementsOfIncome", map("Revenues", map("value", "1234", "decimals", "-2")));

        assertEquals(12.34, resolver.resolve(doc, aliases("Revenues"), 2023, List.of("StatementsOfIncome")), 1e-9);
    }

    @Test
    void datedSingleRecordShouldStillBeFilteredByYear() {
        MappingNode doc = map("StatementsOfIncome", map("Revenues", annual(77, 2022)));

        assertNull(resolver.resolve(doc, aliases("Revenues"), 2023, List.of("StatementsOfIncome")));
        assertEquals(77.0, resolver.resolve(doc, aliases("Revenues"), 2022, List.of("StatementsOfIncome")), 1e-9);
    }

    @Test
    void matchedTagHoldingPlainMappingShouldBeSearchedFurther() {
        MappingNode doc = map("StatementsOfIncome", map("Revenues", map("Revenues", "5,000")));

        assertEquals(5000.0, resolver.resolve(doc, aliases("Revenues"), 2023, List.of("StatementsOfIncome")), 1e-9);
    }

    @Test
    void unparseableScalarShouldNotStopSearch() {
        MappingNode doc = map("StatementsOfIncome", map(
                "Revenues", "n/a",
                "Details", map("us-gaap:Revenues", list(annual(9, 2023)))
        ));

        assertEquals(9.0, resolver.resolve(doc, aliases("Revenues"), 2023, List.of("StatementsOfIncome")), 1e-9);
    }
}
