package com.finforecast.facts;

import org.json.JSONException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FactNodesTest {

    @Test
    void parseShouldKeepDocumentKeyOrder() {
        MappingNode doc = (MappingNode) FactNodes.parse("{\"zeta\":1,\"alpha\":2,\"StatementsOfIncome\":{},\"mid\":[1,2]}");

        assertEquals(List.of("zeta", "alpha", "StatementsOfIncome", "mid"), List.copyOf(doc.keys()));
    }

    @Test
    void parseShouldMapJsonNullToNullScalar() {
        MappingNode doc = (MappingNode) FactNodes.parse("{\"a\":null,\"b\":[null,\"x\"]}");

        assertNull(((ScalarNode) doc.get("a")).value);
        ListNode list = (ListNode) doc.get("b");
        assertEquals(2, list.size());
        assertNull(((ScalarNode) list.items.get(0)).value);
        assertEquals("x", ((ScalarNode) list.items.get(1)).value);
    }

    @Test
    void parseShouldReadNestedRecords() {
        FactNode root = FactNodes.parse(
                "{\"S\":{\"us-gaap:Revenues\":[{\"value\":\"100\",\"decimals\":\"-3\",\"period\":{\"startDate\":\"2023-01-01\",\"endDate\":\"2023-12-31\"}}]}}");

        MappingNode section = (MappingNode) ((MappingNode) root).get("S");
        ListNode records = (ListNode) section.get("us-gaap:Revenues");
        MappingNode record = (MappingNode) records.items.get(0);
        assertEquals("-3", record.text("decimals"));
        assertTrue(record.isContainer());
        assertInstanceOf(MappingNode.class, record.get("period"));
    }

    @Test
    void parseShouldRejectEmptyAndTrailingContent() {
        assertThrows(JSONException.class, () -> FactNodes.parse("   "));
        assertThrows(JSONException.class, () -> FactNodes.parse("{\"a\":1} extra"));
        assertThrows(JSONException.class, () -> FactNodes.parse("{\"a\" 1}"));
    }
}
