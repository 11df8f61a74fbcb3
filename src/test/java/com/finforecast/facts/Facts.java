package com.finforecast.facts;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small builders for hand-made fact trees.
 */
public final class Facts {
    private Facts() {
    }

    public static MappingNode map(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return (MappingNode) FactNodes.of(m);
    }

    public static ListNode list(Object... items) {
        return (ListNode) FactNodes.of(new ArrayList<>(Arrays.asList(items)));
    }

    public static MappingNode duration(Object value, String start, String end, String filed) {
        Map<String, Object> period = new LinkedHashMap<>();
        period.put("startDate", start);
        period.put("endDate", end);
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("value", value);
        record.put("period", period);
        if (filed != null) {
            record.put("filed", filed);
        }
        return (MappingNode) FactNodes.of(record);
    }

    public static MappingNode annual(Object value, int year) {
        return duration(value, year + "-01-01", year + "-12-31", null);
    }

    public static MappingNode instant(Object value, String date) {
        Map<String, Object> period = new LinkedHashMap<>();
        period.put("instant", date);
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("value", value);
        record.put("period", period);
        return (MappingNode) FactNodes.of(record);
    }

    public static List<String> aliases(String... names) {
        return List.of(names);
    }
}
