package com.finforecast.data.sec;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Converts an SEC company-facts payload into a per-year fact document: each {@code us-gaap} concept
 * becomes a top-level {@code us-gaap:Concept} key holding the 10-K records filed for that fiscal
 * year, with their periods and filing dates.
 */
public final class CompanyFactsConverter {
    public static final String TAXONOMY = "us-gaap";
    public static final String ANNUAL_FORM = "10-K";

    public JSONObject toFactDocument(JSONObject companyFacts, int fiscalYear) {
        JSONObject out = new JSONObject();
        JSONObject gaap = gaapFacts(companyFacts);
        for (String concept : gaap.keySet()) {
            JSONObject units = unitsOf(gaap, concept);
            JSONArray records = new JSONArray();
            for (String unit : units.keySet()) {
                JSONArray entries = units.optJSONArray(unit);
                for (int i = 0; entries != null && i < entries.length(); i++) {
                    JSONObject entry = entries.optJSONObject(i);
                    if (isAnnual(entry) && entry.optInt("fy", Integer.MIN_VALUE) == fiscalYear && entry.has("val")) {
                        records.put(toRecord(entry, unit));
                    }
                }
            }
            if (!records.isEmpty()) {
                out.put(TAXONOMY + ":" + concept, records);
            }
        }
        return out;
    }

    /**
     * Fiscal years that have at least one 10-K fact in the payload, ascending.
     */
    public List<Integer> availableYears(JSONObject companyFacts) {
        TreeSet<Integer> years = new TreeSet<>();
        JSONObject gaap = gaapFacts(companyFacts);
        for (String concept : gaap.keySet()) {
            JSONObject units = unitsOf(gaap, concept);
            for (String unit : units.keySet()) {
                JSONArray entries = units.optJSONArray(unit);
                for (int i = 0; entries != null && i < entries.length(); i++) {
                    JSONObject entry = entries.optJSONObject(i);
                    if (isAnnual(entry) && entry.has("fy")) {
                        years.add(entry.optInt("fy"));
                    }
                }
            }
        }
        return new ArrayList<>(years);
    }

    private static JSONObject gaapFacts(JSONObject companyFacts) {
        JSONObject facts = companyFacts == null ? null : companyFacts.optJSONObject("facts");
        JSONObject gaap = facts == null ? null : facts.optJSONObject(TAXONOMY);
        return gaap == null ? new JSONObject() : gaap;
    }

    private static JSONObject unitsOf(JSONObject gaap, String concept) {
        JSONObject conceptData = gaap.optJSONObject(concept);
        JSONObject units = conceptData == null ? null : conceptData.optJSONObject("units");
        return units == null ? new JSONObject() : units;
    }

    private static boolean isAnnual(JSONObject entry) {
        return entry != null && ANNUAL_FORM.equals(entry.optString("form"));
    }

    private static JSONObject toRecord(JSONObject entry, String unit) {
        JSONObject record = new JSONObject();
        record.put("val", entry.get("val"));
        for (String key : new String[]{"start", "end", "filed"}) {
            if (entry.has(key)) {
                record.put(key, entry.getString(key));
            }
        }
        record.put("unit", unit);
        return record;
    }
}
