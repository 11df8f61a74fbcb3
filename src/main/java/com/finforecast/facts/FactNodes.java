package com.finforecast.facts;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds fact trees from JSON text or from plain Java maps and lists.
 * <p>
 * {@link JSONObject} does not keep key order, and the resolver's section fallback and the period
 * tie-break both depend on document order, so objects and arrays are read directly off a
 * {@link JSONTokener}; only scalars are delegated to it.
 */
public final class FactNodes {

    private FactNodes() {
    }

    public static FactNode parse(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new JSONException("empty fact document");
        }
        JSONTokener tokener = new JSONTokener(json);
        FactNode root = read(tokener);
        if (tokener.nextClean() != 0) {
            throw tokener.syntaxError("Unexpected trailing content");
        }
        return root;
    }

    public static FactNode of(Object raw) {
        if (raw == null || raw == JSONObject.NULL) {
            return ScalarNode.of(null);
        }
        if (raw instanceof FactNode) {
            return (FactNode) raw;
        }
        if (raw instanceof JSONObject) {
            return of(((JSONObject) raw).toMap());
        }
        if (raw instanceof JSONArray) {
            return of(((JSONArray) raw).toList());
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, FactNode> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (e.getKey() == null) {
                    continue;
                }
                entries.put(e.getKey().toString(), of(e.getValue()));
            }
            return new MappingNode(entries);
        }
        if (raw instanceof List<?> list) {
            List<FactNode> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(of(item));
            }
            return new ListNode(items);
        }
        return ScalarNode.of(raw);
    }

    private static FactNode read(JSONTokener t) {
        char c = t.nextClean();
        switch (c) {
            case '{':
                return readObject(t);
            case '[':
                return readArray(t);
            case 0:
                throw t.syntaxError("Unexpected end of document");
            default:
                t.back();
                Object scalar = t.nextValue();
                return ScalarNode.of(scalar == JSONObject.NULL ? null : scalar);
        }
    }

    private static MappingNode readObject(JSONTokener t) {
        Map<String, FactNode> entries = new LinkedHashMap<>();
        char c = t.nextClean();
        if (c == '}') {
            return new MappingNode(entries);
        }
        t.back();
        while (true) {
            c = t.nextClean();
            if (c != '"' && c != '\'') {
                throw t.syntaxError("Expected a quoted key");
            }
            String key = t.nextString(c);
            if (t.nextClean() != ':') {
                throw t.syntaxError("Expected ':' after key " + key);
            }
            entries.put(key, read(t));
            c = t.nextClean();
            if (c == '}') {
                return new MappingNode(entries);
            }
            if (c != ',') {
                throw t.syntaxError("Expected ',' or '}'");
            }
        }
    }

    private static ListNode readArray(JSONTokener t) {
        List<FactNode> items = new ArrayList<>();
        char c = t.nextClean();
        if (c == ']') {
            return new ListNode(items);
        }
        t.back();
        while (true) {
            items.add(read(t));
            c = t.nextClean();
            if (c == ']') {
                return new ListNode(items);
            }
            if (c != ',') {
                throw t.syntaxError("Expected ',' or ']'");
            }
        }
    }
}
