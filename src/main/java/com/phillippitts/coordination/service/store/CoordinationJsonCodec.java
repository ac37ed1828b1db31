package com.phillippitts.coordination.service.store;

import com.phillippitts.coordination.domain.CoordinationEvent;
import com.phillippitts.coordination.domain.CoordinationEventType;
import com.phillippitts.coordination.domain.Insight;
import com.phillippitts.coordination.domain.InsightCategory;
import com.phillippitts.coordination.domain.Pattern;
import com.phillippitts.coordination.domain.PatternKey;
import com.phillippitts.coordination.domain.PatternType;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converts the engine collections to and from their flat, versionless JSON documents.
 *
 * <p>Timestamps are ISO-8601 strings; optional fields are omitted when absent. Parsing throws
 * {@link JSONException}, {@link IllegalArgumentException} or {@link java.time.DateTimeException}
 * on malformed input; callers decide how to recover.
 */
public final class CoordinationJsonCodec {

    private static final int INDENT = 2;

    private CoordinationJsonCodec() {}

    public static String eventsToJson(List<CoordinationEvent> events) {
        JSONArray arr = new JSONArray();
        for (CoordinationEvent e : events) {
            JSONObject obj = new JSONObject();
            obj.put("event_id", e.id());
            obj.put("event_type", e.type().wireValue());
            obj.put("timestamp", e.timestamp().toString());
            obj.put("item_count", e.itemCount());
            obj.put("domains", new JSONArray(e.domains()));
            obj.put("strategy", e.strategy());
            obj.put("duration", e.durationSeconds());
            obj.put("success", e.success());
            if (e.itemKinds() != null) {
                obj.put("item_kinds", new JSONArray(e.itemKinds()));
            }
            obj.put("error_message", e.errorMessage());
            arr.put(obj);
        }
        return arr.toString(INDENT);
    }

    public static List<CoordinationEvent> eventsFromJson(String json) {
        JSONArray arr = new JSONArray(json);
        List<CoordinationEvent> events = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONObject obj = arr.getJSONObject(i);
            events.add(new CoordinationEvent(
                    obj.getString("event_id"),
                    CoordinationEventType.fromWireValue(obj.getString("event_type")),
                    Instant.parse(obj.getString("timestamp")),
                    obj.getInt("item_count"),
                    strings(obj.getJSONArray("domains")),
                    obj.getString("strategy"),
                    optDouble(obj, "duration"),
                    optBoolean(obj, "success"),
                    obj.isNull("item_kinds") ? null : strings(obj.getJSONArray("item_kinds")),
                    obj.isNull("error_message") ? null : obj.getString("error_message")
            ));
        }
        return events;
    }

    public static String patternsToJson(Map<String, Pattern> patterns) {
        JSONObject root = new JSONObject();
        for (Pattern p : patterns.values()) {
            JSONObject obj = new JSONObject();
            obj.put("pattern_id", p.id());
            obj.put("pattern_type", p.type().wireValue());
            obj.put("domains", new JSONArray(p.domains()));
            obj.put("item_count", p.itemCount());
            obj.put("strategy", p.strategy());
            obj.put("success_rate", p.successRate());
            obj.put("avg_duration", p.avgDuration());
            obj.put("usage_count", p.usageCount());
            obj.put("last_used", p.lastUsed().toString());
            obj.put("confidence_score", p.confidence());
            root.put(p.id(), obj);
        }
        return root.toString(INDENT);
    }

    /**
     * Parses the pattern map. Keys are rebuilt from each pattern's fields and returned in key order.
     */
    public static Map<String, Pattern> patternsFromJson(String json) {
        JSONObject root = new JSONObject(json);
        Map<String, Pattern> sorted = new TreeMap<>();
        for (String name : root.keySet()) {
            JSONObject obj = root.getJSONObject(name);
            PatternKey key = new PatternKey(
                    strings(obj.getJSONArray("domains")),
                    obj.getInt("item_count"),
                    obj.getString("strategy"));
            Pattern pattern = new Pattern(
                    key,
                    obj.isNull("pattern_type") ? null : PatternType.fromWireValue(obj.getString("pattern_type")),
                    obj.getDouble("success_rate"),
                    obj.getDouble("avg_duration"),
                    obj.getInt("usage_count"),
                    Instant.parse(obj.getString("last_used")),
                    obj.getDouble("confidence_score"));
            sorted.put(key.canonical(), pattern);
        }
        return new LinkedHashMap<>(sorted);
    }

    public static String insightsToJson(List<Insight> insights) {
        JSONArray arr = new JSONArray();
        for (Insight i : insights) {
            JSONObject obj = new JSONObject();
            obj.put("insight_id", i.id());
            obj.put("category", i.category().wireValue());
            obj.put("description", i.description());
            obj.put("recommendation", i.recommendation());
            obj.put("impact_score", i.impactScore());
            obj.put("confidence", i.confidence());
            obj.put("created_at", i.createdAt().toString());
            obj.put("applies_to", new JSONArray(i.appliesTo()));
            arr.put(obj);
        }
        return arr.toString(INDENT);
    }

    public static List<Insight> insightsFromJson(String json) {
        JSONArray arr = new JSONArray(json);
        List<Insight> insights = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            JSONObject obj = arr.getJSONObject(i);
            insights.add(new Insight(
                    obj.getString("insight_id"),
                    InsightCategory.fromWireValue(obj.getString("category")),
                    obj.optString("description", ""),
                    obj.optString("recommendation", ""),
                    obj.getDouble("impact_score"),
                    obj.getDouble("confidence"),
                    Instant.parse(obj.getString("created_at")),
                    strings(obj.getJSONArray("applies_to"))
            ));
        }
        return insights;
    }

    private static List<String> strings(JSONArray arr) {
        List<String> out = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            out.add(arr.getString(i));
        }
        return out;
    }

    private static Double optDouble(JSONObject obj, String key) {
        return obj.isNull(key) ? null : obj.getDouble(key);
    }

    private static Boolean optBoolean(JSONObject obj, String key) {
        return obj.isNull(key) ? null : obj.getBoolean(key);
    }
}
