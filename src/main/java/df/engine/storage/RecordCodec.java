package df.engine.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Converts rows to and from a JSON array of flat objects, keeping key order.
 * Nested arrays and objects are not cells and are rejected.
 */
public final class RecordCodec {
    private static final Gson COMPACT = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
    private static final Gson PRETTY = new GsonBuilder().serializeNulls().disableHtmlEscaping().setPrettyPrinting().create();

    private RecordCodec() {}

    public static List<Row> decode(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed JSON records: " + e.getMessage(), e);
        }
        if (!root.isJsonArray()) {
            throw new IllegalArgumentException("Expected a JSON array of objects");
        }
        JsonArray array = root.getAsJsonArray();
        List<Row> rows = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonElement el = array.get(i);
            if (!el.isJsonObject()) {
                throw new IllegalArgumentException("Element " + i + " is not a JSON object");
            }
            Row.Builder b = Row.builder();
            for (Map.Entry<String, JsonElement> e : el.getAsJsonObject().entrySet()) {
                b.put(e.getKey(), toValue(e.getValue(), i, e.getKey()));
            }
            rows.add(b.build());
        }
        return rows;
    }

    public static String encode(List<Row> rows) {
        return encode(rows, false);
    }

    /**
     * UNDEFINED cells are left out of their object; NaN and infinities are written as null.
     */
    public static String encode(List<Row> rows, boolean pretty) {
        JsonArray array = new JsonArray();
        for (Row r : rows) {
            JsonObject obj = new JsonObject();
            for (Map.Entry<String, Value> e : r.asMap().entrySet()) {
                Value v = e.getValue();
                if (v.isUndefined()) continue;
                obj.add(e.getKey(), toJson(v));
            }
            array.add(obj);
        }
        return (pretty ? PRETTY : COMPACT).toJson(array);
    }

    private static Value toValue(JsonElement el, int index, String key) {
        if (el.isJsonNull()) return Value.NULL;
        if (el.isJsonPrimitive()) {
            JsonPrimitive p = el.getAsJsonPrimitive();
            if (p.isBoolean()) return Value.of(p.getAsBoolean());
            if (p.isNumber()) return Value.of(p.getAsDouble());
            return Value.of(p.getAsString());
        }
        throw new IllegalArgumentException("Element " + index + " has a nested value for '" + key + "'");
    }

    private static JsonElement toJson(Value v) {
        return switch (v.type()) {
            case NUMBER -> {
                double d = v.asDouble();
                if (!Double.isFinite(d)) yield JsonNull.INSTANCE;
                if (d == Math.rint(d) && Math.abs(d) < 1e15) yield new JsonPrimitive((long) d);
                yield new JsonPrimitive(d);
            }
            case TEXT -> new JsonPrimitive(v.asText());
            case BOOLEAN -> new JsonPrimitive(v.asBoolean());
            case NULL, UNDEFINED -> JsonNull.INSTANCE;
        };
    }
}
