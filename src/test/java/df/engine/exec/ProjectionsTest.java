package df.engine.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import df.engine.storage.Row;
import df.engine.storage.Value;

public class ProjectionsTest {
    @Test
    void pickKeepsRequestedKeysInGivenOrder() {
        Row r = Row.of("name", "Alice", "age", 30, "active", true);
        Row picked = Projections.pick(r, List.of("active", "name"));
        assertEquals(List.of("active", "name"), picked.keys());
        assertEquals(Value.TRUE, picked.get("active"));
        assertEquals(Value.of("Alice"), picked.get("name"));
    }

    @Test
    void pickOfAbsentKeyYieldsUndefined() {
        Row picked = Projections.pick(Row.of("a", 1), List.of("a", "b"));
        assertTrue(picked.has("b"));
        assertEquals(Value.UNDEFINED, picked.get("b"));
    }

    @Test
    void omitFollowsCallerSuppliedKeysNotRowKeys() {
        Row r = Row.of("a", 1, "b", 2, "extra", 3);
        Row omitted = Projections.omit(r, List.of("b", "a", "missing"), Set.of("a"));
        assertEquals(List.of("b", "missing"), omitted.keys());
        assertEquals(Value.of(2), omitted.get("b"));
        assertEquals(Value.UNDEFINED, omitted.get("missing"));
        assertFalse(omitted.has("extra"));
    }

    @Test
    void projectionsDoNotChangeSourceRow() {
        Row r = Row.of("a", 1, "b", 2);
        Projections.omit(r, r.keys(), Set.of("a"));
        Projections.pick(r, List.of("b"));
        assertEquals(List.of("a", "b"), r.keys());
    }
}
