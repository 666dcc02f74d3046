package df.engine.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class RecordCodecTest {
    @Test
    void decodesFlatObjectsInOrder() {
        List<Row> rows = RecordCodec.decode("[{\"id\":1,\"name\":\"Alice\",\"active\":true,\"age\":null}]");
        assertEquals(1, rows.size());
        Row r = rows.get(0);
        assertEquals(List.of("id", "name", "active", "age"), r.keys());
        assertEquals(Value.of(1), r.get("id"));
        assertEquals(Value.of("Alice"), r.get("name"));
        assertEquals(Value.TRUE, r.get("active"));
        assertEquals(Value.NULL, r.get("age"));
    }

    @Test
    void encodesIntegralNumbersWithoutFraction() {
        String json = RecordCodec.encode(List.of(Row.of("id", 1, "score", 2.5, "age", null)));
        assertEquals("[{\"id\":1,\"score\":2.5,\"age\":null}]", json);
    }

    @Test
    void undefinedCellsAreLeftOutAndNanBecomesNull() {
        String json = RecordCodec.encode(List.of(Row.of("a", Value.UNDEFINED, "b", Double.NaN)));
        assertEquals("[{\"b\":null}]", json);
    }

    @Test
    void rejectsNonArraysAndNestedValues() {
        assertThrows(IllegalArgumentException.class, () -> RecordCodec.decode("{\"a\":1}"));
        assertThrows(IllegalArgumentException.class, () -> RecordCodec.decode("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> RecordCodec.decode("[{\"a\":[1]}]"));
        assertThrows(IllegalArgumentException.class, () -> RecordCodec.decode("[{\"a\":"));
    }

    @Test
    void emptyArrayDecodesToNoRows() {
        assertTrue(RecordCodec.decode("[]").isEmpty());
        assertEquals("[]", RecordCodec.encode(List.of()));
    }
}
