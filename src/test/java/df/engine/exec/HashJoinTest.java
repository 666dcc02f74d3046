package df.engine.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import df.engine.catalog.TableSchema;
import df.engine.storage.Row;
import df.engine.storage.Value;

public class HashJoinTest {

    private static final List<Row> STUDENTS = List.of(
        Row.of("id", 1, "name", "Alice"),
        Row.of("id", 2, "name", "Bob"),
        Row.of("id", 3, "name", "Eve"));
    private static final TableSchema STUDENTS_SCHEMA = TableSchema.of("id", "name");

    // duplicate student_id=1 to exercise first-match-only
    private static final List<Row> ENROLLMENTS = List.of(
        Row.of("student_id", 1, "course", "Math"),
        Row.of("student_id", 1, "course", "Physics"),
        Row.of("student_id", 3, "course", "Art"),
        Row.of("student_id", 9, "course", "History"));
    private static final TableSchema ENROLLMENTS_SCHEMA = TableSchema.of("student_id", "course");

    @Test
    void indexKeepsFirstRowPerKey() {
        Map<Value, Row> index = HashJoin.buildIndex(ENROLLMENTS, "student_id");
        assertEquals(3, index.size());
        assertEquals(Value.of("Math"), index.get(Value.of(1)).get("course"));
    }

    @Test
    void leftJoinProducesOneRowPerAnchorRow() {
        HashJoin join = new HashJoin(HashJoin.Type.LEFT, "id", "student_id");
        List<Row> out = join.execute(STUDENTS, STUDENTS_SCHEMA, ENROLLMENTS, ENROLLMENTS_SCHEMA);
        assertEquals(List.of(
            Row.of("id", 1, "name", "Alice", "course", "Math"),
            Row.of("id", 2, "name", "Bob", "course", null),
            Row.of("id", 3, "name", "Eve", "course", "Art")), out);
        assertEquals(List.of("id", "name", "course"), out.get(1).keys());
    }

    @Test
    void rightJoinProducesOneRowPerOtherRow() {
        HashJoin join = new HashJoin(HashJoin.Type.RIGHT, "id", "student_id");
        List<Row> out = join.execute(STUDENTS, STUDENTS_SCHEMA, ENROLLMENTS, ENROLLMENTS_SCHEMA);
        assertEquals(4, out.size());
        assertEquals(Row.of("name", "Alice", "student_id", 1, "course", "Physics"), out.get(1));
        assertEquals(Row.of("name", null, "student_id", 9, "course", "History"), out.get(3));
        assertEquals(List.of("name", "course", "student_id"), out.get(3).keys());
        assertEquals(List.of("name", "course", "student_id"), out.get(1).keys());
    }

    @Test
    void matchedFieldsOverrideAnchorFields() {
        List<Row> left = List.of(Row.of("id", 1, "label", "left"), Row.of("id", 2, "label", "left"));
        List<Row> right = List.of(Row.of("ref", 1, "label", "right"));
        HashJoin join = new HashJoin(HashJoin.Type.LEFT, "id", "ref");
        List<Row> out = join.execute(left, TableSchema.of("id", "label"), right, TableSchema.of("ref", "label"));
        assertEquals(Value.of("right"), out.get(0).get("label"));
        assertEquals(Value.NULL, out.get(1).get("label"));
    }

    @Test
    void emptyOtherSideAddsNullColumnsFromSchema() {
        HashJoin join = new HashJoin(HashJoin.Type.LEFT, "id", "student_id");
        List<Row> out = join.execute(STUDENTS, STUDENTS_SCHEMA, List.of(), ENROLLMENTS_SCHEMA);
        for (Row r : out) assertEquals(Value.NULL, r.get("course"));
        assertFalse(out.get(0).has("student_id"));
    }

    @Test
    void nullKeysMatchEachOther() {
        List<Row> left = List.of(Row.of("k", null, "a", 1));
        List<Row> right = List.of(Row.of("k", null, "b", 2));
        List<Row> out = new HashJoin(HashJoin.Type.LEFT, "k", "k")
            .execute(left, TableSchema.of("k", "a"), right, TableSchema.of("k", "b"));
        assertEquals(Value.of(2), out.get(0).get("b"));
    }
}
