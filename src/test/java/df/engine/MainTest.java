package df.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

public class MainTest {
    @Test
    void demoRunsAndReportsSelectionError() {
        PrintStream original = System.out;
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buf, true, StandardCharsets.UTF_8));
        try {
            Main.main(new String[] { "--head=2" });
        } finally {
            System.setOut(original);
        }
        String out = buf.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("median: 3"));
        assertTrue(out.contains("shape:   [2, 3]"));
        assertTrue(out.contains("| 2  | Bob   | null |"));
        assertTrue(out.contains("Error: Cannot select rows from an empty DataFrame"));
    }
}
