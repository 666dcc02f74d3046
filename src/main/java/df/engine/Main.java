package df.engine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.Function;

import df.engine.cli.DemoConfig;
import df.engine.cli.TablePrinter;
import df.engine.exec.Slice;
import df.engine.frame.ColumnFill;
import df.engine.frame.DataFrame;
import df.engine.frame.JoinKeys;
import df.engine.series.Series;
import df.engine.storage.Row;
import df.engine.storage.Value;

public class Main {
    public static void main(String[] args) {
        DemoConfig cfg = DemoConfig.fromArgs(args);

        runSeriesDemo();
        runFrameDemo(cfg);
        if (cfg.showJoins) runJoinDemo(cfg);

        // Selection errors are reported, not fatal
        try {
            new DataFrame().iloc(0);
        } catch (RuntimeException ex) {
            System.out.println("Error: " + ex.getMessage());
        }
    }

    private static void runSeriesDemo() {
        Series numbers = Series.of("myNumbers", 1, 2, 3, 4, 5);
        System.out.println("Series '" + numbers.name() + "' " + numbers.items());
        System.out.println("  mean:   " + fmt(numbers.mean()));
        System.out.println("  median: " + fmt(numbers.median()));
        System.out.println("  min:    " + fmt(numbers.min()));
        System.out.println("  max:    " + fmt(numbers.max()));
        System.out.println("  sum:    " + Value.of(numbers.sum()));
        System.out.println("  q(0.9): " + fmt(numbers.quantile(0.9)));

        Series longer = numbers.concat(List.of(6, 7, 8, 9, 10));
        System.out.println("concat:      " + longer.items());
        Series strings = longer.lambda((v, i) -> v.toString(), "myStrings");
        System.out.println("lambda:      " + strings.items());

        Series mixed = Series.of("myMix", 1, Value.UNDEFINED, false, null, Double.NaN, 10, "");
        System.out.println("fillNullish: " + mixed.fillNullish(0).items());
        System.out.println("fillFalsey:  " + mixed.fillFalsey(0).items());
        System.out.println("forwardFill: " + mixed.forwardFill().items());
        System.out.println();
    }

    private static void runFrameDemo(DemoConfig cfg) {
        DataFrame df = DataFrame.of(
            Row.of("name", "Alice", "age", 30, "active", true),
            Row.of("name", "Bob", "age", 25, "active", false)
        );
        System.out.println("shape:   " + df.shape());
        System.out.println("columns: " + df.columns());
        System.out.println("mean age: " + fmt(df.col("age").mean()));

        df.pushRow(Row.of("name", "John", "age", 35, "active", true));
        System.out.println("head(1): " + df.head(1));
        System.out.println("tail(1): " + df.tail(1));

        DataFrame withInitials = df.addColumn("initials",
            ColumnFill.generator((row, i) -> row.get("name").asText().substring(0, 1)));
        TablePrinter.print(new DataFrame(withInitials.head(cfg.headRows)));

        Map<String, Function<Row, Object>> derived = new LinkedHashMap<>();
        derived.put("birthYear", r -> 2025 - r.get("age").asDouble());
        derived.put("nameLength", r -> r.get("name").asText().length());
        DataFrame assigned = df.assign(derived).filterRows((r, i) -> r.get("active").isTruthy());
        TablePrinter.print(assigned);

        TablePrinter.print(df.iloc(Slice.of(0, df.size(), 2)).drop("active"));
        System.out.println(df.select("name", "age").toJson());
        System.out.println();
    }

    private static void runJoinDemo(DemoConfig cfg) {
        DataFrame users = DataFrame.fromJson("[{\"id\":1,\"name\":\"Alice\"},{\"id\":2,\"name\":\"Bob\"}]");
        DataFrame ages = DataFrame.fromJson("[{\"userId\":1,\"age\":25},{\"userId\":3,\"age\":30}]");
        JoinKeys on = JoinKeys.on("id", "userId");

        System.out.println("leftJoin:");
        TablePrinter.print(new DataFrame(users.leftJoin(ages, on).head(cfg.headRows)));
        System.out.println("rightJoin:");
        TablePrinter.print(new DataFrame(users.rightJoin(ages, on).head(cfg.headRows)));
    }

    private static String fmt(OptionalDouble d) {
        return d.isPresent() ? Value.of(d.getAsDouble()).toString() : "undefined";
    }
}
