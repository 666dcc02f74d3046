package df.engine.cli;

import java.util.List;

import df.engine.frame.DataFrame;
import df.engine.storage.Row;
import df.engine.storage.Value;

/**
 * Simple ASCII table printer for DataFrames.
 * Headers come from the frame's columns; absent cells render as "undefined".
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(DataFrame frame) {
        System.out.println(render(frame.columns(), frame.toArray()));
    }

    public static String render(DataFrame frame) {
        return render(frame.columns(), frame.toArray());
    }

    public static String render(List<String> headers, List<Row> rows) {
        if (rows.isEmpty()) {
            return "(0 row(s))";
        }
        int colCount = headers.size();
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) widths[i] = headers.get(i).length();
        for (Row r : rows) {
            for (int i = 0; i < colCount; i++) {
                String s = cell(r, headers.get(i));
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String divLine = buildDivider(widths);
        StringBuilder out = new StringBuilder();
        out.append(divLine).append('\n');
        out.append(buildLine(headers.toArray(new String[0]), widths)).append('\n');
        out.append(divLine).append('\n');
        for (Row r : rows) {
            String[] cells = new String[colCount];
            for (int i = 0; i < colCount; i++) cells[i] = cell(r, headers.get(i));
            out.append(buildLine(cells, widths)).append('\n');
        }
        out.append(divLine).append('\n');
        out.append('(').append(rows.size()).append(" row(s))");
        return out.toString();
    }

    private static String cell(Row r, String column) {
        Value v = r.get(column);
        return v.toString();
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            divider.append("-".repeat(w + 2));
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(String[] cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(pad(cells[i], widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
