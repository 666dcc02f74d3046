package df.engine.cli;

public class DemoConfig {
    public static final int DEFAULT_HEAD_ROWS = 5;

    public final int headRows;
    public final boolean showJoins;

    public DemoConfig(int headRows, boolean showJoins) {
        this.headRows = headRows;
        this.showJoins = showJoins;
    }

    public static DemoConfig defaultConfig() {
        return new DemoConfig(DEFAULT_HEAD_ROWS, true);
    }

    public static DemoConfig fromArgs(String[] args) {
        int headRows = DEFAULT_HEAD_ROWS;
        boolean showJoins = true;

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--head=")) {
                headRows = parseCount(s.substring("--head=".length()), headRows);
            } else if (s.equals("--no-join")) {
                showJoins = false;
            } else if (!s.isEmpty()) {
                System.err.println("[WARN] Ignoring unknown argument: " + s);
            }
        }
        return new DemoConfig(headRows, showJoins);
    }

    // Malformed or negative counts keep the previous value
    private static int parseCount(String raw, int fallback) {
        try {
            int n = Integer.parseInt(raw);
            return n >= 0 ? n : fallback;
        } catch (NumberFormatException e) {
            System.err.println("[WARN] Invalid --head value '" + raw + "', using " + fallback);
            return fallback;
        }
    }
}
