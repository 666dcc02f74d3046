package df.engine.frame;

// Join columns: thisKey on the receiving frame, otherKey on the frame passed in.
public record JoinKeys(String thisKey, String otherKey) {
    public JoinKeys {
        if (thisKey == null || otherKey == null) throw new IllegalArgumentException("Join keys must not be null");
    }

    public static JoinKeys on(String thisKey, String otherKey) { return new JoinKeys(thisKey, otherKey); }
}
