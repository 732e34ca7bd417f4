package loci.imagestats.image;

/**
 * Per-sample encoding an image used before it was normalized to 32-bit float.
 *
 * <p>Each kind carries the magnitude its integer samples are divided by during
 * normalization ({@link #alpha()}). Floating point kinds pass through with an alpha of 1.
 * {@link #FLOAT16} is recognized so that half-float sources can be reported, but the
 * normalizer rejects it.</p>
 */
public enum NumericKind {
    UINT8("uint8", 1, false, 255.0),
    INT8("int8", 1, false, 127.0),
    UINT16("uint16", 2, false, 65535.0),
    INT16("int16", 2, false, 32767.0),
    INT32("int32", 4, false, 2147483647.0),
    FLOAT32("float32", 4, true, 1.0),
    FLOAT64("float64", 8, true, 1.0),
    FLOAT16("float16", 2, true, 1.0);

    private final String wireName;
    private final int bytes;
    private final boolean floating;
    private final double alpha;

    NumericKind(String wireName, int bytes, boolean floating, double alpha) {
        this.wireName = wireName;
        this.bytes = bytes;
        this.floating = floating;
        this.alpha = alpha;
    }

    /** Name used by the {@code dtype} metadata field, e.g. {@code "uint16"}. */
    public String wireName() {
        return wireName;
    }

    /** Size of one sample in bytes. */
    public int bytes() {
        return bytes;
    }

    public boolean isFloating() {
        return floating;
    }

    /**
     * Magnitude a native sample is divided by to reach the canonical range.
     * Multiplying a canonical value by alpha converts it back to native display units.
     */
    public double alpha() {
        return alpha;
    }

    /**
     * Parses a {@code dtype} name.
     *
     * @param name wire name such as {@code "float32"}
     * @return the matching kind, or null if the name is not part of the wire protocol
     */
    public static NumericKind fromWireName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim().toLowerCase();
        for (NumericKind kind : values()) {
            // float16 is never accepted from the wire
            if (kind != FLOAT16 && kind.wireName.equals(trimmed)) {
                return kind;
            }
        }
        return null;
    }
}
