package loci.imagestats.service.socket;

/**
 * Payload encodings accepted in the {@code compression} metadata field.
 */
public enum Compression {
    /** zlib-deflated raw samples, little-endian, reshaped by {@code shape} and {@code dtype}. */
    ZLIB("zlib"),
    /** Uncompressed raw samples, same layout as {@link #ZLIB} after inflation. */
    RAW("raw"),
    PNG("png"),
    EXR("exr"),
    /** Any encoded image the codec understands. */
    CV("cv");

    private final String wireName;

    Compression(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** True if the payload is a self-describing encoded image rather than raw samples. */
    public boolean isEncoded() {
        return this == PNG || this == EXR || this == CV;
    }

    /**
     * @return the matching compression, or null if the name is unknown
     */
    public static Compression fromWireName(String name) {
        for (Compression c : values()) {
            if (c.wireName.equals(name)) {
                return c;
            }
        }
        return null;
    }
}
