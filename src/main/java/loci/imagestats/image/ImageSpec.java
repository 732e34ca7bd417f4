package loci.imagestats.image;

/**
 * Immutable descriptor of a canonical image.
 *
 * <p>The sample data of every canonical image is 32-bit float. {@code originalKind} is the
 * encoding of the source before normalization and is only used to convert values back to
 * native display units; it never describes the layout of the float buffer.</p>
 *
 * @param width        Image width in pixels
 * @param height       Image height in pixels
 * @param channels     Number of interleaved channels
 * @param originalKind Numeric kind of the source samples
 */
public record ImageSpec(int width, int height, int channels, NumericKind originalKind) {

    public ImageSpec {
        if (width < 0 || height < 0 || channels <= 0) {
            throw new IllegalArgumentException(
                    String.format("Invalid image dimensions %dx%dx%d", width, height, channels));
        }
        if (originalKind == null) {
            throw new IllegalArgumentException("Original numeric kind must not be null");
        }
    }

    /** Number of float samples: width * height * channels. */
    public int sampleCount() {
        return Math.multiplyExact(Math.multiplyExact(width, height), channels);
    }

    /** Byte length of the canonical buffer. */
    public long totalBytes() {
        return (long) sampleCount() * Float.BYTES;
    }

    public int bytesPerPixel() {
        return channels * Float.BYTES;
    }

    public int pixelCount() {
        return width * height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /** Full-frame rectangle of this image. */
    public Rect bounds() {
        return new Rect(0, 0, width, height);
    }

    /**
     * Converts a canonical value back to the units of {@link #originalKind()}.
     */
    public double toNative(double canonicalValue) {
        return canonicalValue * originalKind.alpha();
    }
}
