package loci.imagestats.image;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Converts decoded pixel buffers of any supported layout into a {@link CanonicalImage}.
 *
 * <p>Supported inputs are 1, 3 or 4 interleaved channels of {@code uint8}, {@code int8},
 * {@code uint16}, {@code int16}, {@code int32}, {@code float32} or {@code float64}.
 * Integer samples are divided by the largest magnitude of their kind, floating point
 * samples pass through (float64 is narrowed). Three and four channel buffers in BGR(A)
 * order are swapped to RGB(A).</p>
 *
 * <p>Multiplying a canonical sample by {@link NumericKind#alpha()} and rounding gives back
 * the original integer for every 8 and 16 bit value. A float holds 24 significant bits,
 * so {@code int32} samples are exact up to a magnitude of 2^23 and off by up to
 * {@code |v| / 2^24} beyond.</p>
 *
 * <p>The normalizer is stateless apart from the image id counter, which is the only
 * way ids are handed out.</p>
 */
public final class ImageNormalizer {

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private ImageNormalizer() {
    }

    /**
     * Normalizes a codec-native buffer: BGR(A) component order, little-endian
     * multi-byte samples.
     *
     * @param raw      sample bytes, row-major, channel-interleaved
     * @param width    width in pixels
     * @param height   height in pixels
     * @param channels channel count, 1, 3 or 4
     * @param kind     numeric kind of the samples
     * @return a new canonical image with a fresh id
     * @throws UnsupportedFormatException if the channel count or kind is not supported
     * @throws IllegalArgumentException   if the buffer length does not match the dimensions
     */
    public static CanonicalImage normalize(byte[] raw, int width, int height, int channels, NumericKind kind) {
        return normalize(new RawImage(width, height, channels, kind, raw,
                ByteOrder.LITTLE_ENDIAN, RawImage.ComponentOrder.BGR));
    }

    public static CanonicalImage normalize(RawImage raw) {
        return normalize(raw, 1.0);
    }

    /**
     * Normalizes a raw buffer, multiplying every canonical sample by {@code scale}.
     * Portable float maps carry such a factor in their header.
     */
    public static CanonicalImage normalize(RawImage raw, double scale) {
        validate(raw.channels(), raw.kind());
        if (raw.width() < 0 || raw.height() < 0) {
            throw new IllegalArgumentException(
                    String.format("Invalid image dimensions %dx%d", raw.width(), raw.height()));
        }
        long expected = raw.expectedBytes();
        if (raw.data().length != expected) {
            throw new IllegalArgumentException(String.format(
                    "Buffer holds %d bytes but %dx%dx%d %s needs %d",
                    raw.data().length, raw.width(), raw.height(), raw.channels(),
                    raw.kind().wireName(), expected));
        }

        ImageSpec spec = new ImageSpec(raw.width(), raw.height(), raw.channels(), raw.kind());
        int channels = raw.channels();
        int pixels = spec.pixelCount();
        float[] samples = new float[spec.sampleCount()];

        boolean swap = channels >= 3 && raw.componentOrder() == RawImage.ComponentOrder.BGR;
        double factor = scale / raw.kind().alpha();
        ByteBuffer buffer = raw.buffer();

        for (int p = 0; p < pixels; p++) {
            int base = p * channels;
            for (int c = 0; c < channels; c++) {
                int source = swap && c < 3 ? base + (2 - c) : base + c;
                samples[base + c] = (float) (raw.readSample(buffer, source) * factor);
            }
        }
        return new CanonicalImage(NEXT_ID.getAndIncrement(), spec, samples);
    }

    /**
     * Wraps samples that are already canonical, for images derived from other canonical
     * images (differences, crops). The array is adopted, not copied.
     */
    public static CanonicalImage fromSamples(int width, int height, int channels,
                                             NumericKind originalKind, float[] samples) {
        ImageSpec spec = new ImageSpec(width, height, channels, originalKind);
        return new CanonicalImage(NEXT_ID.getAndIncrement(), spec, samples);
    }

    /**
     * Checks that a channel count and kind can be normalized.
     *
     * @throws UnsupportedFormatException if not
     */
    public static void validate(int channels, NumericKind kind) {
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new UnsupportedFormatException("Unsupported channel count: " + channels);
        }
        if (kind == null || kind == NumericKind.FLOAT16) {
            throw new UnsupportedFormatException("Unsupported sample depth: "
                    + (kind == null ? "unknown" : kind.wireName()));
        }
    }
}
