package loci.imagestats.image;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Decoded but not yet normalized pixel buffer, as produced by a payload decoder or an
 * image codec.
 *
 * @param width          Image width in pixels
 * @param height         Image height in pixels
 * @param channels       Number of interleaved channels
 * @param kind           Numeric kind of each sample
 * @param data           Raw sample bytes, row-major, channel-interleaved (HWC)
 * @param byteOrder      Byte order of multi-byte samples in {@code data}
 * @param componentOrder Ordering of colour components for 3 and 4 channel data
 */
public record RawImage(
        int width,
        int height,
        int channels,
        NumericKind kind,
        byte[] data,
        ByteOrder byteOrder,
        ComponentOrder componentOrder
) {

    /**
     * Colour component ordering of a 3 or 4 channel buffer.
     * Codec-native buffers are BGR(A); the canonical ordering is RGB(A).
     */
    public enum ComponentOrder {
        RGB,
        BGR
    }

    public RawImage {
        if (data == null) {
            throw new IllegalArgumentException("Raw image data must not be null");
        }
        if (byteOrder == null) {
            byteOrder = ByteOrder.LITTLE_ENDIAN;
        }
        if (componentOrder == null) {
            componentOrder = ComponentOrder.RGB;
        }
    }

    /** Number of samples implied by the dimensions. */
    public long expectedSamples() {
        return (long) width * height * channels;
    }

    /** Number of bytes implied by the dimensions and numeric kind. */
    public long expectedBytes() {
        return expectedSamples() * kind.bytes();
    }

    /**
     * Returns a read-only view of the data with {@link #byteOrder()} applied, for
     * absolute reads at {@code sampleIndex * kind.bytes()}.
     */
    public ByteBuffer buffer() {
        return ByteBuffer.wrap(data).asReadOnlyBuffer().order(byteOrder);
    }

    /**
     * Reads one sample in native units (no normalization).
     * Unsigned kinds are returned as their unsigned value.
     *
     * @param buffer      a buffer obtained from {@link #buffer()}
     * @param sampleIndex index of the sample, not the byte offset
     */
    public double readSample(ByteBuffer buffer, int sampleIndex) {
        int offset = sampleIndex * kind.bytes();
        return switch (kind) {
            case UINT8 -> buffer.get(offset) & 0xFF;
            case INT8 -> buffer.get(offset);
            case UINT16 -> buffer.getShort(offset) & 0xFFFF;
            case INT16 -> buffer.getShort(offset);
            case INT32 -> buffer.getInt(offset);
            case FLOAT32 -> buffer.getFloat(offset);
            case FLOAT64 -> buffer.getDouble(offset);
            case FLOAT16 -> throw new UnsupportedFormatException("float16 samples cannot be read");
        };
    }
}
