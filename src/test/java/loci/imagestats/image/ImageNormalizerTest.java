package loci.imagestats.image;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ImageNormalizer}.
 */
class ImageNormalizerTest {

    @Test
    @DisplayName("uint8 BGR buffer is swapped to RGB and scaled to [0, 1]")
    void testUint8BgrSwap() {
        byte[] raw = {(byte) 255, 0, 0, 0, (byte) 255, 0};
        CanonicalImage image = ImageNormalizer.normalize(raw, 2, 1, 3, NumericKind.UINT8);

        assertArrayEquals(new float[]{0f, 0f, 1f}, image.pixelAt(0, 0), 1e-6f);
        assertArrayEquals(new float[]{0f, 1f, 0f}, image.pixelAt(1, 0), 1e-6f);
        assertEquals(NumericKind.UINT8, image.spec().originalKind());
    }

    @Test
    @DisplayName("Alpha channel stays in place when BGRA is swapped")
    void testBgraAlphaKept() {
        byte[] raw = {10, 20, 30, (byte) 255};
        CanonicalImage image = ImageNormalizer.normalize(raw, 1, 1, 4, NumericKind.UINT8);

        float[] px = image.pixelAt(0, 0);
        assertEquals(30 / 255f, px[0], 1e-6f);
        assertEquals(20 / 255f, px[1], 1e-6f);
        assertEquals(10 / 255f, px[2], 1e-6f);
        assertEquals(1f, px[3], 1e-6f);
    }

    @Test
    @DisplayName("Signed and wide integer kinds divide by their largest magnitude")
    void testIntegerKinds() {
        ByteBuffer buf = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
        buf.putShort((short) 32767).putShort((short) -32767);
        CanonicalImage i16 = ImageNormalizer.normalize(buf.array(), 2, 1, 1, NumericKind.INT16);
        assertEquals(1f, i16.sample(0, 0, 0), 1e-6f);
        assertEquals(-1f, i16.sample(1, 0, 0), 1e-6f);

        ByteBuffer u16 = ByteBuffer.allocate(2).order(ByteOrder.LITTLE_ENDIAN).putShort((short) 0xFFFF);
        CanonicalImage image = ImageNormalizer.normalize(u16.array(), 1, 1, 1, NumericKind.UINT16);
        assertEquals(1f, image.sample(0, 0, 0), 1e-6f);

        CanonicalImage i8 = ImageNormalizer.normalize(new byte[]{-127}, 1, 1, 1, NumericKind.INT8);
        assertEquals(-1f, i8.sample(0, 0, 0), 1e-6f);
    }

    /** One-row grayscale image holding {@code values} as little-endian samples of {@code kind}. */
    private static CanonicalImage row(NumericKind kind, long[] values) {
        ByteBuffer buf = ByteBuffer.allocate(values.length * kind.bytes()).order(ByteOrder.LITTLE_ENDIAN);
        for (long v : values) {
            switch (kind) {
                case UINT8, INT8 -> buf.put((byte) v);
                case UINT16, INT16 -> buf.putShort((short) v);
                case INT32 -> buf.putInt((int) v);
                default -> throw new IllegalArgumentException(kind.wireName());
            }
        }
        return ImageNormalizer.normalize(buf.array(), values.length, 1, 1, kind);
    }

    private static long[] range(long from, long to, long step) {
        int n = (int) ((to - from) / step) + 1;
        long[] values = new long[n];
        for (int i = 0; i < n; i++) {
            values[i] = from + i * step;
        }
        return values;
    }

    private static void assertRoundTrip(NumericKind kind, long[] values) {
        CanonicalImage image = row(kind, values);
        for (int i = 0; i < values.length; i++) {
            long back = Math.round(image.spec().toNative(image.sample(i, 0, 0)));
            assertEquals(values[i], back, kind.wireName() + " sample " + values[i]);
        }
    }

    @Test
    @DisplayName("Every 8-bit value and every 16-bit value comes back exactly after rescaling")
    void testIntegerRoundTrip() {
        assertRoundTrip(NumericKind.UINT8, range(0, 255, 1));
        assertRoundTrip(NumericKind.INT8, range(-128, 127, 1));
        assertRoundTrip(NumericKind.UINT16, range(0, 65535, 1));
        assertRoundTrip(NumericKind.INT16, range(-32768, 32767, 1));
    }

    @Test
    @DisplayName("int32 round-trips exactly up to 2^23 and within float precision above")
    void testInt32RoundTripPrecision() {
        assertRoundTrip(NumericKind.INT32, range(-(1L << 23), 1L << 23, 4099));
        assertRoundTrip(NumericKind.INT32, new long[]{0, 1, -1, 8388607, -8388608});

        // a float keeps 24 significant bits, so large magnitudes are off by up to |v| / 2^24
        long[] large = {Integer.MAX_VALUE, Integer.MIN_VALUE, 1_000_000_007L, -123_456_789L};
        CanonicalImage image = row(NumericKind.INT32, large);
        for (int i = 0; i < large.length; i++) {
            double back = image.spec().toNative(image.sample(i, 0, 0));
            assertEquals(large[i], back, Math.abs(large[i]) / (double) (1 << 24) + 1);
        }
    }

    @Test
    @DisplayName("float32 samples are bit-exact and float64 samples are narrowed to the nearest float")
    void testFloatRoundTrip() {
        float[] floats = {0f, -0f, 1f, -1f, 0.1f, 3.4028235e38f, 1.4e-45f, -123.456f, 65535.5f};
        ByteBuffer f32 = ByteBuffer.allocate(floats.length * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (float f : floats) {
            f32.putFloat(f);
        }
        CanonicalImage single = ImageNormalizer.normalize(f32.array(), floats.length, 1, 1, NumericKind.FLOAT32);
        for (int i = 0; i < floats.length; i++) {
            assertEquals(Float.floatToRawIntBits(floats[i]), Float.floatToRawIntBits(single.sample(i, 0, 0)));
        }

        double[] doubles = {0.1, -2.5, 1e-300, 1e300, Math.PI};
        ByteBuffer f64 = ByteBuffer.allocate(doubles.length * 8).order(ByteOrder.LITTLE_ENDIAN);
        for (double d : doubles) {
            f64.putDouble(d);
        }
        CanonicalImage narrowed = ImageNormalizer.normalize(f64.array(), doubles.length, 1, 1, NumericKind.FLOAT64);
        for (int i = 0; i < doubles.length; i++) {
            assertEquals((float) doubles[i], narrowed.sample(i, 0, 0));
        }
    }

    @Test
    @DisplayName("Floating point samples pass through unchanged")
    void testFloatPassThrough() {
        ByteBuffer buf = ByteBuffer.allocate(16).order(ByteOrder.LITTLE_ENDIAN);
        buf.putDouble(-3.5).putDouble(1e6);
        CanonicalImage image = ImageNormalizer.normalize(buf.array(), 2, 1, 1, NumericKind.FLOAT64);

        assertEquals(-3.5f, image.sample(0, 0, 0));
        assertEquals(1e6f, image.sample(1, 0, 0));
    }

    @Test
    @DisplayName("RGB-ordered raw image is not swapped")
    void testRgbRawImage() {
        RawImage raw = new RawImage(1, 1, 3, NumericKind.UINT8, new byte[]{(byte) 255, 0, 0},
                ByteOrder.LITTLE_ENDIAN, RawImage.ComponentOrder.RGB);
        CanonicalImage image = ImageNormalizer.normalize(raw);

        assertArrayEquals(new float[]{1f, 0f, 0f}, image.pixelAt(0, 0), 1e-6f);
    }

    @Test
    @DisplayName("Big-endian buffers and scale factors are honoured")
    void testBigEndianWithScale() {
        ByteBuffer buf = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putFloat(2.0f);
        RawImage raw = new RawImage(1, 1, 1, NumericKind.FLOAT32, buf.array(),
                ByteOrder.BIG_ENDIAN, RawImage.ComponentOrder.RGB);

        CanonicalImage image = ImageNormalizer.normalize(raw, 0.5);
        assertEquals(1.0f, image.sample(0, 0, 0), 1e-6f);
    }

    @Test
    @DisplayName("Unsupported channel counts and kinds are rejected")
    void testUnsupportedFormats() {
        assertThrows(UnsupportedFormatException.class,
                () -> ImageNormalizer.normalize(new byte[4], 2, 1, 2, NumericKind.UINT8));
        assertThrows(UnsupportedFormatException.class,
                () -> ImageNormalizer.normalize(new byte[10], 1, 1, 5, NumericKind.UINT16));
        assertThrows(UnsupportedFormatException.class,
                () -> ImageNormalizer.normalize(new byte[2], 1, 1, 1, NumericKind.FLOAT16));
    }

    @Test
    @DisplayName("Buffer length must match the dimensions")
    void testLengthMismatch() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ImageNormalizer.normalize(new byte[5], 2, 1, 3, NumericKind.UINT8));
        assertFalse(e instanceof UnsupportedFormatException);
    }

    @Test
    @DisplayName("Every normalized image receives a distinct id")
    void testDistinctIds() {
        CanonicalImage a = ImageNormalizer.normalize(new byte[1], 1, 1, 1, NumericKind.UINT8);
        CanonicalImage b = ImageNormalizer.normalize(new byte[1], 1, 1, 1, NumericKind.UINT8);

        assertNotEquals(a.id(), b.id());
        assertTrue(b.id() > 0 && a.id() > 0);
    }

    @Test
    @DisplayName("Empty images normalize to zero samples")
    void testEmptyImage() {
        CanonicalImage image = ImageNormalizer.normalize(new byte[0], 0, 0, 3, NumericKind.UINT8);

        assertTrue(image.spec().isEmpty());
        assertEquals(0, image.samples().length);
    }

    @Test
    @DisplayName("Min/max is computed per channel and memoized")
    void testMinMax() {
        byte[] raw = {0, 51, (byte) 255, 102, 0, 51};
        CanonicalImage image = ImageNormalizer.normalize(raw, 2, 1, 3, NumericKind.UINT8);

        MinMax mm = image.minMax();
        // channel 0 after swap holds bytes 2 and 5
        assertEquals(51 / 255f, mm.min(0), 1e-6f);
        assertEquals(1f, mm.max(0), 1e-6f);
        assertEquals(0f, mm.totalMin(), 1e-6f);
        assertEquals(1f, mm.totalMax(), 1e-6f);
        assertSame(mm, image.minMax());
    }

    @Test
    @DisplayName("pixelAt rejects coordinates outside the image")
    void testPixelAtBounds() {
        CanonicalImage image = ImageNormalizer.normalize(new byte[4], 2, 2, 1, NumericKind.UINT8);

        assertThrows(IndexOutOfBoundsException.class, () -> image.pixelAt(2, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> image.pixelAt(0, -1));
    }
}
