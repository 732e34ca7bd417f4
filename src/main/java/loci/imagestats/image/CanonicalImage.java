package loci.imagestats.image;

/**
 * The engine's single internal image representation: dense row-major,
 * channel-interleaved 32-bit float samples normalized to the natural range of the
 * source's numeric kind.
 *
 * <p>Instances are created only by {@link ImageNormalizer}, which assigns each a
 * process-unique, monotonically increasing {@link #id()}. The id is a cache key for
 * downstream consumers and says nothing about content: two images with identical
 * samples have different ids.</p>
 *
 * <p>The sample array is shared, not copied. Callers must treat it as read-only.</p>
 */
public final class CanonicalImage {

    private final long id;
    private final ImageSpec spec;
    private final float[] samples;

    private volatile MinMax minMax;

    CanonicalImage(long id, ImageSpec spec, float[] samples) {
        if (samples.length != spec.sampleCount()) {
            throw new IllegalArgumentException(String.format(
                    "Sample count %d does not match %dx%dx%d",
                    samples.length, spec.width(), spec.height(), spec.channels()));
        }
        this.id = id;
        this.spec = spec;
        this.samples = samples;
    }

    public long id() {
        return id;
    }

    public ImageSpec spec() {
        return spec;
    }

    public int width() {
        return spec.width();
    }

    public int height() {
        return spec.height();
    }

    public int channels() {
        return spec.channels();
    }

    /** Backing samples, HWC order. Read-only by contract. */
    public float[] samples() {
        return samples;
    }

    /**
     * Single sample lookup without bounds checks beyond those of the array.
     */
    public float sample(int x, int y, int channel) {
        return samples[(y * spec.width() + x) * spec.channels() + channel];
    }

    /**
     * Returns a copy of all channel values of one pixel.
     *
     * @throws IndexOutOfBoundsException if the coordinates lie outside the image
     */
    public float[] pixelAt(int x, int y) {
        if (x < 0 || x >= spec.width() || y < 0 || y >= spec.height()) {
            throw new IndexOutOfBoundsException(
                    String.format("Pixel (%d, %d) outside %dx%d image", x, y, spec.width(), spec.height()));
        }
        int channels = spec.channels();
        float[] pixel = new float[channels];
        System.arraycopy(samples, (y * spec.width() + x) * channels, pixel, 0, channels);
        return pixel;
    }

    /**
     * Per-channel extrema, computed on first use and memoized.
     */
    public MinMax minMax() {
        MinMax result = minMax;
        if (result == null) {
            synchronized (this) {
                result = minMax;
                if (result == null) {
                    result = MinMax.of(this);
                    minMax = result;
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("CanonicalImage[id=%d, %dx%dx%d, %s]",
                id, spec.width(), spec.height(), spec.channels(), spec.originalKind().wireName());
    }
}
