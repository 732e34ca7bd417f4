package loci.imagestats.image;

import java.util.Arrays;

/**
 * Per-channel minima and maxima of a canonical image.
 */
public final class MinMax {

    public static final MinMax EMPTY = new MinMax(new float[0], new float[0]);

    private final float[] mins;
    private final float[] maxs;

    public MinMax(float[] mins, float[] maxs) {
        if (mins.length != maxs.length) {
            throw new IllegalArgumentException("Min and max arrays differ in length");
        }
        this.mins = mins.clone();
        this.maxs = maxs.clone();
    }

    /**
     * Computes the per-channel extrema of an image. An empty image yields {@link #EMPTY}.
     */
    public static MinMax of(CanonicalImage image) {
        ImageSpec spec = image.spec();
        if (spec.isEmpty()) {
            return EMPTY;
        }
        int channels = spec.channels();
        float[] mins = new float[channels];
        float[] maxs = new float[channels];
        Arrays.fill(mins, Float.POSITIVE_INFINITY);
        Arrays.fill(maxs, Float.NEGATIVE_INFINITY);

        float[] samples = image.samples();
        for (int i = 0; i < samples.length; i += channels) {
            for (int c = 0; c < channels; c++) {
                float v = samples[i + c];
                if (v < mins[c]) mins[c] = v;
                if (v > maxs[c]) maxs[c] = v;
            }
        }
        return new MinMax(mins, maxs);
    }

    public int channels() {
        return mins.length;
    }

    /** Minimum of a channel, or 0 for a channel the image does not have. */
    public float min(int channel) {
        return channel >= 0 && channel < mins.length ? mins[channel] : 0f;
    }

    /** Maximum of a channel, or 0 for a channel the image does not have. */
    public float max(int channel) {
        return channel >= 0 && channel < maxs.length ? maxs[channel] : 0f;
    }

    public float totalMin() {
        if (mins.length == 0) {
            return 0f;
        }
        float m = Float.POSITIVE_INFINITY;
        for (float v : mins) m = Math.min(m, v);
        return m;
    }

    public float totalMax() {
        if (maxs.length == 0) {
            return 0f;
        }
        float m = Float.NEGATIVE_INFINITY;
        for (float v : maxs) m = Math.max(m, v);
        return m;
    }

    @Override
    public String toString() {
        return "MinMax[min=" + Arrays.toString(mins) + ", max=" + Arrays.toString(maxs) + "]";
    }
}
