package loci.imagestats.service.metrics;

import loci.imagestats.image.CanonicalImage;
import loci.imagestats.image.Rect;

/**
 * Per-pixel statistics over a rectangle of one or two canonical images.
 *
 * <p>All methods require the rectangle to be non-empty and to lie inside every image
 * involved. Two-image methods also require equal channel counts.</p>
 */
public final class ImageMetrics {

    /** Smallest positive difference OpenCV adds before taking the PSNR logarithm. */
    static final double DBL_EPSILON = Math.ulp(1.0);

    private ImageMetrics() {
    }

    /**
     * Minimum and maximum of each channel, multiplied by {@code scale}.
     *
     * @return {@code [min0, max0, min1, max1, ...]}
     */
    public static double[] minMax(CanonicalImage image, Rect rect, double scale) {
        checkRegion(image, rect);
        int c = image.channels();
        double[] out = new double[2 * c];
        for (int ch = 0; ch < c; ch++) {
            out[2 * ch] = Double.POSITIVE_INFINITY;
            out[2 * ch + 1] = Double.NEGATIVE_INFINITY;
        }

        float[] samples = image.samples();
        for (int y = rect.y(); y < rect.maxY(); y++) {
            int row = (y * image.width() + rect.x()) * c;
            for (int i = 0; i < rect.width() * c; i++) {
                int ch = i % c;
                double v = samples[row + i];
                if (v < out[2 * ch]) out[2 * ch] = v;
                if (v > out[2 * ch + 1]) out[2 * ch + 1] = v;
            }
        }
        for (int i = 0; i < out.length; i++) {
            out[i] *= scale;
        }
        return out;
    }

    /**
     * Population standard deviation of each channel.
     */
    public static double[] stdDev(CanonicalImage image, Rect rect) {
        double[][] planes = planes(image, rect);
        double[] out = new double[planes.length];
        for (int ch = 0; ch < planes.length; ch++) {
            double[] p = planes[ch];
            double mean = 0;
            for (double v : p) mean += v;
            mean /= p.length;
            double var = 0;
            for (double v : p) {
                double d = v - mean;
                var += d * d;
            }
            out[ch] = Math.sqrt(var / p.length);
        }
        return out;
    }

    /**
     * Mean squared difference over all samples of all channels.
     */
    public static double mse(CanonicalImage a, CanonicalImage b, Rect rect) {
        checkPair(a, b, rect);
        double sum = 0;
        long n = 0;
        int c = a.channels();
        float[] as = a.samples();
        float[] bs = b.samples();
        for (int y = rect.y(); y < rect.maxY(); y++) {
            int ar = (y * a.width() + rect.x()) * c;
            int br = (y * b.width() + rect.x()) * c;
            for (int i = 0; i < rect.width() * c; i++) {
                double d = (double) as[ar + i] - bs[br + i];
                sum += d * d;
                n++;
            }
        }
        return sum / n;
    }

    /**
     * Mean absolute difference over all samples of all channels.
     */
    public static double mae(CanonicalImage a, CanonicalImage b, Rect rect) {
        checkPair(a, b, rect);
        double sum = 0;
        long n = 0;
        int c = a.channels();
        float[] as = a.samples();
        float[] bs = b.samples();
        for (int y = rect.y(); y < rect.maxY(); y++) {
            int ar = (y * a.width() + rect.x()) * c;
            int br = (y * b.width() + rect.x()) * c;
            for (int i = 0; i < rect.width() * c; i++) {
                sum += Math.abs((double) as[ar + i] - bs[br + i]);
                n++;
            }
        }
        return sum / n;
    }

    /**
     * Peak signal-to-noise ratio {@code 20 * log10(R / (rmse + eps))}, plus the RMSE in
     * display units derived from it.
     *
     * @param dataRange peak value R of the canonical samples, 1 for normalized images
     * @param scale     factor converting canonical values to display units
     * @return {@code [psnr, rmse]}
     */
    public static double[] psnr(CanonicalImage a, CanonicalImage b, Rect rect, double dataRange, double scale) {
        double rmse = Math.sqrt(mse(a, b, rect));
        double psnr = 20.0 * Math.log10(dataRange / (rmse + DBL_EPSILON));
        double displayRmse = scale / Math.pow(10.0, psnr / 20.0);
        return new double[]{psnr, displayRmse};
    }

    /**
     * Splits the rectangle of an image into one double plane per channel, row-major.
     */
    static double[][] planes(CanonicalImage image, Rect rect) {
        checkRegion(image, rect);
        int c = image.channels();
        int w = rect.width();
        int h = rect.height();
        double[][] planes = new double[c][w * h];
        float[] samples = image.samples();
        for (int y = 0; y < h; y++) {
            int row = ((rect.y() + y) * image.width() + rect.x()) * c;
            for (int x = 0; x < w; x++) {
                for (int ch = 0; ch < c; ch++) {
                    planes[ch][y * w + x] = samples[row + x * c + ch];
                }
            }
        }
        return planes;
    }

    static void checkRegion(CanonicalImage image, Rect rect) {
        if (rect.isEmpty()) {
            throw new IllegalArgumentException("Region " + rect + " is empty");
        }
        if (!rect.isInside(image.spec().bounds())) {
            throw new IndexOutOfBoundsException(String.format("Region %s outside %dx%d image",
                    rect, image.width(), image.height()));
        }
    }

    static void checkPair(CanonicalImage a, CanonicalImage b, Rect rect) {
        if (a.channels() != b.channels()) {
            throw new IllegalArgumentException(String.format(
                    "Channel counts differ: %d vs %d", a.channels(), b.channels()));
        }
        checkRegion(a, rect);
        checkRegion(b, rect);
    }
}
