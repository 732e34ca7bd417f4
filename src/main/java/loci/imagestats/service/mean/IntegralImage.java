package loci.imagestats.service.mean;

import java.util.Arrays;
import loci.imagestats.image.CanonicalImage;

/**
 * Per-channel summed-area table of a canonical image, in double precision.
 *
 * <p>The table has one extra row and column of zeros so that {@code at(x, y, c)} is the
 * sum of all samples of channel {@code c} with column {@code < x} and row {@code < y}.
 * Any rectangle sum is then four lookups.</p>
 */
final class IntegralImage {

    private final long imageId;
    private final int width;
    private final int height;
    private final int channels;
    private final int stride;
    private final double[] table;

    private IntegralImage(long imageId, int width, int height, int channels, double[] table) {
        this.imageId = imageId;
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.stride = (width + 1) * channels;
        this.table = table;
    }

    static IntegralImage build(CanonicalImage image) {
        int w = image.width();
        int h = image.height();
        int c = image.channels();
        int stride = (w + 1) * c;
        double[] table = new double[Math.multiplyExact(stride, h + 1)];
        float[] samples = image.samples();
        double[] rowSum = new double[c];

        for (int y = 0; y < h; y++) {
            Arrays.fill(rowSum, 0.0);
            int src = y * w * c;
            int above = y * stride;
            int here = (y + 1) * stride;
            for (int x = 0; x < w; x++) {
                for (int ch = 0; ch < c; ch++) {
                    rowSum[ch] += samples[src + x * c + ch];
                    int offset = (x + 1) * c + ch;
                    table[here + offset] = table[above + offset] + rowSum[ch];
                }
            }
        }
        return new IntegralImage(image.id(), w, h, c, table);
    }

    long imageId() {
        return imageId;
    }

    int width() {
        return width;
    }

    int height() {
        return height;
    }

    int channels() {
        return channels;
    }

    double at(int x, int y, int channel) {
        return table[y * stride + x * channels + channel];
    }

    /**
     * Sum of channel samples over columns {@code [x0, x1)} and rows {@code [y0, y1)}.
     */
    double sum(int x0, int y0, int x1, int y1, int channel) {
        return at(x1, y1, channel) - at(x0, y1, channel) - at(x1, y0, channel) + at(x0, y0, channel);
    }
}
