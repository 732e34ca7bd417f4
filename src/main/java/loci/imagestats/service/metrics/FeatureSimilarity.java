package loci.imagestats.service.metrics;

import loci.imagestats.image.CanonicalImage;
import loci.imagestats.image.Rect;

/**
 * Feature similarity index (FSIM) of Zhang et al. (2011).
 *
 * <p>Both images are reduced to a luminance plane (mean of channels scaled to
 * {@code [0, 255]}), box-filtered and subsampled by {@code max(1, round(min(h, w) / 256))}.
 * Similarity combines phase congruency and Scharr gradient magnitude, weighted by the
 * larger phase congruency of the two images.</p>
 */
public final class FeatureSimilarity {

    static final double T1 = 0.85;
    static final double T2 = 160;

    private FeatureSimilarity() {
    }

    public static double fsim(CanonicalImage a, CanonicalImage b, Rect rect) {
        ImageMetrics.checkPair(a, b, rect);
        int rows = rect.height();
        int cols = rect.width();
        int factor = (int) Math.max(1, Math.round(Math.min(rows, cols) / 256.0));

        double[] y1 = luminance(a, rect);
        double[] y2 = luminance(b, rect);
        if (factor > 1) {
            y1 = subsample(boxFilter(y1, rows, cols, factor), rows, cols, factor);
            y2 = subsample(boxFilter(y2, rows, cols, factor), rows, cols, factor);
            rows = (rows + factor - 1) / factor;
            cols = (cols + factor - 1) / factor;
        }

        double[] pc1 = PhaseCongruency.compute(y1, rows, cols);
        double[] pc2 = PhaseCongruency.compute(y2, rows, cols);
        double[] g1 = scharrMagnitude(y1, rows, cols);
        double[] g2 = scharrMagnitude(y2, rows, cols);

        double weighted = 0;
        double weights = 0;
        double unweighted = 0;
        for (int i = 0; i < pc1.length; i++) {
            double pcSim = (2 * pc1[i] * pc2[i] + T1) / (pc1[i] * pc1[i] + pc2[i] * pc2[i] + T1);
            double gSim = (2 * g1[i] * g2[i] + T2) / (g1[i] * g1[i] + g2[i] * g2[i] + T2);
            double pcm = Math.max(pc1[i], pc2[i]);
            weighted += gSim * pcSim * pcm;
            weights += pcm;
            unweighted += gSim * pcSim;
        }
        // featureless images carry no phase congruency to weight by
        if (weights <= 0) {
            return unweighted / pc1.length;
        }
        return weighted / weights;
    }

    static double[] luminance(CanonicalImage image, Rect rect) {
        double[][] planes = ImageMetrics.planes(image, rect);
        int n = planes[0].length;
        double[] y = new double[n];
        for (double[] plane : planes) {
            for (int i = 0; i < n; i++) {
                y[i] += plane[i];
            }
        }
        double scale = 255.0 / planes.length;
        for (int i = 0; i < n; i++) {
            y[i] *= scale;
        }
        return y;
    }

    /**
     * Mean over a {@code size x size} window with zero padding outside the image, anchored
     * like a centred 'same' convolution.
     */
    static double[] boxFilter(double[] src, int rows, int cols, int size) {
        double[] out = new double[src.length];
        int before = (size - 1) / 2;
        double norm = 1.0 / (size * size);
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double acc = 0;
                for (int dr = -before; dr < size - before; dr++) {
                    int rr = r + dr;
                    if (rr < 0 || rr >= rows) continue;
                    for (int dc = -before; dc < size - before; dc++) {
                        int cc = c + dc;
                        if (cc < 0 || cc >= cols) continue;
                        acc += src[rr * cols + cc];
                    }
                }
                out[r * cols + c] = acc * norm;
            }
        }
        return out;
    }

    static double[] subsample(double[] src, int rows, int cols, int factor) {
        int nr = (rows + factor - 1) / factor;
        int nc = (cols + factor - 1) / factor;
        double[] out = new double[nr * nc];
        for (int r = 0; r < nr; r++) {
            for (int c = 0; c < nc; c++) {
                out[r * nc + c] = src[r * factor * cols + c * factor];
            }
        }
        return out;
    }

    /**
     * Gradient magnitude with Scharr kernels divided by 16, zero padded.
     */
    static double[] scharrMagnitude(double[] src, int rows, int cols) {
        double[] out = new double[src.length];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double p00 = at(src, rows, cols, r - 1, c - 1);
                double p01 = at(src, rows, cols, r - 1, c);
                double p02 = at(src, rows, cols, r - 1, c + 1);
                double p10 = at(src, rows, cols, r, c - 1);
                double p12 = at(src, rows, cols, r, c + 1);
                double p20 = at(src, rows, cols, r + 1, c - 1);
                double p21 = at(src, rows, cols, r + 1, c);
                double p22 = at(src, rows, cols, r + 1, c + 1);
                double gx = (3 * (p00 - p02) + 10 * (p10 - p12) + 3 * (p20 - p22)) / 16.0;
                double gy = (3 * (p00 - p20) + 10 * (p01 - p21) + 3 * (p02 - p22)) / 16.0;
                out[r * cols + c] = Math.sqrt(gx * gx + gy * gy);
            }
        }
        return out;
    }

    private static double at(double[] src, int rows, int cols, int r, int c) {
        if (r < 0 || r >= rows || c < 0 || c >= cols) {
            return 0;
        }
        return src[r * cols + c];
    }
}
