package loci.imagestats.service.metrics;

import loci.imagestats.image.CanonicalImage;
import loci.imagestats.image.Rect;

/**
 * SSIM and multi-scale SSIM with a Gaussian window.
 *
 * <p>Local statistics are Gaussian-weighted (default 11x11, sigma 1.5) with reflect-101
 * borders, and the stabilizing constants are {@code C1 = 0.01^2} and {@code C2 = 0.03^2}
 * for a dynamic range of 1. Multi-channel images are measured per channel and the
 * channel scores averaged.</p>
 */
public class StructuralSimilarity {

    static final double C1 = 0.0001;
    static final double C2 = 0.0009;

    /** Per-scale exponents of Wang, Simoncelli and Bovik (2003). */
    static final double[] MS_SSIM_WEIGHTS = {0.0448, 0.2856, 0.3001, 0.2363, 0.1333};

    private final int window;
    private final double[] kernel;

    public StructuralSimilarity() {
        this(11, 1.5);
    }

    public StructuralSimilarity(int window, double sigma) {
        if (window < 1 || window % 2 == 0) {
            throw new IllegalArgumentException("SSIM window must be odd and positive: " + window);
        }
        if (sigma <= 0) {
            throw new IllegalArgumentException("SSIM sigma must be positive: " + sigma);
        }
        this.window = window;
        this.kernel = gaussianKernel(window, sigma);
    }

    public int getWindow() {
        return window;
    }

    /**
     * Mean SSIM over the rectangle, averaged across channels.
     */
    public double ssim(CanonicalImage a, CanonicalImage b, Rect rect) {
        ImageMetrics.checkPair(a, b, rect);
        double[][] pa = ImageMetrics.planes(a, rect);
        double[][] pb = ImageMetrics.planes(b, rect);
        double total = 0;
        for (int ch = 0; ch < pa.length; ch++) {
            total += compare(pa[ch], pb[ch], rect.width(), rect.height())[0];
        }
        return total / pa.length;
    }

    /**
     * Multi-scale SSIM with up to five scales. Between scales both images are reduced by
     * 2x2 averaging. The contrast-structure term is used at every scale but the last,
     * where the full SSIM is used. Negative terms are clamped to zero. Regions too small
     * for five scales use as many as fit, with the weights renormalized.
     */
    public double msSsim(CanonicalImage a, CanonicalImage b, Rect rect) {
        ImageMetrics.checkPair(a, b, rect);
        double[][] pa = ImageMetrics.planes(a, rect);
        double[][] pb = ImageMetrics.planes(b, rect);
        int w = rect.width();
        int h = rect.height();

        int scales = scaleCount(w, h);
        double weightSum = 0;
        for (int s = 0; s < scales; s++) {
            weightSum += MS_SSIM_WEIGHTS[s];
        }

        double result = 1.0;
        for (int s = 0; s < scales; s++) {
            double ssimSum = 0;
            double csSum = 0;
            for (int ch = 0; ch < pa.length; ch++) {
                double[] r = compare(pa[ch], pb[ch], w, h);
                ssimSum += r[0];
                csSum += r[1];
            }
            boolean last = s == scales - 1;
            double term = (last ? ssimSum : csSum) / pa.length;
            result *= Math.pow(Math.max(term, 0.0), MS_SSIM_WEIGHTS[s] / weightSum);

            if (!last) {
                for (int ch = 0; ch < pa.length; ch++) {
                    pa[ch] = downsample(pa[ch], w, h);
                    pb[ch] = downsample(pb[ch], w, h);
                }
                w /= 2;
                h /= 2;
            }
        }
        return result;
    }

    /**
     * Number of scales whose smallest side still covers the window, between 1 and 5.
     */
    int scaleCount(int width, int height) {
        int minSide = Math.min(width, height);
        int scales = 1;
        while (scales < MS_SSIM_WEIGHTS.length && (minSide >> scales) >= window) {
            scales++;
        }
        return scales;
    }

    /**
     * @return {@code [mean ssim, mean contrast-structure]} of two planes
     */
    double[] compare(double[] x, double[] y, int w, int h) {
        int n = w * h;
        double[] xx = new double[n];
        double[] yy = new double[n];
        double[] xy = new double[n];
        for (int i = 0; i < n; i++) {
            xx[i] = x[i] * x[i];
            yy[i] = y[i] * y[i];
            xy[i] = x[i] * y[i];
        }

        double[] muX = blur(x, w, h);
        double[] muY = blur(y, w, h);
        double[] sXX = blur(xx, w, h);
        double[] sYY = blur(yy, w, h);
        double[] sXY = blur(xy, w, h);

        double ssimSum = 0;
        double csSum = 0;
        for (int i = 0; i < n; i++) {
            double mx2 = muX[i] * muX[i];
            double my2 = muY[i] * muY[i];
            double mxy = muX[i] * muY[i];
            double varX = sXX[i] - mx2;
            double varY = sYY[i] - my2;
            double cov = sXY[i] - mxy;

            double cs = (2 * cov + C2) / (varX + varY + C2);
            double luminance = (2 * mxy + C1) / (mx2 + my2 + C1);
            ssimSum += luminance * cs;
            csSum += cs;
        }
        return new double[]{ssimSum / n, csSum / n};
    }

    /**
     * Separable Gaussian blur with reflect-101 borders.
     */
    double[] blur(double[] src, int w, int h) {
        int radius = kernel.length / 2;
        double[] tmp = new double[w * h];
        double[] out = new double[w * h];

        for (int y = 0; y < h; y++) {
            int row = y * w;
            for (int x = 0; x < w; x++) {
                double acc = 0;
                for (int k = -radius; k <= radius; k++) {
                    acc += kernel[k + radius] * src[row + reflect101(x + k, w)];
                }
                tmp[row + x] = acc;
            }
        }
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double acc = 0;
                for (int k = -radius; k <= radius; k++) {
                    acc += kernel[k + radius] * tmp[reflect101(y + k, h) * w + x];
                }
                out[y * w + x] = acc;
            }
        }
        return out;
    }

    /**
     * Mirrors an index into {@code [0, length)} without repeating the edge sample:
     * {@code -1 -> 1}, {@code length -> length - 2}.
     */
    static int reflect101(int p, int length) {
        if (length == 1) {
            return 0;
        }
        while (p < 0 || p >= length) {
            if (p < 0) {
                p = -p;
            } else {
                p = 2 * length - 2 - p;
            }
        }
        return p;
    }

    /**
     * 2x2 box average. An odd last row or column is dropped.
     */
    static double[] downsample(double[] src, int w, int h) {
        int nw = w / 2;
        int nh = h / 2;
        double[] out = new double[nw * nh];
        for (int y = 0; y < nh; y++) {
            for (int x = 0; x < nw; x++) {
                int i = 2 * y * w + 2 * x;
                out[y * nw + x] = (src[i] + src[i + 1] + src[i + w] + src[i + w + 1]) * 0.25;
            }
        }
        return out;
    }

    static double[] gaussianKernel(int size, double sigma) {
        double[] k = new double[size];
        int radius = size / 2;
        double sum = 0;
        for (int i = 0; i < size; i++) {
            double d = i - radius;
            k[i] = Math.exp(-(d * d) / (2 * sigma * sigma));
            sum += k[i];
        }
        for (int i = 0; i < size; i++) {
            k[i] /= sum;
        }
        return k;
    }
}
