package loci.imagestats.service.metrics;

/**
 * In-place complex FFT of any length. Powers of two use iterative radix-2; other
 * lengths go through Bluestein's chirp-z algorithm.
 *
 * <p>The inverse transform is scaled by {@code 1/n}, so a forward then inverse
 * transform reproduces the input.</p>
 */
final class Fft {

    private Fft() {
    }

    static void transform(double[] re, double[] im, boolean inverse) {
        int n = re.length;
        if (n != im.length) {
            throw new IllegalArgumentException("Real and imaginary parts differ in length");
        }
        if (n == 0) {
            return;
        }
        if ((n & (n - 1)) == 0) {
            radix2(re, im, inverse);
        } else {
            bluestein(re, im, inverse);
        }
        if (inverse) {
            for (int i = 0; i < n; i++) {
                re[i] /= n;
                im[i] /= n;
            }
        }
    }

    /**
     * 2D transform of a row-major {@code rows x cols} array: every row, then every column.
     */
    static void transform2d(double[] re, double[] im, int rows, int cols, boolean inverse) {
        double[] rowRe = new double[cols];
        double[] rowIm = new double[cols];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(re, r * cols, rowRe, 0, cols);
            System.arraycopy(im, r * cols, rowIm, 0, cols);
            transform(rowRe, rowIm, inverse);
            System.arraycopy(rowRe, 0, re, r * cols, cols);
            System.arraycopy(rowIm, 0, im, r * cols, cols);
        }

        double[] colRe = new double[rows];
        double[] colIm = new double[rows];
        for (int c = 0; c < cols; c++) {
            for (int r = 0; r < rows; r++) {
                colRe[r] = re[r * cols + c];
                colIm[r] = im[r * cols + c];
            }
            transform(colRe, colIm, inverse);
            for (int r = 0; r < rows; r++) {
                re[r * cols + c] = colRe[r];
                im[r * cols + c] = colIm[r];
            }
        }
    }

    // unscaled; sign of the exponent is + for the inverse
    private static void radix2(double[] re, double[] im, boolean inverse) {
        int n = re.length;
        for (int i = 1, j = 0; i < n; i++) {
            int bit = n >> 1;
            for (; (j & bit) != 0; bit >>= 1) {
                j ^= bit;
            }
            j ^= bit;
            if (i < j) {
                double t = re[i];
                re[i] = re[j];
                re[j] = t;
                t = im[i];
                im[i] = im[j];
                im[j] = t;
            }
        }

        for (int len = 2; len <= n; len <<= 1) {
            double angle = 2 * Math.PI / len * (inverse ? 1 : -1);
            double wRe = Math.cos(angle);
            double wIm = Math.sin(angle);
            int half = len >> 1;
            for (int i = 0; i < n; i += len) {
                double curRe = 1;
                double curIm = 0;
                for (int k = 0; k < half; k++) {
                    int a = i + k;
                    int b = a + half;
                    double tRe = re[b] * curRe - im[b] * curIm;
                    double tIm = re[b] * curIm + im[b] * curRe;
                    re[b] = re[a] - tRe;
                    im[b] = im[a] - tIm;
                    re[a] += tRe;
                    im[a] += tIm;
                    double nextRe = curRe * wRe - curIm * wIm;
                    curIm = curRe * wIm + curIm * wRe;
                    curRe = nextRe;
                }
            }
        }
    }

    // unscaled
    private static void bluestein(double[] re, double[] im, boolean inverse) {
        int n = re.length;
        int m = Integer.highestOneBit(2 * n - 1);
        if (m < 2 * n - 1) {
            m <<= 1;
        }

        double sign = inverse ? 1 : -1;
        double[] cosTable = new double[n];
        double[] sinTable = new double[n];
        for (int i = 0; i < n; i++) {
            // i*i mod 2n keeps the angle argument small for large n
            long k = ((long) i * i) % (2L * n);
            double angle = sign * Math.PI * k / n;
            cosTable[i] = Math.cos(angle);
            sinTable[i] = Math.sin(angle);
        }

        double[] aRe = new double[m];
        double[] aIm = new double[m];
        for (int i = 0; i < n; i++) {
            aRe[i] = re[i] * cosTable[i] - im[i] * sinTable[i];
            aIm[i] = re[i] * sinTable[i] + im[i] * cosTable[i];
        }

        double[] bRe = new double[m];
        double[] bIm = new double[m];
        bRe[0] = cosTable[0];
        bIm[0] = -sinTable[0];
        for (int i = 1; i < n; i++) {
            bRe[i] = bRe[m - i] = cosTable[i];
            bIm[i] = bIm[m - i] = -sinTable[i];
        }

        radix2(aRe, aIm, false);
        radix2(bRe, bIm, false);
        for (int i = 0; i < m; i++) {
            double r = aRe[i] * bRe[i] - aIm[i] * bIm[i];
            aIm[i] = aRe[i] * bIm[i] + aIm[i] * bRe[i];
            aRe[i] = r;
        }
        radix2(aRe, aIm, true);

        for (int i = 0; i < n; i++) {
            double cRe = aRe[i] / m;
            double cIm = aIm[i] / m;
            re[i] = cRe * cosTable[i] - cIm * sinTable[i];
            im[i] = cRe * sinTable[i] + cIm * cosTable[i];
        }
    }
}
