package loci.imagestats.service.metrics;

import java.util.Arrays;

/**
 * Phase congruency map of a grayscale image after Kovesi, computed with a bank of
 * log-Gabor filters in the frequency domain.
 *
 * <p>The filter bank has 4 scales and 4 orientations, a minimum wavelength of 6 pixels
 * and a scale multiplier of 2. Noise energy is estimated per orientation from the median
 * response of the smallest scale and subtracted before the energies are summed.</p>
 */
final class PhaseCongruency {

    static final int SCALES = 4;
    static final int ORIENTATIONS = 4;
    static final double MIN_WAVELENGTH = 6;
    static final double MULT = 2;
    static final double SIGMA_ON_F = 0.55;
    static final double D_THETA_ON_SIGMA = 1.2;
    static final double NOISE_K = 2.0;
    static final double EPSILON = 1e-4;

    private PhaseCongruency() {
    }

    /**
     * @param image row-major samples
     * @return phase congruency in {@code [0, 1]} per pixel
     */
    static double[] compute(double[] image, int rows, int cols) {
        int n = rows * cols;
        double[] fftRe = image.clone();
        double[] fftIm = new double[n];
        Fft.transform2d(fftRe, fftIm, rows, cols, false);

        // frequency grid in fft order, origin at index 0
        double[] radius = new double[n];
        double[] sinTheta = new double[n];
        double[] cosTheta = new double[n];
        double[] lowPass = new double[n];
        for (int r = 0; r < rows; r++) {
            double fy = frequency(r, rows);
            for (int c = 0; c < cols; c++) {
                double fx = frequency(c, cols);
                int i = r * cols + c;
                double rad = Math.sqrt(fx * fx + fy * fy);
                lowPass[i] = 1.0 / (1.0 + Math.pow(rad / 0.45, 2 * 15));
                radius[i] = i == 0 ? 1.0 : rad;
                double theta = Math.atan2(-fy, fx);
                sinTheta[i] = Math.sin(theta);
                cosTheta[i] = Math.cos(theta);
            }
        }

        double[][] logGabor = new double[SCALES][n];
        double logSigma = 2 * Math.pow(Math.log(SIGMA_ON_F), 2);
        for (int s = 0; s < SCALES; s++) {
            double fo = 1.0 / (MIN_WAVELENGTH * Math.pow(MULT, s));
            for (int i = 0; i < n; i++) {
                double l = Math.log(radius[i] / fo);
                logGabor[s][i] = Math.exp(-(l * l) / logSigma) * lowPass[i];
            }
            logGabor[s][0] = 0;
        }

        double thetaSigma = Math.PI / ORIENTATIONS / D_THETA_ON_SIGMA;
        double[] energyAll = new double[n];
        double[] amplitudeAll = new double[n];
        double sqrtN = Math.sqrt(n);

        for (int o = 0; o < ORIENTATIONS; o++) {
            double angle = o * Math.PI / ORIENTATIONS;
            double cosA = Math.cos(angle);
            double sinA = Math.sin(angle);
            double[] spread = new double[n];
            for (int i = 0; i < n; i++) {
                double ds = sinTheta[i] * cosA - cosTheta[i] * sinA;
                double dc = cosTheta[i] * cosA + sinTheta[i] * sinA;
                double dTheta = Math.abs(Math.atan2(ds, dc));
                spread[i] = Math.exp(-(dTheta * dTheta) / (2 * thetaSigma * thetaSigma));
            }

            double[] sumE = new double[n];
            double[] sumO = new double[n];
            double[] sumAn = new double[n];
            double[][] evenResp = new double[SCALES][];
            double[][] oddResp = new double[SCALES][];
            double[][] spatialFilter = new double[SCALES][];
            double filterEnergy = 0;

            for (int s = 0; s < SCALES; s++) {
                double[] filter = new double[n];
                for (int i = 0; i < n; i++) {
                    filter[i] = logGabor[s][i] * spread[i];
                }
                if (s == 0) {
                    for (double f : filter) filterEnergy += f * f;
                }

                double[] fRe = filter.clone();
                double[] fIm = new double[n];
                Fft.transform2d(fRe, fIm, rows, cols, true);
                for (int i = 0; i < n; i++) {
                    fRe[i] *= sqrtN;
                }
                spatialFilter[s] = fRe;

                double[] eoRe = new double[n];
                double[] eoIm = new double[n];
                for (int i = 0; i < n; i++) {
                    eoRe[i] = fftRe[i] * filter[i];
                    eoIm[i] = fftIm[i] * filter[i];
                }
                Fft.transform2d(eoRe, eoIm, rows, cols, true);
                evenResp[s] = eoRe;
                oddResp[s] = eoIm;

                for (int i = 0; i < n; i++) {
                    sumAn[i] += Math.hypot(eoRe[i], eoIm[i]);
                    sumE[i] += eoRe[i];
                    sumO[i] += eoIm[i];
                }
            }

            double[] energy = new double[n];
            for (int i = 0; i < n; i++) {
                double xEnergy = Math.sqrt(sumE[i] * sumE[i] + sumO[i] * sumO[i]) + EPSILON;
                double meanE = sumE[i] / xEnergy;
                double meanO = sumO[i] / xEnergy;
                for (int s = 0; s < SCALES; s++) {
                    double e = evenResp[s][i];
                    double od = oddResp[s][i];
                    energy[i] += e * meanE + od * meanO - Math.abs(e * meanO - od * meanE);
                }
            }

            double[] smallest = new double[n];
            for (int i = 0; i < n; i++) {
                double e = evenResp[0][i];
                double od = oddResp[0][i];
                smallest[i] = e * e + od * od;
            }
            double meanE2n = -median(smallest) / Math.log(0.5);
            double noisePower = filterEnergy > 0 ? meanE2n / filterEnergy : 0;

            double sumAn2 = 0;
            double sumAiAj = 0;
            for (int i = 0; i < n; i++) {
                for (int si = 0; si < SCALES; si++) {
                    double a = spatialFilter[si][i];
                    sumAn2 += a * a;
                    for (int sj = si + 1; sj < SCALES; sj++) {
                        sumAiAj += a * spatialFilter[sj][i];
                    }
                }
            }
            double noiseEnergy2 = 2 * noisePower * sumAn2 + 4 * noisePower * sumAiAj;
            double tau = Math.sqrt(Math.max(noiseEnergy2, 0) / 2);
            double noiseMean = tau * Math.sqrt(Math.PI / 2);
            double noiseSigma = Math.sqrt((2 - Math.PI / 2) * tau * tau);
            double threshold = (noiseMean + NOISE_K * noiseSigma) / 1.7;

            for (int i = 0; i < n; i++) {
                energyAll[i] += Math.max(energy[i] - threshold, 0);
                amplitudeAll[i] += sumAn[i];
            }
        }

        double[] pc = new double[n];
        for (int i = 0; i < n; i++) {
            pc[i] = energyAll[i] / (amplitudeAll[i] + EPSILON);
        }
        return pc;
    }

    /**
     * Normalized frequency of index {@code i} in an unshifted spectrum of length
     * {@code n}: {@code 0, 1/n, ..., -1/n} for even n, divided by {@code n - 1} for odd n.
     */
    static double frequency(int i, int n) {
        int signed = i < (n + 1) / 2 ? i : i - n;
        int divisor = n % 2 == 0 ? n : Math.max(1, n - 1);
        return (double) signed / divisor;
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2;
    }
}
