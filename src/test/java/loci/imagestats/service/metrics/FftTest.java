package loci.imagestats.service.metrics;

import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FftTest {

    private static double[][] naiveDft(double[] re, double[] im) {
        int n = re.length;
        double[] outRe = new double[n];
        double[] outIm = new double[n];
        for (int k = 0; k < n; k++) {
            for (int j = 0; j < n; j++) {
                double angle = -2 * Math.PI * k * j / n;
                outRe[k] += re[j] * Math.cos(angle) - im[j] * Math.sin(angle);
                outIm[k] += re[j] * Math.sin(angle) + im[j] * Math.cos(angle);
            }
        }
        return new double[][]{outRe, outIm};
    }

    private static double[] random(int n, long seed) {
        Random r = new Random(seed);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = r.nextDouble() - 0.5;
        }
        return out;
    }

    @Test
    @DisplayName("Power-of-two and arbitrary lengths match the naive DFT")
    void testMatchesNaiveDft() {
        for (int n : new int[]{1, 2, 6, 8, 13, 30}) {
            double[] re = random(n, n);
            double[] im = random(n, n + 100);
            double[][] expected = naiveDft(re, im);

            Fft.transform(re, im, false);

            assertArrayEquals(expected[0], re, 1e-9, "re, n=" + n);
            assertArrayEquals(expected[1], im, 1e-9, "im, n=" + n);
        }
    }

    @Test
    @DisplayName("Inverse transform reproduces the input")
    void testRoundTrip() {
        double[] re = random(12, 1);
        double[] im = random(12, 2);
        double[] re0 = re.clone();
        double[] im0 = im.clone();

        Fft.transform2d(re, im, 3, 4, false);
        Fft.transform2d(re, im, 3, 4, true);

        assertArrayEquals(re0, re, 1e-12);
        assertArrayEquals(im0, im, 1e-12);
    }

    @Test
    @DisplayName("Mismatched parts are rejected")
    void testMismatch() {
        assertThrows(IllegalArgumentException.class, () -> Fft.transform(new double[4], new double[3], false));
    }
}
