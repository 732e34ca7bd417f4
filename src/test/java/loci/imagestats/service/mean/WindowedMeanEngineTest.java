package loci.imagestats.service.mean;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import loci.imagestats.image.CanonicalImage;
import loci.imagestats.image.ImageNormalizer;
import loci.imagestats.image.NumericKind;
import loci.imagestats.image.Rect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WindowedMeanEngine}. Builds are queued on a manual executor so that
 * each test decides when the background work runs.
 */
class WindowedMeanEngineTest {

    private final List<Runnable> pending = new ArrayList<>();
    private WindowedMeanEngine engine;

    @BeforeEach
    void setUp() {
        engine = new WindowedMeanEngine(pending::add);
    }

    private void runPending() {
        List<Runnable> tasks = new ArrayList<>(pending);
        pending.clear();
        tasks.forEach(Runnable::run);
    }

    /** Two channel image whose channel 0 is x + 10y and channel 1 is constant 0.5. */
    private static CanonicalImage gradient(int w, int h) {
        float[] samples = new float[w * h * 2];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                samples[(y * w + x) * 2] = x + 10 * y;
                samples[(y * w + x) * 2 + 1] = 0.5f;
            }
        }
        return ImageNormalizer.fromSamples(w, h, 2, NumericKind.FLOAT32, samples);
    }

    @Test
    @DisplayName("Uniform image has a mean of one on every axis")
    void testUniformImage() {
        float[] ones = new float[4 * 4 * 3];
        Arrays.fill(ones, 1f);
        CanonicalImage image = ImageNormalizer.fromSamples(4, 4, 3, NumericKind.UINT8, ones);
        Rect rect = new Rect(0, 0, 4, 4);

        assertArrayEquals(new double[]{1, 1, 1}, engine.query(image, rect, MeanAxis.ALL), 1e-9);
        double[] columns = engine.query(image, rect, MeanAxis.COLUMN);
        assertEquals(12, columns.length);
        for (double v : columns) {
            assertEquals(1.0, v, 1e-9);
        }
    }

    @Test
    @DisplayName("Column and row means are channel-interleaved")
    void testAxisLayout() {
        CanonicalImage image = gradient(3, 2);
        Rect rect = new Rect(0, 0, 3, 2);

        assertArrayEquals(new double[]{0 + 5, 0.5, 1 + 5, 0.5, 2 + 5, 0.5},
                engine.query(image, rect, MeanAxis.COLUMN), 1e-9);
        assertArrayEquals(new double[]{1, 0.5, 11, 0.5},
                engine.query(image, rect, MeanAxis.ROW), 1e-9);
        assertArrayEquals(new double[]{6, 0.5}, engine.query(image, rect, MeanAxis.ALL), 1e-9);
    }

    @Test
    @DisplayName("Cached answers match direct summation")
    void testCachedMatchesDirect() {
        CanonicalImage image = gradient(7, 5);
        Rect rect = new Rect(2, 1, 4, 3);

        double[] directAll = engine.query(image, rect, MeanAxis.ALL);
        assertEquals(MeanEngineState.PRECOMPUTING, engine.state());
        runPending();
        assertEquals(MeanEngineState.CACHED, engine.state());

        for (MeanAxis axis : MeanAxis.values()) {
            assertArrayEquals(WindowedMeanEngine.directMean(image, rect, axis),
                    engine.query(image, rect, axis), 1e-9, axis.name());
        }
        assertArrayEquals(directAll, engine.query(image, rect, MeanAxis.ALL), 1e-9);
        assertTrue(pending.isEmpty(), "no second build for the same image");
    }

    @Test
    @DisplayName("State follows bind, build and rebind")
    void testStateTransitions() {
        assertEquals(MeanEngineState.IDLE, engine.state());

        CanonicalImage first = gradient(4, 4);
        engine.rebind(first);
        assertEquals(MeanEngineState.BOUND_NO_CACHE, engine.state());

        engine.precomputeAsync(first);
        assertEquals(MeanEngineState.PRECOMPUTING, engine.state());
        runPending();
        assertEquals(MeanEngineState.CACHED, engine.state());

        // querying or warming the bound image keeps the cache
        engine.query(first, new Rect(0, 0, 4, 4), MeanAxis.ALL);
        engine.precomputeAsync(first);
        assertEquals(MeanEngineState.CACHED, engine.state());
        assertTrue(pending.isEmpty());

        engine.rebind(gradient(4, 4));
        assertEquals(MeanEngineState.BOUND_NO_CACHE, engine.state());

        engine.rebind(null);
        assertEquals(MeanEngineState.IDLE, engine.state());
    }

    @Test
    @DisplayName("Explicit rebind of the bound image drops its cache")
    void testRebindSameImageInvalidates() {
        CanonicalImage image = gradient(4, 4);
        Rect rect = new Rect(0, 0, 4, 4);
        engine.precomputeAsync(image);
        runPending();
        assertEquals(MeanEngineState.CACHED, engine.state());

        engine.rebind(image);
        assertEquals(MeanEngineState.BOUND_NO_CACHE, engine.state());

        // next query is served directly and starts a fresh build
        assertArrayEquals(WindowedMeanEngine.directMean(image, rect, MeanAxis.ALL),
                engine.query(image, rect, MeanAxis.ALL), 1e-9);
        assertEquals(MeanEngineState.PRECOMPUTING, engine.state());
        assertEquals(1, pending.size());
        runPending();
        assertEquals(MeanEngineState.CACHED, engine.state());
    }

    @Test
    @DisplayName("Build in flight during a rebind of the same image is discarded")
    void testRebindSameImageDuringBuild() {
        CanonicalImage image = gradient(4, 4);
        engine.precomputeAsync(image);
        engine.rebind(image);
        runPending();

        assertEquals(MeanEngineState.BOUND_NO_CACHE, engine.state());
    }

    @Test
    @DisplayName("Build finishing after a rebind is discarded")
    void testStaleBuildDiscarded() {
        CanonicalImage first = gradient(4, 4);
        CanonicalImage second = gradient(5, 5);

        engine.precomputeAsync(first);
        engine.rebind(second);
        runPending();

        assertEquals(MeanEngineState.BOUND_NO_CACHE, engine.state());
        assertArrayEquals(WindowedMeanEngine.directMean(second, new Rect(0, 0, 5, 5), MeanAxis.ALL),
                engine.query(second, new Rect(0, 0, 5, 5), MeanAxis.ALL), 1e-9);
    }

    @Test
    @DisplayName("Rectangles with no area give an empty result")
    void testZeroArea() {
        CanonicalImage image = gradient(4, 4);

        assertEquals(0, engine.query(image, new Rect(1, 1, 0, 3), MeanAxis.ALL).length);
        assertEquals(0, engine.query(image, new Rect(10, 10, 3, 0), MeanAxis.ROW).length);
    }

    @Test
    @DisplayName("Rectangles outside the image are rejected")
    void testOutOfBounds() {
        CanonicalImage image = gradient(4, 4);

        assertThrows(IndexOutOfBoundsException.class,
                () -> engine.query(image, new Rect(2, 2, 3, 1), MeanAxis.ALL));
        assertThrows(IndexOutOfBoundsException.class,
                () -> engine.query(image, new Rect(-1, 0, 2, 2), MeanAxis.COLUMN));
        IndexOutOfBoundsException e = assertThrows(IndexOutOfBoundsException.class,
                () -> engine.query(image, new Rect(Integer.MAX_VALUE - 1, 0, 10, 1), MeanAxis.ALL));
        assertTrue(e.getMessage().contains("outside"));
        assertThrows(IllegalArgumentException.class,
                () -> engine.query(null, new Rect(0, 0, 1, 1), MeanAxis.ALL));
    }

    @Test
    @DisplayName("Rejected build leaves the image in direct mode for good")
    void testRejectedBuildStaysDirect() {
        int[] attempts = {0};
        WindowedMeanEngine rejecting = new WindowedMeanEngine(task -> {
            attempts[0]++;
            throw new RejectedExecutionException("saturated");
        });
        CanonicalImage image = gradient(4, 3);
        Rect rect = new Rect(0, 0, 4, 3);

        double[] first = rejecting.query(image, rect, MeanAxis.ROW);
        double[] second = rejecting.query(image, rect, MeanAxis.ROW);

        assertEquals(1, attempts[0]);
        assertEquals(MeanEngineState.BOUND_NO_CACHE, rejecting.state());
        assertArrayEquals(first, second, 1e-9);
        assertArrayEquals(WindowedMeanEngine.directMean(image, rect, MeanAxis.ROW), first, 1e-9);
    }

    @Test
    @DisplayName("Default engine builds on a background thread")
    void testDefaultEngineBuildsInBackground() throws InterruptedException {
        WindowedMeanEngine background = new WindowedMeanEngine();
        CanonicalImage image = gradient(64, 64);
        background.precomputeAsync(image);

        for (int i = 0; i < 500 && background.state() != MeanEngineState.CACHED; i++) {
            Thread.sleep(10);
        }
        assertEquals(MeanEngineState.CACHED, background.state());
        assertArrayEquals(new double[]{31.5 + 315, 0.5},
                background.query(image, new Rect(0, 0, 64, 64), MeanAxis.ALL), 1e-6);
    }
}
