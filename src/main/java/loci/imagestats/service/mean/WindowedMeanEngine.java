package loci.imagestats.service.mean;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import loci.imagestats.image.CanonicalImage;
import loci.imagestats.image.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers rectangle mean queries on the currently bound image.
 *
 * <p>The first query after an image is bound starts building an {@link IntegralImage}
 * in the background and is itself answered by direct summation, as is every query until
 * the build completes. Once the table is ready, queries cost four lookups per output
 * value. Binding another image discards the table; a build still running for the old
 * image finishes and its result is dropped.</p>
 *
 * <p>A build that fails leaves the engine in direct mode for that image. It is not
 * retried until an image is bound again with {@link #rebind}.</p>
 *
 * <p>Results are channel-interleaved: {@code ALL} yields {@code c} values, {@code COLUMN}
 * yields {@code width * c} values ordered {@code [col0ch0, col0ch1, ..., col1ch0, ...]},
 * {@code ROW} yields {@code height * c} values in the same manner.</p>
 */
public class WindowedMeanEngine {
    private static final Logger logger = LoggerFactory.getLogger(WindowedMeanEngine.class);

    private enum Phase {
        NOT_STARTED,
        IN_FLIGHT,
        READY,
        FAILED
    }

    /**
     * Cache slot for one image id. {@code integral} is set only in {@link Phase#READY}.
     */
    private record CacheSlot(Phase phase, long imageId, IntegralImage integral) {

        static CacheSlot notStarted(long imageId) {
            return new CacheSlot(Phase.NOT_STARTED, imageId, null);
        }

        static CacheSlot inFlight(long imageId) {
            return new CacheSlot(Phase.IN_FLIGHT, imageId, null);
        }

        static CacheSlot ready(IntegralImage integral) {
            return new CacheSlot(Phase.READY, integral.imageId(), integral);
        }

        static CacheSlot failed(long imageId) {
            return new CacheSlot(Phase.FAILED, imageId, null);
        }
    }

    private final Executor executor;
    private final Object lock = new Object();

    // guarded by lock
    private CanonicalImage boundImage;
    private CacheSlot slot;

    /**
     * Creates an engine that builds each integral image on a new daemon thread.
     */
    public WindowedMeanEngine() {
        this(task -> {
            Thread t = new Thread(task, "IntegralImageBuilder");
            t.setDaemon(true);
            t.start();
        });
    }

    public WindowedMeanEngine(Executor executor) {
        this.executor = executor;
    }

    /**
     * Binds an image and drops whatever cache state the engine had, even when the image is
     * the one already bound. Binding null returns the engine to {@link MeanEngineState#IDLE}.
     */
    public void rebind(CanonicalImage image) {
        synchronized (lock) {
            boundImage = image;
            slot = image == null ? null : CacheSlot.notStarted(image.id());
        }
        if (image != null) {
            logger.debug("Bound image {}", image.id());
        }
    }

    /**
     * Binds {@code image} unless it is already the bound image, in which case the cache is
     * kept.
     */
    private void bind(CanonicalImage image) {
        synchronized (lock) {
            if (boundImage != null && image.id() == boundImage.id()) {
                return;
            }
        }
        rebind(image);
    }

    /**
     * Binds the image and starts the integral build without waiting for a query.
     */
    public void precomputeAsync(CanonicalImage image) {
        if (image == null) {
            rebind(null);
            return;
        }
        bind(image);
        startBuildIfNeeded(image);
    }

    /**
     * Mean of the rectangle along an axis. Binds {@code image} if it is not the bound
     * image, keeping the cache otherwise. Never waits for a background build.
     *
     * @return the channel-interleaved means; empty if the rectangle has no area
     * @throws IndexOutOfBoundsException if the rectangle is not inside the image
     */
    public double[] query(CanonicalImage image, Rect rect, MeanAxis axis) {
        if (image == null) {
            throw new IllegalArgumentException("No image to query");
        }
        bind(image);

        if (rect.area() == 0) {
            return new double[0];
        }
        if (!rect.isInside(image.spec().bounds())) {
            throw new IndexOutOfBoundsException(String.format("Rectangle %s outside %dx%d image",
                    rect, image.width(), image.height()));
        }

        IntegralImage integral = startBuildIfNeeded(image);
        if (integral != null) {
            return cachedMean(integral, rect, axis);
        }
        return directMean(image, rect, axis);
    }

    public MeanEngineState state() {
        synchronized (lock) {
            if (boundImage == null) {
                return MeanEngineState.IDLE;
            }
            return switch (slot.phase()) {
                case NOT_STARTED, FAILED -> MeanEngineState.BOUND_NO_CACHE;
                case IN_FLIGHT -> MeanEngineState.PRECOMPUTING;
                case READY -> MeanEngineState.CACHED;
            };
        }
    }

    /**
     * Starts the build for {@code image} if its slot has not been started yet.
     *
     * @return the integral image if it is already available, otherwise null
     */
    private IntegralImage startBuildIfNeeded(CanonicalImage image) {
        synchronized (lock) {
            if (slot == null || slot.imageId() != image.id()) {
                return null;
            }
            if (slot.phase() == Phase.READY) {
                return slot.integral();
            }
            if (slot.phase() != Phase.NOT_STARTED) {
                return null;
            }
            slot = CacheSlot.inFlight(image.id());
        }

        try {
            executor.execute(() -> build(image));
        } catch (RejectedExecutionException e) {
            logger.warn("Integral image build for image {} was rejected, staying in direct mode", image.id(), e);
            complete(image.id(), null);
        }
        return null;
    }

    private void build(CanonicalImage image) {
        long start = System.currentTimeMillis();
        IntegralImage integral = null;
        try {
            integral = IntegralImage.build(image);
            logger.debug("Built integral image for image {} in {} ms", image.id(),
                    System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            logger.warn("Integral image build for image {} failed, staying in direct mode", image.id(), e);
        }
        complete(image.id(), integral);
    }

    private void complete(long imageId, IntegralImage integral) {
        synchronized (lock) {
            if (slot == null || slot.imageId() != imageId || slot.phase() != Phase.IN_FLIGHT) {
                logger.debug("Discarding stale integral image for image {}", imageId);
                return;
            }
            slot = integral != null ? CacheSlot.ready(integral) : CacheSlot.failed(imageId);
        }
    }

    static double[] cachedMean(IntegralImage ii, Rect rect, MeanAxis axis) {
        int c = ii.channels();
        int x0 = rect.x();
        int y0 = rect.y();
        int x1 = rect.maxX();
        int y1 = rect.maxY();

        switch (axis) {
            case ALL -> {
                double area = (double) rect.area();
                double[] out = new double[c];
                for (int ch = 0; ch < c; ch++) {
                    out[ch] = ii.sum(x0, y0, x1, y1, ch) / area;
                }
                return out;
            }
            case COLUMN -> {
                double rows = rect.height();
                double[] out = new double[rect.width() * c];
                for (int i = 0; i < rect.width(); i++) {
                    for (int ch = 0; ch < c; ch++) {
                        out[i * c + ch] = ii.sum(x0 + i, y0, x0 + i + 1, y1, ch) / rows;
                    }
                }
                return out;
            }
            case ROW -> {
                double cols = rect.width();
                double[] out = new double[rect.height() * c];
                for (int j = 0; j < rect.height(); j++) {
                    for (int ch = 0; ch < c; ch++) {
                        out[j * c + ch] = ii.sum(x0, y0 + j, x1, y0 + j + 1, ch) / cols;
                    }
                }
                return out;
            }
            default -> throw new IllegalArgumentException("Unknown axis: " + axis);
        }
    }

    static double[] directMean(CanonicalImage image, Rect rect, MeanAxis axis) {
        int c = image.channels();
        int w = image.width();
        float[] samples = image.samples();
        int rw = rect.width();
        int rh = rect.height();

        double[] out = new double[switch (axis) {
            case ALL -> c;
            case COLUMN -> rw * c;
            case ROW -> rh * c;
        }];

        for (int j = 0; j < rh; j++) {
            int rowStart = ((rect.y() + j) * w + rect.x()) * c;
            for (int i = 0; i < rw; i++) {
                int base = rowStart + i * c;
                for (int ch = 0; ch < c; ch++) {
                    double v = samples[base + ch];
                    switch (axis) {
                        case ALL -> out[ch] += v;
                        case COLUMN -> out[i * c + ch] += v;
                        case ROW -> out[j * c + ch] += v;
                    }
                }
            }
        }

        double divisor = switch (axis) {
            case ALL -> (double) rect.area();
            case COLUMN -> rh;
            case ROW -> rw;
        };
        for (int k = 0; k < out.length; k++) {
            out[k] /= divisor;
        }
        return out;
    }
}
