package loci.imagestats.service.metrics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import loci.imagestats.image.CanonicalImage;
import loci.imagestats.image.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs metric computations off the caller's thread, at most one per {@link MetricKind}
 * at a time.
 *
 * <p>Submitting a kind that is idle starts it immediately. Submitting a kind that is
 * already running starts nothing and only marks the kind as having a pending request.
 * When the running computation's result is drained it is flagged
 * {@link MetricUpdate#stillPending() stillPending}, and the kind is idle again, so the
 * caller re-submits once with its current inputs. Whatever arrived during a
 * computation therefore leads to exactly one more computation, never two at once.</p>
 *
 * <p>The caller polls {@link #drain()} for finished results. A computation that throws
 * produces NaN values of the kind's result size.</p>
 */
public class QualityMetricsWorker {
    private static final Logger logger = LoggerFactory.getLogger(QualityMetricsWorker.class);

    private enum Phase {
        IDLE,
        RUNNING,
        RUNNING_WITH_PENDING_RERUN
    }

    private record Request(MetricComputation computation, int resultSize) {
    }

    private final Executor executor;
    private final StructuralSimilarity structuralSimilarity;
    private final Queue<MetricResult> completed = new ConcurrentLinkedQueue<>();

    // guarded by slots
    private final Map<MetricKind, Phase> slots = new EnumMap<>(MetricKind.class);

    /**
     * Creates a worker that runs each computation on a new daemon thread.
     */
    public QualityMetricsWorker() {
        this(new StructuralSimilarity());
    }

    public QualityMetricsWorker(StructuralSimilarity structuralSimilarity) {
        this(task -> {
            Thread t = new Thread(task, "QualityMetricsWorker");
            t.setDaemon(true);
            t.start();
        }, structuralSimilarity);
    }

    public QualityMetricsWorker(Executor executor, StructuralSimilarity structuralSimilarity) {
        this.executor = executor;
        this.structuralSimilarity = structuralSimilarity;
        for (MetricKind kind : MetricKind.values()) {
            slots.put(kind, Phase.IDLE);
        }
    }

    /**
     * Submits a single-valued computation.
     */
    public boolean submit(MetricKind kind, MetricComputation computation) {
        return submit(kind, computation, kind.resultSize(1));
    }

    /**
     * Submits a computation, or marks the kind pending if one is already running.
     *
     * @param resultSize number of NaN values reported if the computation fails
     * @return true if the computation was started
     */
    public boolean submit(MetricKind kind, MetricComputation computation, int resultSize) {
        synchronized (slots) {
            if (slots.get(kind) != Phase.IDLE) {
                slots.put(kind, Phase.RUNNING_WITH_PENDING_RERUN);
                logger.debug("{} already running, marked pending", kind);
                return false;
            }
            slots.put(kind, Phase.RUNNING);
        }
        start(kind, new Request(computation, resultSize));
        return true;
    }

    /**
     * Returns every result finished since the last call and makes those kinds idle.
     * An update is marked {@code stillPending} if its kind was submitted again while it
     * was computing; the caller re-submits it to get values for its current inputs.
     */
    public List<MetricUpdate> drain() {
        List<MetricUpdate> updates = new ArrayList<>();
        MetricResult result;
        while ((result = completed.poll()) != null) {
            boolean stillPending;
            synchronized (slots) {
                stillPending = slots.get(result.kind()) == Phase.RUNNING_WITH_PENDING_RERUN;
                slots.put(result.kind(), Phase.IDLE);
            }
            updates.add(new MetricUpdate(result.kind(), result.values(), stillPending));
        }
        return updates;
    }

    /** True if a computation of this kind is running or waiting to be drained. */
    public boolean isRunning(MetricKind kind) {
        synchronized (slots) {
            return slots.get(kind) != Phase.IDLE;
        }
    }

    /** True if this kind was submitted again while its computation was running. */
    public boolean hasPendingRerun(MetricKind kind) {
        synchronized (slots) {
            return slots.get(kind) == Phase.RUNNING_WITH_PENDING_RERUN;
        }
    }

    private void start(MetricKind kind, Request request) {
        try {
            executor.execute(() -> run(kind, request));
        } catch (RejectedExecutionException e) {
            logger.warn("{} computation was rejected", kind, e);
            completed.add(new MetricResult(kind, nan(request.resultSize())));
        }
    }

    private void run(MetricKind kind, Request request) {
        double[] values = null;
        try {
            values = request.computation().compute();
        } catch (Exception e) {
            logger.warn("Error computing {}: {}", kind, e.getMessage(), e);
        } finally {
            // posted even when an Error escapes, so the kind never stays busy
            completed.add(new MetricResult(kind, values != null ? values : nan(request.resultSize())));
        }
    }

    private static double[] nan(int size) {
        double[] values = new double[size];
        Arrays.fill(values, Double.NaN);
        return values;
    }

    // Convenience submitters. A null or empty image schedules nothing.

    public boolean submitMinMax(CanonicalImage image, Rect rect, double scale) {
        if (isEmpty(image)) {
            return false;
        }
        submit(MetricKind.MIN_MAX, () -> ImageMetrics.minMax(image, rect, scale),
                MetricKind.MIN_MAX.resultSize(image.channels()));
        return true;
    }

    public boolean submitStdDev(CanonicalImage image, Rect rect) {
        if (isEmpty(image)) {
            return false;
        }
        submit(MetricKind.STD_DEV, () -> ImageMetrics.stdDev(image, rect),
                MetricKind.STD_DEV.resultSize(image.channels()));
        return true;
    }

    public boolean submitMse(CanonicalImage a, CanonicalImage b, Rect rect) {
        if (isEmpty(a) || isEmpty(b)) {
            return false;
        }
        submit(MetricKind.MSE, () -> new double[]{ImageMetrics.mse(a, b, rect)});
        return true;
    }

    public boolean submitMae(CanonicalImage a, CanonicalImage b, Rect rect) {
        if (isEmpty(a) || isEmpty(b)) {
            return false;
        }
        submit(MetricKind.MAE, () -> new double[]{ImageMetrics.mae(a, b, rect)});
        return true;
    }

    /**
     * @param dataRange peak value of the canonical samples
     * @param scale     factor converting the reported RMSE to display units
     */
    public boolean submitPsnr(CanonicalImage a, CanonicalImage b, double dataRange, double scale, Rect rect) {
        if (isEmpty(a) || isEmpty(b)) {
            return false;
        }
        submit(MetricKind.PSNR, () -> ImageMetrics.psnr(a, b, rect, dataRange, scale),
                MetricKind.PSNR.resultSize(a.channels()));
        return true;
    }

    public boolean submitSsim(CanonicalImage a, CanonicalImage b, Rect rect) {
        if (isEmpty(a) || isEmpty(b)) {
            return false;
        }
        submit(MetricKind.SSIM, () -> new double[]{structuralSimilarity.ssim(a, b, rect)});
        return true;
    }

    public boolean submitMsSsim(CanonicalImage a, CanonicalImage b, Rect rect) {
        if (isEmpty(a) || isEmpty(b)) {
            return false;
        }
        submit(MetricKind.MS_SSIM, () -> new double[]{structuralSimilarity.msSsim(a, b, rect)});
        return true;
    }

    public boolean submitFsim(CanonicalImage a, CanonicalImage b, Rect rect) {
        if (isEmpty(a) || isEmpty(b)) {
            return false;
        }
        submit(MetricKind.FSIM, () -> new double[]{FeatureSimilarity.fsim(a, b, rect)});
        return true;
    }

    private static boolean isEmpty(CanonicalImage image) {
        return image == null || image.spec().isEmpty();
    }
}
