package loci.imagestats.controller;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import loci.imagestats.asset.Asset;
import loci.imagestats.asset.AssetLoader;
import loci.imagestats.image.CanonicalImage;
import loci.imagestats.image.ImageNormalizer;
import loci.imagestats.image.NumericKind;
import loci.imagestats.image.Rect;
import loci.imagestats.service.mean.MeanAxis;
import loci.imagestats.service.mean.WindowedMeanEngine;
import loci.imagestats.service.metrics.MetricKind;
import loci.imagestats.service.metrics.MetricUpdate;
import loci.imagestats.service.metrics.QualityMetricsWorker;
import loci.imagestats.service.metrics.StructuralSimilarity;
import loci.imagestats.service.socket.ConnectionEvent;
import loci.imagestats.service.socket.FrameIngestionListener;
import loci.imagestats.service.socket.ListenerSettings;
import loci.imagestats.utilities.EngineConfigManager;
import loci.imagestats.utilities.SessionLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Facade over the listener, the windowed mean engine and the metrics worker.
 *
 * <p>The consumer owns one controller and calls it from a single thread, typically once
 * per frame of its own loop:</p>
 * <pre>{@code
 * for (Asset asset : controller.pollAssets()) { ... }
 * for (ConnectionEvent event : controller.pollConnectionEvents()) { ... }
 * for (MetricUpdate update : controller.drainMetrics()) { ... }
 * }</pre>
 *
 * <p>None of the facade methods block on network activity or on a metric computation.</p>
 */
public class ImageStatsController implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ImageStatsController.class);

    private final FrameIngestionListener listener;
    private final WindowedMeanEngine meanEngine;
    private final QualityMetricsWorker metricsWorker;
    private final AssetLoader assetLoader;
    private final double psnrDataRange;
    private final String sessionDir;

    private SessionLogger.Session logSession;

    public ImageStatsController(FrameIngestionListener listener,
                                WindowedMeanEngine meanEngine,
                                QualityMetricsWorker metricsWorker,
                                AssetLoader assetLoader,
                                double psnrDataRange,
                                String sessionDir) {
        this.listener = listener;
        this.meanEngine = meanEngine;
        this.metricsWorker = metricsWorker;
        this.assetLoader = assetLoader;
        this.psnrDataRange = psnrDataRange;
        this.sessionDir = sessionDir;
    }

    /**
     * Builds a controller from configuration. Nothing is bound until {@link #start()}.
     */
    public static ImageStatsController fromConfig(EngineConfigManager config) {
        ListenerSettings defaults = ListenerSettings.defaults();
        ListenerSettings settings = new ListenerSettings(
                config.getStringOrDefault(defaults.host(), "listener", "host"),
                config.getIntegerOrDefault(defaults.port(), "listener", "port"),
                config.getBooleanOrDefault(defaults.activeOnStart(), "listener", "active_on_start"),
                config.getIntegerOrDefault(defaults.readTimeoutMs(), "listener", "read_timeout_ms"),
                config.getLongOrDefault(defaults.idleSleepMs(), "listener", "idle_sleep_ms"),
                config.getIntegerOrDefault(defaults.acceptPollMs(), "listener", "accept_poll_ms"),
                config.getLongOrDefault(defaults.maxMessageBytes(), "listener", "max_message_bytes")
        );

        StructuralSimilarity ssim = new StructuralSimilarity(
                config.getIntegerOrDefault(11, "metrics", "ssim_window"),
                config.getDoubleOrDefault(1.5, "metrics", "ssim_sigma"));

        return new ImageStatsController(
                new FrameIngestionListener(settings),
                new WindowedMeanEngine(),
                new QualityMetricsWorker(ssim),
                new AssetLoader(),
                config.getDoubleOrDefault(1.0, "metrics", "psnr_data_range"),
                config.getString("logging", "session_dir"));
    }

    /**
     * Starts the session log, if configured, and the listener.
     *
     * @throws IOException if no port could be bound
     */
    public void start() throws IOException {
        if (sessionDir != null && !sessionDir.isBlank() && logSession == null) {
            logSession = SessionLogger.start(new File(sessionDir));
        }
        listener.start();
        logger.info("Image stats engine listening on {}", listener.boundAddress());
    }

    // Listener

    public void setListenerActive(boolean active) {
        listener.setActive(active);
    }

    public boolean isListenerActive() {
        return listener.isActive();
    }

    public boolean isReceiving() {
        return listener.isReceiving();
    }

    public String listenerAddress() {
        return listener.boundAddress();
    }

    public List<Asset> pollAssets() {
        return new ArrayList<>(listener.pollAssets());
    }

    public List<ConnectionEvent> pollConnectionEvents() {
        return listener.pollConnectionEvents();
    }

    public List<IOException> pollErrors() {
        return listener.pollErrors();
    }

    // Normalizer

    /**
     * Normalizes a codec-native (BGR, little-endian) buffer.
     */
    public CanonicalImage normalize(byte[] raw, int width, int height, int channels, NumericKind kind) {
        return ImageNormalizer.normalize(raw, width, height, channels, kind);
    }

    // Mean engine

    public double[] mean(CanonicalImage image, Rect rect, MeanAxis axis) {
        return meanEngine.query(image, rect, axis);
    }

    public void bindForMeans(CanonicalImage image) {
        meanEngine.precomputeAsync(image);
    }

    // Metrics

    /**
     * Submits a metric over the full frame (for two images, the overlap of both frames).
     * Single-image kinds ignore {@code b}. Display scale is 1.
     *
     * @return false if nothing was scheduled because an image is missing or empty
     */
    public boolean submitMetric(MetricKind kind, CanonicalImage a, CanonicalImage b) {
        if (a == null) {
            return false;
        }
        Rect frame = b == null ? a.spec().bounds() : a.spec().bounds().intersect(b.spec().bounds());
        return switch (kind) {
            case MIN_MAX -> metricsWorker.submitMinMax(a, a.spec().bounds(), 1.0);
            case STD_DEV -> metricsWorker.submitStdDev(a, a.spec().bounds());
            case MSE -> metricsWorker.submitMse(a, b, frame);
            case MAE -> metricsWorker.submitMae(a, b, frame);
            case PSNR -> metricsWorker.submitPsnr(a, b, psnrDataRange, 1.0, frame);
            case SSIM -> metricsWorker.submitSsim(a, b, frame);
            case MS_SSIM -> metricsWorker.submitMsSsim(a, b, frame);
            case FSIM -> metricsWorker.submitFsim(a, b, frame);
        };
    }

    /**
     * Finished metrics since the last call. For an update flagged {@code stillPending}
     * call {@link #submitMetric} again with the current images.
     */
    public List<MetricUpdate> drainMetrics() {
        return metricsWorker.drain();
    }

    public FrameIngestionListener getListener() {
        return listener;
    }

    public WindowedMeanEngine getMeanEngine() {
        return meanEngine;
    }

    public QualityMetricsWorker getMetricsWorker() {
        return metricsWorker;
    }

    public AssetLoader getAssetLoader() {
        return assetLoader;
    }

    @Override
    public void close() {
        listener.close();
        if (logSession != null) {
            logSession.close();
            logSession = null;
        }
    }
}
