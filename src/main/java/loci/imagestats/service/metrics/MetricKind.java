package loci.imagestats.service.metrics;

/**
 * Whole-frame statistics the {@link QualityMetricsWorker} computes.
 */
public enum MetricKind {
    MIN_MAX("Min/Max"),
    STD_DEV("Std Dev"),
    MSE("MSE"),
    MAE("MAE"),
    PSNR("PSNR/RMSE"),
    SSIM("SSIM"),
    MS_SSIM("MS-SSIM"),
    FSIM("FSIM");

    private final String displayName;

    MetricKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Number of values a result of this kind holds.
     *
     * @param channels channel count of the measured image
     */
    public int resultSize(int channels) {
        return switch (this) {
            case MIN_MAX -> 2 * Math.max(1, channels);
            case STD_DEV -> Math.max(1, channels);
            case PSNR -> 2;
            case MSE, MAE, SSIM, MS_SSIM, FSIM -> 1;
        };
    }

    @Override
    public String toString() {
        return displayName;
    }
}
