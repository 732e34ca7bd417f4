package loci.imagestats.service.metrics;

import java.util.Arrays;

/**
 * A result handed to the consumer by {@link QualityMetricsWorker#drain()}.
 *
 * @param kind         metric kind
 * @param values       computed values; NaN if the computation failed
 * @param stillPending true if this kind was requested again while these values were
 *                     being computed; they are stale and the caller should re-submit
 */
public record MetricUpdate(MetricKind kind, double[] values, boolean stillPending) {

    public boolean isFailure() {
        for (double v : values) {
            if (Double.isNaN(v)) {
                return true;
            }
        }
        return values.length == 0;
    }

    @Override
    public String toString() {
        return "MetricUpdate[" + kind.displayName() + "=" + Arrays.toString(values)
                + (stillPending ? ", pending" : "") + "]";
    }
}
