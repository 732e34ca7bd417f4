package loci.imagestats.service.metrics;

/**
 * A finished computation as posted by a worker thread.
 *
 * @param kind   metric kind
 * @param values computed values, or NaN of the kind's result size on failure
 */
public record MetricResult(MetricKind kind, double[] values) {
}
