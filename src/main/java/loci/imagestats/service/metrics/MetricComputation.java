package loci.imagestats.service.metrics;

/**
 * A metric calculation run on a worker thread.
 */
@FunctionalInterface
public interface MetricComputation {

    /**
     * @return the metric values
     * @throws Exception on any failure; the worker reports NaN values instead
     */
    double[] compute() throws Exception;
}
