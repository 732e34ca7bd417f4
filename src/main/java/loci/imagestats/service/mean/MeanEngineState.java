package loci.imagestats.service.mean;

/**
 * Observable state of a {@link WindowedMeanEngine}.
 */
public enum MeanEngineState {
    /** No image bound. */
    IDLE,
    /** Image bound, queries are answered by direct summation. */
    BOUND_NO_CACHE,
    /** Integral image being built in the background; queries still use direct summation. */
    PRECOMPUTING,
    /** Integral image ready for the bound image. */
    CACHED
}
