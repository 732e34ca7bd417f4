package loci.imagestats.service.mean;

/**
 * Shape of a windowed mean result.
 */
public enum MeanAxis {
    /** One mean per channel over the whole rectangle. */
    ALL,
    /** One mean per pixel column and channel, averaged over the rectangle's rows. */
    COLUMN,
    /** One mean per pixel row and channel, averaged over the rectangle's columns. */
    ROW
}
