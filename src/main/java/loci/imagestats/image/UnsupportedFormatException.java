package loci.imagestats.image;

/**
 * Thrown when a buffer cannot be normalized because its channel count or numeric kind
 * is not supported. Never silently coerced.
 */
public class UnsupportedFormatException extends IllegalArgumentException {

    public UnsupportedFormatException(String message) {
        super(message);
    }
}
