package loci.imagestats.image;

import java.io.IOException;

/**
 * Decodes self-describing encoded images (PNG, EXR, TIFF, ...) into raw pixel buffers.
 */
public interface ImageCodec {

    /**
     * Decodes an encoded image.
     *
     * @param encoded the complete encoded file contents
     * @return the decoded buffer, dimensions, channel count and numeric kind
     * @throws IOException if the bytes cannot be decoded
     */
    RawImage decode(byte[] encoded) throws IOException;
}
