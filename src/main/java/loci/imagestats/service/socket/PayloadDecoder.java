package loci.imagestats.service.socket;

import loci.imagestats.image.RawImage;

/**
 * Turns a frame payload into raw pixels. One implementation per {@link Compression}.
 */
@FunctionalInterface
public interface PayloadDecoder {

    /**
     * @param message frame whose payload is decoded
     * @return decoded pixels, not yet normalized
     * @throws FrameFormatException if the payload does not match the metadata or cannot
     *                              be decoded
     */
    RawImage decode(FrameMessage message) throws FrameFormatException;
}
