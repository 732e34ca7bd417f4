package loci.imagestats.service.socket;

/**
 * One framed message as read off the wire, before the payload is decoded.
 *
 * @param name     asset name chosen by the peer
 * @param metadata parsed metadata
 * @param payload  encoded pixel payload
 */
public record FrameMessage(String name, FrameMetadata metadata, byte[] payload) {
}
