package loci.imagestats.service.socket;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Reads one length-prefixed frame:
 *
 * <pre>
 * i32 name_len | i32 metadata_len | i32 payload_len      (big-endian)
 * name (UTF-8) | metadata (UTF-8 JSON) | payload
 * </pre>
 *
 * <p>Lengths are validated before anything is allocated: negative or zero lengths are
 * rejected and so is a message whose total exceeds the configured maximum. The same
 * maximum bounds the decoded sample size declared in the metadata.</p>
 */
public class FrameMessageDecoder {

    static final int HEADER_BYTES = 12;

    private final long maxMessageBytes;

    public FrameMessageDecoder(long maxMessageBytes) {
        if (maxMessageBytes <= 0) {
            throw new IllegalArgumentException("Maximum message size must be positive");
        }
        this.maxMessageBytes = maxMessageBytes;
    }

    public long getMaxMessageBytes() {
        return maxMessageBytes;
    }

    /**
     * Reads exactly one frame from the stream.
     *
     * @throws FrameFormatException if a length or the metadata is invalid
     * @throws IOException          if the stream ends early or times out
     */
    public FrameMessage read(DataInputStream input) throws IOException {
        byte[] header = new byte[HEADER_BYTES];
        readSection(input, header, "header");
        ByteBuffer lengths = ByteBuffer.wrap(header).order(ByteOrder.BIG_ENDIAN);
        int nameLength = checkLength(lengths.getInt(), "name");
        int metadataLength = checkLength(lengths.getInt(), "metadata");
        int payloadLength = checkLength(lengths.getInt(), "payload");

        long total = (long) nameLength + metadataLength + payloadLength;
        if (total > maxMessageBytes) {
            throw new FrameFormatException(String.format(
                    "Message of %d bytes exceeds the maximum of %d", total, maxMessageBytes));
        }

        byte[] nameBytes = new byte[nameLength];
        readSection(input, nameBytes, "name");
        String name = new String(nameBytes, StandardCharsets.UTF_8);

        byte[] metadataBytes = new byte[metadataLength];
        readSection(input, metadataBytes, "metadata");
        FrameMetadata metadata = FrameMetadata.parse(new String(metadataBytes, StandardCharsets.UTF_8), name);
        long declared = Math.max(metadata.nbytes(), metadata.expectedBytes());
        if (declared > maxMessageBytes) {
            throw new FrameFormatException(String.format(
                    "Declared sample size of %d bytes exceeds the maximum of %d", declared, maxMessageBytes), name);
        }

        byte[] payload = new byte[payloadLength];
        readSection(input, payload, "payload");

        return new FrameMessage(name, metadata, payload);
    }

    private static int checkLength(int length, String section) throws FrameFormatException {
        if (length < 0) {
            throw new FrameFormatException("Negative " + section + " length encountered: " + length);
        }
        if (length == 0) {
            throw new FrameFormatException("Empty " + section + " section");
        }
        return length;
    }

    private static void readSection(DataInputStream input, byte[] target, String section) throws IOException {
        try {
            input.readFully(target);
        } catch (EOFException e) {
            throw new IOException("Peer closed connection while reading " + section
                    + " (" + target.length + " bytes expected)", e);
        }
    }
}
