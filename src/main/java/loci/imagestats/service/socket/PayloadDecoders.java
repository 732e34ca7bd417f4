package loci.imagestats.service.socket;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteOrder;
import java.util.EnumMap;
import java.util.Map;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;
import loci.imagestats.image.ImageCodec;
import loci.imagestats.image.RawImage;

/**
 * Standard {@link PayloadDecoder}s.
 *
 * <p>Raw and zlib payloads hold samples as a numpy array would serialize them:
 * row-major, channel-interleaved, little-endian, in the peer's own component order.</p>
 */
public final class PayloadDecoders {

    private PayloadDecoders() {
    }

    /**
     * The decoder table used by the listener: raw sample decoders plus the codec for
     * encoded images.
     */
    public static Map<Compression, PayloadDecoder> defaults(ImageCodec codec) {
        Map<Compression, PayloadDecoder> decoders = new EnumMap<>(Compression.class);
        decoders.put(Compression.ZLIB, zlib());
        decoders.put(Compression.RAW, raw());
        PayloadDecoder encoded = codec(codec);
        decoders.put(Compression.PNG, encoded);
        decoders.put(Compression.EXR, encoded);
        decoders.put(Compression.CV, encoded);
        return decoders;
    }

    public static PayloadDecoder raw() {
        return message -> {
            checkDeclaredSize(message);
            if (message.payload().length != message.metadata().nbytes()) {
                throw new FrameFormatException(String.format("Payload holds %d bytes but nbytes is %d",
                        message.payload().length, message.metadata().nbytes()), message.name());
            }
            return toRawImage(message.metadata(), message.payload());
        };
    }

    public static PayloadDecoder zlib() {
        return message -> {
            checkDeclaredSize(message);
            long nbytes = message.metadata().nbytes();
            byte[] samples;
            try {
                samples = inflate(message.payload(), nbytes);
            } catch (IOException e) {
                throw new FrameFormatException("Failed to inflate payload: " + e.getMessage(), message.name(), e);
            }
            if (samples.length != nbytes) {
                throw new FrameFormatException(String.format("Inflated %d bytes but nbytes is %d",
                        samples.length, nbytes), message.name());
            }
            return toRawImage(message.metadata(), samples);
        };
    }

    public static PayloadDecoder codec(ImageCodec codec) {
        return message -> {
            try {
                return codec.decode(message.payload());
            } catch (IOException e) {
                throw new FrameFormatException("Failed to decode " + message.metadata().compression().wireName()
                        + " payload: " + e.getMessage(), message.name(), e);
            }
        };
    }

    private static void checkDeclaredSize(FrameMessage message) throws FrameFormatException {
        FrameMetadata metadata = message.metadata();
        if (metadata.expectedBytes() != metadata.nbytes()) {
            throw new FrameFormatException(String.format("Shape and dtype imply %d bytes but nbytes is %d",
                    metadata.expectedBytes(), metadata.nbytes()), message.name());
        }
    }

    private static RawImage toRawImage(FrameMetadata metadata, byte[] samples) {
        return new RawImage(metadata.width(), metadata.height(), metadata.channels(), metadata.dtype(),
                samples, ByteOrder.LITTLE_ENDIAN, RawImage.ComponentOrder.RGB);
    }

    /**
     * Inflates until the stream ends or more than {@code limit} bytes come out, so that an
     * oversized stream is detected without inflating all of it. The output grows with the
     * data actually inflated, never with the declared size.
     */
    private static byte[] inflate(byte[] compressed, long limit) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.min(compressed.length * 4, 1 << 20));
        try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(compressed))) {
            byte[] chunk = new byte[64 * 1024];
            long total = 0;
            int n;
            while ((n = in.read(chunk)) != -1) {
                total += n;
                if (total > limit) {
                    throw new ZipException("Inflated data exceeds the declared " + limit + " bytes");
                }
                out.write(chunk, 0, n);
            }
        }
        return out.toByteArray();
    }
}
