package loci.imagestats.image;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBuffer;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ImageCodec} backed by {@code javax.imageio}. Any format with a registered
 * ImageIO reader can be decoded; EXR and similar formats need a reader plugin on the
 * class path.
 *
 * <p>Decoded buffers are returned in RGB(A) component order with little-endian
 * samples. Indexed-colour images are expanded to RGB(A) first.</p>
 *
 * <p>The dimensions in the image header are checked against a pixel limit before any
 * pixel data is decoded.</p>
 */
public class ImageIoCodec implements ImageCodec {

    private static final Logger logger = LoggerFactory.getLogger(ImageIoCodec.class);

    /** 8192 x 8192. */
    public static final long DEFAULT_MAX_PIXELS = 1L << 26;

    private final long maxPixels;

    public ImageIoCodec() {
        this(DEFAULT_MAX_PIXELS);
    }

    public ImageIoCodec(long maxPixels) {
        if (maxPixels <= 0) {
            throw new IllegalArgumentException("Pixel limit must be positive");
        }
        this.maxPixels = maxPixels;
    }

    public long getMaxPixels() {
        return maxPixels;
    }

    @Override
    public RawImage decode(byte[] encoded) throws IOException {
        if (encoded == null || encoded.length == 0) {
            throw new IOException("No image data to decode");
        }
        BufferedImage image;
        try (ImageInputStream stream = ImageIO.createImageInputStream(new ByteArrayInputStream(encoded))) {
            Iterator<ImageReader> readers = stream == null ? null : ImageIO.getImageReaders(stream);
            if (readers == null || !readers.hasNext()) {
                throw new IOException("No ImageIO reader recognized the " + encoded.length + " byte image");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(stream, true, true);
                long pixels = (long) reader.getWidth(0) * reader.getHeight(0);
                if (pixels > maxPixels) {
                    throw new IOException(String.format("Image of %dx%d exceeds the limit of %d pixels",
                            reader.getWidth(0), reader.getHeight(0), maxPixels));
                }
                image = reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (RuntimeException e) {
            throw new IOException("Failed to decode image: " + e.getMessage(), e);
        }
        try {
            return toRawImage(image);
        } catch (RuntimeException e) {
            throw new IOException("Failed to extract pixels: " + e.getMessage(), e);
        }
    }

    /**
     * Extracts the pixel buffer of a {@link BufferedImage}.
     *
     * <p>Two band images (gray plus alpha) keep only the gray band, so that the result
     * always has 1, 3 or 4 channels.</p>
     *
     * @throws IOException if the sample type has no matching numeric kind
     */
    public static RawImage toRawImage(BufferedImage image) throws IOException {
        if (image.getColorModel() instanceof IndexColorModel icm) {
            image = expandIndexed(image, icm.hasAlpha());
        }

        Raster raster = image.getRaster();
        int width = raster.getWidth();
        int height = raster.getHeight();
        int bands = raster.getNumBands();
        NumericKind kind = kindOf(raster);

        int channels = bands == 2 ? 1 : bands;
        if (channels > 4) {
            throw new IOException("Images with " + bands + " bands are not supported");
        }

        ByteBuffer out = ByteBuffer.allocate(bufferSize(width, height, channels, kind))
                .order(ByteOrder.LITTLE_ENDIAN);
        double[] row = new double[width * bands];
        for (int y = 0; y < height; y++) {
            raster.getPixels(0, y, width, 1, row);
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < channels; c++) {
                    putSample(out, kind, row[x * bands + c]);
                }
            }
        }

        logger.debug("Decoded {}x{} image with {} channels of {}", width, height, channels, kind.wireName());
        return new RawImage(width, height, channels, kind, out.array(),
                ByteOrder.LITTLE_ENDIAN, RawImage.ComponentOrder.RGB);
    }

    static int bufferSize(int width, int height, int channels, NumericKind kind) throws IOException {
        try {
            return Math.multiplyExact(Math.multiplyExact(Math.multiplyExact(width, height), channels), kind.bytes());
        } catch (ArithmeticException e) {
            throw new IOException(String.format("A %dx%dx%d %s image does not fit in one buffer",
                    width, height, channels, kind.wireName()), e);
        }
    }

    private static BufferedImage expandIndexed(BufferedImage indexed, boolean alpha) {
        BufferedImage expanded = new BufferedImage(indexed.getWidth(), indexed.getHeight(),
                alpha ? BufferedImage.TYPE_4BYTE_ABGR : BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D g = expanded.createGraphics();
        try {
            g.drawImage(indexed, 0, 0, null);
        } finally {
            g.dispose();
        }
        return expanded;
    }

    private static NumericKind kindOf(Raster raster) throws IOException {
        int dataType = raster.getDataBuffer().getDataType();
        int bits = raster.getSampleModel().getSampleSize(0);
        return switch (dataType) {
            case DataBuffer.TYPE_BYTE -> NumericKind.UINT8;
            case DataBuffer.TYPE_USHORT -> NumericKind.UINT16;
            case DataBuffer.TYPE_SHORT -> NumericKind.INT16;
            case DataBuffer.TYPE_INT -> bits <= 8 ? NumericKind.UINT8
                    : bits <= 16 ? NumericKind.UINT16 : NumericKind.INT32;
            case DataBuffer.TYPE_FLOAT -> NumericKind.FLOAT32;
            case DataBuffer.TYPE_DOUBLE -> NumericKind.FLOAT64;
            default -> throw new IOException("Unsupported raster data type: " + dataType);
        };
    }

    private static void putSample(ByteBuffer out, NumericKind kind, double value) {
        switch (kind) {
            case UINT8, INT8 -> out.put((byte) (int) value);
            case UINT16, INT16 -> out.putShort((short) (int) value);
            case INT32 -> out.putInt((int) value);
            case FLOAT32 -> out.putFloat((float) value);
            case FLOAT64 -> out.putDouble(value);
            case FLOAT16 -> throw new UnsupportedFormatException("float16 samples cannot be written");
        }
    }
}
