package loci.imagestats.asset;

import java.awt.Graphics2D;
import java.awt.HeadlessException;
import java.awt.Image;
import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import loci.imagestats.image.CanonicalImage;
import loci.imagestats.image.ImageCodec;
import loci.imagestats.image.ImageIoCodec;
import loci.imagestats.image.ImageNormalizer;
import loci.imagestats.image.NumericKind;
import loci.imagestats.image.RawImage;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates assets from files, the clipboard and URLs.
 *
 * <p>Portable float maps ({@code .pfm}) and Middlebury optical flow files ({@code .flo})
 * are parsed here. Every other file goes through the {@link ImageCodec}.</p>
 */
public class AssetLoader {

    private static final Logger logger = LoggerFactory.getLogger(AssetLoader.class);

    /** Magic number at the start of every {@code .flo} file. */
    static final float FLO_MAGIC = 202021.25f;

    private static final int FLO_HEADER_BYTES = 12;

    private final ImageCodec codec;
    private final OkHttpClient httpClient;

    public AssetLoader() {
        this(new ImageIoCodec(), new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .build());
    }

    public AssetLoader(ImageCodec codec, OkHttpClient httpClient) {
        this.codec = codec;
        this.httpClient = httpClient;
    }

    /**
     * Loads an image file.
     *
     * @param path file to load
     * @return the loaded asset, keyed by the path
     * @throws IOException if the file does not exist or cannot be decoded
     */
    public FileAsset loadFile(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Image does not exist: " + path);
        }
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String ext = dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new IOException("Failed to read file bytes: " + e.getMessage(), e);
        }

        CanonicalImage image = switch (ext) {
            case "flo" -> decodeFlo(bytes);
            case "pfm" -> decodePfm(bytes);
            default -> ImageNormalizer.normalize(codec.decode(bytes));
        };
        logger.info("Loaded {} ({}x{}x{})", path, image.width(), image.height(), image.channels());
        return new FileAsset(path.toString(), image);
    }

    /**
     * Wraps an image taken from the clipboard. No component reordering is applied
     * beyond what the raster itself describes.
     */
    public ClipboardAsset fromClipboard(BufferedImage image) throws IOException {
        RawImage raw = ImageIoCodec.toRawImage(image);
        if (raw.width() <= 0 || raw.height() <= 0) {
            throw new IOException("Invalid clipboard image dimensions or channels");
        }
        return ClipboardAsset.of(ImageNormalizer.normalize(raw));
    }

    /**
     * Reads the image currently on the system clipboard.
     *
     * @throws IOException if there is no clipboard or it holds no image
     */
    public ClipboardAsset loadClipboard() throws IOException {
        Image content;
        try {
            Clipboard clipboard = Toolkit.getDefaultToolkit().getSystemClipboard();
            if (!clipboard.isDataFlavorAvailable(DataFlavor.imageFlavor)) {
                throw new IOException("Clipboard does not contain an image");
            }
            content = (Image) clipboard.getData(DataFlavor.imageFlavor);
        } catch (HeadlessException | IllegalStateException | UnsupportedFlavorException e) {
            throw new IOException("Failed to get image from clipboard: " + e.getMessage(), e);
        }
        return fromClipboard(toBufferedImage(content));
    }

    /**
     * Downloads and decodes an image.
     *
     * @throws IOException on transport failure, a non-2xx response or undecodable content
     */
    public UrlAsset loadUrl(String url) throws IOException {
        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid URL: " + url, e);
        }

        byte[] bytes;
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Download failed with code: " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Empty response from " + url);
            }
            bytes = body.bytes();
        }

        CanonicalImage image = ImageNormalizer.normalize(codec.decode(bytes));
        logger.info("Downloaded {} ({} bytes)", url, bytes.length);
        return new UrlAsset(url, image);
    }

    /**
     * Difference of two assets, see {@link ComparisonAsset#of(Asset, Asset)}.
     */
    public ComparisonAsset compare(Asset a, Asset b) {
        return ComparisonAsset.of(a, b);
    }

    /**
     * Decodes a Middlebury optical flow file: little-endian magic, width, height, then
     * width * height pairs of float32 (u, v).
     */
    static CanonicalImage decodeFlo(byte[] bytes) throws IOException {
        if (bytes.length < FLO_HEADER_BYTES) {
            throw new IOException(".flo: file too small: " + bytes.length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float magic = buffer.getFloat();
        if (magic != FLO_MAGIC) {
            throw new IOException(".flo: invalid magic: " + magic);
        }
        int width = buffer.getInt();
        int height = buffer.getInt();
        if (width <= 0 || height <= 0) {
            throw new IOException(".flo: invalid dimensions: " + width + "x" + height);
        }

        long floats = (long) width * height * 2;
        if (floats > Integer.MAX_VALUE) {
            throw new IOException(".flo: image size overflow");
        }
        long available = bytes.length - FLO_HEADER_BYTES;
        if (available < floats * Float.BYTES) {
            throw new IOException(".flo: not enough data: have " + available + ", need " + floats * Float.BYTES);
        }

        float[] samples = new float[(int) floats];
        buffer.asFloatBuffer().get(samples);
        return ImageNormalizer.fromSamples(width, height, 2, NumericKind.FLOAT32, samples);
    }

    /**
     * Decodes a portable float map. {@code PF} is three channel, {@code Pf} single
     * channel. The sign of the scale selects the byte order (negative is little-endian)
     * and its magnitude multiplies every sample. Rows are stored bottom to top.
     * Header lines may carry trailing spaces.
     */
    static CanonicalImage decodePfm(byte[] bytes) throws IOException {
        int[] pos = {0};
        String magic = nextToken(bytes, pos);
        int channels = switch (magic) {
            case "PF" -> 3;
            case "Pf" -> 1;
            default -> throw new IOException(".pfm: invalid magic: " + magic);
        };

        int width;
        int height;
        double scale;
        try {
            width = Integer.parseInt(nextToken(bytes, pos));
            height = Integer.parseInt(nextToken(bytes, pos));
            scale = Double.parseDouble(nextToken(bytes, pos));
        } catch (NumberFormatException e) {
            throw new IOException(".pfm: malformed header: " + e.getMessage(), e);
        }
        if (width <= 0 || height <= 0) {
            throw new IOException(".pfm: invalid dimensions: " + width + "x" + height);
        }

        // the raster starts after the line break that ends the scale line
        int offset = pos[0];
        while (offset < bytes.length && (bytes[offset] == ' ' || bytes[offset] == '\t' || bytes[offset] == '\r')) {
            offset++;
        }
        if (offset < bytes.length && bytes[offset] == '\n') {
            offset++;
        }

        int rowBytes = Math.multiplyExact(width * channels, Float.BYTES);
        long dataBytes = (long) rowBytes * height;
        if (bytes.length - offset < dataBytes) {
            throw new IOException(".pfm: not enough data: have " + (bytes.length - offset) + ", need " + dataBytes);
        }

        byte[] topDown = new byte[(int) dataBytes];
        for (int row = 0; row < height; row++) {
            System.arraycopy(bytes, offset + row * rowBytes, topDown, (height - 1 - row) * rowBytes, rowBytes);
        }

        ByteOrder order = scale < 0 ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;
        RawImage raw = new RawImage(width, height, channels, NumericKind.FLOAT32, topDown,
                order, RawImage.ComponentOrder.RGB);
        return ImageNormalizer.normalize(raw, Math.abs(scale) == 0 ? 1.0 : Math.abs(scale));
    }

    private static String nextToken(byte[] bytes, int[] pos) throws IOException {
        int i = pos[0];
        while (i < bytes.length && Character.isWhitespace(bytes[i])) {
            i++;
        }
        int start = i;
        while (i < bytes.length && !Character.isWhitespace(bytes[i])) {
            i++;
        }
        if (start == i) {
            throw new IOException(".pfm: truncated header");
        }
        pos[0] = i;
        return new String(bytes, start, i - start, StandardCharsets.US_ASCII);
    }

    private static BufferedImage toBufferedImage(Image image) throws IOException {
        if (image instanceof BufferedImage buffered) {
            return buffered;
        }
        int width = image.getWidth(null);
        int height = image.getHeight(null);
        if (width <= 0 || height <= 0) {
            throw new IOException("Invalid clipboard image dimensions or channels");
        }
        BufferedImage copy = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }
}
