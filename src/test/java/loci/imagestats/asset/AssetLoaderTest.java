package loci.imagestats.asset;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import loci.imagestats.image.CanonicalImage;
import loci.imagestats.image.ImageIoCodec;
import loci.imagestats.image.ImageNormalizer;
import loci.imagestats.image.NumericKind;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link AssetLoader} and the asset records it produces.
 */
class AssetLoaderTest {

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private AssetLoader loader;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        loader = new AssetLoader(new ImageIoCodec(), new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static byte[] png(int rgb) throws IOException {
        BufferedImage image = new BufferedImage(3, 2, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 3; x++) {
                image.setRGB(x, y, rgb);
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    @Test
    @DisplayName("PNG file loads as a file asset keyed by its path")
    void testLoadPngFile() throws IOException {
        Path file = tempDir.resolve("frame.png");
        Files.write(file, png(0x00FF00));

        FileAsset asset = loader.loadFile(file);

        assertEquals(file.toString(), asset.name());
        assertEquals(file.toString(), asset.hash());
        assertEquals(AssetType.FILE, asset.type());
        assertEquals(3, asset.image().width());
        assertEquals(2, asset.image().height());
        assertArrayEquals(new float[]{0f, 1f, 0f}, asset.image().pixelAt(2, 1), 1e-6f);
    }

    @Test
    @DisplayName("Missing file is reported as not existing")
    void testMissingFile() {
        IOException e = assertThrows(IOException.class, () -> loader.loadFile(tempDir.resolve("nope.png")));
        assertTrue(e.getMessage().contains("does not exist"));
    }

    @Test
    @DisplayName(".flo files decode to two float channels")
    void testLoadFlo() throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(12 + 2 * 1 * 2 * 4).order(ByteOrder.LITTLE_ENDIAN);
        buf.putFloat(AssetLoader.FLO_MAGIC).putInt(2).putInt(1);
        buf.putFloat(1.5f).putFloat(-2f).putFloat(0.25f).putFloat(3f);
        Path file = tempDir.resolve("motion.flo");
        Files.write(file, buf.array());

        CanonicalImage image = loader.loadFile(file).image();

        assertEquals(2, image.channels());
        assertArrayEquals(new float[]{1.5f, -2f}, image.pixelAt(0, 0));
        assertArrayEquals(new float[]{0.25f, 3f}, image.pixelAt(1, 0));
    }

    @Test
    @DisplayName(".flo with a wrong magic number is rejected")
    void testFloBadMagic() {
        ByteBuffer buf = ByteBuffer.allocate(20).order(ByteOrder.LITTLE_ENDIAN);
        buf.putFloat(1f).putInt(1).putInt(1);
        assertThrows(IOException.class, () -> AssetLoader.decodeFlo(buf.array()));
    }

    @Test
    @DisplayName(".pfm rows are flipped and scaled, trailing header spaces tolerated")
    void testLoadPfm() throws IOException {
        byte[] header = "Pf \n1 2 \n-2.0 \n".getBytes(StandardCharsets.US_ASCII);
        // stored bottom row first
        ByteBuffer data = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putFloat(0.25f).putFloat(0.5f);
        byte[] bytes = new byte[header.length + 8];
        System.arraycopy(header, 0, bytes, 0, header.length);
        System.arraycopy(data.array(), 0, bytes, header.length, 8);

        CanonicalImage image = AssetLoader.decodePfm(bytes);

        assertEquals(1, image.channels());
        assertEquals(1.0f, image.sample(0, 0, 0), 1e-6f);
        assertEquals(0.5f, image.sample(0, 1, 0), 1e-6f);
    }

    @Test
    @DisplayName("Big-endian three channel .pfm")
    void testPfmBigEndianColor() throws IOException {
        byte[] header = "PF\n1 1\n1.0\n".getBytes(StandardCharsets.US_ASCII);
        ByteBuffer data = ByteBuffer.allocate(12).order(ByteOrder.BIG_ENDIAN)
                .putFloat(0.1f).putFloat(0.2f).putFloat(0.3f);
        byte[] bytes = new byte[header.length + 12];
        System.arraycopy(header, 0, bytes, 0, header.length);
        System.arraycopy(data.array(), 0, bytes, header.length, 12);

        CanonicalImage image = AssetLoader.decodePfm(bytes);
        assertArrayEquals(new float[]{0.1f, 0.2f, 0.3f}, image.pixelAt(0, 0), 1e-6f);
    }

    @Test
    @DisplayName("Truncated .pfm raster is rejected")
    void testPfmTruncated() {
        byte[] bytes = "PF\n4 4\n-1.0\n\0\0\0\0".getBytes(StandardCharsets.US_ASCII);
        assertThrows(IOException.class, () -> AssetLoader.decodePfm(bytes));
    }

    @Test
    @DisplayName("URL download decodes the body")
    void testLoadUrl() throws IOException {
        server.enqueue(new MockResponse().setBody(new Buffer().write(png(0xFF0000))));
        String url = server.url("/image.png").toString();

        UrlAsset asset = loader.loadUrl(url);

        assertEquals(url, asset.name());
        assertEquals(AssetType.URL, asset.type());
        assertArrayEquals(new float[]{1f, 0f, 0f}, asset.image().pixelAt(0, 0), 1e-6f);
    }

    @Test
    @DisplayName("Non-2xx response fails with the status code")
    void testLoadUrlNotFound() {
        server.enqueue(new MockResponse().setResponseCode(404));

        IOException e = assertThrows(IOException.class, () -> loader.loadUrl(server.url("/missing").toString()));
        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    @DisplayName("Comparison is the signed difference over the overlapping frame")
    void testCompare() {
        CanonicalImage a = ImageNormalizer.fromSamples(2, 2, 1, NumericKind.UINT8, new float[]{1f, 1f, 1f, 1f});
        CanonicalImage b = ImageNormalizer.fromSamples(1, 3, 1, NumericKind.UINT8, new float[]{0.25f, 0.5f, 0.75f});

        ComparisonAsset diff = loader.compare(new SocketAsset("a", a), new SocketAsset("b", b));

        assertEquals("a - b", diff.name());
        assertEquals(AssetType.COMPARISON, diff.type());
        assertEquals(1, diff.image().width());
        assertEquals(2, diff.image().height());
        assertEquals(0.75f, diff.image().sample(0, 0, 0), 1e-6f);
        assertEquals(0.5f, diff.image().sample(0, 1, 0), 1e-6f);
        assertEquals(NumericKind.UINT8, diff.image().spec().originalKind());
    }

    @Test
    @DisplayName("Comparison of different channel counts is rejected")
    void testCompareChannelMismatch() {
        CanonicalImage gray = ImageNormalizer.fromSamples(1, 1, 1, NumericKind.UINT8, new float[1]);
        CanonicalImage rgb = ImageNormalizer.fromSamples(1, 1, 3, NumericKind.UINT8, new float[3]);

        assertThrows(IllegalArgumentException.class,
                () -> loader.compare(new SocketAsset("g", gray), new SocketAsset("c", rgb)));
    }

    @Test
    @DisplayName("Clipboard images get consecutive names")
    void testClipboardNaming() throws IOException {
        BufferedImage image = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);

        ClipboardAsset first = loader.fromClipboard(image);
        ClipboardAsset second = loader.fromClipboard(image);

        assertTrue(first.name().startsWith("Clipboard "));
        long n1 = Long.parseLong(first.name().substring("Clipboard ".length()));
        long n2 = Long.parseLong(second.name().substring("Clipboard ".length()));
        assertEquals(n1 + 1, n2);
        assertEquals(AssetType.CLIPBOARD, first.type());
    }
}
