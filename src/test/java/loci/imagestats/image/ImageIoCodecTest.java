package loci.imagestats.image;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ImageIoCodec} using PNG images encoded in memory.
 */
class ImageIoCodecTest {

    private final ImageIoCodec codec = new ImageIoCodec();

    static byte[] encodePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertTrue(ImageIO.write(image, "png", out), "No PNG writer available");
        return out.toByteArray();
    }

    @Test
    @DisplayName("RGB PNG decodes to RGB-ordered uint8 samples")
    void testDecodeRgbPng() throws IOException {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, 0xFF0000);
        image.setRGB(1, 0, 0x0000FF);

        RawImage raw = codec.decode(encodePng(image));

        assertEquals(3, raw.channels());
        assertEquals(NumericKind.UINT8, raw.kind());
        assertEquals(RawImage.ComponentOrder.RGB, raw.componentOrder());

        CanonicalImage canonical = ImageNormalizer.normalize(raw);
        assertArrayEquals(new float[]{1f, 0f, 0f}, canonical.pixelAt(0, 0), 1e-6f);
        assertArrayEquals(new float[]{0f, 0f, 1f}, canonical.pixelAt(1, 0), 1e-6f);
    }

    @Test
    @DisplayName("16-bit grayscale PNG keeps its depth")
    void testDecodeGray16() throws IOException {
        BufferedImage image = new BufferedImage(1, 1, BufferedImage.TYPE_USHORT_GRAY);
        image.getRaster().setSample(0, 0, 0, 65535);

        RawImage raw = codec.decode(encodePng(image));

        assertEquals(1, raw.channels());
        assertEquals(NumericKind.UINT16, raw.kind());
        assertEquals(1f, ImageNormalizer.normalize(raw).sample(0, 0, 0), 1e-6f);
    }

    @Test
    @DisplayName("Undecodable bytes raise an IOException")
    void testGarbage() {
        assertThrows(IOException.class, () -> codec.decode(new byte[]{1, 2, 3, 4}));
        assertThrows(IOException.class, () -> codec.decode(new byte[0]));
    }

    @Test
    @DisplayName("Buffer size is computed without int overflow")
    void testBufferSizeOverflow() throws IOException {
        assertEquals(2 * 3 * 4 * 2, ImageIoCodec.bufferSize(2, 3, 4, NumericKind.UINT16));
        // 50000 * 50000 wraps as an int before the channel factor is applied
        assertThrows(IOException.class, () -> ImageIoCodec.bufferSize(50000, 50000, 3, NumericKind.UINT8));
        assertThrows(IOException.class, () -> ImageIoCodec.bufferSize(30000, 30000, 1, NumericKind.FLOAT64));
    }

    @Test
    @DisplayName("Images larger than the pixel limit are refused before decoding")
    void testPixelLimit() throws IOException {
        byte[] png = encodePng(new BufferedImage(8, 8, BufferedImage.TYPE_BYTE_GRAY));

        IOException e = assertThrows(IOException.class, () -> new ImageIoCodec(63).decode(png));
        assertTrue(e.getMessage().contains("exceeds the limit"));
        assertEquals(8, new ImageIoCodec(64).decode(png).width());
    }
}
