package loci.imagestats.asset;

import loci.imagestats.image.CanonicalImage;
import loci.imagestats.image.ImageNormalizer;
import loci.imagestats.image.NumericKind;
import loci.imagestats.image.Rect;

/**
 * Signed per-pixel difference {@code a - b} of two assets over the intersection of their
 * frames. Only the difference image is kept; the inputs are not referenced afterwards.
 */
public record ComparisonAsset(String name, CanonicalImage image) implements Asset {

    /**
     * Builds the difference of two assets.
     *
     * @throws IllegalArgumentException if the images have different channel counts
     */
    public static ComparisonAsset of(Asset a, Asset b) {
        CanonicalImage left = a.image();
        CanonicalImage right = b.image();
        if (left.channels() != right.channels()) {
            throw new IllegalArgumentException(String.format(
                    "Cannot compare '%s' (%d channels) with '%s' (%d channels)",
                    a.name(), left.channels(), b.name(), right.channels()));
        }

        Rect region = left.spec().bounds().intersect(right.spec().bounds());
        int width = region.width();
        int height = region.height();
        int channels = left.channels();
        float[] diff = new float[width * height * channels];

        float[] ls = left.samples();
        float[] rs = right.samples();
        int rowLength = width * channels;
        for (int y = 0; y < height; y++) {
            int lRow = ((region.y() + y) * left.width() + region.x()) * channels;
            int rRow = ((region.y() + y) * right.width() + region.x()) * channels;
            int out = y * rowLength;
            for (int i = 0; i < rowLength; i++) {
                diff[out + i] = ls[lRow + i] - rs[rRow + i];
            }
        }

        NumericKind kind = left.spec().originalKind() == right.spec().originalKind()
                ? left.spec().originalKind()
                : NumericKind.FLOAT32;
        CanonicalImage image = ImageNormalizer.fromSamples(width, height, channels, kind, diff);
        return new ComparisonAsset(a.name() + " - " + b.name(), image);
    }

    @Override
    public String hash() {
        return name;
    }

    @Override
    public AssetType type() {
        return AssetType.COMPARISON;
    }
}
