package loci.imagestats.asset;

import loci.imagestats.image.CanonicalImage;

/**
 * Image loaded from disk. Keyed by its path.
 */
public record FileAsset(String path, CanonicalImage image) implements Asset {

    @Override
    public String name() {
        return path;
    }

    @Override
    public String hash() {
        return path;
    }

    @Override
    public AssetType type() {
        return AssetType.FILE;
    }
}
