package loci.imagestats.asset;

import loci.imagestats.image.CanonicalImage;

/**
 * Image downloaded over HTTP. Keyed by its URL.
 */
public record UrlAsset(String url, CanonicalImage image) implements Asset {

    @Override
    public String name() {
        return url;
    }

    @Override
    public String hash() {
        return url;
    }

    @Override
    public AssetType type() {
        return AssetType.URL;
    }
}
