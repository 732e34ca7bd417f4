package loci.imagestats.asset;

import loci.imagestats.image.CanonicalImage;

/**
 * A named canonical image together with the key it is looked up by.
 */
public interface Asset {

    /** Display name. */
    String name();

    CanonicalImage image();

    /**
     * Stable lookup key. Two loads of the same source share a key even though their
     * images have different ids.
     */
    String hash();

    AssetType type();
}
