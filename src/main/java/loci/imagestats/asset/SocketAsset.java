package loci.imagestats.asset;

import loci.imagestats.image.CanonicalImage;

/**
 * Image received from a remote peer. The peer chooses the name, which doubles as the key,
 * so sending the same name again replaces the earlier image in a consumer's lookup.
 */
public record SocketAsset(String name, CanonicalImage image) implements Asset {

    @Override
    public String hash() {
        return name;
    }

    @Override
    public AssetType type() {
        return AssetType.SOCKET;
    }
}
