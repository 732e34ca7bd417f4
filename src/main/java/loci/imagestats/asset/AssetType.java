package loci.imagestats.asset;

/**
 * Where an asset came from.
 */
public enum AssetType {
    FILE,
    CLIPBOARD,
    SOCKET,
    URL,
    COMPARISON
}
