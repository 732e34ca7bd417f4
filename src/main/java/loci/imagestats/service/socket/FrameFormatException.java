package loci.imagestats.service.socket;

import java.io.IOException;

/**
 * A framed message was received but could not be turned into an image: bad lengths,
 * malformed metadata, an unknown compression or a payload that does not decode.
 */
public class FrameFormatException extends IOException {

    private final String assetName;

    public FrameFormatException(String message) {
        this(message, null, null);
    }

    public FrameFormatException(String message, String assetName) {
        this(message, assetName, null);
    }

    public FrameFormatException(String message, String assetName, Throwable cause) {
        super(assetName == null ? message : "[" + assetName + "] " + message, cause);
        this.assetName = assetName;
    }

    /**
     * Name the peer gave the asset, or null if the failure happened before it was read.
     */
    public String getAssetName() {
        return assetName;
    }
}
