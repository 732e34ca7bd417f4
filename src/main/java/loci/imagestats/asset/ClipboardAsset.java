package loci.imagestats.asset;

import java.util.concurrent.atomic.AtomicLong;
import loci.imagestats.image.CanonicalImage;

/**
 * Image pasted from the system clipboard, named {@code "Clipboard N"} from a process-wide
 * counter starting at 0.
 */
public record ClipboardAsset(String name, CanonicalImage image) implements Asset {

    private static final AtomicLong COUNTER = new AtomicLong();

    /**
     * Wraps a clipboard image under the next free clipboard name.
     */
    public static ClipboardAsset of(CanonicalImage image) {
        return new ClipboardAsset("Clipboard " + COUNTER.getAndIncrement(), image);
    }

    @Override
    public String hash() {
        return name;
    }

    @Override
    public AssetType type() {
        return AssetType.CLIPBOARD;
    }
}
