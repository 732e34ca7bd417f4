package loci.imagestats.service.socket;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.util.Arrays;
import loci.imagestats.image.NumericKind;

/**
 * Metadata JSON sent with every frame.
 *
 * <pre>
 * {"compression": "zlib", "nbytes": 48, "shape": [4, 4, 3], "dtype": "uint8"}
 * </pre>
 *
 * @param compression payload encoding
 * @param nbytes      byte length of the raw samples
 * @param shape       {@code [h, w]} or {@code [h, w, c]}
 * @param dtype       numeric kind of the raw samples
 */
public record FrameMetadata(Compression compression, long nbytes, int[] shape, NumericKind dtype) {

    private static final Gson GSON = new Gson();

    public int height() {
        return shape[0];
    }

    public int width() {
        return shape[1];
    }

    public int channels() {
        return shape.length == 3 ? shape[2] : 1;
    }

    /**
     * Byte length implied by {@code shape} and {@code dtype}, saturating at
     * {@link Long#MAX_VALUE}.
     */
    public long expectedBytes() {
        try {
            return Math.multiplyExact(Math.multiplyExact((long) height() * width(), channels()), dtype.bytes());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Parses and validates metadata.
     *
     * @param json      UTF-8 decoded metadata
     * @param assetName name of the frame, for error messages
     * @throws FrameFormatException if the JSON is malformed or a required field is
     *                              missing, empty or unsupported
     */
    public static FrameMetadata parse(String json, String assetName) throws FrameFormatException {
        JsonObject object;
        try {
            object = GSON.fromJson(json, JsonObject.class);
        } catch (JsonParseException e) {
            throw new FrameFormatException("Malformed metadata JSON: " + e.getMessage(), assetName, e);
        }
        if (object == null) {
            throw new FrameFormatException("Empty metadata", assetName);
        }

        String compressionName = requireString(object, "compression", assetName);
        Compression compression = Compression.fromWireName(compressionName);
        if (compression == null) {
            throw new FrameFormatException("Unsupported compression: " + compressionName, assetName);
        }

        long nbytes = integral(require(object, "nbytes", assetName), "nbytes", assetName);
        if (nbytes <= 0) {
            throw new FrameFormatException("Field 'nbytes' must be positive but was " + nbytes, assetName);
        }

        int[] shape = parseShape(require(object, "shape", assetName), assetName);

        String dtypeName = requireString(object, "dtype", assetName);
        NumericKind dtype = NumericKind.fromWireName(dtypeName);
        if (dtype == null) {
            throw new FrameFormatException("Unsupported dtype: " + dtypeName, assetName);
        }

        return new FrameMetadata(compression, nbytes, shape, dtype);
    }

    private static JsonElement require(JsonObject object, String key, String assetName) throws FrameFormatException {
        if (!object.has(key) || object.get(key).isJsonNull()) {
            throw new FrameFormatException("Missing metadata field '" + key + "'", assetName);
        }
        return object.get(key);
    }

    private static String requireString(JsonObject object, String key, String assetName) throws FrameFormatException {
        JsonElement element = require(object, key, assetName);
        if (!element.isJsonPrimitive() || element.getAsString().isEmpty()) {
            throw new FrameFormatException("Metadata field '" + key + "' must be a non-empty string", assetName);
        }
        return element.getAsString();
    }

    private static int[] parseShape(JsonElement element, String assetName) throws FrameFormatException {
        if (!element.isJsonArray()) {
            throw new FrameFormatException("Field 'shape' must be an array", assetName);
        }
        JsonArray array = element.getAsJsonArray();
        if (array.size() != 2 && array.size() != 3) {
            throw new FrameFormatException("Field 'shape' must be [h, w] or [h, w, c] but had "
                    + array.size() + " entries", assetName);
        }
        int[] shape = new int[array.size()];
        for (int i = 0; i < shape.length; i++) {
            long extent = integral(array.get(i), "shape", assetName);
            if (extent <= 0 || extent > Integer.MAX_VALUE) {
                throw new FrameFormatException("Field 'shape' entries must be positive ints but got "
                        + array, assetName);
            }
            shape[i] = (int) extent;
        }
        return shape;
    }

    /**
     * Reads a JSON number that must be a whole number. Fractions, strings and values
     * outside the {@code long} range are rejected instead of being truncated.
     */
    private static long integral(JsonElement element, String key, String assetName) throws FrameFormatException {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new FrameFormatException("Field '" + key + "' must be a number but was " + element, assetName);
        }
        try {
            return element.getAsBigDecimal().longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new FrameFormatException("Field '" + key + "' is not an integer: " + element, assetName, e);
        }
    }

    @Override
    public String toString() {
        return String.format("FrameMetadata[compression=%s, nbytes=%d, shape=%s, dtype=%s]",
                compression.wireName(), nbytes, Arrays.toString(shape), dtype.wireName());
    }
}
