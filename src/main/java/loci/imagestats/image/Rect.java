package loci.imagestats.image;

import java.util.ArrayList;
import java.util.List;

/**
 * Integer pixel rectangle with its origin at the top-left corner.
 *
 * <p>Width and height may be zero. Negative extents only arise from callers building a
 * rectangle by hand; {@link #area()} treats them as empty.</p>
 *
 * @param x      Left edge (inclusive)
 * @param y      Top edge (inclusive)
 * @param width  Width in pixels
 * @param height Height in pixels
 */
public record Rect(int x, int y, int width, int height) {

    public static final Rect EMPTY = new Rect(0, 0, 0, 0);

    /**
     * Builds the rectangle spanning two corners, whichever order they are given in.
     */
    public static Rect fromCorners(int x0, int y0, int x1, int y1) {
        int minX = Math.min(x0, x1);
        int minY = Math.min(y0, y1);
        return new Rect(minX, minY, Math.max(x0, x1) - minX, Math.max(y0, y1) - minY);
    }

    /** Right edge (exclusive), saturated to the int range. */
    public int maxX() {
        return saturatedAdd(x, width);
    }

    /** Bottom edge (exclusive), saturated to the int range. */
    public int maxY() {
        return saturatedAdd(y, height);
    }

    private long right() {
        return (long) x + width;
    }

    private long bottom() {
        return (long) y + height;
    }

    public long area() {
        if (width <= 0 || height <= 0) {
            return 0;
        }
        return (long) width * height;
    }

    public boolean isEmpty() {
        return area() == 0;
    }

    /**
     * Returns true if this rectangle lies completely inside {@code other}.
     */
    public boolean isInside(Rect other) {
        return x >= other.x && y >= other.y && right() <= other.right() && bottom() <= other.bottom();
    }

    public boolean contains(int px, int py) {
        return px >= x && py >= y && px < right() && py < bottom();
    }

    /**
     * Intersection of two rectangles. Disjoint rectangles produce an empty rectangle
     * anchored at the larger of the two origins.
     */
    public Rect intersect(Rect other) {
        int minX = Math.max(x, other.x);
        int minY = Math.max(y, other.y);
        long w = Math.min(right(), other.right()) - minX;
        long h = Math.min(bottom(), other.bottom()) - minY;
        return new Rect(minX, minY, (int) Math.max(0, w), (int) Math.max(0, h));
    }

    /**
     * Parses a rectangle from text. Two notations are accepted:
     * <ul>
     *   <li>{@code [y0:y1, x0:x1]} slice notation, brackets optional</li>
     *   <li>{@code (x, y, width, height)}, parentheses optional, separated by commas or spaces</li>
     * </ul>
     *
     * @param text text to parse
     * @return the parsed rectangle
     * @throws IllegalArgumentException if the text matches neither notation
     */
    public static Rect parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Rectangle text is null");
        }
        String s = text.trim();

        if (s.contains(":")) {
            String inner = stripEnclosing(s, "[]");
            String[] parts = inner.split(",");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Expected '[y0:y1, x0:x1]' but got: " + text);
            }
            int[] ys = parseSlice(parts[0], text);
            int[] xs = parseSlice(parts[1], text);
            return fromCorners(xs[0], ys[0], xs[1], ys[1]);
        }

        String inner = stripEnclosing(s, "()[]");
        List<String> tokens = new ArrayList<>();
        for (String token : inner.split("[,\\s]+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        if (tokens.size() != 4) {
            throw new IllegalArgumentException("Expected '(x, y, width, height)' but got: " + text);
        }
        int px = parseInt(tokens.get(0), text);
        int py = parseInt(tokens.get(1), text);
        int w = parseInt(tokens.get(2), text);
        int h = parseInt(tokens.get(3), text);
        return fromCorners(px, py, saturatedAdd(px, w), saturatedAdd(py, h));
    }

    private static int[] parseSlice(String part, String original) {
        String[] bounds = part.trim().split(":");
        if (bounds.length != 2) {
            throw new IllegalArgumentException("Malformed slice '" + part.trim() + "' in: " + original);
        }
        return new int[]{parseInt(bounds[0], original), parseInt(bounds[1], original)};
    }

    private static int parseInt(String token, String original) {
        try {
            return Integer.parseInt(token.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer '" + token.trim() + "' in: " + original, e);
        }
    }

    private static String stripEnclosing(String s, String chars) {
        int start = 0;
        int end = s.length();
        while (start < end && (chars.indexOf(s.charAt(start)) >= 0 || Character.isWhitespace(s.charAt(start)))) {
            start++;
        }
        while (end > start && (chars.indexOf(s.charAt(end - 1)) >= 0 || Character.isWhitespace(s.charAt(end - 1)))) {
            end--;
        }
        return s.substring(start, end);
    }

    private static int saturatedAdd(int a, int b) {
        long sum = (long) a + b;
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, sum));
    }

    @Override
    public String toString() {
        return String.format("(%d, %d, %d, %d)", x, y, width, height);
    }
}
