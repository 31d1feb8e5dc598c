package FileServer;

import java.util.Objects;

/**
 * A half-open interval {@code [lower, upper)} of file offsets.
 */
public final class ByteRange {

    private final long lower;
    private final long upper;

    public ByteRange(long lower, long upper) {
        if (lower < 0 || upper < lower) {
            throw new IllegalArgumentException("Invalid range [" + lower + ", " + upper + ")");
        }
        this.lower = lower;
        this.upper = upper;
    }

    public static ByteRange wholeFile(long size) {
        return new ByteRange(0, size);
    }

    public long getLower() {
        return lower;
    }

    /**
     * Exclusive upper bound.
     */
    public long getUpper() {
        return upper;
    }

    public long count() {
        return upper - lower;
    }

    /**
     * Whether at least one byte of the range lies inside a file of the given size.
     */
    public boolean isSatisfiable(long size) {
        return lower < size && lower < upper;
    }

    /**
     * Caps the upper bound at the file size.
     */
    public ByteRange clampTo(long size) {
        return upper <= size ? this : new ByteRange(lower, Math.max(lower, size));
    }

    /**
     * Renders the Content-Range value, e.g. "bytes 100-499/500".
     */
    public String toContentRange(long size) {
        return "bytes " + lower + "-" + (upper - 1) + "/" + size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteRange)) return false;
        ByteRange that = (ByteRange) o;
        return lower == that.lower && upper == that.upper;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper);
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + ")";
    }
}
