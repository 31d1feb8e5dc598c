package FileServer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Parses Range request headers of the form {@code bytes=0-3/7-9/10-}.
 *
 * Sub-ranges are separated by '/' or ','. Each is either {@code lower-upper}
 * (upper inclusive on the wire) or {@code lower-} (up to the end of the file).
 * A sub-range that does not parse is dropped; it never fails the whole header.
 * Comma-separated lists count as multiple ranges too, so {@code bytes=0-3,7-9}
 * yields two ranges and is rejected by the handler as an unsupported
 * multi-range request rather than served as full content.
 */
public final class RangeHeaderParser {

    private static final Logger logger = Logger.getLogger(RangeHeaderParser.class.getName());

    private static final String BYTES_UNIT = "bytes";

    private RangeHeaderParser() {
    }

    /**
     * @param header the Range header value
     * @param size the file size, used as the upper bound of open-ended ranges
     * @return the parsed ranges in request order; empty if none parsed
     */
    public static List<ByteRange> parse(String header, long size) {
        if (header == null) {
            return Collections.emptyList();
        }
        String[] initialSplit = header.trim().split("=", -1);
        if (initialSplit.length != 2 || !initialSplit[0].trim().equals(BYTES_UNIT)) {
            logger.fine("Ignoring Range header with unsupported unit or shape: " + header);
            return Collections.emptyList();
        }

        List<ByteRange> ranges = new ArrayList<>();
        for (String subRange : initialSplit[1].split("[/,]")) {
            ByteRange range = parseOneRange(subRange.trim(), size);
            if (range != null) {
                ranges.add(range);
            }
        }
        return ranges;
    }

    /**
     * Parses "0-3" or "0-". Returns null if the sub-range is malformed.
     */
    static ByteRange parseOneRange(String subRange, long size) {
        int dash = subRange.indexOf('-');
        if (dash <= 0 || dash != subRange.lastIndexOf('-')) {
            return null;
        }
        try {
            long lower = Long.parseLong(subRange.substring(0, dash).trim());
            String upperPart = subRange.substring(dash + 1).trim();
            if (lower < 0) {
                return null;
            }
            if (upperPart.isEmpty()) {
                return new ByteRange(lower, Math.max(lower, size));
            }
            long upper = Long.parseLong(upperPart);
            if (upper < lower || upper == Long.MAX_VALUE) {
                return null;
            }
            return new ByteRange(lower, upper + 1);
        } catch (NumberFormatException e) {
            logger.fine("Dropping malformed sub-range: " + subRange);
            return null;
        }
    }
}
