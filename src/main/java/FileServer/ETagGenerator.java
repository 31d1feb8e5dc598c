package FileServer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes ETags from a file's path and modification time.
 *
 * The value is the lowercase hex SHA-1 of {@code path + modificationTime}. The same
 * method feeds both the ETag response header and the If-None-Match comparison, so
 * an unchanged file always yields the tag the client cached.
 */
public final class ETagGenerator {

    private static final String DIGEST_ALGORITHM = "SHA-1";

    private ETagGenerator() {
    }

    public static String generateETag(FileResource file) {
        return generateETag(file.getPath().toString(), file.getModificationTime());
    }

    public static String generateETag(String path, long modificationTime) {
        String eTagStr = path + modificationTime;
        byte[] hash = newDigest().digest(eTagStr.getBytes(StandardCharsets.UTF_8));

        StringBuilder sb = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    /**
     * Exact comparison of an If-None-Match value against the current ETag.
     */
    public static boolean matches(String ifNoneMatch, String currentETag) {
        return ifNoneMatch != null && ifNoneMatch.equals(currentETag);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to ship SHA-1
            throw new IllegalStateException(DIGEST_ALGORITHM + " not available", e);
        }
    }
}
