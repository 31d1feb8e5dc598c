package FileServer;

import java.net.FileNameMap;
import java.net.URLConnection;

/**
 * Maps a file extension to a content type.
 */
public interface MimeTypes {

    String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    String forExtension(String extension);

    /**
     * Returns the lookup backed by the JDK's built-in content-types table.
     */
    static MimeTypes fromFileNameMap() {
        FileNameMap fileNameMap = URLConnection.getFileNameMap();
        return extension -> {
            if (extension == null || extension.isEmpty()) {
                return DEFAULT_CONTENT_TYPE;
            }
            String mimeType = fileNameMap.getContentTypeFor("file." + extension);
            return mimeType != null ? mimeType : DEFAULT_CONTENT_TYPE;
        };
    }

    static String extensionOf(String fileName) {
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        int dot = fileName.lastIndexOf('.');
        if (dot <= slash + 1 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1);
    }
}
