package FileServer;

/**
 * The view of an incoming request that the static file handler needs from the host server.
 * Routing has already happened by the time the handler sees it.
 */
public interface HttpRequest {

    String getMethod();

    /**
     * The request path relative to the document root, e.g. "/docs/" or "/video.mp4".
     */
    String getPath();

    String getDocumentRoot();

    /**
     * Looks up a header by name, ignoring case.
     *
     * @return the header value, or null if absent
     */
    String getHeader(String name);

    default boolean isHead() {
        return "HEAD".equalsIgnoreCase(getMethod());
    }
}
