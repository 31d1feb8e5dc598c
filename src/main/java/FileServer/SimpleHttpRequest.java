package FileServer;

import java.util.Map;
import java.util.TreeMap;

/**
 * Plain {@link HttpRequest} for hosts that have already parsed the request line and headers.
 */
public class SimpleHttpRequest implements HttpRequest {

    private final String method;
    private final String path;
    private final String documentRoot;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public SimpleHttpRequest(String method, String path, String documentRoot) {
        this(method, path, documentRoot, Map.of());
    }

    public SimpleHttpRequest(String method, String path, String documentRoot, Map<String, String> headers) {
        this.method = method;
        this.path = path;
        this.documentRoot = documentRoot;
        this.headers.putAll(headers);
    }

    public SimpleHttpRequest withHeader(String name, String value) {
        headers.put(name, value);
        return this;
    }

    @Override
    public String getMethod() {
        return method;
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public String getDocumentRoot() {
        return documentRoot;
    }

    @Override
    public String getHeader(String name) {
        return headers.get(name);
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
