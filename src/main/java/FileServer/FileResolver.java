package FileServer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Maps request paths onto files under a document root and opens them.
 */
public class FileResolver {

    private final String defaultFilename;

    public FileResolver(String defaultFilename) {
        this.defaultFilename = defaultFilename;
    }

    public FileResolver(StaticFileConfig config) {
        this(config.getDefaultFilename());
    }

    /**
     * Appends the default filename to directory-style paths ("/docs/" becomes "/docs/index.html").
     */
    public String applyDefaultFilename(String requestPath) {
        if (requestPath == null || requestPath.isEmpty()) {
            return "/" + defaultFilename;
        }
        if (requestPath.endsWith("/")) {
            return requestPath + defaultFilename;
        }
        return requestPath;
    }

    /**
     * Computes the file path for a request.
     *
     * @throws NotFoundException if the path is malformed or escapes the document root
     */
    public Path resolve(String documentRoot, String requestPath) throws NotFoundException {
        String path = applyDefaultFilename(requestPath);
        for (String segment : path.split("[/\\\\]")) {
            if (segment.equals("..")) {
                throw new NotFoundException(path, "path traversal rejected");
            }
        }

        try {
            Path root = Paths.get(documentRoot).toAbsolutePath().normalize();
            String relative = path.replaceFirst("^[/\\\\]+", "");
            Path resolved = root.resolve(relative).normalize();
            if (!resolved.startsWith(root)) {
                throw new NotFoundException(path, "path outside document root");
            }
            return resolved;
        } catch (InvalidPathException e) {
            throw new NotFoundException(path, "invalid path: " + e.getReason());
        }
    }

    /**
     * Opens a resolved path for reading.
     *
     * @param displayPath the request path, used in the exception message
     * @throws NotFoundException if nothing readable as a regular file exists there
     * @throws OpenFailureException if the file exists but could not be opened
     */
    public FileResource open(Path file, String displayPath) throws NotFoundException, OpenFailureException {
        if (!Files.isRegularFile(file)) {
            throw new NotFoundException(displayPath, "no regular file at " + file);
        }
        try {
            return FileResource.open(file);
        } catch (NoSuchFileException e) {
            // Deleted between the check and the open
            throw new NotFoundException(displayPath, "file disappeared: " + file);
        } catch (IOException | SecurityException e) {
            throw new OpenFailureException(displayPath, e);
        }
    }

    /**
     * No servable file exists at the requested path.
     */
    public static class NotFoundException extends IOException {
        private final String requestPath;

        public NotFoundException(String requestPath, String detail) {
            super("Not found: " + requestPath + " (" + detail + ")");
            this.requestPath = requestPath;
        }

        public String getRequestPath() {
            return requestPath;
        }
    }

    /**
     * The file exists but could not be opened, e.g. for lack of permission.
     */
    public static class OpenFailureException extends IOException {
        private final String requestPath;

        public OpenFailureException(String requestPath, Throwable cause) {
            super("Could not open: " + requestPath, cause);
            this.requestPath = requestPath;
        }

        public String getRequestPath() {
            return requestPath;
        }
    }
}
