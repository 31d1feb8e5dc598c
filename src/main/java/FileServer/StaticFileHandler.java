package FileServer;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves files from a document root, with ETag validation and single byte-range support.
 *
 * A host server calls {@link #handleRequest} once it has routed a request here. From
 * then on the handler owns the request: it resolves and opens the file, decides
 * between 304, 206 and 200 (or an error status), streams the body in chunks, closes
 * the file and completes the response. Every request gets its own file handle and
 * nothing is shared between requests.
 */
public class StaticFileHandler {

    private static final int HTTP_OK = 200;
    private static final int HTTP_PARTIAL_CONTENT = 206;
    private static final int HTTP_NOT_MODIFIED = 304;
    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_RANGE_NOT_SATISFIABLE = 416;
    private static final int HTTP_INTERNAL_ERROR = 500;

    private static final Logger logger = Logger.getLogger(StaticFileHandler.class.getName());
    private static final Logger auditLog = Logger.getLogger("requests");

    private final StaticFileConfig config;
    private final FileResolver resolver;
    private final MimeTypes mimeTypes;
    private final RequestLogger requestLogger;

    public StaticFileHandler() {
        this(new StaticFileConfig());
    }

    public StaticFileHandler(StaticFileConfig config) {
        this(config, MimeTypes.fromFileNameMap());
    }

    public StaticFileHandler(StaticFileConfig config, MimeTypes mimeTypes) {
        this(config, mimeTypes, new FileResolver(config));
    }

    StaticFileHandler(StaticFileConfig config, MimeTypes mimeTypes, FileResolver resolver) {
        this.config = config;
        this.resolver = resolver;
        this.mimeTypes = mimeTypes;
        this.requestLogger = new RequestLogger(auditLog, config);
    }

    /**
     * Handles the request through to completion. Returns before the body has been
     * fully sent when the transport completes pushes asynchronously.
     */
    public void handleRequest(HttpRequest request, HttpResponse response) {
        String path = resolver.applyDefaultFilename(request.getPath());
        Exchange exchange = new Exchange(requestLogger.generateRequestId(), request.getMethod(), path, response);

        FileResource file;
        try {
            Path resolved = resolver.resolve(request.getDocumentRoot(), request.getPath());
            file = resolver.open(resolved, path);
        } catch (FileResolver.NotFoundException e) {
            requestLogger.logDebug(exchange.requestId, e.getMessage());
            fileNotFound(exchange, "The file " + path + " was not found.", request.isHead());
            return;
        } catch (FileResolver.OpenFailureException e) {
            requestLogger.logError(exchange.requestId, "Failed to open " + path, e.getCause());
            fileNotFound(exchange, "The file " + path + " could not be opened.", request.isHead());
            return;
        }

        exchange.file = file;
        try {
            sendFile(request, exchange, file);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Error serving " + path, e);
            if (!exchange.isFinished()) {
                exchange.status = HTTP_INTERNAL_ERROR;
                exchange.response.setStatus(HTTP_INTERNAL_ERROR);
            }
            exchange.finish(0);
        }
    }

    private void fileNotFound(Exchange exchange, String message, boolean headOnly) {
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        HttpResponse response = exchange.response;
        exchange.status = HTTP_NOT_FOUND;
        response.setStatus(HTTP_NOT_FOUND);
        response.addHeader("Content-Type", "text/plain; charset=utf-8");
        response.addHeader("Content-Length", String.valueOf(body.length));
        if (headOnly) {
            exchange.finish(0);
            return;
        }
        response.appendBody(body);
        exchange.finish(body.length);
    }

    private void sendFile(HttpRequest request, Exchange exchange, FileResource file) {
        HttpResponse response = exchange.response;
        response.addHeader("Accept-Ranges", "bytes");

        String rangeHeader = request.getHeader("Range");
        if (rangeHeader != null) {
            List<ByteRange> ranges = RangeHeaderParser.parse(rangeHeader, file.getSize());
            if (ranges.size() == 1) {
                performRangeRequest(request, exchange, file, ranges.get(0));
                return;
            } else if (ranges.size() > 1) {
                // multipart/byteranges is not supported
                requestLogger.logDebug(exchange.requestId, "Rejecting multi-range request: " + rangeHeader);
                exchange.status = HTTP_INTERNAL_ERROR;
                response.setStatus(HTTP_INTERNAL_ERROR);
                exchange.finish(0);
                return;
            }
            requestLogger.logDebug(exchange.requestId, "No usable range in '" + rangeHeader + "', sending full content");
        }

        String eTag = ETagGenerator.generateETag(file);
        String ifNoneMatch = request.getHeader("If-None-Match");
        if (ETagGenerator.matches(ifNoneMatch, eTag)) {
            exchange.status = HTTP_NOT_MODIFIED;
            response.setStatus(HTTP_NOT_MODIFIED);
            exchange.finish(0);
            return;
        }

        long size = file.getSize();
        exchange.status = HTTP_OK;
        response.setStatus(HTTP_OK);
        response.addHeader("Content-Type", contentTypeOf(file));
        response.addHeader("Content-Length", String.valueOf(size));
        response.addHeader("ETag", eTag);

        if (request.isHead()) {
            exchange.finish(0);
            return;
        }

        streamBody(exchange, file, size);
    }

    private void performRangeRequest(HttpRequest request, Exchange exchange, FileResource file, ByteRange requested) {
        HttpResponse response = exchange.response;
        long size = file.getSize();

        if (!requested.isSatisfiable(size)) {
            requestLogger.logDebug(exchange.requestId, "Range " + requested + " not satisfiable for size " + size);
            exchange.status = HTTP_RANGE_NOT_SATISFIABLE;
            response.setStatus(HTTP_RANGE_NOT_SATISFIABLE);
            response.addHeader("Content-Range", "bytes */" + size);
            exchange.finish(0);
            return;
        }

        ByteRange range = requested.clampTo(size);
        long rangeCount = range.count();

        exchange.status = HTTP_PARTIAL_CONTENT;
        response.setStatus(HTTP_PARTIAL_CONTENT);
        response.addHeader("Content-Length", String.valueOf(rangeCount));
        response.addHeader("Content-Type", contentTypeOf(file));
        response.addHeader("Content-Range", range.toContentRange(size));

        if (request.isHead()) {
            exchange.finish(0);
            return;
        }

        file.setMarker(range.getLower());
        streamBody(exchange, file, rangeCount);
    }

    private void streamBody(Exchange exchange, FileResource file, long count) {
        FileStreamer streamer = new FileStreamer(file, exchange.response, config.getChunkSize(), count);
        streamer.stream(ok -> {
            if (!ok) {
                requestLogger.logError(exchange.requestId, "Streaming aborted after "
                    + streamer.getBytesSent() + " of " + count + " bytes", null);
            }
            exchange.finish(streamer.getBytesSent());
        });
    }

    private String contentTypeOf(FileResource file) {
        Path fileName = file.getPath().getFileName();
        return mimeTypes.forExtension(MimeTypes.extensionOf(fileName == null ? "" : fileName.toString()));
    }

    /**
     * Per-request bookkeeping. Guarantees the file is closed, the response completed
     * and the request logged exactly once.
     */
    private final class Exchange {
        final String requestId;
        final String method;
        final String path;
        final HttpResponse response;
        final long startTime = System.currentTimeMillis();
        final AtomicBoolean finished = new AtomicBoolean();
        volatile FileResource file;
        volatile int status;

        Exchange(String requestId, String method, String path, HttpResponse response) {
            this.requestId = requestId;
            this.method = method;
            this.path = path;
            this.response = response;
        }

        boolean isFinished() {
            return finished.get();
        }

        void finish(long bytesSent) {
            if (!finished.compareAndSet(false, true)) {
                return;
            }
            FileResource toClose = file;
            if (toClose != null) {
                toClose.close();
            }
            try {
                response.completed();
            } finally {
                requestLogger.logRequest(requestId, method, path, status,
                    System.currentTimeMillis() - startTime, bytesSent);
            }
        }
    }
}
