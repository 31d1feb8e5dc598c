package FileServer;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes an HTTP/1.x response to a blocking {@link OutputStream}, e.g. a socket's.
 *
 * The status line and headers go out with the first push. Every push writes and
 * flushes the buffered body, so its stage is always complete on return.
 */
public class StreamHttpResponse implements HttpResponse {

    private static final Logger logger = Logger.getLogger(StreamHttpResponse.class.getName());

    private final OutputStream outputStream;
    private final String httpVersion;
    private final List<String[]> headers = new ArrayList<>();
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();
    private int status = 200;
    private boolean headersSent;
    private boolean failed;
    private boolean completed;
    private long bodyBytesWritten;

    public StreamHttpResponse(OutputStream outputStream) {
        this(outputStream, "HTTP/1.1");
    }

    public StreamHttpResponse(OutputStream outputStream, String httpVersion) {
        this.outputStream = outputStream;
        this.httpVersion = httpVersion;
    }

    @Override
    public void setStatus(int status) {
        if (headersSent) {
            throw new IllegalStateException("Headers already sent");
        }
        this.status = status;
    }

    @Override
    public void addHeader(String name, String value) {
        if (headersSent) {
            throw new IllegalStateException("Headers already sent");
        }
        headers.add(new String[] {name, value});
    }

    @Override
    public void appendBody(byte[] bytes, int offset, int length) {
        body.write(bytes, offset, length);
    }

    @Override
    public CompletionStage<Boolean> push() {
        return CompletableFuture.completedFuture(writeBuffered());
    }

    @Override
    public void completed() {
        if (completed) {
            return;
        }
        completed = true;
        if (!headersSent && status != 304 && getHeader("Content-Length") == null) {
            headers.add(new String[] {"Content-Length", String.valueOf(body.size())});
        }
        if (!writeBuffered()) {
            logger.fine("Response could not be completed, connection lost");
        }
    }

    private boolean writeBuffered() {
        if (failed) {
            return false;
        }
        try {
            if (!headersSent) {
                writeHeaders();
                headersSent = true;
            }
            body.writeTo(outputStream);
            bodyBytesWritten += body.size();
            body.reset();
            outputStream.flush();
            return true;
        } catch (IOException e) {
            failed = true;
            body.reset();
            logger.log(Level.FINE, "Write to client failed", e);
            return false;
        }
    }

    private void writeHeaders() throws IOException {
        StringBuilder head = new StringBuilder();
        head.append(httpVersion).append(' ').append(status).append(' ').append(reasonPhrase(status)).append("\r\n");
        for (String[] header : headers) {
            head.append(header[0]).append(": ").append(header[1]).append("\r\n");
        }
        head.append("\r\n");
        outputStream.write(head.toString().getBytes(StandardCharsets.ISO_8859_1));
    }

    public String getHeader(String name) {
        for (String[] header : headers) {
            if (header[0].equalsIgnoreCase(name)) {
                return header[1];
            }
        }
        return null;
    }

    public int getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return completed;
    }

    public long getBodyBytesWritten() {
        return bodyBytesWritten;
    }

    static String reasonPhrase(int status) {
        switch (status) {
            case 200:
                return "OK";
            case 206:
                return "Partial Content";
            case 304:
                return "Not Modified";
            case 404:
                return "Not Found";
            case 416:
                return "Range Not Satisfiable";
            case 500:
                return "Internal Server Error";
            default:
                return "Unknown";
        }
    }
}
