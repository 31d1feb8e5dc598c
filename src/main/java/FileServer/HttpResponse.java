package FileServer;

import java.util.concurrent.CompletionStage;

/**
 * The host server's response object.
 *
 * Status and headers must be set before the first push. Body bytes are
 * appended to an outgoing buffer and handed to the transport by {@link #push()}.
 */
public interface HttpResponse {

    void setStatus(int status);

    void addHeader(String name, String value);

    void appendBody(byte[] bytes, int offset, int length);

    default void appendBody(byte[] bytes) {
        appendBody(bytes, 0, bytes.length);
    }

    /**
     * Hands the buffered headers and body to the transport.
     *
     * The returned stage completes with true once the transport has accepted the data
     * and is ready for more, or with false (or exceptionally) if the write failed.
     * It may already be complete when returned.
     */
    CompletionStage<Boolean> push();

    /**
     * Sends whatever is still buffered and marks the response as finished.
     * Only the first call has any effect.
     */
    void completed();
}
