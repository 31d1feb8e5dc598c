package FileServer;

import java.io.IOException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Copies a span of an open file into a response in bounded chunks.
 *
 * Each chunk is read at the file's marker, appended to the response and pushed.
 * The next chunk is read only once the push has completed, so a single request
 * never has two chunks in flight. Pushes that complete immediately keep the loop
 * running on the current thread; pushes that complete later resume it from the
 * transport's completion callback. Either way the stack does not grow with the
 * number of chunks.
 *
 * The streamer neither closes the file nor completes the response. It reports
 * the outcome once through the completion callback and the caller cleans up.
 */
public class FileStreamer {

    private static final Logger logger = Logger.getLogger(FileStreamer.class.getName());

    public enum State {
        IDLE, READING, FLUSHING, DONE, FAILED
    }

    private final FileResource file;
    private final HttpResponse response;
    private final int chunkSize;

    private volatile State state = State.IDLE;
    private volatile long remaining;
    private volatile long bytesSent;
    private volatile int chunksSent;
    private Consumer<Boolean> completion;

    // Outcome of the most recent push, handed from the transport callback to the loop
    private volatile Boolean flushOk;
    private volatile Throwable flushError;

    public FileStreamer(FileResource file, HttpResponse response, int chunkSize, long remaining) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        if (remaining < 0 || remaining > file.getSize() - file.getMarker()) {
            throw new IllegalArgumentException("Cannot stream " + remaining + " bytes from marker "
                + file.getMarker() + " of a " + file.getSize() + " byte file");
        }
        this.file = file;
        this.response = response;
        this.chunkSize = chunkSize;
        this.remaining = remaining;
    }

    /**
     * Starts streaming. {@code completion} receives true after the last byte was
     * accepted by the transport, or false on the first read or write failure.
     */
    public void stream(Consumer<Boolean> completion) {
        if (state != State.IDLE) {
            throw new IllegalStateException("Streamer already started: " + state);
        }
        this.completion = completion;
        if (remaining == 0) {
            finish(true);
            return;
        }
        pump();
    }

    private void pump() {
        while (true) {
            state = State.READING;
            int thisRead = (int) Math.min(chunkSize, remaining);
            byte[] bytes;
            try {
                bytes = file.readSomeBytes(thisRead);
            } catch (IOException e) {
                logger.log(Level.WARNING, "Read failed at offset " + file.getMarker() + " of " + file.getPath(), e);
                finish(false);
                return;
            }
            if (bytes.length != thisRead) {
                logger.warning("Short read from " + file.getPath() + ": expected " + thisRead + ", got " + bytes.length);
                finish(false);
                return;
            }

            int chunkLength = bytes.length;
            response.appendBody(bytes, 0, chunkLength);
            remaining -= chunkLength;

            state = State.FLUSHING;
            CompletionStage<Boolean> pushed;
            try {
                pushed = response.push();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Push failed for " + file.getPath(), e);
                finish(false);
                return;
            }

            AtomicBoolean handoff = new AtomicBoolean();
            pushed.whenComplete((ok, error) -> {
                flushOk = ok;
                flushError = error;
                if (!handoff.compareAndSet(false, true)) {
                    // The loop returned while this push was pending: resume it here
                    try {
                        if (afterFlush(chunkLength)) {
                            pump();
                        }
                    } catch (RuntimeException e) {
                        // Would otherwise vanish inside the transport's future
                        logger.log(Level.WARNING, "Streaming failed after push for " + file.getPath(), e);
                        finish(false);
                    }
                }
            });
            if (handoff.compareAndSet(false, true)) {
                return;
            }
            if (!afterFlush(chunkLength)) {
                return;
            }
        }
    }

    /**
     * @return true if another chunk should be sent
     */
    private boolean afterFlush(int chunkLength) {
        Throwable error = flushError;
        if (error != null || !Boolean.TRUE.equals(flushOk)) {
            if (error != null) {
                logger.log(Level.FINE, "Transport rejected chunk for " + file.getPath(), error);
            } else {
                logger.fine("Transport rejected chunk for " + file.getPath());
            }
            finish(false);
            return false;
        }
        bytesSent += chunkLength;
        chunksSent++;
        if (remaining == 0) {
            finish(true);
            return false;
        }
        return true;
    }

    private void finish(boolean ok) {
        if (state == State.DONE || state == State.FAILED) {
            return;
        }
        state = ok ? State.DONE : State.FAILED;
        completion.accept(ok);
    }

    public State getState() {
        return state;
    }

    public long getRemaining() {
        return remaining;
    }

    /**
     * Bytes the transport has acknowledged.
     */
    public long getBytesSent() {
        return bytesSent;
    }

    public int getChunksSent() {
        return chunksSent;
    }
}
