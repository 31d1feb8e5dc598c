package FileServer;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An open, read-only handle on a regular file being served by one request.
 *
 * Size and modification time are captured when the file is opened. Reads happen
 * at the marker, which advances by the number of bytes read and never leaves
 * {@code [0, size]}. Not thread-safe; owned by a single request.
 */
public class FileResource implements Closeable {

    private static final Logger logger = Logger.getLogger(FileResource.class.getName());

    private final Path path;
    private final FileChannel channel;
    private final long size;
    private final long modificationTime;
    private long marker;
    private boolean open = true;

    FileResource(Path path, FileChannel channel, long size, long modificationTime) {
        this.path = path;
        this.channel = channel;
        this.size = size;
        this.modificationTime = modificationTime;
    }

    /**
     * Opens the file for reading and captures its size and modification time.
     */
    public static FileResource open(Path path) throws IOException {
        Path absolute = path.toAbsolutePath();
        FileChannel channel = FileChannel.open(absolute, StandardOpenOption.READ);
        try {
            long modificationTime = Files.getLastModifiedTime(absolute).toMillis();
            return new FileResource(absolute, channel, channel.size(), modificationTime);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    public Path getPath() {
        return path;
    }

    public long getSize() {
        return size;
    }

    /**
     * Modification time in milliseconds since the epoch.
     */
    public long getModificationTime() {
        return modificationTime;
    }

    public long getMarker() {
        return marker;
    }

    public void setMarker(long marker) {
        if (marker < 0 || marker > size) {
            throw new IllegalArgumentException("Marker " + marker + " outside [0, " + size + "]");
        }
        this.marker = marker;
    }

    /**
     * Reads up to {@code count} bytes starting at the marker.
     *
     * Fewer bytes are returned only when the end of the file is reached.
     *
     * @throws EOFException if the file shrank below its recorded size while being read
     */
    public byte[] readSomeBytes(int count) throws IOException {
        if (!open) {
            throw new IOException("File is closed: " + path);
        }
        int toRead = (int) Math.min(count, size - marker);
        ByteBuffer buffer = ByteBuffer.allocate(Math.max(toRead, 0));
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, marker + buffer.position());
            if (read < 0) {
                throw new EOFException("Unexpected end of file at " + (marker + buffer.position()) + ": " + path);
            }
        }
        marker += buffer.position();
        return buffer.array();
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Closes the underlying channel. Calling this more than once has no effect.
     */
    @Override
    public void close() {
        if (!open) {
            return;
        }
        open = false;
        try {
            channel.close();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error closing file: " + path, e);
        }
    }
}
