package FileServer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Stream Response Tests")
class StreamHttpResponseTest {

    @TempDir
    Path webroot;

    @Test
    @DisplayName("Should write status line, headers and body")
    void testWritesResponse() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StreamHttpResponse response = new StreamHttpResponse(out);
        response.setStatus(200);
        response.addHeader("Content-Length", "5");
        response.appendBody("hello".getBytes());

        assertThat(response.push().toCompletableFuture().join()).isTrue();
        response.completed();

        assertThat(out.toString(StandardCharsets.ISO_8859_1))
            .isEqualTo("HTTP/1.1 200 OK\r\nContent-Length: 5\r\n\r\nhello");
        assertThat(response.getBodyBytesWritten()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should add Content-Length to bodies completed without a push")
    void testImplicitContentLength() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StreamHttpResponse response = new StreamHttpResponse(out);
        response.setStatus(500);
        response.completed();
        response.completed();

        assertThat(out.toString(StandardCharsets.ISO_8859_1))
            .isEqualTo("HTTP/1.1 500 Internal Server Error\r\nContent-Length: 0\r\n\r\n");
        assertThat(response.isCompleted()).isTrue();
    }

    @Test
    @DisplayName("Should report failed writes through the push stage")
    void testFailedWrite() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("Broken pipe");
            }
        };
        StreamHttpResponse response = new StreamHttpResponse(broken);
        response.appendBody("data".getBytes());

        assertThat(response.push().toCompletableFuture().join()).isFalse();
        assertThat(response.push().toCompletableFuture().join()).isFalse();
    }

    @Test
    @DisplayName("Should carry a range response end to end")
    void testWithHandler() throws IOException {
        Files.write(webroot.resolve("notes.txt"), "0123456789".getBytes());
        Properties properties = new Properties();
        properties.setProperty("static.chunk.size", "4");
        StaticFileHandler handler = new StaticFileHandler(new StaticFileConfig(properties));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StreamHttpResponse response = new StreamHttpResponse(out);
        handler.handleRequest(new SimpleHttpRequest("GET", "/notes.txt", webroot.toString())
            .withHeader("Range", "bytes=2-7"), response);

        String raw = out.toString(StandardCharsets.ISO_8859_1);
        assertThat(raw).startsWith("HTTP/1.1 206 Partial Content\r\n");
        assertThat(raw).contains("Content-Range: bytes 2-7/10\r\n", "Content-Length: 6\r\n", "Accept-Ranges: bytes\r\n");
        assertThat(raw).endsWith("\r\n\r\n234567");
        assertThat(response.isCompleted()).isTrue();
    }
}
