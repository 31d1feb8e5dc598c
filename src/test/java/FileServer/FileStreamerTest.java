package FileServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("File Streamer Tests")
class FileStreamerTest {

    @TempDir
    Path tempDir;

    private byte[] content;
    private FileResource file;
    private final List<Boolean> outcomes = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        content = new byte[10_000];
        new Random(42).nextBytes(content);
        Path path = tempDir.resolve("data.bin");
        Files.write(path, content);
        file = FileResource.open(path);
    }

    @AfterEach
    void tearDown() {
        file.close();
    }

    @Nested
    @DisplayName("Chunking")
    class ChunkingTests {

        @Test
        @DisplayName("Should deliver the exact span in chunks no larger than the chunk size")
        void testChunksConcatenate() {
            RecordingResponse response = new RecordingResponse();
            FileStreamer streamer = new FileStreamer(file, response, 3_000, content.length);

            streamer.stream(outcomes::add);

            assertThat(outcomes).containsExactly(true);
            assertThat(streamer.getState()).isEqualTo(FileStreamer.State.DONE);
            assertThat(response.chunks).hasSize(4);
            assertThat(response.chunks).allSatisfy(chunk -> assertThat(chunk.length).isLessThanOrEqualTo(3_000));
            assertThat(response.body()).isEqualTo(content);
            assertThat(streamer.getBytesSent()).isEqualTo(content.length);
            assertThat(streamer.getChunksSent()).isEqualTo(4);
        }

        @Test
        @DisplayName("Should stream only the span after the marker")
        void testPartialSpan() {
            file.setMarker(1_000);
            RecordingResponse response = new RecordingResponse();
            FileStreamer streamer = new FileStreamer(file, response, 700, 2_500);

            streamer.stream(outcomes::add);

            assertThat(outcomes).containsExactly(true);
            assertThat(response.body()).isEqualTo(Arrays.copyOfRange(content, 1_000, 3_500));
            assertThat(file.getMarker()).isEqualTo(3_500);
        }

        @Test
        @DisplayName("Should complete without pushing when nothing remains")
        void testZeroBytes() {
            RecordingResponse response = new RecordingResponse();
            FileStreamer streamer = new FileStreamer(file, response, 1_000, 0);

            streamer.stream(outcomes::add);

            assertThat(outcomes).containsExactly(true);
            assertThat(response.pushCount).isZero();
        }

        @Test
        @DisplayName("Should not grow the stack on many synchronous pushes")
        void testManyChunks() {
            RecordingResponse response = new RecordingResponse();
            FileStreamer streamer = new FileStreamer(file, response, 1, content.length);

            streamer.stream(outcomes::add);

            assertThat(outcomes).containsExactly(true);
            assertThat(response.chunks).hasSize(content.length);
            assertThat(response.body()).isEqualTo(content);
        }

        @Test
        @DisplayName("Should refuse spans beyond the end of the file")
        void testSpanTooLarge() {
            file.setMarker(9_000);
            assertThatThrownBy(() -> new FileStreamer(file, new RecordingResponse(), 100, 1_001))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Backpressure")
    class BackpressureTests {

        @Test
        @DisplayName("Should wait for each push before reading the next chunk")
        void testOneChunkInFlight() {
            RecordingResponse response = new RecordingResponse().async();
            FileStreamer streamer = new FileStreamer(file, response, 4_000, content.length);

            streamer.stream(outcomes::add);
            assertThat(response.pushCount).isEqualTo(1);
            assertThat(response.pendingPushCount()).isEqualTo(1);
            assertThat(streamer.getState()).isEqualTo(FileStreamer.State.FLUSHING);
            assertThat(file.getMarker()).isEqualTo(4_000);

            response.completeNextPush(true);
            assertThat(response.pushCount).isEqualTo(2);
            assertThat(file.getMarker()).isEqualTo(8_000);
            assertThat(outcomes).isEmpty();

            response.completeNextPush(true);
            response.completeNextPush(true);

            assertThat(response.pushCount).isEqualTo(3);
            assertThat(outcomes).containsExactly(true);
            assertThat(response.body()).isEqualTo(content);
        }

        @Test
        @DisplayName("Should stop after a pending push fails")
        void testAsyncFailure() {
            RecordingResponse response = new RecordingResponse().async();
            FileStreamer streamer = new FileStreamer(file, response, 4_000, content.length);

            streamer.stream(outcomes::add);
            response.completeNextPush(false);

            assertThat(outcomes).containsExactly(false);
            assertThat(streamer.getState()).isEqualTo(FileStreamer.State.FAILED);
            assertThat(response.pushCount).isEqualTo(1);
            assertThat(file.getMarker()).isEqualTo(4_000);
        }

        @Test
        @DisplayName("Should fail once when the response throws after a pending push")
        void testResponseErrorOnResume() {
            RecordingResponse response = new RecordingResponse() {
                private int appends;

                @Override
                public void appendBody(byte[] bytes, int offset, int length) {
                    if (++appends == 2) {
                        throw new IllegalStateException("Response buffer released");
                    }
                    super.appendBody(bytes, offset, length);
                }
            }.async();
            FileStreamer streamer = new FileStreamer(file, response, 4_000, content.length);

            streamer.stream(outcomes::add);
            response.completeNextPush(true);

            assertThat(outcomes).containsExactly(false);
            assertThat(streamer.getState()).isEqualTo(FileStreamer.State.FAILED);
            assertThat(response.pushCount).isEqualTo(1);
        }

        @Test
        @DisplayName("Should treat an exceptionally completed push as failure")
        void testAsyncException() {
            RecordingResponse response = new RecordingResponse().async();
            FileStreamer streamer = new FileStreamer(file, response, 4_000, content.length);

            streamer.stream(outcomes::add);
            response.completeNextPush(true);
            response.failNextPush(new IOException("Connection reset by peer"));

            assertThat(outcomes).containsExactly(false);
            assertThat(response.pushCount).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should stop reading after a write failure")
        void testWriteFailure() {
            RecordingResponse response = new RecordingResponse().failPushAt(2);
            FileStreamer streamer = new FileStreamer(file, response, 1_000, content.length);

            streamer.stream(outcomes::add);

            assertThat(outcomes).containsExactly(false);
            assertThat(response.pushCount).isEqualTo(2);
            assertThat(file.getMarker()).isEqualTo(2_000);
            assertThat(streamer.getBytesSent()).isEqualTo(1_000);
        }

        @Test
        @DisplayName("Should fail without writing when the file cannot be read")
        void testReadFailure() throws IOException {
            FileResource broken = mock(FileResource.class);
            when(broken.getSize()).thenReturn(100L);
            when(broken.getMarker()).thenReturn(0L);
            when(broken.getPath()).thenReturn(Paths.get("broken.bin"));
            when(broken.readSomeBytes(anyInt())).thenThrow(new IOException("Input/output error"));
            HttpResponse response = mock(HttpResponse.class);

            FileStreamer streamer = new FileStreamer(broken, response, 10, 100);
            streamer.stream(outcomes::add);

            assertThat(outcomes).containsExactly(false);
            verify(response, never()).appendBody(any(byte[].class), anyInt(), anyInt());
            verify(response, never()).push();
            verify(broken, never()).close();
        }

        @Test
        @DisplayName("Should refuse to start twice")
        void testStartTwice() {
            FileStreamer streamer = new FileStreamer(file, new RecordingResponse(), 1_000, 10);
            streamer.stream(outcomes::add);
            assertThatThrownBy(() -> streamer.stream(outcomes::add)).isInstanceOf(IllegalStateException.class);
            assertThat(outcomes).containsExactly(true);
        }
    }
}
