package io.streamgateway.http.spi;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.InputStream;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpClientAdapterTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    static Stream<HttpClientAdapter> adapters() {
        return Stream.of(JdkHttpClientAdapter.create(Duration.ofSeconds(2)), OkHttpClientAdapter.create());
    }

    @ParameterizedTest
    @MethodSource("adapters")
    void postSendsBodyAndReadsBufferedResponse(HttpClientAdapter adapter) throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "application/json")
                .setBody("{\"result\":15}"));

        HttpClientRequest request = HttpClientRequest.post(server.url("/math/add").uri())
                .body("{\"a\":10,\"b\":5}".getBytes(StandardCharsets.UTF_8), "application/json")
                .timeout(Duration.ofSeconds(2))
                .build();

        try (HttpClientResponse response = adapter.send(request)) {
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.header("Content-Type")).contains("application/json");
            assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo("{\"result\":15}");
            assertThat(response.bodyAsStream()).isNull();
        }

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/math/add");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"a\":10,\"b\":5}");
    }

    @ParameterizedTest
    @MethodSource("adapters")
    void streamingResponseExposesBodyStreamAndClosesIdempotently(HttpClientAdapter adapter) throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "text/event-stream")
                .setBody("data: one\n\n"));

        HttpClientResponse response = adapter.sendStreaming(HttpClientRequest.get(server.url("/stream").uri()).build());
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isNull();

        InputStream body = response.bodyAsStream();
        assertThat(new String(body.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("data: one\n\n");

        response.close();
        response.close();
    }

    @ParameterizedTest
    @MethodSource("adapters")
    void refusedConnectionSurfacesAsClientException(HttpClientAdapter adapter) throws Exception {
        URI dead = URI.create("http://127.0.0.1:" + unusedPort() + "/stream");

        assertThatThrownBy(() -> adapter.sendStreaming(HttpClientRequest.get(dead).build()))
                .isInstanceOf(HttpClientException.class)
                .satisfies(e -> assertThat(((HttpClientException) e).target()).isEqualTo("GET " + dead));
    }

    private static int unusedPort() throws Exception {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
