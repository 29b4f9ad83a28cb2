package io.streamgateway.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UrlsTest {

    @Test
    void resolveKeepsBasePathAndDropsTrailingSlash() {
        assertThat(Urls.resolve(URI.create("http://localhost:9001/api/"), "/stream"))
                .isEqualTo(URI.create("http://localhost:9001/api/stream"));
        assertThat(Urls.resolve(URI.create("http://localhost:9001"), "math/add"))
                .isEqualTo(URI.create("http://localhost:9001/math/add"));
    }

    @Test
    void withQuerySortsAndEncodesParameters() {
        URI uri = Urls.withQuery(URI.create("http://localhost/stream"), Map.of("n", "50", "a b", "c&d"));
        assertThat(uri.toString()).isEqualTo("http://localhost/stream?a+b=c%26d&n=50");
    }

    @Test
    void normalizeContentTypeStripsParameters() {
        assertThat(Headers.normalizeContentType("Application/JSON; charset=utf-8")).isEqualTo("application/json");
        assertThat(Headers.firstValue(Map.of("content-type", java.util.List.of("text/plain")), "Content-Type"))
                .contains("text/plain");
    }
}
