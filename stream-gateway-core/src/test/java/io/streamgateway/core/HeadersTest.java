package io.streamgateway.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HeadersTest {

    @Test
    void firstValueIgnoresNameCase() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("content-type", List.of("application/json"));

        assertThat(Headers.firstValue(headers, "Content-Type")).contains("application/json");
        assertThat(Headers.firstValue(headers, "X-Error")).isEmpty();
        assertThat(Headers.firstValue(null, "Content-Type")).isEmpty();
    }

    @Test
    void firstValueSkipsNullValues() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Accept", Arrays.asList(null, "text/event-stream"));

        assertThat(Headers.firstValue(headers, "accept")).contains("text/event-stream");
    }

    @Test
    void contentTypeChecksIgnoreParameters() {
        assertThat(Headers.normalizeContentType("Application/JSON; charset=utf-8")).isEqualTo("application/json");
        assertThat(Headers.isJson("application/problem+json")).isTrue();
        assertThat(Headers.isJson("text/plain")).isFalse();
        assertThat(Headers.isEventStream("text/event-stream;charset=UTF-8")).isTrue();
        assertThat(Headers.isEventStream(null)).isFalse();
    }
}
