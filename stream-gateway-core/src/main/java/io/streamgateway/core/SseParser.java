package io.streamgateway.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Minimal SSE parser for backend event streams.
 *
 * <p>Comment lines ({@code :...}) and blocks without any {@code data:} line are skipped, so
 * keep-alives sent by a backend never surface as frames.
 */
public final class SseParser implements AutoCloseable {

    public record Event(String eventType, String data) {}

    private final BufferedReader in;

    public SseParser(InputStream is) {
        this.in = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    /** @return next event, or {@code null} if EOF */
    public Event next() throws IOException {
        while (true) {
            String eventType = "message";
            StringBuilder data = new StringBuilder();
            boolean seenAny = false;
            boolean hasData = false;

            String line;
            while ((line = in.readLine()) != null) {
                seenAny = true;
                if (line.isEmpty()) break;
                if (line.startsWith(":")) continue;
                if (line.startsWith("event:")) {
                    eventType = line.substring("event:".length()).trim();
                } else if (line.startsWith("data:")) {
                    hasData = true;
                    data.append(stripLeadingSpace(line.substring("data:".length()))).append("\n");
                }
            }

            if (!seenAny) return null;
            if (hasData) return new Event(eventType, stripTrailingNewline(data.toString()));
        }
    }

    private static String stripLeadingSpace(String s) {
        return s.startsWith(" ") ? s.substring(1) : s;
    }

    private static String stripTrailingNewline(String s) {
        int len = s.length();
        while (len > 0 && (s.charAt(len - 1) == '\n' || s.charAt(len - 1) == '\r')) len--;
        return s.substring(0, len);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
