package io.streamgateway.server.core;

import io.streamgateway.core.CloseReason;
import io.streamgateway.core.Protocol;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One unit written to a client event stream.
 *
 * <p>Three kinds exist: a backend payload relayed verbatim as {@code data:} lines, a heartbeat
 * comment ({@code :}) that keeps idle connections open, and the terminal {@code end} event
 * carrying the close reason.
 */
public final class SseFrame {

    public enum Kind {
        DATA,
        HEARTBEAT,
        END
    }

    private static final SseFrame HEARTBEAT = new SseFrame(Kind.HEARTBEAT, null, "");

    private final Kind kind;
    private final String event;
    private final String data;

    private SseFrame(Kind kind, String event, String data) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.event = event;
        this.data = data == null ? "" : data;
    }

    public static SseFrame data(byte[] payload) {
        return new SseFrame(Kind.DATA, null, new String(payload, StandardCharsets.UTF_8));
    }

    public static SseFrame data(String payload) {
        return new SseFrame(Kind.DATA, null, payload);
    }

    public static SseFrame heartbeat() {
        return HEARTBEAT;
    }

    public static SseFrame end(CloseReason reason) {
        Objects.requireNonNull(reason, "reason");
        return new SseFrame(Kind.END, Protocol.EVENT_END,
                "{\"" + Protocol.F_REASON + "\":\"" + reason.wireName() + "\"}");
    }

    public Kind kind() {
        return kind;
    }

    /** Event type, or {@code null} for unnamed data frames and heartbeats. */
    public String event() {
        return event;
    }

    public String data() {
        return data;
    }

    /**
     * Render as an SSE event block (without HTTP headers).
     */
    public String render() {
        if (kind == Kind.HEARTBEAT) return ":\n\n";

        StringBuilder sb = new StringBuilder();
        if (event != null) {
            sb.append("event: ").append(event).append("\n");
        }
        // data can include newlines; each line must be prefixed with "data:"
        String[] lines = data.split("\r?\n", -1);
        for (String line : lines) {
            sb.append("data: ").append(line).append("\n");
        }
        sb.append("\n");
        return sb.toString();
    }
}
