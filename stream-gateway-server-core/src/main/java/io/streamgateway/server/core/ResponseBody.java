package io.streamgateway.server.core;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes, ResponseBody.Sse {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {}

    /**
     * A live event stream. The hosting framework subscribes, writes each rendered frame and
     * flushes, and cancels the subscription once the client is gone. If it fails before
     * subscribing it must call {@link StreamPublisher#abandon()}.
     */
    record Sse(StreamPublisher publisher) implements ResponseBody {}
}
