package io.streamgateway.server.spi;

import io.streamgateway.core.GatewayException;

import java.net.URI;

/**
 * Opens connections to a backend address.
 *
 * <p>A connector is stateless apart from its HTTP client; each stream it opens is an
 * independent handle owned by one session. The SPI is blocking; the session engine runs it on
 * its own threads.
 */
public interface BackendConnector {

    /**
     * Opens the backend's event stream.
     *
     * @throws GatewayException.BackendUnreachable if the stream cannot be opened
     */
    BackendStream openStream(URI backendAddress);

    /**
     * Performs one request/response call against a backend method. Independent of any open stream.
     *
     * @param payload request body, passed through verbatim
     * @param contentType content type of {@code payload}
     * @throws GatewayException.BackendUnreachable if the request cannot be delivered or times out
     */
    CallOutcome call(URI backendAddress, String method, byte[] payload, String contentType);
}
