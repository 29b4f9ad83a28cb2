/**
 * Service provider interfaces between the session engine and its external collaborators.
 *
 * <p>{@link io.streamgateway.server.spi.BackendRegistry} is the control plane as seen by the
 * engine; {@link io.streamgateway.server.spi.BackendConnector} and
 * {@link io.streamgateway.server.spi.BackendStream} model the backend servers.
 */
package io.streamgateway.server.spi;
