/**
 * The gateway data plane session engine and its framework-neutral HTTP handler.
 *
 * <p>{@link io.streamgateway.server.core.Gateway} composes a
 * {@link io.streamgateway.server.core.SessionTable} of
 * {@link io.streamgateway.server.core.Session}s, each fed by one bridge task through a bounded
 * {@link io.streamgateway.server.core.EventBuffer} and drained by at most one
 * {@link io.streamgateway.server.core.StreamPublisher}.
 * {@link io.streamgateway.server.core.GatewayHandler} maps HTTP routes onto it; hosting
 * frameworks adapt {@link io.streamgateway.server.core.ServerRequest} and
 * {@link io.streamgateway.server.core.ServerResponse}.
 */
package io.streamgateway.server.core;
