/**
 * Protocol-centric core for the stream gateway.
 *
 * <p>This module is framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants, close reasons, and the gateway error taxonomy</li>
 *   <li>Lightweight utilities (header lookup, URL building)</li>
 *   <li>A minimal SSE parser used to read backend event streams</li>
 * </ul>
 *
 * <p>HTTP client/server bindings live in other modules.
 */
package io.streamgateway.core;
