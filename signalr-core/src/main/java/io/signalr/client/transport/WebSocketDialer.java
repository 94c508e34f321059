/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.client.transport;

import java.net.URI;
import java.util.Map;

import reactor.core.publisher.Mono;

import io.signalr.spec.Connection;

/**
 * Opens a WebSocket to a SignalR server and exposes it as a {@link Connection}.
 */
@FunctionalInterface
public interface WebSocketDialer {

	/**
	 * Dials {@code uri}.
	 * @param uri the {@code ws} or {@code wss} URI, already carrying the {@code id} and,
	 * if relocated, the {@code access_token} query parameters
	 * @param headers the handshake headers
	 * @param connectionId the negotiated connection id the resulting connection reports
	 * @return the open connection; errors if the handshake fails. Cancelling the
	 * subscription before the handshake completes cancels the dial.
	 */
	Mono<Connection> dial(URI uri, Map<String, String> headers, String connectionId);

}
