/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.client.transport;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.WebSocket;
import reactor.core.publisher.Mono;

import io.signalr.spec.Connection;
import io.signalr.util.Assert;

/**
 * {@link WebSocketDialer} backed by OkHttp.
 */
public class OkHttpWebSocketDialer implements WebSocketDialer {

	private final OkHttpClient client;

	/**
	 * Creates a dialer with a client that never times out reads, since hub connections
	 * can stay silent between pings.
	 */
	public OkHttpWebSocketDialer() {
		this(new OkHttpClient.Builder().connectTimeout(Duration.ofSeconds(10)).readTimeout(Duration.ZERO).build());
	}

	public OkHttpWebSocketDialer(OkHttpClient client) {
		Assert.notNull(client, "client must not be null");
		this.client = client;
	}

	@Override
	public Mono<Connection> dial(URI uri, Map<String, String> headers, String connectionId) {
		return Mono.create(sink -> {
			Request.Builder request = new Request.Builder().url(uri.toString());
			headers.forEach(request::header);
			WebSocketConnection connection = new WebSocketConnection(connectionId);
			WebSocket webSocket = this.client.newWebSocket(request.build(), connection.listener(sink));
			sink.onCancel(webSocket::cancel);
		});
	}

}
