/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.client.transport;

import java.io.IOException;
import java.net.URI;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.http.impl.client.CloseableHttpClient;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import io.signalr.spec.Connection;
import io.signalr.spec.NegotiateResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Tests for {@link TransportEstablisher} transport selection and URL rewriting.
 */
class TransportEstablisherTests {

	private final CloseableHttpClient httpClient = mock(CloseableHttpClient.class);

	private final CapturingDialer dialer = new CapturingDialer();

	@Test
	void routesWithConnectionTokenWhenPresent() {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, this.dialer, null);

		StepVerifier.create(establisher.establish("http://localhost/hub", response(null, "tok", "WebSockets")))
			.expectNext(this.dialer.connection)
			.verifyComplete();

		assertThat(this.dialer.uri).isEqualTo(URI.create("ws://localhost/hub?id=tok"));
		assertThat(this.dialer.connectionId).isNull();
	}

	@Test
	void routesWithConnectionIdWithoutToken() {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, this.dialer, null);

		StepVerifier.create(establisher.establish("http://localhost/hub", response("abc", null, "WebSockets")))
			.expectNextCount(1)
			.verifyComplete();

		assertThat(this.dialer.uri).isEqualTo(URI.create("ws://localhost/hub?id=abc"));
		assertThat(this.dialer.connectionId).isEqualTo("abc");
	}

	@Test
	void emptyTokenFallsBackToConnectionId() {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, this.dialer, null);

		StepVerifier.create(establisher.establish("http://localhost/hub", response("abc", "", "WebSockets")))
			.expectNextCount(1)
			.verifyComplete();

		assertThat(this.dialer.uri.getQuery()).isEqualTo("id=abc");
	}

	@Test
	void routesWithEmptyIdWithoutConnectionIdOrToken() {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, this.dialer, null);

		StepVerifier.create(establisher.establish("http://localhost/hub", response(null, null, "WebSockets")))
			.expectNextCount(1)
			.verifyComplete();

		assertThat(this.dialer.uri).isEqualTo(URI.create("ws://localhost/hub?id="));
	}

	@Test
	void keepsExistingQueryParameters() {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, this.dialer, null);

		StepVerifier
			.create(establisher.establish("http://localhost/hub?tenant=42", response("abc", null, "WebSockets")))
			.expectNextCount(1)
			.verifyComplete();

		assertThat(this.dialer.uri.getQuery()).isEqualTo("tenant=42&id=abc");
	}

	@Test
	void mapsHttpsToWss() {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, this.dialer, null);

		StepVerifier.create(establisher.establish("https://example.com:8443/hub", response("abc", null, "WebSockets")))
			.expectNextCount(1)
			.verifyComplete();

		assertThat(this.dialer.uri.getScheme()).isEqualTo("wss");
		assertThat(this.dialer.uri.getPort()).isEqualTo(8443);
	}

	@Test
	void prefersWebSocketsOverServerSentEvents() {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, this.dialer, null);

		StepVerifier
			.create(establisher.establish("http://localhost/hub",
					response("abc", null, "ServerSentEvents", "WebSockets")))
			.expectNext(this.dialer.connection)
			.verifyComplete();

		assertThat(this.dialer.calls).isEqualTo(1);
		verifyNoInteractions(this.httpClient);
	}

	@Test
	void completesEmptyWhenNoSupportedTransport() {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, this.dialer, null);

		StepVerifier.create(establisher.establish("http://localhost/hub", response("abc", null, "LongPolling")))
			.verifyComplete();
		StepVerifier.create(establisher.establish("http://localhost/hub", response("abc", null))).verifyComplete();

		assertThat(this.dialer.calls).isZero();
		verifyNoInteractions(this.httpClient);
	}

	@Test
	void relocatesBearerTokenIntoQuery() {
		Map<String, String> headers = new HashMap<>();
		headers.put("Authorization", "Bearer secret-token");
		headers.put("X-Trace", "t1");
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, this.dialer, () -> headers);

		StepVerifier.create(establisher.establish("http://localhost/hub", response("abc", null, "WebSockets")))
			.expectNextCount(1)
			.verifyComplete();

		assertThat(this.dialer.uri.getQuery()).isEqualTo("id=abc&access_token=secret-token");
		assertThat(this.dialer.headers).doesNotContainKey("Authorization").containsEntry("X-Trace", "t1");
		// The caller's map is not modified
		assertThat(headers).containsKey("Authorization");
	}

	@Test
	void relocatesBearerTokenRegardlessOfHeaderCase() {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, this.dialer,
				() -> Collections.singletonMap("authorization", "bearer abc"));

		StepVerifier.create(establisher.establish("http://localhost/hub", response("abc", null, "WebSockets")))
			.expectNextCount(1)
			.verifyComplete();

		assertThat(this.dialer.uri.getQuery()).contains("access_token=abc");
		assertThat(this.dialer.headers).isEmpty();
	}

	@Test
	void leavesNonBearerAuthorizationInPlace() {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, this.dialer,
				() -> Collections.singletonMap("Authorization", "Basic dXNlcjpwYXNz"));

		StepVerifier.create(establisher.establish("http://localhost/hub", response("abc", null, "WebSockets")))
			.expectNextCount(1)
			.verifyComplete();

		assertThat(this.dialer.uri.getQuery()).isEqualTo("id=abc");
		assertThat(this.dialer.headers).containsEntry("Authorization", "Basic dXNlcjpwYXNz");
	}

	@Test
	void surfacesDialFailureWithoutFallingBackToServerSentEvents() {
		WebSocketDialer failing = (uri, headers, connectionId) -> Mono.error(new IOException("handshake refused"));
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, failing, null);

		StepVerifier
			.create(establisher.establish("http://localhost/hub",
					response("abc", null, "WebSockets", "ServerSentEvents")))
			.expectErrorMessage("handshake refused")
			.verify();

		verifyNoInteractions(this.httpClient);
	}

	private static NegotiateResponse response(String connectionId, String connectionToken, String... transports) {
		List<NegotiateResponse.AvailableTransport> available = new java.util.ArrayList<>();
		for (String transport : transports) {
			available.add(new NegotiateResponse.AvailableTransport(transport, Arrays.asList("Text")));
		}
		return new NegotiateResponse(connectionId, connectionToken, available);
	}

	static class CapturingDialer implements WebSocketDialer {

		final Connection connection = mock(Connection.class);

		volatile URI uri;

		volatile Map<String, String> headers;

		volatile String connectionId;

		volatile int calls;

		@Override
		public Mono<Connection> dial(URI uri, Map<String, String> headers, String connectionId) {
			this.calls++;
			this.uri = uri;
			this.headers = new HashMap<>(headers);
			this.connectionId = connectionId;
			return Mono.just(this.connection);
		}

	}

}
