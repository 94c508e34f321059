/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.client.transport;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.apache.http.HttpHeaders;
import org.apache.http.StatusLine;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

import io.signalr.logging.SignalRLogging;
import io.signalr.spec.Connection;
import io.signalr.spec.NegotiateResponse;
import io.signalr.spec.SignalRTransportException;
import io.signalr.util.Assert;

/**
 * Establishes the transport advertised by a {@link NegotiateResponse}.
 * <p>
 * WebSockets win over Server-Sent Events. Only one transport is attempted: a failing
 * WebSocket dial is reported as such and does not fall back to SSE. When the server
 * offers neither, the result is empty.
 */
public class TransportEstablisher {

	private static final Logger logger = LoggerFactory.getLogger(TransportEstablisher.class);

	static final String ID_PARAMETER = "id";

	static final String ACCESS_TOKEN_PARAMETER = "access_token";

	private static final String BEARER_PREFIX = "Bearer ";

	private static final String EVENT_STREAM = "text/event-stream";

	// The event stream stays open for the lifetime of the connection
	private static final RequestConfig EVENT_STREAM_REQUEST_CONFIG = RequestConfig.custom()
		.setConnectTimeout(3000)
		.setConnectionRequestTimeout(3000)
		.setSocketTimeout(0)
		.build();

	private final CloseableHttpClient httpClient;

	private final WebSocketDialer webSocketDialer;

	@Nullable
	private final Supplier<Map<String, String>> headers;

	public TransportEstablisher(CloseableHttpClient httpClient, WebSocketDialer webSocketDialer,
			@Nullable Supplier<Map<String, String>> headers) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(webSocketDialer, "webSocketDialer must not be null");
		this.httpClient = httpClient;
		this.webSocketDialer = webSocketDialer;
		this.headers = headers;
	}

	/**
	 * Establishes a connection for {@code negotiateResponse}.
	 * @param address the hub address that was negotiated against
	 * @param negotiateResponse the negotiate result
	 * @return the established connection, or an empty {@link Mono} if no supported
	 * transport was advertised
	 */
	public Mono<Connection> establish(String address, NegotiateResponse negotiateResponse) {
		Assert.notNull(negotiateResponse, "negotiateResponse must not be null");
		return Mono.defer(() -> {
			URI routedUri;
			try {
				String routingId = negotiateResponse.routingId();
				routedUri = new URIBuilder(address).setParameter(ID_PARAMETER, routingId != null ? routingId : "")
					.build();
			}
			catch (URISyntaxException e) {
				return Mono.error(new IllegalArgumentException("Invalid hub address: " + address, e));
			}

			if (negotiateResponse.getTransferFormats(NegotiateResponse.TRANSPORT_WEB_SOCKETS) != null) {
				logTransportSelected(negotiateResponse, NegotiateResponse.TRANSPORT_WEB_SOCKETS);
				return dialWebSocket(routedUri, negotiateResponse.connectionId());
			}
			if (negotiateResponse.getTransferFormats(NegotiateResponse.TRANSPORT_SERVER_SENT_EVENTS) != null) {
				logTransportSelected(negotiateResponse, NegotiateResponse.TRANSPORT_SERVER_SENT_EVENTS);
				return openEventStream(routedUri, negotiateResponse.connectionId());
			}

			SignalRLogging.logEvent(logger, "TRANSPORT", "C_TRANSPORT_NONE", negotiateResponse.connectionId(),
					Collections.singletonMap("availableTransports",
							String.valueOf(negotiateResponse.availableTransports())),
					null);
			return Mono.empty();
		});
	}

	/**
	 * Rewrites the scheme to {@code ws}/{@code wss} and relocates a bearer
	 * {@code Authorization} header into the {@code access_token} query parameter.
	 */
	private Mono<Connection> dialWebSocket(URI routedUri, String connectionId) {
		Map<String, String> handshakeHeaders = resolveHeaders();
		URIBuilder builder = new URIBuilder(routedUri)
			.setScheme("https".equalsIgnoreCase(routedUri.getScheme()) ? "wss" : "ws");
		String authorization = handshakeHeaders.get(HttpHeaders.AUTHORIZATION);
		if (authorization != null
				&& authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
			String token = authorization.substring(BEARER_PREFIX.length()).trim();
			handshakeHeaders.remove(HttpHeaders.AUTHORIZATION);
			if (!token.isEmpty()) {
				builder.setParameter(ACCESS_TOKEN_PARAMETER, token);
			}
		}
		URI webSocketUri;
		try {
			webSocketUri = builder.build();
		}
		catch (URISyntaxException e) {
			return Mono.error(new IllegalArgumentException("Invalid WebSocket address: " + routedUri, e));
		}
		logger.debug("Dialing WebSocket {} for connection {}", webSocketUri.getPath(), connectionId);
		return this.webSocketDialer.dial(webSocketUri, handshakeHeaders, connectionId);
	}

	private Mono<Connection> openEventStream(URI routedUri, String connectionId) {
		return Mono.<Connection>create(sink -> {
			HttpGet get = new HttpGet(routedUri);
			get.setConfig(EVENT_STREAM_REQUEST_CONFIG);
			resolveHeaders().forEach(get::setHeader);
			get.setHeader(HttpHeaders.ACCEPT, EVENT_STREAM);

			AtomicBoolean cancelled = new AtomicBoolean();
			sink.onCancel(() -> {
				cancelled.set(true);
				get.abort();
			});
			CloseableHttpResponse response = null;
			try {
				response = this.httpClient.execute(get);
				StatusLine status = response.getStatusLine();
				if (status.getStatusCode() < 200 || status.getStatusCode() >= 300) {
					EntityUtils.consumeQuietly(response.getEntity());
					response.close();
					throw new SignalRTransportException(
							get.getMethod() + " " + get.getURI() + " -> " + NegotiateClient.statusText(status));
				}
				sink.success(new SseConnection(this.httpClient, routedUri, connectionId, response, this.headers));
			}
			catch (IOException | RuntimeException e) {
				closeQuietly(response);
				if (cancelled.get()) {
					logger.debug("SSE request to {} aborted", get.getURI());
				}
				else {
					sink.error(e);
				}
			}
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private Map<String, String> resolveHeaders() {
		Map<String, String> resolved = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		if (this.headers != null) {
			Map<String, String> supplied = this.headers.get();
			if (supplied != null) {
				resolved.putAll(supplied);
			}
		}
		return resolved;
	}

	private static void logTransportSelected(NegotiateResponse negotiateResponse, String transport) {
		Map<String, Object> details = new HashMap<>();
		details.put("transport", transport);
		details.put("transferFormats", String.valueOf(negotiateResponse.getTransferFormats(transport)));
		SignalRLogging.logEvent(logger, "TRANSPORT", "C_TRANSPORT_SELECTED", negotiateResponse.connectionId(),
				details, null);
	}

	private static void closeQuietly(@Nullable CloseableHttpResponse response) {
		if (response == null) {
			return;
		}
		try {
			response.close();
		}
		catch (IOException e) {
			logger.debug("Error closing SSE response", e);
		}
	}

}
