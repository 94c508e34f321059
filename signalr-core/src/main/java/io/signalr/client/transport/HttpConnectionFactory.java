/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.client.transport;

import java.util.Map;
import java.util.function.Supplier;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import reactor.core.publisher.Mono;

import io.signalr.json.SignalRJsonMapper;
import io.signalr.spec.Connection;
import io.signalr.util.Assert;

/**
 * Negotiates with a hub address and establishes the best advertised transport.
 *
 * <pre>{@code
 * HttpConnectionFactory factory = HttpConnectionFactory.builder("https://host/chat")
 *     .headers(() -> Collections.singletonMap("Authorization", "Bearer " + token))
 *     .build();
 * Connection connection = factory.connect().block();
 * }</pre>
 */
public class HttpConnectionFactory {

	private final String address;

	private final NegotiateClient negotiateClient;

	private final TransportEstablisher transportEstablisher;

	HttpConnectionFactory(String address, NegotiateClient negotiateClient,
			TransportEstablisher transportEstablisher) {
		this.address = address;
		this.negotiateClient = negotiateClient;
		this.transportEstablisher = transportEstablisher;
	}

	/**
	 * Negotiates and establishes a connection. Every subscription performs a fresh
	 * negotiation.
	 * @return the connection, or an empty {@link Mono} if the server advertised no
	 * supported transport
	 */
	public Mono<Connection> connect() {
		return this.negotiateClient.negotiate(this.address)
			.flatMap(negotiateResponse -> this.transportEstablisher.establish(this.address, negotiateResponse));
	}

	public String getAddress() {
		return this.address;
	}

	public static Builder builder(String address) {
		return new Builder(address);
	}

	public static class Builder {

		private final String address;

		private CloseableHttpClient httpClient;

		private Supplier<Map<String, String>> headers;

		private Supplier<String> queryString;

		private WebSocketDialer webSocketDialer;

		private SignalRJsonMapper jsonMapper;

		Builder(String address) {
			Assert.hasText(address, "address must not be empty");
			this.address = address;
		}

		/**
		 * HTTP client used for negotiation and the SSE transport. Defaults to a pooled
		 * client.
		 */
		public Builder httpClient(CloseableHttpClient httpClient) {
			Assert.notNull(httpClient, "httpClient must not be null");
			this.httpClient = httpClient;
			return this;
		}

		/**
		 * Headers sent with every request, resolved per request.
		 */
		public Builder headers(Supplier<Map<String, String>> headers) {
			this.headers = headers;
			return this;
		}

		/**
		 * Raw query string replacing the query of the negotiate URL, resolved per
		 * negotiation.
		 */
		public Builder queryString(Supplier<String> queryString) {
			this.queryString = queryString;
			return this;
		}

		public Builder webSocketDialer(WebSocketDialer webSocketDialer) {
			Assert.notNull(webSocketDialer, "webSocketDialer must not be null");
			this.webSocketDialer = webSocketDialer;
			return this;
		}

		public Builder jsonMapper(SignalRJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public HttpConnectionFactory build() {
			CloseableHttpClient client = this.httpClient != null ? this.httpClient : createPooledHttpClient();
			SignalRJsonMapper mapper = this.jsonMapper != null ? this.jsonMapper : SignalRJsonMapper.getDefault();
			WebSocketDialer dialer = this.webSocketDialer != null ? this.webSocketDialer : new OkHttpWebSocketDialer();
			return new HttpConnectionFactory(this.address,
					new NegotiateClient(client, mapper, this.headers, this.queryString),
					new TransportEstablisher(client, dialer, this.headers));
		}

		/**
		 * Creates a pooled client sized for one long-lived SSE stream per route next to
		 * concurrent POSTs.
		 */
		private static CloseableHttpClient createPooledHttpClient() {
			PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
			connectionManager.setMaxTotal(20);
			connectionManager.setDefaultMaxPerRoute(10);

			RequestConfig requestConfig = RequestConfig.custom()
				.setConnectTimeout(3000)
				.setConnectionRequestTimeout(3000)
				.setSocketTimeout(15000)
				.setExpectContinueEnabled(false)
				.build();

			return HttpClientBuilder.create()
				.setConnectionManager(connectionManager)
				.setDefaultRequestConfig(requestConfig)
				.build();
		}

	}

}
