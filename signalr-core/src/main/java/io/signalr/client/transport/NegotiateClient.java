/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.client.transport;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.apache.http.HttpEntity;
import org.apache.http.StatusLine;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

import io.signalr.json.SignalRJsonMapper;
import io.signalr.logging.SignalRLogging;
import io.signalr.spec.NegotiateResponse;
import io.signalr.spec.SignalRTransportException;
import io.signalr.util.Assert;
import io.signalr.util.Utils;

/**
 * Performs the {@code POST {address}/negotiate} handshake and decodes the server's
 * capability response.
 * <p>
 * Headers and query string are resolved from their providers on every call so that
 * tokens can be refreshed between attempts. Cancelling the returned {@link Mono} aborts
 * the HTTP request.
 */
public class NegotiateClient {

	private static final Logger logger = LoggerFactory.getLogger(NegotiateClient.class);

	private static final String NEGOTIATE_PATH = "negotiate";

	private final CloseableHttpClient httpClient;

	private final SignalRJsonMapper jsonMapper;

	@Nullable
	private final Supplier<Map<String, String>> headers;

	@Nullable
	private final Supplier<String> queryString;

	public NegotiateClient(CloseableHttpClient httpClient, SignalRJsonMapper jsonMapper,
			@Nullable Supplier<Map<String, String>> headers, @Nullable Supplier<String> queryString) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.httpClient = httpClient;
		this.jsonMapper = jsonMapper;
		this.headers = headers;
		this.queryString = queryString;
	}

	/**
	 * Negotiates with the server at {@code baseAddress}.
	 * @param baseAddress the hub address, e.g. {@code https://host/chat}
	 * @return the decoded response; errors with {@link SignalRTransportException} on a
	 * non-200 status, or with an {@link IOException} on network or decode failures
	 */
	public Mono<NegotiateResponse> negotiate(String baseAddress) {
		return Mono.<NegotiateResponse>create(sink -> {
			HttpPost post = new HttpPost(negotiateUri(baseAddress));
			if (this.headers != null) {
				Map<String, String> requestHeaders = this.headers.get();
				if (requestHeaders != null) {
					requestHeaders.forEach(post::setHeader);
				}
			}
			AtomicBoolean cancelled = new AtomicBoolean();
			sink.onCancel(() -> {
				cancelled.set(true);
				post.abort();
			});
			try {
				sink.success(execute(post));
			}
			catch (Exception e) {
				if (cancelled.get()) {
					logger.debug("Negotiate request to {} aborted", post.getURI());
				}
				else {
					Map<String, Object> outcome = new HashMap<>();
					outcome.put("status", "ERROR");
					outcome.put("cause", e.getMessage());
					SignalRLogging.logEvent(logger, "HTTP", "C_NEGOTIATE_FAILED", null,
							Collections.singletonMap("url", post.getURI().toString()), outcome);
					sink.error(e);
				}
			}
		}).subscribeOn(Schedulers.boundedElastic());
	}

	URI negotiateUri(String baseAddress) {
		URI uri = Utils.appendPath(baseAddress, NEGOTIATE_PATH);
		if (this.queryString != null) {
			uri = Utils.withRawQuery(uri, this.queryString.get());
		}
		return uri;
	}

	private NegotiateResponse execute(HttpPost post) throws IOException {
		try (CloseableHttpResponse response = this.httpClient.execute(post)) {
			StatusLine status = response.getStatusLine();
			HttpEntity entity = response.getEntity();
			if (status.getStatusCode() != 200) {
				EntityUtils.consumeQuietly(entity);
				throw new SignalRTransportException(
						post.getMethod() + " " + post.getURI() + " -> " + statusText(status));
			}
			String body = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
			NegotiateResponse negotiateResponse = this.jsonMapper.readValue(body, NegotiateResponse.class);

			Map<String, Object> details = new HashMap<>();
			details.put("url", post.getURI().toString());
			details.put("availableTransports", String.valueOf(negotiateResponse.availableTransports()));
			SignalRLogging.logEvent(logger, "HTTP", "C_NEGOTIATE_OK", negotiateResponse.connectionId(), details,
					Collections.singletonMap("status", "SUCCESS"));
			return negotiateResponse;
		}
	}

	static String statusText(StatusLine status) {
		String reason = status.getReasonPhrase();
		return Utils.hasText(reason) ? status.getStatusCode() + " " + reason : String.valueOf(status.getStatusCode());
	}

}
