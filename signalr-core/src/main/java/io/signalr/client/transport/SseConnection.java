/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.client.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.Supplier;

import org.apache.http.HttpEntity;
import org.apache.http.StatusLine;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

import io.signalr.spec.Connection;

/**
 * {@link Connection} over Server-Sent Events.
 * <p>
 * Inbound data is the payload of the {@code data:} lines of the event stream returned by
 * the SSE {@code GET}; other SSE fields are ignored. Each {@link #write(byte[])} is one
 * {@code POST} to the routed address.
 */
public class SseConnection implements Connection {

	private static final Logger logger = LoggerFactory.getLogger(SseConnection.class);

	private static final String DATA_FIELD = "data:";

	private static final ContentType TEXT_PLAIN_UTF8 = ContentType.create("text/plain", StandardCharsets.UTF_8);

	private final CloseableHttpClient httpClient;

	private final URI routedUri;

	private final String connectionId;

	private final CloseableHttpResponse eventStream;

	private final BufferedReader reader;

	@Nullable
	private final Supplier<Map<String, String>> headers;

	private volatile boolean closed;

	private byte[] pending;

	private int pendingOffset;

	/**
	 * Wraps an open event stream.
	 * @param httpClient client used for outbound {@code POST}s
	 * @param routedUri the address carrying the {@code id} query parameter
	 * @param connectionId the negotiated connection id
	 * @param eventStream the successful response of the SSE {@code GET}
	 * @param headers caller headers applied to each {@code POST}
	 */
	public SseConnection(CloseableHttpClient httpClient, URI routedUri, String connectionId,
			CloseableHttpResponse eventStream, @Nullable Supplier<Map<String, String>> headers) throws IOException {
		this.httpClient = httpClient;
		this.routedUri = routedUri;
		this.connectionId = connectionId;
		this.eventStream = eventStream;
		this.headers = headers;
		HttpEntity entity = eventStream.getEntity();
		if (entity == null) {
			throw new IOException("SSE response for connection " + connectionId + " has no body");
		}
		this.reader = new BufferedReader(new InputStreamReader(entity.getContent(), StandardCharsets.UTF_8));
	}

	@Override
	public int read(byte[] buffer) throws IOException {
		while (this.pending == null || this.pendingOffset == this.pending.length) {
			String line;
			try {
				line = this.reader.readLine();
			}
			catch (IOException e) {
				if (this.closed) {
					return -1;
				}
				throw e;
			}
			if (line == null) {
				return -1;
			}
			String data = dataPayload(line);
			if (data == null || data.isEmpty()) {
				continue;
			}
			this.pending = data.getBytes(StandardCharsets.UTF_8);
			this.pendingOffset = 0;
		}
		int count = Math.min(buffer.length, this.pending.length - this.pendingOffset);
		System.arraycopy(this.pending, this.pendingOffset, buffer, 0, count);
		this.pendingOffset += count;
		return count;
	}

	/**
	 * Returns the payload of a {@code data:} line with one leading space removed, or
	 * {@code null} for any other line. Only CR, tab and space are trimmed from the line;
	 * the record separator is part of the payload.
	 */
	@Nullable
	static String dataPayload(String line) {
		int start = 0;
		int end = line.length();
		while (start < end && isTrimmable(line.charAt(start))) {
			start++;
		}
		while (end > start && isTrimmable(line.charAt(end - 1))) {
			end--;
		}
		String trimmed = line.substring(start, end);
		if (!trimmed.startsWith(DATA_FIELD)) {
			return null;
		}
		String data = trimmed.substring(DATA_FIELD.length());
		return data.startsWith(" ") ? data.substring(1) : data;
	}

	private static boolean isTrimmable(char c) {
		return c == ' ' || c == '\t' || c == '\r';
	}

	@Override
	public void write(byte[] data) throws IOException {
		if (this.closed) {
			throw new IOException("SSE connection " + this.connectionId + " is closed");
		}
		HttpPost post = new HttpPost(this.routedUri);
		if (this.headers != null) {
			Map<String, String> requestHeaders = this.headers.get();
			if (requestHeaders != null) {
				requestHeaders.forEach(post::setHeader);
			}
		}
		post.setEntity(new ByteArrayEntity(data, TEXT_PLAIN_UTF8));
		try (CloseableHttpResponse response = this.httpClient.execute(post)) {
			StatusLine status = response.getStatusLine();
			EntityUtils.consumeQuietly(response.getEntity());
			if (status.getStatusCode() != 200) {
				throw new IOException(
						post.getMethod() + " " + post.getURI() + " -> " + NegotiateClient.statusText(status));
			}
		}
	}

	@Override
	public String getConnectionId() {
		return this.connectionId;
	}

	@Override
	public void close() throws IOException {
		if (this.closed) {
			return;
		}
		this.closed = true;
		logger.debug("Closing SSE connection {}", this.connectionId);
		// Closing the response without draining aborts the underlying socket
		this.eventStream.close();
	}

}
