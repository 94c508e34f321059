/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.client.transport;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.MonoSink;
import reactor.util.annotation.Nullable;

import io.signalr.spec.Connection;

/**
 * {@link Connection} over an OkHttp {@link WebSocket}.
 * <p>
 * Inbound frames are queued by the OkHttp reader thread and handed out through the
 * blocking {@link #read(byte[])}; a frame larger than the caller's buffer is returned
 * over several reads. Outbound data is sent as one text frame per {@link #write(byte[])}.
 */
public class WebSocketConnection implements Connection {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketConnection.class);

	public static final int NORMAL_CLOSURE = 1000;

	// Identity matters: an empty frame is a distinct array
	private static final byte[] END_OF_STREAM = new byte[0];

	private final String connectionId;

	private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();

	private final AtomicBoolean opened = new AtomicBoolean();

	private final AtomicBoolean closed = new AtomicBoolean();

	private volatile WebSocket webSocket;

	private volatile IOException failure;

	private byte[] pending;

	private int pendingOffset;

	WebSocketConnection(String connectionId) {
		this.connectionId = connectionId;
	}

	/**
	 * Returns the listener that feeds this connection. {@code openSink} is completed with
	 * this connection once the handshake succeeded, or errored if it failed.
	 */
	WebSocketListener listener(MonoSink<Connection> openSink) {
		return new WebSocketListener() {

			@Override
			public void onOpen(WebSocket ws, Response response) {
				webSocket = ws;
				opened.set(true);
				logger.debug("WebSocket {} opened: {}", connectionId, response.code());
				openSink.success(WebSocketConnection.this);
			}

			@Override
			public void onMessage(WebSocket ws, String text) {
				inbound.add(text.getBytes(StandardCharsets.UTF_8));
			}

			@Override
			public void onMessage(WebSocket ws, ByteString bytes) {
				inbound.add(bytes.toByteArray());
			}

			@Override
			public void onClosing(WebSocket ws, int code, String reason) {
				logger.debug("WebSocket {} closing by server: {} {}", connectionId, code, reason);
				ws.close(code, null);
			}

			@Override
			public void onClosed(WebSocket ws, int code, String reason) {
				inbound.add(END_OF_STREAM);
			}

			@Override
			public void onFailure(WebSocket ws, Throwable t, @Nullable Response response) {
				if (opened.compareAndSet(false, true)) {
					openSink.error(t);
					return;
				}
				if (!closed.get()) {
					logger.debug("WebSocket {} failed", connectionId, t);
					failure = t instanceof IOException ? (IOException) t
							: new IOException("WebSocket " + connectionId + " failed", t);
				}
				inbound.add(END_OF_STREAM);
			}
		};
	}

	@Override
	public int read(byte[] buffer) throws IOException {
		while (this.pending == null || this.pendingOffset == this.pending.length) {
			byte[] next;
			try {
				next = this.inbound.take();
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new InterruptedIOException("Interrupted while reading from WebSocket " + this.connectionId);
			}
			if (next == END_OF_STREAM) {
				// Subsequent reads see the end of stream again
				this.inbound.add(END_OF_STREAM);
				if (this.failure != null) {
					throw this.failure;
				}
				return -1;
			}
			this.pending = next;
			this.pendingOffset = 0;
		}
		int count = Math.min(buffer.length, this.pending.length - this.pendingOffset);
		System.arraycopy(this.pending, this.pendingOffset, buffer, 0, count);
		this.pendingOffset += count;
		return count;
	}

	@Override
	public void write(byte[] data) throws IOException {
		WebSocket ws = this.webSocket;
		if (ws == null || this.closed.get() || !ws.send(new String(data, StandardCharsets.UTF_8))) {
			throw new IOException("WebSocket " + this.connectionId + " is closing or closed");
		}
	}

	@Override
	public String getConnectionId() {
		return this.connectionId;
	}

	@Override
	public void close() {
		if (!this.closed.compareAndSet(false, true)) {
			return;
		}
		WebSocket ws = this.webSocket;
		if (ws != null && !ws.close(NORMAL_CLOSURE, null)) {
			ws.cancel();
		}
		this.inbound.add(END_OF_STREAM);
	}

}
