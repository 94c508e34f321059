/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.client;

import java.io.EOFException;
import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import io.signalr.logging.SignalRLogging;
import io.signalr.spec.Connection;
import io.signalr.spec.HubConnectionAbortedException;
import io.signalr.spec.HubMessageSendException;
import io.signalr.spec.HubMessages;
import io.signalr.spec.HubProtocol;
import io.signalr.spec.MessageBuffer;
import io.signalr.spec.SignalRTransportException;
import io.signalr.util.Assert;

/**
 * Default {@link HubConnection}.
 * <p>
 * Each {@link #receive()} and each send runs its blocking protocol call as one worker on
 * a {@link Scheduler} and races it against the abort signal. When the abort signal wins,
 * the caller still waits for the worker before throwing, so no worker outlives the call
 * that started it. {@link #abort()} closes the underlying {@link Connection} to make a
 * worker blocked in {@link Connection#read(byte[])} return.
 */
public class DefaultHubConnection implements HubConnection {

	private static final Logger logger = LoggerFactory.getLogger(DefaultHubConnection.class);

	public static final int DEFAULT_MAXIMUM_RECEIVE_MESSAGE_SIZE = 1 << 15;

	// Shared by all hub connections; daemon threads, evicted after 60s idle
	private static final Scheduler DEFAULT_SCHEDULER = Schedulers.newBoundedElastic(
			Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
			"signalr-hub-connection", 60, true);

	private final Connection connection;

	private final HubProtocol protocol;

	private final int maximumReceiveMessageSize;

	private final Scheduler scheduler;

	private final AtomicReference<HubConnectionState> state = new AtomicReference<>(HubConnectionState.IDLE);

	private final CompletableFuture<Void> abortSignal = new CompletableFuture<>();

	private final Map<String, Object> items = new HashMap<>();

	// Only touched by the single in-flight receive worker
	private final MessageBuffer receiveBuffer = new MessageBuffer();

	public DefaultHubConnection(Connection connection, HubProtocol protocol) {
		this(connection, protocol, DEFAULT_MAXIMUM_RECEIVE_MESSAGE_SIZE);
	}

	public DefaultHubConnection(Connection connection, HubProtocol protocol, int maximumReceiveMessageSize) {
		this(connection, protocol, maximumReceiveMessageSize, DEFAULT_SCHEDULER);
	}

	/**
	 * Creates a hub connection.
	 * @param connection the established transport, owned by this hub connection from now
	 * on
	 * @param protocol the hub protocol
	 * @param maximumReceiveMessageSize maximum number of bytes requested from the
	 * transport per read
	 * @param scheduler scheduler running receive and send workers
	 */
	public DefaultHubConnection(Connection connection, HubProtocol protocol, int maximumReceiveMessageSize,
			Scheduler scheduler) {
		Assert.notNull(connection, "connection must not be null");
		Assert.notNull(protocol, "protocol must not be null");
		Assert.isTrue(maximumReceiveMessageSize > 0, "maximumReceiveMessageSize must be positive");
		Assert.notNull(scheduler, "scheduler must not be null");
		this.connection = connection;
		this.protocol = protocol;
		this.maximumReceiveMessageSize = maximumReceiveMessageSize;
		this.scheduler = scheduler;
	}

	@Override
	public boolean start() {
		boolean started = this.state.compareAndSet(HubConnectionState.IDLE, HubConnectionState.CONNECTED);
		if (started) {
			logger.debug("Hub connection {} started with protocol {}", getConnectionId(), this.protocol.getName());
		}
		return started;
	}

	@Override
	public boolean isConnected() {
		return this.state.get() == HubConnectionState.CONNECTED;
	}

	@Override
	public HubConnectionState getState() {
		return this.state.get();
	}

	@Override
	public String getConnectionId() {
		return this.connection.getConnectionId();
	}

	@Override
	public Map<String, Object> items() {
		return this.items;
	}

	@Override
	public boolean isAborted() {
		return this.abortSignal.isDone();
	}

	@Override
	public HubMessages.HubMessage receive() throws IOException {
		if (isAborted()) {
			throw new HubConnectionAbortedException("Hub connection " + getConnectionId() + " has been aborted");
		}
		HubMessages.HubMessage message = await(runWorker(this::readNextMessage), null);
		logger.debug("Hub connection {} received {}", getConnectionId(), message);
		return message;
	}

	private HubMessages.HubMessage readNextMessage() throws IOException {
		byte[] chunk = new byte[this.maximumReceiveMessageSize];
		while (true) {
			HubMessages.HubMessage message = this.protocol.readMessage(this.receiveBuffer);
			if (message != null) {
				return message;
			}
			int read = this.connection.read(chunk);
			if (read < 0) {
				throw new EOFException("Connection " + getConnectionId() + " was closed by the server");
			}
			this.receiveBuffer.append(chunk, 0, read);
		}
	}

	@Override
	public HubMessages.InvocationMessage sendInvocation(String target, Object... arguments)
			throws HubMessageSendException {
		return writeMessage(HubMessages.InvocationMessage.sendOnly(target, arguments));
	}

	@Override
	public HubMessages.StreamItemMessage streamItem(String invocationId, Object item) throws HubMessageSendException {
		return writeMessage(new HubMessages.StreamItemMessage(invocationId, item));
	}

	@Override
	public HubMessages.CompletionMessage completion(String invocationId, Object result, String error)
			throws HubMessageSendException {
		return writeMessage(new HubMessages.CompletionMessage(invocationId, result, error));
	}

	@Override
	public HubMessages.PingMessage ping() throws HubMessageSendException {
		return writeMessage(HubMessages.PingMessage.INSTANCE);
	}

	@Override
	public HubMessages.CloseMessage close(String error) throws HubMessageSendException {
		HubConnectionState previous = this.state
			.getAndUpdate(s -> s == HubConnectionState.ABORTED ? s : HubConnectionState.CLOSED);
		SignalRLogging.logEvent(logger, "HUB", "C_HUB_CLOSE", getConnectionId(),
				Collections.singletonMap("previousState", previous.name()),
				error == null ? null : Collections.singletonMap("error", error));
		return writeMessage(new HubMessages.CloseMessage(error, true));
	}

	@Override
	public void abort() {
		HubConnectionState previous = this.state.getAndSet(HubConnectionState.ABORTED);
		if (!this.abortSignal.complete(null)) {
			return;
		}
		SignalRLogging.logEvent(logger, "HUB", "C_HUB_ABORT", getConnectionId(),
				Collections.singletonMap("previousState", previous.name()), null);
		try {
			this.connection.close();
		}
		catch (IOException e) {
			logger.debug("Error closing connection {} on abort", getConnectionId(), e);
		}
	}

	private <M extends HubMessages.HubMessage> M writeMessage(M message) throws HubMessageSendException {
		if (isAborted()) {
			throw new HubConnectionAbortedException("Hub connection " + getConnectionId() + " has been aborted",
					message);
		}
		try {
			return await(runWorker(() -> {
				this.protocol.writeMessage(message, this.connection);
				return message;
			}), message);
		}
		catch (HubConnectionAbortedException e) {
			throw e;
		}
		catch (IOException | RuntimeException e) {
			throw new HubMessageSendException(message, e);
		}
	}

	private <T> CompletableFuture<T> runWorker(Callable<T> work) {
		return Mono.fromCallable(work).subscribeOn(this.scheduler).toFuture();
	}

	/**
	 * Waits for either the worker or the abort signal. On abort the worker is joined
	 * before the abort exception is thrown.
	 */
	private <T> T await(CompletableFuture<T> worker, HubMessages.HubMessage attempted) throws IOException {
		CompletableFuture.anyOf(worker, this.abortSignal).handle((r, e) -> null).join();
		if (this.abortSignal.isDone()) {
			worker.handle((r, e) -> null).join();
			throw new HubConnectionAbortedException("Hub connection " + getConnectionId() + " has been aborted",
					attempted);
		}
		try {
			return worker.join();
		}
		catch (CompletionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			if (cause instanceof IOException) {
				throw (IOException) cause;
			}
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new SignalRTransportException("Hub connection worker failed", cause);
		}
	}

}
