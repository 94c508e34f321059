/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.client;

import java.io.IOException;
import java.util.Map;

import io.signalr.spec.HubConnectionAbortedException;
import io.signalr.spec.HubMessageSendException;
import io.signalr.spec.HubMessages;

/**
 * A hub protocol session over one established
 * {@link io.signalr.spec.Connection Connection}.
 * <p>
 * {@link #receive()} calls must not overlap. Senders may be called from several threads
 * but are not serialized against each other. Every blocking call returns only after the
 * worker it started has finished, also when it ends with a
 * {@link HubConnectionAbortedException}.
 */
public interface HubConnection {

	/**
	 * Moves the connection from idle to connected.
	 * @return {@code true} if this call performed the transition
	 */
	boolean start();

	boolean isConnected();

	HubConnectionState getState();

	String getConnectionId();

	/**
	 * Blocks until one complete message has been received.
	 * @return the next message
	 * @throws IOException if reading from the connection or decoding failed
	 * @throws HubConnectionAbortedException if {@link #abort()} was called
	 */
	HubMessages.HubMessage receive() throws IOException;

	/**
	 * Sends a send-only invocation of {@code target}.
	 * @throws HubMessageSendException if the write failed
	 * @throws HubConnectionAbortedException if {@link #abort()} was called
	 */
	HubMessages.InvocationMessage sendInvocation(String target, Object... arguments) throws HubMessageSendException;

	HubMessages.StreamItemMessage streamItem(String invocationId, Object item) throws HubMessageSendException;

	HubMessages.CompletionMessage completion(String invocationId, Object result, String error)
			throws HubMessageSendException;

	HubMessages.PingMessage ping() throws HubMessageSendException;

	/**
	 * Leaves the connected state and sends a close message allowing reconnects. Does not
	 * abort in-flight operations.
	 * @param error error text for the peer, may be {@code null}
	 * @return the close message that was sent
	 * @throws HubMessageSendException if the write failed
	 */
	HubMessages.CloseMessage close(String error) throws HubMessageSendException;

	/**
	 * Cancels all in-flight operations and ends the session.
	 */
	void abort();

	boolean isAborted();

	/**
	 * Per-connection key/value store owned by the caller. Not synchronized.
	 */
	Map<String, Object> items();

}
