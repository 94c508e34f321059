/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.client;

/**
 * Lifecycle of a {@link HubConnection}. {@link #CLOSED} and {@link #ABORTED} are
 * terminal.
 */
public enum HubConnectionState {

	IDLE,

	CONNECTED,

	CLOSED,

	ABORTED

}
