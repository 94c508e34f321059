/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.json;

import java.io.IOException;

/**
 * Abstraction over the JSON library used to encode negotiate responses and hub protocol
 * messages. Implementations are discovered through {@link SignalRJsonMapperSupplier}.
 */
public interface SignalRJsonMapper {

	<T> T readValue(String content, Class<T> type) throws IOException;

	<T> T readValue(byte[] content, Class<T> type) throws IOException;

	<T> T readValue(String content, TypeRef<T> type) throws IOException;

	<T> T readValue(byte[] content, TypeRef<T> type) throws IOException;

	/**
	 * Converts a value (typically a {@code Map} produced by a previous read) into the
	 * requested type.
	 */
	<T> T convertValue(Object fromValue, Class<T> type);

	<T> T convertValue(Object fromValue, TypeRef<T> type);

	String writeValueAsString(Object value) throws IOException;

	byte[] writeValueAsBytes(Object value) throws IOException;

	/**
	 * Returns the cached default mapper resolved from the classpath.
	 * @return the default mapper
	 * @throws IllegalStateException if no implementation is available
	 */
	static SignalRJsonMapper getDefault() {
		return SignalRJsonInternal.getDefaultMapper();
	}

	/**
	 * Creates a fresh default mapper, bypassing the cache.
	 * @return a new default mapper
	 */
	static SignalRJsonMapper createDefault() {
		return SignalRJsonInternal.createDefaultMapper();
	}

}
