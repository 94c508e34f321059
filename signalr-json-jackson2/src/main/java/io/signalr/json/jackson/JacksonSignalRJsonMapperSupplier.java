/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.signalr.json.SignalRJsonMapper;
import io.signalr.json.SignalRJsonMapperSupplier;

/**
 * {@link SignalRJsonMapperSupplier} registered through {@code META-INF/services}. Unknown
 * properties are ignored so that newer servers can add fields to negotiate responses and
 * hub messages.
 */
public class JacksonSignalRJsonMapperSupplier implements SignalRJsonMapperSupplier {

	@Override
	public SignalRJsonMapper get() {
		ObjectMapper objectMapper = new ObjectMapper()
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
		return new JacksonSignalRJsonMapper(objectMapper);
	}

}
