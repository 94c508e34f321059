/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.json;

import java.util.Iterator;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Holds the process-wide default mapper, taken from the first
 * {@link SignalRJsonMapperSupplier} registered on the classpath.
 */
final class SignalRJsonInternal {

	private static volatile SignalRJsonMapper defaultJsonMapper;

	private SignalRJsonInternal() {
	}

	static SignalRJsonMapper getDefaultMapper() {
		SignalRJsonMapper mapper = defaultJsonMapper;
		if (mapper == null) {
			mapper = createDefaultMapper();
			defaultJsonMapper = mapper;
		}
		return mapper;
	}

	/**
	 * @throws IllegalStateException if no supplier is registered, or the registered one
	 * cannot be loaded or returns {@code null}
	 */
	static SignalRJsonMapper createDefaultMapper() {
		Iterator<SignalRJsonMapperSupplier> suppliers = ServiceLoader.load(SignalRJsonMapperSupplier.class)
			.iterator();
		try {
			if (!suppliers.hasNext()) {
				throw new IllegalStateException("No default SignalRJsonMapper implementation found");
			}
			SignalRJsonMapper mapper = suppliers.next().get();
			if (mapper == null) {
				throw new IllegalStateException("SignalRJsonMapperSupplier returned no mapper");
			}
			return mapper;
		}
		catch (ServiceConfigurationError e) {
			throw new IllegalStateException("Failed to load SignalRJsonMapperSupplier", e);
		}
	}

}
