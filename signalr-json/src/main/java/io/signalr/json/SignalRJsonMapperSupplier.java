/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.json;

import java.util.function.Supplier;

/**
 * Service provider interface for a {@link SignalRJsonMapper}. Register an implementation
 * in {@code META-INF/services/io.signalr.json.SignalRJsonMapperSupplier}.
 */
public interface SignalRJsonMapperSupplier extends Supplier<SignalRJsonMapper> {

}
