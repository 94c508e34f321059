/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.logging;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;

import io.signalr.json.SignalRJsonMapper;

/**
 * Emits structured lifecycle events as one JSON object per log line.
 */
public final class SignalRLogging {

	private SignalRLogging() {
	}

	/**
	 * Emits a structured event at DEBUG level. Nothing is serialized when DEBUG is off.
	 * @param logger SLF4J logger
	 * @param channel "HTTP" | "TRANSPORT" | "HUB"
	 * @param event event name, e.g. "C_NEGOTIATE_OK"
	 * @param connectionId connection id (optional)
	 * @param details event specific fields (optional)
	 * @param outcome outcome such as {status, cause} (optional)
	 */
	public static void logEvent(Logger logger, String channel, String event, String connectionId,
			Map<String, Object> details, Map<String, Object> outcome) {
		if (!logger.isDebugEnabled()) {
			return;
		}
		try {
			Map<String, Object> o = new LinkedHashMap<>();
			o.put("side", "CLIENT");
			o.put("channel", channel);
			o.put("event", event);
			o.put("ts", Instant.now().toString());
			o.put("thread", Thread.currentThread().getName());
			if (connectionId != null) {
				o.put("connectionId", connectionId);
			}
			if (details != null && !details.isEmpty()) {
				o.put("details", details);
			}
			if (outcome != null && !outcome.isEmpty()) {
				o.put("outcome", outcome);
			}
			logger.debug(SignalRJsonMapper.getDefault().writeValueAsString(o));
		}
		catch (Exception e) {
			logger.warn("Failed to emit structured SignalR log: {}", e.getMessage());
		}
	}

}
