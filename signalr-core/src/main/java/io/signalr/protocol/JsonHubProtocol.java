/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.protocol;

import java.io.IOException;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.signalr.json.SignalRJsonMapper;
import io.signalr.spec.Connection;
import io.signalr.spec.HubMessages;
import io.signalr.spec.HubProtocol;
import io.signalr.spec.MessageBuffer;
import io.signalr.util.Assert;

/**
 * JSON hub protocol: each message is a UTF-8 JSON object terminated by the ASCII record
 * separator {@code 0x1E}.
 */
public class JsonHubProtocol implements HubProtocol {

	private static final Logger logger = LoggerFactory.getLogger(JsonHubProtocol.class);

	public static final byte RECORD_SEPARATOR = 0x1E;

	private final SignalRJsonMapper jsonMapper;

	public JsonHubProtocol() {
		this(SignalRJsonMapper.getDefault());
	}

	public JsonHubProtocol(SignalRJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.jsonMapper = jsonMapper;
	}

	@Override
	public String getName() {
		return "json";
	}

	@Override
	public HubMessages.HubMessage readMessage(MessageBuffer buffer) throws IOException {
		int end = buffer.indexOf(RECORD_SEPARATOR);
		if (end < 0) {
			return null;
		}
		byte[] record = buffer.consume(end + 1);
		byte[] json = Arrays.copyOf(record, end);
		try {
			HubMessages.HubMessage message = HubMessages.deserializeHubMessage(this.jsonMapper, json);
			logger.debug("Parsed hub message: type={}", message.type());
			return message;
		}
		catch (IllegalArgumentException e) {
			throw new IOException("Invalid hub message: " + e.getMessage(), e);
		}
	}

	@Override
	public void writeMessage(HubMessages.HubMessage message, Connection connection) throws IOException {
		byte[] json = this.jsonMapper.writeValueAsBytes(message);
		byte[] frame = Arrays.copyOf(json, json.length + 1);
		frame[json.length] = RECORD_SEPARATOR;
		connection.write(frame);
	}

}
