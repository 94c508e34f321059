/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.json.jackson;

import java.io.IOException;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.signalr.json.SignalRJsonMapper;
import io.signalr.json.TypeRef;

/**
 * Jackson 2 based implementation of {@link SignalRJsonMapper}.
 */
public final class JacksonSignalRJsonMapper implements SignalRJsonMapper {

	private final ObjectMapper objectMapper;

	/**
	 * Creates a mapper backed by the given {@link ObjectMapper}.
	 * @param objectMapper the Jackson mapper to delegate to
	 */
	public JacksonSignalRJsonMapper(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	/**
	 * Returns the underlying {@link ObjectMapper}.
	 */
	public ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}

	@Override
	public <T> T readValue(String content, Class<T> type) throws IOException {
		return this.objectMapper.readValue(content, type);
	}

	@Override
	public <T> T readValue(byte[] content, Class<T> type) throws IOException {
		return this.objectMapper.readValue(content, type);
	}

	@Override
	public <T> T readValue(String content, TypeRef<T> type) throws IOException {
		return this.objectMapper.readValue(content, javaType(type));
	}

	@Override
	public <T> T readValue(byte[] content, TypeRef<T> type) throws IOException {
		return this.objectMapper.readValue(content, javaType(type));
	}

	@Override
	public <T> T convertValue(Object fromValue, Class<T> type) {
		return this.objectMapper.convertValue(fromValue, type);
	}

	@Override
	public <T> T convertValue(Object fromValue, TypeRef<T> type) {
		return this.objectMapper.convertValue(fromValue, javaType(type));
	}

	@Override
	public String writeValueAsString(Object value) throws IOException {
		return this.objectMapper.writeValueAsString(value);
	}

	@Override
	public byte[] writeValueAsBytes(Object value) throws IOException {
		return this.objectMapper.writeValueAsBytes(value);
	}

	private JavaType javaType(TypeRef<?> type) {
		return this.objectMapper.getTypeFactory().constructType(type.getType());
	}

}
