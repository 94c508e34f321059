/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.spec;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageBufferTests {

	@Test
	void growsBeyondInitialCapacity() {
		MessageBuffer buffer = new MessageBuffer();
		byte[] chunk = new byte[300];
		chunk[299] = 0x1E;

		buffer.append(chunk, 0, chunk.length);
		buffer.append(chunk, 0, chunk.length);

		assertThat(buffer.size()).isEqualTo(600);
		assertThat(buffer.indexOf((byte) 0x1E)).isEqualTo(299);
	}

	@Test
	void consumeRemovesFromTheFront() {
		MessageBuffer buffer = new MessageBuffer();
		byte[] bytes = "abcdef".getBytes(StandardCharsets.UTF_8);
		buffer.append(bytes, 2, 4);

		assertThat(new String(buffer.consume(2), StandardCharsets.UTF_8)).isEqualTo("cd");
		assertThat(new String(buffer.toByteArray(), StandardCharsets.UTF_8)).isEqualTo("ef");
		assertThat(buffer.indexOf((byte) 'c')).isEqualTo(-1);
	}

	@Test
	void consumeBeyondSizeFails() {
		MessageBuffer buffer = new MessageBuffer();
		buffer.append(new byte[] { 1, 2 }, 0, 2);

		assertThatThrownBy(() -> buffer.consume(3)).isInstanceOf(IndexOutOfBoundsException.class);
		assertThat(buffer.size()).isEqualTo(2);
	}

	@Test
	void clearEmptiesTheBuffer() {
		MessageBuffer buffer = new MessageBuffer();
		buffer.append(new byte[] { 1 }, 0, 1);

		buffer.clear();

		assertThat(buffer.isEmpty()).isTrue();
	}

}
