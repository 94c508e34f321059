/*
 * Copyright 2025 - 2025 the original author or authors.
 */

package io.signalr.client.transport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

import org.apache.catalina.startup.Tomcat;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import reactor.test.StepVerifier;

import io.signalr.spec.Connection;
import io.signalr.spec.NegotiateResponse;
import io.signalr.spec.SignalRTransportException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the Server-Sent Events transport against an embedded Tomcat.
 */
@Timeout(20)
class SseConnectionTests {

	private final TestHubServlet servlet = new TestHubServlet();

	private Tomcat tomcat;

	private String address;

	private CloseableHttpClient httpClient;

	@BeforeEach
	void setUp() {
		int port = TomcatTestUtil.findAvailablePort();
		this.tomcat = TomcatTestUtil.startTomcatServer(port, this.servlet);
		this.address = "http://localhost:" + port + "/hub";
		this.httpClient = HttpClients.createDefault();
	}

	@AfterEach
	void tearDown() throws IOException {
		this.servlet.endStream();
		this.httpClient.close();
		TomcatTestUtil.stopTomcatServer(this.tomcat);
	}

	@Test
	void opensEventStreamWithRoutingIdAndAcceptHeader() throws IOException {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, new OkHttpWebSocketDialer(),
				() -> Collections.singletonMap("X-Trace", "t1"));

		Connection connection = establisher.establish(this.address, sseOnly("abc", "tok"))
			.block(Duration.ofSeconds(5));

		assertThat(connection).isInstanceOf(SseConnection.class);
		assertThat(connection.getConnectionId()).isEqualTo("abc");
		TestHubServlet.Call get = this.servlet.calls.get(0);
		assertThat(get.method).isEqualTo("GET");
		assertThat(get.path).isEqualTo("/hub");
		assertThat(get.query).isEqualTo("id=tok");
		assertThat(get.headers).containsEntry("Accept", "text/event-stream").containsEntry("X-Trace", "t1");

		connection.close();
	}

	@Test
	void readsDataLinesOnly() throws IOException {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, new OkHttpWebSocketDialer(),
				null);
		Connection connection = establisher.establish(this.address, sseOnly("abc", null))
			.block(Duration.ofSeconds(5));

		this.servlet.emit(": keep-alive comment");
		this.servlet.emit("event: message");
		this.servlet.emit("data: {\"type\":6}\u001e");
		this.servlet.emit("");
		this.servlet.emit("data:{\"type\":7}\u001e\r");
		this.servlet.endStream();

		assertThat(readFully(connection)).isEqualTo("{\"type\":6}\u001e{\"type\":7}\u001e");
		connection.close();
	}

	@Test
	void writePostsToRoutedAddress() throws Exception {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, new OkHttpWebSocketDialer(),
				() -> Collections.singletonMap("X-Trace", "t1"));
		Connection connection = establisher.establish(this.address, sseOnly("abc", "tok"))
			.block(Duration.ofSeconds(5));

		connection.write("{\"type\":6}\u001e".getBytes(StandardCharsets.UTF_8));

		assertThat(this.servlet.sentBodies.poll(5, TimeUnit.SECONDS)).isEqualTo("{\"type\":6}\u001e");
		TestHubServlet.Call post = this.servlet.calls.get(1);
		assertThat(post.method).isEqualTo("POST");
		assertThat(post.query).isEqualTo("id=tok");
		assertThat(post.headers).containsEntry("X-Trace", "t1");

		connection.close();
	}

	@Test
	void writeFailsOnNon200() throws IOException {
		this.servlet.sendStatus = 404;
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, new OkHttpWebSocketDialer(),
				null);
		Connection connection = establisher.establish(this.address, sseOnly("abc", null))
			.block(Duration.ofSeconds(5));

		assertThatThrownBy(() -> connection.write(new byte[] { '{', '}' })).isInstanceOf(IOException.class)
			.hasMessageStartingWith("POST " + this.address + "?id=abc -> 404");

		connection.close();
	}

	@Test
	void failsOnNon2xxEventStream() {
		this.servlet.eventStreamStatus = 503;
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, new OkHttpWebSocketDialer(),
				null);

		StepVerifier.create(establisher.establish(this.address, sseOnly("abc", null)))
			.expectErrorSatisfies(e -> assertThat(e).isInstanceOf(SignalRTransportException.class)
				.hasMessageStartingWith("GET " + this.address + "?id=abc -> 503"))
			.verify(Duration.ofSeconds(5));
	}

	@Test
	void closeEndsReading() throws IOException {
		TransportEstablisher establisher = new TransportEstablisher(this.httpClient, new OkHttpWebSocketDialer(),
				null);
		Connection connection = establisher.establish(this.address, sseOnly("abc", null))
			.block(Duration.ofSeconds(5));

		connection.close();

		assertThat(connection.read(new byte[16])).isEqualTo(-1);
		assertThatThrownBy(() -> connection.write(new byte[] { 1 })).isInstanceOf(IOException.class);
	}

	@Test
	void dataPayloadStripsOneLeadingSpace() {
		assertThat(SseConnection.dataPayload("data: x")).isEqualTo("x");
		assertThat(SseConnection.dataPayload("data:x")).isEqualTo("x");
		assertThat(SseConnection.dataPayload("data:  x")).isEqualTo(" x");
		assertThat(SseConnection.dataPayload("\tdata: x\r")).isEqualTo("x");
		assertThat(SseConnection.dataPayload("data: {}\u001e")).isEqualTo("{}\u001e");
		assertThat(SseConnection.dataPayload("event: message")).isNull();
		assertThat(SseConnection.dataPayload("")).isNull();
	}

	private static String readFully(Connection connection) throws IOException {
		StringBuilder received = new StringBuilder();
		byte[] buffer = new byte[4];
		int read;
		while ((read = connection.read(buffer)) != -1) {
			received.append(new String(buffer, 0, read, StandardCharsets.UTF_8));
		}
		return received.toString();
	}

	private static NegotiateResponse sseOnly(String connectionId, String connectionToken) {
		return new NegotiateResponse(connectionId, connectionToken, Collections.singletonList(
				new NegotiateResponse.AvailableTransport("ServerSentEvents", Collections.singletonList("Text"))));
	}

}
