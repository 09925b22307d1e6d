package hu.advjava.mcpcrossword.bonus;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

import org.glassfish.grizzly.http.server.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import jakarta.json.Json;
import jakarta.json.JsonObject;

public class McpServerHttpTest {
	private static HttpServer server;
	private static String endpoint;
	private static final HttpClient http = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(5))
			.build();

	@BeforeAll
	public static void start() throws IOException {
		int port;
		try (var socket = new ServerSocket(0)) {
			port = socket.getLocalPort();
		}
		server = McpServer.runServer("http://127.0.0.1:" + port);
		endpoint = "http://127.0.0.1:" + port + "/mcp";
	}

	@AfterAll
	public static void stop() {
		if (server != null) server.shutdownNow();
	}

	private static String solveRequest() {
		return Json.createObjectBuilder()
			.add("jsonrpc", "2.0")
			.add("id", 7)
			.add("method", "tools/call")
			.add("params", Json.createObjectBuilder()
				.add("name", "solve_crossword")
				.add("arguments", Json.createObjectBuilder()
					.add("structure", Json.createArrayBuilder(List.of("___")))
					.add("words", Json.createArrayBuilder(List.of("cat", "horse")))))
			.build()
			.toString();
	}

	private static HttpResponse<String> post(String accept, String body) throws Exception {
		HttpRequest req = HttpRequest.newBuilder()
			.uri(URI.create(endpoint))
			.timeout(Duration.ofSeconds(10))
			.header("Content-Type", "application/json")
			.header("Accept", accept)
			.POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
			.build();
		return http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
	}

	private static HttpResponse<String> send(String method, String path) throws Exception {
		HttpRequest req = HttpRequest.newBuilder()
			.uri(URI.create(endpoint + path))
			.timeout(Duration.ofSeconds(10))
			.method(method, HttpRequest.BodyPublishers.noBody())
			.build();
		return http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
	}

	private static JsonObject parse(String text) {
		try (var reader = Json.createReader(new StringReader(text))) {
			return reader.readObject();
		}
	}

	private static JsonObject toolPayload(JsonObject envelope) {
		return parse(envelope.getJsonObject("result").getJsonArray("content").getJsonObject(0).getString("text"));
	}

	private static String dataLine(String eventStream) {
		return eventStream.lines()
			.filter(line -> line.startsWith("data:"))
			.map(line -> line.substring("data:".length()).trim())
			.findFirst()
			.orElseThrow(() -> new AssertionError("No data line in: " + eventStream));
	}

	@Test
	public void jsonPostSolvesTheGrid() throws Exception {
		var resp = post("application/json", solveRequest());
		assertEquals(200, resp.statusCode(), resp.body());

		var envelope = parse(resp.body());
		var result = toolPayload(envelope);
		assertAll(
			() -> assertEquals(7, envelope.getInt("id")),
			() -> assertEquals("SOLVEDUNIQUE", result.getString("state")),
			() -> assertEquals("CAT", result.getJsonArray("solution").getJsonObject(0).getString("word")),
			() -> assertEquals("no-cache", resp.headers().firstValue("Cache-Control").orElse(""))
		);
	}

	@Test
	public void ssePostSendsOneJsonRpcEvent() throws Exception {
		var resp = post("text/event-stream", solveRequest());
		assertEquals(200, resp.statusCode(), resp.body());

		var result = toolPayload(parse(dataLine(resp.body())));
		assertAll(
			() -> assertTrue(resp.body().lines().anyMatch(line -> line.equals("event: jsonrpc")), resp.body()),
			() -> assertEquals("SOLVEDUNIQUE", result.getString("state")),
			() -> assertEquals("CAT", result.getJsonArray("grid").getString(0))
		);
	}

	@Test
	public void getDescribesTheEndpoint() throws Exception {
		var resp = send("GET", "");
		assertEquals(200, resp.statusCode());
		var info = parse(resp.body());
		assertAll(
			() -> assertTrue(info.getBoolean("ok")),
			() -> assertEquals("/mcp", info.getString("endpoint"))
		);
	}

	@Test
	public void headAndPreflightAnswer() throws Exception {
		var head = send("HEAD", "");
		var preflight = send("OPTIONS", "/anything");
		assertAll(
			() -> assertEquals(200, head.statusCode()),
			() -> assertEquals(200, preflight.statusCode()),
			() -> assertEquals("*", preflight.headers().firstValue("Access-Control-Allow-Origin").orElse("")),
			() -> assertTrue(preflight.headers().firstValue("Access-Control-Allow-Methods").orElse("").contains("POST"))
		);
	}

	@Test
	public void streamAnnouncesReadiness() {
		// the stream stays open, so read only up to the first event
		String data = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
			HttpRequest req = HttpRequest.newBuilder()
				.uri(URI.create(endpoint + "/stream"))
				.header("Accept", "text/event-stream")
				.GET()
				.build();
			HttpResponse<Stream<String>> resp = http.send(req, HttpResponse.BodyHandlers.ofLines());
			assertEquals(200, resp.statusCode());
			try (Stream<String> lines = resp.body()) {
				return lines.filter(line -> line.startsWith("data:"))
					.map(line -> line.substring("data:".length()).trim())
					.findFirst()
					.orElseThrow();
			}
		});
		assertEquals("server/ready", parse(data).getString("method"));
	}
}
