package hu.advjava.mcpcrossword.bonus;

import java.net.URI;
import java.util.Map;

//org.glassfish.jersey.media:jersey-media-sse:3.1.11
//org.glassfish.jersey.media:jersey-media-json-processing:3.1.11
//org.glassfish.jersey.inject:jersey-hk2:3.1.11
//org.glassfish.jersey.containers:jersey-container-grizzly2-http:3.1.11

import org.glassfish.grizzly.http.server.HttpServer;
import org.glassfish.jersey.grizzly2.httpserver.GrizzlyHttpServerFactory;
import org.glassfish.jersey.jsonp.JsonProcessingFeature;
import org.glassfish.jersey.media.sse.SseFeature;
import org.glassfish.jersey.server.ResourceConfig;
import org.glassfish.jersey.server.ServerProperties;

public class McpServer {
	static final String DEFAULT_HOST = "127.0.0.1";
	static final int DEFAULT_PORT = 8080;

	record ServerConfig(String host, int port) {
		String baseUri() {
			return "http://%s:%d".formatted(host, port);
		}
	}

	public static void main(String[] args) throws Exception {
		var cfg = loadConfig(System.getenv());

		HttpServer server = runServer(cfg.baseUri());
		Runtime.getRuntime().addShutdownHook(new Thread(server::shutdownNow));
		System.out.println("Crossword MCP listening on " + cfg.baseUri() + "/mcp");

		Thread.currentThread().join();
	}

	// MCP_HOST and MCP_PORT, both optional
	static ServerConfig loadConfig(Map<String, String> env) {
		String host = env.getOrDefault("MCP_HOST", "");
		if (host.isBlank()) host = DEFAULT_HOST;

		String port = env.getOrDefault("MCP_PORT", "");
		if (port.isBlank()) return new ServerConfig(host, DEFAULT_PORT);
		try {
			int p = Integer.parseInt(port.trim());
			if (p < 1 || p > 65535) throw new IllegalStateException("MCP_PORT out of range: " + port);
			return new ServerConfig(host, p);
		} catch (NumberFormatException e) {
			throw new IllegalStateException("Set MCP_PORT to a port number, not '" + port + "'.", e);
		}
	}

	static ResourceConfig resourceConfig() {
		return new ResourceConfig()
			.register(McpResource.class) // registered explicitly, no package scanning
			.register(SseFeature.class)
			.register(JsonProcessingFeature.class)
			.property(ServerProperties.WADL_FEATURE_DISABLE, true);
	}

	static HttpServer runServer(String baseUri) {
		return GrizzlyHttpServerFactory.createHttpServer(URI.create(baseUri), resourceConfig());
	}
}
