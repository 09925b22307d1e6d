package hu.advjava.mcpcrossword.bonus;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import hu.advjava.mcpcrossword.Assignment;
import hu.advjava.mcpcrossword.Crossword;
import hu.advjava.mcpcrossword.CrosswordSolver;
import hu.advjava.mcpcrossword.ExampleCrossword;
import hu.advjava.mcpcrossword.SearchStatistics;
import jakarta.json.Json;
import jakarta.json.JsonArray;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;
import jakarta.json.JsonString;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HEAD;
import jakarta.ws.rs.OPTIONS;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.sse.OutboundSseEvent;
import jakarta.ws.rs.sse.Sse;
import jakarta.ws.rs.sse.SseEventSink;

@Path("/mcp")
public class McpResource {
	public static final Function<String, String> nameToUri = name ->
		"crossword://examples/%s".formatted(name.toLowerCase().replaceAll("_", "-"));

	static final int INVALID_PARAMS = -32602;
	static final int METHOD_NOT_FOUND = -32601;
	static final int SERVER_ERROR = -32000;
	static final long DEFAULT_COUNT_LIMIT = 100;

	@Context
	private Sse sse;

	/* ---- Accept GET (200) so connectors probing don't fail ---- */
	@GET
	@Produces(MediaType.APPLICATION_JSON)
	public Response getInfo(@Context HttpHeaders headers, @Context UriInfo ui) {
		logProbe("GET", ui, headers);
		JsonObject body = Json.createObjectBuilder()
			.add("ok", true)
			.add("endpoint", "/mcp")
			.add("hint", "POST JSON-RPC here; optional SSE at GET /mcp/stream")
			.build();
		return Response.ok(body).build();
	}

	@HEAD
	public Response head(@Context HttpHeaders headers, @Context UriInfo ui) {
		logProbe("HEAD", ui, headers);
		return Response.ok().build();
	}

	// Preflight / browser convenience
	@OPTIONS
	@Path("{any: .*}")
	public Response options(@Context HttpHeaders headers, @Context UriInfo ui) {
		logProbe("OPTIONS", ui, headers);
		return Response.ok()
			.header("Access-Control-Allow-Origin", "*")
			.header("Access-Control-Allow-Headers", "Content-Type, Authorization")
			.header("Access-Control-Allow-Methods", "GET,POST,HEAD,OPTIONS")
			.build();
	}

	/* -------------------- POST (JSON) -------------------- */

	@POST
	@Consumes(MediaType.APPLICATION_JSON)
	@Produces(MediaType.APPLICATION_JSON)
	public Response handleJson(JsonObject request, @Context HttpHeaders headers, @Context UriInfo ui) {
		logProbe("POST", ui, headers);
		JsonObject resp = dispatch(request);
		return Response.ok(resp, MediaType.APPLICATION_JSON_TYPE)
			.header("Cache-Control", "no-cache")
			.build();
	}

	/* -------------------- POST (SSE) -------------------- */

	// Same path, different negotiated media type
	@POST
	@Consumes(MediaType.APPLICATION_JSON)
	@Produces(MediaType.SERVER_SENT_EVENTS)
	public void handleSse(JsonObject request, @Context SseEventSink sink) {
		try (sink) {
			sink.send(jsonRpcEvent(dispatch(request)));
		}
	}

	@GET
	@Path("/stream")
	@Produces(MediaType.SERVER_SENT_EVENTS)
	public void stream(@Context SseEventSink sink) {
		JsonObject ready = Json.createObjectBuilder()
			.add("jsonrpc", "2.0")
			.add("method", "server/ready")
			.add("params", Json.createObjectBuilder())
			.build();
		sink.send(jsonRpcEvent(ready));
	}

	private OutboundSseEvent jsonRpcEvent(JsonObject envelope) {
		return sse.newEventBuilder()
			.name("jsonrpc")
			.mediaType(MediaType.APPLICATION_JSON_TYPE)
			.data(JsonObject.class, envelope)
			.build();
	}

	/* -------------------- Core dispatcher -------------------- */

	public JsonObject dispatch(JsonObject request) {
		String method = request.getString("method", "");
		int id = request.getInt("id", -1);

		System.out.println("MCP <- " + method + " (id=" + id + ")");
		try {
			switch (method) {
			case "initialize":
				return okEnvelope(id, Json.createObjectBuilder()
					.add("protocolVersion", "2025-06-18")
					.add("capabilities", Json.createObjectBuilder()
						.add("tools", Json.createObjectBuilder())
						.add("resources", Json.createObjectBuilder()))
					.add("serverInfo", Json.createObjectBuilder()
						.add("name", "CrosswordMCP")
						.add("version", "1.0"))
					.add("instructions",
						"This server fills crossword grids from a word list (solve_crossword, count_solutions) " +
						"and offers a few example puzzles as resources. Grid rows use '_' for open cells.")
					.build());

			case "tools/list":
				return okEnvelope(id, Json.createObjectBuilder()
					.add("tools", Json.createArrayBuilder()
						.add(Json.createObjectBuilder()
							.add("name", "solve_crossword")
							.add("description", "Fill a crossword grid with distinct words from the list. '_' marks an open cell, anything else is blocked.")
							.add("inputSchema", puzzleSchema(Json.createObjectBuilder())))
						.add(Json.createObjectBuilder()
							.add("name", "count_solutions")
							.add("description", "Count the fillings of a crossword grid, up to a limit (0 = no limit).")
							.add("inputSchema", puzzleSchema(Json.createObjectBuilder()
								.add("limit", Json.createObjectBuilder()
									.add("type", "integer")
									.add("default", DEFAULT_COUNT_LIMIT))))))
					.build());

			case "tools/call": {
				final JsonObject params = params(request);
				final String toolName = params.getString("name", "");
				final JsonObject args = params.getJsonObject("arguments");

				if ("solve_crossword".equals(toolName)) {
					return okEnvelope(id, textContent(solve(toCrossword(args))));
				}
				if ("count_solutions".equals(toolName)) {
					var solver = new CrosswordSolver(toCrossword(args));
					long limit = args.containsKey("limit") ? args.getJsonNumber("limit").longValue() : DEFAULT_COUNT_LIMIT;
					long count = solver.countSolutions(limit);
					return okEnvelope(id, textContent(Json.createObjectBuilder()
						.add("count", count)
						.add("state", CrosswordSolver.State.stateFromSols(count).toString())
						.add("statistics", statisticsToJson(solver.statistics()))
						.build()));
				}
				return errorEnvelope(id, METHOD_NOT_FOUND, "Unknown tool: " + toolName);
			}

			case "resources/list": {
				JsonArrayBuilder resources = Json.createArrayBuilder();
				Arrays.stream(ExampleCrossword.values()).forEach(e -> resources.add(Json.createObjectBuilder()
					.add("uri", nameToUri.apply(e.name()))
					.add("name", "Example " + e.name().toLowerCase().replaceAll("_", " "))
					.add("mimeType", "application/json")));
				return okEnvelope(id, Json.createObjectBuilder().add("resources", resources).build());
			}

			case "resources/read": {
				final String uri = params(request).getString("uri", "");
				Optional<ExampleCrossword> maybeExample = ExampleCrossword.findByName.apply(uri, nameToUri);
				if (maybeExample.isEmpty()) {
					return errorEnvelope(id, INVALID_PARAMS, "Unknown resource: " + uri);
				}
				var example = maybeExample.get();
				String text = Json.createObjectBuilder()
					.add("structure", Json.createArrayBuilder(example.getStructure()))
					.add("words", Json.createArrayBuilder(example.getWords()))
					.build()
					.toString();
				return okEnvelope(id, Json.createObjectBuilder()
					.add("contents", Json.createArrayBuilder()
						.add(Json.createObjectBuilder()
							.add("uri", uri)
							.add("mimeType", "application/json")
							.add("text", text)))
					.build());
			}

			default:
				return errorEnvelope(id, METHOD_NOT_FOUND, "Method not found: " + method);
			}
		} catch (IllegalArgumentException | ClassCastException e) {
			System.out.println("MCP -> invalid params (id=" + id + "): " + e.getMessage());
			return errorEnvelope(id, INVALID_PARAMS, "Invalid params: " + e.getMessage());
		} catch (RuntimeException e) {
			e.printStackTrace();
			return errorEnvelope(id, SERVER_ERROR, "Server error: " + e.getMessage());
		}
	}

	/* -------------------- Solving -------------------- */

	static JsonObject solve(Crossword crossword) {
		var solver = new CrosswordSolver(crossword);
		Optional<Assignment> solution = solver.solve();
		JsonObject statistics = statisticsToJson(solver.statistics());

		// a second, counting pass tells unique fillings apart
		CrosswordSolver.State state = solution.isPresent()
			? new CrosswordSolver(crossword).solveCount(2)
			: CrosswordSolver.State.NOSOLUTION;

		return Json.createObjectBuilder()
			.add("state", state.toString())
			.add("solution", solution.map(McpResource::assignmentToJson).orElseGet(() -> Json.createArrayBuilder().build()))
			.add("grid", solution.map(a -> gridToJson(crossword, a)).orElseGet(() -> Json.createArrayBuilder().build()))
			.add("statistics", statistics)
			.build();
	}

	private static JsonObject params(JsonObject request) {
		JsonObject params = request.getJsonObject("params");
		if (params == null) throw new IllegalArgumentException("params are required");
		return params;
	}

	private static Crossword toCrossword(JsonObject args) {
		if (args == null) throw new IllegalArgumentException("arguments are required");
		return Crossword.fromRows(strings(args, "structure"), strings(args, "words"));
	}

	private static List<String> strings(JsonObject args, String name) {
		JsonArray arr = args.getJsonArray(name);
		if (arr == null) throw new IllegalArgumentException("'" + name + "' must be an array of strings");
		return arr.getValuesAs(JsonString.class).stream().map(JsonString::getString).toList();
	}

	/* -------------------- JSON helpers -------------------- */

	private static JsonObject puzzleSchema(JsonObjectBuilder extraProperties) {
		return Json.createObjectBuilder()
			.add("type", "object")
			.add("properties", extraProperties
				.add("structure", Json.createObjectBuilder()
					.add("type", "array")
					.add("minItems", 1)
					.add("items", Json.createObjectBuilder().add("type", "string")))
				.add("words", Json.createObjectBuilder()
					.add("type", "array")
					.add("items", Json.createObjectBuilder().add("type", "string"))))
			.add("required", Json.createArrayBuilder().add("structure").add("words"))
			.build();
	}

	private static JsonObject textContent(JsonObject payload) {
		return Json.createObjectBuilder().add("content",
			Json.createArrayBuilder().add(
				Json.createObjectBuilder().add("type", "text").add("text", payload.toString()))).build();
	}

	private static JsonObject okEnvelope(int id, JsonObject result) {
		return Json.createObjectBuilder()
			.add("jsonrpc", "2.0")
			.add("id", id)
			.add("result", result)
			.build();
	}

	private static JsonObject errorEnvelope(int id, int code, String message) {
		return Json.createObjectBuilder()
			.add("jsonrpc", "2.0")
			.add("id", id)
			.add("error", Json.createObjectBuilder()
				.add("code", code)
				.add("message", message))
			.build();
	}

	private static JsonArray assignmentToJson(Assignment assignment) {
		JsonArrayBuilder ab = Json.createArrayBuilder();
		assignment.asMap().forEach((v, word) -> ab.add(Json.createObjectBuilder()
			.add("i", v.i())
			.add("j", v.j())
			.add("direction", v.direction().toString())
			.add("length", v.length())
			.add("word", word)));
		return ab.build();
	}

	// '#' blocked, ' ' open but unfilled
	static JsonArray gridToJson(Crossword crossword, Assignment assignment) {
		Character[][] letters = crossword.letterGrid(assignment);
		JsonArrayBuilder ab = Json.createArrayBuilder();
		IntStream.range(0, crossword.height()).forEach(i -> ab.add(IntStream.range(0, crossword.width())
			.mapToObj(j -> !crossword.isFillable(i, j) ? "#" : letters[i][j] == null ? " " : letters[i][j].toString())
			.collect(Collectors.joining())));
		return ab.build();
	}

	private static JsonObject statisticsToJson(SearchStatistics statistics) {
		return Json.createObjectBuilder()
			.add("nodes", statistics.nodes())
			.add("branches", statistics.branches())
			.add("rejectedBranches", statistics.rejectedBranches())
			.add("revisions", statistics.revisions())
			.build();
	}

	/* ---- Logging helper ---- */
	private void logProbe(String method, UriInfo ui, HttpHeaders h) {
		System.out.println(method + " " + ui.getRequestUri() + " Accept=" + h.getHeaderString("Accept") +
			" Content-Type=" + h.getHeaderString("Content-Type"));
	}
}
