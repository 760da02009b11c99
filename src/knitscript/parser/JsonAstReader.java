package knitscript.parser;

import knitscript.model.*;
import knitscript.util.SourceLocation;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads the AST produced by the KnitScript parser, serialized as JSON, into model nodes.
 *
 * A document looks like
 *
 * <pre>
 * {"source": "scarf.ks",
 *  "statements": [
 *    {"type": "patternDef", "name": "rib", "pattern": {"type": "pattern", "params": [], "rows": [...]}},
 *    {"type": "call", "call": {"type": "call", "target": {"type": "get", "name": "show"}, "args": [...]}}]}
 * </pre>
 *
 * Every node may carry a {@code "location"} object with 0-based offsets, lines and columns into
 * the source file.
 */
public class JsonAstReader {

	private final Path source;

	private JsonAstReader(Path source) {
		this.source = source;
	}

	public static Document readDocument(Path path) throws IOException, AstReadException {
		String text = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
		JSONObject json;
		try {
			json = new JSONObject(text);
		} catch (JSONException e) {
			throw new AstReadException(path + ": parsing error: " + e.getMessage(), e);
		}
		return readDocument(path, json);
	}

	/**
	 * @param path the file the JSON was read from; the source file it names is resolved against
	 *             its directory
	 */
	public static Document readDocument(Path path, JSONObject json) throws AstReadException {
		Path source = path;
		if (json.has("source")) {
			Path dir = path.toAbsolutePath().getParent();
			source = dir.resolve(json.optString("source", path.toString()));
		}
		JsonAstReader reader = new JsonAstReader(source);
		try {
			List<Statement> statements = new ArrayList<>();
			JSONArray array = json.getJSONArray("statements");
			for (int i = 0; i < array.length(); i++) {
				statements.add(reader.readStatement(array.getJSONObject(i)));
			}
			return new Document(source, statements);
		} catch (JSONException e) {
			throw new AstReadException(path + ": malformed document: " + e.getMessage(), e);
		}
	}

	/**
	 * Reads a single expression, attributing its locations to {@code source}.
	 */
	public static Node readNode(Path source, JSONObject json) throws AstReadException {
		try {
			return new JsonAstReader(source).readNode(json);
		} catch (JSONException e) {
			throw new AstReadException("malformed node: " + e.getMessage(), e);
		}
	}

	private SourceLocation readLocation(JSONObject json) {
		JSONObject loc = json.optJSONObject("location");
		if (loc == null || source == null) {
			return SourceLocation.unknown();
		}
		return new SourceLocation(
				source,
				loc.getInt("startOffset"),
				loc.getInt("endOffset"),
				loc.getInt("startLine"),
				loc.getInt("endLine"),
				loc.getInt("startColumn"),
				loc.getInt("endColumn"));
	}

	private List<String> readStrings(JSONArray array) {
		List<String> result = new ArrayList<>(array.length());
		for (int i = 0; i < array.length(); i++) {
			result.add(array.getString(i));
		}
		return result;
	}

	private List<Node> readNodes(JSONArray array) throws AstReadException {
		List<Node> result = new ArrayList<>(array.length());
		for (int i = 0; i < array.length(); i++) {
			result.add(readNode(array.getJSONObject(i)));
		}
		return result;
	}

	private Statement readStatement(JSONObject json) throws AstReadException {
		SourceLocation location = readLocation(json);
		String type = json.getString("type");
		switch (type) {
			case "using":
				return new UsingStatement(location, readStrings(json.getJSONArray("names")), json.getString("module"));
			case "patternDef":
				return new PatternDefinition(location, json.getString("name"), readNode(json.getJSONObject("pattern")));
			case "call": {
				// the call itself may be inlined into the statement
				JSONObject callJson = json.has("call") ? json.getJSONObject("call") : json;
				return new CallStatement(location, readCall(callJson));
			}
			default:
				throw new AstReadException("unknown statement type \"" + type + "\"");
		}
	}

	private Call readCall(JSONObject json) throws AstReadException {
		return new Call(readLocation(json), readNode(json.getJSONObject("target")), readNodes(json.getJSONArray("args")));
	}

	private Node readNode(JSONObject json) throws AstReadException {
		SourceLocation location = readLocation(json);
		String type = json.getString("type");
		switch (type) {
			case "natural": {
				int value = json.getInt("value");
				if (value < 0) {
					throw new AstReadException("natural literal must not be negative, found " + value);
				}
				return new NaturalLit(location, value);
			}
			case "string":
				return new StringLit(location, json.getString("value"));
			case "stitch": {
				String symbol = json.getString("value");
				Stitch stitch = Stitch.fromSymbol(symbol)
						.orElseThrow(() -> new AstReadException("unknown stitch \"" + symbol + "\""));
				return new StitchLit(location, stitch);
			}
			case "fixedStitchRepeat":
				return new FixedStitchRepeat(
						location, readNodes(json.getJSONArray("stitches")), readNode(json.getJSONObject("times")));
			case "expandingStitchRepeat": {
				Node toLast = json.has("toLast")
						? readNode(json.getJSONObject("toLast"))
						: new NaturalLit(location, 0);
				return new ExpandingStitchRepeat(location, readNodes(json.getJSONArray("stitches")), toLast);
			}
			case "row": {
				Side side = null;
				String sideSymbol = json.optString("side", null);
				if (sideSymbol != null) {
					try {
						side = Side.fromSymbol(sideSymbol);
					} catch (IllegalArgumentException e) {
						throw new AstReadException("unknown side \"" + sideSymbol + "\"", e);
					}
				}
				return new Row(location, readNodes(json.getJSONArray("stitches")), side, false);
			}
			case "rowRepeat":
				return new RowRepeat(location, readNodes(json.getJSONArray("rows")), readNode(json.getJSONObject("times")));
			case "pattern": {
				List<String> params = json.has("params") ? readStrings(json.getJSONArray("params")) : Collections.emptyList();
				return new Pattern(location, readNodes(json.getJSONArray("rows")), params, null);
			}
			case "block":
				return new Block(location, readNodes(json.getJSONArray("patterns")));
			case "fixedBlockRepeat":
				return new FixedBlockRepeat(location, readNode(json.getJSONObject("block")), readNode(json.getJSONObject("times")));
			case "get":
				return new VarRef(location, json.getString("name"));
			case "call":
				return readCall(json);
			default:
				throw new AstReadException("unknown node type \"" + type + "\"");
		}
	}

}
