package org.javai.pegtree.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.pegtree.input.Position;

/**
 * Renders a parse tree as JSON, e.g. for golden files or for inspection.
 *
 * <pre>
 * {"type":"digit","source":"example","begin":{"offset":0,"line":1,"column":1},
 *  "end":{"offset":1,"line":1,"column":2},"content":"1","children":[]}
 * </pre>
 *
 * The root node has an empty type and no positions; nodes whose content was
 * removed have no {@code end} and no {@code content}.
 */
public final class ParseTreeJsonWriter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private ParseTreeJsonWriter() {}

	public static ObjectNode toJson(ParseTreeNode node) {
		ObjectNode json = mapper.createObjectNode();
		json.put("type", node.type());
		if (!node.isRoot()) {
			json.put("source", node.source());
			json.set("begin", position(node.begin()));
			if (node.hasContent()) {
				json.set("end", position(node.end()));
				json.put("content", node.content());
			}
		}
		ArrayNode children = json.putArray("children");
		for (ParseTreeNode child : node.children()) {
			children.add(toJson(child));
		}
		return json;
	}

	/**
	 * Pretty-printed JSON for {@code node} and its subtree.
	 */
	public static String writeString(ParseTreeNode node) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(node));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render parse tree as JSON", e);
		}
	}

	private static ObjectNode position(Position position) {
		ObjectNode json = mapper.createObjectNode();
		json.put("offset", position.offset());
		json.put("line", position.line());
		json.put("column", position.column());
		return json;
	}
}
