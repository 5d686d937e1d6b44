package org.javai.cst.helpers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.cst.CstException;
import org.javai.cst.nodes.CstNode;
import org.javai.cst.nodes.CstNodes;
import org.javai.cst.nodes.NodeSchema;
import org.javai.cst.parser.ParseTree;
import org.javai.cst.tokenize.Token;

/**
 * Converts syntax trees into JSON for diagnostics and golden files.
 * <p>
 * A CST node becomes an object with a {@code type} field followed by one field
 * per slot in source order. Absent optional children are written as
 * {@code null}, sequences as arrays.
 */
public final class CstJsonWriter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private CstJsonWriter() {
	}

	public static ObjectNode toJson(CstNode node) {
		ObjectNode json = mapper.createObjectNode();
		json.put("type", node.getClass().getSimpleName());
		for (NodeSchema.Slot slot : CstNodes.schema(node).slots()) {
			Object value = CstNodes.slotValue(node, slot.name());
			switch (slot.kind()) {
				case SEQUENCE -> {
					ArrayNode items = json.putArray(slot.name());
					for (Object item : (List<?>) value) {
						items.add(toJson((CstNode) item));
					}
				}
				case REQUIRED, OPTIONAL -> {
					if (value == null) {
						json.putNull(slot.name());
					}
					else {
						json.set(slot.name(), toJson((CstNode) value));
					}
				}
				default -> putAttribute(json, slot.name(), value);
			}
		}
		return json;
	}

	public static ObjectNode toJson(ParseTree tree) {
		ObjectNode json = mapper.createObjectNode();
		if (tree.isLeaf()) {
			Token token = tree.token();
			json.put("kind", token.kind().name());
			json.put("text", token.text());
			json.put("leading", token.leadingTrivia());
			json.put("trailing", token.trailingTrivia());
			json.put("start", token.start());
			return json;
		}
		json.put("symbol", tree.symbol());
		ArrayNode children = json.putArray("children");
		for (ParseTree child : tree.children()) {
			children.add(toJson(child));
		}
		return json;
	}

	/**
	 * Indented JSON text for a node.
	 */
	public static String write(CstNode node) {
		return pretty(toJson(node));
	}

	public static String write(ParseTree tree) {
		return pretty(toJson(tree));
	}

	private static void putAttribute(ObjectNode json, String name, Object value) {
		if (value == null) {
			json.putNull(name);
		}
		else if (value instanceof Boolean flag) {
			json.put(name, flag);
		}
		else if (value instanceof Enum<?> constant) {
			json.put(name, constant.name());
		}
		else {
			json.put(name, value.toString());
		}
	}

	private static String pretty(ObjectNode json) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(json);
		}
		catch (JsonProcessingException e) {
			throw new CstException("Failed to write JSON", e);
		}
	}
}
