package org.javai.sxlc.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.sxlc.sxl.SxlCompileException;
import org.javai.sxlc.sxl.SxlNode;
import org.javai.sxlc.sxl.SxlParser;
import org.javai.sxlc.sxl.SxlToken;
import org.javai.sxlc.sxl.UnknownNodeKindException;
import org.javai.sxlc.target.CNode;

/**
 * Renders tokens and both ASTs as JSON for inspection.
 *
 * <p>Every node becomes an object whose {@code "type"} names its kind, followed
 * by its fields, for example:</p>
 * <pre>
 * {"type":"CallExpression","name":"add","params":[{"type":"NumberLiteral","value":"2"}]}
 * </pre>
 */
public class AstJsonWriter {

	private final ObjectMapper mapper;

	public AstJsonWriter() {
		this(SxlParser.DEFAULT_MAX_DEPTH);
	}

	/**
	 * @param maxDepth the call nesting depth the trees to render may reach; each call
	 *                 level opens an object and an array, and the program, statement
	 *                 and innermost literal add a few more
	 */
	public AstJsonWriter(int maxDepth) {
		JsonFactory factory = JsonFactory.builder()
				.streamWriteConstraints(StreamWriteConstraints.builder()
						.maxNestingDepth(2 * maxDepth + 8)
						.build())
				.build();
		this.mapper = new ObjectMapper(factory)
				.enable(SerializationFeature.INDENT_OUTPUT);
	}

	public String writeTokens(List<SxlToken> tokens) {
		ArrayNode array = mapper.createArrayNode();
		for (SxlToken token : tokens) {
			array.addObject()
					.put("type", token.type().name())
					.put("value", token.value())
					.put("position", token.position());
		}
		return write(array);
	}

	public String writeSource(SxlNode node) {
		return write(toJson(node));
	}

	public String writeTarget(CNode node) {
		return write(toJson(node));
	}

	ObjectNode toJson(SxlNode node) {
		ObjectNode json = mapper.createObjectNode();
		if (node instanceof SxlNode.Program program) {
			json.put("type", "Program");
			ArrayNode body = json.putArray("body");
			for (SxlNode child : program.body()) {
				body.add(toJson(child));
			}
		} else if (node instanceof SxlNode.CallExpression call) {
			json.put("type", "CallExpression").put("name", call.name());
			ArrayNode params = json.putArray("params");
			for (SxlNode child : call.params()) {
				params.add(toJson(child));
			}
		} else if (node instanceof SxlNode.NumberLiteral number) {
			json.put("type", "NumberLiteral").put("value", number.value());
		} else if (node instanceof SxlNode.StringLiteral string) {
			json.put("type", "StringLiteral").put("value", string.value());
		} else {
			throw new UnknownNodeKindException(node);
		}
		return json;
	}

	ObjectNode toJson(CNode node) {
		ObjectNode json = mapper.createObjectNode();
		if (node instanceof CNode.Program program) {
			json.put("type", "Program");
			ArrayNode body = json.putArray("body");
			for (CNode child : program.body()) {
				body.add(toJson(child));
			}
		} else if (node instanceof CNode.ExpressionStatement statement) {
			json.put("type", "ExpressionStatement");
			json.set("expression", toJson(statement.expression()));
		} else if (node instanceof CNode.CallExpression call) {
			json.put("type", "CallExpression");
			json.set("callee", toJson(call.callee()));
			ArrayNode arguments = json.putArray("arguments");
			for (CNode child : call.arguments()) {
				arguments.add(toJson(child));
			}
		} else if (node instanceof CNode.Identifier identifier) {
			json.put("type", "Identifier").put("name", identifier.name());
		} else if (node instanceof CNode.NumberLiteral number) {
			json.put("type", "NumberLiteral").put("value", number.value());
		} else if (node instanceof CNode.StringLiteral string) {
			json.put("type", "StringLiteral").put("value", string.value());
		} else {
			throw new UnknownNodeKindException(node);
		}
		return json;
	}

	private String write(Object json) {
		try {
			return mapper.writeValueAsString(json);
		} catch (JsonProcessingException e) {
			throw new SxlCompileException("Failed to render JSON", e);
		}
	}
}
