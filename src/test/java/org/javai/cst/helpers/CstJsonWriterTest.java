package org.javai.cst.helpers;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.cst.grammar.GrammarVersion;
import org.javai.cst.nodes.Assign;
import org.javai.cst.nodes.IntegerLiteral;
import org.javai.cst.nodes.Name;
import org.javai.cst.parser.CstParser;
import org.javai.cst.parser.ParseMode;
import org.javai.cst.parser.ParseTree;
import org.javai.cst.parser.ParserBackend;
import org.javai.cst.tokenize.PythonTokenizer;
import org.junit.jupiter.api.Test;

class CstJsonWriterTest {

	@Test
	void leafNode() {
		assertThat(CstJsonWriter.toJson(Name.of("x")).toString())
				.isEqualTo("{\"type\":\"Name\",\"lpar\":[],\"value\":\"x\",\"rpar\":[]}");
	}

	@Test
	void absentOptionalChildIsNull() {
		ObjectNode json = CstJsonWriter.toJson(Assign.of(Name.of("x"), IntegerLiteral.of("1")));

		assertThat(json.get("semicolon").isNull()).isTrue();
		assertThat(json.get("targets")).hasSize(1);
		assertThat(json.at("/value/value").asText()).isEqualTo("1");
		assertThat(json.at("/targets/0/whitespaceAfterEqual/value").asText()).isEqualTo(" ");
	}

	@Test
	void booleanAttributesStayBoolean() {
		ObjectNode json = CstJsonWriter.toJson(CstParser.parseModule("x"));

		assertThat(json.get("hasTrailingNewline").isBoolean()).isTrue();
		assertThat(json.get("hasTrailingNewline").asBoolean()).isFalse();
		assertThat(json.get("encoding").asText()).isEqualTo("utf-8");
	}

	@Test
	void writtenTextParsesBack() throws Exception {
		String text = CstJsonWriter.write(CstParser.parseModule("def f(a):\n    return a\n"));

		JsonNode parsed = new ObjectMapper().readTree(text);
		assertThat(parsed.get("type").asText()).isEqualTo("Module");
		assertThat(parsed.at("/body/0/type").asText()).isEqualTo("FunctionDef");
		assertThat(text).contains("\n");
	}

	@Test
	void parseTree() {
		ParseTree tree = ParserBackend.INTERPRETED.newStrategy().parse(
				PythonTokenizer.tokenize("a", GrammarVersion.PYTHON_3_8), GrammarVersion.PYTHON_3_8, ParseMode.EXPRESSION);

		ObjectNode json = CstJsonWriter.toJson(tree);

		assertThat(json.get("symbol").asText()).isEqualTo("expression_input");
		assertThat(json.at("/children/0/kind").asText()).isEqualTo("NAME");
		assertThat(json.at("/children/0/text").asText()).isEqualTo("a");
		assertThat(json.at("/children/0/start").asInt()).isZero();
	}
}
