package org.goof.util;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.goof.ast.Program;
import org.goof.parser.SourceParser;
import org.goof.semantic.Analyzer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AstJsonConverterTest
{
	private static JsonObject firstStatement(Program program)
	{
		JsonObject root = JsonParser.parseString(AstJsonConverter.toJson(program)).getAsJsonObject();
		assertEquals("Program", root.get("node").getAsString());
		return root.getAsJsonArray("statements").get(0).getAsJsonObject();
	}

	@Test
	void plainTreeHasNoTypes()
	{
		JsonObject declaration = firstStatement(SourceParser.parse("var x : whole_number := 1"));

		assertEquals("VariableDeclaration", declaration.get("node").getAsString());
		assertFalse(declaration.has("type"));
	}

	@Test
	void decoratedTreeShowsTypesAndReferences()
	{
		Program program = SourceParser.parse("var x : whole_number := 1; x := 2");
		new Analyzer().analyze(program);

		JsonObject root = JsonParser.parseString(AstJsonConverter.toJson(program)).getAsJsonObject();
		JsonObject declaration = root.getAsJsonArray("statements").get(0).getAsJsonObject();
		assertEquals("whole_number", declaration.get("type").getAsString());

		String json = AstJsonConverter.toJson(program);
		assertTrue(json.contains("\"reference\""), json);
		assertTrue(json.contains("\"kind\": \"VariableDeclaration\""), json);
	}
}
