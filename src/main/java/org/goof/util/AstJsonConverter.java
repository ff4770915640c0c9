// File: src/main/java/org/goof/util/AstJsonConverter.java
package org.goof.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.goof.ast.*;

import java.util.List;

/**
 * Dumps a syntax tree as pretty-printed JSON. Before analysis this is the plain
 * AST; afterwards every node also shows its resolved type and every identifier
 * the declaration it refers to.
 */
public class AstJsonConverter implements AstVisitor<JsonElement>
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

	public static String toJson(Node root)
	{
		return GSON.toJson(root.accept(new AstJsonConverter()));
	}

	private JsonElement convert(Node node)
	{
		return node == null ? JsonNull.INSTANCE : node.accept(this);
	}

	private JsonArray convertAll(List<? extends Node> nodes)
	{
		JsonArray array = new JsonArray();
		nodes.forEach(n -> array.add(convert(n)));
		return array;
	}

	private JsonObject start(Node node)
	{
		JsonObject json = new JsonObject();
		json.addProperty("node", node.getClass().getSimpleName());
		if (node.isAnalyzed())
		{
			json.addProperty("type", node.getType().getName());
		}
		return json;
	}

	private static JsonObject reference(Declaration declaration)
	{
		JsonObject json = new JsonObject();
		json.addProperty("name", declaration.getName());
		json.addProperty("kind", declaration.getClass().getSimpleName());
		return json;
	}

	@Override
	public JsonElement visitProgram(Program node)
	{
		JsonObject json = start(node);
		json.add("statements", convertAll(node.getStatements()));
		return json;
	}

	@Override
	public JsonElement visitArrayExpression(ArrayExpression node)
	{
		JsonObject json = start(node);
		json.add("arrayType", convert(node.getArrayType()));
		json.add("size", convert(node.getSize()));
		json.add("elements", convertAll(node.getElements()));
		return json;
	}

	@Override
	public JsonElement visitArrayType(ArrayTypeNode node)
	{
		JsonObject json = start(node);
		json.add("elementType", convert(node.getElementType()));
		return json;
	}

	@Override
	public JsonElement visitAssignmentStatement(AssignmentStatement node)
	{
		JsonObject json = start(node);
		json.add("target", convert(node.getTarget()));
		json.add("source", convert(node.getSource()));
		return json;
	}

	@Override
	public JsonElement visitBinaryExpression(BinaryExpression node)
	{
		JsonObject json = start(node);
		json.addProperty("op", node.getOp().getSymbol());
		json.add("left", convert(node.getLeft()));
		json.add("right", convert(node.getRight()));
		return json;
	}

	@Override
	public JsonElement visitCallExpression(CallExpression node)
	{
		JsonObject json = start(node);
		json.addProperty("callee", node.getCalleeName());
		json.add("args", convertAll(node.getArgs()));
		return json;
	}

	@Override
	public JsonElement visitField(Field node)
	{
		JsonObject json = start(node);
		json.addProperty("name", node.getName());
		json.add("declaredType", convert(node.getTypeNode()));
		json.add("value", convert(node.getValue()));
		return json;
	}

	@Override
	public JsonElement visitForStatement(ForStatement node)
	{
		JsonObject json = start(node);
		json.add("assignments", convertAll(node.getAssignments()));
		json.add("test", convert(node.getTest()));
		json.add("action", convert(node.getAction()));
		json.add("body", convertAll(node.getBody()));
		return json;
	}

	private JsonObject function(FunctionDeclaration node)
	{
		JsonObject json = start(node);
		json.addProperty("name", node.getName());
		json.add("parameters", convertAll(node.getParameters()));
		json.add("returnType", convert(node.getReturnTypeNode()));
		json.add("body", convertAll(node.getBody()));
		return json;
	}

	@Override
	public JsonElement visitFunc(Func node)
	{
		return function(node);
	}

	@Override
	public JsonElement visitMethod(Method node)
	{
		return function(node);
	}

	@Override
	public JsonElement visitGifStatement(GifStatement node)
	{
		JsonObject json = start(node);
		json.add("tests", convertAll(node.getTests()));
		JsonArray consequents = new JsonArray();
		node.getConsequents().forEach(c -> consequents.add(convertAll(c)));
		json.add("consequents", consequents);
		json.add("alternate", node.getAlternate() == null ? JsonNull.INSTANCE : convertAll(node.getAlternate()));
		return json;
	}

	@Override
	public JsonElement visitIdExp(IdExp node)
	{
		JsonObject json = start(node);
		json.addProperty("name", node.getName());
		if (node.isResolved())
		{
			json.add("reference", reference(node.getReference()));
		}
		return json;
	}

	@Override
	public JsonElement visitLiteral(Literal node)
	{
		JsonObject json = start(node);
		json.addProperty("kind", node.getKind());
		json.addProperty("value", node.getValue());
		return json;
	}

	@Override
	public JsonElement visitMemberExpression(MemberExpression node)
	{
		JsonObject json = start(node);
		json.add("object", convert(node.getObject()));
		json.add("property", convert(node.getProperty()));
		json.addProperty("computed", node.isComputed());
		return json;
	}

	@Override
	public JsonElement visitObjectExp(ObjectExp node)
	{
		JsonObject json = start(node);
		json.add("properties", convertAll(node.getProperties()));
		return json;
	}

	@Override
	public JsonElement visitParameter(Parameter node)
	{
		JsonObject json = start(node);
		json.addProperty("name", node.getName());
		json.add("declaredType", convert(node.getTypeNode()));
		return json;
	}

	@Override
	public JsonElement visitPrimitiveType(PrimitiveTypeNode node)
	{
		JsonObject json = start(node);
		json.addProperty("name", node.getName());
		return json;
	}

	@Override
	public JsonElement visitRecordType(RecordTypeNode node)
	{
		return start(node);
	}

	@Override
	public JsonElement visitReturnStatement(ReturnStatement node)
	{
		JsonObject json = start(node);
		json.add("returnValue", convert(node.getReturnValue()));
		return json;
	}

	@Override
	public JsonElement visitThrowStatement(ThrowStatement node)
	{
		JsonObject json = start(node);
		json.add("error", convert(node.getError()));
		return json;
	}

	@Override
	public JsonElement visitVariableDeclaration(VariableDeclaration node)
	{
		JsonObject json = start(node);
		json.addProperty("name", node.getName());
		json.addProperty("readOnly", node.isReadOnly());
		json.add("declaredType", convert(node.getTypeNode()));
		json.add("initializer", convert(node.getInitializer()));
		return json;
	}

	@Override
	public JsonElement visitWhileStatement(WhileStatement node)
	{
		JsonObject json = start(node);
		json.add("test", convert(node.getTest()));
		json.add("body", convertAll(node.getBody()));
		return json;
	}
}
