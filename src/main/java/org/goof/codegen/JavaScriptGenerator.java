// File: src/main/java/org/goof/codegen/JavaScriptGenerator.java
package org.goof.codegen;

import org.goof.ast.*;
import org.goof.semantic.Context;
import org.goof.semantic.type.PrimitiveType;
import org.goof.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Translates an analyzed goof3 tree to JavaScript. Each visit returns the
 * fragment for one node, built from its children's fragments.
 * <p>
 * The input must have passed the {@link org.goof.semantic.Analyzer}; reading
 * an unresolved identifier fails with {@link IllegalStateException}.
 */
public class JavaScriptGenerator implements AstVisitor<String>
{
	private final JavaScriptNames names;

	public JavaScriptGenerator(JavaScriptNames names)
	{
		this.names = names;
	}

	/**
	 * Generates the whole program, preceded by the library functions it may call.
	 */
	public String generate(Program program)
	{
		program.getType(); // fails on a tree the analyzer has not seen
		StringBuilder out = new StringBuilder();
		out.append(generateLibraryFunctions(program.getContext()));
		for (Node statement : program.getStatements())
		{
			out.append(statement.accept(this)).append(";\n");
		}
		Debug.logDebug("Generated JavaScript for " + names.size() + " declaration(s).");
		return out.toString();
	}

	private String generateLibraryFunctions(Context global)
	{
		if (global == null)
		{
			return "";
		}
		return global.resolveLocally(Context.PRINT)
				.map(print -> generateLibraryStub((Callable) print, "console.log"))
				.orElse("");
	}

	private String generateLibraryStub(Callable entity, String primitive)
	{
		String name = names.nameOf(entity);
		String params = entity.getParameters().stream().map(names::nameOf).collect(Collectors.joining(","));
		return "function " + name + "(" + params + ") {" + primitive + "(" + params + ");}\n";
	}

	private String gen(Node node)
	{
		return node.accept(this);
	}

	private String statements(List<Node> body)
	{
		StringBuilder out = new StringBuilder();
		for (Node statement : body)
		{
			out.append(gen(statement)).append(';');
		}
		return out.toString();
	}

	private String braced(List<Node> body)
	{
		return "{" + statements(body) + "}";
	}

	private String declarator(VariableDeclaration node)
	{
		String name = names.nameOf(node);
		return node.getInitializer() == null ? name : name + " = " + gen(node.getInitializer());
	}

	@Override
	public String visitProgram(Program node)
	{
		return generate(node);
	}

	// --- Types do not figure into the output ---

	@Override
	public String visitArrayType(ArrayTypeNode node)
	{
		return "";
	}

	@Override
	public String visitPrimitiveType(PrimitiveTypeNode node)
	{
		return "";
	}

	@Override
	public String visitRecordType(RecordTypeNode node)
	{
		return "";
	}

	// --- Expressions ---

	@Override
	public String visitArrayExpression(ArrayExpression node)
	{
		String array = "Array(" + gen(node.getSize()) + ")";
		if (node.getElements().isEmpty())
		{
			return array;
		}
		return array + ".fill(" + gen(node.getElements().get(0)) + ")";
	}

	@Override
	public String visitBinaryExpression(BinaryExpression node)
	{
		return "(" + gen(node.getLeft()) + " " + node.getOp().getJavaScript() + " " + gen(node.getRight()) + ")";
	}

	@Override
	public String visitCallExpression(CallExpression node)
	{
		String args = node.getArgs().stream().map(this::gen).collect(Collectors.joining(","));
		return names.nameOf(node.getCallee()) + "(" + args + ")";
	}

	@Override
	public String visitIdExp(IdExp node)
	{
		return names.nameOf(node.getReference());
	}

	@Override
	public String visitLiteral(Literal node)
	{
		switch (node.getKind())
		{
			case Literal.STRING:
				return "\"" + node.getValue() + "\"";
			case Literal.NULL:
				return "null";
			default:
				return node.getValue();
		}
	}

	@Override
	public String visitMemberExpression(MemberExpression node)
	{
		String object = gen(node.getObject());
		if (node.getObject().getType().isArray())
		{
			return object + "[" + gen(node.getProperty()) + "]";
		}
		return object + "." + gen(node.getProperty());
	}

	@Override
	public String visitObjectExp(ObjectExp node)
	{
		String properties = node.getProperties().stream().map(this::gen).collect(Collectors.joining(", "));
		return "{" + properties + "}";
	}

	@Override
	public String visitField(Field node)
	{
		return names.nameOf(node) + ": " + gen(node.getValue());
	}

	@Override
	public String visitParameter(Parameter node)
	{
		return names.nameOf(node);
	}

	// --- Declarations ---

	@Override
	public String visitVariableDeclaration(VariableDeclaration node)
	{
		return (node.isConstant() ? "const " : "let ") + declarator(node);
	}

	@Override
	public String visitFunc(Func node)
	{
		String header = functionHeader(node);
		return header + braced(node.getBody());
	}

	@Override
	public String visitMethod(Method node)
	{
		String header = functionHeader(node);
		List<Node> body = node.getBody();
		if (!node.hasReturnType() || node.getReturnType() == PrimitiveType.VOID || body.isEmpty()
				|| !(body.get(body.size() - 1) instanceof Expression result))
		{
			return header + braced(body);
		}
		// A method with a result returns its final expression.
		String leading = statements(body.subList(0, body.size() - 1));
		return header + "{" + leading + "return " + gen(result) + ";}";
	}

	// Named before the body so the function and its parameters number first.
	private String functionHeader(FunctionDeclaration node)
	{
		String name = names.nameOf(node);
		String params = node.getParameters().stream().map(this::gen).collect(Collectors.joining(","));
		return "function " + name + " (" + params + ") ";
	}

	// --- Statements ---

	@Override
	public String visitAssignmentStatement(AssignmentStatement node)
	{
		return gen(node.getTarget()) + " = " + gen(node.getSource());
	}

	@Override
	public String visitForStatement(ForStatement node)
	{
		List<String> declarations = new ArrayList<>();
		List<String> assignments = new ArrayList<>();
		for (Node init : node.getAssignments())
		{
			if (init instanceof VariableDeclaration declaration)
			{
				declarations.add(declarator(declaration));
			}
			else
			{
				assignments.add(gen(init));
			}
		}

		String header = gen(node.getTest()) + "; " + gen(node.getAction()) + ") " + braced(node.getBody());
		if (assignments.isEmpty())
		{
			return "for (let " + String.join(", ", declarations) + "; " + header;
		}
		String loop = "for (" + String.join(", ", assignments) + "; " + header;
		if (declarations.isEmpty())
		{
			return loop;
		}
		// Mixed header: declare the induction variables just outside the loop.
		return "{let " + String.join(", ", declarations) + "; " + loop + "}";
	}

	@Override
	public String visitWhileStatement(WhileStatement node)
	{
		return "while (" + gen(node.getTest()) + ") " + braced(node.getBody());
	}

	@Override
	public String visitGifStatement(GifStatement node)
	{
		StringBuilder out = new StringBuilder();
		for (int i = 0; i < node.getTests().size(); i++)
		{
			if (i > 0)
			{
				out.append(" else ");
			}
			out.append("if (").append(gen(node.getTests().get(i))).append(") ")
					.append(braced(node.getConsequents().get(i)));
		}
		if (node.getAlternate() != null)
		{
			out.append(" else ").append(braced(node.getAlternate()));
		}
		return out.toString();
	}

	@Override
	public String visitReturnStatement(ReturnStatement node)
	{
		return "return " + gen(node.getReturnValue());
	}

	@Override
	public String visitThrowStatement(ThrowStatement node)
	{
		return "throw Error(" + gen(node.getError()) + ")";
	}
}
