// File: src/main/java/org/goof/parser/AstBuilder.java
package org.goof.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.goof.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the goof3 AST from an ANTLR parse tree. Purely structural: names are
 * not resolved and no types are checked here.
 */
public class AstBuilder extends GoofBaseVisitor<Node>
{
	public Program buildProgram(GoofParser.ProgramContext ctx)
	{
		return (Program) visit(ctx);
	}

	private static SyntaxException error(ParserRuleContext ctx, String message)
	{
		Token start = ctx.getStart();
		return new SyntaxException(start.getLine(), start.getCharPositionInLine() + 1, message);
	}

	private Expression expression(ParserRuleContext ctx)
	{
		return (Expression) visit(ctx);
	}

	private TypeNode type(GoofParser.TypeContext ctx)
	{
		return (TypeNode) visit(ctx);
	}

	private List<Node> statements(List<GoofParser.StatementContext> contexts)
	{
		List<Node> statements = new ArrayList<>();
		for (GoofParser.StatementContext statement : contexts)
		{
			statements.add(visit(statement));
		}
		return statements;
	}

	private List<Node> body(GoofParser.BodyContext ctx)
	{
		if (ctx.block() != null)
		{
			return statements(ctx.block().statement());
		}
		return List.of(visit(ctx.statement()));
	}

	private List<Parameter> parameters(GoofParser.ParameterListContext ctx)
	{
		List<Parameter> parameters = new ArrayList<>();
		if (ctx != null)
		{
			for (GoofParser.ParameterContext parameter : ctx.parameter())
			{
				parameters.add(new Parameter(parameter.ID().getText(), type(parameter.type())));
			}
		}
		return parameters;
	}

	// --- Statements ---

	@Override
	public Node visitProgram(GoofParser.ProgramContext ctx)
	{
		return new Program(statements(ctx.statement()));
	}

	@Override
	public Node visitStatement(GoofParser.StatementContext ctx)
	{
		return visit(ctx.simpleStatement());
	}

	@Override
	public Node visitSimpleStatement(GoofParser.SimpleStatementContext ctx)
	{
		return visit(ctx.getChild(0));
	}

	@Override
	public Node visitVariableDeclaration(GoofParser.VariableDeclarationContext ctx)
	{
		String name = ctx.ID().getText();
		boolean constant = ctx.CONST_KW() != null;
		Expression initializer = ctx.initializer == null ? null : expression(ctx.initializer);

		if (ctx.size == null)
		{
			if (constant && initializer == null)
			{
				throw error(ctx, "Constant " + name + " needs an initial value");
			}
			return new VariableDeclaration(name, type(ctx.type()), initializer, constant);
		}

		// var a : array of T[n] := v  declares an array of n copies of v
		if (!(ctx.type() instanceof GoofParser.ArrayTypeContext))
		{
			throw error(ctx.type(), "Only array declarations take a size");
		}
		List<Expression> elements = initializer == null ? List.of() : List.of(initializer);
		ArrayExpression array = new ArrayExpression((ArrayTypeNode) type(ctx.type()), expression(ctx.size), elements);
		return new VariableDeclaration(name, type(ctx.type()), array, constant);
	}

	@Override
	public Node visitFunctionDeclaration(GoofParser.FunctionDeclarationContext ctx)
	{
		TypeNode returnType = ctx.type() == null ? null : type(ctx.type());
		return new Func(ctx.ID().getText(), parameters(ctx.parameterList()), returnType, statements(ctx.block().statement()));
	}

	@Override
	public Node visitMethodDeclaration(GoofParser.MethodDeclarationContext ctx)
	{
		return new Method(ctx.ID().getText(), parameters(ctx.parameterList()), type(ctx.type()), statements(ctx.block().statement()));
	}

	@Override
	public Node visitIfStatement(GoofParser.IfStatementContext ctx)
	{
		List<Expression> tests = new ArrayList<>();
		List<List<Node>> consequents = new ArrayList<>();
		tests.add(expression(ctx.expression()));
		consequents.add(body(ctx.body(0)));

		if (ctx.ELSE_KW() == null)
		{
			return new GifStatement(tests, consequents, null);
		}

		List<Node> alternate = body(ctx.body(1));
		boolean elseIf = ctx.body(1).block() == null && alternate.get(0) instanceof GifStatement;
		if (!elseIf)
		{
			return new GifStatement(tests, consequents, alternate);
		}

		// Flatten "else if" into one chain of tests.
		GifStatement nested = (GifStatement) alternate.get(0);
		tests.addAll(nested.getTests());
		consequents.addAll(nested.getConsequents());
		return new GifStatement(tests, consequents, nested.getAlternate());
	}

	@Override
	public Node visitWhileStatement(GoofParser.WhileStatementContext ctx)
	{
		return new WhileStatement(expression(ctx.expression()), body(ctx.body()));
	}

	@Override
	public Node visitForStatement(GoofParser.ForStatementContext ctx)
	{
		List<Node> assignments = new ArrayList<>();
		for (GoofParser.ForInitContext init : ctx.forInit())
		{
			assignments.add(visit(init.getChild(0)));
		}
		return new ForStatement(assignments, expression(ctx.expression()), visit(ctx.assignment()), body(ctx.body()));
	}

	@Override
	public Node visitReturnStatement(GoofParser.ReturnStatementContext ctx)
	{
		return new ReturnStatement(expression(ctx.expression()));
	}

	@Override
	public Node visitThrowStatement(GoofParser.ThrowStatementContext ctx)
	{
		return new ThrowStatement(expression(ctx.expression()));
	}

	@Override
	public Node visitAssignment(GoofParser.AssignmentContext ctx)
	{
		Expression target = expression(ctx.postfixExpression());
		if (!(target instanceof IdExp) && !(target instanceof MemberExpression))
		{
			throw error(ctx.postfixExpression(), "Cannot assign to " + ctx.postfixExpression().getText());
		}
		return new AssignmentStatement(target, expression(ctx.expression()));
	}

	// --- Types ---

	@Override
	public Node visitArrayType(GoofParser.ArrayTypeContext ctx)
	{
		return new ArrayTypeNode(type(ctx.type()));
	}

	@Override
	public Node visitRecordType(GoofParser.RecordTypeContext ctx)
	{
		return new RecordTypeNode();
	}

	@Override
	public Node visitPrimitiveType(GoofParser.PrimitiveTypeContext ctx)
	{
		return new PrimitiveTypeNode(ctx.ID().getText());
	}

	// --- Expressions ---

	@Override
	public Node visitPostfixExpr(GoofParser.PostfixExprContext ctx)
	{
		return visit(ctx.postfixExpression());
	}

	@Override
	public Node visitBinaryExpr(GoofParser.BinaryExprContext ctx)
	{
		BinaryOperator op = BinaryOperator.fromSymbol(ctx.op.getText());
		return new BinaryExpression(op, expression(ctx.expression(0)), expression(ctx.expression(1)));
	}

	@Override
	public Node visitPostfixExpression(GoofParser.PostfixExpressionContext ctx)
	{
		Expression result = expression(ctx.primary());
		for (GoofParser.PostfixOpContext op : ctx.postfixOp())
		{
			if (op instanceof GoofParser.FieldAccessContext field)
			{
				result = new MemberExpression(result, new IdExp(field.ID().getText()), false);
			}
			else
			{
				GoofParser.IndexAccessContext index = (GoofParser.IndexAccessContext) op;
				result = new MemberExpression(result, expression(index.expression()), true);
			}
		}
		return result;
	}

	@Override
	public Node visitLiteralPrimary(GoofParser.LiteralPrimaryContext ctx)
	{
		return visit(ctx.literal());
	}

	@Override
	public Node visitCallPrimary(GoofParser.CallPrimaryContext ctx)
	{
		List<Expression> args = new ArrayList<>();
		if (ctx.argumentList() != null)
		{
			ctx.argumentList().expression().forEach(arg -> args.add(expression(arg)));
		}
		return new CallExpression(ctx.ID().getText(), args);
	}

	@Override
	public Node visitIdPrimary(GoofParser.IdPrimaryContext ctx)
	{
		return new IdExp(ctx.ID().getText());
	}

	@Override
	public Node visitParenPrimary(GoofParser.ParenPrimaryContext ctx)
	{
		return visit(ctx.expression());
	}

	@Override
	public Node visitObjectPrimary(GoofParser.ObjectPrimaryContext ctx)
	{
		List<Field> fields = new ArrayList<>();
		for (GoofParser.FieldContext field : ctx.field())
		{
			fields.add(new Field(field.ID().getText(), type(field.type()), expression(field.expression())));
		}
		return new ObjectExp(fields);
	}

	@Override
	public Node visitArrayPrimary(GoofParser.ArrayPrimaryContext ctx)
	{
		ArrayTypeNode arrayType = new ArrayTypeNode(type(ctx.type()));
		return new ArrayExpression(arrayType, expression(ctx.expression(0)), List.of(expression(ctx.expression(1))));
	}

	@Override
	public Node visitLiteral(GoofParser.LiteralContext ctx)
	{
		String text = ctx.getText();
		if (ctx.INT_LITERAL() != null)
		{
			return new Literal(Literal.WHOLE_NUMBER, text);
		}
		if (ctx.FLOAT_LITERAL() != null)
		{
			return new Literal(Literal.NOT_WHOLE_NUMBER, text);
		}
		if (ctx.STRING_LITERAL() != null)
		{
			return new Literal(Literal.STRING, text.substring(1, text.length() - 1));
		}
		if (ctx.NULL_KW() != null)
		{
			return new Literal(Literal.NULL, text);
		}
		return new Literal(Literal.TRUE_OR_FALSE, text);
	}
}
