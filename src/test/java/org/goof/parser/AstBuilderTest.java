package org.goof.parser;

import org.goof.ast.ArrayExpression;
import org.goof.ast.ArrayTypeNode;
import org.goof.ast.AssignmentStatement;
import org.goof.ast.BinaryExpression;
import org.goof.ast.BinaryOperator;
import org.goof.ast.CallExpression;
import org.goof.ast.ForStatement;
import org.goof.ast.Func;
import org.goof.ast.GifStatement;
import org.goof.ast.IdExp;
import org.goof.ast.Literal;
import org.goof.ast.MemberExpression;
import org.goof.ast.Method;
import org.goof.ast.ObjectExp;
import org.goof.ast.Program;
import org.goof.ast.RecordTypeNode;
import org.goof.ast.VariableDeclaration;
import org.goof.ast.WhileStatement;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AstBuilderTest
{
	private static VariableDeclaration declaration(String source)
	{
		Program program = SourceParser.parse(source);
		return (VariableDeclaration) program.getStatements().get(0);
	}

	@Test
	void emptyProgram()
	{
		assertTrue(SourceParser.parse("// nothing here\n/* at all */").getStatements().isEmpty());
	}

	@Test
	void semicolonsAreOptional()
	{
		assertEquals(3, SourceParser.parse("print(\"a\"); print(\"b\")\nprint(\"c\")").getStatements().size());
	}

	@Test
	void multiplicationBindsTighterThanAddition()
	{
		BinaryExpression sum = (BinaryExpression) declaration("var x : whole_number := 1 + 2 * 3").getInitializer();

		assertEquals(BinaryOperator.ADD, sum.getOp());
		assertEquals(BinaryOperator.MULTIPLY, ((BinaryExpression) sum.getRight()).getOp());
	}

	@Test
	void parenthesesOverridePrecedence()
	{
		BinaryExpression product = (BinaryExpression) declaration("var x : whole_number := (1 + 2) * 3").getInitializer();

		assertEquals(BinaryOperator.MULTIPLY, product.getOp());
		assertInstanceOf(BinaryExpression.class, product.getLeft());
	}

	@Test
	void declarationShapes()
	{
		VariableDeclaration constant = declaration("const c : true_or_false := true");
		assertTrue(constant.isConstant());
		assertTrue(constant.isReadOnly());

		VariableDeclaration record = declaration("var o : object := null");
		assertInstanceOf(RecordTypeNode.class, record.getTypeNode());
		assertEquals(Literal.NULL, ((Literal) record.getInitializer()).getKind());

		assertNull(declaration("var u : whole_number").getInitializer());
	}

	@Test
	void constantsNeedAnInitialValue()
	{
		SyntaxException e = assertThrows(SyntaxException.class, () -> SourceParser.parse("const c : whole_number"));
		assertTrue(e.getMessage().contains("Constant c needs an initial value"), e.getMessage());

		VariableDeclaration array = declaration("const a : array of whole_number[2]");
		assertInstanceOf(ArrayExpression.class, array.getInitializer());
	}

	@Test
	void sizedArrayDeclarationBuildsAnArrayExpression()
	{
		VariableDeclaration a = declaration("var a : array of whole_number[3] := 0");

		ArrayExpression array = assertInstanceOf(ArrayExpression.class, a.getInitializer());
		assertEquals("3", ((Literal) array.getSize()).getValue());
		assertEquals(1, array.getElements().size());
		assertInstanceOf(ArrayTypeNode.class, a.getTypeNode());
		assertNotSame(a.getTypeNode(), array.getArrayType());
	}

	@Test
	void onlyArraysTakeASize()
	{
		SyntaxException e = assertThrows(SyntaxException.class, () -> SourceParser.parse("var x : whole_number[3] := 0"));
		assertEquals(1, e.getLine());
	}

	@Test
	void stringLiteralsLoseTheirQuotes()
	{
		Literal literal = (Literal) declaration("var s : array_of_chars := \"hello\"").getInitializer();

		assertEquals(Literal.STRING, literal.getKind());
		assertEquals("hello", literal.getValue());
	}

	@Test
	void literalKinds()
	{
		assertEquals(Literal.WHOLE_NUMBER, ((Literal) declaration("var a : whole_number := 42").getInitializer()).getKind());
		assertEquals(Literal.NOT_WHOLE_NUMBER, ((Literal) declaration("var a : not_whole_number := 4.2").getInitializer()).getKind());
		assertEquals(Literal.TRUE_OR_FALSE, ((Literal) declaration("var a : true_or_false := false").getInitializer()).getKind());
	}

	@Test
	void elseIfChainsAreFlattened()
	{
		Program program = SourceParser.parse("if a then 1 else if b then 2 else if c then 3 else 4");

		GifStatement chain = (GifStatement) program.getStatements().get(0);
		assertEquals(3, chain.getTests().size());
		assertEquals(3, chain.getConsequents().size());
		assertEquals(1, chain.getAlternate().size());
	}

	@Test
	void elseBlockContainingIfIsNotFlattened()
	{
		Program program = SourceParser.parse("if a then 1 else { if b then 2 }");

		GifStatement outer = (GifStatement) program.getStatements().get(0);
		assertEquals(1, outer.getTests().size());
		assertInstanceOf(GifStatement.class, outer.getAlternate().get(0));
	}

	@Test
	void ifWithoutElse()
	{
		GifStatement statement = (GifStatement) SourceParser.parse("if a then print(\"x\")").getStatements().get(0);

		assertNull(statement.getAlternate());
	}

	@Test
	void postfixChains()
	{
		Program program = SourceParser.parse("x.a[1].b := 2");

		AssignmentStatement assignment = (AssignmentStatement) program.getStatements().get(0);
		MemberExpression outer = (MemberExpression) assignment.getTarget();
		assertFalse(outer.isComputed());
		assertEquals("b", ((IdExp) outer.getProperty()).getName());

		MemberExpression index = (MemberExpression) outer.getObject();
		assertTrue(index.isComputed());
		assertInstanceOf(MemberExpression.class, index.getObject());
	}

	@Test
	void onlyNamesAndMembersCanBeAssigned()
	{
		assertThrows(SyntaxException.class, () -> SourceParser.parse("f() := 1"));
		assertThrows(SyntaxException.class, () -> SourceParser.parse("1 := 1"));
	}

	@Test
	void functionsAndMethods()
	{
		Program program = SourceParser.parse("function f(a : whole_number, b : array of array_of_chars) { print(\"x\") }"
				+ " method m() : whole_number { 1 }");

		Func f = (Func) program.getStatements().get(0);
		assertEquals(2, f.getParameters().size());
		assertFalse(f.hasReturnType());
		assertInstanceOf(CallExpression.class, f.getBody().get(0));

		Method m = (Method) program.getStatements().get(1);
		assertTrue(m.hasReturnType());
		assertInstanceOf(Literal.class, m.getBody().get(0));
	}

	@Test
	void methodsMustDeclareAResult()
	{
		assertThrows(SyntaxException.class, () -> SourceParser.parse("method m() { 1 }"));
	}

	@Test
	void loops()
	{
		Program program = SourceParser.parse("for (var i : whole_number := 0, j := 1; i < 3; i := i + 1) { }"
				+ " while true do print(\"x\")");

		ForStatement loop = (ForStatement) program.getStatements().get(0);
		assertEquals(2, loop.getAssignments().size());
		assertInstanceOf(VariableDeclaration.class, loop.getAssignments().get(0));
		assertInstanceOf(AssignmentStatement.class, loop.getAssignments().get(1));
		assertInstanceOf(AssignmentStatement.class, loop.getAction());
		assertTrue(loop.getBody().isEmpty());

		WhileStatement whileLoop = (WhileStatement) program.getStatements().get(1);
		assertEquals(1, whileLoop.getBody().size());
	}

	@Test
	void forActionMustBeAnAssignment()
	{
		assertThrows(SyntaxException.class,
				() -> SourceParser.parse("for (var i : whole_number := 0; i < 3; print(\"x\")) print(\"y\")"));
	}

	@Test
	void objectLiteral()
	{
		ObjectExp object = (ObjectExp) declaration("var o : object := { a : whole_number := 1, b : object := null }").getInitializer();

		assertEquals(2, object.getProperties().size());
		assertEquals("b", object.getProperties().get(1).getName());
	}

	@Test
	void arrayLiteral()
	{
		ArrayExpression array = (ArrayExpression) declaration("var a : array of whole_number := array of whole_number[5] of 7").getInitializer();

		assertEquals("5", ((Literal) array.getSize()).getValue());
		assertEquals("7", ((Literal) array.getElements().get(0)).getValue());
	}

	@Test
	void syntaxErrorReportsItsPosition()
	{
		SyntaxException e = assertThrows(SyntaxException.class, () -> SourceParser.parse("var x : whole_number := 1\nvar y whole_number"));

		assertEquals(2, e.getLine());
		assertTrue(e.getMessage().startsWith("line 2:"));
	}

	@Test
	void lexerErrorsAreSyntaxErrors()
	{
		assertThrows(SyntaxException.class, () -> SourceParser.parse("var x : whole_number := 1 # 2"));
	}
}
