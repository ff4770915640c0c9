package org.goof.codegen;

import org.goof.ast.Literal;
import org.goof.ast.PrimitiveTypeNode;
import org.goof.ast.VariableDeclaration;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JavaScriptNamesTest
{
	private static VariableDeclaration variable(String name)
	{
		return new VariableDeclaration(name, new PrimitiveTypeNode("whole_number"), new Literal(Literal.WHOLE_NUMBER, "0"), false);
	}

	@Test
	void firstSightAssignsTheNextNumber()
	{
		JavaScriptNames names = new JavaScriptNames();

		assertEquals("x_1", names.nameOf(variable("x")));
		assertEquals("y_2", names.nameOf(variable("y")));
		assertEquals(2, names.size());
	}

	@Test
	void sameDeclarationKeepsItsName()
	{
		JavaScriptNames names = new JavaScriptNames();
		VariableDeclaration x = variable("x");

		assertEquals(names.nameOf(x), names.nameOf(x));
		assertEquals(1, names.size());
	}

	@Test
	void equalNamesDoNotCollide()
	{
		JavaScriptNames names = new JavaScriptNames();

		assertNotEquals(names.nameOf(variable("f")), names.nameOf(variable("f")));
	}

	@Test
	void eachRunStartsOver()
	{
		VariableDeclaration x = variable("x");
		new JavaScriptNames().nameOf(variable("other"));

		assertEquals("x_1", new JavaScriptNames().nameOf(x));
	}
}
