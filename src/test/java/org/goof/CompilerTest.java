package org.goof;

import org.goof.ast.Program;
import org.goof.parser.SyntaxException;
import org.goof.semantic.ErrorKind;
import org.goof.semantic.SemanticException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CompilerTest
{
	private static final String HELLO = "function greet(name : array_of_chars) { print(name) }\n"
			+ "var names : array of array_of_chars[2] := \"goof\"\n"
			+ "for (var i : whole_number := 0; i < 2; i := i + 1) {\n"
			+ "    greet(names[i])\n"
			+ "}\n";

	@Test
	void compilesToJavaScript()
	{
		String js = new Compiler().compile(HELLO, CompileOptions.DEFAULT);

		assertTrue(js.startsWith("function print_1(s_2) {console.log(s_2);}\n"), js);
		assertTrue(js.contains("function greet_3 (name_4) {print_1(name_4);}"), js);
		assertTrue(js.contains("let names_5 = Array(2).fill(\"goof\");"), js);
		assertTrue(js.contains("for (let i_6 = 0; (i_6 < 2); i_6 = (i_6 + 1)) {greet_3(names_5[i_6]);}"), js);
	}

	@Test
	void astOnlyStopsBeforeAnalysis()
	{
		// Would fail analysis; the plain tree does not care.
		String json = new Compiler().compile("x := \"s\" + 1", new CompileOptions(true, false, false, false));

		assertTrue(json.contains("\"node\": \"AssignmentStatement\""), json);
		assertFalse(json.contains("\"type\""), json);
	}

	@Test
	void frontEndOnlyReturnsTheDecoratedTree()
	{
		String json = new Compiler().compile("var x : whole_number := 1", new CompileOptions(false, true, false, false));

		assertTrue(json.contains("\"type\": \"whole_number\""), json);
	}

	@Test
	void optimizerRunsOnlyWhenAsked()
	{
		AtomicInteger calls = new AtomicInteger();
		Compiler compiler = new Compiler(program ->
		{
			calls.incrementAndGet();
			return program;
		});

		compiler.compile("print(\"a\")", CompileOptions.DEFAULT);
		assertEquals(0, calls.get());

		String js = compiler.compile("print(\"a\")", new CompileOptions(false, false, true, false));
		assertEquals(1, calls.get());
		assertTrue(js.endsWith("print_1(\"a\");\n"), js);
	}

	@Test
	void checkReturnsTheAnalyzedProgram()
	{
		Program program = new Compiler().check("var x : whole_number := 1", CompileOptions.DEFAULT);

		assertTrue(program.isAnalyzed());
		assertTrue(program.getStatements().get(0).isAnalyzed());
	}

	@Test
	void strictReturnsComeFromTheOptions()
	{
		String source = "function f() : whole_number { return \"s\" }";
		new Compiler().compile(source, CompileOptions.DEFAULT);

		SemanticException e = assertThrows(SemanticException.class,
				() -> new Compiler().compile(source, new CompileOptions(false, false, false, true)));
		assertEquals(ErrorKind.RETURN_MISMATCH, e.getKind());
	}

	@Test
	void errorsPropagate()
	{
		assertThrows(SyntaxException.class, () -> new Compiler().compile("var := 1", CompileOptions.DEFAULT));

		SemanticException e = assertThrows(SemanticException.class,
				() -> new Compiler().compile("var x : whole_number := 3; x := 3.5", CompileOptions.DEFAULT));
		assertEquals(ErrorKind.ASSIGNABILITY, e.getKind());
	}
}
