package org.goof.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.goof.ast.Program;
import org.goof.util.Debug;
import org.goof.util.SyntaxErrorListener;

/**
 * Turns goof3 source text into a {@link Program}.
 */
public final class SourceParser
{
	private SourceParser()
	{
	}

	public static Program parse(String source)
	{
		return parse(CharStreams.fromString(source));
	}

	/**
	 * @throws SyntaxException for the first syntax error, after all of them have been logged.
	 */
	public static Program parse(CharStream input)
	{
		SyntaxErrorListener listener = new SyntaxErrorListener();

		GoofLexer lexer = new GoofLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(listener);

		GoofParser parser = new GoofParser(new CommonTokenStream(lexer));
		// Remove default error listeners to use our own
		parser.removeErrorListeners();
		parser.addErrorListener(listener);

		GoofParser.ProgramContext tree = parser.program();
		if (listener.hasErrors())
		{
			throw listener.getErrors().get(0);
		}

		Program program = new AstBuilder().buildProgram(tree);
		Debug.logDebug("Parsed " + program.getStatements().size() + " top-level statement(s) from " + input.getSourceName());
		return program;
	}
}
