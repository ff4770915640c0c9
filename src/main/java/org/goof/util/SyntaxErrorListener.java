package org.goof.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.goof.parser.SyntaxException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A custom error listener for the ANTLR lexer and parser that routes syntax
 * errors through the Debug.logError system and remembers them.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final List<SyntaxException> errors = new ArrayList<>();

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		SyntaxException error = new SyntaxException(line, charPositionInLine + 1, msg);
		Debug.logError("[Syntax Error] " + error.getMessage());
		errors.add(error);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public List<SyntaxException> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}
}
