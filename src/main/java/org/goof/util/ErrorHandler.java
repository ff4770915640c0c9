// File: src/main/java/org/goof/util/ErrorHandler.java
package org.goof.util;

import org.goof.parser.SyntaxException;
import org.goof.semantic.SemanticException;

/**
 * Reports the diagnostic that stopped a compilation.
 */
public class ErrorHandler
{
	private boolean hasErrors = false;

	public void logError(SemanticException e)
	{
		String err = String.format("[Semantic Error] %s - %s", e.getKind(), e.getMessage());
		Debug.logError(err);
		hasErrors = true;
	}

	public void logError(SyntaxException e)
	{
		Debug.logError("Compilation failed due to syntax errors: " + e.getMessage());
		hasErrors = true;
	}

	public boolean hasErrors()
	{
		return hasErrors;
	}
}
