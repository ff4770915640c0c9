package org.goof.parser;

/**
 * The source text is not a well-formed goof3 program.
 */
public class SyntaxException extends RuntimeException
{
	private static final long serialVersionUID = 1L;

	private final int line;
	private final int column;

	public SyntaxException(int line, int column, String message)
	{
		super(String.format("line %d:%d - %s", line, column, message));
		this.line = line;
		this.column = column;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}
}
