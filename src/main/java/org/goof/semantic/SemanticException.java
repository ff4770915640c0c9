package org.goof.semantic;

/**
 * Thrown by the first semantic rule a program breaks. Analysis does not
 * recover, so this is the only diagnostic a failed compilation produces.
 */
public class SemanticException extends RuntimeException
{
	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;

	public SemanticException(ErrorKind kind, String message)
	{
		super(message);
		this.kind = kind;
	}

	public ErrorKind getKind()
	{
		return kind;
	}
}
