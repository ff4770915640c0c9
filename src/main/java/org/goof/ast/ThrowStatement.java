package org.goof.ast;

public class ThrowStatement extends Statement
{
	private final Expression error;

	public ThrowStatement(Expression error)
	{
		this.error = error;
	}

	public Expression getError()
	{
		return error;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitThrowStatement(this);
	}
}
