package org.goof.ast;

public class ReturnStatement extends Statement
{
	private final Expression returnValue;

	public ReturnStatement(Expression returnValue)
	{
		this.returnValue = returnValue;
	}

	public Expression getReturnValue()
	{
		return returnValue;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitReturnStatement(this);
	}
}
