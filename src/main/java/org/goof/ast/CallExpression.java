package org.goof.ast;

import java.util.List;

public class CallExpression extends Expression
{
	private final String calleeName;
	private final List<Expression> args;
	private Callable callee;

	public CallExpression(String calleeName, List<Expression> args)
	{
		this.calleeName = calleeName;
		this.args = List.copyOf(args);
	}

	public String getCalleeName()
	{
		return calleeName;
	}

	public List<Expression> getArgs()
	{
		return args;
	}

	public Callable getCallee()
	{
		if (callee == null)
		{
			throw new IllegalStateException("Call to '" + calleeName + "' has not been resolved");
		}
		return callee;
	}

	public void setCallee(Callable callee)
	{
		if (this.callee != null)
		{
			throw new IllegalStateException("Call to '" + calleeName + "' is already resolved");
		}
		this.callee = callee;
	}

	@Override
	public String describe()
	{
		return "call to '" + calleeName + "'";
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}
}
