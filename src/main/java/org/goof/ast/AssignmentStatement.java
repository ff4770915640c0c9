package org.goof.ast;

public class AssignmentStatement extends Statement
{
	private final Expression target;
	private final Expression source;

	public AssignmentStatement(Expression target, Expression source)
	{
		this.target = target;
		this.source = source;
	}

	public Expression getTarget()
	{
		return target;
	}

	public Expression getSource()
	{
		return source;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitAssignmentStatement(this);
	}
}
