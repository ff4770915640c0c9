package org.goof.ast;

public class BinaryExpression extends Expression
{
	private final BinaryOperator op;
	private final Expression left;
	private final Expression right;

	public BinaryExpression(BinaryOperator op, Expression left, Expression right)
	{
		this.op = op;
		this.left = left;
		this.right = right;
	}

	public BinaryOperator getOp()
	{
		return op;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public String describe()
	{
		return "BinaryExpression '" + op.getSymbol() + "'";
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}
}
