package org.goof.ast;

import java.util.List;

/**
 * {@code array of T[size] of value}: a fixed-size array filled with one value.
 */
public class ArrayExpression extends Expression
{
	private final ArrayTypeNode arrayType;
	private final Expression size;
	private final List<Expression> elements;

	public ArrayExpression(ArrayTypeNode arrayType, Expression size, List<Expression> elements)
	{
		this.arrayType = arrayType;
		this.size = size;
		this.elements = List.copyOf(elements);
	}

	public ArrayTypeNode getArrayType()
	{
		return arrayType;
	}

	public Expression getSize()
	{
		return size;
	}

	public List<Expression> getElements()
	{
		return elements;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitArrayExpression(this);
	}
}
