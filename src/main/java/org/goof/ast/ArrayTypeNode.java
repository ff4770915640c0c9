package org.goof.ast;

public class ArrayTypeNode extends TypeNode
{
	private final TypeNode elementType;

	public ArrayTypeNode(TypeNode elementType)
	{
		this.elementType = elementType;
	}

	public TypeNode getElementType()
	{
		return elementType;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitArrayType(this);
	}
}
