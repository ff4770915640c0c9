package org.goof.ast;

/**
 * One {@code name : type := value} entry of an object literal.
 */
public class Field extends Node implements Declaration
{
	private final String name;
	private final TypeNode typeNode;
	private final Expression value;

	public Field(String name, TypeNode typeNode, Expression value)
	{
		this.name = name;
		this.typeNode = typeNode;
		this.value = value;
	}

	@Override
	public String getName()
	{
		return name;
	}

	public TypeNode getTypeNode()
	{
		return typeNode;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public String describe()
	{
		return "field '" + name + "'";
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitField(this);
	}
}
