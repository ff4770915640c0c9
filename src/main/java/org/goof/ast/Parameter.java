package org.goof.ast;

public class Parameter extends Node implements Declaration
{
	private final String name;
	private final TypeNode typeNode;

	public Parameter(String name, TypeNode typeNode)
	{
		this.name = name;
		this.typeNode = typeNode;
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

	@Override
	public String describe()
	{
		return "parameter '" + name + "'";
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitParameter(this);
	}
}
