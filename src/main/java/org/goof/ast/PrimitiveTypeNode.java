package org.goof.ast;

/**
 * A type named by keyword, such as {@code whole_number} or {@code true_or_false}.
 */
public class PrimitiveTypeNode extends TypeNode
{
	private final String name;

	public PrimitiveTypeNode(String name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public String describe()
	{
		return "type '" + name + "'";
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitPrimitiveType(this);
	}
}
