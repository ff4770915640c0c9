package org.goof.ast;

/**
 * A use of a name. The analyzer binds it to the declaration it resolves to.
 */
public class IdExp extends Expression
{
	private final String name;
	private Declaration reference;

	public IdExp(String name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	public Declaration getReference()
	{
		if (reference == null)
		{
			throw new IllegalStateException("Identifier '" + name + "' has not been resolved");
		}
		return reference;
	}

	public void setReference(Declaration reference)
	{
		if (this.reference != null)
		{
			throw new IllegalStateException("Identifier '" + name + "' is already resolved");
		}
		this.reference = reference;
	}

	public boolean isResolved()
	{
		return reference != null;
	}

	@Override
	public String describe()
	{
		return "identifier '" + name + "'";
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitIdExp(this);
	}
}
