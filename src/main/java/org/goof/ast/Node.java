package org.goof.ast;

import org.goof.semantic.type.Type;

import java.util.Objects;

/**
 * Base of every goof3 syntax tree node.
 * <p>
 * The analyzer fills in the resolved type exactly once. Reading it before that
 * is a programming error in whichever pass asked for it, so {@link #getType()}
 * fails loudly instead of returning null.
 */
public abstract class Node
{
	private Type type;

	public abstract <R> R accept(AstVisitor<R> visitor);

	public Type getType()
	{
		if (type == null)
		{
			throw new IllegalStateException(describe() + " has not been analyzed");
		}
		return type;
	}

	public void setType(Type type)
	{
		if (this.type != null)
		{
			throw new IllegalStateException(describe() + " already has type " + this.type.getName());
		}
		this.type = Objects.requireNonNull(type, "type");
	}

	public boolean isAnalyzed()
	{
		return type != null;
	}

	/**
	 * Short human-readable label used in diagnostics.
	 */
	public String describe()
	{
		return getClass().getSimpleName();
	}
}
