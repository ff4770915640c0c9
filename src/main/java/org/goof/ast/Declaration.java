package org.goof.ast;

import org.goof.semantic.type.Type;

/**
 * Anything a name can be bound to in a {@link org.goof.semantic.Context}.
 */
public interface Declaration
{
	String getName();

	Type getType();

	default boolean isReadOnly()
	{
		return false;
	}
}
