package org.goof.ast;

import org.goof.semantic.type.Type;

import java.util.List;

public interface Callable extends Declaration
{
	List<Parameter> getParameters();

	/**
	 * The declared result, or {@link org.goof.semantic.type.PrimitiveType#VOID}.
	 */
	Type getReturnType();
}
