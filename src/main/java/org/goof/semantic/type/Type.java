// File: src/main/java/org/goof/semantic/type/Type.java
package org.goof.semantic.type;

/**
 * A goof3 type. Types compare by tag: primitives are singletons, arrays compare
 * by element type and all record types share one tag.
 */
public interface Type
{
	String getName();

	boolean isAssignableTo(Type other);

	default boolean isNumeric()
	{
		return false;
	}

	default boolean isInteger()
	{
		return false;
	}

	default boolean isBoolean()
	{
		return false;
	}

	default boolean isString()
	{
		return false;
	}

	default boolean isArray()
	{
		return false;
	}

	default boolean isRecord()
	{
		return false;
	}

	/**
	 * Result type of an arithmetic operator: float if either side is float.
	 */
	static Type getWiderType(Type a, Type b)
	{
		return PrimitiveType.getWiderType(a, b);
	}
}
