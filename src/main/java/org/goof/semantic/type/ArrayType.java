// File: src/main/java/org/goof/semantic/type/ArrayType.java
package org.goof.semantic.type;

import java.util.Objects;

/**
 * {@code array of T}. The length belongs to the array value, not its type.
 */
public class ArrayType implements Type
{
	private final Type elementType;

	public ArrayType(Type elementType)
	{
		this.elementType = Objects.requireNonNull(elementType, "elementType");
	}

	public Type getElementType()
	{
		return elementType;
	}

	@Override
	public String getName()
	{
		return "array of " + elementType.getName();
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		// Invariant: array of T only goes into array of T.
		return this.equals(other);
	}

	@Override
	public boolean isArray()
	{
		return true;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		ArrayType arrayType = (ArrayType) o;
		return Objects.equals(elementType, arrayType.elementType);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(elementType);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
