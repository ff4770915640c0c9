// File: src/main/java/org/goof/semantic/type/PrimitiveType.java
package org.goof.semantic.type;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class PrimitiveType implements Type
{
	// --- Canonical Type Instances ---
	public static final PrimitiveType INT = new PrimitiveType("whole_number");
	public static final PrimitiveType FLOAT = new PrimitiveType("not_whole_number");
	public static final PrimitiveType STRING = new PrimitiveType("array_of_chars");
	public static final PrimitiveType BOOL = new PrimitiveType("true_or_false");
	public static final PrimitiveType NULL = new PrimitiveType("temp");

	// Statements, and calls to functions that declare no result.
	public static final PrimitiveType VOID = new PrimitiveType("void");

	private static final Map<String, PrimitiveType> KEYWORD_TO_TYPE_MAP;

	static
	{
		Map<String, PrimitiveType> map = new HashMap<>();
		map.put(INT.name, INT);
		map.put(FLOAT.name, FLOAT);
		map.put(STRING.name, STRING);
		map.put(BOOL.name, BOOL);
		map.put(NULL.name, NULL);
		KEYWORD_TO_TYPE_MAP = Collections.unmodifiableMap(map);
	}

	private final String name;

	private PrimitiveType(String name)
	{
		this.name = name;
	}

	/**
	 * Looks up a primitive by the keyword the language uses for it.
	 * {@code void} is not spellable in source and is never returned.
	 */
	public static Optional<PrimitiveType> fromKeyword(String keyword)
	{
		return Optional.ofNullable(KEYWORD_TO_TYPE_MAP.get(keyword));
	}

	static Type getWiderType(Type a, Type b)
	{
		if (a == FLOAT || b == FLOAT)
		{
			return FLOAT;
		}
		return INT;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		if (this == NULL)
		{
			return other == NULL || other.isRecord();
		}
		return this == other;
	}

	@Override
	public boolean isNumeric()
	{
		return this == INT || this == FLOAT;
	}

	@Override
	public boolean isInteger()
	{
		return this == INT;
	}

	@Override
	public boolean isBoolean()
	{
		return this == BOOL;
	}

	@Override
	public boolean isString()
	{
		return this == STRING;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
