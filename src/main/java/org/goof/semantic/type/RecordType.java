// File: src/main/java/org/goof/semantic/type/RecordType.java
package org.goof.semantic.type;

import org.goof.ast.Field;
import org.goof.semantic.Context;

import java.util.List;

/**
 * The type of {@code object} values.
 * <p>
 * Records are compared by tag only, so every record type equals every other.
 * A record type produced by an object literal also carries that literal's
 * fields and member scope; the bare {@code object} annotation carries neither.
 */
public class RecordType implements Type
{
	public static final RecordType OBJECT = new RecordType(List.of(), null);

	private final List<Field> fields;
	private final Context members;

	public RecordType(List<Field> fields, Context members)
	{
		this.fields = List.copyOf(fields);
		this.members = members;
	}

	/**
	 * @return the scope holding the record's fields, or null when the shape
	 * of the record is not known statically.
	 */
	public Context getMembers()
	{
		return members;
	}

	public boolean hasMembers()
	{
		return members != null;
	}

	@Override
	public String getName()
	{
		return "object";
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		return other.isRecord();
	}

	@Override
	public boolean isRecord()
	{
		return true;
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof RecordType;
	}

	@Override
	public int hashCode()
	{
		return RecordType.class.hashCode();
	}

	@Override
	public String toString()
	{
		String names = String.join(", ", fields.stream().map(Field::getName).toList());
		return fields.isEmpty() ? "object" : "object {" + names + "}";
	}
}
