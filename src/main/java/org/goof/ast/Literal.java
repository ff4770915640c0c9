package org.goof.ast;

/**
 * A literal value. {@code kind} is the name of the literal's type as the
 * language spells it ({@code whole_number}, {@code array_of_chars}, ...).
 * String values are stored without their surrounding quotes.
 */
public class Literal extends Expression
{
	public static final String STRING = "array_of_chars";
	public static final String WHOLE_NUMBER = "whole_number";
	public static final String NOT_WHOLE_NUMBER = "not_whole_number";
	public static final String TRUE_OR_FALSE = "true_or_false";
	public static final String NULL = "temp";

	private final String kind;
	private final String value;

	public Literal(String kind, String value)
	{
		this.kind = kind;
		this.value = value;
	}

	public String getKind()
	{
		return kind;
	}

	public String getValue()
	{
		return value;
	}

	@Override
	public String describe()
	{
		return "literal " + value;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitLiteral(this);
	}
}
