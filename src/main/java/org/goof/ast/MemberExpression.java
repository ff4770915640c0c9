package org.goof.ast;

/**
 * {@code object.property} or {@code object[property]}. Arrays take an integer
 * index, records take a field name.
 */
public class MemberExpression extends Expression
{
	private final Expression object;
	private final Expression property;
	private final boolean computed;

	public MemberExpression(Expression object, Expression property, boolean computed)
	{
		this.object = object;
		this.property = property;
		this.computed = computed;
	}

	public Expression getObject()
	{
		return object;
	}

	public Expression getProperty()
	{
		return property;
	}

	/**
	 * @return true for the bracket form.
	 */
	public boolean isComputed()
	{
		return computed;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMemberExpression(this);
	}
}
