package org.goof.ast;

import org.goof.semantic.Context;

import java.util.List;

/**
 * A record literal. Its member scope is kept after analysis so member
 * accesses can resolve field names against it.
 */
public class ObjectExp extends Expression
{
	private final List<Field> properties;
	private Context objContext;

	public ObjectExp(List<Field> properties)
	{
		this.properties = List.copyOf(properties);
	}

	public List<Field> getProperties()
	{
		return properties;
	}

	public Context getObjContext()
	{
		return objContext;
	}

	public void setObjContext(Context objContext)
	{
		this.objContext = objContext;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitObjectExp(this);
	}
}
