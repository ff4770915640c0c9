package org.goof.ast;

import org.goof.semantic.Context;
import org.goof.semantic.type.PrimitiveType;
import org.goof.semantic.type.Type;

import java.util.List;

/**
 * Shared shape of {@link Func} and {@link Method}.
 */
public abstract class FunctionDeclaration extends Statement implements Callable
{
	private final String name;
	private final List<Parameter> parameters;
	private final TypeNode returnTypeNode;
	private final List<Node> body;
	private Context bodyContext;

	protected FunctionDeclaration(String name, List<Parameter> parameters, TypeNode returnTypeNode, List<Node> body)
	{
		this.name = name;
		this.parameters = List.copyOf(parameters);
		this.returnTypeNode = returnTypeNode;
		this.body = List.copyOf(body);
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public List<Parameter> getParameters()
	{
		return parameters;
	}

	/**
	 * @return the declared result type as written, or null when there is none.
	 */
	public TypeNode getReturnTypeNode()
	{
		return returnTypeNode;
	}

	public List<Node> getBody()
	{
		return body;
	}

	@Override
	public Type getReturnType()
	{
		return isAnalyzed() ? getType() : PrimitiveType.VOID;
	}

	/**
	 * Function names cannot be assigned to.
	 */
	@Override
	public boolean isReadOnly()
	{
		return true;
	}

	public boolean hasReturnType()
	{
		return returnTypeNode != null;
	}

	public Context getBodyContext()
	{
		return bodyContext;
	}

	/**
	 * Set while the signature is analyzed. A non-null body context means the
	 * function has already been declared in its enclosing scope.
	 */
	public void setBodyContext(Context bodyContext)
	{
		this.bodyContext = bodyContext;
	}

	@Override
	public String describe()
	{
		return getClass().getSimpleName().toLowerCase() + " '" + name + "'";
	}
}
