package org.goof.ast;

/**
 * {@code var name : type := initializer} or its {@code const} form.
 * <p>
 * Loop induction variables are marked read-only by the analyzer once the
 * loop header has been checked.
 */
public class VariableDeclaration extends Statement implements Declaration
{
	private final String name;
	private final TypeNode typeNode;
	private final Expression initializer;
	private final boolean constant;
	private boolean readOnly;

	public VariableDeclaration(String name, TypeNode typeNode, Expression initializer, boolean constant)
	{
		this.name = name;
		this.typeNode = typeNode;
		this.initializer = initializer;
		this.constant = constant;
		this.readOnly = constant;
	}

	@Override
	public String getName()
	{
		return name;
	}

	public TypeNode getTypeNode()
	{
		return typeNode;
	}

	/**
	 * @return the initializer, or null for a bare declaration.
	 */
	public Expression getInitializer()
	{
		return initializer;
	}

	public boolean isConstant()
	{
		return constant;
	}

	@Override
	public boolean isReadOnly()
	{
		return readOnly;
	}

	public void markReadOnly()
	{
		this.readOnly = true;
	}

	@Override
	public String describe()
	{
		return "variable '" + name + "'";
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitVariableDeclaration(this);
	}
}
