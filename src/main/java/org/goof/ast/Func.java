package org.goof.ast;

import java.util.List;

/**
 * {@code function name(params) [: type] { body }}
 */
public class Func extends FunctionDeclaration
{
	public Func(String name, List<Parameter> parameters, TypeNode returnTypeNode, List<Node> body)
	{
		super(name, parameters, returnTypeNode, body);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitFunc(this);
	}
}
