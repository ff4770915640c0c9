package org.goof.ast;

import java.util.List;

/**
 * {@code method name(params) : type { body }}. Unlike a {@link Func}, the
 * value of the final expression statement is the method's result.
 */
public class Method extends FunctionDeclaration
{
	public Method(String name, List<Parameter> parameters, TypeNode returnTypeNode, List<Node> body)
	{
		super(name, parameters, returnTypeNode, body);
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitMethod(this);
	}
}
