package org.goof.ast;

import java.util.List;

/**
 * {@code for (inits; test; action) body}. Variables declared in {@code inits}
 * are the loop's induction variables.
 */
public class ForStatement extends Statement
{
	private final List<Node> assignments;
	private final Expression test;
	private final Node action;
	private final List<Node> body;

	public ForStatement(List<Node> assignments, Expression test, Node action, List<Node> body)
	{
		this.assignments = List.copyOf(assignments);
		this.test = test;
		this.action = action;
		this.body = List.copyOf(body);
	}

	public List<Node> getAssignments()
	{
		return assignments;
	}

	public Expression getTest()
	{
		return test;
	}

	public Node getAction()
	{
		return action;
	}

	public List<Node> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitForStatement(this);
	}
}
