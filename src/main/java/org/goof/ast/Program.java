package org.goof.ast;

import org.goof.semantic.Context;

import java.util.List;

/**
 * Root of a compilation unit: the top-level statement list.
 */
public class Program extends Node
{
	private final List<Node> statements;
	private Context context;

	public Program(List<Node> statements)
	{
		this.statements = List.copyOf(statements);
	}

	public List<Node> getStatements()
	{
		return statements;
	}

	/**
	 * @return the global scope the program was analyzed in, or null before analysis.
	 */
	public Context getContext()
	{
		return context;
	}

	public void setContext(Context context)
	{
		this.context = context;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}
}
