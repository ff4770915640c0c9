package org.goof.ast;

import java.util.List;

/**
 * {@code if t1 then c1 else if t2 then c2 ... else alternate}. The parser
 * flattens {@code else if} chains so that {@code tests.get(i)} guards
 * {@code consequents.get(i)}.
 */
public class GifStatement extends Statement
{
	private final List<Expression> tests;
	private final List<List<Node>> consequents;
	private final List<Node> alternate;

	public GifStatement(List<Expression> tests, List<List<Node>> consequents, List<Node> alternate)
	{
		if (tests.size() != consequents.size())
		{
			throw new IllegalArgumentException("Every test needs exactly one consequent");
		}
		this.tests = List.copyOf(tests);
		this.consequents = consequents.stream().map(List::copyOf).toList();
		this.alternate = alternate == null ? null : List.copyOf(alternate);
	}

	public List<Expression> getTests()
	{
		return tests;
	}

	public List<List<Node>> getConsequents()
	{
		return consequents;
	}

	/**
	 * @return the else branch, or null when absent.
	 */
	public List<Node> getAlternate()
	{
		return alternate;
	}

	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitGifStatement(this);
	}
}
