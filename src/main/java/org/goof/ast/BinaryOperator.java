package org.goof.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * goof3 binary operators, grouped by the operand rule the analyzer applies.
 */
public enum BinaryOperator
{
	ADD("+", Category.ARITHMETIC, "+"),
	SUBTRACT("-", Category.ARITHMETIC, "-"),
	MULTIPLY("*", Category.ARITHMETIC, "*"),
	DIVIDE("/", Category.ARITHMETIC, "/"),

	LESS("<", Category.RELATIONAL, "<"),
	GREATER(">", Category.RELATIONAL, ">"),
	LESS_OR_EQUAL("<=", Category.RELATIONAL, "<="),
	GREATER_OR_EQUAL(">=", Category.RELATIONAL, ">="),

	EQUAL("=", Category.EQUALITY, "==="),
	NOT_EQUAL("<>", Category.EQUALITY, "!=="),

	AND("&", Category.LOGICAL, "&&"),
	OR("|", Category.LOGICAL, "||"),
	SHORT_AND("&&", Category.LOGICAL, "&&"),
	SHORT_OR("||", Category.LOGICAL, "||");

	public enum Category
	{
		ARITHMETIC,
		RELATIONAL,
		LOGICAL,
		EQUALITY
	}

	private static final Map<String, BinaryOperator> BY_SYMBOL = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(BinaryOperator::getSymbol, Function.identity()));

	private final String symbol;
	private final Category category;
	private final String javaScript;

	BinaryOperator(String symbol, Category category, String javaScript)
	{
		this.symbol = symbol;
		this.category = category;
		this.javaScript = javaScript;
	}

	public static BinaryOperator fromSymbol(String symbol)
	{
		BinaryOperator op = BY_SYMBOL.get(symbol);
		if (op == null)
		{
			throw new IllegalArgumentException("Unknown operator: " + symbol);
		}
		return op;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public Category getCategory()
	{
		return category;
	}

	public String getJavaScript()
	{
		return javaScript;
	}
}
