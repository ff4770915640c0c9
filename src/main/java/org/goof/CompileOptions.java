package org.goof;

import org.goof.util.CompilerArguments;

/**
 * What a compilation should produce.
 *
 * @param astOnly        stop after parsing and return the AST as JSON
 * @param frontEndOnly   stop after analysis and return the decorated AST as JSON
 * @param shouldOptimize run the optimizer between analysis and generation
 * @param strictReturns  check returned values against declared results
 */
public record CompileOptions(boolean astOnly, boolean frontEndOnly, boolean shouldOptimize, boolean strictReturns)
{
	public static final CompileOptions DEFAULT = new CompileOptions(false, false, false, false);

	public static CompileOptions from(CompilerArguments arguments)
	{
		return new CompileOptions(arguments.isAstOnly(), arguments.isDecoratedAst(), arguments.isOptimize(), arguments.isStrictReturns());
	}
}
