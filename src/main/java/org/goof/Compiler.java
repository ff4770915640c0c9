package org.goof;

import org.goof.ast.Program;
import org.goof.codegen.CodeGenerator;
import org.goof.parser.SourceParser;
import org.goof.semantic.Analyzer;
import org.goof.semantic.Optimizer;
import org.goof.util.AstJsonConverter;
import org.goof.util.Debug;

/**
 * The goof3 pipeline: parse, analyze, optionally optimize, generate.
 */
public class Compiler
{
	private final Optimizer optimizer;

	public Compiler()
	{
		this(Optimizer.NONE);
	}

	public Compiler(Optimizer optimizer)
	{
		this.optimizer = optimizer;
	}

	/**
	 * Compiles source text to JavaScript, or to a JSON dump of the tree when the
	 * options ask to stop early.
	 *
	 * @throws org.goof.parser.SyntaxException   if the source does not parse
	 * @throws org.goof.semantic.SemanticException if the program breaks a semantic rule
	 */
	public String compile(String sourceCode, CompileOptions options)
	{
		Program program = SourceParser.parse(sourceCode);
		if (options.astOnly())
		{
			return AstJsonConverter.toJson(program);
		}

		Program analyzed = analyze(program, options);
		if (options.frontEndOnly())
		{
			return AstJsonConverter.toJson(analyzed);
		}

		Debug.logDebug("Semantic analysis passed. Generating JavaScript...");
		return new CodeGenerator(analyzed).generate();
	}

	/**
	 * Parses and analyzes without generating anything.
	 */
	public Program check(String sourceCode, CompileOptions options)
	{
		return analyze(SourceParser.parse(sourceCode), options);
	}

	private Program analyze(Program program, CompileOptions options)
	{
		new Analyzer(options.strictReturns()).analyze(program);
		if (options.shouldOptimize())
		{
			Debug.logDebug("Optimizing...");
			return optimizer.optimize(program);
		}
		return program;
	}
}
