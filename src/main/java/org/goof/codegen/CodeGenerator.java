package org.goof.codegen;

import org.goof.ast.Program;

/**
 * Produces the JavaScript for one analyzed program. Every call to
 * {@link #generate()} numbers identifiers afresh.
 */
public class CodeGenerator
{
	private final Program program;

	public CodeGenerator(Program program)
	{
		this.program = program;
	}

	public String generate()
	{
		JavaScriptGenerator visitor = new JavaScriptGenerator(new JavaScriptNames());
		return visitor.generate(program);
	}
}
