package org.goof.semantic;

import org.goof.ast.Program;

/**
 * Rewrites an analyzed tree before code generation. The result must still be
 * fully analyzed, since the generator reads resolved types and references.
 */
@FunctionalInterface
public interface Optimizer
{
	/**
	 * Leaves the tree as it is.
	 */
	Optimizer NONE = program -> program;

	Program optimize(Program analyzed);
}
