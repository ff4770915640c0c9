package org.goof.ast;

/**
 * The {@code object} type annotation.
 */
public class RecordTypeNode extends TypeNode
{
	@Override
	public <R> R accept(AstVisitor<R> visitor)
	{
		return visitor.visitRecordType(this);
	}
}
