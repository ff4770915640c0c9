package org.goof.ast;

/**
 * A type as written in the source, e.g. {@code array of whole_number}.
 * The analyzer resolves it to a {@link org.goof.semantic.type.Type}.
 */
public abstract class TypeNode extends Node
{
}
