package org.goof.ast;

/**
 * A node that produces a value.
 */
public abstract class Expression extends Node
{
}
