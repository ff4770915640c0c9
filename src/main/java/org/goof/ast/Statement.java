package org.goof.ast;

/**
 * A node executed for its effect.
 */
public abstract class Statement extends Node
{
}
