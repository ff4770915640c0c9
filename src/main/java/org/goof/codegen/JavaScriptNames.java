package org.goof.codegen;

import org.goof.ast.Declaration;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Hands out JavaScript names for goof3 declarations: the source name plus a
 * suffix unique within one generator run, e.g. {@code x_3}. A declaration gets
 * its number the first time it is seen and keeps it, so every reference to it
 * renders the same way and two declarations sharing a name never collide.
 */
public class JavaScriptNames
{
	private final Map<Declaration, Integer> ids = new IdentityHashMap<>();
	private int lastId = 0;

	public String nameOf(Declaration declaration)
	{
		int id = ids.computeIfAbsent(declaration, d -> ++lastId);
		return declaration.getName() + "_" + id;
	}

	public int size()
	{
		return ids.size();
	}
}
