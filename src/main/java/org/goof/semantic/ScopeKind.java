package org.goof.semantic;

public enum ScopeKind
{
	GLOBAL,
	LOOP,
	FUNCTION_BODY,
	OBJECT
}
