package org.goof.semantic;

/**
 * The rule a {@link SemanticException} reports as broken.
 */
public enum ErrorKind
{
	TYPE_MISMATCH,
	ASSIGNABILITY,
	READ_ONLY_ASSIGNMENT,
	ARITY_MISMATCH,
	NON_FUNCTION_CALL,
	DUPLICATE_FIELD,
	UNDECLARED_IDENTIFIER,
	DUPLICATE_DECLARATION,
	NON_SUBSCRIPTABLE,
	UNKNOWN_TYPE,
	RETURN_MISMATCH
}
