// File: src/main/java/org/goof/semantic/Check.java
package org.goof.semantic;

import org.goof.ast.AssignmentStatement;
import org.goof.ast.Callable;
import org.goof.ast.Declaration;
import org.goof.ast.Expression;
import org.goof.ast.IdExp;
import org.goof.ast.Node;
import org.goof.ast.Parameter;
import org.goof.semantic.type.PrimitiveType;
import org.goof.semantic.type.Type;

import java.util.List;
import java.util.Set;

/**
 * The semantic rules of goof3. Each check returns quietly or throws a
 * {@link SemanticException} naming the rule and the offending types.
 */
public final class Check
{
	private Check()
	{
	}

	private static void doCheck(boolean condition, ErrorKind kind, String message)
	{
		if (!condition)
		{
			throw new SemanticException(kind, message);
		}
	}

	public static void isArray(Node expression)
	{
		doCheck(expression.getType().isArray(), ErrorKind.TYPE_MISMATCH,
				"Not an array: " + describe(expression));
	}

	public static void isArrayType(Type type)
	{
		doCheck(type.isArray(), ErrorKind.TYPE_MISMATCH, "Not an array type: " + type.getName());
	}

	public static void isInteger(Node expression)
	{
		doCheck(expression.getType().isInteger(), ErrorKind.TYPE_MISMATCH,
				"Not an integer: " + describe(expression));
	}

	public static void isNumber(Node expression)
	{
		doCheck(expression.getType().isNumeric(), ErrorKind.TYPE_MISMATCH,
				"Not a number: " + describe(expression));
	}

	public static void isString(Node expression)
	{
		doCheck(expression.getType().isString(), ErrorKind.TYPE_MISMATCH,
				"Not a string: " + describe(expression));
	}

	public static void isIntegerOrString(Node expression)
	{
		Type type = expression.getType();
		doCheck(type.isInteger() || type.isString(), ErrorKind.TYPE_MISMATCH,
				"Not an integer or string: " + describe(expression));
	}

	public static void isBoolean(Node expression)
	{
		doCheck(expression.getType().isBoolean(), ErrorKind.TYPE_MISMATCH,
				"Not a boolean: " + describe(expression));
	}

	public static void isFunction(Declaration value)
	{
		doCheck(value instanceof Callable, ErrorKind.NON_FUNCTION_CALL,
				"Not a function: " + value.getName());
	}

	public static void isAssignment(Node statement)
	{
		doCheck(statement instanceof AssignmentStatement, ErrorKind.TYPE_MISMATCH,
				"Not an assignment: " + statement.describe());
	}

	public static void expressionsHaveTheSameType(Node e1, Node e2)
	{
		doCheck(e1.getType() != PrimitiveType.VOID, ErrorKind.TYPE_MISMATCH,
				"No value to compare: " + describe(e1));
		doCheck(e1.getType().equals(e2.getType()), ErrorKind.TYPE_MISMATCH,
				"Types must match exactly: " + e1.getType().getName() + " and " + e2.getType().getName());
	}

	/**
	 * Can a value of the expression's type be stored in a location of the given type?
	 * Yes when the types are equal, or when null goes into a record.
	 */
	public static void isAssignableTo(Node expression, Type type)
	{
		Type source = expression.getType();
		doCheck(source.isAssignableTo(type), ErrorKind.ASSIGNABILITY,
				"Expression of type " + source.getName() + " not compatible with type " + type.getName());
	}

	public static void isNotReadOnly(Expression lvalue)
	{
		if (lvalue instanceof IdExp id)
		{
			doCheck(!id.getReference().isReadOnly(), ErrorKind.READ_ONLY_ASSIGNMENT,
					"Assignment to read-only variable " + id.getName());
		}
	}

	public static void fieldHasNotBeenUsed(String field, Set<String> usedFields)
	{
		doCheck(!usedFields.contains(field), ErrorKind.DUPLICATE_FIELD, "Field " + field + " already declared");
	}

	/**
	 * Same number of arguments and parameters, and every argument assignable
	 * to its parameter.
	 */
	public static void legalArguments(List<? extends Node> args, List<Parameter> params)
	{
		doCheck(args.size() == params.size(), ErrorKind.ARITY_MISMATCH,
				"Expected " + params.size() + " args in call, got " + args.size());
		for (int i = 0; i < args.size(); i++)
		{
			isAssignableTo(args.get(i), params.get(i).getType());
		}
	}

	private static String describe(Node expression)
	{
		return expression.describe() + " of type " + expression.getType().getName();
	}
}
