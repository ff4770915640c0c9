// File: src/main/java/org/goof/semantic/Analyzer.java
package org.goof.semantic;

import org.goof.ast.*;
import org.goof.semantic.type.ArrayType;
import org.goof.semantic.type.PrimitiveType;
import org.goof.semantic.type.RecordType;
import org.goof.semantic.type.Type;
import org.goof.util.Debug;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a goof3 tree and decorates it in place: every node gets its type,
 * every identifier and call its declaration.
 * <p>
 * Children are analyzed before their parent's rules are checked. The first
 * broken rule throws a {@link SemanticException} and ends the pass.
 */
public class Analyzer implements AstVisitor<Type>
{
	private final boolean strictReturns;
	private Context currentContext;

	public Analyzer()
	{
		this(false);
	}

	/**
	 * @param strictReturns when true, returned values must match the enclosing
	 *                      function's declared result.
	 */
	public Analyzer(boolean strictReturns)
	{
		this.strictReturns = strictReturns;
	}

	public void analyze(Program program)
	{
		analyze(program, Context.createGlobal());
	}

	public void analyze(Program program, Context context)
	{
		Debug.logDebug("Analyzing " + program.getStatements().size() + " top-level statement(s)...");
		analyzeIn(context, program);
		Debug.logDebug("Semantic analysis completed successfully.");
	}

	private Type analyze(Node node)
	{
		return node.accept(this);
	}

	private Type analyzeIn(Context context, Node node)
	{
		Context saved = currentContext;
		currentContext = context;
		try
		{
			return node.accept(this);
		}
		finally
		{
			currentContext = saved;
		}
	}

	/**
	 * Declares every function of the list before analyzing any statement, so
	 * functions can call each other regardless of order.
	 */
	private void analyzeStatements(List<Node> statements, Context context)
	{
		for (Node statement : statements)
		{
			if (statement instanceof FunctionDeclaration function)
			{
				analyzeSignature(function, context);
			}
		}
		for (Node statement : statements)
		{
			analyzeIn(context, statement);
		}
	}

	private void analyzeSignature(FunctionDeclaration function, Context context)
	{
		if (function.getBodyContext() != null)
		{
			return;
		}
		Context bodyContext = context.createChildContextForFunctionBody(function);
		function.setBodyContext(bodyContext);
		for (Parameter parameter : function.getParameters())
		{
			analyzeIn(bodyContext, parameter);
		}
		Type result = function.hasReturnType() ? analyzeIn(context, function.getReturnTypeNode()) : PrimitiveType.VOID;
		function.setType(result);
		context.add(function);
	}

	private static Type resolveTypeName(String name)
	{
		if (name.equals(RecordType.OBJECT.getName()))
		{
			return RecordType.OBJECT;
		}
		return PrimitiveType.fromKeyword(name).orElseThrow(() ->
				new SemanticException(ErrorKind.UNKNOWN_TYPE, "Unknown type: " + name));
	}

	/**
	 * A location declared {@code object} takes on the exact record type of its
	 * initializer, which keeps the record's fields reachable through it.
	 */
	private static Type declaredType(Type declared, Expression initializer)
	{
		if (initializer != null && declared.isRecord() && initializer.getType() instanceof RecordType record)
		{
			return record;
		}
		return declared;
	}

	private static Type settle(Node node, Type type)
	{
		node.setType(type);
		return type;
	}

	// --- Program and types ---

	@Override
	public Type visitProgram(Program node)
	{
		node.setContext(currentContext);
		analyzeStatements(node.getStatements(), currentContext);
		return settle(node, PrimitiveType.VOID);
	}

	@Override
	public Type visitPrimitiveType(PrimitiveTypeNode node)
	{
		return settle(node, resolveTypeName(node.getName()));
	}

	@Override
	public Type visitRecordType(RecordTypeNode node)
	{
		return settle(node, RecordType.OBJECT);
	}

	@Override
	public Type visitArrayType(ArrayTypeNode node)
	{
		Type elementType = analyze(node.getElementType());
		return settle(node, new ArrayType(elementType));
	}

	// --- Expressions ---

	@Override
	public Type visitLiteral(Literal node)
	{
		return settle(node, resolveTypeName(node.getKind()));
	}

	@Override
	public Type visitBinaryExpression(BinaryExpression node)
	{
		Expression left = node.getLeft();
		Expression right = node.getRight();
		analyze(left);
		analyze(right);

		switch (node.getOp().getCategory())
		{
			case ARITHMETIC:
				Check.isNumber(left);
				Check.isNumber(right);
				return settle(node, Type.getWiderType(left.getType(), right.getType()));
			case RELATIONAL:
				Check.isNumber(left);
				Check.isNumber(right);
				return settle(node, PrimitiveType.BOOL);
			case LOGICAL:
				Check.isBoolean(left);
				Check.isBoolean(right);
				return settle(node, PrimitiveType.BOOL);
			case EQUALITY:
				Check.expressionsHaveTheSameType(left, right);
				return settle(node, PrimitiveType.BOOL);
			default:
				throw new IllegalStateException("Unhandled operator " + node.getOp());
		}
	}

	@Override
	public Type visitCallExpression(CallExpression node)
	{
		Declaration callee = currentContext.lookupValue(node.getCalleeName());
		Check.isFunction(callee);
		Callable function = (Callable) callee;
		node.getArgs().forEach(this::analyze);
		Check.legalArguments(node.getArgs(), function.getParameters());
		node.setCallee(function);
		return settle(node, function.getReturnType());
	}

	@Override
	public Type visitArrayExpression(ArrayExpression node)
	{
		Type type = analyze(node.getArrayType());
		Check.isArrayType(type);
		Type elementType = ((ArrayType) type).getElementType();

		analyze(node.getSize());
		Check.isInteger(node.getSize());

		for (Expression element : node.getElements())
		{
			analyze(element);
			Check.isAssignableTo(element, elementType);
		}
		return settle(node, type);
	}

	@Override
	public Type visitIdExp(IdExp node)
	{
		Declaration reference = currentContext.lookupValue(node.getName());
		if (reference instanceof Callable)
		{
			throw new SemanticException(ErrorKind.TYPE_MISMATCH, "Function " + node.getName() + " used as a value");
		}
		node.setReference(reference);
		return settle(node, reference.getType());
	}

	@Override
	public Type visitMemberExpression(MemberExpression node)
	{
		Type objectType = analyze(node.getObject());

		if (objectType instanceof ArrayType arrayType)
		{
			if (!node.isComputed())
			{
				throw new SemanticException(ErrorKind.NON_SUBSCRIPTABLE,
						"Array elements are accessed by index, not by name");
			}
			analyze(node.getProperty());
			Check.isInteger(node.getProperty());
			return settle(node, arrayType.getElementType());
		}

		if (objectType instanceof RecordType record && record.hasMembers())
		{
			if (node.isComputed() || !(node.getProperty() instanceof IdExp property))
			{
				throw new SemanticException(ErrorKind.NON_SUBSCRIPTABLE,
						"Object fields are accessed by name, not by index");
			}
			Declaration field = record.getMembers().lookupMember(property.getName());
			property.setReference(field);
			property.setType(field.getType());
			return settle(node, field.getType());
		}

		throw new SemanticException(ErrorKind.NON_SUBSCRIPTABLE,
				"Non subscriptable expression: " + node.getObject().describe() + " of type " + objectType.getName());
	}

	@Override
	public Type visitObjectExp(ObjectExp node)
	{
		Context objContext = currentContext.createChildContextForObject();
		node.setObjContext(objContext);

		Set<String> usedFields = new HashSet<>();
		for (Field field : node.getProperties())
		{
			Check.fieldHasNotBeenUsed(field.getName(), usedFields);
			usedFields.add(field.getName());
			analyzeIn(objContext, field);
		}
		return settle(node, new RecordType(node.getProperties(), objContext));
	}

	// --- Declarations ---

	@Override
	public Type visitField(Field node)
	{
		Type declared = analyze(node.getTypeNode());

		// Initializers see the scope around the literal, not sibling fields.
		Context valueContext = currentContext.getKind() == ScopeKind.OBJECT
				? currentContext.getEnclosingContext()
				: currentContext;
		analyzeIn(valueContext, node.getValue());
		Check.isAssignableTo(node.getValue(), declared);

		Type type = settle(node, declaredType(declared, node.getValue()));
		currentContext.add(node);
		return type;
	}

	@Override
	public Type visitParameter(Parameter node)
	{
		Type type = settle(node, analyze(node.getTypeNode()));
		currentContext.add(node);
		return type;
	}

	@Override
	public Type visitVariableDeclaration(VariableDeclaration node)
	{
		Type declared = analyze(node.getTypeNode());
		Expression initializer = node.getInitializer();
		if (initializer != null)
		{
			analyze(initializer);
			Check.isAssignableTo(initializer, declared);
		}
		Type type = settle(node, declaredType(declared, initializer));
		currentContext.add(node);
		return type;
	}

	@Override
	public Type visitFunc(Func node)
	{
		analyzeSignature(node, currentContext);
		analyzeStatements(node.getBody(), node.getBodyContext());
		return node.getType();
	}

	@Override
	public Type visitMethod(Method node)
	{
		analyzeSignature(node, currentContext);
		List<Node> body = node.getBody();
		analyzeStatements(body, node.getBodyContext());

		if (strictReturns && !body.isEmpty() && body.get(body.size() - 1) instanceof Expression result)
		{
			checkReturnable(result, node);
		}
		return node.getType();
	}

	// --- Statements ---

	@Override
	public Type visitAssignmentStatement(AssignmentStatement node)
	{
		analyze(node.getSource());
		analyze(node.getTarget());
		Check.isAssignableTo(node.getSource(), node.getTarget().getType());
		Check.isNotReadOnly(node.getTarget());
		return settle(node, PrimitiveType.VOID);
	}

	@Override
	public Type visitForStatement(ForStatement node)
	{
		Context loopContext = currentContext.createChildContextForLoop();
		node.getAssignments().forEach(assignment -> analyzeIn(loopContext, assignment));

		analyzeIn(loopContext, node.getTest());
		Check.isBoolean(node.getTest());

		analyzeIn(loopContext, node.getAction());
		Check.isAssignment(node.getAction());

		// Only the step action may move the induction variables.
		for (Node assignment : node.getAssignments())
		{
			if (assignment instanceof VariableDeclaration induction)
			{
				induction.markReadOnly();
			}
		}

		analyzeStatements(node.getBody(), loopContext);
		return settle(node, PrimitiveType.VOID);
	}

	@Override
	public Type visitWhileStatement(WhileStatement node)
	{
		Context loopContext = currentContext.createChildContextForLoop();
		analyzeIn(loopContext, node.getTest());
		Check.isBoolean(node.getTest());
		analyzeStatements(node.getBody(), loopContext);
		return settle(node, PrimitiveType.VOID);
	}

	@Override
	public Type visitGifStatement(GifStatement node)
	{
		for (Expression test : node.getTests())
		{
			analyze(test);
			Check.isBoolean(test);
		}
		for (List<Node> consequent : node.getConsequents())
		{
			analyzeStatements(consequent, currentContext);
		}
		if (node.getAlternate() != null)
		{
			analyzeStatements(node.getAlternate(), currentContext);
		}
		return settle(node, PrimitiveType.VOID);
	}

	@Override
	public Type visitReturnStatement(ReturnStatement node)
	{
		analyze(node.getReturnValue());
		if (strictReturns)
		{
			Callable function = currentContext.enclosingFunction().orElseThrow(() ->
					new SemanticException(ErrorKind.RETURN_MISMATCH, "Return statement outside of a function"));
			checkReturnable(node.getReturnValue(), function);
		}
		return settle(node, PrimitiveType.VOID);
	}

	private static void checkReturnable(Expression value, Callable function)
	{
		Type expected = function.getReturnType();
		if (!value.getType().isAssignableTo(expected))
		{
			throw new SemanticException(ErrorKind.RETURN_MISMATCH, "Function " + function.getName()
					+ " returns " + expected.getName() + " but found " + value.getType().getName());
		}
	}

	@Override
	public Type visitThrowStatement(ThrowStatement node)
	{
		analyze(node.getError());
		Check.isString(node.getError());
		return settle(node, PrimitiveType.VOID);
	}
}
