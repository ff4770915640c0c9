// File: src/main/java/org/goof/semantic/Context.java
package org.goof.semantic;

import org.goof.ast.Callable;
import org.goof.ast.Declaration;
import org.goof.ast.Func;
import org.goof.ast.Parameter;
import org.goof.ast.PrimitiveTypeNode;
import org.goof.semantic.type.PrimitiveType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One frame of the scope tree built during analysis. Frames point at their
 * enclosing frame; the global frame has none.
 */
public class Context
{
	public static final String PRINT = "print";

	private final Context enclosingContext;
	private final ScopeKind kind;
	private final Callable owner;
	private final Map<String, Declaration> values = new LinkedHashMap<>();

	private Context(Context enclosingContext, ScopeKind kind, Callable owner)
	{
		this.enclosingContext = enclosingContext;
		this.kind = kind;
		this.owner = owner;
	}

	/**
	 * Creates the root frame for one compilation, with the standard library
	 * already declared in it.
	 */
	public static Context createGlobal()
	{
		Context global = new Context(null, ScopeKind.GLOBAL, null);
		global.add(createPrint());
		return global;
	}

	private static Func createPrint()
	{
		Parameter s = new Parameter("s", new PrimitiveTypeNode(PrimitiveType.STRING.getName()));
		s.setType(PrimitiveType.STRING);
		Func print = new Func(PRINT, List.of(s), null, List.of());
		print.setType(PrimitiveType.VOID);
		return print;
	}

	public Context createChildContextForLoop()
	{
		return new Context(this, ScopeKind.LOOP, null);
	}

	public Context createChildContextForFunctionBody(Callable owner)
	{
		return new Context(this, ScopeKind.FUNCTION_BODY, owner);
	}

	public Context createChildContextForObject()
	{
		return new Context(this, ScopeKind.OBJECT, null);
	}

	/**
	 * Binds the declaration's name in this frame.
	 *
	 * @throws SemanticException DUPLICATE_DECLARATION if this frame already binds the name.
	 */
	public void add(Declaration declaration)
	{
		String name = declaration.getName();
		if (values.containsKey(name))
		{
			throw new SemanticException(ErrorKind.DUPLICATE_DECLARATION,
					"Identifier " + name + " already declared in this scope");
		}
		values.put(name, declaration);
	}

	/**
	 * Resolves a name in this frame or the nearest enclosing frame that binds it.
	 *
	 * @throws SemanticException UNDECLARED_IDENTIFIER if no frame binds the name.
	 */
	public Declaration lookupValue(String name)
	{
		return resolve(name).orElseThrow(() -> new SemanticException(ErrorKind.UNDECLARED_IDENTIFIER,
				"Identifier " + name + " has not been declared"));
	}

	/**
	 * Resolves a name in this frame only. Used for record members.
	 */
	public Declaration lookupMember(String name)
	{
		return resolveLocally(name).orElseThrow(() -> new SemanticException(ErrorKind.UNDECLARED_IDENTIFIER,
				"Object has no field " + name));
	}

	public Optional<Declaration> resolve(String name)
	{
		Context context = this;
		while (context != null)
		{
			Declaration found = context.values.get(name);
			if (found != null)
			{
				return Optional.of(found);
			}
			context = context.enclosingContext;
		}
		return Optional.empty();
	}

	public Optional<Declaration> resolveLocally(String name)
	{
		return Optional.ofNullable(values.get(name));
	}

	/**
	 * @return the function whose body this frame is nested in, if any.
	 */
	public Optional<Callable> enclosingFunction()
	{
		for (Context context = this; context != null; context = context.enclosingContext)
		{
			if (context.kind == ScopeKind.FUNCTION_BODY)
			{
				return Optional.ofNullable(context.owner);
			}
		}
		return Optional.empty();
	}

	public ScopeKind getKind()
	{
		return kind;
	}

	public Context getEnclosingContext()
	{
		return enclosingContext;
	}
}
