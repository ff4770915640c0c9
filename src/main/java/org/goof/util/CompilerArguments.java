package org.goof.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses and holds all command-line arguments for the goof3 compiler.
 */
public class CompilerArguments
{
	private Path inputFile = null;
	private Path outputPath = null;
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean astOnly = false;
	private boolean decoratedAst = false;
	private boolean optimize = false;
	private boolean checkOnly = false;
	private boolean strictReturns = false;
	private boolean invalid = false;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					continue;
				}
				if (arg.equals("-a") || arg.equals("--ast"))
				{
					parsedArgs.astOnly = true;
					continue;
				}
				if (arg.equals("-i") || arg.equals("--decorated"))
				{
					parsedArgs.decoratedAst = true;
					continue;
				}
				if (arg.equals("-O") || arg.equals("--optimize"))
				{
					parsedArgs.optimize = true;
					continue;
				}
				if (arg.equals("-k") || arg.equals("--check"))
				{
					parsedArgs.checkOnly = true;
					continue;
				}
				if (arg.equals("--strict-returns"))
				{
					parsedArgs.strictReturns = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				// If it's not a flag, it's the input file
				if (parsedArgs.inputFile != null)
				{
					throw new IllegalArgumentException("Only one input file is supported, got " + parsedArgs.inputFile + " and " + arg);
				}
				parsedArgs.inputFile = Paths.get(arg);
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.invalid = true;
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Compiler for the goof3 language, targeting JavaScript.");
		System.out.println("\nUSAGE: goofc [options] file.goof");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show compiler version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -a, --ast                 Write out the abstract syntax tree and stop.");
		System.out.println("  -i, --decorated           Write out the analyzed (decorated) syntax tree and stop.");
		System.out.println("  -O, --optimize            Optimize the analyzed tree before generating code.");
		System.out.println("  -k, --check               Run semantic analysis only; do not generate output.");
		System.out.println("  -o, --output <file>       Write the output to <file> instead of standard output.");
		System.out.println("\nFLAGS:");
		System.out.println("  --strict-returns          Check returned values against the function's declared result.");
	}

	// --- Getters ---

	public Path getInputFile()
	{
		return inputFile;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	/**
	 * @return true when the arguments could not be parsed; help is shown instead.
	 */
	public boolean isInvalid()
	{
		return invalid;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isAstOnly()
	{
		return astOnly;
	}

	public boolean isDecoratedAst()
	{
		return decoratedAst;
	}

	public boolean isOptimize()
	{
		return optimize;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	public boolean isStrictReturns()
	{
		return strictReturns;
	}
}
