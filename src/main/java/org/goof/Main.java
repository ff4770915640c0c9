package org.goof;

import org.goof.parser.SyntaxException;
import org.goof.semantic.SemanticException;
import org.goof.util.CompilerArguments;
import org.goof.util.Debug;
import org.goof.util.ErrorHandler;
import org.goof.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Command-line entry point. Compiles one goof3 file and writes the JavaScript
 * (or the requested tree dump) to standard output or to the {@code -o} file.
 */
public class Main
{
	public static final String VERSION = "0.1.0";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * @return the process exit code: 0 on success, 1 on a compilation error,
	 * 2 on a usage or I/O error.
	 */
	public static int run(String[] args)
	{
		CompilerArguments arguments = CompilerArguments.parse(args);

		if (arguments.isHelpFlag())
		{
			CompilerArguments.printUsage();
			return arguments.isInvalid() ? 2 : 0;
		}
		if (arguments.isVersionFlag())
		{
			System.out.println("goofc (goof3 Compiler) version " + VERSION);
			return 0;
		}
		if (arguments.getInputFile() == null)
		{
			Debug.logError("No input file provided. Use -h for help.");
			return 2;
		}

		Path input = arguments.getInputFile();
		if (!Files.exists(input))
		{
			Debug.logError("Input file not found: " + input);
			return 2;
		}
		if (!FileUtils.SOURCE_EXTENSION.equals(FileUtils.getFileExtension(input)))
		{
			Debug.logWarning("Input file does not end in " + FileUtils.SOURCE_EXTENSION + ": " + input);
		}

		ErrorHandler errorHandler = new ErrorHandler();
		try
		{
			String source = Files.readString(input);
			CompileOptions options = CompileOptions.from(arguments);
			Compiler compiler = new Compiler();

			if (arguments.isCheckOnly())
			{
				compiler.check(source, options);
				Debug.logInfo("Semantic check passed. No output generated (-k flag).");
				return 0;
			}

			String output = compiler.compile(source, options);
			writeOutput(output, arguments.getOutputPath());
			return 0;
		}
		catch (SyntaxException e)
		{
			errorHandler.logError(e);
		}
		catch (SemanticException e)
		{
			errorHandler.logError(e);
		}
		catch (IOException e)
		{
			Debug.logError("Error reading or writing file: " + e.getMessage());
			return 2;
		}
		return errorHandler.hasErrors() ? 1 : 0;
	}

	private static void writeOutput(String output, Path outputPath) throws IOException
	{
		if (outputPath == null)
		{
			Debug.log(output);
			return;
		}
		Path parent = outputPath.getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outputPath, output, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote output to: " + outputPath);
	}
}
