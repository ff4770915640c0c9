package org.goof.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class CompilerArgumentsTest
{
	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void noArgumentsShowsHelp()
	{
		CompilerArguments arguments = CompilerArguments.parse(new String[0]);

		assertTrue(arguments.isHelpFlag());
		assertFalse(arguments.isInvalid());
	}

	@Test
	void inputFileAndFlags()
	{
		CompilerArguments arguments = CompilerArguments.parse(new String[]{"-a", "-i", "-O", "-k", "--strict-returns", "hello.goof"});

		assertEquals(Paths.get("hello.goof"), arguments.getInputFile());
		assertTrue(arguments.isAstOnly());
		assertTrue(arguments.isDecoratedAst());
		assertTrue(arguments.isOptimize());
		assertTrue(arguments.isCheckOnly());
		assertTrue(arguments.isStrictReturns());
		assertFalse(arguments.isHelpFlag());
		assertNull(arguments.getOutputPath());
	}

	@Test
	void longFlags()
	{
		CompilerArguments arguments = CompilerArguments.parse(new String[]{"--ast", "--decorated", "--optimize", "--check", "x.goof"});

		assertTrue(arguments.isAstOnly());
		assertTrue(arguments.isDecoratedAst());
		assertTrue(arguments.isOptimize());
		assertTrue(arguments.isCheckOnly());
	}

	@Test
	void outputPath()
	{
		CompilerArguments arguments = CompilerArguments.parse(new String[]{"in.goof", "-o", "out/prog.js"});

		assertEquals(Paths.get("out/prog.js"), arguments.getOutputPath());
		assertEquals(Paths.get("in.goof"), arguments.getInputFile());
	}

	@Test
	void verboseTurnsOnDebugLogging()
	{
		CompilerArguments arguments = CompilerArguments.parse(new String[]{"--verbose", "in.goof"});

		assertTrue(arguments.isVerboseFlag());
		assertTrue(Debug.ENABLE_DEBUG);
	}

	@Test
	void helpAndVersionStopParsing()
	{
		assertTrue(CompilerArguments.parse(new String[]{"-h", "--bogus"}).isHelpFlag());
		assertFalse(CompilerArguments.parse(new String[]{"--help"}).isInvalid());

		CompilerArguments version = CompilerArguments.parse(new String[]{"--version", "--bogus"});
		assertTrue(version.isVersionFlag());
		assertFalse(version.isInvalid());
	}

	@Test
	void unknownOptionIsInvalid()
	{
		CompilerArguments arguments = CompilerArguments.parse(new String[]{"--bogus", "in.goof"});

		assertTrue(arguments.isInvalid());
		assertTrue(arguments.isHelpFlag());
	}

	@Test
	void outputNeedsAValue()
	{
		assertTrue(CompilerArguments.parse(new String[]{"in.goof", "-o"}).isInvalid());
		assertTrue(CompilerArguments.parse(new String[]{"in.goof", "-o", "-a"}).isInvalid());
	}

	@Test
	void onlyOneInputFile()
	{
		assertTrue(CompilerArguments.parse(new String[]{"a.goof", "b.goof"}).isInvalid());
	}
}
