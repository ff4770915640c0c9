package org.goof;

import org.goof.util.Debug;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest
{
	@TempDir
	Path dir;

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	@BeforeEach
	void captureLogs()
	{
		Debug.ENABLE_COLOR = false;
		Debug.setStreams(new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	@AfterEach
	void restoreLogs()
	{
		Debug.setStreams(System.out, System.err);
		Debug.ENABLE_DEBUG = false;
	}

	private Path source(String name, String text) throws IOException
	{
		Path file = dir.resolve(name);
		Files.writeString(file, text);
		return file;
	}

	private String stdout()
	{
		return out.toString(StandardCharsets.UTF_8);
	}

	private String stderr()
	{
		return err.toString(StandardCharsets.UTF_8);
	}

	@Test
	void writesJavaScriptToStandardOutput() throws IOException
	{
		Path input = source("hello.goof", "print(\"hello\")");

		assertEquals(0, Main.run(new String[]{input.toString()}));
		assertTrue(stdout().contains("print_1(\"hello\");"), stdout());
	}

	@Test
	void writesToTheOutputFile() throws IOException
	{
		Path input = source("hello.goof", "print(\"hello\")");
		Path output = dir.resolve("build/hello.js");

		assertEquals(0, Main.run(new String[]{input.toString(), "-o", output.toString()}));
		assertTrue(Files.readString(output).contains("console.log"));
		assertFalse(stdout().contains("console.log"));
	}

	@Test
	void checkOnlyWritesNothing() throws IOException
	{
		Path input = source("ok.goof", "var x : whole_number := 1");

		assertEquals(0, Main.run(new String[]{"-k", input.toString()}));
		assertTrue(stdout().isEmpty(), stdout());
	}

	@Test
	void semanticErrorExitsWithOne() throws IOException
	{
		Path input = source("bad.goof", "var x : whole_number := 3; x := 3.5;");

		assertEquals(1, Main.run(new String[]{input.toString()}));
		assertTrue(stderr().contains("[Semantic Error] ASSIGNABILITY"), stderr());
		assertTrue(stdout().isEmpty(), stdout());
	}

	@Test
	void syntaxErrorExitsWithOne() throws IOException
	{
		Path input = source("broken.goof", "var x whole_number");

		assertEquals(1, Main.run(new String[]{input.toString()}));
		assertTrue(stderr().contains("[Syntax Error]"), stderr());
	}

	@Test
	void missingInputFileExitsWithTwo()
	{
		assertEquals(2, Main.run(new String[]{dir.resolve("nope.goof").toString()}));
		assertTrue(stderr().contains("Input file not found"), stderr());
	}

	@Test
	void otherExtensionsOnlyWarn() throws IOException
	{
		Path input = source("hello.txt", "print(\"hi\")");

		assertEquals(0, Main.run(new String[]{input.toString()}));
		assertTrue(stderr().contains("does not end in .goof"), stderr());
	}

	@Test
	void badArgumentsExitWithTwo()
	{
		assertEquals(2, Main.run(new String[]{"--bogus"}));
		assertEquals(2, Main.run(new String[]{"-v"}));
	}

	@Test
	void helpAndVersionExitWithZero()
	{
		assertEquals(0, Main.run(new String[]{"--help"}));
		assertEquals(0, Main.run(new String[]{"--version"}));
	}
}
