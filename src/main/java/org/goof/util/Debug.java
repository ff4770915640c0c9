package org.goof.util;

import java.io.PrintStream;

public class Debug
{
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Turned on by -v / --verbose.
	public static boolean ENABLE_DEBUG = false;

	// Colors are only useful on a terminal; piped output stays plain.
	public static boolean ENABLE_COLOR = System.console() != null;

	private static PrintStream out = System.out;
	private static PrintStream err = System.err;

	/**
	 * Redirects log output. The compiler writes generated code to stdout, so
	 * diagnostics go to stderr unless told otherwise.
	 */
	public static void setStreams(PrintStream out, PrintStream err)
	{
		Debug.out = out;
		Debug.err = err;
	}

	public static void log(String log)
	{
		out.println(log);
	}

	public static void logInfo(String log)
	{
		err.println(color(ANSI_GREEN, log));
	}

	public static void logDebug(String log)
	{
		// Only print if the ENABLE_DEBUG flag is true
		if (ENABLE_DEBUG)
		{
			err.println(log);
		}
	}

	public static void logWarning(String log)
	{
		err.println(color(ANSI_YELLOW, log));
	}

	public static void logError(String log)
	{
		err.println(color(ANSI_RED, log));
	}

	private static String color(String code, String log)
	{
		return ENABLE_COLOR ? code + log + ANSI_RESET : log;
	}
}
