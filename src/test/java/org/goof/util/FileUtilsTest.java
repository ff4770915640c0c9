package org.goof.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class FileUtilsTest
{
	@Test
	void extensionIncludesTheDot()
	{
		assertEquals(".goof", FileUtils.getFileExtension(Paths.get("dir/hello.goof")));
		assertEquals(".js", FileUtils.getFileExtension(Paths.get("hello.min.js")));
	}

	@Test
	void noExtension()
	{
		assertNull(FileUtils.getFileExtension(Paths.get("Makefile")));
		assertNull(FileUtils.getFileExtension(Paths.get(".hidden")));
	}
}
