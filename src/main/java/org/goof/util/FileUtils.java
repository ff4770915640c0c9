package org.goof.util;

import java.nio.file.Path;

public class FileUtils
{
	public static final String SOURCE_EXTENSION = ".goof";

	public static String getFileExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}
}
