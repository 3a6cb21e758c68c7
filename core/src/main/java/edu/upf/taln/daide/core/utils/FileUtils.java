package edu.upf.taln.daide.core.utils;

import com.google.common.base.Charsets;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Whole-file reads and writes of UTF-8 text. Failures are reported to the caller.
 */
public class FileUtils
{
	public static String readTextFile(Path file) throws IOException
	{
		return org.apache.commons.io.FileUtils.readFileToString(file.toFile(), Charsets.UTF_8);
	}

	public static void writeTextToFile(Path file, String text) throws IOException
	{
		org.apache.commons.io.FileUtils.writeStringToFile(file.toFile(), text, Charsets.UTF_8);
	}

	/**
	 * Creates the output folder if needed and returns the path of a file in it named after the input file,
	 * with old_suffix replaced by new_suffix, or new_suffix appended if the name doesn't end in old_suffix.
	 */
	public static Path createOutputPath(Path input_file, Path output_folder, String old_suffix, String new_suffix)
			throws IOException
	{
		Files.createDirectories(output_folder);

		final String basename = input_file.getFileName().toString();
		final String out_filename = basename.endsWith(old_suffix) ?
				basename.substring(0, basename.length() - old_suffix.length()) + new_suffix :
				basename + new_suffix;
		return output_folder.resolve(out_filename);
	}
}
