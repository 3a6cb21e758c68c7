package edu.upf.taln.daide.tools;

import edu.upf.taln.daide.core.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Properties;

/**
 * Settings read from a .properties file:
 * <pre>
 * daide.resources = path to a lexical resources file, replaces the bundled one
 * daide.max_depth = maximum recursion depth
 * daide.indent = number of spaces per level of indentation in printed AMRs
 * </pre>
 */
public class DaideProperties
{
	private Path resourcesPath;
	private Integer maxDepth;
	private Integer indent;

	private final static Logger log = LogManager.getLogger();

	public DaideProperties() {}

	public DaideProperties(Path properties_file) throws IOException
	{
		Properties prop = new Properties();
		try (FileInputStream input = new FileInputStream(properties_file.toFile()))
		{
			prop.load(input);
		}
		log.info("Loaded properties from " + properties_file);

		resourcesPath = checkValidFile(prop.getProperty("daide.resources"));
		maxDepth = checkPositiveInteger("daide.max_depth", prop.getProperty("daide.max_depth"));
		indent = checkPositiveInteger("daide.indent", prop.getProperty("daide.indent"));
	}

	public Optional<Path> getResourcesPath()
	{
		return Optional.ofNullable(resourcesPath);
	}

	public Optional<Integer> getMaxDepth()
	{
		return Optional.ofNullable(maxDepth);
	}

	public Optional<Integer> getIndent()
	{
		return Optional.ofNullable(indent);
	}

	/**
	 * @return default options overridden by the values of these properties
	 */
	public Options createOptions()
	{
		final Options options = new Options();
		getMaxDepth().ifPresent(d -> options.max_depth = d);
		getIndent().ifPresent(i -> options.indent = " ".repeat(i));
		return options;
	}

	private static Path checkValidFile(String value)
	{
		if (value == null || value.trim().isEmpty())
			return null;

		Path path = Paths.get(value.trim());
		if (!Files.exists(path) || !Files.isRegularFile(path))
		{
			throw new IllegalArgumentException(value + " is not a valid path");
		}
		return path;
	}

	private static Integer checkPositiveInteger(String key, String value)
	{
		if (value == null || value.trim().isEmpty())
			return null;

		try
		{
			final int n = Integer.parseInt(value.trim());
			if (n < 1)
				throw new IllegalArgumentException(key + " must be greater than 0: " + value);
			return n;
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException(key + " is not an integer: " + value, e);
		}
	}
}
