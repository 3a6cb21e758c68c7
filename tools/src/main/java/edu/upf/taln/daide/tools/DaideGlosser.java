package edu.upf.taln.daide.tools;

import edu.upf.taln.daide.core.Options;
import edu.upf.taln.daide.core.daide.DaideParse;
import edu.upf.taln.daide.core.daide.DaideParser;
import edu.upf.taln.daide.core.english.EnglishGenerator;
import edu.upf.taln.daide.core.resources.LexicalResources;
import edu.upf.taln.daide.core.utils.DepthLimitExceededException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Glosses DAIDE expressions in English, one expression per line.
 */
public class DaideGlosser
{
	private final DaideParser parser = new DaideParser();
	private final EnglishGenerator generator;

	private final static Logger log = LogManager.getLogger();

	public DaideGlosser(LexicalResources resources, Options options)
	{
		generator = new EnglishGenerator(resources, options);
	}

	/**
	 * @return output blocks for all non-blank lines of the text
	 */
	public String glossLines(String text)
	{
		return Arrays.stream(text.split("\\R"))
				.map(String::trim)
				.filter(l -> !l.isEmpty())
				.map(this::gloss)
				.collect(Collectors.joining());
	}

	public String gloss(String daide)
	{
		final StringBuilder b = new StringBuilder();
		b.append("DAIDE: ").append(daide).append('\n');
		final DaideParse parse = parser.parse(daide);
		parse.getErrors().forEach(e -> b.append("# ::error ").append(e).append('\n'));
		try
		{
			b.append("English: ").append(generator.toEnglish(parse.getTree())).append('\n');
		}
		catch (DepthLimitExceededException | StackOverflowError e)
		{
			log.error("Cannot gloss " + daide + ": " + e);
			b.append("# ::error ").append(e instanceof StackOverflowError ? "Stack overflow" : e.getMessage()).append('\n');
		}
		return b.append('\n').toString();
	}
}
