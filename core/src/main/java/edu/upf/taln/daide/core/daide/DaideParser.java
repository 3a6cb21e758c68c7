package edu.upf.taln.daide.core.daide;

import com.google.common.base.Preconditions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tolerant single-pass parser for DAIDE text. Never fails: spurious characters and unbalanced parentheses are
 * reported in the returned {@link DaideParse} and skipped.
 */
public class DaideParser
{
	private final static Logger log = LogManager.getLogger();

	public DaideParse parse(String text)
	{
		return parse(text, 0);
	}

	public DaideParse parse(String text, int index)
	{
		Preconditions.checkNotNull(text);
		Preconditions.checkArgument(index >= 0, "Negative start index " + index);

		final List<String> errors = new ArrayList<>();
		// one open list per nesting level, outermost at the bottom
		final Deque<List<DaideTree>> levels = new ArrayDeque<>();
		levels.push(new ArrayList<>());

		int i = index;
		while (i < text.length())
		{
			final char c = text.charAt(i);
			if (Character.isWhitespace(c))
				++i;
			else if (c == '(')
			{
				levels.push(new ArrayList<>());
				++i;
			}
			else if (c == ')')
			{
				if (levels.size() > 1)
				{
					final List<DaideTree> closed = levels.pop();
					levels.peek().add(DaideTree.list(closed));
				}
				else
					errors.add("Ignoring spurious close parenthesis at position " + i);
				++i;
			}
			else if (Character.isLetter(c))
			{
				final int start = i;
				while (i < text.length() && Character.isLetter(text.charAt(i)))
					++i;
				levels.peek().add(DaideTree.leaf(text.substring(start, i)));
			}
			else
			{
				errors.add("Ignoring spurious character " + c + " at position " + i);
				++i;
			}
		}

		while (levels.size() > 1)
		{
			errors.add("Missing close parenthesis");
			final List<DaideTree> closed = levels.pop();
			levels.peek().add(DaideTree.list(closed));
		}

		if (!errors.isEmpty())
			log.debug("Parsed DAIDE with " + errors.size() + " errors: " + text);
		return new DaideParse(DaideTree.list(levels.pop()), errors, i);
	}
}
