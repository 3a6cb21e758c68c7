package edu.upf.taln.daide.amr.patterns;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A pattern matched against AMR subgraphs, written in a Penman-like notation without variables, e.g.
 * <pre>($utype(army|fleet) :mod $power(country) :location $location(sea|province))</pre>
 * The head constrains the concept of the node, each role constrains the first filler of that role.
 */
public final class AMRPattern
{
	private final PatternTerm head;
	private final List<Pair<String, PatternTerm>> constraints;

	public AMRPattern(PatternTerm head, List<Pair<String, PatternTerm>> constraints)
	{
		Preconditions.checkArgument(!head.isPattern(), "Head of a pattern cannot be a pattern");
		this.head = head;
		this.constraints = List.copyOf(constraints);
	}

	public PatternTerm getHead() { return head; }
	public List<Pair<String, PatternTerm>> getConstraints() { return constraints; }

	/**
	 * @throws IllegalArgumentException if the text is not a well-formed pattern
	 */
	public static AMRPattern parse(String text)
	{
		final Scanner s = new Scanner(text);
		final AMRPattern p = s.readPattern();
		s.skipWhitespace();
		if (!s.atEnd())
			throw s.error("Unexpected text after pattern");
		return p;
	}

	@Override
	public String toString()
	{
		return "(" + head + constraints.stream()
				.map(c -> " :" + c.getLeft() + " " + c.getRight())
				.collect(Collectors.joining()) + ")";
	}

	// Balanced parenthesis scanner for pattern texts
	private static class Scanner
	{
		private final String text;
		private int pos = 0;

		Scanner(String text) { this.text = text; }

		boolean atEnd() { return pos >= text.length(); }
		char peek() { return text.charAt(pos); }

		void skipWhitespace()
		{
			while (!atEnd() && Character.isWhitespace(peek()))
				++pos;
		}

		void expect(char c)
		{
			skipWhitespace();
			if (atEnd() || peek() != c)
				throw error("Expected '" + c + "'");
			++pos;
		}

		AMRPattern readPattern()
		{
			expect('(');
			skipWhitespace();
			final PatternTerm head = readTerm(false);
			final List<Pair<String, PatternTerm>> constraints = new ArrayList<>();

			skipWhitespace();
			while (!atEnd() && peek() != ')')
			{
				expect(':');
				final String role = readAtom();
				if (role.isEmpty())
					throw error("Missing role name");
				skipWhitespace();
				constraints.add(Pair.of(role, readTerm(true)));
				skipWhitespace();
			}
			expect(')');

			return new AMRPattern(head, constraints);
		}

		PatternTerm readTerm(boolean nested_allowed)
		{
			if (atEnd())
				throw error("Missing term");
			if (peek() == '(')
			{
				if (!nested_allowed)
					throw error("Unexpected nested pattern");
				return PatternTerm.pattern(readPattern());
			}

			final String atom = readAtom();
			if (atom.isEmpty())
				throw error("Missing term");
			if (!atom.startsWith("$"))
				return PatternTerm.literal(atom);

			final String name = atom.substring(1);
			if (!name.matches("[a-z][a-z0-9]*"))
				throw error("Invalid slot name " + name);

			List<String> alternatives = List.of();
			if (!atEnd() && peek() == '(')
			{
				final int close = text.indexOf(')', pos);
				if (close < 0)
					throw error("Unterminated alternatives");
				alternatives = Arrays.asList(text.substring(pos + 1, close).split("\\|"));
				pos = close + 1;
			}
			return PatternTerm.slot(name, alternatives);
		}

		String readAtom()
		{
			final int start = pos;
			while (!atEnd() && !Character.isWhitespace(peek()) && peek() != '(' && peek() != ')')
				++pos;
			return text.substring(start, pos);
		}

		IllegalArgumentException error(String message)
		{
			return new IllegalArgumentException(message + " at position " + pos + " of pattern " + text);
		}
	}
}
