package edu.upf.taln.daide.amr.patterns;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DAIDE text with $name placeholders, e.g. "$unit MTO $destination", instantiated with the bindings of a pattern match.
 */
public final class DaideTemplate
{
	private static final Pattern placeholder = Pattern.compile("\\$([a-z][a-z0-9]*)(?![a-z0-9])");
	private static final Pattern double_parentheses = Pattern.compile("\\((\\([^()]*\\))\\)");
	private final String text;

	public DaideTemplate(String text)
	{
		this.text = text;
	}

	public String getText() { return text; }

	/**
	 * Replaces placeholders with their bound values, parenthesizing multi-token values where needed.
	 * Unbound placeholders are left as they are.
	 * @param negated if true, the result is wrapped in NOT (...)
	 */
	public String instantiate(Map<String, String> bindings, boolean negated)
	{
		final StringBuilder b = new StringBuilder();
		final Matcher m = placeholder.matcher(text);
		int last = 0;
		while (m.find())
		{
			b.append(text, last, m.start());
			last = m.end();

			String value = bindings.get(m.group(1));
			if (value == null)
				value = m.group();
			else
			{
				final boolean enclosed = b.length() > 0 && b.charAt(b.length() - 1) == '(' &&
						text.startsWith(")", m.end());
				if (value.contains(" ") && !hasMatchingOuterParentheses(value) && !enclosed)
					value = "(" + value + ")";
			}
			b.append(value);
		}
		b.append(text.substring(last));

		String result = b.toString();
		if (negated)
			result = "NOT (" + result + ")";
		return collapseParentheses(result);
	}

	/**
	 * @return true if the text is wholly enclosed in a pair of matching parentheses, as "(A (B) C)" but not "(A) (B)"
	 */
	public static boolean hasMatchingOuterParentheses(String s)
	{
		if (!s.startsWith("(") || !s.endsWith(")"))
			return false;

		int open = 0;
		for (int i = 0; i < s.length(); ++i)
		{
			final char c = s.charAt(i);
			if (c == '(')
				++open;
			else if (c == ')')
				--open;
			if (open <= 0 && i < s.length() - 1)
				return false;
		}
		return open == 0;
	}

	// ((X)) -> (X)
	private static String collapseParentheses(String s)
	{
		Matcher m = double_parentheses.matcher(s);
		while (m.find())
		{
			s = s.substring(0, m.start()) + m.group(1) + s.substring(m.end());
			m = double_parentheses.matcher(s);
		}
		return s;
	}

	@Override
	public String toString()
	{
		return text;
	}
}
