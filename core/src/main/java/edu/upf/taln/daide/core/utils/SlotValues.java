package edu.upf.taln.daide.core.utils;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads values from lines made of double-colon delimited slots, e.g. "::power-id ENG ::power-name England".
 * A value runs from its marker to the next marker or to the end of the line, and may be empty.
 */
public class SlotValues
{
	private static final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

	private SlotValues() {}

	public static Optional<String> get(String line, String slot)
	{
		final Pattern p = patterns.computeIfAbsent(slot, s ->
				Pattern.compile("(?:.*\\s)?::" + Pattern.quote(s) + "(|\\s+\\S.*?)(?:\\s+::\\S.*|\\s*)"));
		final Matcher m = p.matcher(line);
		if (!m.matches())
			return Optional.empty();
		return Optional.of(m.group(1).trim());
	}

	// Empty values count as missing
	public static Optional<String> getNonEmpty(String line, String slot)
	{
		return get(line, slot).filter(v -> !v.isEmpty());
	}
}
