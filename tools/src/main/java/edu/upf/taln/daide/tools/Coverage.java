package edu.upf.taln.daide.tools;

import java.util.regex.Pattern;

/**
 * How much of an AMR was translated into DAIDE, judging by the output alone: DAIDE codes are uppercase and
 * untranslated AMR concepts are lowercase.
 */
public enum Coverage
{
	NONE("No-DAIDE"),
	PARTIAL("Partial-DAIDE"),
	FULL("Full-DAIDE");

	private static final Pattern code = Pattern.compile("[A-Z]{3}");
	private static final Pattern lowercase = Pattern.compile("[a-z]");
	private final String label;

	Coverage(String label)
	{
		this.label = label;
	}

	public String getLabel() { return label; }

	public static Coverage of(String daide)
	{
		if (!code.matcher(daide).find())
			return NONE;
		return lowercase.matcher(daide).find() ? PARTIAL : FULL;
	}

	@Override
	public String toString() { return label; }
}
