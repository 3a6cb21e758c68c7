package edu.upf.taln.daide.core;

public class Options
{
	public int max_depth = 100; // Maximum recursion depth when printing AMRs, translating them to DAIDE or glossing DAIDE in English. Must be reached before the thread stack runs out.
	public int amr_max_nesting = 1000; // Maximum nesting of AMR nodes accepted by the reader. Deeper nodes are truncated and reported.
	public String indent = "      "; // Indentation unit used by the AMR writer for each level of nesting

	public Options() {}

	public Options(Options o)
	{
		this.max_depth = o.max_depth;
		this.amr_max_nesting = o.amr_max_nesting;
		this.indent = o.indent;
	}

	@Override
	public String toString()
	{
		return "Options:" +
				"\n\tmax_depth = " + max_depth +
				"\n\tamr_max_nesting = " + amr_max_nesting +
				"\n\tindent = \"" + indent + "\"";
	}
}
