package edu.upf.taln.daide.core.utils;

/**
 * Thrown when a recursive traversal of an AMR graph or a DAIDE tree goes deeper than the configured maximum.
 * Callers processing a batch catch it per item.
 */
public class DepthLimitExceededException extends RuntimeException
{
	private final int max_depth;

	public DepthLimitExceededException(String what, int max_depth)
	{
		super(what + " exceeded maximum depth " + max_depth);
		this.max_depth = max_depth;
	}

	public int getMaxDepth() { return max_depth; }

	public static void check(int depth, int max_depth, String what)
	{
		if (depth > max_depth)
			throw new DepthLimitExceededException(what, max_depth);
	}
}
