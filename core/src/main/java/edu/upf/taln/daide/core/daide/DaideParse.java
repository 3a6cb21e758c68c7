package edu.upf.taln.daide.core.daide;

import java.util.List;

/**
 * Result of parsing DAIDE text: a best-effort tree, the problems found along the way and the index where parsing stopped.
 */
public final class DaideParse
{
	private final DaideTree tree;
	private final List<String> errors;
	private final int next_index;

	public DaideParse(DaideTree tree, List<String> errors, int next_index)
	{
		this.tree = tree;
		this.errors = List.copyOf(errors);
		this.next_index = next_index;
	}

	public DaideTree getTree() { return tree; }
	public List<String> getErrors() { return errors; }
	public int getNextIndex() { return next_index; }
	public boolean hasErrors() { return !errors.isEmpty(); }
}
