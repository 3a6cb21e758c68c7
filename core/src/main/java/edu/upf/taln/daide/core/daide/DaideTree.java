package edu.upf.taln.daide.core.daide;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A DAIDE expression: either a single token such as "ENG" or "MTO", or an ordered list of sub-expressions.
 */
public final class DaideTree
{
	private final String token; // null for lists
	private final List<DaideTree> children;

	private DaideTree(String token, List<DaideTree> children)
	{
		this.token = token;
		this.children = children;
	}

	public static DaideTree leaf(String token)
	{
		Preconditions.checkNotNull(token);
		return new DaideTree(token, ImmutableList.of());
	}

	public static DaideTree list(List<DaideTree> children)
	{
		return new DaideTree(null, ImmutableList.copyOf(children));
	}

	public static DaideTree list(DaideTree... children)
	{
		return new DaideTree(null, ImmutableList.copyOf(children));
	}

	public boolean isLeaf() { return token != null; }
	public String getToken() { return token; }
	public List<DaideTree> getChildren() { return children; }
	public int size() { return children.size(); }
	public DaideTree get(int i) { return children.get(i); }

	/**
	 * @return true if the i-th child exists and is the given token
	 */
	public boolean hasToken(int i, String token)
	{
		return i < children.size() && children.get(i).isLeaf() && children.get(i).token.equals(token);
	}

	public boolean isLeafAt(int i)
	{
		return i < children.size() && children.get(i).isLeaf();
	}

	/**
	 * Prints the tree back as DAIDE text with normalized spacing. The outermost list is not parenthesized.
	 */
	@Override
	public String toString()
	{
		return print(this, 0);
	}

	private static String print(DaideTree tree, int level)
	{
		if (tree.isLeaf())
			return tree.token;

		final String joined = tree.children.stream()
				.map(c -> print(c, level + 1))
				.collect(Collectors.joining(" "));
		return level > 0 ? "(" + joined + ")" : joined;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		DaideTree that = (DaideTree) o;
		return Objects.equals(token, that.token) && children.equals(that.children);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(token, children);
	}
}
