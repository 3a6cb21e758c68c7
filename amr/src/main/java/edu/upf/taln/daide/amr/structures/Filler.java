package edu.upf.taln.daide.amr.structures;

import com.google.common.base.Preconditions;

/**
 * Value of a relation in an AMR graph: another node, a literal (quoted or not) or a reference to a variable
 * not yet defined when the relation was read.
 */
public final class Filler
{
	public enum Type {NODE, QUOTED, UNQUOTED, PLACEHOLDER}

	private final Type type;
	private final AMRNode node;
	private final String text; // literal value or placeholder variable

	private Filler(Type type, AMRNode node, String text)
	{
		this.type = type;
		this.node = node;
		this.text = text;
	}

	public static Filler node(AMRNode node)
	{
		Preconditions.checkNotNull(node);
		return new Filler(Type.NODE, node, null);
	}

	public static Filler quoted(String text) { return new Filler(Type.QUOTED, null, text); }
	public static Filler unquoted(String text) { return new Filler(Type.UNQUOTED, null, text); }
	public static Filler placeholder(String variable) { return new Filler(Type.PLACEHOLDER, null, variable); }

	public Type getType() { return type; }
	public boolean isNode() { return type == Type.NODE; }
	public boolean isLiteral() { return type == Type.QUOTED || type == Type.UNQUOTED; }
	public boolean isPlaceholder() { return type == Type.PLACEHOLDER; }

	public AMRNode getNode()
	{
		Preconditions.checkState(isNode(), "Filler is not a node: " + this);
		return node;
	}

	/**
	 * @return the literal value, or the variable of a placeholder
	 */
	public String getText()
	{
		Preconditions.checkState(!isNode(), "Filler is a node: " + this);
		return text;
	}

	@Override
	public String toString()
	{
		switch (type)
		{
			case NODE:
				return node.getVariable();
			case QUOTED:
				return "\"" + text + "\"";
			default:
				return text;
		}
	}
}
