package edu.upf.taln.daide.amr.io;

import edu.upf.taln.daide.amr.structures.AMRGraph;
import edu.upf.taln.daide.amr.structures.AMRNode;
import edu.upf.taln.daide.amr.structures.Filler;
import edu.upf.taln.daide.amr.structures.Relation;
import edu.upf.taln.daide.core.Options;
import edu.upf.taln.daide.core.utils.DepthLimitExceededException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Prints AMR graphs in Penman notation, one relation per line except for names, which are printed inline.
 * A node already printed is referred to by its variable only.
 */
public class AMRWriter
{
	private final String indent;
	private final int max_depth;

	public AMRWriter()
	{
		this(new Options());
	}

	public AMRWriter(Options options)
	{
		this.indent = options.indent;
		this.max_depth = options.max_depth;
	}

	/**
	 * Prints graphs preceded by their id and sentence comments and separated by blank lines.
	 */
	public String write(List<AMRGraph> graphs)
	{
		return graphs.stream()
				.map(g -> g.getId().map(i -> "# ::id " + i + "\n").orElse("") +
						g.getSentence().map(s -> "# ::snt " + s + "\n").orElse("") +
						write(g))
				.collect(Collectors.joining("\n\n", "", graphs.isEmpty() ? "" : "\n"));
	}

	public String write(AMRGraph graph)
	{
		return write(graph.getRoot());
	}

	/**
	 * @throws DepthLimitExceededException if the graph is nested deeper than the maximum depth
	 */
	public String write(AMRNode root)
	{
		return printNode(root, 0, false, new HashSet<>());
	}

	private String printNode(AMRNode node, int depth, boolean inline, Set<String> printed)
	{
		DepthLimitExceededException.check(depth, max_depth, "AMR printing");
		printed.add(node.getVariable());

		final String tabs = indent.repeat(depth + 1);
		final StringBuilder b = new StringBuilder("(" + node.getVariable() + " / " + node.getConcept());
		for (Relation r : node.getRelations())
		{
			final Filler f = r.getFiller();
			final boolean inline_names = inline || isName(r);
			b.append(inline_names ? " " : "\n" + tabs).append(':').append(r.getRole()).append(' ');

			if (f.isNode() && !printed.contains(f.getNode().getVariable()))
				b.append(printNode(f.getNode(), depth + 1, inline_names, printed));
			else
				b.append(f); // back-references, literals and unresolved variables
		}

		return b.append(')').toString();
	}

	private static boolean isName(Relation r)
	{
		return r.getRole().equals(AMRSemantics.name) && r.getFiller().isNode() &&
				r.getFiller().getNode().getConcept().equals(AMRSemantics.name_concept);
	}
}
