package edu.upf.taln.daide.amr.structures;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A node of an AMR graph: a variable, its concept and its ordered outgoing relations.
 * Nodes may have several parents when the graph has reentrancies.
 */
public final class AMRNode
{
	private final String variable;
	private final String concept;
	private final List<Relation> relations = new ArrayList<>();
	private final List<AMRNode> parents = new ArrayList<>();

	public AMRNode(String variable, String concept)
	{
		this.variable = variable;
		this.concept = concept;
	}

	public String getVariable() { return variable; }
	public String getConcept() { return concept; }
	public List<Relation> getRelations() { return Collections.unmodifiableList(relations); }
	public List<AMRNode> getParents() { return Collections.unmodifiableList(parents); }
	public boolean hasRelations() { return !relations.isEmpty(); }

	/**
	 * @return filler of the first relation with the given role
	 */
	public Optional<Filler> getFiller(String role)
	{
		return relations.stream()
				.filter(r -> r.getRole().equals(role))
				.map(Relation::getFiller)
				.findFirst();
	}

	/**
	 * @return node filling the first relation with the given role, if that filler is a node
	 */
	public Optional<AMRNode> getChild(String role)
	{
		return getFiller(role)
				.filter(Filler::isNode)
				.map(Filler::getNode);
	}

	/**
	 * Appends a relation, registering this node as parent of the filler if it is a node.
	 * @return index of the new relation
	 */
	public int addRelation(String role, Filler filler)
	{
		relations.add(new Relation(role, filler));
		if (filler.isNode())
			filler.getNode().addParent(this);
		return relations.size() - 1;
	}

	/**
	 * Replaces the placeholder at the given relation index with the node it stands for.
	 */
	public void resolve(int index, AMRNode node)
	{
		final Relation r = relations.get(index);
		Preconditions.checkState(r.getFiller().isPlaceholder(), "Relation " + r + " is already resolved");
		relations.set(index, new Relation(r.getRole(), Filler.node(node)));
		node.addParent(this);
	}

	private void addParent(AMRNode parent)
	{
		if (!parents.contains(parent))
			parents.add(parent);
	}

	/**
	 * @return true if a node reachable by following parent links has one of the given concepts
	 */
	public boolean hasAncestor(List<String> concepts)
	{
		final List<AMRNode> visited = new ArrayList<>();
		final List<AMRNode> pending = new ArrayList<>(parents);
		while (!pending.isEmpty())
		{
			final AMRNode n = pending.remove(pending.size() - 1);
			if (visited.contains(n))
				continue;
			visited.add(n);
			if (concepts.contains(n.concept))
				return true;
			pending.addAll(n.parents);
		}
		return false;
	}

	@Override
	public String toString()
	{
		return "(" + variable + " / " + concept + ")";
	}
}
