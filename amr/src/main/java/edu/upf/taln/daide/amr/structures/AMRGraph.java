package edu.upf.taln.daide.amr.structures;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import org.apache.commons.lang3.tuple.Pair;

import java.util.*;
import java.util.stream.Collectors;

/**
 * An AMR read from text, along with the id and sentence found in its comment lines and the problems found while
 * reading it.
 */
public final class AMRGraph
{
	private final String id;
	private final String sentence;
	private final String text; // source text of the graph, without comments
	private final AMRNode root;
	private final Map<String, AMRNode> variables;
	private final ListMultimap<String, Pair<AMRNode, Integer>> orphans; // forward references: variable -> (holder, relation index)
	private final List<String> errors;
	private final int end; // offset in the source text right after this graph

	public AMRGraph(String id, String sentence, String text, AMRNode root, Map<String, AMRNode> variables,
	                ListMultimap<String, Pair<AMRNode, Integer>> orphans, List<String> errors, int end)
	{
		this.id = id;
		this.sentence = sentence;
		this.text = text;
		this.root = root;
		this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
		this.orphans = ImmutableListMultimap.copyOf(orphans);
		this.errors = List.copyOf(errors);
		this.end = end;
	}

	public Optional<String> getId() { return Optional.ofNullable(id); }
	public Optional<String> getSentence() { return Optional.ofNullable(sentence); }
	public String getText() { return text; }
	public AMRNode getRoot() { return root; }
	public Map<String, AMRNode> getVariables() { return variables; }
	public Optional<AMRNode> getNode(String variable) { return Optional.ofNullable(variables.get(variable)); }
	public ListMultimap<String, Pair<AMRNode, Integer>> getOrphans() { return orphans; }
	public List<String> getErrors() { return errors; }
	public int getEnd() { return end; }

	/**
	 * @return referenced variables that are not defined anywhere in the graph
	 */
	public Set<String> getUnresolvedVariables()
	{
		return orphans.keySet().stream()
				.filter(v -> !variables.containsKey(v))
				.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	@Override
	public String toString()
	{
		return getId().orElse("AMR") + " " + root;
	}
}
