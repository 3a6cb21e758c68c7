package edu.upf.taln.daide.amr.daide;

import edu.upf.taln.daide.amr.io.AMRSemantics;
import edu.upf.taln.daide.amr.patterns.DaideTemplate;
import edu.upf.taln.daide.amr.patterns.EntityNames;
import edu.upf.taln.daide.amr.patterns.PatternMatcher;
import edu.upf.taln.daide.amr.structures.AMRGraph;
import edu.upf.taln.daide.amr.structures.AMRNode;
import edu.upf.taln.daide.amr.structures.Filler;
import edu.upf.taln.daide.amr.structures.Relation;
import edu.upf.taln.daide.core.Options;
import edu.upf.taln.daide.core.resources.LexicalResources;
import edu.upf.taln.daide.core.utils.DepthLimitExceededException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates AMR graphs into DAIDE. Subgraphs no rule applies to are rendered as their concept followed by their
 * translated relations, in lowercase, which leaves the output as partial DAIDE.
 */
public class AMRToDaide
{
	private final LexicalResources resources;
	private final List<DaideRule> rules;
	private final int max_depth;
	private final static Logger log = LogManager.getLogger();

	public AMRToDaide(LexicalResources resources, Options options)
	{
		this(resources, options, DaideRules.rules);
	}

	public AMRToDaide(LexicalResources resources, Options options, List<DaideRule> rules)
	{
		this.resources = resources;
		this.rules = rules;
		this.max_depth = options.max_depth;
	}

	/**
	 * @throws DepthLimitExceededException if the graph is nested deeper than the maximum depth, or has cycles
	 * that the translation runs into
	 */
	public String translate(AMRGraph graph)
	{
		final String daide = translate(graph.getRoot());
		log.debug(graph.getId().orElse("AMR") + " -> " + daide);
		return daide;
	}

	public String translate(AMRNode node)
	{
		return new Translation().translate(node, 0);
	}

	/**
	 * State of a single translation. Nodes are translated at most once, rules that bind a node and then fail
	 * on a later role leave its translation in the cache for the next rule.
	 */
	private class Translation
	{
		private final Map<AMRNode, String> cache = new IdentityHashMap<>();
		private final PatternMatcher matcher = new PatternMatcher(resources, this::translate);

		private String translate(AMRNode node, int depth)
		{
			DepthLimitExceededException.check(depth, max_depth, "AMR to DAIDE translation");
			final String cached = cache.get(node);
			if (cached != null)
				return cached;

			final String daide = translateNode(node, depth);
			cache.put(node, daide);
			return daide;
		}

		private String translateNode(AMRNode node, int depth)
		{
			final Optional<String> entity_id = EntityNames.getName(node).flatMap(resources::getId);
			if (entity_id.isPresent())
				return entity_id.get();

			if (node.getConcept().equals(AMRSemantics.and))
				return translateConjunction(node, depth);

			for (DaideRule rule : rules)
			{
				final Optional<Map<String, String>> bindings = matcher.match(node, rule.getPattern(), depth);
				if (bindings.isPresent() && rule.accepts(node))
					return rule.getTemplate().instantiate(bindings.get(), isNegated(node));
			}

			return translateUnmatched(node, depth);
		}

		// ITA FRA (ENG AMY LVP)
		private String translateConjunction(AMRNode node, int depth)
		{
			final List<String> elements = new ArrayList<>();
			for (int i = 1; ; ++i)
			{
				final Optional<Filler> op = node.getFiller(AMRSemantics.opRole(i));
				if (op.isEmpty())
					break;

				String element = translateFiller(op.get(), depth);
				if (element.isEmpty())
					continue;
				if (element.contains(" ") && !DaideTemplate.hasMatchingOuterParentheses(element))
					element = "(" + element + ")";
				elements.add(element);
			}
			return String.join(" ", elements);
		}

		private String translateUnmatched(AMRNode node, int depth)
		{
			final StringBuilder b = new StringBuilder("(" + node.getConcept());
			for (Relation r : node.getRelations())
			{
				b.append(" :").append(r.getRole()).append(' ');
				final Filler f = r.getFiller();
				b.append(f.isNode() ? translate(f.getNode(), depth + 1) : f.toString());
			}
			return b.append(')').toString();
		}

		private String translateFiller(Filler filler, int depth)
		{
			if (filler.isNode())
				return translate(filler.getNode(), depth + 1);
			if (filler.isLiteral())
				return filler.getText();
			return "";
		}
	}

	private static boolean isNegated(AMRNode node)
	{
		return node.getFiller(AMRSemantics.polarity)
				.filter(Filler::isLiteral)
				.map(f -> f.getText().equals(AMRSemantics.negative))
				.orElse(false);
	}
}
