package edu.upf.taln.daide.amr.patterns;

import edu.upf.taln.daide.amr.structures.AMRNode;
import edu.upf.taln.daide.amr.structures.Filler;
import edu.upf.taln.daide.core.resources.LexicalResources;
import org.apache.commons.lang3.tuple.Pair;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Matches AMR nodes against {@link AMRPattern}s. Each role of a pattern is checked against the first filler of the
 * node with that role only, there is no search over alternative fillers.
 * <p>
 * Slots are bound to the DAIDE id of the concept or entity name they match when the lexical resources have one.
 * A slot matching a node with relations of its own is bound to the translation of that node.
 */
public class PatternMatcher
{
	@FunctionalInterface
	public interface SubgraphTranslator
	{
		String translate(AMRNode node, int depth);
	}

	private final LexicalResources resources;
	private final SubgraphTranslator translator;

	public PatternMatcher(LexicalResources resources, SubgraphTranslator translator)
	{
		this.resources = resources;
		this.translator = translator;
	}

	/**
	 * @param depth depth of the node in the current translation, passed on to the translator for sub-graphs
	 * @return slot bindings, or nothing if the node doesn't match
	 */
	public Optional<Map<String, String>> match(AMRNode node, AMRPattern pattern, int depth)
	{
		final Map<String, String> bindings = new LinkedHashMap<>();
		if (matchPattern(node, pattern, bindings, depth))
			return Optional.of(bindings);
		return Optional.empty();
	}

	private boolean matchPattern(AMRNode node, AMRPattern pattern, Map<String, String> bindings, int depth)
	{
		final PatternTerm head = pattern.getHead();
		final String concept = node.getConcept();
		if (head.isLiteral())
		{
			if (!head.getText().equals(concept))
				return false;
		}
		else if (head.admits(concept))
			bindings.put(head.getText(), toId(concept));
		else
			return false;

		for (Pair<String, PatternTerm> constraint : pattern.getConstraints())
		{
			final Optional<Filler> filler = node.getFiller(constraint.getLeft());
			if (filler.isEmpty() || !matchFiller(filler.get(), constraint.getRight(), bindings, depth))
				return false;
		}
		return true;
	}

	private boolean matchFiller(Filler filler, PatternTerm value, Map<String, String> bindings, int depth)
	{
		if (filler.isPlaceholder())
			return false;

		if (filler.isLiteral())
		{
			final String text = filler.getText();
			switch (value.getType())
			{
				case LITERAL:
					return value.getText().equals(text);
				case SLOT:
					if (!value.admits(text))
						return false;
					bindings.put(value.getText(), toId(text));
					return true;
				default:
					return false;
			}
		}

		final AMRNode child = filler.getNode();
		switch (value.getType())
		{
			case LITERAL:
				return value.getText().equals(child.getConcept());
			case SLOT:
			{
				if (!value.admits(child.getConcept()))
					return false;
				bindings.put(value.getText(), bindNode(child, depth));
				return true;
			}
			default:
				return value.getPattern()
						.map(p -> matchPattern(child, p, bindings, depth + 1))
						.orElse(false);
		}
	}

	private String bindNode(AMRNode node, int depth)
	{
		final Optional<String> name = EntityNames.getName(node);
		if (name.isPresent())
			return toId(name.get());
		if (node.hasRelations())
		{
			final String translation = translator.translate(node, depth + 1);
			return translation.isEmpty() ? node.getConcept() : translation;
		}
		return toId(node.getConcept());
	}

	private String toId(String name)
	{
		return resources.getId(name).orElse(name);
	}
}
