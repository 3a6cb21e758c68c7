package edu.upf.taln.daide.amr.patterns;

import edu.upf.taln.daide.amr.io.AMRSemantics;
import edu.upf.taln.daide.amr.structures.AMRNode;
import edu.upf.taln.daide.amr.structures.Filler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class EntityNames
{
	private EntityNames() {}

	/**
	 * Spells out the name of a country, province or sea node, e.g. "North Sea" for
	 * <pre>(s / sea :name (n / name :op1 "North" :op2 "Sea"))</pre>
	 * @return the name, or nothing if the node is not a named entity of one of these types
	 */
	public static Optional<String> getName(AMRNode node)
	{
		if (!AMRSemantics.isNamedEntityType(node.getConcept()))
			return Optional.empty();

		final Optional<AMRNode> name = node.getChild(AMRSemantics.name)
				.filter(n -> n.getConcept().equals(AMRSemantics.name_concept));
		if (name.isEmpty())
			return Optional.empty();

		final List<String> parts = new ArrayList<>();
		for (int i = 1; ; ++i)
		{
			final Optional<Filler> op = name.get().getFiller(AMRSemantics.opRole(i));
			if (op.isEmpty() || !op.get().isLiteral())
				break;
			parts.add(op.get().getText());
		}

		return parts.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", parts));
	}
}
